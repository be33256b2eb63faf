package com.chatdesk.message.domain;

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

public enum MessageType {
    TEXT("text"),
    IMAGE("image"),
    VIDEO("video"),
    AUDIO("audio"),
    FILE("file"),
    LOCATION("location"),
    CONTACT("contact"),
    STICKER("sticker"),
    REACTION("reaction");

    private final String value;

    MessageType(String value) {
        this.value = value;
    }

    @JsonValue
    public String getValue() {
        return value;
    }

    /**
     * Maps a platform-specific type name onto the stored message types.
     * Anything unrecognised is stored as text.
     */
    public static MessageType fromPlatformType(String platformType) {
        if (platformType == null) {
            return TEXT;
        }
        return switch (platformType.toLowerCase(Locale.ROOT)) {
            case "image" -> IMAGE;
            case "video" -> VIDEO;
            case "audio", "voice" -> AUDIO;
            case "file", "document" -> FILE;
            case "location" -> LOCATION;
            case "contact", "contacts" -> CONTACT;
            case "sticker" -> STICKER;
            case "reaction" -> REACTION;
            default -> TEXT;
        };
    }
}
