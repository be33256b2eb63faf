package com.chatdesk.socialconnection.domain;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Arrays;

public enum Platform {
    FACEBOOK("facebook"),
    INSTAGRAM("instagram"),
    WHATSAPP("whatsapp");

    private final String value;

    Platform(String value) {
        this.value = value;
    }

    @JsonValue
    public String getValue() {
        return value;
    }

    @JsonCreator
    public static Platform fromValue(String value) {
        return Arrays.stream(values())
                .filter(platform -> platform.value.equalsIgnoreCase(value))
                .findFirst()
                .orElseThrow(() -> new IllegalArgumentException("Unknown platform: " + value));
    }
}
