package com.chatdesk.realtime.dto;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Arrays;

/**
 * Event types the server sends to realtime clients.
 */
public enum OutboundEventType {
    AUTHENTICATED("authenticated"),
    AUTHENTICATION_FAILED("authentication_failed"),
    ERROR("error"),
    ROOM_JOINED("join_chat"),
    ROOM_LEFT("leave_chat"),
    NEW_MESSAGE("new_message"),
    MESSAGE_READ("message_read"),
    CHAT_UPDATED("chat_updated"),
    USER_ONLINE("user_online"),
    USER_OFFLINE("user_offline"),
    TYPING_START("typing_start"),
    TYPING_STOP("typing_stop");

    private final String wireName;

    OutboundEventType(String wireName) {
        this.wireName = wireName;
    }

    @JsonValue
    public String getWireName() {
        return wireName;
    }

    @JsonCreator
    public static OutboundEventType fromWireName(String wireName) {
        return Arrays.stream(values())
                .filter(type -> type.wireName.equals(wireName))
                .findFirst()
                .orElseThrow(() -> new IllegalArgumentException("Unknown outbound event type: " + wireName));
    }
}
