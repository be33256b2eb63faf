package com.chatdesk.realtime.dto;

import java.util.Arrays;
import java.util.Optional;

/**
 * Event types a realtime client may send. Anything else is answered with an error event.
 */
public enum InboundEventType {
    AUTHENTICATE("authenticate"),
    JOIN_CHAT("join_chat"),
    LEAVE_CHAT("leave_chat"),
    TYPING_START("typing_start"),
    TYPING_STOP("typing_stop");

    private final String wireName;

    InboundEventType(String wireName) {
        this.wireName = wireName;
    }

    public String getWireName() {
        return wireName;
    }

    public static Optional<InboundEventType> fromWireName(String wireName) {
        return Arrays.stream(values())
                .filter(type -> type.wireName.equals(wireName))
                .findFirst();
    }
}
