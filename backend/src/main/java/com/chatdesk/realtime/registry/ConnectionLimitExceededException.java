package com.chatdesk.realtime.registry;

import java.util.UUID;

public class ConnectionLimitExceededException extends RuntimeException {

    public ConnectionLimitExceededException(UUID userId, int limit) {
        super("Too many connections for user " + userId + " (limit " + limit + ")");
    }
}
