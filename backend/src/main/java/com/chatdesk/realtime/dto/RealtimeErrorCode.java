package com.chatdesk.realtime.dto;

public enum RealtimeErrorCode {
    INVALID_MESSAGE_FORMAT,
    UNKNOWN_EVENT_TYPE,
    MISSING_REQUIRED_FIELD,
    UNAUTHORIZED,
    ALREADY_AUTHENTICATED,
    AUTHENTICATION_FAILED,
    TOO_MANY_CONNECTIONS,
    ACCESS_DENIED,
    INTERNAL_ERROR
}
