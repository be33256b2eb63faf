package com.chatdesk.realtime.gateway;

public enum ConnectionState {
    CONNECTING,
    AUTHENTICATING,
    AUTHENTICATED,
    CLOSED
}
