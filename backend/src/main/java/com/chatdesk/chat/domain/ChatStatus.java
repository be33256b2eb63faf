package com.chatdesk.chat.domain;

public enum ChatStatus {
    OPEN("open"),
    PENDING("pending"),
    CLOSED("closed");

    private final String value;

    ChatStatus(String value) {
        this.value = value;
    }

    public String getValue() {
        return value;
    }
}
