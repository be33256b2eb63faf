package com.chatdesk.user.domain;

import java.util.Arrays;
import java.util.List;

public enum UserRole {
    ADMIN("admin"),
    MANAGER("manager"),
    AGENT("agent"),
    USER("user");

    /**
     * Roles that may open every conversation of their tenant.
     */
    public static final List<String> CONVERSATION_SUPERVISORS = List.of(ADMIN.value, MANAGER.value);

    private final String value;

    UserRole(String value) {
        this.value = value;
    }

    public String getValue() {
        return value;
    }

    public static UserRole fromValue(String value) {
        return Arrays.stream(values())
                .filter(role -> role.value.equalsIgnoreCase(value))
                .findFirst()
                .orElse(USER);
    }
}
