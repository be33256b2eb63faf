package com.chatdesk.realtime.dto;

import com.fasterxml.jackson.annotation.JsonInclude;

import java.util.UUID;

@JsonInclude(JsonInclude.Include.NON_NULL)
public record UserProfile(UUID id, String firstName, String lastName, String role) {
}
