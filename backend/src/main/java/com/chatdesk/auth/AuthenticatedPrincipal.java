package com.chatdesk.auth;

import com.chatdesk.user.domain.UserRole;

import java.util.UUID;

/**
 * Identity established by a realtime handshake.
 */
public record AuthenticatedPrincipal(UUID userId, UUID tenantId, UserRole role, String firstName, String lastName) {
}
