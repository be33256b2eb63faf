package com.chatdesk.socialconnection.domain;

import jakarta.persistence.*;
import lombok.AccessLevel;
import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;

import java.time.LocalDateTime;
import java.util.UUID;

/**
 * A tenant's authorized link to one external messaging account.
 * Token columns are managed elsewhere and deliberately not mapped here.
 */
@Entity
@Table(name = "social_connections")
@Getter
@NoArgsConstructor(access = AccessLevel.PROTECTED)
public class SocialConnection {

    @Id
    private UUID id;

    @Column(name = "user_id", nullable = false)
    private UUID userId;

    @Column(name = "tenant_id", nullable = false)
    private UUID tenantId;

    @Column(nullable = false)
    private String platform;

    @Column(name = "platform_account_id", nullable = false)
    private String platformAccountId;

    @Column(name = "is_active", nullable = false)
    private boolean active;

    @Column(name = "created_at", nullable = false, insertable = false, updatable = false)
    private LocalDateTime createdAt;

    @Builder
    public SocialConnection(UUID id, UUID userId, UUID tenantId, Platform platform,
                            String platformAccountId, boolean active) {
        this.id = id;
        this.userId = userId;
        this.tenantId = tenantId;
        this.platform = platform.getValue();
        this.platformAccountId = platformAccountId;
        this.active = active;
    }

    public Platform getPlatformType() {
        return Platform.fromValue(platform);
    }
}
