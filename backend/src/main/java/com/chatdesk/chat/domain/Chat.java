package com.chatdesk.chat.domain;

import jakarta.persistence.*;
import lombok.AccessLevel;
import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;

import java.time.LocalDateTime;
import java.util.UUID;

/**
 * A conversation between one customer identity on a platform and one tenant's team.
 * Unique per (social connection, platform chat id); the tenant never changes after creation.
 */
@Entity
@Table(name = "chats")
@Getter
@NoArgsConstructor(access = AccessLevel.PROTECTED)
public class Chat {

    @Id
    private UUID id;

    @Column(name = "social_connection_id", nullable = false, updatable = false)
    private UUID socialConnectionId;

    @Column(name = "tenant_id", nullable = false, updatable = false)
    private UUID tenantId;

    @Column(name = "platform_chat_id", nullable = false, updatable = false)
    private String platformChatId;

    @Column(nullable = false)
    private String status;

    @Column(name = "customer_name")
    private String customerName;

    @Column(name = "assigned_user_id")
    private UUID assignedUserId;

    @Column(name = "last_interaction")
    private LocalDateTime lastInteraction;

    @Column(name = "created_at", insertable = false, updatable = false)
    private LocalDateTime createdAt;

    @Column(name = "updated_at", insertable = false, updatable = false)
    private LocalDateTime updatedAt;

    @Builder
    public Chat(UUID id, UUID socialConnectionId, UUID tenantId, String platformChatId,
                ChatStatus status, String customerName, UUID assignedUserId,
                LocalDateTime lastInteraction) {
        this.id = id;
        this.socialConnectionId = socialConnectionId;
        this.tenantId = tenantId;
        this.platformChatId = platformChatId;
        this.status = (status != null ? status : ChatStatus.OPEN).getValue();
        this.customerName = customerName;
        this.assignedUserId = assignedUserId;
        this.lastInteraction = lastInteraction;
    }
}
