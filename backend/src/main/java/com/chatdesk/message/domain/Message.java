package com.chatdesk.message.domain;

import jakarta.persistence.*;
import lombok.AccessLevel;
import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;

import java.time.LocalDateTime;
import java.util.UUID;

@Entity
@Table(name = "messages")
@Getter
@NoArgsConstructor(access = AccessLevel.PROTECTED)
public class Message {

    public static final String DIRECTION_INBOUND = "inbound";
    public static final String SENDER_CUSTOMER = "customer";

    @Id
    private UUID id;

    @Column(name = "chat_id", nullable = false, updatable = false)
    private UUID chatId;

    @Column(name = "tenant_id", nullable = false, updatable = false)
    private UUID tenantId;

    @Column(name = "platform_message_id", updatable = false)
    private String platformMessageId;

    @Column(name = "message_type", nullable = false)
    private String messageType;

    @Column(nullable = false)
    private String direction;

    @Column(name = "sender_type", nullable = false)
    private String senderType;

    @Column(columnDefinition = "TEXT")
    private String content;

    @Column(columnDefinition = "jsonb", insertable = false, updatable = false)
    private String metadata;

    @Column(name = "created_at", updatable = false)
    private LocalDateTime createdAt;

    @Builder
    public Message(UUID id, UUID chatId, UUID tenantId, String platformMessageId, MessageType messageType,
                   String content, String metadata, LocalDateTime createdAt) {
        this.id = id;
        this.chatId = chatId;
        this.tenantId = tenantId;
        this.platformMessageId = platformMessageId;
        this.messageType = (messageType != null ? messageType : MessageType.TEXT).getValue();
        this.direction = DIRECTION_INBOUND;
        this.senderType = SENDER_CUSTOMER;
        this.content = content;
        this.metadata = metadata;
        this.createdAt = createdAt;
    }
}
