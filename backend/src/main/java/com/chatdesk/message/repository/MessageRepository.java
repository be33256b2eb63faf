package com.chatdesk.message.repository;

import com.chatdesk.message.domain.Message;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

import java.time.LocalDateTime;
import java.util.UUID;

public interface MessageRepository extends JpaRepository<Message, UUID> {

    /**
     * Inserts an inbound customer message. A second delivery with the same
     * (chat_id, platform_message_id) hits the unique index and inserts nothing.
     * Messages without a platform id never conflict. The index ships in
     * {@code db/schema.sql} as {@code uq_messages_chat_platform_message}.
     *
     * @return 1 if the row was inserted, 0 for a redelivery
     */
    @Modifying
    @Query(value = """
            INSERT INTO messages (id, chat_id, tenant_id, platform_message_id, message_type,
                                  direction, sender_type, content, metadata, created_at)
            VALUES (:id, :chatId, :tenantId, :platformMessageId, :messageType,
                    'inbound', 'customer', :content, CAST(:metadata AS jsonb), :createdAt)
            ON CONFLICT (chat_id, platform_message_id) DO NOTHING
            """, nativeQuery = true)
    int insertIgnoringDuplicate(@Param("id") UUID id,
                                @Param("chatId") UUID chatId,
                                @Param("tenantId") UUID tenantId,
                                @Param("platformMessageId") String platformMessageId,
                                @Param("messageType") String messageType,
                                @Param("content") String content,
                                @Param("metadata") String metadata,
                                @Param("createdAt") LocalDateTime createdAt);
}
