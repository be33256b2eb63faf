package com.chatdesk.chat.repository;

import com.chatdesk.chat.domain.Chat;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

import java.time.LocalDateTime;
import java.util.Collection;
import java.util.Optional;
import java.util.UUID;

public interface ChatRepository extends JpaRepository<Chat, UUID> {

    Optional<Chat> findBySocialConnectionIdAndPlatformChatId(UUID socialConnectionId, String platformChatId);

    /**
     * Inserts the conversation unless one already exists for the same
     * (social connection, platform chat id), backed by {@code uq_chats_connection_platform_chat}
     * in {@code db/schema.sql}. Returns the number of inserted rows.
     */
    @Modifying
    @Query(value = """
            INSERT INTO chats (id, social_connection_id, tenant_id, platform_chat_id,
                               status, customer_name, last_interaction)
            VALUES (:id, :socialConnectionId, :tenantId, :platformChatId,
                    'open', :customerName, :lastInteraction)
            ON CONFLICT (social_connection_id, platform_chat_id) DO NOTHING
            """, nativeQuery = true)
    int insertIfAbsent(@Param("id") UUID id,
                       @Param("socialConnectionId") UUID socialConnectionId,
                       @Param("tenantId") UUID tenantId,
                       @Param("platformChatId") String platformChatId,
                       @Param("customerName") String customerName,
                       @Param("lastInteraction") LocalDateTime lastInteraction);

    /**
     * Moves last_interaction forward only; an older redelivered event leaves it unchanged.
     */
    @Modifying(clearAutomatically = true)
    @Query("UPDATE Chat c SET c.lastInteraction = :timestamp " +
           "WHERE c.id = :chatId AND (c.lastInteraction IS NULL OR c.lastInteraction < :timestamp)")
    int bumpLastInteraction(@Param("chatId") UUID chatId, @Param("timestamp") LocalDateTime timestamp);

    /**
     * Access rule for realtime room joins: the chat belongs to the tenant and the user is a
     * supervisor, the assigned agent, or the owner of the chat's social connection.
     */
    @Query("SELECT COUNT(c) > 0 FROM Chat c, SocialConnection sc, User u " +
           "WHERE sc.id = c.socialConnectionId AND u.id = :userId " +
           "AND c.id = :chatId AND c.tenantId = :tenantId AND (" +
           "  c.assignedUserId = :userId OR sc.userId = :userId OR u.role IN :supervisorRoles)")
    boolean isAccessibleBy(@Param("chatId") UUID chatId,
                           @Param("tenantId") UUID tenantId,
                           @Param("userId") UUID userId,
                           @Param("supervisorRoles") Collection<String> supervisorRoles);
}
