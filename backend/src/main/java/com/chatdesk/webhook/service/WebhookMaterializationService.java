package com.chatdesk.webhook.service;

import com.chatdesk.chat.domain.Chat;
import com.chatdesk.chat.repository.ChatRepository;
import com.chatdesk.message.domain.MessageType;
import com.chatdesk.message.repository.MessageRepository;
import com.chatdesk.socialconnection.domain.SocialConnection;
import com.chatdesk.socialconnection.repository.SocialConnectionRepository;
import com.chatdesk.webhook.dto.MaterializationResult;
import com.chatdesk.webhook.dto.MessageCandidate;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.LocalDateTime;
import java.time.ZoneOffset;
import java.util.List;
import java.util.Locale;
import java.util.UUID;

/**
 * Stores one message candidate: routes it to a social connection, finds or creates the
 * conversation, inserts the message and moves the conversation's last interaction forward.
 *
 * Safe to run concurrently and repeatedly for the same candidate. The unique keys on
 * (social_connection_id, platform_chat_id) and (chat_id, platform_message_id) make a
 * redelivery a no-op.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class WebhookMaterializationService {

    private final SocialConnectionRepository socialConnectionRepository;
    private final ChatRepository chatRepository;
    private final MessageRepository messageRepository;
    private final ObjectMapper objectMapper;

    @Transactional
    public MaterializationResult materialize(MessageCandidate candidate) {
        List<SocialConnection> routes = socialConnectionRepository.findRoutable(
                candidate.getPlatform().getValue(), candidate.getAccountId());
        if (routes.isEmpty()) {
            log.warn("No active social connection for webhook message: platform={}, account={}",
                    candidate.getPlatform().getValue(), candidate.getAccountId());
            return MaterializationResult.unrouted();
        }
        SocialConnection connection = routes.get(0);
        if (routes.size() > 1) {
            log.warn("Account linked to {} active connections, routing to the oldest: platform={}, account={}, connection={}",
                    routes.size(), candidate.getPlatform().getValue(), candidate.getAccountId(), connection.getId());
        }

        LocalDateTime timestamp = LocalDateTime.ofInstant(candidate.getTimestamp(), ZoneOffset.UTC);

        boolean chatCreated = chatRepository.insertIfAbsent(UUID.randomUUID(), connection.getId(),
                connection.getTenantId(), candidate.getSenderId(), candidate.displayName(), timestamp) > 0;
        Chat chat = chatRepository.findBySocialConnectionIdAndPlatformChatId(connection.getId(), candidate.getSenderId())
                .orElseThrow(() -> new IllegalStateException(
                        "Conversation missing after insert: connection=" + connection.getId()));
        if (chatCreated) {
            log.info("New chat created from webhook: chatId={}, platform={}, tenant={}",
                    chat.getId(), candidate.getPlatform().getValue(), chat.getTenantId());
        }

        UUID messageId = UUID.randomUUID();
        MessageType messageType = resolveMessageType(candidate);
        int inserted = messageRepository.insertIgnoringDuplicate(messageId, chat.getId(), chat.getTenantId(),
                candidate.getPlatformMessageId(), messageType.getValue(), candidate.getText(),
                buildMetadata(candidate), timestamp);
        if (inserted == 0) {
            log.debug("Duplicate webhook message ignored: chatId={}, platformMessageId={}",
                    chat.getId(), candidate.getPlatformMessageId());
            return MaterializationResult.duplicate(chat);
        }

        chatRepository.bumpLastInteraction(chat.getId(), timestamp);
        Chat refreshed = chatRepository.findById(chat.getId()).orElse(chat);

        return MaterializationResult.created(refreshed, chatCreated, messageId, messageType);
    }

    /**
     * First attachment decides the type; otherwise the platform's own type when it maps
     * onto a stored type; otherwise text.
     */
    static MessageType resolveMessageType(MessageCandidate candidate) {
        if (candidate.hasAttachments()) {
            String type = candidate.getAttachments().get(0).path("type").asText("").toLowerCase(Locale.ROOT);
            return switch (type) {
                case "image" -> MessageType.IMAGE;
                case "audio" -> MessageType.AUDIO;
                case "video" -> MessageType.VIDEO;
                case "file" -> MessageType.FILE;
                default -> MessageType.TEXT;
            };
        }
        return MessageType.fromPlatformType(candidate.getPlatformType());
    }

    private String buildMetadata(MessageCandidate candidate) {
        ObjectNode metadata = objectMapper.createObjectNode();
        metadata.put("platform", candidate.getPlatform().getValue());
        metadata.put("platformSenderId", candidate.getSenderId());
        putIfPresent(metadata, "attachments", candidate.getAttachments());
        putIfPresent(metadata, "media", candidate.getMedia());
        if (candidate.getPostbackPayload() != null) {
            metadata.put("postbackPayload", candidate.getPostbackPayload());
        }
        try {
            return objectMapper.writeValueAsString(metadata);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Failed to serialize message metadata", e);
        }
    }

    private static void putIfPresent(ObjectNode target, String field, JsonNode value) {
        if (value != null && !value.isNull() && !value.isMissingNode()) {
            target.set(field, value);
        }
    }
}
