package com.chatdesk.webhook.service;

import com.chatdesk.chat.domain.Chat;
import com.chatdesk.message.domain.Message;
import com.chatdesk.realtime.broadcast.BroadcastService;
import com.chatdesk.realtime.dto.ChatSummary;
import com.chatdesk.realtime.dto.MessagePayload;
import com.chatdesk.realtime.dto.OutboundEventType;
import com.chatdesk.realtime.dto.RealtimeEvent;
import com.chatdesk.webhook.dto.MaterializationResult;
import com.chatdesk.webhook.dto.MessageCandidate;
import com.chatdesk.webhook.dto.NewMessageEvent;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;

/**
 * Announces a newly stored customer message: {@code new_message} to the conversation room,
 * {@code chat_updated} to the whole tenant, and a {@link NewMessageEvent} on the Redis
 * {@code new_message} channel for background consumers.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class WebhookBroadcaster {

    private final BroadcastService broadcastService;
    private final NewMessageEventPublisher newMessageEventPublisher;
    private final Clock clock;

    public void announce(MessageCandidate candidate, MaterializationResult result) {
        Chat chat = result.chat();
        String now = Instant.now(clock).toString();

        MessagePayload message = MessagePayload.builder()
                .id(result.messageId())
                .platformMessageId(candidate.getPlatformMessageId())
                .text(candidate.getText())
                .type(result.messageType().getValue())
                .sender(Message.SENDER_CUSTOMER)
                .senderId(candidate.getSenderId())
                .timestamp(candidate.getTimestamp().toString())
                .attachments(candidate.getAttachments())
                .build();

        ChatSummary summary = ChatSummary.builder()
                .id(chat.getId())
                .status(chat.getStatus())
                .customerName(chat.getCustomerName())
                .platform(candidate.getPlatform().getValue())
                .lastInteraction(chat.getLastInteraction() == null
                        ? null
                        : chat.getLastInteraction().toInstant(ZoneOffset.UTC).toString())
                .build();

        broadcastService.toRoom(chat.getId(), RealtimeEvent.builder()
                .type(OutboundEventType.NEW_MESSAGE)
                .chatId(chat.getId())
                .message(message)
                .chat(summary)
                .timestamp(now)
                .build());

        broadcastService.toTenant(chat.getTenantId(), RealtimeEvent.builder()
                .type(OutboundEventType.CHAT_UPDATED)
                .chatId(chat.getId())
                .lastMessage(message)
                .chat(summary)
                .timestamp(now)
                .build());

        newMessageEventPublisher.publish(new NewMessageEvent(chat.getId(), result.messageId(), chat.getTenantId(),
                candidate.getPlatform().getValue(), true));

        log.debug("Announced webhook message: chatId={}, messageId={}", chat.getId(), result.messageId());
    }
}
