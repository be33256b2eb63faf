package com.chatdesk.realtime.dto;

import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.UUID;

/**
 * Server-to-client event. The same shape travels over the broker inside a
 * {@link com.chatdesk.realtime.broadcast.BroadcastEnvelope}.
 * Factories take the timestamp from the caller's clock.
 */
@Getter
@NoArgsConstructor
@AllArgsConstructor
@Builder(toBuilder = true)
@JsonInclude(JsonInclude.Include.NON_NULL)
public class RealtimeEvent {
    private OutboundEventType type;
    private UUID chatId;
    private UUID userId;
    private UserProfile user;
    private MessagePayload message;
    private MessagePayload lastMessage;
    private ChatSummary chat;
    private RealtimeErrorCode code;
    private String error;
    private String timestamp;

    public static RealtimeEvent error(RealtimeErrorCode code, String error, Instant at) {
        return RealtimeEvent.builder()
                .type(OutboundEventType.ERROR)
                .code(code)
                .error(error)
                .timestamp(at.toString())
                .build();
    }

    public static RealtimeEvent authenticationFailed(RealtimeErrorCode code, String error, Instant at) {
        return RealtimeEvent.builder()
                .type(OutboundEventType.AUTHENTICATION_FAILED)
                .code(code)
                .error(error)
                .timestamp(at.toString())
                .build();
    }

    public static RealtimeEvent forChat(OutboundEventType type, UUID chatId, Instant at) {
        return RealtimeEvent.builder()
                .type(type)
                .chatId(chatId)
                .timestamp(at.toString())
                .build();
    }

    public static RealtimeEvent forUser(OutboundEventType type, UUID userId, Instant at) {
        return RealtimeEvent.builder()
                .type(type)
                .userId(userId)
                .timestamp(at.toString())
                .build();
    }
}
