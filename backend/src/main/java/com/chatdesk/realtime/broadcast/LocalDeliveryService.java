package com.chatdesk.realtime.broadcast;

import com.chatdesk.realtime.dto.RealtimeEvent;
import com.chatdesk.realtime.gateway.ConnectionSessions;
import com.chatdesk.realtime.presence.RoomMembershipService;
import com.chatdesk.realtime.registry.ConnectionRegistry;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.stereotype.Service;
import org.springframework.web.socket.TextMessage;

import java.io.IOException;
import java.util.Objects;
import java.util.Set;
import java.util.UUID;

/**
 * Writes events to sockets held by this instance.
 *
 * A failing socket is reported through {@link ConnectionDeliveryFailedEvent} and skipped;
 * the remaining recipients still receive the event.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class LocalDeliveryService {

    private final ConnectionSessions connectionSessions;
    private final ConnectionRegistry connectionRegistry;
    private final RoomMembershipService roomMembershipService;
    private final ApplicationEventPublisher eventPublisher;
    private final ObjectMapper objectMapper;

    public int deliver(ChannelFamily family, UUID key, RealtimeEvent event, String excludeConnectionId) {
        Set<String> recipients = switch (family) {
            case ROOM -> roomMembershipService.roomMembers(key);
            case TENANT -> connectionRegistry.connectionsOfTenant(key);
            case USER -> connectionRegistry.connectionsOfUser(key);
        };
        if (recipients.isEmpty()) {
            return 0;
        }

        TextMessage frame = toFrame(event);
        int delivered = 0;
        for (String connectionId : recipients) {
            if (Objects.equals(connectionId, excludeConnectionId)) {
                continue;
            }
            if (write(connectionId, frame)) {
                delivered++;
            }
        }
        log.debug("Delivered locally: family={}, key={}, type={}, recipients={}",
                family, key, event.getType(), delivered);
        return delivered;
    }

    /**
     * Sends a reply to a single connection, authenticated or not.
     */
    public boolean sendTo(String connectionId, RealtimeEvent event) {
        return write(connectionId, toFrame(event));
    }

    private boolean write(String connectionId, TextMessage frame) {
        try {
            return connectionSessions.send(connectionId, frame);
        } catch (IOException | RuntimeException e) {
            log.warn("Socket write failed: connectionId={}, error={}", connectionId, e.getMessage());
            eventPublisher.publishEvent(new ConnectionDeliveryFailedEvent(connectionId, e));
            return false;
        }
    }

    private TextMessage toFrame(RealtimeEvent event) {
        try {
            return new TextMessage(objectMapper.writeValueAsString(event));
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Failed to serialize realtime event " + event.getType(), e);
        }
    }
}
