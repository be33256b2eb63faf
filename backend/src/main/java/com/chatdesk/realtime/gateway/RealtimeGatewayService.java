package com.chatdesk.realtime.gateway;

import com.chatdesk.auth.AuthenticatedPrincipal;
import com.chatdesk.auth.CredentialValidator;
import com.chatdesk.auth.InvalidCredentialException;
import com.chatdesk.config.RealtimeProperties;
import com.chatdesk.realtime.broadcast.BroadcastService;
import com.chatdesk.realtime.broadcast.ConnectionDeliveryFailedEvent;
import com.chatdesk.realtime.broadcast.LocalDeliveryService;
import com.chatdesk.realtime.dto.InboundEventType;
import com.chatdesk.realtime.dto.InboundFrame;
import com.chatdesk.realtime.dto.OutboundEventType;
import com.chatdesk.realtime.dto.RealtimeErrorCode;
import com.chatdesk.realtime.dto.RealtimeEvent;
import com.chatdesk.realtime.dto.UserProfile;
import com.chatdesk.realtime.presence.JoinOutcome;
import com.chatdesk.realtime.presence.RoomMembershipService;
import com.chatdesk.realtime.registry.ConnectionLimitExceededException;
import com.chatdesk.realtime.registry.ConnectionRegistry;
import com.chatdesk.realtime.registry.Disconnection;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.micrometer.core.instrument.MeterRegistry;
import jakarta.annotation.PreDestroy;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.slf4j.MDC;
import org.springframework.context.event.EventListener;
import org.springframework.scheduling.TaskScheduler;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Service;
import org.springframework.web.socket.CloseStatus;
import org.springframework.web.socket.PingMessage;
import org.springframework.web.socket.WebSocketSession;
import org.springframework.web.socket.handler.ConcurrentWebSocketSessionDecorator;

import java.io.IOException;
import java.time.Clock;
import java.time.Instant;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

/**
 * Realtime connection lifecycle: handshake, authentication, event dispatch, heartbeat
 * and teardown.
 *
 * <pre>
 * CONNECTING -> AUTHENTICATING -> AUTHENTICATED -> CLOSED
 *                      \______________________________/
 * </pre>
 *
 * Sockets that do not authenticate within {@code realtime.authentication-timeout} are closed
 * with a policy violation. Authenticated sockets silent for two heartbeat intervals are
 * closed as timed out.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class RealtimeGatewayService {

    public static final String CONNECTION_ID_ATTRIBUTE = "connectionId";

    static final CloseStatus AUTHENTICATION_TIMEOUT = CloseStatus.POLICY_VIOLATION.withReason("Authentication timeout");
    static final CloseStatus HEARTBEAT_TIMEOUT = CloseStatus.GOING_AWAY.withReason("Timeout");
    static final CloseStatus SERVER_SHUTDOWN = CloseStatus.GOING_AWAY.withReason("Server shutdown");
    static final CloseStatus DELIVERY_FAILED = CloseStatus.SESSION_NOT_RELIABLE.withReason("Delivery failed");

    private final ConnectionSessions connectionSessions;
    private final ConnectionRegistry connectionRegistry;
    private final RoomMembershipService roomMembershipService;
    private final BroadcastService broadcastService;
    private final LocalDeliveryService localDeliveryService;
    private final CredentialValidator credentialValidator;
    private final RealtimeProperties realtimeProperties;
    private final TaskScheduler taskScheduler;
    private final Clock clock;
    private final ObjectMapper objectMapper;
    private final MeterRegistry meterRegistry;

    /**
     * Accepts a new socket and starts its authentication deadline.
     *
     * @return the connection id assigned to the socket
     */
    public String open(WebSocketSession socket) {
        String connectionId = "ws_" + UUID.randomUUID();
        socket.getAttributes().put(CONNECTION_ID_ATTRIBUTE, connectionId);

        WebSocketSession decorated = new ConcurrentWebSocketSessionDecorator(socket,
                (int) realtimeProperties.getSendTimeLimit().toMillis(),
                realtimeProperties.getSendBufferSizeLimit());
        GatewaySession session = new GatewaySession(connectionId, decorated);
        session.transition(ConnectionState.CONNECTING, ConnectionState.AUTHENTICATING);
        connectionSessions.add(session);

        Instant deadline = clock.instant().plus(realtimeProperties.getAuthenticationTimeout());
        session.setAuthenticationDeadline(taskScheduler.schedule(() -> onAuthenticationDeadline(connectionId), deadline));

        meterRegistry.counter("realtime.connections.opened").increment();
        log.info("WebSocket connection opened: connectionId={}, remote={}", connectionId, socket.getRemoteAddress());
        return connectionId;
    }

    public void onText(String connectionId, String payload) {
        MDC.put(CONNECTION_ID_ATTRIBUTE, connectionId);
        try {
            Optional<GatewaySession> found = connectionSessions.find(connectionId);
            if (found.isEmpty()) {
                return;
            }
            GatewaySession session = found.get();
            connectionRegistry.touch(connectionId);
            dispatch(session, payload);
        } finally {
            MDC.remove(CONNECTION_ID_ATTRIBUTE);
        }
    }

    public void onPong(String connectionId) {
        connectionRegistry.touch(connectionId);
    }

    public void onClose(String connectionId, CloseStatus status) {
        log.info("WebSocket connection closed: connectionId={}, code={}, reason={}",
                connectionId, status.getCode(), status.getReason());
        teardown(connectionId);
    }

    /**
     * A transport failure ends the connection the same way a close does.
     */
    public void onTransportError(String connectionId, Throwable error) {
        log.warn("WebSocket transport error: connectionId={}, error={}", connectionId, error.getMessage());
        meterRegistry.counter("realtime.transport.errors").increment();
        connectionSessions.find(connectionId).ifPresentOrElse(
                session -> close(session, CloseStatus.SERVER_ERROR),
                () -> teardown(connectionId));
    }

    private void dispatch(GatewaySession session, String payload) {
        InboundFrame frame;
        try {
            frame = objectMapper.readValue(payload, InboundFrame.class);
        } catch (JsonProcessingException e) {
            reply(session, RealtimeEvent.error(RealtimeErrorCode.INVALID_MESSAGE_FORMAT, "Invalid message format", clock.instant()));
            return;
        }
        if (frame == null || frame.getType() == null || frame.getType().isBlank()) {
            reply(session, RealtimeEvent.error(RealtimeErrorCode.INVALID_MESSAGE_FORMAT, "Message type is required", clock.instant()));
            return;
        }

        Optional<InboundEventType> type = InboundEventType.fromWireName(frame.getType());
        if (type.isEmpty()) {
            reply(session, RealtimeEvent.error(RealtimeErrorCode.UNKNOWN_EVENT_TYPE,
                    "Unknown message type: " + frame.getType(), clock.instant()));
            return;
        }
        if (type.get() != InboundEventType.AUTHENTICATE && !session.isAuthenticated()) {
            reply(session, RealtimeEvent.error(RealtimeErrorCode.UNAUTHORIZED, "Authentication required", clock.instant()));
            return;
        }

        try {
            switch (type.get()) {
                case AUTHENTICATE -> handleAuthenticate(session, frame);
                case JOIN_CHAT -> handleJoinChat(session, frame);
                case LEAVE_CHAT -> handleLeaveChat(session, frame);
                case TYPING_START -> handleTyping(session, frame, OutboundEventType.TYPING_START);
                case TYPING_STOP -> handleTyping(session, frame, OutboundEventType.TYPING_STOP);
            }
        } catch (RuntimeException e) {
            log.error("Failed to handle realtime event: type={}", frame.getType(), e);
            reply(session, RealtimeEvent.error(RealtimeErrorCode.INTERNAL_ERROR, "Internal server error", clock.instant()));
        }
    }

    private void handleAuthenticate(GatewaySession session, InboundFrame frame) {
        if (session.isAuthenticated()) {
            reply(session, RealtimeEvent.error(RealtimeErrorCode.ALREADY_AUTHENTICATED, "Already authenticated", clock.instant()));
            return;
        }

        Optional<String> token = frame.textField("token");
        if (token.isEmpty()) {
            reply(session, RealtimeEvent.authenticationFailed(RealtimeErrorCode.MISSING_REQUIRED_FIELD, "Token required", clock.instant()));
            return;
        }

        AuthenticatedPrincipal principal;
        try {
            principal = credentialValidator.validate(token.get());
        } catch (InvalidCredentialException e) {
            log.warn("Realtime authentication failed: reason={}", e.getMessage());
            meterRegistry.counter("realtime.authentication.failed").increment();
            reply(session, RealtimeEvent.authenticationFailed(RealtimeErrorCode.AUTHENTICATION_FAILED, e.getMessage(), clock.instant()));
            return;
        }

        synchronized (session) {
            if (session.getState() != ConnectionState.AUTHENTICATING) {
                return;
            }
            try {
                connectionRegistry.register(session.getConnectionId(), principal.userId(), principal.tenantId());
            } catch (ConnectionLimitExceededException e) {
                reply(session, RealtimeEvent.authenticationFailed(RealtimeErrorCode.TOO_MANY_CONNECTIONS, "Too many connections", clock.instant()));
                return;
            }
            session.setPrincipal(principal);
            session.transition(ConnectionState.AUTHENTICATING, ConnectionState.AUTHENTICATED);
            session.cancelAuthenticationDeadline();
        }

        UserProfile profile = new UserProfile(principal.userId(), principal.firstName(), principal.lastName(),
                principal.role().getValue());
        reply(session, RealtimeEvent.builder()
                .type(OutboundEventType.AUTHENTICATED)
                .userId(principal.userId())
                .user(profile)
                .timestamp(clock.instant().toString())
                .build());

        broadcastService.toTenant(principal.tenantId(),
                RealtimeEvent.forUser(OutboundEventType.USER_ONLINE, principal.userId(), clock.instant()),
                session.getConnectionId());

        log.info("Realtime authentication successful: user={}, tenant={}", principal.userId(), principal.tenantId());
    }

    private void handleJoinChat(GatewaySession session, InboundFrame frame) {
        Optional<UUID> chatId = requireChatId(session, frame);
        if (chatId.isEmpty()) {
            return;
        }
        JoinOutcome outcome = roomMembershipService.join(session.getConnectionId(), chatId.get());
        reply(session, outcome.reply());
    }

    private void handleLeaveChat(GatewaySession session, InboundFrame frame) {
        Optional<UUID> chatId = requireChatId(session, frame);
        if (chatId.isEmpty()) {
            return;
        }
        reply(session, roomMembershipService.leave(session.getConnectionId(), chatId.get()));
    }

    private void handleTyping(GatewaySession session, InboundFrame frame, OutboundEventType type) {
        Optional<UUID> chatId = requireChatId(session, frame);
        if (chatId.isEmpty()) {
            return;
        }
        if (!roomMembershipService.isMember(session.getConnectionId(), chatId.get())) {
            log.debug("Typing event ignored outside room: chat={}", chatId.get());
            return;
        }

        AuthenticatedPrincipal principal = session.getPrincipal();
        RealtimeEvent event = RealtimeEvent.forChat(type, chatId.get(), clock.instant()).toBuilder()
                .userId(principal.userId())
                .user(new UserProfile(principal.userId(), principal.firstName(), principal.lastName(), null))
                .build();
        broadcastService.toRoom(chatId.get(), event, session.getConnectionId());
    }

    private Optional<UUID> requireChatId(GatewaySession session, InboundFrame frame) {
        try {
            Optional<UUID> chatId = frame.uuidField("chatId");
            if (chatId.isEmpty()) {
                reply(session, RealtimeEvent.error(RealtimeErrorCode.MISSING_REQUIRED_FIELD, "chatId is required", clock.instant()));
            }
            return chatId;
        } catch (IllegalArgumentException e) {
            reply(session, RealtimeEvent.error(RealtimeErrorCode.INVALID_MESSAGE_FORMAT, "chatId must be a UUID", clock.instant()));
            return Optional.empty();
        }
    }

    private void reply(GatewaySession session, RealtimeEvent event) {
        localDeliveryService.sendTo(session.getConnectionId(), event);
    }

    void onAuthenticationDeadline(String connectionId) {
        connectionSessions.find(connectionId).ifPresent(session -> {
            synchronized (session) {
                if (session.getState() != ConnectionState.AUTHENTICATING) {
                    return;
                }
                log.info("Authentication deadline passed: connectionId={}", connectionId);
                meterRegistry.counter("realtime.authentication.timeouts").increment();
                close(session, AUTHENTICATION_TIMEOUT);
            }
        });
    }

    /**
     * Closes authenticated connections not seen for two heartbeat intervals and pings the rest.
     */
    @Scheduled(fixedDelayString = "${realtime.heartbeat-interval:PT30S}",
            initialDelayString = "${realtime.heartbeat-interval:PT30S}")
    public void heartbeat() {
        List<String> stale = connectionRegistry.sweep(clock.instant(), realtimeProperties.getLivenessTimeout());
        for (String connectionId : stale) {
            connectionSessions.find(connectionId).ifPresentOrElse(
                    session -> {
                        log.info("Heartbeat timeout: connectionId={}", connectionId);
                        close(session, HEARTBEAT_TIMEOUT);
                    },
                    () -> teardown(connectionId));
        }

        for (GatewaySession session : connectionSessions.all()) {
            if (!session.isAuthenticated() || stale.contains(session.getConnectionId())) {
                continue;
            }
            try {
                session.getSocket().sendMessage(new PingMessage());
            } catch (IOException | RuntimeException e) {
                log.warn("Ping failed: connectionId={}, error={}", session.getConnectionId(), e.getMessage());
                close(session, DELIVERY_FAILED);
            }
        }
        if (!stale.isEmpty()) {
            meterRegistry.counter("realtime.heartbeat.timeouts").increment(stale.size());
        }
    }

    @EventListener
    public void onDeliveryFailed(ConnectionDeliveryFailedEvent event) {
        connectionSessions.find(event.connectionId()).ifPresent(session -> close(session, DELIVERY_FAILED));
    }

    @PreDestroy
    public void shutdown() {
        List<GatewaySession> open = List.copyOf(connectionSessions.all());
        log.info("Closing {} realtime connections for shutdown", open.size());
        for (GatewaySession session : open) {
            close(session, SERVER_SHUTDOWN);
        }
    }

    /**
     * Closes the socket and tears the connection down. Safe to call more than once.
     */
    void close(GatewaySession session, CloseStatus status) {
        if (session.markClosed()) {
            try {
                session.getSocket().close(status);
            } catch (IOException e) {
                log.warn("Failed to close socket: connectionId={}, error={}", session.getConnectionId(), e.getMessage());
            }
        }
        teardown(session.getConnectionId());
    }

    private void teardown(String connectionId) {
        connectionSessions.remove(connectionId).ifPresent(session -> {
            session.markClosed();
            session.cancelAuthenticationDeadline();
        });

        // Unregister before clearing rooms so an in-flight join fails its registry re-check.
        Optional<Disconnection> unregistered = connectionRegistry.unregister(connectionId);
        roomMembershipService.leaveAll(connectionId);
        unregistered.ifPresent(disconnection -> {
            if (disconnection.userWentOffline()) {
                broadcastService.toTenant(disconnection.connection().getTenantId(),
                        RealtimeEvent.forUser(OutboundEventType.USER_OFFLINE, disconnection.connection().getUserId(),
                                clock.instant()));
            }
        });
    }
}
