package com.chatdesk.realtime.gateway;

import com.chatdesk.auth.AuthenticatedPrincipal;
import com.chatdesk.auth.CredentialValidator;
import com.chatdesk.auth.InvalidCredentialException;
import com.chatdesk.config.RealtimeProperties;
import com.chatdesk.realtime.broadcast.BroadcastService;
import com.chatdesk.realtime.broadcast.ConnectionDeliveryFailedEvent;
import com.chatdesk.realtime.broadcast.LocalDeliveryService;
import com.chatdesk.realtime.dto.OutboundEventType;
import com.chatdesk.realtime.dto.RealtimeErrorCode;
import com.chatdesk.realtime.dto.RealtimeEvent;
import com.chatdesk.realtime.presence.JoinOutcome;
import com.chatdesk.realtime.presence.RoomMembershipService;
import com.chatdesk.realtime.registry.ConnectionRegistry;
import com.chatdesk.support.MutableClock;
import com.chatdesk.user.domain.UserRole;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.scheduling.TaskScheduler;
import org.springframework.web.socket.CloseStatus;
import org.springframework.web.socket.PingMessage;
import org.springframework.web.socket.WebSocketSession;

import java.io.IOException;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.UUID;
import java.util.concurrent.ScheduledFuture;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyBoolean;
import static org.mockito.ArgumentMatchers.argThat;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.atLeastOnce;
import static org.mockito.Mockito.doAnswer;
import static org.mockito.Mockito.lenient;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
@DisplayName("RealtimeGatewayService 단위 테스트")
class RealtimeGatewayServiceTest {

    private static final Instant NOW = Instant.parse("2024-01-01T00:00:00Z");
    private static final UUID USER_ID = UUID.randomUUID();
    private static final UUID TENANT_ID = UUID.randomUUID();
    private static final UUID CHAT_ID = UUID.randomUUID();
    private static final String TOKEN = "valid-token";

    @Mock
    private RoomMembershipService roomMembershipService;

    @Mock
    private BroadcastService broadcastService;

    @Mock
    private LocalDeliveryService localDeliveryService;

    @Mock
    private CredentialValidator credentialValidator;

    @Mock
    private TaskScheduler taskScheduler;

    @Mock
    private ScheduledFuture<?> deadlineFuture;

    private final ObjectMapper objectMapper = new ObjectMapper();
    private MutableClock clock;
    private ConnectionSessions connectionSessions;
    private ConnectionRegistry registry;
    private RealtimeProperties properties;
    private RealtimeGatewayService gatewayService;
    private Runnable pendingDeadline;

    @BeforeEach
    void setUp() {
        clock = new MutableClock(Instant.parse("2024-01-01T00:00:00Z"));
        connectionSessions = new ConnectionSessions();
        properties = new RealtimeProperties();
        properties.setMaxConnectionsPerUser(2);
        registry = new ConnectionRegistry(properties.getMaxConnectionsPerUser(), clock);

        gatewayService = new RealtimeGatewayService(connectionSessions, registry, roomMembershipService,
                broadcastService, localDeliveryService, credentialValidator, properties, taskScheduler,
                clock, objectMapper, new SimpleMeterRegistry());

        lenient().when(taskScheduler.schedule(any(Runnable.class), any(Instant.class))).thenAnswer(invocation -> {
            pendingDeadline = invocation.getArgument(0);
            return deadlineFuture;
        });
        lenient().when(credentialValidator.validate(TOKEN))
                .thenReturn(new AuthenticatedPrincipal(USER_ID, TENANT_ID, UserRole.AGENT, "Jane", "Doe"));
    }

    @Test
    @DisplayName("연결 시 인증 마감 시각이 예약된다")
    void open_SchedulesAuthenticationDeadline() {
        // when
        String connectionId = gatewayService.open(newSocket());

        // then
        assertThat(connectionId).startsWith("ws_");
        verify(taskScheduler).schedule(any(Runnable.class), eq(clock.instant().plus(Duration.ofSeconds(30))));
        assertThat(connectionSessions.find(connectionId).orElseThrow().getState())
                .isEqualTo(ConnectionState.AUTHENTICATING);
    }

    @Test
    @DisplayName("인증 없이 마감 시각이 지나면 정책 위반으로 연결이 닫힌다")
    void authenticationDeadline_ClosesUnauthenticatedSocket() throws Exception {
        // given
        WebSocketSession socket = newSocket();
        String connectionId = gatewayService.open(socket);

        // when
        pendingDeadline.run();

        // then
        verify(socket).close(CloseStatus.POLICY_VIOLATION.withReason("Authentication timeout"));
        assertThat(connectionSessions.find(connectionId)).isEmpty();
        assertThat(registry.connectionCount()).isZero();
    }

    @Test
    @DisplayName("인증에 성공하면 authenticated 응답과 user_online 브로드캐스트가 발생한다")
    void authenticate_Success() {
        // given
        WebSocketSession socket = newSocket();
        String connectionId = gatewayService.open(socket);
        ArgumentCaptor<RealtimeEvent> reply = ArgumentCaptor.forClass(RealtimeEvent.class);
        ArgumentCaptor<RealtimeEvent> online = ArgumentCaptor.forClass(RealtimeEvent.class);

        // when
        gatewayService.onText(connectionId, authenticateFrame(TOKEN));

        // then
        verify(localDeliveryService).sendTo(eq(connectionId), reply.capture());
        assertThat(reply.getValue().getType()).isEqualTo(OutboundEventType.AUTHENTICATED);
        assertThat(reply.getValue().getUser().id()).isEqualTo(USER_ID);
        assertThat(reply.getValue().getUser().firstName()).isEqualTo("Jane");
        assertThat(reply.getValue().getUser().role()).isEqualTo("agent");

        verify(deadlineFuture).cancel(false);
        assertThat(registry.get(connectionId)).isPresent();
        assertThat(connectionSessions.find(connectionId).orElseThrow().isAuthenticated()).isTrue();

        verify(broadcastService).toTenant(eq(TENANT_ID), online.capture(), eq(connectionId));
        assertThat(online.getValue().getType()).isEqualTo(OutboundEventType.USER_ONLINE);
        assertThat(online.getValue().getUserId()).isEqualTo(USER_ID);
    }

    @Test
    @DisplayName("인증 후 마감 시각이 도래해도 연결은 유지된다")
    void authenticationDeadline_AfterAuthentication_NoOp() throws Exception {
        // given
        WebSocketSession socket = newSocket();
        String connectionId = gatewayService.open(socket);
        gatewayService.onText(connectionId, authenticateFrame(TOKEN));

        // when
        pendingDeadline.run();

        // then
        verify(socket, never()).close(any());
        assertThat(registry.get(connectionId)).isPresent();
    }

    @Test
    @DisplayName("잘못된 토큰은 authentication_failed를 받고 마감 타이머는 계속 동작한다")
    void authenticate_InvalidToken_KeepsDeadline() {
        // given
        String connectionId = gatewayService.open(newSocket());
        when(credentialValidator.validate("bad-token")).thenThrow(new InvalidCredentialException("Authentication failed"));
        ArgumentCaptor<RealtimeEvent> reply = ArgumentCaptor.forClass(RealtimeEvent.class);

        // when
        gatewayService.onText(connectionId, authenticateFrame("bad-token"));

        // then
        verify(localDeliveryService).sendTo(eq(connectionId), reply.capture());
        assertThat(reply.getValue().getType()).isEqualTo(OutboundEventType.AUTHENTICATION_FAILED);
        assertThat(reply.getValue().getError()).isEqualTo("Authentication failed");
        verify(deadlineFuture, never()).cancel(anyBoolean());
        assertThat(connectionSessions.find(connectionId).orElseThrow().getState())
                .isEqualTo(ConnectionState.AUTHENTICATING);
        assertThat(registry.connectionCount()).isZero();
    }

    @Test
    @DisplayName("토큰이 없으면 Token required로 실패한다")
    void authenticate_MissingToken() {
        // given
        String connectionId = gatewayService.open(newSocket());

        // when
        gatewayService.onText(connectionId, "{\"type\":\"authenticate\",\"data\":{}}");

        // then
        verify(localDeliveryService).sendTo(eq(connectionId), argThat(event ->
                event.getType() == OutboundEventType.AUTHENTICATION_FAILED
                        && "Token required".equals(event.getError())));
        verify(credentialValidator, never()).validate(any());
    }

    @Test
    @DisplayName("사용자당 연결 상한을 넘으면 TOO_MANY_CONNECTIONS로 실패한다")
    void authenticate_OverConnectionCap() {
        // given
        for (int i = 0; i < 2; i++) {
            gatewayService.onText(gatewayService.open(newSocket()), authenticateFrame(TOKEN));
        }
        String connectionId = gatewayService.open(newSocket());

        // when
        gatewayService.onText(connectionId, authenticateFrame(TOKEN));

        // then
        verify(localDeliveryService).sendTo(eq(connectionId), argThat(event ->
                event.getType() == OutboundEventType.AUTHENTICATION_FAILED
                        && event.getCode() == RealtimeErrorCode.TOO_MANY_CONNECTIONS));
        assertThat(registry.userConnectionCount(USER_ID)).isEqualTo(2);
        assertThat(connectionSessions.find(connectionId).orElseThrow().isAuthenticated()).isFalse();
    }

    @Test
    @DisplayName("인증 전 이벤트는 UNAUTHORIZED 오류를 받는다")
    void eventBeforeAuthentication_Unauthorized() {
        // given
        String connectionId = gatewayService.open(newSocket());

        // when
        gatewayService.onText(connectionId, joinFrame(CHAT_ID));

        // then
        verify(localDeliveryService).sendTo(eq(connectionId), argThat(event ->
                event.getType() == OutboundEventType.ERROR && event.getCode() == RealtimeErrorCode.UNAUTHORIZED));
        verify(roomMembershipService, never()).join(any(), any());
    }

    @Test
    @DisplayName("알 수 없는 이벤트 타입과 JSON이 아닌 프레임은 타입이 지정된 오류를 받는다")
    void unknownTypeAndInvalidJson_TypedErrors() {
        // given
        String connectionId = authenticatedConnection(newSocket());

        // when
        gatewayService.onText(connectionId, "{\"type\":\"self_destruct\",\"data\":{}}");
        gatewayService.onText(connectionId, "not json at all");

        // then
        verify(localDeliveryService).sendTo(eq(connectionId), argThat(event ->
                event.getCode() == RealtimeErrorCode.UNKNOWN_EVENT_TYPE));
        verify(localDeliveryService).sendTo(eq(connectionId), argThat(event ->
                event.getCode() == RealtimeErrorCode.INVALID_MESSAGE_FORMAT));
    }

    @Test
    @DisplayName("join_chat 결과가 요청한 연결에 응답된다")
    void joinChat_RepliesWithOutcome() {
        // given
        String connectionId = authenticatedConnection(newSocket());
        when(roomMembershipService.join(connectionId, CHAT_ID)).thenReturn(
                JoinOutcome.denied(RealtimeEvent.error(RealtimeErrorCode.ACCESS_DENIED, "Access denied to this chat", NOW)));

        // when
        gatewayService.onText(connectionId, joinFrame(CHAT_ID));

        // then
        verify(localDeliveryService).sendTo(eq(connectionId), argThat(event ->
                event.getCode() == RealtimeErrorCode.ACCESS_DENIED));
    }

    @Test
    @DisplayName("chatId가 없으면 MISSING_REQUIRED_FIELD 오류를 받는다")
    void joinChat_MissingChatId() {
        // given
        String connectionId = authenticatedConnection(newSocket());

        // when
        gatewayService.onText(connectionId, "{\"type\":\"join_chat\",\"data\":{}}");

        // then
        verify(localDeliveryService).sendTo(eq(connectionId), argThat(event ->
                event.getCode() == RealtimeErrorCode.MISSING_REQUIRED_FIELD));
        verify(roomMembershipService, never()).join(any(), any());
    }

    @Test
    @DisplayName("방 멤버의 타이핑 이벤트는 보낸 연결을 제외하고 방에 전달된다")
    void typing_Member_RelayedToRoomExcludingSender() {
        // given
        String connectionId = authenticatedConnection(newSocket());
        when(roomMembershipService.isMember(connectionId, CHAT_ID)).thenReturn(true);
        ArgumentCaptor<RealtimeEvent> relayed = ArgumentCaptor.forClass(RealtimeEvent.class);

        // when
        gatewayService.onText(connectionId, "{\"type\":\"typing_start\",\"data\":{\"chatId\":\"" + CHAT_ID + "\"}}");

        // then
        verify(broadcastService).toRoom(eq(CHAT_ID), relayed.capture(), eq(connectionId));
        assertThat(relayed.getValue().getType()).isEqualTo(OutboundEventType.TYPING_START);
        assertThat(relayed.getValue().getUserId()).isEqualTo(USER_ID);
    }

    @Test
    @DisplayName("방에 없는 연결의 타이핑 이벤트는 전달되지 않는다")
    void typing_NonMember_Dropped() {
        // given
        String connectionId = authenticatedConnection(newSocket());
        when(roomMembershipService.isMember(connectionId, CHAT_ID)).thenReturn(false);

        // when
        gatewayService.onText(connectionId, "{\"type\":\"typing_stop\",\"data\":{\"chatId\":\"" + CHAT_ID + "\"}}");

        // then
        verify(broadcastService, never()).toRoom(any(), any(), any());
    }

    @Test
    @DisplayName("하트비트는 2T 동안 조용한 연결을 Timeout으로 닫고 오프라인을 알린다")
    void heartbeat_ClosesStaleConnection() throws Exception {
        // given
        WebSocketSession socket = newSocket();
        String connectionId = authenticatedConnection(socket);
        clock.advance(Duration.ofSeconds(61));

        // when
        gatewayService.heartbeat();

        // then
        verify(socket).close(CloseStatus.GOING_AWAY.withReason("Timeout"));
        verify(roomMembershipService).leaveAll(connectionId);
        assertThat(registry.get(connectionId)).isEmpty();
        assertThat(connectionSessions.find(connectionId)).isEmpty();
        verify(broadcastService).toTenant(eq(TENANT_ID), argThat(event ->
                event.getType() == OutboundEventType.USER_OFFLINE && USER_ID.equals(event.getUserId())));
    }

    @Test
    @DisplayName("하트비트는 살아있는 연결에 ping을 보내고 pong은 활동으로 기록된다")
    void heartbeat_PingsLiveConnections() throws Exception {
        // given
        WebSocketSession socket = newSocket();
        String connectionId = authenticatedConnection(socket);
        clock.advance(Duration.ofSeconds(50));
        gatewayService.onPong(connectionId);
        clock.advance(Duration.ofSeconds(50));

        // when
        gatewayService.heartbeat();

        // then
        verify(socket, atLeastOnce()).sendMessage(any(PingMessage.class));
        verify(socket, never()).close(any());
        assertThat(registry.get(connectionId)).isPresent();
    }

    @Test
    @DisplayName("사용자의 마지막 연결이 닫힐 때만 user_offline이 브로드캐스트된다")
    void onClose_OfflineOnlyForLastConnection() {
        // given
        String first = authenticatedConnection(newSocket());
        String second = authenticatedConnection(newSocket());

        // when
        gatewayService.onClose(first, CloseStatus.NORMAL);

        // then
        verify(broadcastService, never()).toTenant(any(), argThat(event ->
                event.getType() == OutboundEventType.USER_OFFLINE));

        // when
        gatewayService.onClose(second, CloseStatus.NORMAL);

        // then
        verify(broadcastService).toTenant(eq(TENANT_ID), argThat(event ->
                event.getType() == OutboundEventType.USER_OFFLINE));
        assertThat(registry.connectionCount()).isZero();
    }

    @Test
    @DisplayName("전송 실패 이벤트를 받으면 해당 연결을 정리한다")
    void deliveryFailure_TearsDownConnection() throws Exception {
        // given
        WebSocketSession socket = newSocket();
        String connectionId = authenticatedConnection(socket);

        // when
        gatewayService.onDeliveryFailed(new ConnectionDeliveryFailedEvent(connectionId, new IOException("reset")));

        // then
        verify(socket).close(any(CloseStatus.class));
        assertThat(registry.get(connectionId)).isEmpty();
    }

    @Test
    @DisplayName("전송 오류가 나면 닫힘과 같이 소켓을 닫고 연결을 정리한다")
    void transportError_TearsDownLikeClose() throws Exception {
        // given
        WebSocketSession socket = newSocket();
        String connectionId = authenticatedConnection(socket);

        // when
        gatewayService.onTransportError(connectionId, new IOException("connection reset"));

        // then
        verify(socket).close(CloseStatus.SERVER_ERROR);
        assertThat(connectionSessions.find(connectionId)).isEmpty();
        assertThat(registry.get(connectionId)).isEmpty();
        verify(roomMembershipService).leaveAll(connectionId);
        verify(broadcastService).toTenant(eq(TENANT_ID), argThat(event ->
                event.getType() == OutboundEventType.USER_OFFLINE));
    }

    @Test
    @DisplayName("정리 시 방 제거는 레지스트리에서 연결이 빠진 뒤에 실행된다")
    void teardown_UnregistersBeforeLeavingRooms() {
        // given
        String connectionId = authenticatedConnection(newSocket());
        List<Boolean> registeredDuringLeaveAll = new ArrayList<>();
        doAnswer(invocation -> registeredDuringLeaveAll.add(registry.get(connectionId).isPresent()))
                .when(roomMembershipService).leaveAll(connectionId);

        // when
        gatewayService.onClose(connectionId, CloseStatus.NORMAL);

        // then
        assertThat(registeredDuringLeaveAll).containsExactly(false);
    }

    @Test
    @DisplayName("토큰 검증 중에 연결이 닫히면 등록되지 않고 온라인 알림도 없다")
    void authenticate_ClosedDuringValidation_NotRegistered() {
        // given
        WebSocketSession socket = newSocket();
        String connectionId = gatewayService.open(socket);
        when(credentialValidator.validate("slow-token")).thenAnswer(invocation -> {
            gatewayService.onClose(connectionId, CloseStatus.NORMAL);
            return new AuthenticatedPrincipal(USER_ID, TENANT_ID, UserRole.AGENT, "Jane", "Doe");
        });

        // when
        gatewayService.onText(connectionId, authenticateFrame("slow-token"));

        // then
        assertThat(registry.connectionCount()).isZero();
        assertThat(connectionSessions.find(connectionId)).isEmpty();
        verify(localDeliveryService, never()).sendTo(eq(connectionId), argThat(event ->
                event.getType() == OutboundEventType.AUTHENTICATED));
        verify(broadcastService, never()).toTenant(any(), any(), any());
    }

    @Test
    @DisplayName("종료 시 모든 소켓을 Server shutdown으로 닫는다")
    void shutdown_ClosesAllSockets() throws Exception {
        // given
        WebSocketSession authenticated = newSocket();
        WebSocketSession pending = newSocket();
        authenticatedConnection(authenticated);
        gatewayService.open(pending);

        // when
        gatewayService.shutdown();

        // then
        for (WebSocketSession socket : List.of(authenticated, pending)) {
            verify(socket).close(CloseStatus.GOING_AWAY.withReason("Server shutdown"));
        }
        assertThat(connectionSessions.size()).isZero();
    }

    private WebSocketSession newSocket() {
        WebSocketSession socket = mock(WebSocketSession.class);
        lenient().when(socket.getAttributes()).thenReturn(new HashMap<>());
        lenient().when(socket.isOpen()).thenReturn(true);
        return socket;
    }

    private String authenticatedConnection(WebSocketSession socket) {
        String connectionId = gatewayService.open(socket);
        gatewayService.onText(connectionId, authenticateFrame(TOKEN));
        return connectionId;
    }

    private static String authenticateFrame(String token) {
        return "{\"type\":\"authenticate\",\"data\":{\"token\":\"" + token + "\"}}";
    }

    private static String joinFrame(UUID chatId) {
        return "{\"type\":\"join_chat\",\"data\":{\"chatId\":\"" + chatId + "\"}}";
    }
}
