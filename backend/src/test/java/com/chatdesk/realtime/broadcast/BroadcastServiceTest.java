package com.chatdesk.realtime.broadcast;

import com.chatdesk.config.RealtimeProperties;
import com.chatdesk.realtime.dto.OutboundEventType;
import com.chatdesk.realtime.dto.RealtimeEvent;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.InOrder;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.data.redis.RedisConnectionFailureException;

import java.time.Instant;
import java.util.UUID;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatCode;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.ArgumentMatchers.isNull;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.inOrder;
import static org.mockito.Mockito.verify;

@ExtendWith(MockitoExtension.class)
@DisplayName("BroadcastService 단위 테스트")
class BroadcastServiceTest {

    private static final Instant NOW = Instant.parse("2024-01-01T00:00:00Z");
    private static final UUID CHAT_ID = UUID.randomUUID();
    private static final UUID TENANT_ID = UUID.randomUUID();
    private static final UUID USER_ID = UUID.randomUUID();

    @Mock
    private LocalDeliveryService localDeliveryService;

    @Mock
    private RedisBroadcastPublisher publisher;

    private SimpleMeterRegistry meterRegistry;
    private BroadcastService broadcastService;

    @BeforeEach
    void setUp() {
        RealtimeProperties properties = new RealtimeProperties();
        properties.setInstanceId("instance-a");
        meterRegistry = new SimpleMeterRegistry();
        broadcastService = new BroadcastService(localDeliveryService, publisher, properties, meterRegistry);
    }

    @Test
    @DisplayName("방 전송은 로컬 전달 후 인스턴스 ID가 담긴 봉투를 발행한다")
    void toRoom_DeliversLocallyThenPublishes() {
        // given
        RealtimeEvent event = RealtimeEvent.forChat(OutboundEventType.TYPING_START, CHAT_ID, NOW);
        ArgumentCaptor<BroadcastEnvelope> envelope = ArgumentCaptor.forClass(BroadcastEnvelope.class);

        // when
        broadcastService.toRoom(CHAT_ID, event, "ws_sender");

        // then
        InOrder order = inOrder(localDeliveryService, publisher);
        order.verify(localDeliveryService).deliver(ChannelFamily.ROOM, CHAT_ID, event, "ws_sender");
        order.verify(publisher).publish(envelope.capture());

        assertThat(envelope.getValue().getFamily()).isEqualTo(ChannelFamily.ROOM);
        assertThat(envelope.getValue().getKey()).isEqualTo(CHAT_ID);
        assertThat(envelope.getValue().getExcludeConnectionId()).isEqualTo("ws_sender");
        assertThat(envelope.getValue().getOriginInstanceId()).isEqualTo("instance-a");
        assertThat(envelope.getValue().getEvent()).isSameAs(event);
    }

    @Test
    @DisplayName("테넌트와 사용자 전송은 각자의 채널 패밀리를 사용한다")
    void toTenantAndUser_UseTheirFamilies() {
        // given
        RealtimeEvent online = RealtimeEvent.forUser(OutboundEventType.USER_ONLINE, USER_ID, NOW);

        // when
        broadcastService.toTenant(TENANT_ID, online);
        broadcastService.toUser(USER_ID, online);

        // then
        verify(localDeliveryService).deliver(eq(ChannelFamily.TENANT), eq(TENANT_ID), eq(online), isNull());
        verify(localDeliveryService).deliver(eq(ChannelFamily.USER), eq(USER_ID), eq(online), isNull());
    }

    @Test
    @DisplayName("브로커 발행 실패는 호출자에게 전파되지 않고 카운트된다")
    void publishFailure_IsCountedNotThrown() {
        // given
        doThrow(new RedisConnectionFailureException("redis down")).when(publisher).publish(any());

        // when & then
        assertThatCode(() -> broadcastService.toTenant(TENANT_ID,
                RealtimeEvent.forUser(OutboundEventType.USER_OFFLINE, USER_ID, NOW)))
                .doesNotThrowAnyException();
        assertThat(meterRegistry.counter("realtime.broadcast.publish.failed").count()).isEqualTo(1.0);
        verify(localDeliveryService).deliver(eq(ChannelFamily.TENANT), eq(TENANT_ID), any(), isNull());
    }
}
