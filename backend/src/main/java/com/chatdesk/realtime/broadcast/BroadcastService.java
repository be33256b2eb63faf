package com.chatdesk.realtime.broadcast;

import com.chatdesk.config.RealtimeProperties;
import com.chatdesk.realtime.dto.RealtimeEvent;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.UUID;

/**
 * Entry point for fan-out. Every call delivers to matching sockets on this instance, then
 * publishes one envelope so other instances do the same. Publish failures are logged and
 * counted; callers never see them.
 */
@Slf4j
@Service
public class BroadcastService {

    private final LocalDeliveryService localDeliveryService;
    private final RedisBroadcastPublisher publisher;
    private final String instanceId;
    private final Counter publishFailures;

    public BroadcastService(LocalDeliveryService localDeliveryService,
                            RedisBroadcastPublisher publisher,
                            RealtimeProperties realtimeProperties,
                            MeterRegistry meterRegistry) {
        this.localDeliveryService = localDeliveryService;
        this.publisher = publisher;
        this.instanceId = realtimeProperties.getInstanceId();
        this.publishFailures = Counter.builder("realtime.broadcast.publish.failed")
                .description("Broadcast envelopes that could not be published to Redis")
                .register(meterRegistry);
    }

    public void toRoom(UUID chatId, RealtimeEvent event) {
        toRoom(chatId, event, null);
    }

    public void toRoom(UUID chatId, RealtimeEvent event, String excludeConnectionId) {
        broadcast(ChannelFamily.ROOM, chatId, event, excludeConnectionId);
    }

    public void toTenant(UUID tenantId, RealtimeEvent event) {
        toTenant(tenantId, event, null);
    }

    public void toTenant(UUID tenantId, RealtimeEvent event, String excludeConnectionId) {
        broadcast(ChannelFamily.TENANT, tenantId, event, excludeConnectionId);
    }

    public void toUser(UUID userId, RealtimeEvent event) {
        broadcast(ChannelFamily.USER, userId, event, null);
    }

    private void broadcast(ChannelFamily family, UUID key, RealtimeEvent event, String excludeConnectionId) {
        localDeliveryService.deliver(family, key, event, excludeConnectionId);

        BroadcastEnvelope envelope = BroadcastEnvelope.builder()
                .family(family)
                .key(key)
                .excludeConnectionId(excludeConnectionId)
                .originInstanceId(instanceId)
                .event(event)
                .build();
        try {
            publisher.publish(envelope);
        } catch (RuntimeException e) {
            publishFailures.increment();
            log.error("Broadcast publish failed: family={}, key={}, type={}", family, key, event.getType(), e);
        }
    }
}
