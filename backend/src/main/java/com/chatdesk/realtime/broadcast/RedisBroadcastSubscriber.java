package com.chatdesk.realtime.broadcast;

import com.chatdesk.config.RealtimeProperties;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.data.redis.connection.Message;
import org.springframework.data.redis.connection.MessageListener;
import org.springframework.stereotype.Service;

import java.nio.charset.StandardCharsets;

/**
 * Receives envelopes published by any instance and delivers them to local sockets.
 * Envelopes this instance published itself were already delivered locally and are skipped.
 * Nothing received here is published again.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class RedisBroadcastSubscriber implements MessageListener {

    private final LocalDeliveryService localDeliveryService;
    private final RealtimeProperties realtimeProperties;
    private final ObjectMapper objectMapper;

    @Override
    public void onMessage(Message message, byte[] pattern) {
        try {
            String json = new String(message.getBody(), StandardCharsets.UTF_8);
            BroadcastEnvelope envelope = objectMapper.readValue(json, BroadcastEnvelope.class);

            if (realtimeProperties.getInstanceId().equals(envelope.getOriginInstanceId())) {
                return;
            }
            if (envelope.getFamily() == null || envelope.getKey() == null || envelope.getEvent() == null) {
                log.warn("Ignoring incomplete broadcast envelope from instance={}", envelope.getOriginInstanceId());
                return;
            }

            localDeliveryService.deliver(envelope.getFamily(), envelope.getKey(),
                    envelope.getEvent(), envelope.getExcludeConnectionId());
        } catch (Exception e) {
            log.error("Failed to process broadcast envelope from Redis", e);
        }
    }
}
