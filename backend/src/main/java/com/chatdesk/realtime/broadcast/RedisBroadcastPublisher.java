package com.chatdesk.realtime.broadcast;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.data.redis.core.RedisTemplate;
import org.springframework.stereotype.Service;

/**
 * Publishes broadcast envelopes to Redis so that other instances can deliver them to
 * their own sockets.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class RedisBroadcastPublisher {

    private final RedisTemplate<String, Object> redisTemplate;
    private final ObjectMapper objectMapper;

    public void publish(BroadcastEnvelope envelope) {
        String payload;
        try {
            payload = objectMapper.writeValueAsString(envelope);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Failed to serialize broadcast envelope", e);
        }
        redisTemplate.convertAndSend(envelope.getFamily().getTopic(), payload);
        log.debug("Published to Redis: topic={}, key={}, type={}",
                envelope.getFamily().getTopic(), envelope.getKey(), envelope.getEvent().getType());
    }
}
