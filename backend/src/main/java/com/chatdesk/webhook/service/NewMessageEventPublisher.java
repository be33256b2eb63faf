package com.chatdesk.webhook.service;

import com.chatdesk.webhook.dto.NewMessageEvent;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.micrometer.core.instrument.MeterRegistry;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.data.redis.core.RedisTemplate;
import org.springframework.stereotype.Service;

/**
 * Publishes {@link NewMessageEvent} on the Redis {@code new_message} channel.
 *
 * Best effort: a Redis failure is logged and counted, never propagated, so it cannot fail
 * the webhook that stored the message.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class NewMessageEventPublisher {

    public static final String CHANNEL = "new_message";

    private final RedisTemplate<String, Object> redisTemplate;
    private final ObjectMapper objectMapper;
    private final MeterRegistry meterRegistry;

    public void publish(NewMessageEvent event) {
        try {
            redisTemplate.convertAndSend(CHANNEL, objectMapper.writeValueAsString(event));
            log.debug("Published new_message event: chatId={}, messageId={}", event.chatId(), event.messageId());
        } catch (JsonProcessingException | RuntimeException e) {
            meterRegistry.counter("webhook.new_message.publish.failed").increment();
            log.error("Failed to publish new_message event: chatId={}, messageId={}",
                    event.chatId(), event.messageId(), e);
        }
    }
}
