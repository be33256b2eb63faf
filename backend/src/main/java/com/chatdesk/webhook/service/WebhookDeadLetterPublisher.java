package com.chatdesk.webhook.service;

import com.chatdesk.config.WebhookProperties;
import com.chatdesk.webhook.dto.IngestionStage;
import com.chatdesk.webhook.dto.MessageCandidate;
import com.chatdesk.webhook.dto.WebhookDeadLetter;
import io.micrometer.core.instrument.MeterRegistry;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.kafka.core.KafkaTemplate;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Instant;
import java.util.Queue;
import java.util.concurrent.ConcurrentLinkedQueue;
import java.util.concurrent.TimeUnit;

/**
 * Parks failed webhook candidates on the dead-letter topic.
 *
 * Records that cannot be handed to Kafka are held in memory and retried every few
 * seconds, so a broker outage does not lose them while the process stays up.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class WebhookDeadLetterPublisher {

    private static final long SEND_TIMEOUT_MS = 500;

    private final KafkaTemplate<String, WebhookDeadLetter> kafkaTemplate;
    private final WebhookProperties webhookProperties;
    private final MeterRegistry meterRegistry;
    private final Clock clock;

    private final Queue<WebhookDeadLetter> fallbackQueue = new ConcurrentLinkedQueue<>();

    public void publish(MessageCandidate candidate, IngestionStage stage, Throwable cause) {
        WebhookDeadLetter deadLetter = WebhookDeadLetter.builder()
                .candidate(candidate)
                .stage(stage)
                .error(cause.getClass().getSimpleName() + ": " + cause.getMessage())
                .failedAt(Instant.now(clock))
                .build();

        if (!send(deadLetter)) {
            fallbackQueue.offer(deadLetter);
            meterRegistry.counter("webhook.dlt.fallback").increment();
        }
    }

    @Scheduled(fixedDelay = 5000)
    public void retryFallbackQueue() {
        int succeeded = 0;
        WebhookDeadLetter deadLetter;
        while ((deadLetter = fallbackQueue.poll()) != null) {
            if (!send(deadLetter)) {
                // Broker still unreachable; the rest waits for the next run.
                fallbackQueue.offer(deadLetter);
                log.warn("Dead-letter fallback retry stopped on failure: remaining={}", fallbackQueue.size());
                break;
            }
            succeeded++;
        }

        if (succeeded > 0) {
            meterRegistry.counter("webhook.dlt.fallback.recovered").increment(succeeded);
            log.info("Dead-letter fallback retry completed: succeeded={}, remaining={}", succeeded, fallbackQueue.size());
        }
        meterRegistry.gauge("webhook.dlt.fallback.queue_size", fallbackQueue, Queue::size);
    }

    int pendingFallbackCount() {
        return fallbackQueue.size();
    }

    private boolean send(WebhookDeadLetter deadLetter) {
        try {
            kafkaTemplate.send(webhookProperties.getDeadLetterTopic(), deadLetter.getPartitionKey(), deadLetter)
                    .get(SEND_TIMEOUT_MS, TimeUnit.MILLISECONDS);
            log.info("Webhook candidate dead-lettered: topic={}, candidate={}, stage={}",
                    webhookProperties.getDeadLetterTopic(), deadLetter.getCandidate(), deadLetter.getStage());
            return true;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            log.error("Interrupted while dead-lettering candidate={}", deadLetter.getCandidate(), e);
            return false;
        } catch (Exception e) {
            log.error("Dead-letter publish failed, queued for retry: candidate={}", deadLetter.getCandidate(), e);
            return false;
        }
    }
}
