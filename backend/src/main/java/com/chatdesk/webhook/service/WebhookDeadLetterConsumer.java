package com.chatdesk.webhook.service;

import com.chatdesk.webhook.dto.MaterializationResult;
import com.chatdesk.webhook.dto.WebhookDeadLetter;
import io.micrometer.core.instrument.MeterRegistry;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.kafka.annotation.KafkaListener;
import org.springframework.stereotype.Service;

/**
 * DLT consumer for webhook candidates.
 * Replays each parked candidate; a replay that still fails after retries is counted and
 * handed back to the listener container.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class WebhookDeadLetterConsumer {

    private final WebhookReplayService replayService;
    private final MeterRegistry meterRegistry;

    @KafkaListener(
        topics = "${webhook.dead-letter-topic:webhook-candidates-dlt}",
        groupId = "${spring.kafka.consumer.group-id}-dlt"
    )
    public void handleDeadLetter(WebhookDeadLetter deadLetter) {
        if (deadLetter == null || deadLetter.getCandidate() == null) {
            log.warn("Discarding dead letter without a candidate");
            meterRegistry.counter("webhook.dlt.discarded").increment();
            return;
        }

        log.warn("Replaying dead-lettered candidate: candidate={}, stage={}, error={}, failedAt={}",
                deadLetter.getCandidate(), deadLetter.getStage(), deadLetter.getError(), deadLetter.getFailedAt());

        try {
            MaterializationResult result = replayService.replay(deadLetter.getCandidate());
            meterRegistry.counter("webhook.dlt.reconciled").increment();
            log.info("DLT reconciliation success: candidate={}, outcome={}", deadLetter.getCandidate(), result.status());
        } catch (Exception e) {
            log.error("DLT reconciliation failed, needs manual intervention: candidate={}",
                    deadLetter.getCandidate(), e);
            meterRegistry.counter("webhook.dlt.failed").increment();
            throw new IllegalStateException("Dead-letter replay failed", e);
        }
    }
}
