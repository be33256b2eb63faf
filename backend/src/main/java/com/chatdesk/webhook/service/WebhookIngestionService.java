package com.chatdesk.webhook.service;

import com.chatdesk.webhook.dto.IngestionStage;
import com.chatdesk.webhook.dto.IngestionSummary;
import com.chatdesk.webhook.dto.MaterializationResult;
import com.chatdesk.webhook.dto.MessageCandidate;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.micrometer.core.instrument.MeterRegistry;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.util.List;
import java.util.Locale;

/**
 * Runs a verified webhook delivery through the pipeline, one candidate at a time.
 *
 * Each candidate is materialized in its own transaction. A failing candidate is logged,
 * counted and dead-lettered, and its siblings are still processed. Broadcast failures after
 * a successful commit are only logged: the message is stored and clients pick it up on
 * their next fetch.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class WebhookIngestionService {

    private final WebhookPayloadParser payloadParser;
    private final WebhookMaterializationService materializationService;
    private final WebhookBroadcaster broadcaster;
    private final WebhookDeadLetterPublisher deadLetterPublisher;
    private final ObjectMapper objectMapper;
    private final MeterRegistry meterRegistry;

    public IngestionSummary ingest(byte[] rawBody) {
        JsonNode envelope;
        try {
            envelope = objectMapper.readTree(rawBody);
        } catch (IOException e) {
            log.warn("Discarding webhook delivery with malformed JSON: bytes={}, error={}",
                    rawBody.length, e.getMessage());
            meterRegistry.counter("webhook.deliveries.malformed").increment();
            return IngestionSummary.empty();
        }

        List<MessageCandidate> candidates = payloadParser.parse(envelope);
        log.info("Webhook received: object={}, entries={}, candidates={}",
                envelope.path("object").asText(null), envelope.path("entry").size(), candidates.size());

        int created = 0;
        int duplicates = 0;
        int unrouted = 0;
        int failed = 0;
        for (MessageCandidate candidate : candidates) {
            switch (process(candidate)) {
                case CREATED -> created++;
                case DUPLICATE -> duplicates++;
                case UNROUTED -> unrouted++;
                case FAILED -> failed++;
            }
        }
        return new IngestionSummary(candidates.size(), created, duplicates, unrouted, failed);
    }

    private Outcome process(MessageCandidate candidate) {
        MaterializationResult result;
        try {
            result = materializationService.materialize(candidate);
        } catch (RuntimeException e) {
            logFailure(candidate, IngestionStage.MATERIALIZATION, e);
            meterRegistry.counter("webhook.candidates.failed").increment();
            deadLetterPublisher.publish(candidate, IngestionStage.MATERIALIZATION, e);
            return Outcome.FAILED;
        }

        meterRegistry.counter("webhook.candidates", "outcome", result.status().name().toLowerCase(Locale.ROOT)).increment();
        if (result.status() == MaterializationResult.Status.UNROUTED) {
            return Outcome.UNROUTED;
        }
        if (result.status() == MaterializationResult.Status.DUPLICATE) {
            return Outcome.DUPLICATE;
        }

        try {
            broadcaster.announce(candidate, result);
        } catch (RuntimeException e) {
            logFailure(candidate, IngestionStage.BROADCAST, e);
            meterRegistry.counter("webhook.broadcast.failed").increment();
        }
        log.info("Webhook message processed: chatId={}, messageId={}, tenant={}, newChat={}",
                result.chat().getId(), result.messageId(), result.chat().getTenantId(), result.chatCreated());
        return Outcome.CREATED;
    }

    private static void logFailure(MessageCandidate candidate, IngestionStage stage, Exception e) {
        log.error("Webhook candidate failed: platform={}, account={}, sender={}, platformMessageId={}, stage={}",
                candidate.getPlatform().getValue(), candidate.getAccountId(), candidate.getSenderId(),
                candidate.getPlatformMessageId(), stage, e);
    }

    private enum Outcome {
        CREATED,
        DUPLICATE,
        UNROUTED,
        FAILED
    }
}
