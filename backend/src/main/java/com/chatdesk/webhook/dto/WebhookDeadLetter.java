package com.chatdesk.webhook.dto;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;

import java.time.Instant;

/**
 * Kafka record for a candidate that could not be processed, keyed by account id.
 */
@Getter
@NoArgsConstructor
@AllArgsConstructor
@Builder
@JsonIgnoreProperties(ignoreUnknown = true)
public class WebhookDeadLetter {
    private MessageCandidate candidate;
    private IngestionStage stage;
    private String error;
    private Instant failedAt;

    @JsonIgnore
    public String getPartitionKey() {
        return candidate == null ? null : candidate.getAccountId();
    }
}
