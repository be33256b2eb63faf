package com.chatdesk.webhook.service;

import com.chatdesk.webhook.dto.MaterializationResult;
import com.chatdesk.webhook.dto.MessageCandidate;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.retry.annotation.Backoff;
import org.springframework.retry.annotation.Retryable;
import org.springframework.stereotype.Service;

/**
 * Re-runs materialization for a dead-lettered candidate. A candidate that was stored
 * before it failed comes back as a duplicate and is not announced again.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class WebhookReplayService {

    private final WebhookMaterializationService materializationService;
    private final WebhookBroadcaster broadcaster;

    @Retryable(maxAttempts = 3, backoff = @Backoff(delay = 1000, multiplier = 2))
    public MaterializationResult replay(MessageCandidate candidate) {
        MaterializationResult result = materializationService.materialize(candidate);
        if (result.isCreated()) {
            broadcaster.announce(candidate, result);
        }
        return result;
    }
}
