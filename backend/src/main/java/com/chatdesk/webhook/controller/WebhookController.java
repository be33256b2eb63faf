package com.chatdesk.webhook.controller;

import com.chatdesk.config.WebhookProperties;
import com.chatdesk.webhook.dto.IngestionSummary;
import com.chatdesk.webhook.dto.WebhookAck;
import com.chatdesk.webhook.service.WebhookIngestionService;
import com.chatdesk.webhook.service.WebhookSignatureVerifier;
import io.micrometer.core.instrument.MeterRegistry;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestHeader;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

/**
 * Meta platform webhooks. WhatsApp uses the same envelope and is served by the same
 * handlers under its own path.
 */
@Slf4j
@RestController
@RequestMapping("/api/webhooks")
@RequiredArgsConstructor
public class WebhookController {

    static final String SIGNATURE_HEADER = "X-Hub-Signature-256";
    static final String VERIFICATION_FAILED = "WEBHOOK_VERIFICATION_FAILED";

    private final WebhookSignatureVerifier signatureVerifier;
    private final WebhookIngestionService ingestionService;
    private final WebhookProperties webhookProperties;
    private final MeterRegistry meterRegistry;

    /**
     * Subscription handshake: echoes {@code hub.challenge} when the mode is
     * {@code subscribe} and the token matches {@code webhook.verify-token}.
     */
    @GetMapping({"/meta", "/whatsapp"})
    public ResponseEntity<?> verifySubscription(
            @RequestParam(name = "hub.mode", required = false) String mode,
            @RequestParam(name = "hub.challenge", required = false) String challenge,
            @RequestParam(name = "hub.verify_token", required = false) String verifyToken) {

        String expected = webhookProperties.getVerifyToken();
        boolean verified = "subscribe".equals(mode)
                && expected != null && !expected.isBlank()
                && expected.equals(verifyToken)
                && challenge != null;

        if (!verified) {
            log.warn("Webhook verification failed: mode={}, token={}", mode, verifyToken == null ? "missing" : "provided");
            return ResponseEntity.status(HttpStatus.FORBIDDEN)
                    .contentType(MediaType.APPLICATION_JSON)
                    .body(WebhookAck.rejected(VERIFICATION_FAILED, "Webhook verification failed"));
        }

        log.info("Webhook verification successful");
        return ResponseEntity.ok()
                .contentType(MediaType.TEXT_PLAIN)
                .body(challenge);
    }

    @PostMapping({"/meta", "/whatsapp"})
    public ResponseEntity<WebhookAck> receive(
            @RequestBody(required = false) byte[] body,
            @RequestHeader(name = SIGNATURE_HEADER, required = false) String signature) {

        byte[] rawBody = body == null ? new byte[0] : body;
        if (!signatureVerifier.verify(rawBody, signature)) {
            log.warn("SECURITY: invalid webhook signature: signature={}, payloadLength={}",
                    signature == null ? "missing" : "provided", rawBody.length);
            meterRegistry.counter("webhook.deliveries.rejected").increment();
            return ResponseEntity.status(HttpStatus.UNAUTHORIZED)
                    .body(WebhookAck.rejected(VERIFICATION_FAILED, "Invalid webhook signature"));
        }

        meterRegistry.counter("webhook.deliveries.received").increment();
        IngestionSummary summary = ingestionService.ingest(rawBody);
        log.debug("Webhook delivery handled: {}", summary);
        return ResponseEntity.ok(WebhookAck.received());
    }
}
