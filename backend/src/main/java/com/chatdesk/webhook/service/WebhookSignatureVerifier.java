package com.chatdesk.webhook.service;

import com.chatdesk.config.WebhookProperties;
import com.chatdesk.config.WebhookProperties.VerificationMode;
import jakarta.annotation.PostConstruct;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import javax.crypto.Mac;
import javax.crypto.spec.SecretKeySpec;
import java.nio.charset.StandardCharsets;
import java.security.InvalidKeyException;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.HexFormat;

/**
 * Checks the {@code X-Hub-Signature-256} header: {@code sha256=} followed by the hex
 * HMAC-SHA256 of the raw request body keyed with the app secret.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class WebhookSignatureVerifier {

    static final String SIGNATURE_PREFIX = "sha256=";
    private static final String ALGORITHM = "HmacSHA256";

    private final WebhookProperties webhookProperties;

    @PostConstruct
    void reportMode() {
        if (webhookProperties.getVerificationMode() == VerificationMode.UNVERIFIED) {
            log.warn("Webhook signature verification is DISABLED (webhook.verification-mode=UNVERIFIED)");
        } else if (!webhookProperties.hasAppSecret()) {
            log.error("webhook.app-secret is not set; every webhook delivery will be rejected");
        }
    }

    public boolean verify(byte[] rawBody, String signatureHeader) {
        if (webhookProperties.getVerificationMode() == VerificationMode.UNVERIFIED) {
            log.warn("Accepting webhook delivery without signature verification");
            return true;
        }
        if (!webhookProperties.hasAppSecret()) {
            return false;
        }
        if (signatureHeader == null || !signatureHeader.startsWith(SIGNATURE_PREFIX)) {
            return false;
        }

        byte[] expected = sign(rawBody, webhookProperties.getAppSecret());
        byte[] provided;
        try {
            provided = HexFormat.of().parseHex(signatureHeader.substring(SIGNATURE_PREFIX.length()).trim());
        } catch (IllegalArgumentException e) {
            return false;
        }
        return MessageDigest.isEqual(expected, provided);
    }

    static byte[] sign(byte[] body, String secret) {
        try {
            Mac mac = Mac.getInstance(ALGORITHM);
            mac.init(new SecretKeySpec(secret.getBytes(StandardCharsets.UTF_8), ALGORITHM));
            return mac.doFinal(body);
        } catch (NoSuchAlgorithmException | InvalidKeyException e) {
            throw new IllegalStateException("HMAC-SHA256 unavailable", e);
        }
    }
}
