package com.chatdesk.config;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;
import org.springframework.validation.annotation.Validated;

@Configuration
@ConfigurationProperties(prefix = "webhook")
@Data
@Validated
public class WebhookProperties {

    /**
     * Shared app secret used for the X-Hub-Signature-256 HMAC.
     */
    private String appSecret;

    /**
     * Token echoed back by the platform during subscription verification.
     */
    private String verifyToken;

    @NotNull
    private VerificationMode verificationMode = VerificationMode.ENFORCED;

    @NotBlank
    private String deadLetterTopic = "webhook-candidates-dlt";

    public boolean hasAppSecret() {
        return appSecret != null && !appSecret.isBlank();
    }

    public enum VerificationMode {
        /** Every delivery must carry a valid signature. Deliveries are rejected while no secret is set. */
        ENFORCED,
        /** Local development only: signatures are not checked. */
        UNVERIFIED
    }
}
