package com.chatdesk.config;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Size;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;
import org.springframework.validation.annotation.Validated;

@Configuration
@ConfigurationProperties(prefix = "auth")
@Data
@Validated
public class AuthProperties {

    /**
     * HMAC secret shared with the token issuer (at least 32 bytes for HS256).
     */
    @NotBlank
    @Size(min = 32)
    private String jwtSecret;
}
