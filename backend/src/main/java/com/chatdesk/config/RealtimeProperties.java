package com.chatdesk.config;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Positive;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;
import org.springframework.validation.annotation.Validated;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.UUID;

@Configuration
@ConfigurationProperties(prefix = "realtime")
@Data
@Validated
public class RealtimeProperties {

    /**
     * Identifies this process on the broker so it can skip its own publications.
     */
    @NotBlank
    private String instanceId = "instance-" + UUID.randomUUID();

    @Positive
    private int maxConnectionsPerUser = 5;

    @NotNull
    private Duration heartbeatInterval = Duration.ofSeconds(30);

    @NotNull
    private Duration authenticationTimeout = Duration.ofSeconds(30);

    @NotNull
    private Duration sendTimeLimit = Duration.ofSeconds(10);

    @Positive
    private int sendBufferSizeLimit = 512 * 1024;

    private List<String> allowedOrigins = new ArrayList<>(List.of("*"));

    /**
     * A connection silent for longer than this is considered half-open.
     */
    public Duration getLivenessTimeout() {
        return heartbeatInterval.multipliedBy(2);
    }
}
