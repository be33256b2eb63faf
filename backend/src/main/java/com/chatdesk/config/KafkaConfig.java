package com.chatdesk.config;

import lombok.RequiredArgsConstructor;
import org.apache.kafka.clients.admin.NewTopic;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.kafka.annotation.EnableKafka;
import org.springframework.kafka.config.TopicBuilder;

/**
 * Kafka configuration for webhook dead-lettering.
 * Candidates that fail materialization are parked here and replayed by
 * {@link com.chatdesk.webhook.service.WebhookDeadLetterConsumer}.
 */
@Configuration
@EnableKafka
@RequiredArgsConstructor
public class KafkaConfig {

    private final WebhookProperties webhookProperties;

    @Bean
    public NewTopic webhookDeadLetterTopic() {
        return TopicBuilder.name(webhookProperties.getDeadLetterTopic())
                .partitions(3)
                .replicas(1)
                .config("retention.ms", String.valueOf(7L * 24 * 60 * 60 * 1000))  // 7 days
                .build();
    }
}
