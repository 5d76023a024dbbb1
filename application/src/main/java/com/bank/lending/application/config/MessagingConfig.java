package com.bank.lending.application.config;

import org.apache.kafka.clients.admin.NewTopic;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.kafka.config.TopicBuilder;

/**
 * Messaging configuration
 * Declares the outbound topics so KafkaAdmin creates them on startup
 *
 * Configuration in application.yml:
 *   app:
 *     messaging:
 *       create-topics: true
 *       partitions: 6
 *       topics:
 *         audit: lending.audit
 *         realtime: lending.realtime
 */
@Configuration
@ConditionalOnProperty(name = "app.messaging.create-topics", havingValue = "true")
public class MessagingConfig {

    @Value("${app.messaging.partitions:6}")
    private int partitions;

    @Value("${app.messaging.replicas:1}")
    private int replicas;

    /**
     * Audit topic, keyed by applicant id
     */
    @Bean
    public NewTopic auditTopic(@Value("${app.messaging.topics.audit:lending.audit}") String name) {
        return TopicBuilder.name(name)
                .partitions(partitions)
                .replicas(replicas)
                .build();
    }

    /**
     * Realtime topic, keyed by channel
     */
    @Bean
    public NewTopic realtimeTopic(@Value("${app.messaging.topics.realtime:lending.realtime}") String name) {
        return TopicBuilder.name(name)
                .partitions(partitions)
                .replicas(replicas)
                .build();
    }
}
