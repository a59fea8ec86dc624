package com.flagship.group_access.config;

import org.apache.kafka.clients.admin.NewTopic;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.kafka.config.TopicBuilder;

/**
 * Kafka topics fed by the outbox publisher.
 *
 * - payments: accepted payments, consumed by analytics
 * - member-notifications: grace, expiry and reminder notices, consumed by the delivery bot
 */
@Configuration
public class KafkaConfig {

    @Value("${kafka.topic.payments:payments}")
    private String paymentsTopic;

    @Value("${kafka.topic.member-notifications:member-notifications}")
    private String memberNotificationsTopic;

    @Bean
    public NewTopic paymentsTopic() {
        return TopicBuilder.name(paymentsTopic)
                .partitions(3)
                .replicas(1)
                .build();
    }

    /**
     * Keyed by user id so notifications for one member stay ordered.
     */
    @Bean
    public NewTopic memberNotificationsTopic() {
        return TopicBuilder.name(memberNotificationsTopic)
                .partitions(3)
                .replicas(1)
                .build();
    }
}
