package com.flagship.group_access.observability;

import com.flagship.group_access.config.MembershipProperties;
import com.flagship.group_access.outbox.OutboxEventRepository;
import com.flagship.group_access.reconciliation.ReconciliationCursorRepository;
import org.springframework.boot.actuate.health.Health;
import org.springframework.boot.actuate.health.HealthIndicator;
import org.springframework.data.redis.core.StringRedisTemplate;
import org.springframework.kafka.core.KafkaTemplate;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Duration;

/**
 * Actuator health indicators for the outbox, Redis, Kafka and the reconciliation cursor.
 */
public class HealthIndicators {

    /**
     * Down when too many notifications are waiting to be published.
     */
    @Component("outboxHealth")
    public static class OutboxHealthIndicator implements HealthIndicator {

        private static final long BACKLOG_WARNING_THRESHOLD = 1000;
        private static final long BACKLOG_CRITICAL_THRESHOLD = 10000;

        private final OutboxEventRepository outboxRepository;

        public OutboxHealthIndicator(OutboxEventRepository outboxRepository) {
            this.outboxRepository = outboxRepository;
        }

        @Override
        public Health health() {
            try {
                long backlogSize = outboxRepository.countUnpublished();

                Health.Builder builder = backlogSize < BACKLOG_WARNING_THRESHOLD
                        ? Health.up()
                        : backlogSize < BACKLOG_CRITICAL_THRESHOLD
                        ? Health.status("WARNING")
                        : Health.down();

                return builder
                        .withDetail("backlogSize", backlogSize)
                        .withDetail("warningThreshold", BACKLOG_WARNING_THRESHOLD)
                        .withDetail("criticalThreshold", BACKLOG_CRITICAL_THRESHOLD)
                        .build();
            } catch (Exception e) {
                return Health.down().withDetail("error", e.getMessage()).build();
            }
        }
    }

    /**
     * Redis only backs the payment-key fast path, so an outage is DEGRADED, never DOWN.
     */
    @Component("redisHealth")
    public static class RedisHealthIndicator implements HealthIndicator {

        private static final String NOTE = "Duplicate detection falls back to the database";

        private final StringRedisTemplate redisTemplate;

        public RedisHealthIndicator(StringRedisTemplate redisTemplate) {
            this.redisTemplate = redisTemplate;
        }

        @Override
        public Health health() {
            try {
                var connectionFactory = redisTemplate.getConnectionFactory();
                if (connectionFactory == null) {
                    return Health.status("DEGRADED")
                            .withDetail("error", "No connection factory configured")
                            .withDetail("note", NOTE)
                            .build();
                }

                try (var connection = connectionFactory.getConnection()) {
                    String result = connection.ping();
                    if ("PONG".equals(result)) {
                        return Health.up().withDetail("response", result).build();
                    }
                    return Health.status("DEGRADED")
                            .withDetail("response", result != null ? result : "null")
                            .withDetail("note", NOTE)
                            .build();
                }
            } catch (Exception e) {
                return Health.status("DEGRADED")
                        .withDetail("error", e.getMessage() != null ? e.getMessage() : e.getClass().getSimpleName())
                        .withDetail("note", NOTE)
                        .build();
            }
        }
    }

    @Component("kafkaHealth")
    public static class KafkaHealthIndicator implements HealthIndicator {

        private final KafkaTemplate<String, String> kafkaTemplate;

        public KafkaHealthIndicator(KafkaTemplate<String, String> kafkaTemplate) {
            this.kafkaTemplate = kafkaTemplate;
        }

        @Override
        public Health health() {
            try {
                var metrics = kafkaTemplate.metrics();
                if (metrics == null || metrics.isEmpty()) {
                    return Health.down()
                            .withDetail("error", "No Kafka connections established")
                            .build();
                }
                return Health.up().withDetail("metricsCount", metrics.size()).build();
            } catch (Exception e) {
                return Health.down()
                        .withDetail("error", e.getMessage() != null ? e.getMessage() : e.getClass().getSimpleName())
                        .build();
            }
        }
    }

    /**
     * Reports WARNING when no reconciliation run has completed for longer than
     * {@code membership.reconciliation.max-lag}. The lookback margin covers short outages;
     * a longer stall means payments may be missing from the ledger.
     */
    @Component("reconciliationHealth")
    public static class ReconciliationHealthIndicator implements HealthIndicator {

        private final ReconciliationCursorRepository cursorRepository;
        private final Clock clock;
        private final Duration maxLag;

        public ReconciliationHealthIndicator(ReconciliationCursorRepository cursorRepository,
                                             Clock clock,
                                             MembershipProperties properties) {
            this.cursorRepository = cursorRepository;
            this.clock = clock;
            this.maxLag = properties.getReconciliation().getMaxLag();
        }

        @Override
        public Health health() {
            try {
                return cursorRepository.findById(ReconciliationCursorRepository.SINGLETON_ID)
                        .map(cursor -> {
                            Duration lag = Duration.between(cursor.getUpdatedAt(), clock.instant());
                            Health.Builder builder = lag.compareTo(maxLag) <= 0
                                    ? Health.up()
                                    : Health.status("WARNING");
                            return builder
                                    .withDetail("lastSeenAt", cursor.getLastSeenAt().toString())
                                    .withDetail("lastSeenTxId", String.valueOf(cursor.getLastSeenTxId()))
                                    .withDetail("sinceLastRun", lag.toString())
                                    .build();
                        })
                        .orElseGet(() -> Health.unknown().withDetail("note", "Reconciliation has not run yet").build());
            } catch (Exception e) {
                return Health.down().withDetail("error", e.getMessage()).build();
            }
        }
    }
}
