package com.flagship.group_access.observability;

import com.flagship.group_access.access.AccessGrantStatus;
import com.flagship.group_access.access.AccessGrantTaskRepository;
import com.flagship.group_access.reconciliation.ReconciliationCursorRepository;
import com.flagship.group_access.subscription.SubscriptionRepository;
import com.flagship.group_access.subscription.SubscriptionStatus;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import jakarta.annotation.PostConstruct;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;
import java.time.Duration;
import java.util.EnumMap;
import java.util.Map;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Metrics for payment ingestion, the subscription lifecycle, access grants and reconciliation.
 *
 * Counters:
 * - membership.payments.ingested{source, outcome}: INSERTED vs ALREADY_EXISTS per ingestion path
 * - membership.subscription.transitions{to}: lifecycle moves made by ingestion and the sweep
 * - membership.access.attempts{outcome}: each grant call against the platform
 * - membership.revocations{outcome}
 * - membership.reconciliation.runs{status}
 *
 * Gauges (cached, refreshed by {@link MetricsScheduler}):
 * - membership.subscriptions{status}
 * - membership.access.tasks.pending
 * - membership.reconciliation.cursor.lag.seconds
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class MembershipMetrics {

    private final MeterRegistry registry;
    private final SubscriptionRepository subscriptionRepository;
    private final AccessGrantTaskRepository accessGrantTaskRepository;
    private final ReconciliationCursorRepository cursorRepository;
    private final Clock clock;

    private final Map<SubscriptionStatus, AtomicLong> subscriptionsByStatus = new EnumMap<>(SubscriptionStatus.class);
    private final AtomicLong pendingAccessTasks = new AtomicLong(0);
    private final AtomicLong cursorLagSeconds = new AtomicLong(0);

    @PostConstruct
    public void init() {
        for (SubscriptionStatus status : SubscriptionStatus.values()) {
            AtomicLong holder = new AtomicLong(0);
            subscriptionsByStatus.put(status, holder);
            Gauge.builder("membership.subscriptions", holder, AtomicLong::get)
                    .description("Subscriptions by lifecycle status")
                    .tag("status", status.name())
                    .register(registry);
        }

        Gauge.builder("membership.access.tasks.pending", pendingAccessTasks, AtomicLong::get)
                .description("Access grants waiting for a retry")
                .register(registry);

        Gauge.builder("membership.reconciliation.cursor.lag.seconds", cursorLagSeconds, AtomicLong::get)
                .description("Seconds between now and the reconciliation cursor")
                .register(registry);
    }

    @Transactional(readOnly = true)
    public void refreshGauges() {
        try {
            subscriptionsByStatus.forEach((status, holder) ->
                    holder.set(subscriptionRepository.countByStatus(status)));
            pendingAccessTasks.set(accessGrantTaskRepository.countByStatus(AccessGrantStatus.PENDING));
            cursorRepository.findById(ReconciliationCursorRepository.SINGLETON_ID)
                    .ifPresent(cursor -> cursorLagSeconds.set(
                            Math.max(0, Duration.between(cursor.getLastSeenAt(), clock.instant()).getSeconds())));
        } catch (Exception e) {
            log.warn("Failed to refresh membership metrics: {}", e.getMessage());
        }
    }

    public void recordPaymentIngested(String source, String outcome) {
        registry.counter("membership.payments.ingested",
                "source", source,
                "outcome", outcome
        ).increment();
    }

    public void recordIngestionLatency(String source, Duration duration) {
        Timer.builder("membership.payments.ingestion.duration")
                .tag("source", source)
                .publishPercentiles(0.5, 0.95, 0.99)
                .register(registry)
                .record(duration);
    }

    public void recordTransition(String toStatus) {
        registry.counter("membership.subscription.transitions", "to", toStatus).increment();
    }

    public void recordAccessAttempt(String outcome) {
        registry.counter("membership.access.attempts", "outcome", outcome).increment();
    }

    public void recordRevocation(String outcome) {
        registry.counter("membership.revocations", "outcome", outcome).increment();
    }

    public void recordReconciliationRun(String status, long inserted) {
        registry.counter("membership.reconciliation.runs", "status", status).increment();
        registry.counter("membership.reconciliation.payments.inserted").increment(inserted);
    }
}
