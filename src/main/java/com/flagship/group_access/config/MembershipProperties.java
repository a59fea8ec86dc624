package com.flagship.group_access.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

/**
 * Business settings for plans, grace, access finalization, reconciliation and the lifecycle sweep.
 *
 * Bound from the {@code membership.*} keys in application.yml.
 */
@Data
@ConfigurationProperties(prefix = "membership")
public class MembershipProperties {

    private Plan plan = new Plan();
    private Access access = new Access();
    private Reconciliation reconciliation = new Reconciliation();
    private Lifecycle lifecycle = new Lifecycle();
    private Jobs jobs = new Jobs();

    @Data
    public static class Plan {
        /** Access bought by one one-time payment. */
        private Duration oneTimePeriod = Duration.ofDays(30);

        /** Fallback period for a recurring charge that carries no expiry from the platform. */
        private Duration renewalPeriod = Duration.ofDays(30);

        /** Interval after expiry during which access is retained. */
        private Duration gracePeriod = Duration.ofHours(48);

        private String currency = "XTR";
    }

    @Data
    public static class Access {
        /** Delay before each retry after a retryable grant failure. Its size is the retry budget. */
        private List<Duration> backoff = new ArrayList<>(List.of(
                Duration.ofMillis(500),
                Duration.ofSeconds(1),
                Duration.ofSeconds(2),
                Duration.ofSeconds(4),
                Duration.ofSeconds(8),
                Duration.ofSeconds(16),
                Duration.ofSeconds(32),
                Duration.ofSeconds(64)));

        /** Lifetime of a self-service invite link. */
        private Duration inviteTtl = Duration.ofMinutes(5);

        private int workerBatchSize = 50;

        /** How long a claimed task is hidden from other workers while its attempt runs. */
        private Duration claimLease = Duration.ofSeconds(30);
    }

    @Data
    public static class Reconciliation {
        /** Used for the cursor when none has been stored yet. */
        private Duration initialLookback = Duration.ofDays(7);

        /** Overlap subtracted from the cursor so late deliveries are re-read. */
        private Duration lookbackMargin = Duration.ofHours(72);

        private int pageSize = 100;

        /** Safety bound on pages per run. */
        private int maxPages = 500;

        /** Health turns WARNING when no run has completed for this long. */
        private Duration maxLag = Duration.ofHours(24);
    }

    @Data
    public static class Lifecycle {
        private int maxRevokeAttempts = 10;

        /** Failed renewal stops before the row stops being retried. */
        private int maxRenewalStopAttempts = 10;

        private Duration reminderLead = Duration.ofDays(3);

        private int batchSize = 500;
    }

    @Data
    public static class Jobs {
        private Duration leaseTtl = Duration.ofMinutes(15);
    }
}
