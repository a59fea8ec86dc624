package com.flagship.group_access.payment;

import com.flagship.group_access.access.AccessFinalizer;
import com.flagship.group_access.observability.CorrelationContext;
import com.flagship.group_access.observability.MembershipMetrics;
import com.flagship.group_access.outbox.OutboxEvent;
import com.flagship.group_access.outbox.OutboxService;
import com.flagship.group_access.payment.event.PaymentAcceptedEvent;
import com.flagship.group_access.subscription.SubscriptionLedger;
import com.flagship.group_access.subscription.SubscriptionTransition;
import com.flagship.group_access.user.UserProfile;
import com.flagship.group_access.user.UserService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.slf4j.MDC;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;

/**
 * The single write path for payments, shared by live events and reconciliation.
 *
 * In one transaction:
 * 1. Upsert the user
 * 2. Record the payment (duplicates are absorbed)
 * 3. Apply it to the subscription ledger
 * 4. Queue an access grant
 * 5. Queue a PaymentAccepted event
 *
 * A crash anywhere rolls all of it back, and re-submitting the same payment resumes from step 1.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class PaymentIngestionService {

    private final UserService userService;
    private final PaymentStore paymentStore;
    private final SubscriptionLedger ledger;
    private final AccessFinalizer accessFinalizer;
    private final OutboxService outboxService;
    private final MembershipMetrics metrics;
    private final Clock clock;

    @Transactional
    public IngestionResult ingest(UserProfile profile, Payment payment) {
        if (profile.getUserId() != payment.getUserId()) {
            throw new IllegalArgumentException(
                "Payment user " + payment.getUserId() + " does not match profile user " + profile.getUserId());
        }

        Instant started = clock.instant();
        String source = payment.getSource().name().toLowerCase();
        MDC.put(CorrelationContext.USER_ID_MDC_KEY, String.valueOf(payment.getUserId()));
        try {
            userService.touch(profile);

            RecordResult recorded = paymentStore.record(payment);
            Payment stored = recorded.getPayment();
            MDC.put(CorrelationContext.PAYMENT_ID_MDC_KEY, stored.getId().toString());

            SubscriptionTransition transition = null;
            if (recorded.isInserted() || !stored.isApplied()) {
                transition = ledger.apply(stored);
                accessFinalizer.requestFinalization(stored.getUserId());
                outboxService.saveEvent(OutboxEvent.AGGREGATE_PAYMENT, stored.getId(),
                        PaymentAcceptedEvent.from(stored, transition, clock.instant()));
            } else {
                if (stored.getUserId() != payment.getUserId()) {
                    log.warn("Duplicate payment key reported for a different user: key={}, storedUserId={}, reportedUserId={}",
                            payment.naturalKey(), stored.getUserId(), payment.getUserId());
                }
                accessFinalizer.requestFinalizationIfIdle(stored.getUserId());
            }

            metrics.recordPaymentIngested(source, recorded.getOutcome().name());
            metrics.recordIngestionLatency(source, Duration.between(started, clock.instant()));
            log.info("Payment ingested: outcome={}, key={}, kind={}, amount={}, source={}, expiresAt={}",
                    recorded.getOutcome(), payment.naturalKey(), payment.getKind(), payment.getAmount(), source,
                    transition != null ? transition.getExpiresAt() : null);

            return new IngestionResult(recorded.getOutcome(), stored, transition);
        } finally {
            MDC.remove(CorrelationContext.USER_ID_MDC_KEY);
            MDC.remove(CorrelationContext.PAYMENT_ID_MDC_KEY);
        }
    }
}
