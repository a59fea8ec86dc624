package com.flagship.group_access.lifecycle;

import com.flagship.group_access.access.GroupAccessPlatform;
import com.flagship.group_access.access.PlatformCallException;
import com.flagship.group_access.config.MembershipProperties;
import com.flagship.group_access.exemption.ExemptionRegistry;
import com.flagship.group_access.observability.MembershipMetrics;
import com.flagship.group_access.subscription.RevocationStatus;
import com.flagship.group_access.subscription.Subscription;
import com.flagship.group_access.subscription.SubscriptionLedger;
import com.flagship.group_access.subscription.SubscriptionRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.data.domain.PageRequest;
import org.springframework.data.domain.Pageable;
import org.springframework.stereotype.Service;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

/**
 * Time-driven subscription transitions.
 *
 * A sweep runs five passes in order: grace entry, expiry, pending revocations, pending renewal
 * stops and expiry reminders. Each row is changed in its own transaction through
 * {@link SubscriptionLedger}, which re-checks eligibility under the member's lock.
 *
 * Platform calls are made outside any transaction. Their failure is recorded on the row and
 * retried by later sweeps; it never undoes or blocks a state transition. A removal is dropped
 * instead of attempted when the member has paid access again.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class LifecycleScheduler {

    private final SubscriptionLedger ledger;
    private final SubscriptionRepository repository;
    private final GroupAccessPlatform platform;
    private final ExemptionRegistry exemptionRegistry;
    private final MembershipProperties properties;
    private final MembershipMetrics metrics;

    public List<LifecycleTransition> sweep(Instant now) {
        return sweep(now, () -> { });
    }

    /**
     * @param heartbeat run between passes; an exception from it aborts the rest of the sweep
     */
    public List<LifecycleTransition> sweep(Instant now, Runnable heartbeat) {
        List<LifecycleTransition> transitions = new ArrayList<>();
        Pageable batch = PageRequest.of(0, properties.getLifecycle().getBatchSize());

        for (UUID id : repository.findActiveExpiredBefore(now, batch)) {
            ledger.enterGrace(id, now).ifPresent(s ->
                transitions.add(transition(LifecycleTransition.Type.GRACE_STARTED, s, now)));
        }

        heartbeat.run();
        for (UUID id : repository.findGraceEndedBefore(now, batch)) {
            ledger.expire(id, exemptionRegistry::isExempt, now).ifPresent(s ->
                transitions.add(transition(
                    s.getRevocationStatus() == RevocationStatus.SKIPPED_EXEMPT
                        ? LifecycleTransition.Type.EXPIRED_EXEMPT
                        : LifecycleTransition.Type.EXPIRED,
                    s, now)));
        }

        heartbeat.run();
        for (UUID id : repository.findPendingRevocations(batch)) {
            revoke(id, now).ifPresent(transitions::add);
        }

        heartbeat.run();
        for (UUID id : repository.findPendingRenewalStops(batch)) {
            stopRenewal(id, now).ifPresent(transitions::add);
        }

        heartbeat.run();
        Instant horizon = now.plus(properties.getLifecycle().getReminderLead());
        for (UUID id : repository.findDueForReminder(now, horizon, batch)) {
            ledger.sendExpiryReminder(id, now).ifPresent(s ->
                transitions.add(transition(LifecycleTransition.Type.REMINDER_SENT, s, now)));
        }

        if (!transitions.isEmpty()) {
            log.info("Lifecycle sweep finished: at={}, transitions={}", now, transitions.size());
        }
        return transitions;
    }

    private Optional<LifecycleTransition> revoke(UUID subscriptionId, Instant now) {
        Optional<Subscription> pending = ledger.find(subscriptionId)
            .filter(s -> s.getRevocationStatus() == RevocationStatus.PENDING);
        if (pending.isEmpty()) {
            return Optional.empty();
        }
        long userId = pending.get().getUserId();

        if (ledger.hasActiveAccess(userId, now)) {
            return ledger.supersedeRevocation(subscriptionId, now).map(s -> {
                metrics.recordRevocation("superseded");
                return transition(LifecycleTransition.Type.REVOCATION_SUPERSEDED, s, now);
            });
        }

        String error = null;
        try {
            platform.revokeAccess(userId);
        } catch (PlatformCallException e) {
            error = e.getErrorCode() + ": " + e.getMessage();
            log.warn("Revocation failed: userId={}, subscriptionId={}, kind={}, error={}",
                    userId, subscriptionId, e.getKind(), error);
        }

        Optional<Subscription> recorded = ledger.recordRevocation(subscriptionId, error == null, error, now);
        return recorded.map(s -> {
            LifecycleTransition.Type type;
            if (s.getRevocationStatus() == RevocationStatus.DONE) {
                type = LifecycleTransition.Type.REVOKED;
                metrics.recordRevocation("revoked");
                log.info("Access revoked: userId={}, subscriptionId={}", userId, subscriptionId);
            } else if (s.getRevocationStatus() == RevocationStatus.GAVE_UP) {
                type = LifecycleTransition.Type.REVOCATION_GAVE_UP;
                metrics.recordRevocation("gave_up");
                log.error("Gave up revoking access after {} attempts: userId={}, subscriptionId={}, lastError={}",
                        s.getRevokeAttempts(), userId, subscriptionId, s.getLastRevokeError());
            } else {
                type = LifecycleTransition.Type.REVOCATION_FAILED;
                metrics.recordRevocation("failed");
            }
            return transition(type, s, now);
        });
    }

    private Optional<LifecycleTransition> stopRenewal(UUID subscriptionId, Instant now) {
        Optional<Subscription> pending = ledger.find(subscriptionId).filter(Subscription::isRenewalStopPending);
        if (pending.isEmpty()) {
            return Optional.empty();
        }
        Subscription subscription = pending.get();

        try {
            platform.stopRecurringCharges(subscription.getUserId(), subscription.getRecurringChargeId());
        } catch (PlatformCallException e) {
            String error = e.getErrorCode() + ": " + e.getMessage();
            boolean fatal = e.getKind() == PlatformCallException.Kind.FATAL;
            return ledger.recordRenewalStopFailure(subscriptionId, error, fatal, now).map(s -> {
                if (s.isRenewalStopPending()) {
                    log.warn("Stopping renewal failed, will retry: userId={}, subscriptionId={}, attempt={}, error={}",
                            s.getUserId(), subscriptionId, s.getRenewalStopAttempts(), error);
                    return transition(LifecycleTransition.Type.RENEWAL_STOP_FAILED, s, now);
                }
                log.error("Gave up stopping renewal after {} attempts: userId={}, subscriptionId={}, kind={}, error={}",
                        s.getRenewalStopAttempts(), s.getUserId(), subscriptionId, e.getKind(), error);
                return transition(LifecycleTransition.Type.RENEWAL_STOP_GAVE_UP, s, now);
            });
        }

        return ledger.markRenewalStopped(subscriptionId, now)
            .map(s -> transition(LifecycleTransition.Type.RENEWAL_STOPPED, s, now));
    }

    private static LifecycleTransition transition(LifecycleTransition.Type type, Subscription subscription, Instant at) {
        return new LifecycleTransition(type, subscription.getUserId(), subscription.getId(), at);
    }
}
