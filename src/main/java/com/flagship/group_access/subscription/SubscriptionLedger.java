package com.flagship.group_access.subscription;

import com.flagship.group_access.config.MembershipProperties;
import com.flagship.group_access.observability.MembershipMetrics;
import com.flagship.group_access.outbox.OutboxEvent;
import com.flagship.group_access.outbox.OutboxService;
import com.flagship.group_access.payment.Payment;
import com.flagship.group_access.payment.PaymentStore;
import com.flagship.group_access.subscription.event.AccessExpiredEvent;
import com.flagship.group_access.subscription.event.ExpiryReminderEvent;
import com.flagship.group_access.subscription.event.GracePeriodStartedEvent;
import com.flagship.group_access.user.UserService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;
import java.time.Instant;
import java.util.EnumSet;
import java.util.Optional;
import java.util.Set;
import java.util.UUID;
import java.util.function.LongPredicate;

/**
 * Owner of subscription rows and the only writer of their status.
 *
 * Every write takes the user's row lock first ({@link UserService#lock}), so a payment and a
 * sweep touching the same member run one after the other and never compute from a stale row.
 * At most one open (pending, active or grace) row per user is also enforced by a unique index.
 *
 * Time-driven moves are made one row per transaction and re-check eligibility after locking.
 * A row that changed in between (e.g. renewed while the sweep was queued) is left alone.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class SubscriptionLedger {

    static final Set<SubscriptionStatus> OPEN_STATUSES =
        EnumSet.of(SubscriptionStatus.PENDING, SubscriptionStatus.ACTIVE, SubscriptionStatus.GRACE);

    private final SubscriptionRepository repository;
    private final PaymentStore paymentStore;
    private final UserService userService;
    private final OutboxService outboxService;
    private final MembershipProperties properties;
    private final MembershipMetrics metrics;
    private final Clock clock;

    /**
     * Extends or opens the user's subscription with a recorded payment.
     *
     * Applying the same payment twice is a no-op: the payment is first marked as applied, and
     * only the caller that flips that marker moves {@code expiresAt}.
     */
    @Transactional
    public SubscriptionTransition apply(Payment payment) {
        Instant now = clock.instant();
        userService.lock(payment.getUserId());

        Optional<SubscriptionEntity> open = findOpen(payment.getUserId());
        Subscription current = open.map(SubscriptionEntity::toDomain)
            .orElseGet(() -> Subscription.pending(payment.getUserId(), now));

        if (!paymentStore.markApplied(payment.getId(), current.getId())) {
            log.info("Payment already applied, ledger unchanged: paymentId={}, userId={}",
                    payment.getId(), payment.getUserId());
            return SubscriptionTransition.unchanged(payment.getUserId(), open.map(SubscriptionEntity::toDomain).orElse(null));
        }

        Subscription updated = current.applyPayment(payment, properties.getPlan(), now);
        save(open, updated);
        metrics.recordTransition(updated.getStatus().name());
        supersedePendingRevocations(payment.getUserId(), updated.getId(), now);

        log.info("Subscription extended: userId={}, subscriptionId={}, kind={}, from={}, expiresAt {} -> {}",
                payment.getUserId(), updated.getId(), payment.getKind(),
                open.isPresent() ? current.getStatus() : "NONE", current.getExpiresAt(), updated.getExpiresAt());

        return SubscriptionTransition.of(current, updated, open.isEmpty());
    }

    /**
     * Opens a PENDING row when an invoice is issued. Returns the existing open row if there is one.
     */
    @Transactional
    public Subscription markPending(long userId) {
        userService.lock(userId);
        Optional<SubscriptionEntity> open = findOpen(userId);
        if (open.isPresent()) {
            return open.get().toDomain();
        }
        Subscription pending = Subscription.pending(userId, clock.instant());
        repository.save(SubscriptionEntity.fromDomain(pending));
        log.info("Pending subscription opened: userId={}, subscriptionId={}", userId, pending.getId());
        return pending;
    }

    /**
     * The open row, else the most recent closed one.
     *
     * @throws SubscriptionNotFoundException if the user never had a subscription
     */
    @Transactional(readOnly = true)
    public Subscription getStatus(long userId) {
        return findOpen(userId)
            .or(() -> repository.findFirstByUserIdOrderByCreatedAtDesc(userId))
            .map(SubscriptionEntity::toDomain)
            .orElseThrow(() -> new SubscriptionNotFoundException(userId));
    }

    /**
     * Stops renewal without touching {@code expiresAt}. Access ends when the window and grace run out.
     *
     * @throws SubscriptionNotFoundException if the user has no open subscription
     */
    @Transactional
    public Subscription cancel(long userId) {
        userService.lock(userId);
        SubscriptionEntity entity = findOpen(userId)
            .orElseThrow(() -> new SubscriptionNotFoundException(userId));

        Subscription current = entity.toDomain();
        Subscription cancelled = current.cancel(clock.instant());
        if (cancelled != current) {
            entity.updateFromDomain(cancelled);
            log.info("Subscription cancelled: userId={}, subscriptionId={}, expiresAt={}, renewalStopPending={}",
                    userId, cancelled.getId(), cancelled.getExpiresAt(), cancelled.isRenewalStopPending());
        }
        return cancelled;
    }

    @Transactional(readOnly = true)
    public boolean hasActiveAccess(long userId, Instant now) {
        return findOpen(userId)
            .map(entity -> entity.toDomain().hasAccessAt(now, properties.getPlan().getGracePeriod()))
            .orElse(false);
    }

    @Transactional(readOnly = true)
    public Optional<Subscription> find(UUID subscriptionId) {
        return repository.findById(subscriptionId).map(SubscriptionEntity::toDomain);
    }

    /**
     * ACTIVE to GRACE, with a GracePeriodStarted notification.
     *
     * @return the new state, or empty if the row is no longer ACTIVE past its expiry
     */
    @Transactional
    public Optional<Subscription> enterGrace(UUID subscriptionId, Instant now) {
        return lockAndLoad(subscriptionId)
            .filter(entity -> entity.getStatus() == SubscriptionStatus.ACTIVE
                    && entity.getExpiresAt() != null && entity.getExpiresAt().isBefore(now))
            .map(entity -> {
                Subscription grace = entity.toDomain().enterGrace(properties.getPlan().getGracePeriod(), now);
                entity.updateFromDomain(grace);
                outboxService.saveEvent(OutboxEvent.AGGREGATE_SUBSCRIPTION, grace.getId(),
                        GracePeriodStartedEvent.from(grace, now));
                metrics.recordTransition(SubscriptionStatus.GRACE.name());
                log.info("Grace period started: userId={}, subscriptionId={}, expiresAt={}, graceUntil={}",
                        grace.getUserId(), grace.getId(), grace.getExpiresAt(), grace.getGraceUntil());
                return grace;
            });
    }

    /**
     * GRACE to EXPIRED, with an AccessExpired notification. Exempt members are marked
     * SKIPPED_EXEMPT instead of being queued for removal.
     *
     * @return the new state, or empty if the row is no longer GRACE past its grace end
     */
    @Transactional
    public Optional<Subscription> expire(UUID subscriptionId, LongPredicate isExempt, Instant now) {
        return lockAndLoad(subscriptionId)
            .filter(entity -> entity.getStatus() == SubscriptionStatus.GRACE
                    && entity.getGraceUntil() != null && entity.getGraceUntil().isBefore(now))
            .map(entity -> {
                boolean exempt = isExempt.test(entity.getUserId());
                Subscription expired = entity.toDomain().expire(exempt, now);
                entity.updateFromDomain(expired);
                outboxService.saveEvent(OutboxEvent.AGGREGATE_SUBSCRIPTION, expired.getId(),
                        AccessExpiredEvent.from(expired, now));
                metrics.recordTransition(SubscriptionStatus.EXPIRED.name());
                log.info("Subscription expired: userId={}, subscriptionId={}, revocation={}",
                        expired.getUserId(), expired.getId(), expired.getRevocationStatus());
                return expired;
            });
    }

    /**
     * Records the outcome of one removal attempt. Ignored unless the revocation is still pending.
     */
    @Transactional
    public Optional<Subscription> recordRevocation(UUID subscriptionId, boolean succeeded, String error, Instant now) {
        return lockAndLoad(subscriptionId)
            .filter(entity -> entity.getRevocationStatus() == RevocationStatus.PENDING)
            .map(entity -> {
                Subscription current = entity.toDomain();
                Subscription updated = succeeded
                    ? current.revocationSucceeded(now)
                    : current.revocationFailed(error, properties.getLifecycle().getMaxRevokeAttempts(), now);
                entity.updateFromDomain(updated);
                return updated;
            });
    }

    /**
     * Closes a pending removal without calling the platform because the member has access again.
     * Ignored unless the revocation is still pending.
     */
    @Transactional
    public Optional<Subscription> supersedeRevocation(UUID subscriptionId, Instant now) {
        return lockAndLoad(subscriptionId)
            .filter(entity -> entity.getRevocationStatus() == RevocationStatus.PENDING)
            .map(entity -> {
                Subscription updated = entity.toDomain().revocationSuperseded(now);
                entity.updateFromDomain(updated);
                log.info("Revocation superseded by renewed access: userId={}, subscriptionId={}",
                        updated.getUserId(), updated.getId());
                return updated;
            });
    }

    @Transactional
    public Optional<Subscription> markRenewalStopped(UUID subscriptionId, Instant now) {
        return lockAndLoad(subscriptionId)
            .filter(SubscriptionEntity::isRenewalStopPending)
            .map(entity -> {
                Subscription updated = entity.toDomain().renewalStopped(now);
                entity.updateFromDomain(updated);
                log.info("Renewal stopped: userId={}, subscriptionId={}", updated.getUserId(), updated.getId());
                return updated;
            });
    }

    /**
     * Records a failed renewal stop. Ignored unless the stop is still pending.
     */
    @Transactional
    public Optional<Subscription> recordRenewalStopFailure(UUID subscriptionId, String error, boolean fatal, Instant now) {
        return lockAndLoad(subscriptionId)
            .filter(SubscriptionEntity::isRenewalStopPending)
            .map(entity -> {
                Subscription updated = entity.toDomain().renewalStopFailed(
                        error, fatal, properties.getLifecycle().getMaxRenewalStopAttempts(), now);
                entity.updateFromDomain(updated);
                return updated;
            });
    }

    /**
     * Queues an ExpiryReminder unless the row was renewed, closed or already reminded since it was selected.
     */
    @Transactional
    public Optional<Subscription> sendExpiryReminder(UUID subscriptionId, Instant now) {
        Instant horizon = now.plus(properties.getLifecycle().getReminderLead());
        return lockAndLoad(subscriptionId)
            .filter(entity -> entity.getStatus() == SubscriptionStatus.ACTIVE
                    && !entity.isRecurring()
                    && entity.getReminderSentAt() == null
                    && entity.getExpiresAt() != null
                    && entity.getExpiresAt().isAfter(now)
                    && !entity.getExpiresAt().isAfter(horizon))
            .map(entity -> {
                Subscription reminded = entity.toDomain().reminderSent(now);
                entity.updateFromDomain(reminded);
                outboxService.saveEvent(OutboxEvent.AGGREGATE_SUBSCRIPTION, reminded.getId(),
                        ExpiryReminderEvent.from(reminded, now));
                return reminded;
            });
    }

    /**
     * An expired row still queued for removal must not kick out a member who just paid again.
     */
    private void supersedePendingRevocations(long userId, UUID openId, Instant now) {
        for (SubscriptionEntity entity : repository.findByUserIdAndRevocationStatus(userId, RevocationStatus.PENDING)) {
            if (entity.getId().equals(openId)) {
                continue;
            }
            entity.updateFromDomain(entity.toDomain().revocationSuperseded(now));
            log.info("Revocation superseded by payment: userId={}, subscriptionId={}", userId, entity.getId());
        }
    }

    private Optional<SubscriptionEntity> findOpen(long userId) {
        return repository.findFirstByUserIdAndStatusIn(userId, OPEN_STATUSES);
    }

    private Optional<SubscriptionEntity> lockAndLoad(UUID subscriptionId) {
        return repository.findUserIdById(subscriptionId)
            .flatMap(userId -> {
                userService.lock(userId);
                return repository.findById(subscriptionId);
            });
    }

    private void save(Optional<SubscriptionEntity> existing, Subscription updated) {
        if (existing.isPresent()) {
            existing.get().updateFromDomain(updated);
        } else {
            repository.save(SubscriptionEntity.fromDomain(updated));
        }
    }
}
