package com.flagship.group_access.subscription;

import com.flagship.group_access.config.MembershipProperties;
import com.flagship.group_access.payment.Payment;
import lombok.Builder;
import lombok.Value;

import java.time.Duration;
import java.time.Instant;
import java.util.UUID;

/**
 * A user's access window and lifecycle state.
 *
 * Transitions return a new instance and reject moves the state machine does not allow:
 * <pre>
 * PENDING --payment--> ACTIVE --expires_at passed--> GRACE --grace_until passed--> EXPIRED
 *                        ^                             |
 *                        +-----------payment-----------+
 * </pre>
 * Cancelling a paid row only records {@code cancelledAt} and turns off renewal. The row keeps
 * expiring on its own schedule and is reported as CANCELLED while it is still open.
 */
@Value
@Builder(toBuilder = true)
public class Subscription {
    UUID id;
    long userId;
    SubscriptionStatus status;
    Instant expiresAt;
    Instant graceUntil;
    Instant graceStartedAt;
    boolean recurring;
    String recurringChargeId;
    Instant cancelledAt;
    boolean renewalStopPending;
    int renewalStopAttempts;
    String lastRenewalStopError;
    Instant reminderSentAt;
    RevocationStatus revocationStatus;
    int revokeAttempts;
    String lastRevokeError;
    Instant revokedAt;
    Instant createdAt;
    Instant updatedAt;

    public static Subscription pending(long userId, Instant now) {
        return Subscription.builder()
            .id(UUID.randomUUID())
            .userId(userId)
            .status(SubscriptionStatus.PENDING)
            .revocationStatus(RevocationStatus.NOT_REQUIRED)
            .createdAt(now)
            .updatedAt(now)
            .build();
    }

    /**
     * Extends the window by one payment and (re)activates the row.
     *
     * One-time: {@code max(now, expiresAt) + oneTimePeriod}, recurring flag unchanged.
     * Recurring: the platform-reported expiry when present, else {@code (expiresAt or payment time) + renewalPeriod}.
     * The result never moves {@code expiresAt} backwards.
     *
     * @throws IllegalStateException if the row is not open
     */
    public Subscription applyPayment(Payment payment, MembershipProperties.Plan plan, Instant now) {
        if (!status.isOpen()) {
            throw new IllegalStateException(
                String.format("Cannot apply payment %s to subscription %s in %s status", payment.getId(), id, status));
        }

        Instant newExpiresAt;
        boolean newRecurring;
        String newChargeId = recurringChargeId;
        boolean newStopPending = renewalStopPending;

        if (payment.getKind().isRecurring()) {
            Instant candidate = payment.getSubscriptionExpirationHint() != null
                ? payment.getSubscriptionExpirationHint()
                : (expiresAt != null ? expiresAt : payment.getCreatedAt()).plus(plan.getRenewalPeriod());
            newExpiresAt = latest(candidate, expiresAt);
            newRecurring = true;
            if (payment.getChargeId() != null) {
                newChargeId = payment.getChargeId();
            }
            newStopPending = false;
        } else {
            Instant base = latest(now, expiresAt);
            newExpiresAt = base.plus(plan.getOneTimePeriod());
            newRecurring = recurring;
        }

        return toBuilder()
            .status(SubscriptionStatus.ACTIVE)
            .expiresAt(newExpiresAt)
            .graceUntil(null)
            .graceStartedAt(null)
            .recurring(newRecurring)
            .recurringChargeId(newChargeId)
            .cancelledAt(null)
            .renewalStopPending(newStopPending)
            .reminderSentAt(null)
            .updatedAt(now)
            .build();
    }

    /**
     * @throws IllegalStateException unless ACTIVE
     */
    public Subscription enterGrace(Duration gracePeriod, Instant now) {
        if (status != SubscriptionStatus.ACTIVE) {
            throw new IllegalStateException(
                String.format("Cannot start grace for subscription %s in %s status. Only ACTIVE subscriptions can.", id, status));
        }
        return toBuilder()
            .status(SubscriptionStatus.GRACE)
            .graceUntil(expiresAt.plus(gracePeriod))
            .graceStartedAt(now)
            .updatedAt(now)
            .build();
    }

    /**
     * Ends the grace period. An exempt member keeps group membership; everyone else is queued for revocation.
     *
     * @throws IllegalStateException unless GRACE
     */
    public Subscription expire(boolean exempt, Instant now) {
        if (status != SubscriptionStatus.GRACE) {
            throw new IllegalStateException(
                String.format("Cannot expire subscription %s in %s status. Only GRACE subscriptions can.", id, status));
        }
        return toBuilder()
            .status(SubscriptionStatus.EXPIRED)
            .graceUntil(null)
            .revocationStatus(exempt ? RevocationStatus.SKIPPED_EXEMPT : RevocationStatus.PENDING)
            .revokeAttempts(0)
            .lastRevokeError(null)
            .updatedAt(now)
            .build();
    }

    public Subscription revocationSucceeded(Instant now) {
        requireRevocationPending();
        return toBuilder()
            .revocationStatus(RevocationStatus.DONE)
            .revokeAttempts(revokeAttempts + 1)
            .lastRevokeError(null)
            .revokedAt(now)
            .updatedAt(now)
            .build();
    }

    /**
     * Records a failed removal; after {@code maxAttempts} failures the row is GAVE_UP.
     */
    public Subscription revocationFailed(String error, int maxAttempts, Instant now) {
        requireRevocationPending();
        int attempts = revokeAttempts + 1;
        return toBuilder()
            .revocationStatus(attempts >= maxAttempts ? RevocationStatus.GAVE_UP : RevocationStatus.PENDING)
            .revokeAttempts(attempts)
            .lastRevokeError(error)
            .updatedAt(now)
            .build();
    }

    /**
     * Drops a pending removal because the member has paid access again.
     */
    public Subscription revocationSuperseded(Instant now) {
        requireRevocationPending();
        return toBuilder()
            .revocationStatus(RevocationStatus.SUPERSEDED)
            .updatedAt(now)
            .build();
    }

    /**
     * Turns off renewal. Idempotent for a row already cancelled. A pending row is closed outright.
     *
     * @throws IllegalStateException if the row is not open
     */
    public Subscription cancel(Instant now) {
        if (!status.isOpen()) {
            throw new IllegalStateException(
                String.format("Cannot cancel subscription %s in %s status", id, status));
        }
        if (status == SubscriptionStatus.PENDING) {
            return toBuilder()
                .status(SubscriptionStatus.CANCELLED)
                .cancelledAt(now)
                .updatedAt(now)
                .build();
        }
        if (cancelledAt != null) {
            return this;
        }
        return toBuilder()
            .cancelledAt(now)
            .recurring(false)
            .renewalStopPending(recurringChargeId != null && recurring)
            .renewalStopAttempts(0)
            .lastRenewalStopError(null)
            .updatedAt(now)
            .build();
    }

    public Subscription renewalStopped(Instant now) {
        return toBuilder()
            .renewalStopPending(false)
            .lastRenewalStopError(null)
            .updatedAt(now)
            .build();
    }

    /**
     * Records a failed attempt to stop platform-side renewal. A fatal error, or the
     * {@code maxAttempts}-th failure, clears the pending flag so the row leaves the queue.
     */
    public Subscription renewalStopFailed(String error, boolean fatal, int maxAttempts, Instant now) {
        if (!renewalStopPending) {
            throw new IllegalStateException(
                String.format("Subscription %s has no pending renewal stop", id));
        }
        int attempts = renewalStopAttempts + 1;
        return toBuilder()
            .renewalStopPending(!fatal && attempts < maxAttempts)
            .renewalStopAttempts(attempts)
            .lastRenewalStopError(error)
            .updatedAt(now)
            .build();
    }

    public Subscription reminderSent(Instant now) {
        return toBuilder()
            .reminderSentAt(now)
            .updatedAt(now)
            .build();
    }

    /**
     * Status as reported to users: an open, paid row the user cancelled reads as CANCELLED.
     */
    public SubscriptionStatus effectiveStatus() {
        if (cancelledAt != null && (status == SubscriptionStatus.ACTIVE || status == SubscriptionStatus.GRACE)) {
            return SubscriptionStatus.CANCELLED;
        }
        return status;
    }

    /**
     * True while the member is entitled to be in the group. An ACTIVE row past its expiry that the
     * sweep has not reached yet is still inside its grace window.
     */
    public boolean hasAccessAt(Instant now, Duration gracePeriod) {
        return switch (status) {
            case ACTIVE -> expiresAt != null && expiresAt.plus(gracePeriod).isAfter(now);
            case GRACE -> graceUntil != null && graceUntil.isAfter(now);
            default -> false;
        };
    }

    private void requireRevocationPending() {
        if (revocationStatus != RevocationStatus.PENDING) {
            throw new IllegalStateException(
                String.format("Subscription %s has no pending revocation (%s)", id, revocationStatus));
        }
    }

    private static Instant latest(Instant a, Instant b) {
        if (b == null) {
            return a;
        }
        return a.isAfter(b) ? a : b;
    }
}
