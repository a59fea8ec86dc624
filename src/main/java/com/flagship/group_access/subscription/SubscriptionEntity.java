package com.flagship.group_access.subscription;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.EnumType;
import jakarta.persistence.Enumerated;
import jakarta.persistence.Id;
import jakarta.persistence.Index;
import jakarta.persistence.Table;
import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Getter;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.UUID;

/**
 * JPA entity for the subscriptions table.
 *
 * No setters: every change goes through a {@link Subscription} transition and
 * {@link #updateFromDomain}, so the entity cannot drift from the state machine.
 * Identity, owner and creation time are not updatable.
 */
@Entity
@Table(
    name = "subscriptions",
    indexes = {
        @Index(name = "idx_subscriptions_status_expires", columnList = "status, expires_at"),
        @Index(name = "idx_subscriptions_status_grace", columnList = "status, grace_until")
    }
)
@Getter
@NoArgsConstructor(access = AccessLevel.PROTECTED)
@AllArgsConstructor(access = AccessLevel.PRIVATE)
public class SubscriptionEntity {

    @Id
    @Column(nullable = false, updatable = false)
    private UUID id;

    @Column(name = "user_id", nullable = false, updatable = false)
    private Long userId;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, length = 20)
    private SubscriptionStatus status;

    @Column(name = "expires_at")
    private Instant expiresAt;

    @Column(name = "grace_until")
    private Instant graceUntil;

    @Column(name = "grace_started_at")
    private Instant graceStartedAt;

    @Column(name = "is_recurring", nullable = false)
    private boolean recurring;

    @Column(name = "recurring_charge_id")
    private String recurringChargeId;

    @Column(name = "cancelled_at")
    private Instant cancelledAt;

    @Column(name = "renewal_stop_pending", nullable = false)
    private boolean renewalStopPending;

    @Column(name = "renewal_stop_attempts", nullable = false)
    private int renewalStopAttempts;

    @Column(name = "last_renewal_stop_error", columnDefinition = "TEXT")
    private String lastRenewalStopError;

    @Column(name = "reminder_sent_at")
    private Instant reminderSentAt;

    @Enumerated(EnumType.STRING)
    @Column(name = "revocation_status", nullable = false, length = 20)
    private RevocationStatus revocationStatus;

    @Column(name = "revoke_attempts", nullable = false)
    private int revokeAttempts;

    @Column(name = "last_revoke_error", columnDefinition = "TEXT")
    private String lastRevokeError;

    @Column(name = "revoked_at")
    private Instant revokedAt;

    @Column(name = "created_at", nullable = false, updatable = false)
    private Instant createdAt;

    @Column(name = "updated_at", nullable = false)
    private Instant updatedAt;

    static SubscriptionEntity fromDomain(Subscription s) {
        return new SubscriptionEntity(
            s.getId(),
            s.getUserId(),
            s.getStatus(),
            s.getExpiresAt(),
            s.getGraceUntil(),
            s.getGraceStartedAt(),
            s.isRecurring(),
            s.getRecurringChargeId(),
            s.getCancelledAt(),
            s.isRenewalStopPending(),
            s.getRenewalStopAttempts(),
            s.getLastRenewalStopError(),
            s.getReminderSentAt(),
            s.getRevocationStatus(),
            s.getRevokeAttempts(),
            s.getLastRevokeError(),
            s.getRevokedAt(),
            s.getCreatedAt(),
            s.getUpdatedAt()
        );
    }

    public Subscription toDomain() {
        return new Subscription(
            id,
            userId,
            status,
            expiresAt,
            graceUntil,
            graceStartedAt,
            recurring,
            recurringChargeId,
            cancelledAt,
            renewalStopPending,
            renewalStopAttempts,
            lastRenewalStopError,
            reminderSentAt,
            revocationStatus,
            revokeAttempts,
            lastRevokeError,
            revokedAt,
            createdAt,
            updatedAt
        );
    }

    void updateFromDomain(Subscription s) {
        if (!s.getId().equals(id)) {
            throw new IllegalArgumentException("Subscription id mismatch: " + s.getId() + " != " + id);
        }
        this.status = s.getStatus();
        this.expiresAt = s.getExpiresAt();
        this.graceUntil = s.getGraceUntil();
        this.graceStartedAt = s.getGraceStartedAt();
        this.recurring = s.isRecurring();
        this.recurringChargeId = s.getRecurringChargeId();
        this.cancelledAt = s.getCancelledAt();
        this.renewalStopPending = s.isRenewalStopPending();
        this.renewalStopAttempts = s.getRenewalStopAttempts();
        this.lastRenewalStopError = s.getLastRenewalStopError();
        this.reminderSentAt = s.getReminderSentAt();
        this.revocationStatus = s.getRevocationStatus();
        this.revokeAttempts = s.getRevokeAttempts();
        this.lastRevokeError = s.getLastRevokeError();
        this.revokedAt = s.getRevokedAt();
        this.updatedAt = s.getUpdatedAt();
    }
}
