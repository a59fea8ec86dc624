package com.flagship.group_access.payment;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.EnumType;
import jakarta.persistence.Enumerated;
import jakarta.persistence.Id;
import jakarta.persistence.Table;
import lombok.AccessLevel;
import lombok.Getter;
import lombok.NoArgsConstructor;
import org.hibernate.annotations.Immutable;

import java.time.Instant;
import java.util.UUID;

/**
 * Read-only mapping of the payments table.
 *
 * Rows are written by {@link PaymentStore} through JDBC only, because the insert has to be a
 * single conflict-aware statement. No setters, and Hibernate never issues updates for it.
 */
@Entity
@Immutable
@Table(name = "payments")
@Getter
@NoArgsConstructor(access = AccessLevel.PROTECTED)
public class PaymentEntity {

    @Id
    @Column(nullable = false, updatable = false)
    private UUID id;

    @Column(name = "user_id", nullable = false)
    private Long userId;

    @Column(name = "charge_id")
    private String chargeId;

    @Column(name = "external_tx_id")
    private String externalTxId;

    @Column(nullable = false)
    private long amount;

    @Column(nullable = false, length = 8)
    private String currency;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, length = 30)
    private PaymentKind kind;

    @Column(name = "is_recurring", nullable = false)
    private boolean recurring;

    @Column(name = "subscription_expiration_hint")
    private Instant subscriptionExpirationHint;

    @Column(name = "invoice_payload")
    private String invoicePayload;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, length = 20)
    private PaymentSource source;

    @Column(name = "created_at", nullable = false)
    private Instant createdAt;

    @Column(name = "subscription_id")
    private UUID subscriptionId;

    @Column(name = "applied_at")
    private Instant appliedAt;

    public Payment toDomain() {
        return new Payment(
            id,
            userId,
            chargeId,
            externalTxId,
            amount,
            currency,
            kind,
            recurring,
            createdAt,
            subscriptionExpirationHint,
            invoicePayload,
            source,
            subscriptionId,
            appliedAt
        );
    }
}
