package com.flagship.group_access.payment;

import lombok.Value;

import java.time.Instant;
import java.util.UUID;

/**
 * An accepted payment. Immutable once recorded.
 *
 * Identified for deduplication by its natural keys: the platform charge id and/or the id of the
 * matching transaction in the platform's ledger. At least one must be present.
 * {@code subscriptionId} and {@code appliedAt} are set exactly once, when the subscription
 * ledger consumes the payment.
 */
@Value
public class Payment {
    UUID id;
    long userId;
    String chargeId;
    String externalTxId;
    long amount;
    String currency;
    PaymentKind kind;
    boolean recurring;
    Instant createdAt;
    Instant subscriptionExpirationHint;
    String invoicePayload;
    PaymentSource source;
    UUID subscriptionId;
    Instant appliedAt;

    /**
     * Creates a payment that has not been recorded yet.
     *
     * @throws IllegalArgumentException if both natural keys are missing or the amount is negative
     */
    public static Payment create(long userId, String chargeId, String externalTxId, long amount,
                                 String currency, PaymentKind kind, Instant createdAt,
                                 Instant subscriptionExpirationHint, String invoicePayload,
                                 PaymentSource source) {
        if (isBlank(chargeId) && isBlank(externalTxId)) {
            throw new IllegalArgumentException("Payment needs a charge id or an external transaction id");
        }
        if (amount < 0) {
            throw new IllegalArgumentException("Payment amount must not be negative: " + amount);
        }
        if (kind == null) {
            throw new IllegalArgumentException("Payment kind is required");
        }
        if (createdAt == null) {
            throw new IllegalArgumentException("Payment time is required");
        }
        return new Payment(
            UUID.randomUUID(),
            userId,
            isBlank(chargeId) ? null : chargeId,
            isBlank(externalTxId) ? null : externalTxId,
            amount,
            currency,
            kind,
            kind.isRecurring(),
            createdAt,
            kind.isRecurring() ? subscriptionExpirationHint : null,
            invoicePayload,
            source,
            null,
            null
        );
    }

    public boolean isApplied() {
        return appliedAt != null;
    }

    /**
     * Natural key used in logs and by the key cache: the charge id when known, else the ledger id.
     */
    public String naturalKey() {
        return chargeId != null ? "charge:" + chargeId : "tx:" + externalTxId;
    }

    private static boolean isBlank(String value) {
        return value == null || value.isBlank();
    }
}
