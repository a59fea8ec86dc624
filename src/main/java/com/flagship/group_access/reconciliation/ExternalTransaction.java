package com.flagship.group_access.reconciliation;

import lombok.Value;

import java.time.Instant;

/**
 * One entry of the platform's transaction ledger.
 *
 * {@code userId} is null for entries that are not an incoming payment from a user
 * (withdrawals, refunds, ad spend). {@code chargeId} is the charge id the live payment
 * event carried for the same payment, when the platform exposes it.
 */
@Value
public class ExternalTransaction {
    String id;
    String chargeId;
    Long userId;
    long amount;
    Instant occurredAt;
    boolean recurring;
    String invoicePayload;

    public boolean isIncomingUserPayment() {
        return userId != null && amount > 0;
    }
}
