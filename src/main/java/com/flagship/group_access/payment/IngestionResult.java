package com.flagship.group_access.payment;

import com.flagship.group_access.subscription.SubscriptionTransition;
import lombok.Value;

/**
 * What the ingestion path did with one submitted payment.
 * {@code transition} is null for a duplicate that had already been applied.
 */
@Value
public class IngestionResult {
    RecordResult.Outcome outcome;
    Payment payment;
    SubscriptionTransition transition;

    public boolean isInserted() {
        return outcome == RecordResult.Outcome.INSERTED;
    }
}
