package com.flagship.group_access.payment;

import lombok.Value;

/**
 * Outcome of {@link PaymentStore#record}. A duplicate is a normal outcome, not an error;
 * it carries the row that was recorded first.
 */
@Value
public class RecordResult {

    public enum Outcome {
        INSERTED,
        ALREADY_EXISTS
    }

    Outcome outcome;
    Payment payment;

    public static RecordResult inserted(Payment payment) {
        return new RecordResult(Outcome.INSERTED, payment);
    }

    public static RecordResult alreadyExists(Payment payment) {
        return new RecordResult(Outcome.ALREADY_EXISTS, payment);
    }

    public boolean isInserted() {
        return outcome == Outcome.INSERTED;
    }
}
