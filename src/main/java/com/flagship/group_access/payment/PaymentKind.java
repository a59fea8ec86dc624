package com.flagship.group_access.payment;

public enum PaymentKind {
    ONE_TIME,
    RECURRING_INITIAL,
    RECURRING_RENEWAL;

    public boolean isRecurring() {
        return this != ONE_TIME;
    }
}
