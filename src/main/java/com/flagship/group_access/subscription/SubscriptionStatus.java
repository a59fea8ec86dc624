package com.flagship.group_access.subscription;

public enum SubscriptionStatus {
    /** Invoice issued, nothing paid yet. */
    PENDING,
    ACTIVE,
    GRACE,
    EXPIRED,
    /** Terminal state for a pending row closed before any payment. Paid rows keep their ACTIVE/GRACE track when cancelled. */
    CANCELLED;

    /**
     * Open rows count against the one-per-user uniqueness constraint.
     */
    public boolean isOpen() {
        return this == PENDING || this == ACTIVE || this == GRACE;
    }
}
