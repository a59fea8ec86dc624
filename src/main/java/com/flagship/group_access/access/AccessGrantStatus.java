package com.flagship.group_access.access;

public enum AccessGrantStatus {
    /** Waiting for its next attempt. */
    PENDING,
    GRANTED,
    /** Stopped by a non-retryable platform answer. */
    FAILED,
    /** Retry budget spent. The member keeps paid access and can recover through self-service. */
    EXHAUSTED
}
