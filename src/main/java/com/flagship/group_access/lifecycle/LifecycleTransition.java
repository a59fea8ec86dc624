package com.flagship.group_access.lifecycle;

import lombok.Value;

import java.time.Instant;
import java.util.UUID;

/**
 * One change made by a sweep.
 */
@Value
public class LifecycleTransition {

    public enum Type {
        GRACE_STARTED,
        EXPIRED,
        EXPIRED_EXEMPT,
        REVOKED,
        REVOCATION_FAILED,
        REVOCATION_GAVE_UP,
        REVOCATION_SUPERSEDED,
        RENEWAL_STOPPED,
        RENEWAL_STOP_FAILED,
        RENEWAL_STOP_GAVE_UP,
        REMINDER_SENT
    }

    Type type;
    long userId;
    UUID subscriptionId;
    Instant at;
}
