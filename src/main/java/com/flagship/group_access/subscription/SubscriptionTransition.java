package com.flagship.group_access.subscription;

import lombok.Value;

import java.time.Instant;
import java.util.UUID;

/**
 * What one {@link SubscriptionLedger#apply} did to a user's subscription.
 * {@code changed == false} means the payment had already been applied and nothing moved.
 */
@Value
public class SubscriptionTransition {
    long userId;
    UUID subscriptionId;
    SubscriptionStatus fromStatus;
    SubscriptionStatus toStatus;
    Instant previousExpiresAt;
    Instant expiresAt;
    boolean changed;

    static SubscriptionTransition of(Subscription before, Subscription after, boolean created) {
        return new SubscriptionTransition(
            after.getUserId(),
            after.getId(),
            created ? null : before.getStatus(),
            after.getStatus(),
            created ? null : before.getExpiresAt(),
            after.getExpiresAt(),
            true
        );
    }

    static SubscriptionTransition unchanged(long userId, Subscription current) {
        return new SubscriptionTransition(
            userId,
            current != null ? current.getId() : null,
            current != null ? current.getStatus() : null,
            current != null ? current.getStatus() : null,
            current != null ? current.getExpiresAt() : null,
            current != null ? current.getExpiresAt() : null,
            false
        );
    }
}
