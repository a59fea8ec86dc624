package com.flagship.group_access.subscription.event;

import com.flagship.group_access.outbox.DomainEvent;
import com.flagship.group_access.subscription.RevocationStatus;
import com.flagship.group_access.subscription.Subscription;
import lombok.Value;

import java.time.Instant;
import java.util.UUID;

/**
 * Grace ran out. {@code revocationStatus} tells consumers whether the member is being removed
 * (PENDING) or stays as an exempt member (SKIPPED_EXEMPT).
 */
@Value
public class AccessExpiredEvent implements DomainEvent {
    UUID eventId;
    long userId;
    UUID subscriptionId;
    Instant expiresAt;
    RevocationStatus revocationStatus;
    Instant occurredAt;

    public static final String EVENT_TYPE = "AccessExpired";

    @Override
    public String getEventType() {
        return EVENT_TYPE;
    }

    public static AccessExpiredEvent from(Subscription subscription, Instant now) {
        return new AccessExpiredEvent(
            UUID.randomUUID(),
            subscription.getUserId(),
            subscription.getId(),
            subscription.getExpiresAt(),
            subscription.getRevocationStatus(),
            now
        );
    }
}
