package com.flagship.group_access.subscription.event;

import com.flagship.group_access.outbox.DomainEvent;
import com.flagship.group_access.subscription.Subscription;
import lombok.Value;

import java.time.Instant;
import java.util.UUID;

/**
 * The member's paid period ended; access continues until {@code graceUntil}.
 * The delivery bot turns this into a "renew now" message.
 */
@Value
public class GracePeriodStartedEvent implements DomainEvent {
    UUID eventId;
    long userId;
    UUID subscriptionId;
    Instant expiresAt;
    Instant graceUntil;
    Instant occurredAt;

    public static final String EVENT_TYPE = "GracePeriodStarted";

    @Override
    public String getEventType() {
        return EVENT_TYPE;
    }

    public static GracePeriodStartedEvent from(Subscription subscription, Instant now) {
        return new GracePeriodStartedEvent(
            UUID.randomUUID(),
            subscription.getUserId(),
            subscription.getId(),
            subscription.getExpiresAt(),
            subscription.getGraceUntil(),
            now
        );
    }
}
