package com.flagship.group_access.subscription.event;

import com.flagship.group_access.outbox.DomainEvent;
import com.flagship.group_access.subscription.Subscription;
import lombok.Value;

import java.time.Instant;
import java.util.UUID;

@Value
public class ExpiryReminderEvent implements DomainEvent {
    UUID eventId;
    long userId;
    UUID subscriptionId;
    Instant expiresAt;
    Instant occurredAt;

    public static final String EVENT_TYPE = "ExpiryReminder";

    @Override
    public String getEventType() {
        return EVENT_TYPE;
    }

    public static ExpiryReminderEvent from(Subscription subscription, Instant now) {
        return new ExpiryReminderEvent(
            UUID.randomUUID(),
            subscription.getUserId(),
            subscription.getId(),
            subscription.getExpiresAt(),
            now
        );
    }
}
