package com.flagship.group_access.payment.event;

import com.flagship.group_access.outbox.DomainEvent;
import com.flagship.group_access.payment.Payment;
import com.flagship.group_access.subscription.SubscriptionTransition;
import lombok.Value;

import java.time.Instant;
import java.util.UUID;

/**
 * A new payment was recorded and applied. Published once per payment, whichever path saw it first.
 */
@Value
public class PaymentAcceptedEvent implements DomainEvent {
    UUID eventId;
    UUID paymentId;
    long userId;
    long amount;
    String currency;
    String kind;
    String source;
    UUID subscriptionId;
    Instant expiresAt;
    Instant occurredAt;

    public static final String EVENT_TYPE = "PaymentAccepted";

    @Override
    public String getEventType() {
        return EVENT_TYPE;
    }

    public static PaymentAcceptedEvent from(Payment payment, SubscriptionTransition transition, Instant now) {
        return new PaymentAcceptedEvent(
            UUID.randomUUID(),
            payment.getId(),
            payment.getUserId(),
            payment.getAmount(),
            payment.getCurrency(),
            payment.getKind().name(),
            payment.getSource().name(),
            transition.getSubscriptionId(),
            transition.getExpiresAt(),
            now
        );
    }
}
