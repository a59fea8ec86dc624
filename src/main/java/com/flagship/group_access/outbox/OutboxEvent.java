package com.flagship.group_access.outbox;

import lombok.Value;

import java.time.Instant;
import java.util.UUID;

/**
 * A membership or payment fact waiting to be published to Kafka.
 *
 * Written in the same transaction as the state change it describes, so a committed
 * grace transition or accepted payment always has its notification queued.
 */
@Value
public class OutboxEvent {

    public static final String AGGREGATE_PAYMENT = "Payment";
    public static final String AGGREGATE_SUBSCRIPTION = "Subscription";

    UUID id;
    String aggregateType;
    UUID aggregateId;
    String eventType;          // e.g. "GracePeriodStarted"
    String partitionKey;       // platform user id, keeps one member's events ordered
    String payload;            // JSON
    Instant createdAt;
    Instant publishedAt;
    int retryCount;
    String lastError;
    Long sequenceNumber;

    public static OutboxEvent create(String aggregateType, UUID aggregateId, String eventType,
                                     String partitionKey, String payload, Instant createdAt) {
        return new OutboxEvent(
            UUID.randomUUID(),
            aggregateType,
            aggregateId,
            eventType,
            partitionKey,
            payload,
            createdAt,
            null,
            0,
            null,
            null   // assigned by database
        );
    }

    public boolean isPublished() {
        return publishedAt != null;
    }
}
