package com.flagship.group_access.outbox;

import java.time.Instant;
import java.util.UUID;

/**
 * A fact about one member, serialized as the outbox payload.
 */
public interface DomainEvent {

    /**
     * Lets consumers drop redelivered copies.
     */
    UUID getEventId();

    long getUserId();

    Instant getOccurredAt();

    String getEventType();
}
