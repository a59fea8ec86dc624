package com.flagship.group_access.subscription.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.flagship.group_access.subscription.Subscription;
import com.flagship.group_access.subscription.SubscriptionStatus;
import lombok.Builder;
import lombok.Value;

import java.time.Instant;

/**
 * Read view of a user's subscription. {@code status} is the user-facing status,
 * so a cancelled subscription that has not run out yet reads CANCELLED.
 */
@Value
@Builder
public class SubscriptionStatusResponse {

    @JsonProperty("user_id")
    long userId;

    @JsonProperty("status")
    SubscriptionStatus status;

    @JsonProperty("expires_at")
    Instant expiresAt;

    @JsonProperty("grace_until")
    Instant graceUntil;

    @JsonProperty("is_recurring")
    boolean recurring;

    @JsonProperty("cancelled_at")
    Instant cancelledAt;

    public static SubscriptionStatusResponse from(Subscription subscription) {
        return SubscriptionStatusResponse.builder()
            .userId(subscription.getUserId())
            .status(subscription.effectiveStatus())
            .expiresAt(subscription.getExpiresAt())
            .graceUntil(subscription.getGraceUntil())
            .recurring(subscription.isRecurring())
            .cancelledAt(subscription.getCancelledAt())
            .build();
    }
}
