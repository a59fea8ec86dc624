package com.flagship.group_access.payment.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.flagship.group_access.payment.IngestionResult;
import com.flagship.group_access.payment.RecordResult;
import lombok.Builder;
import lombok.Value;

import java.time.Instant;
import java.util.UUID;

@Value
@Builder
public class IngestionResponse {

    @JsonProperty("outcome")
    RecordResult.Outcome outcome;

    @JsonProperty("payment_id")
    UUID paymentId;

    @JsonProperty("user_id")
    long userId;

    /** Subscription expiry after this payment; absent for a duplicate. */
    @JsonProperty("expires_at")
    Instant expiresAt;

    public static IngestionResponse from(IngestionResult result) {
        return IngestionResponse.builder()
            .outcome(result.getOutcome())
            .paymentId(result.getPayment().getId())
            .userId(result.getPayment().getUserId())
            .expiresAt(result.getTransition() != null ? result.getTransition().getExpiresAt() : null)
            .build();
    }
}
