package com.flagship.group_access.payment.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.flagship.group_access.payment.Payment;
import com.flagship.group_access.payment.PaymentKind;
import com.flagship.group_access.payment.PaymentSource;
import lombok.Builder;
import lombok.Value;

import java.time.Instant;
import java.util.UUID;

@Value
@Builder
public class PaymentResponse {

    @JsonProperty("id")
    UUID id;

    @JsonProperty("user_id")
    long userId;

    @JsonProperty("charge_id")
    String chargeId;

    @JsonProperty("external_tx_id")
    String externalTxId;

    @JsonProperty("amount")
    long amount;

    @JsonProperty("currency")
    String currency;

    @JsonProperty("kind")
    PaymentKind kind;

    @JsonProperty("source")
    PaymentSource source;

    @JsonProperty("created_at")
    Instant createdAt;

    @JsonProperty("subscription_id")
    UUID subscriptionId;

    @JsonProperty("applied_at")
    Instant appliedAt;

    public static PaymentResponse from(Payment payment) {
        return PaymentResponse.builder()
            .id(payment.getId())
            .userId(payment.getUserId())
            .chargeId(payment.getChargeId())
            .externalTxId(payment.getExternalTxId())
            .amount(payment.getAmount())
            .currency(payment.getCurrency())
            .kind(payment.getKind())
            .source(payment.getSource())
            .createdAt(payment.getCreatedAt())
            .subscriptionId(payment.getSubscriptionId())
            .appliedAt(payment.getAppliedAt())
            .build();
    }
}
