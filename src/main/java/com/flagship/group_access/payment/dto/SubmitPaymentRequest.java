package com.flagship.group_access.payment.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.flagship.group_access.payment.PaymentKind;
import jakarta.validation.constraints.AssertTrue;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Pattern;
import jakarta.validation.constraints.Positive;
import jakarta.validation.constraints.PositiveOrZero;
import jakarta.validation.constraints.Size;
import lombok.Value;

import java.time.Instant;

/**
 * A successful payment as forwarded by the webhook layer, after it has checked transport authenticity.
 */
@Value
public class SubmitPaymentRequest {

    @NotNull(message = "User id is required")
    @Positive(message = "User id must be positive")
    @JsonProperty("user_id")
    Long userId;

    @Size(max = 64)
    @JsonProperty("username")
    String username;

    @Size(max = 256)
    @JsonProperty("first_name")
    String firstName;

    @Size(max = 256)
    @JsonProperty("last_name")
    String lastName;

    @Size(max = 16)
    @JsonProperty("language_code")
    String languageCode;

    @Size(max = 255)
    @Pattern(regexp = "^[A-Za-z0-9_:.\\-]*$", message = "Charge id contains invalid characters")
    @JsonProperty("charge_id")
    String chargeId;

    @Size(max = 255)
    @Pattern(regexp = "^[A-Za-z0-9_:.\\-]*$", message = "External transaction id contains invalid characters")
    @JsonProperty("external_tx_id")
    String externalTxId;

    @NotNull(message = "Amount is required")
    @PositiveOrZero(message = "Amount must not be negative")
    @JsonProperty("amount")
    Long amount;

    @Pattern(regexp = "^[A-Z]{3}$", message = "Currency must be a 3-letter code")
    @JsonProperty("currency")
    String currency;

    @NotNull(message = "Kind is required")
    @JsonProperty("kind")
    PaymentKind kind;

    /** Expiry reported by the platform for recurring charges. */
    @JsonProperty("subscription_expiration_date")
    Instant subscriptionExpirationDate;

    @Size(max = 128)
    @JsonProperty("invoice_payload")
    String invoicePayload;

    /** When the platform accepted the payment; defaults to receipt time. */
    @JsonProperty("paid_at")
    Instant paidAt;

    @AssertTrue(message = "charge_id or external_tx_id is required")
    public boolean isNaturalKeyPresent() {
        return (chargeId != null && !chargeId.isBlank()) || (externalTxId != null && !externalTxId.isBlank());
    }
}
