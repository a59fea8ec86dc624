package com.flagship.group_access.payment;

import com.flagship.group_access.config.MembershipProperties;
import com.flagship.group_access.payment.dto.IngestionResponse;
import com.flagship.group_access.payment.dto.PaymentResponse;
import com.flagship.group_access.payment.dto.SubmitPaymentRequest;
import com.flagship.group_access.subscription.SubscriptionLedger;
import com.flagship.group_access.subscription.dto.SubscriptionStatusResponse;
import com.flagship.group_access.user.UserProfile;
import com.flagship.group_access.user.UserService;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.time.Clock;
import java.util.List;
import java.util.UUID;

/**
 * Entry points used by the webhook layer.
 *
 * Submitting is idempotent on the payment's natural keys: a redelivered payment answers
 * 202 with outcome ALREADY_EXISTS and the id of the row recorded first.
 */
@RestController
@RequestMapping("/api/payments")
@RequiredArgsConstructor
@Slf4j
public class PaymentController {

    private final PaymentIngestionService ingestionService;
    private final PaymentStore paymentStore;
    private final SubscriptionLedger ledger;
    private final UserService userService;
    private final MembershipProperties properties;
    private final Clock clock;

    @PostMapping
    public ResponseEntity<IngestionResponse> submitPayment(@Valid @RequestBody SubmitPaymentRequest request) {
        log.info("Received payment: userId={}, chargeId={}, externalTxId={}, kind={}, amount={}",
                request.getUserId(), request.getChargeId(), request.getExternalTxId(),
                request.getKind(), request.getAmount());

        UserProfile profile = new UserProfile(
            request.getUserId(),
            request.getUsername(),
            request.getFirstName(),
            request.getLastName(),
            request.getLanguageCode());

        Payment payment = Payment.create(
            request.getUserId(),
            request.getChargeId(),
            request.getExternalTxId(),
            request.getAmount(),
            request.getCurrency() != null ? request.getCurrency() : properties.getPlan().getCurrency(),
            request.getKind(),
            request.getPaidAt() != null ? request.getPaidAt() : clock.instant(),
            request.getSubscriptionExpirationDate(),
            request.getInvoicePayload(),
            PaymentSource.LIVE);

        IngestionResult result = ingestionService.ingest(profile, payment);
        return ResponseEntity.status(HttpStatus.ACCEPTED).body(IngestionResponse.from(result));
    }

    /**
     * Called when an invoice is sent, so the member shows as PENDING until the payment lands.
     */
    @PostMapping("/pending/{userId}")
    public ResponseEntity<SubscriptionStatusResponse> markPending(@PathVariable("userId") long userId) {
        userService.touch(UserProfile.idOnly(userId));
        return ResponseEntity.ok(SubscriptionStatusResponse.from(ledger.markPending(userId)));
    }

    @GetMapping("/{id}")
    public ResponseEntity<PaymentResponse> getPayment(@PathVariable("id") UUID id) {
        return paymentStore.findById(id)
            .map(payment -> ResponseEntity.ok(PaymentResponse.from(payment)))
            .orElse(ResponseEntity.notFound().build());
    }

    @GetMapping("/users/{userId}")
    public List<PaymentResponse> getPaymentsForUser(@PathVariable("userId") long userId) {
        return paymentStore.findByUser(userId).stream()
            .map(PaymentResponse::from)
            .toList();
    }
}
