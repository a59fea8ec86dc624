package com.flagship.group_access.payment;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.core.RowMapper;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Timestamp;
import java.time.Clock;
import java.time.Instant;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

/**
 * Durable record of every accepted payment and the authority on duplicates.
 *
 * Invariants, enforced by partial unique indexes rather than by lookups:
 * 1. At most one row per non-null charge_id
 * 2. At most one row per non-null external_tx_id
 *
 * The live path and reconciliation may race on the same payment. Both run the same single
 * {@code INSERT ... ON CONFLICT DO NOTHING}; the loser sees no returned row and loads the winner.
 * The statement does not abort the surrounding transaction on conflict.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class PaymentStore {

    private static final String COLUMNS =
        "id, user_id, charge_id, external_tx_id, amount, currency, kind, is_recurring, created_at, " +
        "subscription_expiration_hint, invoice_payload, source, subscription_id, applied_at";

    private final JdbcTemplate jdbcTemplate;
    private final PaymentRepository paymentRepository;
    private final PaymentKeyCache keyCache;
    private final Clock clock;

    /**
     * Records a payment unless one with the same charge id or external transaction id exists.
     * Never throws for a duplicate.
     */
    @Transactional
    public RecordResult record(Payment payment) {
        Optional<UUID> cachedId = keyCache.lookup(payment.getChargeId(), payment.getExternalTxId());
        if (cachedId.isPresent()) {
            Optional<Payment> cached = findRow("id = ?", cachedId.get());
            if (cached.isPresent()) {
                log.debug("Duplicate payment detected by key cache: key={}, paymentId={}",
                        payment.naturalKey(), cachedId.get());
                return RecordResult.alreadyExists(cached.get());
            }
        }

        List<UUID> inserted = jdbcTemplate.query(
            "INSERT INTO payments (id, user_id, charge_id, external_tx_id, amount, currency, kind, is_recurring, " +
            "created_at, subscription_expiration_hint, invoice_payload, source) " +
            "VALUES (?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?) " +
            "ON CONFLICT DO NOTHING RETURNING id",
            (rs, rowNum) -> rs.getObject("id", UUID.class),
            payment.getId(),
            payment.getUserId(),
            payment.getChargeId(),
            payment.getExternalTxId(),
            payment.getAmount(),
            payment.getCurrency(),
            payment.getKind().name(),
            payment.isRecurring(),
            Timestamp.from(payment.getCreatedAt()),
            toTimestamp(payment.getSubscriptionExpirationHint()),
            payment.getInvoicePayload(),
            payment.getSource().name()
        );

        if (!inserted.isEmpty()) {
            keyCache.remember(payment);
            log.debug("Recorded payment: paymentId={}, key={}, kind={}",
                    payment.getId(), payment.naturalKey(), payment.getKind());
            return RecordResult.inserted(payment);
        }

        Payment existing = findByNaturalKey(payment.getChargeId(), payment.getExternalTxId())
            .orElseThrow(() -> new IllegalStateException(
                "Payment insert conflicted but no row matches key " + payment.naturalKey()));
        keyCache.remember(existing);
        log.debug("Duplicate payment: key={}, existingPaymentId={}", payment.naturalKey(), existing.getId());
        return RecordResult.alreadyExists(existing);
    }

    /**
     * Links a payment to the subscription it extended. Succeeds once per payment.
     *
     * @return false if the payment was already applied
     */
    @Transactional
    public boolean markApplied(UUID paymentId, UUID subscriptionId) {
        int updated = jdbcTemplate.update(
            "UPDATE payments SET subscription_id = ?, applied_at = ? WHERE id = ? AND applied_at IS NULL",
            subscriptionId,
            Timestamp.from(clock.instant()),
            paymentId
        );
        return updated == 1;
    }

    /**
     * Looks a payment up by charge id first, then by external transaction id.
     */
    @Transactional(readOnly = true)
    public Optional<Payment> findByNaturalKey(String chargeId, String externalTxId) {
        Optional<Payment> found = Optional.empty();
        if (chargeId != null) {
            found = findRow("charge_id = ?", chargeId);
        }
        if (found.isEmpty() && externalTxId != null) {
            found = findRow("external_tx_id = ?", externalTxId);
        }
        return found;
    }

    @Transactional(readOnly = true)
    public Optional<Payment> findById(UUID paymentId) {
        return paymentRepository.findById(paymentId).map(PaymentEntity::toDomain);
    }

    @Transactional(readOnly = true)
    public List<Payment> findByUser(long userId) {
        return paymentRepository.findByUserIdOrderByCreatedAtDesc(userId).stream()
            .map(PaymentEntity::toDomain)
            .toList();
    }

    private Optional<Payment> findRow(String condition, Object arg) {
        List<Payment> rows = jdbcTemplate.query(
            "SELECT " + COLUMNS + " FROM payments WHERE " + condition,
            paymentRowMapper(),
            arg
        );
        return rows.stream().findFirst();
    }

    private RowMapper<Payment> paymentRowMapper() {
        return (rs, rowNum) -> new Payment(
            rs.getObject("id", UUID.class),
            rs.getLong("user_id"),
            rs.getString("charge_id"),
            rs.getString("external_tx_id"),
            rs.getLong("amount"),
            rs.getString("currency"),
            PaymentKind.valueOf(rs.getString("kind")),
            rs.getBoolean("is_recurring"),
            toInstant(rs, "created_at"),
            toInstant(rs, "subscription_expiration_hint"),
            rs.getString("invoice_payload"),
            PaymentSource.valueOf(rs.getString("source")),
            rs.getObject("subscription_id", UUID.class),
            toInstant(rs, "applied_at")
        );
    }

    private static Instant toInstant(ResultSet rs, String column) throws SQLException {
        Timestamp ts = rs.getTimestamp(column);
        return ts != null ? ts.toInstant() : null;
    }

    private static Timestamp toTimestamp(Instant instant) {
        return instant != null ? Timestamp.from(instant) : null;
    }
}
