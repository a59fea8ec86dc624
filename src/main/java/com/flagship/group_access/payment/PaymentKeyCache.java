package com.flagship.group_access.payment;

import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.data.redis.core.StringRedisTemplate;
import org.springframework.stereotype.Component;
import org.springframework.transaction.support.TransactionSynchronization;
import org.springframework.transaction.support.TransactionSynchronizationManager;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

/**
 * Redis fast path for duplicate deliveries: natural key to payment id.
 *
 * The payments table stays the authority. A miss, a stale entry or an unreachable Redis
 * only means the database decides. Entries are written after the recording transaction
 * commits, so a rolled-back insert never leaves a mapping behind.
 */
@Component
@Slf4j
public class PaymentKeyCache {

    private static final String REDIS_KEY_PREFIX = "payment-key:";

    private final Optional<StringRedisTemplate> redisTemplate;
    private final Duration ttl;

    public PaymentKeyCache(Optional<StringRedisTemplate> redisTemplate,
                           @Value("${membership.payment-key-cache.ttl:P7D}") Duration ttl) {
        this.redisTemplate = redisTemplate;
        this.ttl = ttl;
    }

    /**
     * @return the id of a payment already recorded under one of the keys, if Redis knows it
     */
    public Optional<UUID> lookup(String chargeId, String externalTxId) {
        if (redisTemplate.isEmpty()) {
            return Optional.empty();
        }
        for (String key : keysOf(chargeId, externalTxId)) {
            try {
                String paymentId = redisTemplate.get().opsForValue().get(key);
                if (paymentId != null) {
                    log.debug("Payment key found in Redis: {}", key);
                    return Optional.of(UUID.fromString(paymentId));
                }
            } catch (Exception e) {
                log.warn("Redis lookup failed for payment key: {}. Falling back to database. Error: {}",
                        key, e.getMessage());
                return Optional.empty();
            }
        }
        return Optional.empty();
    }

    /**
     * Stores the mapping once the current transaction commits, or immediately when none is active.
     */
    public void remember(Payment payment) {
        if (redisTemplate.isEmpty()) {
            return;
        }
        if (TransactionSynchronizationManager.isSynchronizationActive()) {
            TransactionSynchronizationManager.registerSynchronization(new TransactionSynchronization() {
                @Override
                public void afterCommit() {
                    store(payment);
                }
            });
        } else {
            store(payment);
        }
    }

    private void store(Payment payment) {
        for (String key : keysOf(payment.getChargeId(), payment.getExternalTxId())) {
            try {
                redisTemplate.get().opsForValue().set(key, payment.getId().toString(), ttl);
            } catch (Exception e) {
                log.warn("Failed to cache payment key in Redis: {}. Error: {}", key, e.getMessage());
                return;
            }
        }
    }

    private static List<String> keysOf(String chargeId, String externalTxId) {
        List<String> keys = new ArrayList<>(2);
        if (chargeId != null) {
            keys.add(REDIS_KEY_PREFIX + "charge:" + chargeId);
        }
        if (externalTxId != null) {
            keys.add(REDIS_KEY_PREFIX + "tx:" + externalTxId);
        }
        return keys;
    }
}
