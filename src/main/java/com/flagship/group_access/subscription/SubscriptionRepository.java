package com.flagship.group_access.subscription;

import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.time.Instant;
import java.util.Collection;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

/**
 * Sweep queries return ids only. Each row is then re-read and changed under the owner's
 * user lock, so a payment arriving mid-sweep is never overwritten.
 */
@Repository
public interface SubscriptionRepository extends JpaRepository<SubscriptionEntity, UUID> {

    Optional<SubscriptionEntity> findFirstByUserIdAndStatusIn(Long userId, Collection<SubscriptionStatus> statuses);

    Optional<SubscriptionEntity> findFirstByUserIdOrderByCreatedAtDesc(Long userId);

    long countByStatus(SubscriptionStatus status);

    @Query("SELECT s.userId FROM SubscriptionEntity s WHERE s.id = :id")
    Optional<Long> findUserIdById(@Param("id") UUID id);

    @Query("""
        SELECT s.id FROM SubscriptionEntity s
        WHERE s.status = com.flagship.group_access.subscription.SubscriptionStatus.ACTIVE
          AND s.expiresAt < :now
        ORDER BY s.expiresAt ASC
        """)
    List<UUID> findActiveExpiredBefore(@Param("now") Instant now, Pageable page);

    @Query("""
        SELECT s.id FROM SubscriptionEntity s
        WHERE s.status = com.flagship.group_access.subscription.SubscriptionStatus.GRACE
          AND s.graceUntil < :now
        ORDER BY s.graceUntil ASC
        """)
    List<UUID> findGraceEndedBefore(@Param("now") Instant now, Pageable page);

    @Query("""
        SELECT s.id FROM SubscriptionEntity s
        WHERE s.revocationStatus = com.flagship.group_access.subscription.RevocationStatus.PENDING
        ORDER BY s.updatedAt ASC
        """)
    List<UUID> findPendingRevocations(Pageable page);

    List<SubscriptionEntity> findByUserIdAndRevocationStatus(Long userId, RevocationStatus revocationStatus);

    @Query("""
        SELECT s.id FROM SubscriptionEntity s
        WHERE s.renewalStopPending = true
        ORDER BY s.updatedAt ASC
        """)
    List<UUID> findPendingRenewalStops(Pageable page);

    /**
     * One-time subscriptions that run out within the reminder lead and have not been reminded.
     */
    @Query("""
        SELECT s.id FROM SubscriptionEntity s
        WHERE s.status = com.flagship.group_access.subscription.SubscriptionStatus.ACTIVE
          AND s.recurring = false
          AND s.reminderSentAt IS NULL
          AND s.expiresAt > :now
          AND s.expiresAt <= :horizon
        ORDER BY s.expiresAt ASC
        """)
    List<UUID> findDueForReminder(@Param("now") Instant now, @Param("horizon") Instant horizon, Pageable page);
}
