package com.flagship.group_access.reconciliation;

import jakarta.persistence.LockModeType;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Lock;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.time.Instant;
import java.util.Optional;

@Repository
public interface ReconciliationCursorRepository extends JpaRepository<ReconciliationCursorEntity, Integer> {

    int SINGLETON_ID = 1;

    @Lock(LockModeType.PESSIMISTIC_WRITE)
    @Query("SELECT c FROM ReconciliationCursorEntity c WHERE c.id = :id")
    Optional<ReconciliationCursorEntity> findByIdForUpdate(@Param("id") Integer id);

    @Modifying
    @Query(value = """
        INSERT INTO reconciliation_cursor (id, last_seen_at, last_seen_tx_id, updated_at)
        VALUES (1, :initial, NULL, :now)
        ON CONFLICT (id) DO NOTHING
        """, nativeQuery = true)
    int initializeIfMissing(@Param("initial") Instant initial, @Param("now") Instant now);
}
