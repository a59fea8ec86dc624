package com.flagship.group_access.reconciliation;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.Id;
import jakarta.persistence.Table;
import lombok.AccessLevel;
import lombok.Getter;
import lombok.NoArgsConstructor;

import java.time.Instant;

/**
 * The single row (id = 1) recording how far reconciliation has read the external ledger.
 */
@Entity
@Table(name = "reconciliation_cursor")
@Getter
@NoArgsConstructor(access = AccessLevel.PROTECTED)
public class ReconciliationCursorEntity {

    @Id
    @Column(nullable = false, updatable = false)
    private Integer id;

    @Column(name = "last_seen_at", nullable = false)
    private Instant lastSeenAt;

    @Column(name = "last_seen_tx_id")
    private String lastSeenTxId;

    /** Ledger offset the next run starts reading from. */
    @Column(name = "resume_offset", nullable = false)
    private int resumeOffset;

    /** Time of the last successful run, whether or not it moved the cursor. */
    @Column(name = "updated_at", nullable = false)
    private Instant updatedAt;

    /**
     * Moves the cursor forward to {@code seenAt} and the resume offset forward to {@code nextOffset}.
     * An older timestamp or a smaller offset leaves the respective value where it is.
     *
     * @return true if the cursor timestamp moved
     */
    boolean advance(Instant seenAt, String txId, int nextOffset, Instant now) {
        this.updatedAt = now;
        if (nextOffset > resumeOffset) {
            this.resumeOffset = nextOffset;
        }
        if (seenAt == null || !seenAt.isAfter(lastSeenAt)) {
            return false;
        }
        this.lastSeenAt = seenAt;
        this.lastSeenTxId = txId;
        return true;
    }
}
