package com.flagship.group_access.reconciliation;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Instant;

/**
 * Reads and moves the reconciliation cursor. Only the reconciliation engine calls this.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class ReconciliationCursorService {

    private final ReconciliationCursorRepository repository;

    /**
     * The stored cursor position, created at {@code initial} on first use.
     */
    @Transactional
    public Instant currentPosition(Instant initial, Instant now) {
        if (repository.initializeIfMissing(initial, now) == 1) {
            log.info("Reconciliation cursor initialized: lastSeenAt={}", initial);
        }
        return repository.findByIdForUpdate(ReconciliationCursorRepository.SINGLETON_ID)
            .map(ReconciliationCursorEntity::getLastSeenAt)
            .orElseThrow(() -> new IllegalStateException("Reconciliation cursor row missing"));
    }

    /**
     * Ledger offset the next run starts from, 0 before the first run.
     */
    @Transactional(readOnly = true)
    public int resumeOffset() {
        return repository.findById(ReconciliationCursorRepository.SINGLETON_ID)
            .map(ReconciliationCursorEntity::getResumeOffset)
            .orElse(0);
    }

    /**
     * @return the cursor position after the call, never earlier than before
     */
    @Transactional
    public Instant advance(Instant seenAt, String txId, int nextOffset, Instant now) {
        ReconciliationCursorEntity cursor = repository.findByIdForUpdate(ReconciliationCursorRepository.SINGLETON_ID)
            .orElseThrow(() -> new IllegalStateException("Reconciliation cursor row missing"));
        Instant before = cursor.getLastSeenAt();
        int offsetBefore = cursor.getResumeOffset();
        if (cursor.advance(seenAt, txId, nextOffset, now)) {
            log.info("Reconciliation cursor advanced: {} -> {}, txId={}", before, seenAt, txId);
        }
        if (cursor.getResumeOffset() != offsetBefore) {
            log.info("Reconciliation resume offset moved: {} -> {}", offsetBefore, cursor.getResumeOffset());
        }
        return cursor.getLastSeenAt();
    }
}
