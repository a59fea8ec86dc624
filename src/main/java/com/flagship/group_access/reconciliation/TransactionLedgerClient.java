package com.flagship.group_access.reconciliation;

import java.time.Instant;

/**
 * Read access to the platform's authoritative transaction ledger.
 */
public interface TransactionLedgerClient {

    /**
     * Returns transactions in chronological order, starting {@code offset} entries into the whole
     * ledger. Offsets are absolute so a run can resume where an earlier one stopped.
     * {@code since} is the start of the caller's window; it never shifts offsets, and the caller
     * filters out older entries itself.
     *
     * @throws LedgerFetchException if the page cannot be read
     */
    LedgerPage fetchPage(Instant since, int offset, int limit);
}
