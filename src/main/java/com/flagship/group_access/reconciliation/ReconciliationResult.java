package com.flagship.group_access.reconciliation;

import lombok.Builder;
import lombok.Value;

import java.time.Instant;

/**
 * Summary of one reconciliation run. On FAILED the cursor is where it was before the run.
 */
@Value
@Builder
public class ReconciliationResult {

    public enum Status {
        COMPLETED,
        /** Stopped at the page limit; the next run resumes at the offset reached. */
        TRUNCATED,
        FAILED
    }

    Status status;
    int paymentsFound;
    int paymentsInserted;
    int pagesFetched;
    Instant windowStart;
    Instant windowEnd;
    Instant cursorAdvancedTo;
    /** Ledger offset this run started reading at. */
    int startOffset;
    /** Ledger offset the next run starts at. */
    int nextOffset;
    String error;
}
