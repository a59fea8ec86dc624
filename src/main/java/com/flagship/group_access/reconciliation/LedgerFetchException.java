package com.flagship.group_access.reconciliation;

/**
 * The external ledger could not be read. Aborts the reconciliation run.
 */
public class LedgerFetchException extends RuntimeException {

    public LedgerFetchException(String message, Throwable cause) {
        super(message, cause);
    }
}
