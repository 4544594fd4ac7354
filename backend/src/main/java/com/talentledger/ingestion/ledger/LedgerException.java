package com.talentledger.ingestion.ledger;

/**
 * Base type of failures reported by {@link LedgerClient}.
 */
public abstract class LedgerException extends RuntimeException {

    protected LedgerException(String message) {
        super(message);
    }

    protected LedgerException(String message, Throwable cause) {
        super(message, cause);
    }
}
