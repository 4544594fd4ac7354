package com.talentledger.ingestion.ledger;

/**
 * The ledger could not be queried (connection, HTTP, timeout, node error). Transient.
 */
public class UnreachableSourceException extends LedgerException {

    public UnreachableSourceException(String message) {
        super(message);
    }

    public UnreachableSourceException(String message, Throwable cause) {
        super(message, cause);
    }
}
