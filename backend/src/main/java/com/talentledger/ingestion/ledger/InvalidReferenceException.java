package com.talentledger.ingestion.ledger;

/**
 * The referenced agreement, milestone or credential does not exist on the ledger.
 */
public class InvalidReferenceException extends LedgerException {

    public InvalidReferenceException(String message) {
        super(message);
    }

    public InvalidReferenceException(String message, Throwable cause) {
        super(message, cause);
    }
}
