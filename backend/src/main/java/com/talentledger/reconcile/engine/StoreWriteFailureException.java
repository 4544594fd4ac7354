package com.talentledger.reconcile.engine;

/**
 * A transient failure of the reconciliation commit (connection, write conflict, timeout). Retried.
 */
public class StoreWriteFailureException extends RuntimeException {

    public StoreWriteFailureException(String message, Throwable cause) {
        super(message, cause);
    }
}
