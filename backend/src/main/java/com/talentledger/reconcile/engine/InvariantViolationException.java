package com.talentledger.reconcile.engine;

/**
 * Notification and ledger state contradict each other or would move local state backward. Never applied.
 */
public class InvariantViolationException extends RuntimeException {

    public InvariantViolationException(String message) {
        super(message);
    }
}
