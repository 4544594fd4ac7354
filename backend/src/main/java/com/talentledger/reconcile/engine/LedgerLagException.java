package com.talentledger.reconcile.engine;

/**
 * The ledger view queried for a notification has not caught up with the state the notification implies, for
 * example a load-balanced node a block behind. Transient.
 */
public class LedgerLagException extends RuntimeException {

    public LedgerLagException(String message) {
        super(message);
    }
}
