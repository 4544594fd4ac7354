package com.talentledger.reconcile.engine;

public enum ReconcileOutcome {
    /** Record, mirror, aggregates and watermark committed. */
    APPLIED,
    /** Already applied or already parked under this idempotency key. */
    DUPLICATE,
    /** Could not be applied; stored for operator review and the partition is held. */
    QUARANTINED,
    /** Parked behind an earlier quarantined notification of the same partition. */
    HELD
}
