package com.talentledger.reconcile.engine;

/**
 * Outcome of releasing a held partition.
 *
 * @param resolved  entries applied (or found already applied) in this release
 * @param remaining entries still open afterwards
 * @param stoppedAt idempotency key of the entry that failed again and re-held the partition; null when fully drained
 */
public record ReleaseResult(String partitionKey, int resolved, int remaining, String stoppedAt) {

    public boolean drained() {
        return stoppedAt == null;
    }
}
