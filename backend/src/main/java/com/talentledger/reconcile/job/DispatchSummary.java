package com.talentledger.reconcile.job;

import com.talentledger.reconcile.engine.ReconcileOutcome;

import java.util.Collections;
import java.util.EnumMap;
import java.util.Map;

/**
 * Outcome counts of one dispatched batch.
 */
public record DispatchSummary(Map<ReconcileOutcome, Integer> counts) {

    public static final DispatchSummary EMPTY = new DispatchSummary(new EnumMap<>(ReconcileOutcome.class));

    public DispatchSummary {
        Map<ReconcileOutcome, Integer> copy = new EnumMap<>(ReconcileOutcome.class);
        copy.putAll(counts);
        counts = Collections.unmodifiableMap(copy);
    }

    public int count(ReconcileOutcome outcome) {
        return counts.getOrDefault(outcome, 0);
    }

    public int total() {
        return counts.values().stream().mapToInt(Integer::intValue).sum();
    }
}
