package com.talentledger.projection;

import java.util.List;

/**
 * Result of comparing stored aggregates with a fresh fold of the activity log.
 */
public record AggregateVerification(long recordsFolded, int profilesChecked, List<String> mismatches) {

    public boolean consistent() {
        return mismatches.isEmpty();
    }
}
