package com.talentledger.projection;

import java.math.BigInteger;
import java.util.Map;

public record FoldedAggregates(
        Map<String, ProfileTotals> profiles,
        BigInteger totalVolume,
        BigInteger totalPlatformFees,
        long paidMilestones,
        long recordsFolded
) {
}
