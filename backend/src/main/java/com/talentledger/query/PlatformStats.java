package com.talentledger.query;

import java.math.BigDecimal;

/**
 * Platform-wide counters; amounts in wei.
 */
public record PlatformStats(
        long totalAgreements,
        long activeAgreements,
        long completedAgreements,
        long companies,
        long talents,
        BigDecimal totalVolume,
        BigDecimal platformFees,
        long paidMilestones
) {
}
