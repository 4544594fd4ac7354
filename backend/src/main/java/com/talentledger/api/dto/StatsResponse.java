package com.talentledger.api.dto;

/**
 * GET /api/v1/stats response.
 */
public record StatsResponse(
        long totalAgreements,
        long activeAgreements,
        long completedAgreements,
        long companies,
        long talents,
        String totalVolumeWei,
        String totalVolume,
        String platformFeesWei,
        String platformFees,
        long paidMilestones
) {
}
