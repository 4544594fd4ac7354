package com.talentledger.api.dto;

import com.talentledger.common.AmountFormat;
import com.talentledger.domain.PartyProfile;

import java.time.Instant;
import java.util.List;

/**
 * GET /api/v1/parties/{address} response.
 */
public record PartyProfileResponse(
        String address,
        String userType,
        String displayName,
        String companyName,
        List<String> skills,
        long totalContracts,
        long completedContracts,
        long disputedContracts,
        long cancelledContracts,
        long finalizedContracts,
        String totalEarned,
        String totalSpent,
        List<CredentialEntry> credentials,
        Instant updatedAt
) {

    public record CredentialEntry(Long tokenId, String skillName, String issuer, Instant issuedAt) {
    }

    public static PartyProfileResponse from(PartyProfile p) {
        PartyProfile.Reputation r = p.getReputation() != null ? p.getReputation() : new PartyProfile.Reputation();
        List<CredentialEntry> credentials = p.getCredentials() == null ? List.of() : p.getCredentials().stream()
                .map(c -> new CredentialEntry(c.getTokenId(), c.getSkillName(), c.getIssuer(), c.getIssuedAt()))
                .toList();
        return new PartyProfileResponse(
                p.getId(),
                p.userType(),
                p.getDisplayName(),
                p.getCompanyName(),
                p.getSkills() != null ? p.getSkills() : List.of(),
                r.getTotalContracts(),
                r.getCompletedContracts(),
                r.getDisputedContracts(),
                r.getCancelledContracts(),
                r.getFinalizedContracts(),
                AmountFormat.toEther(r.getTotalEarned()),
                AmountFormat.toEther(r.getTotalSpent()),
                credentials,
                p.getUpdatedAt());
    }
}
