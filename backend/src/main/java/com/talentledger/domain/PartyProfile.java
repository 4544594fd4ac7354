package com.talentledger.domain;

import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;
import org.springframework.data.annotation.Id;
import org.springframework.data.mongodb.core.mapping.Document;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.ArrayList;
import java.util.EnumSet;
import java.util.List;
import java.util.Set;

/**
 * Per-address aggregate. Id is the lowercase 0x address. Reputation counters are derived from activity records
 * and only ever incremented; profile text fields are user-supplied and untouched by reconciliation.
 */
@Document(collection = "party_profiles")
@NoArgsConstructor
@Getter
@Setter
@EqualsAndHashCode(onlyExplicitlyIncluded = true)
public class PartyProfile {

    @Id
    @EqualsAndHashCode.Include
    private String id;
    private Set<PartyRole> roles = EnumSet.noneOf(PartyRole.class);
    private String displayName;
    private String bio;
    private String companyName;
    private String title;
    private List<String> skills = new ArrayList<>();
    private Reputation reputation = new Reputation();
    private List<CredentialRef> credentials = new ArrayList<>();
    private Long nonce;
    private Instant createdAt;
    private Instant updatedAt;

    /** COMPANY, TALENT or BOTH; null when no role is known yet. */
    public String userType() {
        if (roles == null || roles.isEmpty()) {
            return null;
        }
        if (roles.size() > 1) {
            return "BOTH";
        }
        return roles.iterator().next().name();
    }

    @NoArgsConstructor
    @Getter
    @Setter
    public static class Reputation {
        /** Reserved; not derived from ledger activity. */
        private BigDecimal rating = BigDecimal.ZERO;
        private long totalContracts;
        private long completedContracts;
        private long disputedContracts;
        private long cancelledContracts;
        private long finalizedContracts;
        private BigDecimal totalEarned = BigDecimal.ZERO;
        private BigDecimal totalSpent = BigDecimal.ZERO;
    }

    /** Soulbound skill credential held by the party. Added once per token id. */
    @NoArgsConstructor
    @Getter
    @Setter
    public static class CredentialRef {
        private Long tokenId;
        private String skillName;
        private String issuer;
        private Instant issuedAt;
    }
}
