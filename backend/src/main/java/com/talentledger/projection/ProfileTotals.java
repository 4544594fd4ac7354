package com.talentledger.projection;

import com.talentledger.domain.PartyProfile;
import com.talentledger.domain.PartyRole;
import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.ToString;

import java.math.BigDecimal;
import java.math.BigInteger;
import java.util.ArrayList;
import java.util.EnumSet;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * Comparable form of one party's derived aggregates, built either by folding deltas or from a stored profile.
 */
@Getter
@EqualsAndHashCode(exclude = "credentialRefs")
@ToString(exclude = "credentialRefs")
public class ProfileTotals {

    private final Set<PartyRole> roles = EnumSet.noneOf(PartyRole.class);
    private long totalContracts;
    private long completedContracts;
    private long disputedContracts;
    private long cancelledContracts;
    private long finalizedContracts;
    private BigInteger totalEarned = BigInteger.ZERO;
    private BigInteger totalSpent = BigInteger.ZERO;
    private final Set<Long> credentialTokenIds = new LinkedHashSet<>();
    private final List<PartyProfile.CredentialRef> credentialRefs = new ArrayList<>();

    void add(ProfileDelta d) {
        if (d.role() != null) {
            roles.add(d.role());
        }
        totalContracts += d.totalContracts();
        completedContracts += d.completedContracts();
        disputedContracts += d.disputedContracts();
        cancelledContracts += d.cancelledContracts();
        finalizedContracts += d.finalizedContracts();
        totalEarned = totalEarned.add(d.totalEarned());
        totalSpent = totalSpent.add(d.totalSpent());
        if (d.credential() != null && credentialTokenIds.add(d.credential().getTokenId())) {
            credentialRefs.add(d.credential());
        }
    }

    static ProfileTotals of(PartyProfile profile) {
        ProfileTotals t = new ProfileTotals();
        if (profile.getRoles() != null) {
            t.roles.addAll(profile.getRoles());
        }
        PartyProfile.Reputation r = profile.getReputation() != null ? profile.getReputation() : new PartyProfile.Reputation();
        t.totalContracts = r.getTotalContracts();
        t.completedContracts = r.getCompletedContracts();
        t.disputedContracts = r.getDisputedContracts();
        t.cancelledContracts = r.getCancelledContracts();
        t.finalizedContracts = r.getFinalizedContracts();
        t.totalEarned = toWei(r.getTotalEarned());
        t.totalSpent = toWei(r.getTotalSpent());
        if (profile.getCredentials() != null) {
            profile.getCredentials().forEach(c -> t.credentialTokenIds.add(c.getTokenId()));
        }
        return t;
    }

    private static BigInteger toWei(BigDecimal value) {
        return value == null ? BigInteger.ZERO : value.toBigInteger();
    }
}
