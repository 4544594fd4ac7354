package com.talentledger.projection;

import com.talentledger.domain.PartyProfile;
import com.talentledger.domain.PartyRole;

import java.math.BigInteger;

/**
 * Increments for one party produced by one activity record. Zero fields are left untouched on apply.
 */
public record ProfileDelta(
        String address,
        PartyRole role,
        long totalContracts,
        long completedContracts,
        long disputedContracts,
        long cancelledContracts,
        long finalizedContracts,
        BigInteger totalEarned,
        BigInteger totalSpent,
        PartyProfile.CredentialRef credential
) {

    public static ProfileDelta touch(String address, PartyRole role) {
        return new ProfileDelta(address, role, 0, 0, 0, 0, 0, BigInteger.ZERO, BigInteger.ZERO, null);
    }

    public ProfileDelta withTotalContracts(long n) {
        return new ProfileDelta(address, role, n, completedContracts, disputedContracts, cancelledContracts,
                finalizedContracts, totalEarned, totalSpent, credential);
    }

    public ProfileDelta withCompleted(long n) {
        return new ProfileDelta(address, role, totalContracts, n, disputedContracts, cancelledContracts,
                finalizedContracts, totalEarned, totalSpent, credential);
    }

    public ProfileDelta withDisputed(long n) {
        return new ProfileDelta(address, role, totalContracts, completedContracts, n, cancelledContracts,
                finalizedContracts, totalEarned, totalSpent, credential);
    }

    public ProfileDelta withCancelled(long n) {
        return new ProfileDelta(address, role, totalContracts, completedContracts, disputedContracts, n,
                finalizedContracts, totalEarned, totalSpent, credential);
    }

    public ProfileDelta withFinalized(long n) {
        return new ProfileDelta(address, role, totalContracts, completedContracts, disputedContracts,
                cancelledContracts, n, totalEarned, totalSpent, credential);
    }

    public ProfileDelta withEarned(BigInteger wei) {
        return new ProfileDelta(address, role, totalContracts, completedContracts, disputedContracts,
                cancelledContracts, finalizedContracts, wei, totalSpent, credential);
    }

    public ProfileDelta withSpent(BigInteger wei) {
        return new ProfileDelta(address, role, totalContracts, completedContracts, disputedContracts,
                cancelledContracts, finalizedContracts, totalEarned, wei, credential);
    }

    public ProfileDelta withCredential(PartyProfile.CredentialRef ref) {
        return new ProfileDelta(address, role, totalContracts, completedContracts, disputedContracts,
                cancelledContracts, finalizedContracts, totalEarned, totalSpent, ref);
    }
}
