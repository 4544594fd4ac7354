package com.talentledger.ingestion.ledger;

import com.talentledger.domain.PartyRole;

import java.util.Set;

/**
 * Read-only view of the employment and credential contracts. Results are never cached: every call reflects the
 * ledger at the time of the call.
 *
 * <p>All fetch methods throw {@link UnreachableSourceException} when the ledger cannot be queried and
 * {@link InvalidReferenceException} when the referenced id does not exist.
 */
public interface LedgerClient {

    LedgerAgreement fetchAgreement(long agreementId);

    LedgerMilestone fetchMilestone(long agreementId, int index);

    /**
     * Agreement ids in which the address takes part.
     *
     * @param role COMPANY or TALENT; null for both
     */
    Set<Long> fetchPartyAgreements(String address, PartyRole role);

    LedgerCredential fetchCredential(long tokenId);

    long latestBlock();

    /**
     * EIP-191 personal-sign check. Never throws; malformed input yields false.
     */
    boolean verifySignedMessage(String message, String signature, String claimedAddress);
}
