package com.talentledger.ingestion.ledger;

import java.time.Instant;

public record LedgerCredential(
        long tokenId,
        String issuer,
        String recipient,
        String skillName,
        String credentialType,
        Instant issuedDate,
        boolean revoked
) {
}
