package com.talentledger.ingestion.ledger;

import com.talentledger.domain.AgreementStatus;

import java.math.BigInteger;
import java.time.Instant;
import java.util.List;

/**
 * Agreement as currently recorded on the ledger, with its milestones in index order.
 * Addresses are lowercase 0x hex; amounts are wei.
 */
public record LedgerAgreement(
        long id,
        String company,
        String talent,
        String title,
        String metadataRef,
        BigInteger totalAmount,
        Instant startDate,
        Instant endDate,
        AgreementStatus status,
        boolean companyApproved,
        boolean talentApproved,
        List<LedgerMilestone> milestones
) {

    public LedgerAgreement {
        milestones = milestones == null ? List.of() : List.copyOf(milestones);
    }

    public BigInteger milestoneTotal() {
        return milestones.stream()
                .map(LedgerMilestone::amount)
                .reduce(BigInteger.ZERO, BigInteger::add);
    }
}
