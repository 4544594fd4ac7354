package com.talentledger.ingestion.ledger;

import com.talentledger.domain.MilestoneStatus;

import java.math.BigInteger;
import java.time.Instant;

public record LedgerMilestone(
        String description,
        BigInteger amount,
        Instant deadline,
        MilestoneStatus status,
        String deliverableRef
) {
}
