package com.talentledger.reconcile;

import com.talentledger.domain.AgreementStatus;
import com.talentledger.domain.MilestoneStatus;
import com.talentledger.ingestion.feed.event.NotificationOrigin;
import com.talentledger.ingestion.ledger.LedgerAgreement;
import com.talentledger.ingestion.ledger.LedgerMilestone;

import java.math.BigInteger;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

/**
 * Ledger snapshots and notification origins shared by reconciliation tests.
 */
public final class LedgerFixtures {

    public static final String COMPANY = "0x1111111111111111111111111111111111111111";
    public static final String TALENT = "0x2222222222222222222222222222222222222222";
    public static final String STRANGER = "0x9999999999999999999999999999999999999999";
    public static final BigInteger ONE_ETH = new BigInteger("1000000000000000000");
    public static final BigInteger TWO_ETH = new BigInteger("2000000000000000000");

    private LedgerFixtures() {
    }

    public static NotificationOrigin origin(long block, int logIndex) {
        return new NotificationOrigin(String.format("0x%064x", block * 1000 + logIndex), block, logIndex,
                Instant.ofEpochSecond(1_700_000_000L + block * 12));
    }

    /**
     * Two milestones of 1 and 2 ETH, all milestones in the given status.
     */
    public static LedgerAgreement agreement(long id, AgreementStatus status, MilestoneStatus... milestoneStatuses) {
        List<LedgerMilestone> milestones = new ArrayList<>();
        BigInteger[] amounts = {ONE_ETH, TWO_ETH};
        for (int i = 0; i < amounts.length; i++) {
            MilestoneStatus ms = milestoneStatuses.length > i ? milestoneStatuses[i] : MilestoneStatus.PENDING;
            milestones.add(new LedgerMilestone("Milestone " + i, amounts[i], Instant.parse("2027-01-01T00:00:00Z"), ms,
                    ms.isAtLeast(MilestoneStatus.SUBMITTED) ? "ipfs://deliverable-" + i : null));
        }
        return new LedgerAgreement(id, COMPANY, TALENT, "Agreement " + id, "ipfs://meta-" + id,
                ONE_ETH.add(TWO_ETH), Instant.parse("2026-01-01T00:00:00Z"), Instant.parse("2027-06-01T00:00:00Z"),
                status, true, status != AgreementStatus.PENDING, milestones);
    }

    public static LedgerAgreement withTalentApproved(LedgerAgreement a, boolean talentApproved) {
        return new LedgerAgreement(a.id(), a.company(), a.talent(), a.title(), a.metadataRef(), a.totalAmount(),
                a.startDate(), a.endDate(), a.status(), a.companyApproved(), talentApproved, a.milestones());
    }

    public static LedgerAgreement withTotal(LedgerAgreement a, BigInteger total) {
        return new LedgerAgreement(a.id(), a.company(), a.talent(), a.title(), a.metadataRef(), total,
                a.startDate(), a.endDate(), a.status(), a.companyApproved(), a.talentApproved(), a.milestones());
    }
}
