package com.talentledger.reconcile.handler;

import com.talentledger.domain.ActivityRecord;
import com.talentledger.domain.AgreementStatus;
import com.talentledger.domain.MilestoneStatus;
import com.talentledger.ingestion.feed.event.MilestoneApproved;
import com.talentledger.ingestion.feed.event.NotificationType;
import com.talentledger.ingestion.ledger.LedgerAgreement;
import com.talentledger.ingestion.ledger.LedgerClient;
import com.talentledger.reconcile.engine.ReconcilePlan;
import org.springframework.stereotype.Component;

@Component
public class MilestoneApprovedHandler extends AgreementHandlerSupport<MilestoneApproved> {

    public MilestoneApprovedHandler(LedgerClient ledgerClient) {
        super(ledgerClient);
    }

    @Override
    public NotificationType type() {
        return NotificationType.MILESTONE_APPROVED;
    }

    @Override
    public ReconcilePlan plan(MilestoneApproved n) {
        LedgerAgreement agreement = fetchWithMilestone(n.agreementId(), n.milestoneIndex());
        requireReached(AgreementStatus.ACTIVE, agreement);
        requireReached(MilestoneStatus.APPROVED, agreement, n.milestoneIndex());
        ActivityRecord record = newRecord(n, agreement, agreement.company());
        record.getPayload().setMilestoneIndex(n.milestoneIndex());
        record.getPayload().setAmount(wei(agreement.milestones().get(n.milestoneIndex()).amount()));
        return new ReconcilePlan(record, agreement);
    }
}
