package com.talentledger.reconcile.handler;

import com.talentledger.domain.ActivityRecord;
import com.talentledger.domain.AgreementStatus;
import com.talentledger.domain.MilestoneStatus;
import com.talentledger.ingestion.feed.event.MilestoneSubmitted;
import com.talentledger.ingestion.feed.event.NotificationType;
import com.talentledger.ingestion.ledger.LedgerAgreement;
import com.talentledger.ingestion.ledger.LedgerClient;
import com.talentledger.ingestion.ledger.LedgerMilestone;
import com.talentledger.reconcile.engine.ReconcilePlan;
import org.springframework.stereotype.Component;

@Component
public class MilestoneSubmittedHandler extends AgreementHandlerSupport<MilestoneSubmitted> {

    public MilestoneSubmittedHandler(LedgerClient ledgerClient) {
        super(ledgerClient);
    }

    @Override
    public NotificationType type() {
        return NotificationType.MILESTONE_SUBMITTED;
    }

    @Override
    public ReconcilePlan plan(MilestoneSubmitted n) {
        LedgerAgreement agreement = fetchWithMilestone(n.agreementId(), n.milestoneIndex());
        requireReached(AgreementStatus.ACTIVE, agreement);
        requireReached(MilestoneStatus.SUBMITTED, agreement, n.milestoneIndex());
        LedgerMilestone milestone = agreement.milestones().get(n.milestoneIndex());
        ActivityRecord record = newRecord(n, agreement, agreement.talent());
        record.getPayload().setMilestoneIndex(n.milestoneIndex());
        record.getPayload().setAmount(wei(milestone.amount()));
        record.getPayload().setExternalRef(milestone.deliverableRef());
        return new ReconcilePlan(record, agreement);
    }
}
