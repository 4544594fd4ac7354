package com.talentledger.reconcile.handler;

import com.talentledger.domain.ActivityRecord;
import com.talentledger.domain.AgreementStatus;
import com.talentledger.ingestion.feed.event.AgreementCancelled;
import com.talentledger.ingestion.feed.event.NotificationType;
import com.talentledger.ingestion.ledger.LedgerAgreement;
import com.talentledger.ingestion.ledger.LedgerClient;
import com.talentledger.reconcile.engine.ReconcilePlan;
import org.springframework.stereotype.Component;

@Component
public class AgreementCancelledHandler extends AgreementHandlerSupport<AgreementCancelled> {

    public AgreementCancelledHandler(LedgerClient ledgerClient) {
        super(ledgerClient);
    }

    @Override
    public NotificationType type() {
        return NotificationType.AGREEMENT_CANCELLED;
    }

    @Override
    public ReconcilePlan plan(AgreementCancelled n) {
        LedgerAgreement agreement = fetchAgreement(n.agreementId());
        requireReached(AgreementStatus.CANCELLED, agreement);
        ActivityRecord record = newRecord(n, agreement, agreement.company());
        record.getPayload().setReason(n.reason());
        return new ReconcilePlan(record, agreement);
    }
}
