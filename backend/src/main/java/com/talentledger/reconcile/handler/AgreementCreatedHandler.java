package com.talentledger.reconcile.handler;

import com.talentledger.domain.ActivityRecord;
import com.talentledger.domain.AgreementStatus;
import com.talentledger.ingestion.feed.event.AgreementCreated;
import com.talentledger.ingestion.feed.event.NotificationType;
import com.talentledger.ingestion.ledger.LedgerAgreement;
import com.talentledger.ingestion.ledger.LedgerClient;
import com.talentledger.reconcile.engine.InvariantViolationException;
import com.talentledger.reconcile.engine.ReconcilePlan;
import org.springframework.stereotype.Component;

@Component
public class AgreementCreatedHandler extends AgreementHandlerSupport<AgreementCreated> {

    public AgreementCreatedHandler(LedgerClient ledgerClient) {
        super(ledgerClient);
    }

    @Override
    public NotificationType type() {
        return NotificationType.AGREEMENT_CREATED;
    }

    @Override
    public ReconcilePlan plan(AgreementCreated n) {
        LedgerAgreement agreement = fetchAgreement(n.agreementId());
        if (!agreement.company().equals(n.company()) || !agreement.talent().equals(n.talent())) {
            throw new InvariantViolationException("Agreement " + n.agreementId() + " parties differ from creation event");
        }
        if (n.totalAmount() != null && !agreement.totalAmount().equals(n.totalAmount())) {
            throw new InvariantViolationException("Agreement " + n.agreementId() + " total " + agreement.totalAmount()
                    + " differs from creation event " + n.totalAmount());
        }
        requireReached(AgreementStatus.PENDING, agreement);
        ActivityRecord record = newRecord(n, agreement, agreement.company());
        record.getPayload().setAmount(wei(agreement.totalAmount()));
        return new ReconcilePlan(record, agreement);
    }
}
