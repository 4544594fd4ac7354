package com.talentledger.reconcile.handler;

import com.talentledger.domain.AgreementStatus;
import com.talentledger.ingestion.feed.event.AgreementDisputed;
import com.talentledger.ingestion.feed.event.NotificationType;
import com.talentledger.ingestion.ledger.LedgerAgreement;
import com.talentledger.ingestion.ledger.LedgerClient;
import com.talentledger.reconcile.engine.ReconcilePlan;
import org.springframework.stereotype.Component;

@Component
public class AgreementDisputedHandler extends AgreementHandlerSupport<AgreementDisputed> {

    public AgreementDisputedHandler(LedgerClient ledgerClient) {
        super(ledgerClient);
    }

    @Override
    public NotificationType type() {
        return NotificationType.AGREEMENT_DISPUTED;
    }

    @Override
    public ReconcilePlan plan(AgreementDisputed n) {
        LedgerAgreement agreement = fetchAgreement(n.agreementId());
        requireParty(agreement, n.initiator());
        requireReached(AgreementStatus.DISPUTED, agreement);
        return new ReconcilePlan(newRecord(n, agreement, n.initiator()), agreement);
    }
}
