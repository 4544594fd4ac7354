package com.talentledger.reconcile.handler;

import com.talentledger.domain.AgreementStatus;
import com.talentledger.ingestion.feed.event.AgreementFinalized;
import com.talentledger.ingestion.feed.event.NotificationType;
import com.talentledger.ingestion.ledger.LedgerClient;
import org.springframework.stereotype.Component;

@Component
public class AgreementFinalizedHandler extends StatusTransitionHandler<AgreementFinalized> {

    public AgreementFinalizedHandler(LedgerClient ledgerClient) {
        super(ledgerClient, AgreementStatus.FINALIZED);
    }

    @Override
    public NotificationType type() {
        return NotificationType.AGREEMENT_FINALIZED;
    }
}
