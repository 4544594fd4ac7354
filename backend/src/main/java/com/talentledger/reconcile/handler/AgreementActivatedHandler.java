package com.talentledger.reconcile.handler;

import com.talentledger.domain.AgreementStatus;
import com.talentledger.ingestion.feed.event.AgreementActivated;
import com.talentledger.ingestion.feed.event.NotificationType;
import com.talentledger.ingestion.ledger.LedgerClient;
import org.springframework.stereotype.Component;

@Component
public class AgreementActivatedHandler extends StatusTransitionHandler<AgreementActivated> {

    public AgreementActivatedHandler(LedgerClient ledgerClient) {
        super(ledgerClient, AgreementStatus.ACTIVE);
    }

    @Override
    public NotificationType type() {
        return NotificationType.AGREEMENT_ACTIVATED;
    }
}
