package com.talentledger.reconcile.handler;

import com.talentledger.domain.AgreementStatus;
import com.talentledger.ingestion.feed.event.AgreementCompleted;
import com.talentledger.ingestion.feed.event.NotificationType;
import com.talentledger.ingestion.ledger.LedgerClient;
import org.springframework.stereotype.Component;

@Component
public class AgreementCompletedHandler extends StatusTransitionHandler<AgreementCompleted> {

    public AgreementCompletedHandler(LedgerClient ledgerClient) {
        super(ledgerClient, AgreementStatus.COMPLETED);
    }

    @Override
    public NotificationType type() {
        return NotificationType.AGREEMENT_COMPLETED;
    }
}
