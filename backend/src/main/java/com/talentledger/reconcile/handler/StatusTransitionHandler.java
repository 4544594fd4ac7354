package com.talentledger.reconcile.handler;

import com.talentledger.domain.AgreementStatus;
import com.talentledger.ingestion.feed.event.AgreementNotification;
import com.talentledger.ingestion.ledger.LedgerAgreement;
import com.talentledger.ingestion.ledger.LedgerClient;
import com.talentledger.reconcile.engine.ReconcilePlan;

/**
 * Notifications whose only meaning is "the agreement reached this status", initiated by the company.
 */
public abstract class StatusTransitionHandler<N extends AgreementNotification> extends AgreementHandlerSupport<N> {

    private final AgreementStatus implied;

    protected StatusTransitionHandler(LedgerClient ledgerClient, AgreementStatus implied) {
        super(ledgerClient);
        this.implied = implied;
    }

    @Override
    public ReconcilePlan plan(N notification) {
        LedgerAgreement agreement = fetchAgreement(notification.agreementId());
        requireReached(implied, agreement);
        return new ReconcilePlan(newRecord(notification, agreement, agreement.company()), agreement);
    }
}
