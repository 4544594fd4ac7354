package com.talentledger.reconcile.handler;

import com.talentledger.domain.AgreementStatus;
import com.talentledger.ingestion.feed.event.AgreementAccepted;
import com.talentledger.ingestion.feed.event.NotificationType;
import com.talentledger.ingestion.ledger.LedgerAgreement;
import com.talentledger.ingestion.ledger.LedgerClient;
import com.talentledger.reconcile.engine.InvariantViolationException;
import com.talentledger.reconcile.engine.LedgerLagException;
import com.talentledger.reconcile.engine.ReconcilePlan;
import org.springframework.stereotype.Component;

/**
 * Talent acceptance. The agreement stays PENDING until both sides approved, so the ledger check is on the
 * talent approval flag.
 */
@Component
public class AgreementAcceptedHandler extends AgreementHandlerSupport<AgreementAccepted> {

    public AgreementAcceptedHandler(LedgerClient ledgerClient) {
        super(ledgerClient);
    }

    @Override
    public NotificationType type() {
        return NotificationType.AGREEMENT_ACCEPTED;
    }

    @Override
    public ReconcilePlan plan(AgreementAccepted n) {
        LedgerAgreement agreement = fetchAgreement(n.agreementId());
        if (!agreement.talent().equals(n.talent())) {
            throw new InvariantViolationException(n.talent() + " accepted agreement " + n.agreementId()
                    + " but is not its talent");
        }
        if (agreement.status() == AgreementStatus.PENDING && !agreement.talentApproved()) {
            throw new LedgerLagException("Agreement " + n.agreementId() + " acceptance not visible yet");
        }
        return new ReconcilePlan(newRecord(n, agreement, n.talent()), agreement);
    }
}
