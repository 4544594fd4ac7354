package com.talentledger.reconcile.handler;

import com.talentledger.domain.ActivityRecord;
import com.talentledger.domain.AgreementStatus;
import com.talentledger.domain.MilestoneStatus;
import com.talentledger.ingestion.feed.event.MilestonePaid;
import com.talentledger.ingestion.feed.event.NotificationType;
import com.talentledger.ingestion.ledger.LedgerAgreement;
import com.talentledger.ingestion.ledger.LedgerClient;
import com.talentledger.reconcile.config.ReconcileProperties;
import com.talentledger.reconcile.engine.InvariantViolationException;
import com.talentledger.reconcile.engine.ReconcilePlan;
import org.springframework.stereotype.Component;

import java.math.BigInteger;

/**
 * Escrow release of one milestone. The event carries the talent payment; the gross comes from the ledger milestone
 * and the platform fee is gross * feeBasisPoints / 10000, so talentPayment + fee must equal gross exactly.
 */
@Component
public class MilestonePaidHandler extends AgreementHandlerSupport<MilestonePaid> {

    private static final BigInteger BASIS_POINTS = BigInteger.valueOf(10_000);

    private final ReconcileProperties properties;

    public MilestonePaidHandler(LedgerClient ledgerClient, ReconcileProperties properties) {
        super(ledgerClient);
        this.properties = properties;
    }

    @Override
    public NotificationType type() {
        return NotificationType.MILESTONE_PAID;
    }

    @Override
    public ReconcilePlan plan(MilestonePaid n) {
        LedgerAgreement agreement = fetchWithMilestone(n.agreementId(), n.milestoneIndex());
        requireReached(AgreementStatus.ACTIVE, agreement);
        requireReached(MilestoneStatus.PAID, agreement, n.milestoneIndex());
        BigInteger gross = agreement.milestones().get(n.milestoneIndex()).amount();
        BigInteger fee = platformFee(gross, properties.getPlatformFeeBasisPoints());
        if (n.talentPayment() == null || !n.talentPayment().add(fee).equals(gross)) {
            throw new InvariantViolationException("Agreement " + n.agreementId() + " milestone " + n.milestoneIndex()
                    + " paid " + n.talentPayment() + " + fee " + fee + " != amount " + gross);
        }
        ActivityRecord record = newRecord(n, agreement, agreement.company());
        record.getPayload().setMilestoneIndex(n.milestoneIndex());
        record.getPayload().setAmount(wei(gross));
        record.getPayload().setTalentPayment(wei(n.talentPayment()));
        record.getPayload().setPlatformFee(wei(fee));
        return new ReconcilePlan(record, agreement);
    }

    static BigInteger platformFee(BigInteger gross, int basisPoints) {
        return gross.multiply(BigInteger.valueOf(basisPoints)).divide(BASIS_POINTS);
    }
}
