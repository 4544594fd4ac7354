package com.talentledger.reconcile.handler;

import com.talentledger.common.AmountFormat;
import com.talentledger.domain.ActivityPayload;
import com.talentledger.domain.ActivityRecord;
import com.talentledger.domain.AgreementStatus;
import com.talentledger.domain.MilestoneStatus;
import com.talentledger.ingestion.feed.event.AgreementNotification;
import com.talentledger.ingestion.ledger.InvalidReferenceException;
import com.talentledger.ingestion.ledger.LedgerAgreement;
import com.talentledger.ingestion.ledger.LedgerClient;
import com.talentledger.ingestion.ledger.LedgerMilestone;
import com.talentledger.reconcile.engine.InvariantViolationException;
import com.talentledger.reconcile.engine.LedgerLagException;
import lombok.extern.slf4j.Slf4j;

import java.math.BigInteger;
import java.time.Instant;

/**
 * Shared fetch-and-check steps of agreement handlers. The notification supplies identifiers and deltas; the ledger
 * query confirms the resulting state.
 */
@Slf4j
public abstract class AgreementHandlerSupport<N extends AgreementNotification> implements NotificationHandler<N> {

    protected final LedgerClient ledgerClient;

    protected AgreementHandlerSupport(LedgerClient ledgerClient) {
        this.ledgerClient = ledgerClient;
    }

    protected LedgerAgreement fetchAgreement(long agreementId) {
        LedgerAgreement agreement = ledgerClient.fetchAgreement(agreementId);
        if (!agreement.milestones().isEmpty() && !agreement.milestoneTotal().equals(agreement.totalAmount())) {
            throw new InvariantViolationException("Agreement " + agreementId + " total " + agreement.totalAmount()
                    + " differs from milestone sum " + agreement.milestoneTotal());
        }
        return agreement;
    }

    /**
     * Fetches the agreement and makes sure the milestone index exists, re-fetching once before giving up.
     */
    protected LedgerAgreement fetchWithMilestone(long agreementId, int index) {
        LedgerAgreement agreement = fetchAgreement(agreementId);
        if (index >= 0 && index < agreement.milestones().size()) {
            return agreement;
        }
        log.debug("Milestone {} out of bounds for agreement {} ({} known); re-fetching", index, agreementId,
                agreement.milestones().size());
        agreement = fetchAgreement(agreementId);
        if (index < 0 || index >= agreement.milestones().size()) {
            throw new InvalidReferenceException("Milestone " + index + " does not exist on agreement " + agreementId
                    + " (" + agreement.milestones().size() + " milestones)");
        }
        return agreement;
    }

    /**
     * The ledger must be at the implied status or beyond it. Still before it means the ledger view lags;
     * on a diverging branch it is a contradiction.
     */
    protected static void requireReached(AgreementStatus implied, LedgerAgreement agreement) {
        AgreementStatus fetched = agreement.status();
        if (implied.canReach(fetched)) {
            return;
        }
        if (fetched.canReach(implied)) {
            throw new LedgerLagException("Agreement " + agreement.id() + " is " + fetched + ", expected " + implied);
        }
        throw new InvariantViolationException("Agreement " + agreement.id() + " is " + fetched
                + ", which cannot follow " + implied);
    }

    protected static void requireReached(MilestoneStatus implied, LedgerAgreement agreement, int index) {
        LedgerMilestone milestone = agreement.milestones().get(index);
        if (milestone.status().isBefore(implied)) {
            throw new LedgerLagException("Agreement " + agreement.id() + " milestone " + index + " is "
                    + milestone.status() + ", expected " + implied);
        }
    }

    protected static void requireParty(LedgerAgreement agreement, String address) {
        if (!address.equals(agreement.company()) && !address.equals(agreement.talent())) {
            throw new InvariantViolationException(address + " is not a party of agreement " + agreement.id());
        }
    }

    protected static ActivityRecord newRecord(AgreementNotification notification, LedgerAgreement agreement, String initiator) {
        ActivityRecord record = new ActivityRecord();
        record.setIdempotencyKey(notification.idempotencyKey());
        record.setAgreementId(notification.agreementId());
        record.setTransactionHash(notification.origin().transactionHash());
        record.setSequencePosition(notification.sequencePosition());
        record.setLogIndex(notification.origin().logIndex());
        record.setType(notification.type().activityType());
        record.setCompany(agreement.company());
        record.setTalent(agreement.talent());
        record.setInitiator(initiator);
        record.setPayload(new ActivityPayload());
        record.setTimestamp(notification.origin().blockTimestamp());
        record.setProcessed(false);
        record.setCreatedAt(Instant.now());
        return record;
    }

    protected static String wei(BigInteger amount) {
        return AmountFormat.toWeiString(amount);
    }
}
