package com.talentledger.reconcile.handler;

import com.talentledger.domain.ActivityRecord;
import com.talentledger.domain.ActivityType;
import com.talentledger.domain.AgreementStatus;
import com.talentledger.domain.MilestoneStatus;
import com.talentledger.ingestion.feed.event.AgreementAccepted;
import com.talentledger.ingestion.feed.event.AgreementCancelled;
import com.talentledger.ingestion.feed.event.AgreementCompleted;
import com.talentledger.ingestion.feed.event.AgreementCreated;
import com.talentledger.ingestion.feed.event.AgreementDisputed;
import com.talentledger.ingestion.feed.event.MilestoneSubmitted;
import com.talentledger.ingestion.ledger.InvalidReferenceException;
import com.talentledger.ingestion.ledger.LedgerAgreement;
import com.talentledger.ingestion.ledger.LedgerClient;
import com.talentledger.reconcile.engine.InvariantViolationException;
import com.talentledger.reconcile.engine.LedgerLagException;
import com.talentledger.reconcile.engine.ReconcilePlan;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import static com.talentledger.reconcile.LedgerFixtures.COMPANY;
import static com.talentledger.reconcile.LedgerFixtures.ONE_ETH;
import static com.talentledger.reconcile.LedgerFixtures.STRANGER;
import static com.talentledger.reconcile.LedgerFixtures.TALENT;
import static com.talentledger.reconcile.LedgerFixtures.TWO_ETH;
import static com.talentledger.reconcile.LedgerFixtures.agreement;
import static com.talentledger.reconcile.LedgerFixtures.origin;
import static com.talentledger.reconcile.LedgerFixtures.withTalentApproved;
import static com.talentledger.reconcile.LedgerFixtures.withTotal;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class AgreementHandlersTest {

    @Mock
    private LedgerClient ledgerClient;

    @Test
    void createdBuildsRecordFromLedgerState() {
        LedgerAgreement ledger = agreement(1, AgreementStatus.PENDING);
        when(ledgerClient.fetchAgreement(1)).thenReturn(ledger);

        ReconcilePlan plan = new AgreementCreatedHandler(ledgerClient)
                .plan(new AgreementCreated(origin(10, 0), 1, COMPANY, TALENT, ONE_ETH.add(TWO_ETH)));

        ActivityRecord record = plan.record();
        assertThat(plan.agreementState()).isSameAs(ledger);
        assertThat(record.getType()).isEqualTo(ActivityType.CONTRACT_CREATED);
        assertThat(record.getIdempotencyKey()).isEqualTo(origin(10, 0).transactionHash() + ":0");
        assertThat(record.getAgreementId()).isEqualTo(1L);
        assertThat(record.getSequencePosition()).isEqualTo(10);
        assertThat(record.getCompany()).isEqualTo(COMPANY);
        assertThat(record.getTalent()).isEqualTo(TALENT);
        assertThat(record.getInitiator()).isEqualTo(COMPANY);
        assertThat(record.getPayload().getAmount()).isEqualTo("3000000000000000000");
        assertThat(record.getTimestamp()).isEqualTo(origin(10, 0).blockTimestamp());
        assertThat(record.isProcessed()).isFalse();
    }

    @Test
    void createdWithDifferentPartiesIsViolation() {
        when(ledgerClient.fetchAgreement(1)).thenReturn(agreement(1, AgreementStatus.PENDING));

        AgreementCreatedHandler handler = new AgreementCreatedHandler(ledgerClient);

        assertThatThrownBy(() -> handler.plan(new AgreementCreated(origin(10, 0), 1, COMPANY, STRANGER, null)))
                .isInstanceOf(InvariantViolationException.class);
    }

    @Test
    void totalNotMatchingMilestoneSumIsViolation() {
        when(ledgerClient.fetchAgreement(1)).thenReturn(withTotal(agreement(1, AgreementStatus.PENDING), ONE_ETH));

        AgreementCreatedHandler handler = new AgreementCreatedHandler(ledgerClient);

        assertThatThrownBy(() -> handler.plan(new AgreementCreated(origin(10, 0), 1, COMPANY, TALENT, ONE_ETH)))
                .isInstanceOf(InvariantViolationException.class)
                .hasMessageContaining("milestone sum");
    }

    @Test
    void acceptanceNotYetVisibleIsLag() {
        when(ledgerClient.fetchAgreement(1))
                .thenReturn(withTalentApproved(agreement(1, AgreementStatus.PENDING), false));

        AgreementAcceptedHandler handler = new AgreementAcceptedHandler(ledgerClient);

        assertThatThrownBy(() -> handler.plan(new AgreementAccepted(origin(11, 0), 1, TALENT)))
                .isInstanceOf(LedgerLagException.class);
    }

    @Test
    void acceptanceRecordedWithTalentAsInitiator() {
        when(ledgerClient.fetchAgreement(1))
                .thenReturn(withTalentApproved(agreement(1, AgreementStatus.PENDING), true));

        ReconcilePlan plan = new AgreementAcceptedHandler(ledgerClient)
                .plan(new AgreementAccepted(origin(11, 0), 1, TALENT));

        assertThat(plan.record().getInitiator()).isEqualTo(TALENT);
    }

    @Test
    @DisplayName("ledger still before the implied status means lag, not contradiction")
    void statusBehindImpliedIsLag() {
        when(ledgerClient.fetchAgreement(1)).thenReturn(agreement(1, AgreementStatus.ACTIVE));

        AgreementCompletedHandler handler = new AgreementCompletedHandler(ledgerClient);

        assertThatThrownBy(() -> handler.plan(new AgreementCompleted(origin(20, 0), 1)))
                .isInstanceOf(LedgerLagException.class);
    }

    @Test
    void statusOnDivergingBranchIsViolation() {
        when(ledgerClient.fetchAgreement(1)).thenReturn(agreement(1, AgreementStatus.CANCELLED));

        AgreementCompletedHandler handler = new AgreementCompletedHandler(ledgerClient);

        assertThatThrownBy(() -> handler.plan(new AgreementCompleted(origin(20, 0), 1)))
                .isInstanceOf(InvariantViolationException.class);
    }

    @Test
    void statusAlreadyBeyondImpliedIsAccepted() {
        when(ledgerClient.fetchAgreement(1)).thenReturn(agreement(1, AgreementStatus.FINALIZED,
                MilestoneStatus.PAID, MilestoneStatus.PAID));

        ReconcilePlan plan = new AgreementCompletedHandler(ledgerClient)
                .plan(new AgreementCompleted(origin(20, 0), 1));

        assertThat(plan.record().getType()).isEqualTo(ActivityType.CONTRACT_COMPLETED);
        assertThat(plan.agreementState().status()).isEqualTo(AgreementStatus.FINALIZED);
    }

    @Test
    void disputeByNonPartyIsViolation() {
        when(ledgerClient.fetchAgreement(1)).thenReturn(agreement(1, AgreementStatus.DISPUTED));

        AgreementDisputedHandler handler = new AgreementDisputedHandler(ledgerClient);

        assertThatThrownBy(() -> handler.plan(new AgreementDisputed(origin(21, 0), 1, STRANGER)))
                .isInstanceOf(InvariantViolationException.class);
    }

    @Test
    void disputeRecordsInitiatingParty() {
        when(ledgerClient.fetchAgreement(1)).thenReturn(agreement(1, AgreementStatus.DISPUTED));

        ReconcilePlan plan = new AgreementDisputedHandler(ledgerClient)
                .plan(new AgreementDisputed(origin(21, 0), 1, TALENT));

        assertThat(plan.record().getInitiator()).isEqualTo(TALENT);
    }

    @Test
    void cancellationKeepsReason() {
        when(ledgerClient.fetchAgreement(1)).thenReturn(agreement(1, AgreementStatus.CANCELLED));

        ReconcilePlan plan = new AgreementCancelledHandler(ledgerClient)
                .plan(new AgreementCancelled(origin(12, 0), 1, "scope changed"));

        assertThat(plan.record().getPayload().getReason()).isEqualTo("scope changed");
    }

    @Test
    void submittedCarriesDeliverable() {
        when(ledgerClient.fetchAgreement(1)).thenReturn(agreement(1, AgreementStatus.ACTIVE,
                MilestoneStatus.SUBMITTED));

        ReconcilePlan plan = new MilestoneSubmittedHandler(ledgerClient)
                .plan(new MilestoneSubmitted(origin(13, 2), 1, 0));

        ActivityRecord record = plan.record();
        assertThat(record.getPayload().getMilestoneIndex()).isZero();
        assertThat(record.getPayload().getAmount()).isEqualTo(ONE_ETH.toString());
        assertThat(record.getPayload().getExternalRef()).isEqualTo("ipfs://deliverable-0");
        assertThat(record.getInitiator()).isEqualTo(TALENT);
        assertThat(record.getLogIndex()).isEqualTo(2);
    }

    @Test
    void milestoneStillPendingIsLag() {
        when(ledgerClient.fetchAgreement(1)).thenReturn(agreement(1, AgreementStatus.ACTIVE));

        MilestoneSubmittedHandler handler = new MilestoneSubmittedHandler(ledgerClient);

        assertThatThrownBy(() -> handler.plan(new MilestoneSubmitted(origin(13, 0), 1, 0)))
                .isInstanceOf(LedgerLagException.class);
    }

    @Test
    void unknownMilestoneIndexIsRefetchedOnceThenInvalid() {
        when(ledgerClient.fetchAgreement(1)).thenReturn(agreement(1, AgreementStatus.ACTIVE));

        MilestoneSubmittedHandler handler = new MilestoneSubmittedHandler(ledgerClient);

        assertThatThrownBy(() -> handler.plan(new MilestoneSubmitted(origin(13, 0), 1, 5)))
                .isInstanceOf(InvalidReferenceException.class)
                .hasMessageContaining("Milestone 5");
        verify(ledgerClient, times(2)).fetchAgreement(1);
    }
}
