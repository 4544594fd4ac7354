package com.talentledger.reconcile.handler;

import com.talentledger.domain.AgreementStatus;
import com.talentledger.domain.MilestoneStatus;
import com.talentledger.ingestion.feed.event.MilestonePaid;
import com.talentledger.ingestion.ledger.LedgerClient;
import com.talentledger.reconcile.config.ReconcileProperties;
import com.talentledger.reconcile.engine.InvariantViolationException;
import com.talentledger.reconcile.engine.LedgerLagException;
import com.talentledger.reconcile.engine.ReconcilePlan;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.math.BigInteger;

import static com.talentledger.reconcile.LedgerFixtures.COMPANY;
import static com.talentledger.reconcile.LedgerFixtures.TWO_ETH;
import static com.talentledger.reconcile.LedgerFixtures.agreement;
import static com.talentledger.reconcile.LedgerFixtures.origin;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class MilestonePaidHandlerTest {

    @Mock
    private LedgerClient ledgerClient;

    private MilestonePaidHandler handler;

    @BeforeEach
    void setUp() {
        ReconcileProperties properties = new ReconcileProperties();
        properties.setPlatformFeeBasisPoints(200);
        handler = new MilestonePaidHandler(ledgerClient, properties);
    }

    @Test
    void splitsGrossIntoTalentPaymentAndFee() {
        when(ledgerClient.fetchAgreement(1)).thenReturn(agreement(1, AgreementStatus.ACTIVE,
                MilestoneStatus.PAID, MilestoneStatus.PAID));

        ReconcilePlan plan = handler.plan(new MilestonePaid(origin(30, 0), 1, 1,
                new BigInteger("1960000000000000000")));

        assertThat(plan.record().getPayload().getAmount()).isEqualTo(TWO_ETH.toString());
        assertThat(plan.record().getPayload().getTalentPayment()).isEqualTo("1960000000000000000");
        assertThat(plan.record().getPayload().getPlatformFee()).isEqualTo("40000000000000000");
        assertThat(plan.record().getInitiator()).isEqualTo(COMPANY);
    }

    @Test
    void paymentNotAddingUpIsViolation() {
        when(ledgerClient.fetchAgreement(1)).thenReturn(agreement(1, AgreementStatus.ACTIVE, MilestoneStatus.PAID));

        assertThatThrownBy(() -> handler.plan(new MilestonePaid(origin(30, 0), 1, 0,
                new BigInteger("1000000000000000000"))))
                .isInstanceOf(InvariantViolationException.class);
    }

    @Test
    void milestoneOnlyApprovedIsLag() {
        when(ledgerClient.fetchAgreement(1)).thenReturn(agreement(1, AgreementStatus.ACTIVE,
                MilestoneStatus.APPROVED));

        assertThatThrownBy(() -> handler.plan(new MilestonePaid(origin(30, 0), 1, 0,
                new BigInteger("980000000000000000"))))
                .isInstanceOf(LedgerLagException.class);
    }

    @Test
    void feeRoundsDown() {
        assertThat(MilestonePaidHandler.platformFee(BigInteger.valueOf(9_999), 200)).isEqualTo(BigInteger.valueOf(199));
        assertThat(MilestonePaidHandler.platformFee(BigInteger.ZERO, 200)).isZero();
        assertThat(MilestonePaidHandler.platformFee(BigInteger.valueOf(10_000), 0)).isZero();
    }
}
