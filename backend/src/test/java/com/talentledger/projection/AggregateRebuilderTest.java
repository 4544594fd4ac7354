package com.talentledger.projection;

import com.talentledger.domain.ActivityRecord;
import com.talentledger.domain.ActivityType;
import com.talentledger.domain.PartyRole;
import org.junit.jupiter.api.Test;

import java.math.BigInteger;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class AggregateRebuilderTest {

    private static final String COMPANY = "0x1111111111111111111111111111111111111111";
    private static final String TALENT = "0x2222222222222222222222222222222222222222";

    private final AggregateRebuilder rebuilder =
            new AggregateRebuilder(new AggregateProjector(null), null, null, null, null, null);

    @Test
    void foldSumsLifecycleIntoTotals() {
        FoldedAggregates folded = rebuilder.fold(lifecycle());

        assertThat(folded.recordsFolded()).isEqualTo(5);
        assertThat(folded.totalVolume()).isEqualTo(new BigInteger("3000000000000000000"));
        assertThat(folded.totalPlatformFees()).isEqualTo(new BigInteger("60000000000000000"));
        assertThat(folded.paidMilestones()).isEqualTo(2);

        ProfileTotals company = folded.profiles().get(COMPANY);
        assertThat(company.getRoles()).containsExactly(PartyRole.COMPANY);
        assertThat(company.getTotalContracts()).isEqualTo(1);
        assertThat(company.getCompletedContracts()).isEqualTo(1);
        assertThat(company.getTotalSpent()).isEqualTo(new BigInteger("3000000000000000000"));

        ProfileTotals talent = folded.profiles().get(TALENT);
        assertThat(talent.getTotalEarned()).isEqualTo(new BigInteger("2940000000000000000"));
        assertThat(talent.getCompletedContracts()).isEqualTo(1);
    }

    @Test
    void foldIsIndependentOfRecordOrder() {
        List<ActivityRecord> shuffled = new ArrayList<>(lifecycle());
        Collections.reverse(shuffled);

        FoldedAggregates forward = rebuilder.fold(lifecycle());
        FoldedAggregates backward = rebuilder.fold(shuffled);

        assertThat(backward.profiles()).isEqualTo(forward.profiles());
        assertThat(backward.totalVolume()).isEqualTo(forward.totalVolume());
        assertThat(backward.totalPlatformFees()).isEqualTo(forward.totalPlatformFees());
    }

    @Test
    void foldOfNothingIsEmpty() {
        FoldedAggregates folded = rebuilder.fold(List.of());

        assertThat(folded.profiles()).isEmpty();
        assertThat(folded.totalVolume()).isZero();
        assertThat(folded.recordsFolded()).isZero();
    }

    private static List<ActivityRecord> lifecycle() {
        ActivityRecord created = record(ActivityType.CONTRACT_CREATED, 1);
        created.getPayload().setAmount("3000000000000000000");
        ActivityRecord first = paid(2, 0, "1000000000000000000", "980000000000000000", "20000000000000000");
        ActivityRecord second = paid(3, 1, "2000000000000000000", "1960000000000000000", "40000000000000000");
        ActivityRecord activated = record(ActivityType.CONTRACT_ACTIVATED, 2);
        activated.setLogIndex(1);
        ActivityRecord completed = record(ActivityType.CONTRACT_COMPLETED, 4);
        return List.of(created, activated, first, second, completed);
    }

    private static ActivityRecord paid(long block, int index, String gross, String talentPayment, String fee) {
        ActivityRecord r = record(ActivityType.MILESTONE_PAID, block);
        r.getPayload().setMilestoneIndex(index);
        r.getPayload().setAmount(gross);
        r.getPayload().setTalentPayment(talentPayment);
        r.getPayload().setPlatformFee(fee);
        return r;
    }

    private static ActivityRecord record(ActivityType type, long block) {
        ActivityRecord r = new ActivityRecord();
        r.setIdempotencyKey("0x" + block + ":" + type.ordinal());
        r.setAgreementId(1L);
        r.setSequencePosition(block);
        r.setType(type);
        r.setCompany(COMPANY);
        r.setTalent(TALENT);
        r.setInitiator(COMPANY);
        return r;
    }
}
