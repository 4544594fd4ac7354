package com.talentledger.projection;

import com.talentledger.domain.ActivityRecord;
import com.talentledger.domain.ActivityRecordRepository;
import com.talentledger.domain.PartyProfile;
import com.talentledger.domain.PartyProfileRepository;
import com.talentledger.domain.PlatformTotals;
import com.talentledger.domain.PlatformTotalsRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.bson.types.Decimal128;
import org.springframework.data.mongodb.core.MongoTemplate;
import org.springframework.data.mongodb.core.query.Query;
import org.springframework.data.mongodb.core.query.Update;
import org.springframework.stereotype.Service;
import org.springframework.transaction.support.TransactionTemplate;

import java.math.BigDecimal;
import java.math.BigInteger;
import java.time.Instant;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.TreeMap;

import static org.springframework.data.mongodb.core.query.Criteria.where;

/**
 * Recomputes party and platform aggregates from the activity log with the projector's own delta rules, so the
 * fold and the live path cannot drift apart.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class AggregateRebuilder {

    private final AggregateProjector projector;
    private final ActivityRecordRepository activityRecordRepository;
    private final PartyProfileRepository partyProfileRepository;
    private final PlatformTotalsRepository platformTotalsRepository;
    private final MongoTemplate mongoTemplate;
    private final TransactionTemplate reconcileTransactionTemplate;

    public FoldedAggregates fold(Iterable<ActivityRecord> records) {
        Map<String, ProfileTotals> profiles = new TreeMap<>();
        BigInteger volume = BigInteger.ZERO;
        BigInteger fees = BigInteger.ZERO;
        long paid = 0;
        long count = 0;
        for (ActivityRecord record : records) {
            AggregateDeltas deltas = projector.deltasFor(record);
            for (ProfileDelta delta : deltas.profiles()) {
                profiles.computeIfAbsent(delta.address(), a -> new ProfileTotals()).add(delta);
            }
            volume = volume.add(deltas.platform().volume());
            fees = fees.add(deltas.platform().fees());
            paid += deltas.platform().paidMilestones();
            count++;
        }
        return new FoldedAggregates(profiles, volume, fees, paid, count);
    }

    public AggregateVerification verify() {
        FoldedAggregates folded = fold(activityRecordRepository.findAllByOrderBySequencePositionAscLogIndexAsc());
        List<String> mismatches = new ArrayList<>();
        Set<String> seen = new HashSet<>();
        for (PartyProfile stored : partyProfileRepository.findAll()) {
            seen.add(stored.getId());
            ProfileTotals expected = folded.profiles().getOrDefault(stored.getId(), new ProfileTotals());
            ProfileTotals actual = ProfileTotals.of(stored);
            if (!expected.equals(actual)) {
                mismatches.add("profile " + stored.getId() + ": expected " + expected + " but stored " + actual);
            }
        }
        for (String address : folded.profiles().keySet()) {
            if (!seen.contains(address)) {
                mismatches.add("profile " + address + ": missing");
            }
        }
        PlatformTotals platform = platformTotalsRepository.findById(PlatformTotals.SINGLETON_ID).orElseGet(PlatformTotals::new);
        if (!Objects.equals(folded.totalVolume(), toWei(platform.getTotalVolume()))
                || !Objects.equals(folded.totalPlatformFees(), toWei(platform.getTotalPlatformFees()))
                || folded.paidMilestones() != platform.getPaidMilestones()) {
            mismatches.add("platform totals: expected volume=" + folded.totalVolume() + " fees=" + folded.totalPlatformFees()
                    + " paid=" + folded.paidMilestones() + " but stored volume=" + platform.getTotalVolume()
                    + " fees=" + platform.getTotalPlatformFees() + " paid=" + platform.getPaidMilestones());
        }
        if (!mismatches.isEmpty()) {
            log.warn("Aggregate verification found {} mismatch(es)", mismatches.size());
        }
        return new AggregateVerification(folded.recordsFolded(), seen.size(), mismatches);
    }

    /**
     * Overwrites every derived aggregate with the fold of the log, in one transaction. Profile text fields are kept.
     */
    public FoldedAggregates rebuild() {
        FoldedAggregates folded = fold(activityRecordRepository.findAllByOrderBySequencePositionAscLogIndexAsc());
        Instant now = Instant.now();
        reconcileTransactionTemplate.executeWithoutResult(status -> {
            mongoTemplate.updateMulti(new Query(), resetUpdate(now), PartyProfile.class);
            folded.profiles().forEach((address, totals) ->
                    mongoTemplate.upsert(new Query(where("_id").is(address)), setUpdate(totals, now), PartyProfile.class));
            Update platform = new Update()
                    .set("totalVolume", decimal(folded.totalVolume()))
                    .set("totalPlatformFees", decimal(folded.totalPlatformFees()))
                    .set("paidMilestones", folded.paidMilestones())
                    .set("updatedAt", now);
            mongoTemplate.upsert(new Query(where("_id").is(PlatformTotals.SINGLETON_ID)), platform, PlatformTotals.class);
        });
        log.info("Rebuilt aggregates from {} activity records ({} profiles)", folded.recordsFolded(), folded.profiles().size());
        return folded;
    }

    private static Update resetUpdate(Instant now) {
        return new Update()
                .set("roles", List.of())
                .set("reputation.totalContracts", 0L)
                .set("reputation.completedContracts", 0L)
                .set("reputation.disputedContracts", 0L)
                .set("reputation.cancelledContracts", 0L)
                .set("reputation.finalizedContracts", 0L)
                .set("reputation.totalEarned", decimal(BigInteger.ZERO))
                .set("reputation.totalSpent", decimal(BigInteger.ZERO))
                .set("credentials", List.of())
                .set("updatedAt", now);
    }

    private static Update setUpdate(ProfileTotals t, Instant now) {
        return new Update()
                .setOnInsert("createdAt", now)
                .set("roles", new ArrayList<>(t.getRoles()))
                .set("reputation.totalContracts", t.getTotalContracts())
                .set("reputation.completedContracts", t.getCompletedContracts())
                .set("reputation.disputedContracts", t.getDisputedContracts())
                .set("reputation.cancelledContracts", t.getCancelledContracts())
                .set("reputation.finalizedContracts", t.getFinalizedContracts())
                .set("reputation.totalEarned", decimal(t.getTotalEarned()))
                .set("reputation.totalSpent", decimal(t.getTotalSpent()))
                .set("credentials", t.getCredentialRefs())
                .set("updatedAt", now);
    }

    private static BigInteger toWei(BigDecimal value) {
        return value == null ? BigInteger.ZERO : value.toBigInteger();
    }

    private static Decimal128 decimal(BigInteger wei) {
        return new Decimal128(new BigDecimal(wei));
    }
}
