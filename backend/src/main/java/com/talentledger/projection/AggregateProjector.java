package com.talentledger.projection;

import com.talentledger.common.AmountFormat;
import com.talentledger.domain.ActivityPayload;
import com.talentledger.domain.ActivityRecord;
import com.talentledger.domain.PartyProfile;
import com.talentledger.domain.PartyRole;
import com.talentledger.domain.PlatformTotals;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.bson.types.Decimal128;
import org.springframework.data.mongodb.core.MongoTemplate;
import org.springframework.data.mongodb.core.query.Query;
import org.springframework.data.mongodb.core.query.Update;
import org.springframework.stereotype.Component;

import java.math.BigDecimal;
import java.math.BigInteger;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

import static org.springframework.data.mongodb.core.query.Criteria.where;

/**
 * Folds committed activity records into party reputation and platform totals. {@link #deltasFor} is pure;
 * {@link #apply} writes the deltas with atomic $inc / $addToSet upserts and must run at most once per record,
 * inside the commit that inserted it.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class AggregateProjector {

    private final MongoTemplate mongoTemplate;

    public AggregateDeltas deltasFor(ActivityRecord record) {
        ActivityPayload payload = record.getPayload() != null ? record.getPayload() : new ActivityPayload();
        List<ProfileDelta> profiles = new ArrayList<>(2);
        PlatformDelta platform = PlatformDelta.NONE;
        ProfileDelta company = record.getCompany() != null ? ProfileDelta.touch(record.getCompany(), PartyRole.COMPANY) : null;
        ProfileDelta talent = record.getTalent() != null ? ProfileDelta.touch(record.getTalent(), PartyRole.TALENT) : null;
        switch (record.getType()) {
            case CONTRACT_CREATED -> {
                company = company == null ? null : company.withTotalContracts(1).withSpent(wei(payload.getAmount()));
                talent = talent == null ? null : talent.withTotalContracts(1);
            }
            case MILESTONE_PAID -> {
                talent = talent == null ? null : talent.withEarned(wei(payload.getTalentPayment()));
                platform = new PlatformDelta(wei(payload.getAmount()), wei(payload.getPlatformFee()), 1);
            }
            case CONTRACT_COMPLETED -> {
                company = company == null ? null : company.withCompleted(1);
                talent = talent == null ? null : talent.withCompleted(1);
            }
            case CONTRACT_DISPUTED -> {
                company = company == null ? null : company.withDisputed(1);
                talent = talent == null ? null : talent.withDisputed(1);
            }
            case CONTRACT_CANCELLED -> {
                company = company == null ? null : company.withCancelled(1);
                talent = talent == null ? null : talent.withCancelled(1);
            }
            case CONTRACT_FINALIZED -> {
                company = company == null ? null : company.withFinalized(1);
                talent = talent == null ? null : talent.withFinalized(1);
            }
            case CREDENTIAL_ISSUED -> {
                company = null;
                talent = talent == null ? null : talent.withCredential(credentialRef(record));
            }
            default -> {
                // profile touch only
            }
        }
        if (company != null) {
            profiles.add(company);
        }
        if (talent != null) {
            profiles.add(talent);
        }
        return new AggregateDeltas(profiles, platform);
    }

    public void apply(ActivityRecord record) {
        AggregateDeltas deltas = deltasFor(record);
        Instant now = Instant.now();
        for (ProfileDelta delta : deltas.profiles()) {
            mongoTemplate.upsert(new Query(where("_id").is(delta.address())), toUpdate(delta, now), PartyProfile.class);
        }
        if (!deltas.platform().isEmpty()) {
            PlatformDelta p = deltas.platform();
            Update update = new Update()
                    .inc("totalVolume", decimal(p.volume()))
                    .inc("totalPlatformFees", decimal(p.fees()))
                    .inc("paidMilestones", p.paidMilestones())
                    .set("updatedAt", now);
            mongoTemplate.upsert(new Query(where("_id").is(PlatformTotals.SINGLETON_ID)), update, PlatformTotals.class);
        }
        log.debug("Projected {} ({}) onto {} profile(s)", record.getIdempotencyKey(), record.getType(),
                deltas.profiles().size());
    }

    private static Update toUpdate(ProfileDelta d, Instant now) {
        Update update = new Update()
                .setOnInsert("createdAt", now)
                .set("updatedAt", now);
        if (d.role() != null) {
            update.addToSet("roles", d.role());
        }
        incIfNonZero(update, "reputation.totalContracts", d.totalContracts());
        incIfNonZero(update, "reputation.completedContracts", d.completedContracts());
        incIfNonZero(update, "reputation.disputedContracts", d.disputedContracts());
        incIfNonZero(update, "reputation.cancelledContracts", d.cancelledContracts());
        incIfNonZero(update, "reputation.finalizedContracts", d.finalizedContracts());
        if (d.totalEarned().signum() != 0) {
            update.inc("reputation.totalEarned", decimal(d.totalEarned()));
        }
        if (d.totalSpent().signum() != 0) {
            update.inc("reputation.totalSpent", decimal(d.totalSpent()));
        }
        if (d.credential() != null) {
            update.addToSet("credentials", d.credential());
        }
        return update;
    }

    private static void incIfNonZero(Update update, String field, long n) {
        if (n != 0) {
            update.inc(field, n);
        }
    }

    static PartyProfile.CredentialRef credentialRef(ActivityRecord record) {
        PartyProfile.CredentialRef ref = new PartyProfile.CredentialRef();
        ref.setTokenId(record.getPayload().getTokenId());
        ref.setSkillName(record.getPayload().getSkillName());
        ref.setIssuer(record.getInitiator());
        ref.setIssuedAt(record.getTimestamp());
        return ref;
    }

    private static BigInteger wei(String value) {
        return value == null ? BigInteger.ZERO : AmountFormat.fromWeiString(value);
    }

    private static Decimal128 decimal(BigInteger wei) {
        return new Decimal128(new BigDecimal(wei));
    }
}
