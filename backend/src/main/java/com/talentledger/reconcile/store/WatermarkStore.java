package com.talentledger.reconcile.store;

import com.talentledger.domain.PartitionWatermark;
import com.talentledger.domain.PartitionWatermarkRepository;
import lombok.RequiredArgsConstructor;
import org.springframework.data.mongodb.core.MongoTemplate;
import org.springframework.data.mongodb.core.query.Query;
import org.springframework.data.mongodb.core.query.Update;
import org.springframework.stereotype.Service;

import java.time.Instant;
import java.util.Optional;

import static org.springframework.data.mongodb.core.query.Criteria.where;

/**
 * Per-partition watermark and hold flag. A hold is set by the first quarantined notification of a partition and
 * cleared by an operator release.
 * <p>
 * {@code highestPosition} is the highest position applied, not a contiguous prefix: it moves up with {@code $max},
 * so a position below it may still be missing. Nothing resumes or skips from it. Replay starts from the global feed
 * checkpoint and is deduplicated by idempotency key, and a notification that failed is never passed over silently,
 * because its hold parks everything behind it until release. Handlers confirm state against the ledger, so the
 * order of applied notifications within a partition does not change the outcome.
 */
@Service
@RequiredArgsConstructor
public class WatermarkStore {

    private final PartitionWatermarkRepository repository;
    private final MongoTemplate mongoTemplate;

    /** Raises the watermark to {@code position}; a lower position leaves it unchanged. */
    public void advance(String partitionKey, long position) {
        Update update = new Update()
                .max("highestPosition", position)
                .set("updatedAt", Instant.now());
        mongoTemplate.upsert(new Query(where("_id").is(partitionKey)), update, PartitionWatermark.class);
    }

    public boolean isHeld(String partitionKey) {
        return repository.findById(partitionKey).map(PartitionWatermark::isHeld).orElse(false);
    }

    /** Holds the partition at the given notification unless it is already held. */
    public void hold(String partitionKey, String idempotencyKey, long position) {
        Update update = new Update()
                .set("heldByKey", idempotencyKey)
                .set("heldAtPosition", position)
                .setOnInsert("highestPosition", 0L)
                .set("updatedAt", Instant.now());
        if (!repository.existsById(partitionKey)) {
            mongoTemplate.upsert(new Query(where("_id").is(partitionKey)), update, PartitionWatermark.class);
        } else {
            mongoTemplate.updateFirst(new Query(where("_id").is(partitionKey).and("heldByKey").is(null)), update,
                    PartitionWatermark.class);
        }
    }

    public void clearHold(String partitionKey) {
        mongoTemplate.updateFirst(new Query(where("_id").is(partitionKey)),
                new Update().unset("heldByKey").unset("heldAtPosition").set("updatedAt", Instant.now()),
                PartitionWatermark.class);
    }

    public Optional<PartitionWatermark> find(String partitionKey) {
        return repository.findById(partitionKey);
    }
}
