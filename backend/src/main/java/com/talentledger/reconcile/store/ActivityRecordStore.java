package com.talentledger.reconcile.store;

import com.talentledger.domain.ActivityRecord;
import com.talentledger.domain.ActivityRecordRepository;
import lombok.RequiredArgsConstructor;
import org.springframework.data.mongodb.core.MongoTemplate;
import org.springframework.data.mongodb.core.query.Query;
import org.springframework.data.mongodb.core.query.Update;
import org.springframework.stereotype.Service;

import static org.springframework.data.mongodb.core.query.Criteria.where;

/**
 * Insert-once store for activity records keyed by idempotency key. The unique index decides races: the second
 * insert of a key fails with DuplicateKeyException and its transaction rolls back.
 */
@Service
@RequiredArgsConstructor
public class ActivityRecordStore {

    private final ActivityRecordRepository repository;
    private final MongoTemplate mongoTemplate;

    public boolean exists(String idempotencyKey) {
        return repository.existsByIdempotencyKey(idempotencyKey);
    }

    /**
     * @throws org.springframework.dao.DuplicateKeyException when the key was committed concurrently
     */
    public ActivityRecord insert(ActivityRecord record) {
        return mongoTemplate.insert(record);
    }

    /** Only {@code processed} ever changes on a stored record. */
    public void markProcessed(String idempotencyKey) {
        mongoTemplate.updateFirst(new Query(where("idempotencyKey").is(idempotencyKey)),
                new Update().set("processed", true), ActivityRecord.class);
    }
}
