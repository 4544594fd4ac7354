package com.talentledger.reconcile.store;

import com.talentledger.domain.FeedCheckpoint;
import com.talentledger.domain.FeedCheckpointRepository;
import lombok.RequiredArgsConstructor;
import org.springframework.data.mongodb.core.MongoTemplate;
import org.springframework.data.mongodb.core.query.Query;
import org.springframework.data.mongodb.core.query.Update;
import org.springframework.stereotype.Service;

import java.time.Instant;
import java.util.Optional;

import static org.springframework.data.mongodb.core.query.Criteria.where;

/**
 * Durable feed checkpoint: the last block whose notifications were all dispatched and completed.
 */
@Service
@RequiredArgsConstructor
public class CheckpointStore {

    private final FeedCheckpointRepository repository;
    private final MongoTemplate mongoTemplate;

    public Optional<FeedCheckpoint> find() {
        return repository.findById(FeedCheckpoint.DEFAULT_ID);
    }

    /** Moves the checkpoint forward; never backward. */
    public void advance(long throughBlock, FeedCheckpoint.FeedMode mode) {
        Update update = new Update()
                .max("lastDispatchedBlock", throughBlock)
                .set("mode", mode)
                .set("updatedAt", Instant.now());
        mongoTemplate.upsert(new Query(where("_id").is(FeedCheckpoint.DEFAULT_ID)), update, FeedCheckpoint.class);
    }
}
