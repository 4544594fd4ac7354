package com.talentledger.domain;

import org.springframework.data.mongodb.repository.MongoRepository;

public interface FeedCheckpointRepository extends MongoRepository<FeedCheckpoint, String> {
}
