package com.talentledger.domain;

import org.springframework.data.mongodb.repository.MongoRepository;

import java.time.Instant;
import java.util.List;

/**
 * Activity history, ordered by ledger position.
 */
public interface ActivityRecordRepository extends MongoRepository<ActivityRecord, String> {

    boolean existsByIdempotencyKey(String idempotencyKey);

    List<ActivityRecord> findByAgreementIdOrderBySequencePositionAscLogIndexAsc(Long agreementId);

    List<ActivityRecord> findTop50ByAgreementIdOrderBySequencePositionDescLogIndexDesc(Long agreementId);

    List<ActivityRecord> findAllByOrderBySequencePositionAscLogIndexAsc();

    List<ActivityRecord> findByProcessedFalseAndCreatedAtBefore(Instant cutoff);

    long countByType(ActivityType type);
}
