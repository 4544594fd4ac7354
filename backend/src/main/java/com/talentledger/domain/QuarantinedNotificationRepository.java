package com.talentledger.domain;

import org.springframework.data.mongodb.repository.MongoRepository;

import java.util.List;
import java.util.Optional;

public interface QuarantinedNotificationRepository extends MongoRepository<QuarantinedNotification, String> {

    Optional<QuarantinedNotification> findByIdempotencyKey(String idempotencyKey);

    boolean existsByIdempotencyKeyAndStatus(String idempotencyKey, QuarantinedNotification.QuarantineStatus status);

    List<QuarantinedNotification> findByPartitionKeyAndStatusOrderBySequencePositionAscLogIndexAsc(
            String partitionKey, QuarantinedNotification.QuarantineStatus status);

    List<QuarantinedNotification> findByStatusOrderByQuarantinedAtAsc(QuarantinedNotification.QuarantineStatus status);

    long countByStatus(QuarantinedNotification.QuarantineStatus status);
}
