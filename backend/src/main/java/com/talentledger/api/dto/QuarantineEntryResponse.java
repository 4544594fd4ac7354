package com.talentledger.api.dto;

import com.talentledger.domain.QuarantinedNotification;

import java.time.Instant;

public record QuarantineEntryResponse(
        String idempotencyKey,
        String partitionKey,
        Long agreementId,
        long blockNumber,
        int logIndex,
        String type,
        String fault,
        String message,
        int attempts,
        Instant quarantinedAt
) {

    public static QuarantineEntryResponse from(QuarantinedNotification q) {
        return new QuarantineEntryResponse(
                q.getIdempotencyKey(),
                q.getPartitionKey(),
                q.getAgreementId(),
                q.getSequencePosition(),
                q.getLogIndex(),
                q.getType() != null ? q.getType().getEventName() : null,
                q.getFault() != null ? q.getFault().name() : null,
                q.getMessage(),
                q.getAttempts(),
                q.getQuarantinedAt());
    }
}
