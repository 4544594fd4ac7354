package com.talentledger.ingestion.feed;

import com.talentledger.ingestion.feed.event.NotificationType;

import java.time.Instant;

/**
 * A log of a supported event that could not be decoded. Kept verbatim so it can be decoded again once the cause
 * is fixed. {@code agreementId} is null when even the indexed id could not be read.
 */
public record MalformedLog(
        String transactionHash,
        long blockNumber,
        int logIndex,
        Instant blockTimestamp,
        NotificationType type,
        String partitionKey,
        Long agreementId,
        String rawLog,
        String reason
) {

    /** Partition for logs whose subject id is unreadable. */
    public static final String UNKNOWN_PARTITION = "undecodable-logs";

    /** Same form as a decoded notification's key, so a later successful decode dedups against this entry. */
    public String idempotencyKey() {
        return transactionHash + ":" + logIndex;
    }
}
