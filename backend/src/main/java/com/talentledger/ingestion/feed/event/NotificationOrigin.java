package com.talentledger.ingestion.feed.event;

import java.time.Instant;

/**
 * Where a notification sits in the ledger log. (transactionHash, logIndex) identifies it uniquely.
 */
public record NotificationOrigin(String transactionHash, long blockNumber, int logIndex, Instant blockTimestamp) {
}
