package com.talentledger.ingestion.feed;

import com.talentledger.ingestion.feed.event.Notification;

import java.util.List;

/**
 * Source of ledger notifications. Delivery may repeat: ranges overlap after reconnects and the caller dedups by
 * idempotency key.
 */
public interface NotificationFeed {

    /**
     * Historical notifications in [fromBlock, toBlock], ordered by (block, logIndex).
     *
     * @throws com.talentledger.ingestion.ledger.UnreachableSourceException when the ledger cannot be queried
     */
    List<Notification> listNotifications(long fromBlock, long toBlock);

    /** Head block minus the configured confirmation depth. */
    long latestConfirmedBlock();

    /**
     * Live mode: delivers every newly confirmed range after {@code fromBlockExclusive} until cancelled or failed.
     */
    FeedSubscription subscribe(long fromBlockExclusive, FeedListener listener);
}
