package com.talentledger.ingestion.feed;

import com.talentledger.ingestion.feed.event.Notification;

import java.util.List;

/**
 * Receiver of a live subscription. Called from the subscription's polling thread, one call at a time.
 */
public interface FeedListener {

    /**
     * Notifications of blocks up to and including {@code throughBlock}, ordered by (block, logIndex).
     * Returning normally acknowledges the range; throwing ends the subscription through {@link #onError}.
     */
    void onNotifications(List<Notification> notifications, long throughBlock);

    /** The subscription stopped because of this failure. Not called after {@link FeedSubscription#cancel()}. */
    void onError(Throwable error);
}
