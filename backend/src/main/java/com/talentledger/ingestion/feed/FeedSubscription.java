package com.talentledger.ingestion.feed;

public interface FeedSubscription {

    void cancel();

    boolean isActive();
}
