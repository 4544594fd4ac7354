package com.talentledger.reconcile.job;

import com.talentledger.common.RetryPolicy;
import com.talentledger.config.AsyncConfig;
import com.talentledger.domain.FeedCheckpoint;
import com.talentledger.domain.FeedCheckpoint.FeedMode;
import com.talentledger.ingestion.config.FeedProperties;
import com.talentledger.ingestion.feed.FeedListener;
import com.talentledger.ingestion.feed.FeedSubscription;
import com.talentledger.ingestion.feed.NotificationFeed;
import com.talentledger.ingestion.feed.event.Notification;
import com.talentledger.reconcile.store.CheckpointStore;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.context.SmartLifecycle;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.concurrent.Executor;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Drives the feed: replays history from the checkpoint up to the confirmed head, then follows live ranges. Any feed
 * or dispatch failure drops the subscription and reconnects with backoff from the checkpoint; the overlap is
 * deduplicated downstream.
 */
@Slf4j
@Component
public class ReconciliationRunner implements SmartLifecycle {

    private static final double RECONNECT_JITTER = 0.2;

    private final NotificationFeed feed;
    private final ReconcileDispatcher dispatcher;
    private final CheckpointStore checkpointStore;
    private final FeedProperties feedProperties;
    private final Executor feedExecutor;
    private final RetryPolicy reconnectPolicy;

    private final AtomicBoolean running = new AtomicBoolean(false);
    private final AtomicInteger consecutiveFailures = new AtomicInteger();
    private volatile FeedSubscription subscription;

    public ReconciliationRunner(
            NotificationFeed feed,
            ReconcileDispatcher dispatcher,
            CheckpointStore checkpointStore,
            FeedProperties feedProperties,
            @Qualifier(AsyncConfig.FEED_EXECUTOR) Executor feedExecutor) {
        this.feed = feed;
        this.dispatcher = dispatcher;
        this.checkpointStore = checkpointStore;
        this.feedProperties = feedProperties;
        this.feedExecutor = feedExecutor;
        this.reconnectPolicy = new RetryPolicy(feedProperties.getReconnectBaseDelayMs(),
                feedProperties.getReconnectMaxDelayMs(), RECONNECT_JITTER, Integer.MAX_VALUE);
    }

    /** Disabled feeds leave the API serving stored state only. */
    @Override
    public boolean isAutoStartup() {
        return feedProperties.isEnabled();
    }

    @Override
    public void start() {
        if (running.compareAndSet(false, true)) {
            log.info("Reconciliation runner starting");
            feedExecutor.execute(this::connect);
        }
    }

    @Override
    public boolean isRunning() {
        return running.get();
    }

    void connect() {
        if (!running.get()) {
            return;
        }
        try {
            long dispatchedThrough = catchUp();
            if (!running.get()) {
                return;
            }
            log.info("Replay complete through block {}; following live ledger", dispatchedThrough);
            subscription = feed.subscribe(dispatchedThrough, new LiveListener());
        } catch (RuntimeException e) {
            scheduleReconnect(e);
        }
    }

    /**
     * Replays [checkpoint, confirmed head] in bounded ranges. The checkpoint block itself is replayed because a crash
     * may have interrupted it.
     *
     * @return the last block dispatched
     */
    long catchUp() {
        long from = checkpointStore.find()
                .map(FeedCheckpoint::getLastDispatchedBlock)
                .orElse(feedProperties.getStartBlock());
        long head = feed.latestConfirmedBlock();
        long range = Math.max(1, feedProperties.getMaxBlockRange());
        long cursor = from;
        while (cursor <= head && running.get()) {
            long to = Math.min(head, cursor + range - 1);
            List<Notification> batch = feed.listNotifications(cursor, to);
            DispatchSummary summary = dispatcher.dispatch(batch);
            checkpointStore.advance(to, FeedMode.REPLAY);
            if (summary.total() > 0) {
                log.info("Replayed blocks {}-{}: {}", cursor, to, summary.counts());
            }
            cursor = to + 1;
        }
        consecutiveFailures.set(0);
        return Math.max(head, from - 1);
    }

    private void scheduleReconnect(Throwable cause) {
        subscription = null;
        if (!running.get()) {
            return;
        }
        int attempt = consecutiveFailures.getAndIncrement();
        long delay = reconnectPolicy.delayMs(attempt);
        log.warn("Feed interrupted ({}); reconnecting in {} ms (attempt {})", cause.toString(), delay, attempt + 1);
        feedExecutor.execute(() -> {
            try {
                Thread.sleep(delay);
            } catch (InterruptedException ie) {
                Thread.currentThread().interrupt();
                return;
            }
            connect();
        });
    }

    /**
     * Stops the live subscription. Batches already handed to the dispatcher finish while its workers drain.
     */
    @Override
    public void stop() {
        if (!running.compareAndSet(true, false)) {
            return;
        }
        FeedSubscription current = subscription;
        if (current != null) {
            current.cancel();
        }
        log.info("Reconciliation runner stopped");
    }

    private final class LiveListener implements FeedListener {

        @Override
        public void onNotifications(List<Notification> notifications, long throughBlock) {
            DispatchSummary summary = dispatcher.dispatch(notifications);
            checkpointStore.advance(throughBlock, FeedMode.LIVE);
            consecutiveFailures.set(0);
            if (summary.total() > 0) {
                log.info("Live through block {}: {}", throughBlock, summary.counts());
            }
        }

        @Override
        public void onError(Throwable error) {
            scheduleReconnect(error);
        }
    }
}
