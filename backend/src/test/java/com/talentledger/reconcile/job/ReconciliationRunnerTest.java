package com.talentledger.reconcile.job;

import com.talentledger.domain.FeedCheckpoint;
import com.talentledger.domain.FeedCheckpoint.FeedMode;
import com.talentledger.ingestion.config.FeedProperties;
import com.talentledger.ingestion.feed.FeedListener;
import com.talentledger.ingestion.feed.FeedSubscription;
import com.talentledger.ingestion.feed.NotificationFeed;
import com.talentledger.ingestion.feed.event.AgreementActivated;
import com.talentledger.ingestion.feed.event.Notification;
import com.talentledger.ingestion.ledger.UnreachableSourceException;
import com.talentledger.reconcile.store.CheckpointStore;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.InOrder;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.mockito.junit.jupiter.MockitoSettings;
import org.mockito.quality.Strictness;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.Executor;

import static com.talentledger.reconcile.LedgerFixtures.origin;
import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyList;
import static org.mockito.Mockito.inOrder;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
@MockitoSettings(strictness = Strictness.LENIENT)
class ReconciliationRunnerTest {

    @Mock
    private ReconcileDispatcher dispatcher;
    @Mock
    private CheckpointStore checkpointStore;

    private final FakeFeed feed = new FakeFeed();
    private final Deque<Runnable> scheduled = new ArrayDeque<>();
    private final Executor queued = scheduled::add;
    private FeedProperties properties;

    @BeforeEach
    void setUp() {
        properties = new FeedProperties();
        properties.setStartBlock(100);
        properties.setMaxBlockRange(10);
        properties.setReconnectBaseDelayMs(0);
        properties.setReconnectMaxDelayMs(0);
        when(dispatcher.dispatch(anyList())).thenReturn(DispatchSummary.EMPTY);
        when(checkpointStore.find()).thenReturn(Optional.empty());
    }

    @Test
    void catchUpWalksBoundedRangesFromStartBlock() {
        feed.head = 125;
        ReconciliationRunner runner = startedRunner();

        long through = runner.catchUp();

        assertThat(through).isEqualTo(125);
        assertThat(feed.ranges).containsExactly(new long[]{100, 109}, new long[]{110, 119}, new long[]{120, 125});
        InOrder order = inOrder(dispatcher, checkpointStore);
        order.verify(dispatcher).dispatch(anyList());
        order.verify(checkpointStore).advance(109, FeedMode.REPLAY);
        order.verify(dispatcher).dispatch(anyList());
        order.verify(checkpointStore).advance(119, FeedMode.REPLAY);
        order.verify(dispatcher).dispatch(anyList());
        order.verify(checkpointStore).advance(125, FeedMode.REPLAY);
    }

    @Test
    void catchUpResumesAtCheckpointInclusive() {
        FeedCheckpoint checkpoint = new FeedCheckpoint();
        checkpoint.setLastDispatchedBlock(118);
        when(checkpointStore.find()).thenReturn(Optional.of(checkpoint));
        feed.head = 120;
        ReconciliationRunner runner = startedRunner();

        runner.catchUp();

        assertThat(feed.ranges).containsExactly(new long[]{118, 120});
    }

    @Test
    void nothingToReplayWhenHeadIsBehindStart() {
        feed.head = 50;
        ReconciliationRunner runner = startedRunner();

        assertThat(runner.catchUp()).isEqualTo(99);
        assertThat(feed.ranges).isEmpty();
        verify(dispatcher, never()).dispatch(anyList());
    }

    @Test
    void subscribesAfterReplayAndAdvancesLiveCheckpoint() {
        feed.head = 105;
        ReconciliationRunner runner = startedRunner();
        runNext();

        assertThat(feed.subscribedFrom).isEqualTo(105);
        List<Notification> live = List.of(new AgreementActivated(origin(106, 0), 1));
        feed.listener.onNotifications(live, 106);

        verify(dispatcher).dispatch(live);
        verify(checkpointStore).advance(106, FeedMode.LIVE);
        assertThat(runner.isRunning()).isTrue();
    }

    @Test
    void feedErrorReconnectsFromCheckpoint() {
        feed.head = 105;
        startedRunner();
        runNext();
        FeedListener first = feed.listener;

        first.onError(new UnreachableSourceException("socket closed"));
        assertThat(scheduled).hasSize(1);
        runNext();

        assertThat(feed.subscribeCount).isEqualTo(2);
        assertThat(feed.listener).isNotSameAs(first);
    }

    @Test
    void replayFailureSchedulesReconnect() {
        feed.head = 105;
        feed.failListing = true;
        startedRunner();

        runNext();

        assertThat(feed.subscribeCount).isZero();
        assertThat(scheduled).hasSize(1);
    }

    @Test
    void stopCancelsSubscription() {
        feed.head = 105;
        ReconciliationRunner runner = startedRunner();
        runNext();

        runner.stop();

        assertThat(runner.isRunning()).isFalse();
        assertThat(feed.cancelled).isTrue();
    }

    private ReconciliationRunner startedRunner() {
        ReconciliationRunner runner = new ReconciliationRunner(feed, dispatcher, checkpointStore, properties, queued);
        runner.start();
        return runner;
    }

    private void runNext() {
        Runnable next = scheduled.poll();
        assertThat(next).isNotNull();
        next.run();
    }

    private static final class FakeFeed implements NotificationFeed {

        long head;
        boolean failListing;
        final List<long[]> ranges = new ArrayList<>();
        long subscribedFrom = -1;
        int subscribeCount;
        FeedListener listener;
        boolean cancelled;

        @Override
        public List<Notification> listNotifications(long fromBlock, long toBlock) {
            if (failListing) {
                throw new UnreachableSourceException("ledger down");
            }
            ranges.add(new long[]{fromBlock, toBlock});
            return List.of();
        }

        @Override
        public long latestConfirmedBlock() {
            return head;
        }

        @Override
        public FeedSubscription subscribe(long fromBlockExclusive, FeedListener listener) {
            this.subscribedFrom = fromBlockExclusive;
            this.listener = listener;
            this.subscribeCount++;
            return new FeedSubscription() {
                @Override
                public void cancel() {
                    cancelled = true;
                }

                @Override
                public boolean isActive() {
                    return !cancelled;
                }
            };
        }
    }
}
