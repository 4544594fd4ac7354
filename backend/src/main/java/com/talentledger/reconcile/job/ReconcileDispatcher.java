package com.talentledger.reconcile.job;

import com.talentledger.ingestion.feed.event.Notification;
import com.talentledger.reconcile.config.ReconcileProperties;
import com.talentledger.reconcile.engine.ReconcileOutcome;
import com.talentledger.reconcile.engine.ReconciliationEngine;
import jakarta.annotation.PreDestroy;
import lombok.extern.slf4j.Slf4j;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Future;

/**
 * Fans a batch out to single-thread workers. A partition key always maps to the same worker, so notifications of one
 * agreement are applied in delivery order while different agreements proceed in parallel.
 */
@Slf4j
@Component
public class ReconcileDispatcher {

    private final ReconciliationEngine engine;
    private final List<ThreadPoolTaskExecutor> workers;

    public ReconcileDispatcher(ReconciliationEngine engine, ReconcileProperties properties) {
        this.engine = engine;
        int n = Math.max(1, properties.getWorkerPartitions());
        this.workers = new ArrayList<>(n);
        for (int i = 0; i < n; i++) {
            ThreadPoolTaskExecutor e = new ThreadPoolTaskExecutor();
            e.setCorePoolSize(1);
            e.setMaxPoolSize(1);
            e.setThreadNamePrefix("reconcile-" + i + "-");
            e.setWaitForTasksToCompleteOnShutdown(true);
            e.setAwaitTerminationMillis(properties.getShutdownTimeoutMs());
            e.initialize();
            workers.add(e);
        }
    }

    /**
     * Applies the batch and blocks until every notification has an outcome.
     *
     * @throws IllegalStateException when a worker failed or the caller was interrupted; the batch must be redelivered
     */
    public DispatchSummary dispatch(List<Notification> notifications) {
        if (notifications.isEmpty()) {
            return DispatchSummary.EMPTY;
        }
        List<List<Notification>> lanes = new ArrayList<>(workers.size());
        for (int i = 0; i < workers.size(); i++) {
            lanes.add(new ArrayList<>());
        }
        for (Notification n : notifications) {
            lanes.get(workerIndex(n.partitionKey())).add(n);
        }
        List<Future<Map<ReconcileOutcome, Integer>>> futures = new ArrayList<>();
        for (int i = 0; i < lanes.size(); i++) {
            List<Notification> lane = lanes.get(i);
            if (!lane.isEmpty()) {
                futures.add(workers.get(i).submit(() -> runLane(lane)));
            }
        }
        Map<ReconcileOutcome, Integer> totals = new EnumMap<>(ReconcileOutcome.class);
        for (Future<Map<ReconcileOutcome, Integer>> f : futures) {
            try {
                f.get().forEach((outcome, count) -> totals.merge(outcome, count, Integer::sum));
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                throw new IllegalStateException("Interrupted while waiting for reconcile workers", e);
            } catch (ExecutionException e) {
                throw new IllegalStateException("Reconcile worker failed", e.getCause());
            }
        }
        DispatchSummary summary = new DispatchSummary(totals);
        log.debug("Dispatched {} notification(s): {}", notifications.size(), summary.counts());
        return summary;
    }

    int workerIndex(String partitionKey) {
        return Math.floorMod(partitionKey.hashCode(), workers.size());
    }

    private Map<ReconcileOutcome, Integer> runLane(List<Notification> lane) {
        Map<ReconcileOutcome, Integer> counts = new EnumMap<>(ReconcileOutcome.class);
        for (Notification n : lane) {
            counts.merge(engine.reconcile(n), 1, Integer::sum);
        }
        return counts;
    }

    @PreDestroy
    public void shutdown() {
        log.info("Draining {} reconcile worker(s)", workers.size());
        workers.forEach(ThreadPoolTaskExecutor::shutdown);
    }
}
