package com.talentledger.reconcile.engine;

import com.talentledger.domain.QuarantinedNotification;
import com.talentledger.domain.QuarantinedNotification.QuarantineStatus;
import com.talentledger.ingestion.feed.MalformedLogException;
import com.talentledger.ingestion.feed.event.Notification;
import com.talentledger.reconcile.store.QuarantineStore;
import com.talentledger.reconcile.store.WatermarkStore;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.List;
import java.util.Optional;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Operator view of quarantined notifications and the release of a held partition.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class QuarantineService {

    private final QuarantineStore quarantineStore;
    private final WatermarkStore watermarkStore;
    private final ReconciliationEngine engine;
    private final PartitionLocks partitionLocks;

    public List<QuarantinedNotification> listOpen() {
        return quarantineStore.listOpen();
    }

    /**
     * Clears the hold and re-runs the partition's open entries in ledger order. Stops at the first entry that fails
     * again; that entry holds the partition anew and later entries stay parked.
     */
    public ReleaseResult release(String partitionKey) {
        ReentrantLock lock = partitionLocks.lockFor(partitionKey);
        lock.lock();
        try {
            watermarkStore.clearHold(partitionKey);
            List<QuarantinedNotification> open = quarantineStore.openEntries(partitionKey);
            log.info("Releasing {} with {} open entr{}", partitionKey, open.size(), open.size() == 1 ? "y" : "ies");
            int resolved = 0;
            for (QuarantinedNotification entry : open) {
                Optional<Notification> notification;
                try {
                    notification = quarantineStore.readNotification(entry);
                } catch (MalformedLogException e) {
                    quarantineStore.onMalformedLog(e.getMalformedLog());
                    log.warn("Release of {} stopped at {}: log still undecodable", partitionKey,
                            entry.getIdempotencyKey());
                    return new ReleaseResult(partitionKey, resolved, open.size() - resolved,
                            entry.getIdempotencyKey());
                }
                ReconcileOutcome outcome = notification.map(engine::reconcileReleased)
                        .orElse(ReconcileOutcome.DUPLICATE);
                if (outcome == ReconcileOutcome.QUARANTINED) {
                    log.warn("Release of {} stopped at {}", partitionKey, entry.getIdempotencyKey());
                    return new ReleaseResult(partitionKey, resolved, open.size() - resolved,
                            entry.getIdempotencyKey());
                }
                quarantineStore.close(entry, outcome == ReconcileOutcome.APPLIED
                        ? QuarantineStatus.RESOLVED : QuarantineStatus.RELEASED);
                resolved++;
            }
            return new ReleaseResult(partitionKey, resolved, 0, null);
        } finally {
            lock.unlock();
        }
    }
}
