package com.talentledger.reconcile.engine;

import com.talentledger.common.RetryPolicy;
import com.talentledger.domain.ActivityRecord;
import com.talentledger.domain.QuarantinedNotification.FaultCode;
import com.talentledger.ingestion.feed.event.Notification;
import com.talentledger.ingestion.ledger.InvalidReferenceException;
import com.talentledger.ingestion.ledger.UnreachableSourceException;
import com.talentledger.projection.AggregateProjector;
import com.talentledger.publication.PublicationSink;
import com.talentledger.reconcile.handler.NotificationHandlerRegistry;
import com.talentledger.reconcile.store.ActivityRecordStore;
import com.talentledger.reconcile.store.AgreementMirrorStore;
import com.talentledger.reconcile.store.QuarantineStore;
import com.talentledger.reconcile.store.WatermarkStore;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.dao.DataAccessException;
import org.springframework.dao.DuplicateKeyException;
import org.springframework.stereotype.Service;
import org.springframework.transaction.TransactionException;
import org.springframework.transaction.support.TransactionTemplate;

import java.util.concurrent.locks.ReentrantLock;

/**
 * Applies one notification at most once. Under the partition lock: dedup by idempotency key, park behind a held
 * partition, then plan (ledger query) and commit record, mirror, aggregates and watermark in one transaction.
 * Transient failures are retried with backoff; the rest are quarantined. Publication happens after the commit.
 */
@Slf4j
@Service
public class ReconciliationEngine {

    private final NotificationHandlerRegistry handlers;
    private final ActivityRecordStore activityStore;
    private final AgreementMirrorStore mirrorStore;
    private final AggregateProjector projector;
    private final WatermarkStore watermarkStore;
    private final QuarantineStore quarantineStore;
    private final PublicationSink publicationSink;
    private final PartitionLocks partitionLocks;
    private final RetryPolicy retryPolicy;
    private final TransactionTemplate transactionTemplate;

    public ReconciliationEngine(
            NotificationHandlerRegistry handlers,
            ActivityRecordStore activityStore,
            AgreementMirrorStore mirrorStore,
            AggregateProjector projector,
            WatermarkStore watermarkStore,
            QuarantineStore quarantineStore,
            PublicationSink publicationSink,
            PartitionLocks partitionLocks,
            @Qualifier("reconcileRetryPolicy") RetryPolicy retryPolicy,
            @Qualifier("reconcileTransactionTemplate") TransactionTemplate transactionTemplate) {
        this.handlers = handlers;
        this.activityStore = activityStore;
        this.mirrorStore = mirrorStore;
        this.projector = projector;
        this.watermarkStore = watermarkStore;
        this.quarantineStore = quarantineStore;
        this.publicationSink = publicationSink;
        this.partitionLocks = partitionLocks;
        this.retryPolicy = retryPolicy;
        this.transactionTemplate = transactionTemplate;
    }

    public ReconcileOutcome reconcile(Notification notification) {
        return reconcile(notification, false);
    }

    /**
     * Re-runs a quarantined notification during an operator release. The caller holds the partition lock and has
     * cleared the hold.
     */
    ReconcileOutcome reconcileReleased(Notification notification) {
        return reconcile(notification, true);
    }

    private ReconcileOutcome reconcile(Notification notification, boolean releasing) {
        String key = notification.idempotencyKey();
        String partitionKey = notification.partitionKey();
        ReentrantLock lock = partitionLocks.lockFor(partitionKey);
        lock.lock();
        try {
            if (activityStore.exists(key)) {
                log.debug("Skip duplicate {}", key);
                return ReconcileOutcome.DUPLICATE;
            }
            if (!releasing) {
                if (quarantineStore.isOpen(key)) {
                    log.debug("Skip {}: already quarantined", key);
                    return ReconcileOutcome.DUPLICATE;
                }
                if (watermarkStore.isHeld(partitionKey)) {
                    quarantineStore.park(notification);
                    return ReconcileOutcome.HELD;
                }
            }
            return applyWithRetry(notification);
        } finally {
            lock.unlock();
        }
    }

    private ReconcileOutcome applyWithRetry(Notification notification) {
        String key = notification.idempotencyKey();
        for (int attempt = 1; ; attempt++) {
            try {
                ReconcilePlan plan = handlers.plan(notification);
                ActivityRecord committed = commit(notification, plan);
                if (committed == null) {
                    log.debug("Skip {}: committed concurrently", key);
                    return ReconcileOutcome.DUPLICATE;
                }
                log.info("Applied {} ({}) to {} at block {}", key, notification.type(), notification.partitionKey(),
                        notification.sequencePosition());
                afterCommit(committed);
                return ReconcileOutcome.APPLIED;
            } catch (InvalidReferenceException e) {
                quarantineStore.quarantine(notification, FaultCode.INVALID_REFERENCE, e.getMessage(), attempt);
                return ReconcileOutcome.QUARANTINED;
            } catch (InvariantViolationException e) {
                quarantineStore.quarantine(notification, FaultCode.INVARIANT_VIOLATION, e.getMessage(), attempt);
                return ReconcileOutcome.QUARANTINED;
            } catch (UnreachableSourceException | LedgerLagException | StoreWriteFailureException e) {
                if (retryPolicy.isExhausted(attempt)) {
                    quarantineStore.quarantine(notification, FaultCode.RETRIES_EXHAUSTED, e.getMessage(), attempt);
                    return ReconcileOutcome.QUARANTINED;
                }
                long delay = retryPolicy.delayMs(attempt - 1);
                log.debug("Attempt {} for {} failed ({}); retrying in {} ms", attempt, key, e.getMessage(), delay);
                if (!sleep(delay)) {
                    quarantineStore.quarantine(notification, FaultCode.RETRIES_EXHAUSTED,
                            "Interrupted while retrying: " + e.getMessage(), attempt);
                    return ReconcileOutcome.QUARANTINED;
                }
            } catch (RuntimeException e) {
                log.error("Unexpected failure reconciling {}", key, e);
                quarantineStore.quarantine(notification, FaultCode.INVARIANT_VIOLATION,
                        "Unexpected failure: " + e, attempt);
                return ReconcileOutcome.QUARANTINED;
            }
        }
    }

    /**
     * @return the stored record, or null when the idempotency key won a race in another commit
     */
    private ActivityRecord commit(Notification notification, ReconcilePlan plan) {
        try {
            return transactionTemplate.execute(status -> {
                ActivityRecord saved = activityStore.insert(plan.record());
                if (plan.agreementState() != null) {
                    mirrorStore.merge(plan.agreementState(), notification.sequencePosition());
                }
                projector.apply(saved);
                watermarkStore.advance(notification.partitionKey(), notification.sequencePosition());
                return saved;
            });
        } catch (DuplicateKeyException e) {
            return null;
        } catch (DataAccessException | TransactionException e) {
            throw new StoreWriteFailureException("Commit of " + notification.idempotencyKey() + " failed", e);
        }
    }

    /**
     * The record is durable at this point, so nothing here may fail the notification. A record left unmarked is
     * picked up again by the unpublished activity sweep.
     */
    private void afterCommit(ActivityRecord record) {
        try {
            publicationSink.publish(record);
            activityStore.markProcessed(record.getIdempotencyKey());
        } catch (RuntimeException e) {
            log.warn("Post-commit publication of {} failed; left for the sweep: {}", record.getIdempotencyKey(),
                    e.getMessage());
        }
    }

    private static boolean sleep(long delayMs) {
        try {
            Thread.sleep(delayMs);
            return true;
        } catch (InterruptedException ie) {
            Thread.currentThread().interrupt();
            return false;
        }
    }
}
