package com.talentledger.reconcile.job;

import com.talentledger.domain.ActivityRecord;
import com.talentledger.domain.ActivityRecordRepository;
import com.talentledger.publication.PublicationSink;
import com.talentledger.reconcile.config.ReconcileProperties;
import com.talentledger.reconcile.store.ActivityRecordStore;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

import java.time.Instant;
import java.util.List;

/**
 * Publishes committed records whose publication was cut short (crash between commit and publish). Only records older
 * than one sweep interval are picked up, so records still in flight on a worker are left alone.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class UnpublishedActivitySweep {

    private final ActivityRecordRepository repository;
    private final ActivityRecordStore activityStore;
    private final PublicationSink publicationSink;
    private final ReconcileProperties properties;

    @Scheduled(fixedDelayString = "${talentledger.reconcile.publish-sweep-interval-ms:60000}",
            initialDelayString = "${talentledger.reconcile.publish-sweep-interval-ms:60000}")
    public void run() {
        Instant cutoff = Instant.now().minusMillis(properties.getPublishSweepIntervalMs());
        List<ActivityRecord> pending = repository.findByProcessedFalseAndCreatedAtBefore(cutoff);
        if (pending.isEmpty()) {
            return;
        }
        for (ActivityRecord record : pending) {
            publicationSink.publish(record);
            activityStore.markProcessed(record.getIdempotencyKey());
        }
        log.info("Published {} record(s) left unpublished", pending.size());
    }
}
