package com.talentledger.reconcile.store;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.talentledger.domain.QuarantinedNotification;
import com.talentledger.domain.QuarantinedNotification.FaultCode;
import com.talentledger.domain.QuarantinedNotification.QuarantineStatus;
import com.talentledger.domain.QuarantinedNotificationRepository;
import com.talentledger.ingestion.feed.ContractEventDecoder;
import com.talentledger.ingestion.feed.MalformedLog;
import com.talentledger.ingestion.feed.MalformedLogHandler;
import com.talentledger.ingestion.feed.event.AgreementNotification;
import com.talentledger.ingestion.feed.event.Notification;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.data.mongodb.core.MongoTemplate;
import org.springframework.data.mongodb.core.query.Query;
import org.springframework.data.mongodb.core.query.Update;
import org.springframework.stereotype.Service;

import java.time.Instant;
import java.util.List;
import java.util.Optional;

import static org.springframework.data.mongodb.core.query.Criteria.where;

/**
 * Quarantine entries keyed by idempotency key. Quarantining a notification also holds its partition; parking a
 * notification behind an existing hold does not change the hold. Logs the feed could not decode land here too.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class QuarantineStore implements MalformedLogHandler {

    private final QuarantinedNotificationRepository repository;
    private final WatermarkStore watermarkStore;
    private final MongoTemplate mongoTemplate;
    private final ObjectMapper objectMapper;
    private final ContractEventDecoder decoder;

    public boolean isOpen(String idempotencyKey) {
        return repository.existsByIdempotencyKeyAndStatus(idempotencyKey, QuarantineStatus.OPEN);
    }

    public void quarantine(Notification notification, FaultCode fault, String message, int attempts) {
        upsert(notification, fault, message, attempts);
        watermarkStore.hold(notification.partitionKey(), notification.idempotencyKey(),
                notification.sequencePosition());
        log.warn("Quarantined {} ({}) on {}: {} after {} attempt(s): {}", notification.idempotencyKey(),
                notification.type(), notification.partitionKey(), fault, attempts, message);
    }

    @Override
    public void onMalformedLog(MalformedLog malformedLog) {
        Update update = new Update()
                .set("partitionKey", malformedLog.partitionKey())
                .set("agreementId", malformedLog.agreementId())
                .set("sequencePosition", malformedLog.blockNumber())
                .set("logIndex", malformedLog.logIndex())
                .set("type", malformedLog.type().activityType())
                .set("rawLog", malformedLog.rawLog())
                .set("blockTimestamp", malformedLog.blockTimestamp())
                .set("fault", FaultCode.UNDECODABLE_LOG)
                .set("message", malformedLog.reason())
                .set("attempts", 1)
                .set("status", QuarantineStatus.OPEN)
                .unset("notificationJson")
                .unset("resolvedAt")
                .setOnInsert("quarantinedAt", Instant.now());
        mongoTemplate.upsert(new Query(where("idempotencyKey").is(malformedLog.idempotencyKey())), update,
                QuarantinedNotification.class);
        watermarkStore.hold(malformedLog.partitionKey(), malformedLog.idempotencyKey(), malformedLog.blockNumber());
        log.warn("Quarantined undecodable {} log {} on {}: {}", malformedLog.type(), malformedLog.idempotencyKey(),
                malformedLog.partitionKey(), malformedLog.reason());
    }

    public void park(Notification notification) {
        upsert(notification, FaultCode.HELD_BEHIND_FAULT,
                "Partition " + notification.partitionKey() + " is held by an earlier quarantined notification", 0);
        log.info("Parked {} ({}) behind held partition {}", notification.idempotencyKey(), notification.type(),
                notification.partitionKey());
    }

    /** Open entries of one partition in ledger order. */
    public List<QuarantinedNotification> openEntries(String partitionKey) {
        return repository.findByPartitionKeyAndStatusOrderBySequencePositionAscLogIndexAsc(partitionKey,
                QuarantineStatus.OPEN);
    }

    public List<QuarantinedNotification> listOpen() {
        return repository.findByStatusOrderByQuarantinedAtAsc(QuarantineStatus.OPEN);
    }

    public void close(QuarantinedNotification entry, QuarantineStatus status) {
        mongoTemplate.updateFirst(new Query(where("idempotencyKey").is(entry.getIdempotencyKey())),
                new Update().set("status", status).set("resolvedAt", Instant.now()),
                QuarantinedNotification.class);
    }

    /**
     * The notification to re-run for an entry. An undecodable log is decoded again, which yields empty when the
     * log turns out to carry nothing to apply.
     *
     * @throws com.talentledger.ingestion.feed.MalformedLogException when the raw log still cannot be decoded
     */
    public Optional<Notification> readNotification(QuarantinedNotification entry) {
        try {
            if (entry.getFault() == FaultCode.UNDECODABLE_LOG) {
                return decoder.decode(objectMapper.readTree(entry.getRawLog()), entry.getBlockTimestamp());
            }
            return Optional.of(objectMapper.readValue(entry.getNotificationJson(), Notification.class));
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Quarantined notification " + entry.getIdempotencyKey()
                    + " cannot be read back", e);
        }
    }

    private void upsert(Notification notification, FaultCode fault, String message, int attempts) {
        Update update = new Update()
                .set("partitionKey", notification.partitionKey())
                .set("agreementId", notification instanceof AgreementNotification a ? a.agreementId() : null)
                .set("sequencePosition", notification.sequencePosition())
                .set("logIndex", notification.origin().logIndex())
                .set("type", notification.type().activityType())
                .set("notificationJson", writeJson(notification))
                .set("fault", fault)
                .set("message", message)
                .set("attempts", attempts)
                .set("status", QuarantineStatus.OPEN)
                .unset("resolvedAt")
                .setOnInsert("quarantinedAt", Instant.now());
        mongoTemplate.upsert(new Query(where("idempotencyKey").is(notification.idempotencyKey())), update,
                QuarantinedNotification.class);
    }

    private String writeJson(Notification notification) {
        try {
            return objectMapper.writeValueAsString(notification);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Notification " + notification.idempotencyKey()
                    + " cannot be serialized", e);
        }
    }
}
