package com.talentledger.domain;

import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;
import org.springframework.data.annotation.Id;
import org.springframework.data.mongodb.core.index.CompoundIndex;
import org.springframework.data.mongodb.core.index.Indexed;
import org.springframework.data.mongodb.core.mapping.Document;

import java.time.Instant;

/**
 * A notification that could not be applied, kept for operator inspection and release. The original notification
 * is stored as JSON so it can be replayed verbatim; an undecodable log is stored raw and decoded again on release.
 */
@Document(collection = "quarantined_notifications")
@CompoundIndex(name = "partition_order", def = "{'partitionKey': 1, 'status': 1, 'sequencePosition': 1, 'logIndex': 1}")
@NoArgsConstructor
@Getter
@Setter
@EqualsAndHashCode(onlyExplicitlyIncluded = true)
public class QuarantinedNotification {

    @Id
    private String id;
    @Indexed(unique = true)
    @EqualsAndHashCode.Include
    private String idempotencyKey;
    private String partitionKey;
    private Long agreementId;
    private long sequencePosition;
    private int logIndex;
    private ActivityType type;
    private String notificationJson;
    /** Verbatim eth_getLogs entry; set instead of notificationJson when the log could not be decoded. */
    private String rawLog;
    private Instant blockTimestamp;
    private FaultCode fault;
    private String message;
    private int attempts;
    private QuarantineStatus status;
    private Instant quarantinedAt;
    private Instant resolvedAt;

    public enum FaultCode {
        INVALID_REFERENCE,
        INVARIANT_VIOLATION,
        RETRIES_EXHAUSTED,
        /** A log of a supported event whose body could not be decoded. */
        UNDECODABLE_LOG,
        /** Parked because an earlier notification of the same partition is quarantined. */
        HELD_BEHIND_FAULT
    }

    public enum QuarantineStatus {
        OPEN,
        RELEASED,
        RESOLVED
    }
}
