package com.talentledger.domain;

import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;
import org.springframework.data.annotation.Id;
import org.springframework.data.mongodb.core.index.CompoundIndex;
import org.springframework.data.mongodb.core.index.CompoundIndexes;
import org.springframework.data.mongodb.core.index.Indexed;
import org.springframework.data.mongodb.core.mapping.Document;

import java.time.Instant;

/**
 * One applied ledger notification. Unique on idempotencyKey ({txHash}:{logIndex}); the write of this document is
 * the idempotency gate for every derived effect.
 */
@Document(collection = "contract_activities")
@CompoundIndexes({
        @CompoundIndex(name = "agreement_order", def = "{'agreementId': 1, 'sequencePosition': 1, 'logIndex': 1}"),
        @CompoundIndex(name = "company_ts", def = "{'company': 1, 'timestamp': -1}"),
        @CompoundIndex(name = "talent_ts", def = "{'talent': 1, 'timestamp': -1}")
})
@NoArgsConstructor
@Getter
@Setter
@EqualsAndHashCode(onlyExplicitlyIncluded = true)
public class ActivityRecord {

    @Id
    private String id;
    @Indexed(unique = true)
    @EqualsAndHashCode.Include
    private String idempotencyKey;
    /** Null for credential notifications. */
    private Long agreementId;
    private String transactionHash;
    private long sequencePosition;
    private int logIndex;
    private ActivityType type;
    private String company;
    private String talent;
    private String initiator;
    private ActivityPayload payload = new ActivityPayload();
    private Instant timestamp;
    /** Set after channel publication was attempted. */
    private boolean processed;
    private Instant createdAt;
}
