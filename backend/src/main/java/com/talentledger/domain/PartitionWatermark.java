package com.talentledger.domain;

import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;
import org.springframework.data.annotation.Id;
import org.springframework.data.mongodb.core.mapping.Document;

import java.time.Instant;

/**
 * Ordering state of one partition (agreement-{id} or credential-{tokenId}). A partition with heldByKey set does not
 * apply further notifications until the held notification is released.
 */
@Document(collection = "partition_watermarks")
@NoArgsConstructor
@Getter
@Setter
public class PartitionWatermark {

    @Id
    private String partitionKey;
    private long highestPosition;
    private Long heldAtPosition;
    private String heldByKey;
    private Instant updatedAt;

    public boolean isHeld() {
        return heldByKey != null;
    }
}
