package com.talentledger.domain;

import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;
import org.springframework.data.annotation.Id;
import org.springframework.data.mongodb.core.mapping.Document;

import java.time.Instant;

/**
 * Last block whose notifications were all dispatched and completed. Catch-up resumes from this block inclusive.
 */
@Document(collection = "feed_checkpoints")
@NoArgsConstructor
@Getter
@Setter
public class FeedCheckpoint {

    public static final String DEFAULT_ID = "employment-feed";

    @Id
    private String id;
    private long lastDispatchedBlock;
    private FeedMode mode;
    private Instant updatedAt;

    public enum FeedMode {
        REPLAY,
        LIVE
    }
}
