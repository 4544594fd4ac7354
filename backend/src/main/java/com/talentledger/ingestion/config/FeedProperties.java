package com.talentledger.ingestion.config;

import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * Notification feed settings. Live mode polls the confirmed head and reconnects with backoff.
 */
@ConfigurationProperties(prefix = "talentledger.feed")
@NoArgsConstructor
@Getter
@Setter
public class FeedProperties {

    /** When false the runner does not start; the API still serves stored state. */
    private boolean enabled = true;

    /** First block to index when no checkpoint exists (contract deployment block). */
    private long startBlock = 0L;

    /** Largest eth_getLogs range per request. */
    private int maxBlockRange = 1000;

    /** Blocks behind head that are considered final. */
    private int confirmations = 2;

    private long pollIntervalMs = 4_000L;

    private long reconnectBaseDelayMs = 1_000L;

    private long reconnectMaxDelayMs = 60_000L;
}
