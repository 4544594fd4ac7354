package com.talentledger.reconcile.config;

import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

/**
 * Reconciliation worker and retry settings. The fee rate splits each milestone payout.
 */
@ConfigurationProperties(prefix = "talentledger.reconcile")
@Validated
@NoArgsConstructor
@Getter
@Setter
public class ReconcileProperties {

    /** Single-thread workers; a partition always maps to the same worker. */
    @Min(1)
    private int workerPartitions = 4;

    /** Attempts per notification for transient failures before it is quarantined. */
    @Min(1)
    private int maxAttempts = 5;

    private long baseDelayMs = 500L;

    private long maxDelayMs = 10_000L;

    private double jitterFactor = 0.2;

    /** Time given to in-flight work on shutdown before it is abandoned. */
    private long shutdownTimeoutMs = 10_000L;

    /** Platform fee on the gross milestone amount; 200 = 2%. */
    @Min(0)
    @Max(10_000)
    private int platformFeeBasisPoints = 200;

    /** Interval of the sweep that publishes committed records left unpublished by a crash. */
    private long publishSweepIntervalMs = 60_000L;
}
