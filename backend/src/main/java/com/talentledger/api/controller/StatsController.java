package com.talentledger.api.controller;

import com.talentledger.api.dto.HealthResponse;
import com.talentledger.api.dto.StatsResponse;
import com.talentledger.common.AmountFormat;
import com.talentledger.domain.FeedCheckpoint;
import com.talentledger.query.PlatformStats;
import com.talentledger.query.StatsQueryService;
import com.talentledger.reconcile.job.ReconciliationRunner;
import com.talentledger.reconcile.store.CheckpointStore;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.time.Instant;
import java.util.Optional;

/**
 * GET /stats, GET /health.
 */
@RestController
@RequestMapping("/api/v1")
@RequiredArgsConstructor
public class StatsController {

    private final StatsQueryService statsQueryService;
    private final CheckpointStore checkpointStore;
    private final ReconciliationRunner runner;

    @GetMapping("/stats")
    public ResponseEntity<StatsResponse> getStats() {
        PlatformStats s = statsQueryService.platformStats();
        return ResponseEntity.ok(new StatsResponse(
                s.totalAgreements(),
                s.activeAgreements(),
                s.completedAgreements(),
                s.companies(),
                s.talents(),
                s.totalVolume().toBigInteger().toString(),
                AmountFormat.toEther(s.totalVolume()),
                s.platformFees().toBigInteger().toString(),
                AmountFormat.toEther(s.platformFees()),
                s.paidMilestones()));
    }

    @GetMapping("/health")
    public ResponseEntity<HealthResponse> health() {
        Optional<FeedCheckpoint> checkpoint = checkpointStore.find();
        return ResponseEntity.ok(new HealthResponse(
                "UP",
                runner.isRunning(),
                checkpoint.map(FeedCheckpoint::getLastDispatchedBlock).orElse(null),
                checkpoint.map(FeedCheckpoint::getMode).map(Enum::name).orElse(null),
                statsQueryService.openQuarantineCount(),
                Instant.now()));
    }
}
