package com.talentledger.api.dto;

import java.time.Instant;

public record HealthResponse(
        String status,
        boolean feedRunning,
        Long lastDispatchedBlock,
        String feedMode,
        long openQuarantine,
        Instant timestamp
) {
}
