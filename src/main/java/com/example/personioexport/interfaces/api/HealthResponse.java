package com.example.personioexport.interfaces.api;

import com.example.personioexport.domain.model.ExportRunOutcome;

import java.time.Instant;

/**
 * API-layer DTO returned by {@code GET /health}.
 */
public record HealthResponse(
        String status,
        double uptimeSeconds,
        Instant timestamp,
        ExportRunOutcome lastRun
) {
}
