package com.williamcallahan.steam_analytics.dto;

import java.time.Instant;
import java.util.List;

/**
 * Point-in-time pipeline status: last successful full and pricing runs, the run in
 * flight (if any) and the most recent reports, newest first.
 */
public record IngestionStatusSnapshot(
    Instant lastFullRun,
    Instant lastPricingRun,
    boolean running,
    String activeRunId,
    List<IngestionRunReport> recentRuns
) {
    public IngestionStatusSnapshot {
        recentRuns = recentRuns == null ? List.of() : List.copyOf(recentRuns);
    }
}
