package com.williamcallahan.steam_analytics.service.event;

import com.williamcallahan.steam_analytics.types.RunType;

import java.time.Instant;

/**
 * Event published once a run holds the pipeline lock and begins work.
 */
public class IngestionRunStartedEvent {
    private final String runId;
    private final RunType runType;
    private final Instant startedAt;

    public IngestionRunStartedEvent(String runId, RunType runType, Instant startedAt) {
        this.runId = runId;
        this.runType = runType;
        this.startedAt = startedAt;
    }

    public String getRunId() { return runId; }
    public RunType getRunType() { return runType; }
    public Instant getStartedAt() { return startedAt; }
}
