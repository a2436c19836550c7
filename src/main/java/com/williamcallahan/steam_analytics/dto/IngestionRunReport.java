package com.williamcallahan.steam_analytics.dto;

import com.williamcallahan.steam_analytics.types.RunStatus;
import com.williamcallahan.steam_analytics.types.RunType;
import com.williamcallahan.steam_analytics.types.SourceName;

import java.time.Duration;
import java.time.Instant;
import java.util.Collections;
import java.util.EnumMap;
import java.util.Map;

/**
 * Structured summary returned by every pipeline run, whatever its outcome, and
 * published to the status collaborators on completion.
 */
public record IngestionRunReport(
    String runId,
    RunType runType,
    RunStatus status,
    String trigger,
    Instant startedAt,
    Instant finishedAt,
    int requestedKeys,
    Map<SourceName, SourceAcquisitionStats> sources,
    MergeCounts merge,
    LoadStats load,
    String message
) {
    public IngestionRunReport {
        EnumMap<SourceName, SourceAcquisitionStats> copy = new EnumMap<>(SourceName.class);
        if (sources != null) {
            copy.putAll(sources);
        }
        sources = Collections.unmodifiableMap(copy);
        merge = merge == null ? MergeCounts.NONE : merge;
        load = load == null ? LoadStats.NONE : load;
    }

    public Duration duration() {
        if (startedAt == null || finishedAt == null) {
            return Duration.ZERO;
        }
        return Duration.between(startedAt, finishedAt);
    }

    public int totalSourceFailures() {
        return sources.values().stream().mapToInt(SourceAcquisitionStats::failureCount).sum();
    }

    public SourceAcquisitionStats source(SourceName source) {
        return sources.get(source);
    }
}
