package com.williamcallahan.steam_analytics.dto;

import com.williamcallahan.steam_analytics.types.SourceName;

import java.util.List;

/**
 * Per-source section of the run report.
 *
 * @param refreshed false when the source's data came from the stored baseline
 */
public record SourceAcquisitionStats(
    SourceName source,
    boolean refreshed,
    int requestedKeys,
    int records,
    int succeededKeys,
    List<SourceFailure> failures
) {
    public SourceAcquisitionStats {
        failures = failures == null ? List.of() : List.copyOf(failures);
    }

    public static SourceAcquisitionStats baseline(SourceName source, int requestedKeys, int records, int keysWithData) {
        return new SourceAcquisitionStats(source, false, requestedKeys, records, keysWithData, List.of());
    }

    public int failureCount() {
        return failures.size();
    }
}
