package com.williamcallahan.steam_analytics.service;

import com.williamcallahan.steam_analytics.dto.SourceAcquisitionStats;
import com.williamcallahan.steam_analytics.dto.SourceFailure;
import com.williamcallahan.steam_analytics.types.SourceName;

import java.util.List;
import java.util.Set;
import java.util.TreeSet;

/**
 * Output of one Source Client batch: the normalized records plus the entities that failed.
 *
 * @param succeededKeys appids that produced at least an empty successful response
 */
public record AcquisitionResult<T>(
    SourceName source,
    int requestedKeys,
    List<T> records,
    Set<Long> succeededKeys,
    List<SourceFailure> failures
) {
    public AcquisitionResult {
        records = List.copyOf(records);
        succeededKeys = Set.copyOf(new TreeSet<>(succeededKeys));
        failures = List.copyOf(failures);
    }

    public static <T> AcquisitionResult<T> of(SourceName source, List<T> records, Set<Long> succeededKeys) {
        return new AcquisitionResult<>(source, succeededKeys.size(), records, succeededKeys, List.of());
    }

    public SourceAcquisitionStats toStats() {
        return new SourceAcquisitionStats(source, true, requestedKeys, records.size(), succeededKeys.size(), failures);
    }
}
