package com.williamcallahan.steam_analytics.service;

import com.williamcallahan.steam_analytics.model.FactRow;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.YearMonth;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.TreeMap;

/**
 * Guarantees at most one fact row per (appid, month) leaves the merge stage.
 * <p>
 * On collision the kept row is the one with player metrics, then the one with more populated
 * fields, then the lexically smallest rendering, so the choice never depends on input order.
 */
@Slf4j
@Service
public class FactRowDeduplicator {

    static final Comparator<FactRow> PREFERENCE = Comparator
        .comparing(FactRow::hasPlayerMetrics, Comparator.reverseOrder())
        .thenComparing(Comparator.comparingInt(FactRow::populatedFieldCount).reversed())
        .thenComparing(FactRow::toString);

    public DedupResult dedupe(Collection<FactRow> rows) {
        Map<FactKey, FactRow> kept = new TreeMap<>();
        int collisions = 0;
        for (FactRow row : rows) {
            FactKey key = new FactKey(row.appId(), row.period());
            FactRow existing = kept.get(key);
            if (existing == null) {
                kept.put(key, row);
                continue;
            }
            collisions++;
            if (PREFERENCE.compare(row, existing) < 0) {
                kept.put(key, row);
            }
        }
        if (collisions > 0) {
            log.warn("Removed {} colliding fact rows (same appid and month) before load", collisions);
        }
        return new DedupResult(new ArrayList<>(kept.values()), collisions);
    }

    /**
     * @param collisionsRemoved number of rows dropped because another row owned the same key
     */
    public record DedupResult(List<FactRow> rows, int collisionsRemoved) {
        public DedupResult {
            rows = List.copyOf(rows);
        }
    }

    private record FactKey(long appId, YearMonth period) implements Comparable<FactKey> {

        FactKey {
            Objects.requireNonNull(period, "period");
        }

        @Override
        public int compareTo(FactKey other) {
            int byApp = Long.compare(appId, other.appId);
            return byApp != 0 ? byApp : period.compareTo(other.period);
        }
    }
}
