package com.williamcallahan.steam_analytics.dto;

import com.williamcallahan.steam_analytics.types.LoadTable;

import java.util.Collections;
import java.util.EnumMap;
import java.util.Map;

/**
 * Loader output: counts per destination table, in write order.
 */
public record LoadStats(Map<LoadTable, TableLoadStats> tables) {

    public static final LoadStats NONE = new LoadStats(Map.of());

    public LoadStats {
        EnumMap<LoadTable, TableLoadStats> copy = new EnumMap<>(LoadTable.class);
        if (tables != null) {
            copy.putAll(tables);
        }
        tables = Collections.unmodifiableMap(copy);
    }

    public TableLoadStats forTable(LoadTable table) {
        return tables.getOrDefault(table, TableLoadStats.empty(table));
    }

    public int totalFailed() {
        return tables.values().stream().mapToInt(TableLoadStats::failed).sum();
    }

    public int totalWritten() {
        return tables.values().stream().mapToInt(t -> t.inserted() + t.updated()).sum();
    }

    public boolean hasFailures() {
        return totalFailed() > 0;
    }
}
