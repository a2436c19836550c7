package com.williamcallahan.steam_analytics.dto;

import com.williamcallahan.steam_analytics.types.LoadTable;

import java.util.List;

public record TableLoadStats(
    LoadTable table,
    int inserted,
    int updated,
    int unchanged,
    int failed,
    List<RecordFailure> failures
) {
    public TableLoadStats {
        failures = failures == null ? List.of() : List.copyOf(failures);
    }

    public static TableLoadStats empty(LoadTable table) {
        return new TableLoadStats(table, 0, 0, 0, 0, List.of());
    }

    public int attempted() {
        return inserted + updated + unchanged + failed;
    }
}
