package com.williamcallahan.steam_analytics.types;

import java.util.EnumSet;
import java.util.Locale;
import java.util.Set;

/**
 * Which sources a pipeline run refreshes. Sources a run does not refresh are
 * represented by what is already stored.
 */
public enum RunType {
    FULL(EnumSet.allOf(SourceName.class)),
    PRICING(EnumSet.of(SourceName.STEAM_STORE)),
    PLAYER_COUNTS(EnumSet.of(SourceName.STEAMCHARTS)),
    METADATA(EnumSet.of(SourceName.STEAMSPY));

    private final Set<SourceName> refreshedSources;

    RunType(Set<SourceName> refreshedSources) {
        this.refreshedSources = refreshedSources;
    }

    public boolean refreshes(SourceName source) {
        return refreshedSources.contains(source);
    }

    public Set<SourceName> getRefreshedSources() {
        return EnumSet.copyOf(refreshedSources);
    }

    /**
     * Lenient parse for CLI and configuration input ("pricing", "player-counts", ...).
     */
    public static RunType fromString(String value) {
        if (value == null || value.isBlank()) {
            return FULL;
        }
        String normalized = value.trim().toUpperCase(Locale.ROOT).replace('-', '_');
        return RunType.valueOf(normalized);
    }
}
