package com.williamcallahan.steam_analytics.model;

/**
 * Owner-count estimate bounds, min &lt;= max.
 */
public record OwnerRange(long min, long max) {
    public OwnerRange {
        if (min < 0 || min > max) {
            throw new IllegalArgumentException("Invalid owner range " + min + " .. " + max);
        }
    }
}
