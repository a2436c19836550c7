package com.williamcallahan.steam_analytics.types;

/**
 * Result of a single insert-or-update against the destination store.
 */
public enum WriteOutcome {
    INSERTED,
    UPDATED,
    UNCHANGED
}
