package com.williamcallahan.steam_analytics.types;

public enum RunStatus {
    /** Every requested entity was acquired and every record loaded. */
    COMPLETED,
    /** Loaded, with per-entity or per-record failures recorded in the report. */
    COMPLETED_WITH_FAILURES,
    /** No entity succeeded, or an unexpected error stopped the run. Nothing loaded. */
    FAILED,
    /** Source failure rate exceeded the configured threshold. Nothing loaded. */
    ABORTED,
    /** Timed out or cancelled. Nothing loaded. */
    CANCELLED,
    /** Another run held the pipeline lock for longer than the lock wait. */
    REJECTED;

    public boolean isSuccessful() {
        return this == COMPLETED || this == COMPLETED_WITH_FAILURES;
    }
}
