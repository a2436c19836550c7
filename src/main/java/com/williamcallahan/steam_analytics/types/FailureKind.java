package com.williamcallahan.steam_analytics.types;

/**
 * Classification of a per-entity source failure. Transient kinds are retried.
 */
public enum FailureKind {
    NETWORK(true),
    TIMEOUT(true),
    THROTTLED(true),
    SERVER_ERROR(true),
    NOT_FOUND(false),
    MALFORMED(false),
    CLIENT_ERROR(false);

    private final boolean transientFailure;

    FailureKind(boolean transientFailure) {
        this.transientFailure = transientFailure;
    }

    public boolean isTransient() {
        return transientFailure;
    }
}
