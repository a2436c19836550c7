package com.williamcallahan.steam_analytics.service.source;

import com.williamcallahan.steam_analytics.types.FailureKind;

/**
 * Result of a retried fetch: either a value or a typed failure, never an exception.
 */
public final class FetchOutcome<T> {

    private final T value;
    private final FailureKind failureKind;
    private final String failureMessage;
    private final int attempts;

    private FetchOutcome(T value, FailureKind failureKind, String failureMessage, int attempts) {
        this.value = value;
        this.failureKind = failureKind;
        this.failureMessage = failureMessage;
        this.attempts = attempts;
    }

    public static <T> FetchOutcome<T> success(T value, int attempts) {
        return new FetchOutcome<>(value, null, null, attempts);
    }

    public static <T> FetchOutcome<T> failure(FailureKind kind, String message, int attempts) {
        return new FetchOutcome<>(null, kind, message, attempts);
    }

    public boolean isSuccess() {
        return failureKind == null;
    }

    public T getValue() {
        if (!isSuccess()) {
            throw new IllegalStateException("Fetch failed with " + failureKind + ": " + failureMessage);
        }
        return value;
    }

    public FailureKind getFailureKind() {
        return failureKind;
    }

    public String getFailureMessage() {
        return failureMessage;
    }

    public int getAttempts() {
        return attempts;
    }
}
