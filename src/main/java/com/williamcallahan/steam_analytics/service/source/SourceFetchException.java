package com.williamcallahan.steam_analytics.service.source;

import com.williamcallahan.steam_analytics.types.FailureKind;
import com.williamcallahan.steam_analytics.types.SourceName;

/**
 * A single fetch against an external source failed for one entity.
 * <p>
 * Never escapes a source client: the retry executor turns it into a
 * {@link FetchOutcome} failure once retries are exhausted or the failure is permanent.
 */
public abstract class SourceFetchException extends RuntimeException {

    private final SourceName source;
    private final long appId;
    private final FailureKind kind;

    protected SourceFetchException(SourceName source, long appId, FailureKind kind, String message, Throwable cause) {
        super(message, cause);
        this.source = source;
        this.appId = appId;
        this.kind = kind;
    }

    public SourceName getSource() {
        return source;
    }

    public long getAppId() {
        return appId;
    }

    public FailureKind getKind() {
        return kind;
    }

    public static SourceFetchException of(SourceName source, long appId, FailureKind kind, String message) {
        return of(source, appId, kind, message, null);
    }

    public static SourceFetchException of(SourceName source, long appId, FailureKind kind, String message, Throwable cause) {
        if (kind.isTransient()) {
            return new TransientSourceException(source, appId, kind, message, cause);
        }
        return new PermanentSourceException(source, appId, kind, message, cause);
    }

    /**
     * Maps a non-2xx HTTP status: 404 is not found, 408/429 are throttling,
     * 5xx is a server error and any other 4xx a client error.
     */
    public static SourceFetchException forStatus(SourceName source, long appId, int status) {
        FailureKind kind;
        if (status == 404) {
            kind = FailureKind.NOT_FOUND;
        } else if (status == 408 || status == 429) {
            kind = FailureKind.THROTTLED;
        } else if (status >= 500) {
            kind = FailureKind.SERVER_ERROR;
        } else {
            kind = FailureKind.CLIENT_ERROR;
        }
        return of(source, appId, kind, "HTTP " + status);
    }
}
