package com.williamcallahan.steam_analytics.service.source;

import com.williamcallahan.steam_analytics.types.FailureKind;
import com.williamcallahan.steam_analytics.types.SourceName;

/**
 * Not found, malformed payload or a non-retryable 4xx. Reported without retry.
 */
public class PermanentSourceException extends SourceFetchException {

    public PermanentSourceException(SourceName source, long appId, FailureKind kind, String message, Throwable cause) {
        super(source, appId, kind, message, cause);
        if (kind.isTransient()) {
            throw new IllegalArgumentException(kind + " is not a permanent failure kind");
        }
    }

    public static PermanentSourceException malformed(SourceName source, long appId, String message, Throwable cause) {
        return new PermanentSourceException(source, appId, FailureKind.MALFORMED, message, cause);
    }

    public static PermanentSourceException notFound(SourceName source, long appId, String message) {
        return new PermanentSourceException(source, appId, FailureKind.NOT_FOUND, message, null);
    }
}
