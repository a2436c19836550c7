package com.williamcallahan.steam_analytics.service.source;

import com.williamcallahan.steam_analytics.types.FailureKind;
import com.williamcallahan.steam_analytics.types.SourceName;

/**
 * Network error, timeout, throttling or 5xx. Retried with back-off.
 */
public class TransientSourceException extends SourceFetchException {

    public TransientSourceException(SourceName source, long appId, FailureKind kind, String message, Throwable cause) {
        super(source, appId, kind, message, cause);
        if (!kind.isTransient()) {
            throw new IllegalArgumentException(kind + " is not a transient failure kind");
        }
    }
}
