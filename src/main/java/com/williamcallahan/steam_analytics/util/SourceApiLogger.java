package com.williamcallahan.steam_analytics.util;

import com.williamcallahan.steam_analytics.types.FailureKind;
import com.williamcallahan.steam_analytics.types.SourceName;
import org.slf4j.Logger;

/**
 * Uniform log lines for calls to the external Steam sources so one grep on
 * {@code [SOURCE-API]} follows a run's traffic across all three clients.
 */
public final class SourceApiLogger {

    private static final String PREFIX = "[SOURCE-API]";

    private SourceApiLogger() {
    }

    /**
     * Log an outgoing request
     */
    public static void logRequest(Logger log, SourceName source, String endpoint, long appId) {
        if (log.isDebugEnabled()) {
            log.debug(String.format("%s [%s] REQUEST: endpoint=%s appid=%s",
                PREFIX, source.getDisplayName(), endpoint, describeKey(appId)));
        }
    }

    /**
     * Log a response, including non-2xx ones
     */
    public static void logResponse(Logger log, SourceName source, String endpoint, long appId, int status, int bodySize, long elapsedMs) {
        if (log.isDebugEnabled()) {
            log.debug(String.format("%s [%s] RESPONSE: endpoint=%s appid=%s status=%d bodySize=%d bytes elapsed=%dms",
                PREFIX, source.getDisplayName(), endpoint, describeKey(appId), status, bodySize, elapsedMs));
        }
    }

    /**
     * Log a transient failure that will be retried
     */
    public static void logRetry(Logger log, SourceName source, long appId, int failedAttempt, FailureKind kind, String reason) {
        log.info(String.format("%s [%s] RETRY: appid=%s attempt=%d failed with %s - %s",
            PREFIX, source.getDisplayName(), describeKey(appId), failedAttempt, kind, reason));
    }

    /**
     * Log a per-entity failure surfaced to the run report
     */
    public static void logFailure(Logger log, SourceName source, long appId, FailureKind kind, int attempts, String reason) {
        log.warn(String.format("%s [%s] FAILURE: appid=%s kind=%s attempts=%d - %s",
            PREFIX, source.getDisplayName(), describeKey(appId), kind, attempts, reason));
    }

    public static void logProgress(Logger log, SourceName source, int processed, int total) {
        log.info(String.format("%s [%s] PROGRESS: %d/%d entities processed",
            PREFIX, source.getDisplayName(), processed, total));
    }

    public static void logAcquisitionComplete(Logger log, SourceName source, int records, int succeeded, int failed) {
        log.info(String.format("%s [%s] COMPLETE: records=%d succeededKeys=%d failedKeys=%d",
            PREFIX, source.getDisplayName(), records, succeeded, failed));
    }

    private static String describeKey(long appId) {
        return appId > 0 ? Long.toString(appId) : "-";
    }
}
