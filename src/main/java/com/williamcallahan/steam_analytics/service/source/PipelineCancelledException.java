package com.williamcallahan.steam_analytics.service.source;

/**
 * The run was cancelled or timed out. Unlike per-entity failures this propagates
 * out of source clients so in-flight work unwinds immediately.
 */
public class PipelineCancelledException extends RuntimeException {

    public PipelineCancelledException(String message) {
        super(message);
    }

    public PipelineCancelledException(String message, Throwable cause) {
        super(message, cause);
    }
}
