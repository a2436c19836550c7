package com.williamcallahan.steam_analytics.dto;

import com.williamcallahan.steam_analytics.types.FailureKind;

/**
 * An entity a source could not deliver after retries (or immediately, for permanent failures).
 */
public record SourceFailure(long appId, FailureKind kind, String message, int attempts) {
}
