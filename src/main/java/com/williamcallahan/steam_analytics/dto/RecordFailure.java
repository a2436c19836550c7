package com.williamcallahan.steam_analytics.dto;

/**
 * A single destination write that failed; the rest of its table group still ran.
 */
public record RecordFailure(String naturalKey, String reason) {
}
