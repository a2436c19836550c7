package com.williamcallahan.steam_analytics.test.support;

import com.williamcallahan.steam_analytics.model.MetadataRecord;
import com.williamcallahan.steam_analytics.model.PlayerCountRecord;
import com.williamcallahan.steam_analytics.model.PricingRecord;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.time.YearMonth;
import java.util.List;

/**
 * Record builders shared by merge, loader and orchestrator tests.
 */
public final class SteamRecordFixtures {

    private SteamRecordFixtures() {
    }

    public static MetadataRecord metadata(long appId, String name, List<String> genres, List<String> tags) {
        return new MetadataRecord(appId, name, "Meta Dev", "Meta Pub", null, Boolean.FALSE,
            1_000L, 2_000L, 10, 2, new BigDecimal("9.99"), new BigDecimal("9.99"), 0, genres, tags);
    }

    /**
     * A game as the stored baseline returns it: descriptive fields only, no price fields.
     */
    public static MetadataRecord storedMetadata(long appId, String name, List<String> genres) {
        return new MetadataRecord(appId, name, "Valve", "Valve", LocalDate.of(2012, 8, 21), Boolean.FALSE,
            1_000L, 2_000L, 10, 2, null, null, null, genres, List.of());
    }

    /**
     * Counter-Strike 2 as SteamSpy reports it: metadata plus a stale full price.
     */
    public static MetadataRecord counterStrikeMetadata() {
        return new MetadataRecord(730, "Counter-Strike 2", "Valve", "Valve", null, Boolean.FALSE,
            50_000_000L, 100_000_000L, 7_000_000, 1_000_000, new BigDecimal("14.99"), new BigDecimal("14.99"), 0,
            List.of("Action", "Free to Play"), List.of("FPS", "Shooter"));
    }

    public static PlayerCountRecord players(long appId, YearMonth month, int avg, int peak) {
        return new PlayerCountRecord(appId, month, avg, peak, null, null);
    }

    public static PricingRecord pricing(long appId, String current, String original, int discount) {
        return new PricingRecord(appId, null, Boolean.FALSE, new BigDecimal(current), new BigDecimal(original),
            discount, "USD", LocalDate.of(2012, 8, 21), false, "Valve", "Valve", List.of("Action"), List.of());
    }
}
