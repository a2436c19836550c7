package com.williamcallahan.steam_analytics.dto;

import java.time.LocalDate;
import java.util.List;

public record DataQualitySnapshot(
    long totalGames,
    long gamesWithPriceData,
    long gamesWithPlayerData,
    long gamesMissingMetadata,
    LocalDate oldestFactDate,
    LocalDate newestFactDate,
    double avgFactsPerGame,
    List<String> recommendations
) {
    public DataQualitySnapshot {
        recommendations = recommendations == null ? List.of() : List.copyOf(recommendations);
    }
}
