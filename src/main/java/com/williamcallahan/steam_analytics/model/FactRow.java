package com.williamcallahan.steam_analytics.model;

import java.math.BigDecimal;
import java.time.YearMonth;
import java.util.Objects;

/**
 * One {@code fact_player_price} row: player metrics for a month plus the run's price snapshot.
 * Natural key is (appId, period).
 */
public record FactRow(
    long appId,
    YearMonth period,
    String genreName,
    Integer avgPlayers,
    Integer peakPlayers,
    Integer playerGain,
    BigDecimal gainPercent,
    BigDecimal currentPrice,
    BigDecimal originalPrice,
    Integer discountPercent,
    Boolean discountActive
) {
    public FactRow {
        Objects.requireNonNull(period, "period");
    }

    public static FactRow of(PlayerCountRecord players, String genreName, PriceSnapshot price) {
        return new FactRow(players.appId(), players.month(), genreName, players.avgPlayers(), players.peakPlayers(),
            players.gain(), players.gainPercent(), price.currentPrice(), price.originalPrice(),
            price.discountPercent(), price.discountActive());
    }

    public boolean hasPlayerMetrics() {
        return avgPlayers != null || peakPlayers != null;
    }

    public int populatedFieldCount() {
        int count = 0;
        for (Object value : new Object[] {genreName, avgPlayers, peakPlayers, playerGain, gainPercent,
            currentPrice, originalPrice, discountPercent, discountActive}) {
            if (value != null) {
                count++;
            }
        }
        return count;
    }

    public String naturalKey() {
        return appId + "/" + period;
    }
}
