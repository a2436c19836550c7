package com.williamcallahan.steam_analytics.dto;

import java.math.BigDecimal;
import java.time.LocalDate;

/**
 * Read-side tuple over {@code fact_player_price}, handed to the statistical layer.
 * {@code period} is the first day of the fact's month.
 */
public record PlayerPriceObservation(
    long appId,
    LocalDate period,
    Integer avgPlayers,
    Integer peakPlayers,
    BigDecimal gainPercent,
    BigDecimal currentPrice,
    BigDecimal originalPrice,
    BigDecimal discountPercent,
    boolean discountActive,
    boolean salePeriod,
    String saleName
) {
}
