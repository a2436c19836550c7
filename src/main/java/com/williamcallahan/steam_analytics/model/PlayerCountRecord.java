package com.williamcallahan.steam_analytics.model;

import java.math.BigDecimal;
import java.time.YearMonth;
import java.util.Objects;

/**
 * One monthly row of concurrent-player history for a game.
 */
public record PlayerCountRecord(
    long appId,
    YearMonth month,
    Integer avgPlayers,
    Integer peakPlayers,
    Integer gain,
    BigDecimal gainPercent
) {
    public PlayerCountRecord {
        Objects.requireNonNull(month, "month");
    }
}
