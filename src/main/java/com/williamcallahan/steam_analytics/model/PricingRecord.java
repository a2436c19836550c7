package com.williamcallahan.steam_analytics.model;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.List;

/**
 * Current price state and store-side release info for one game.
 * Amounts are in currency units (not cents). Nullable fields are absent when the
 * record comes from the stored baseline rather than a live store response.
 */
public record PricingRecord(
    long appId,
    String name,
    Boolean free,
    BigDecimal currentPrice,
    BigDecimal originalPrice,
    Integer discountPercent,
    String currency,
    LocalDate releaseDate,
    boolean comingSoon,
    String developer,
    String publisher,
    List<String> genres,
    List<String> categories
) {
    public PricingRecord {
        genres = genres == null ? List.of() : List.copyOf(genres);
        categories = categories == null ? List.of() : List.copyOf(categories);
        if (discountPercent != null && (discountPercent < 0 || discountPercent > 100)) {
            throw new IllegalArgumentException("discountPercent out of range: " + discountPercent);
        }
    }

    public boolean discountActive() {
        return discountPercent != null && discountPercent > 0;
    }

    /**
     * Price-only record, as reconstructed from the latest stored snapshot.
     */
    public static PricingRecord priceOnly(long appId, BigDecimal currentPrice, BigDecimal originalPrice, Integer discountPercent) {
        return new PricingRecord(appId, null, null, currentPrice, originalPrice, discountPercent, null, null, false,
            null, null, List.of(), List.of());
    }
}
