package com.williamcallahan.steam_analytics.model;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.List;
import java.util.Objects;
import java.util.TreeSet;

/**
 * Normalized metadata for one game as reported by the metadata source (or by the
 * stored baseline when the metadata source is not refreshed in a run).
 * <p>
 * {@code genres} keeps source order (the first entry is the primary genre);
 * {@code tags} is a sorted, duplicate-free set of tag names. Price fields are
 * only a fallback for when the pricing source has nothing for this game.
 */
public record MetadataRecord(
    long appId,
    String name,
    String developer,
    String publisher,
    LocalDate releaseDate,
    Boolean free,
    Long ownersMin,
    Long ownersMax,
    Integer positiveReviews,
    Integer negativeReviews,
    BigDecimal currentPrice,
    BigDecimal originalPrice,
    Integer discountPercent,
    List<String> genres,
    List<String> tags
) {
    public MetadataRecord {
        genres = genres == null ? List.of() : List.copyOf(genres);
        tags = tags == null ? List.of() : List.copyOf(new TreeSet<>(tags));
        if (ownersMin != null && ownersMax != null && ownersMin > ownersMax) {
            throw new IllegalArgumentException("ownersMin " + ownersMin + " exceeds ownersMax " + ownersMax + " for app " + appId);
        }
    }

    public String primaryGenre() {
        return genres.isEmpty() ? null : genres.get(0);
    }

    public MetadataRecord withTags(List<String> newTags) {
        return new MetadataRecord(appId, name, developer, publisher, releaseDate, free, ownersMin, ownersMax,
            positiveReviews, negativeReviews, currentPrice, originalPrice, discountPercent, genres, newTags);
    }

    /**
     * Number of populated scalar fields, used to rank duplicate records.
     */
    public int populatedFieldCount() {
        int count = 0;
        for (Object value : new Object[] {name, developer, publisher, releaseDate, free, ownersMin, ownersMax,
            positiveReviews, negativeReviews, currentPrice, originalPrice, discountPercent}) {
            if (value != null) {
                count++;
            }
        }
        return count + (genres.isEmpty() ? 0 : 1) + (tags.isEmpty() ? 0 : 1);
    }

    public boolean hasPriceData() {
        return Objects.nonNull(currentPrice) || Objects.nonNull(originalPrice);
    }
}
