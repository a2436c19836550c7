package com.williamcallahan.steam_analytics.model;

import java.time.LocalDate;

/**
 * A {@code dim_game} row after field-level authority rules were applied.
 * <p>
 * A null free flag or review count means no source reported it this run.
 */
public record MergedGame(
    long appId,
    String name,
    String developer,
    String publisher,
    LocalDate releaseDate,
    Boolean free,
    Long ownersMin,
    Long ownersMax,
    Integer positiveReviews,
    Integer negativeReviews
) {
}
