package com.williamcallahan.steam_analytics.repository;

import com.williamcallahan.steam_analytics.model.FactRow;
import com.williamcallahan.steam_analytics.model.GameTagLink;
import com.williamcallahan.steam_analytics.model.MergedGame;
import com.williamcallahan.steam_analytics.types.WriteOutcome;

/**
 * Insert-or-update primitives keyed by each table's natural key.
 * <p>
 * Genres, tags and bridge rows are first-writer-wins; games and facts overwrite their mutable
 * fields and keep their creation timestamp. Implementations report {@link WriteOutcome#UNCHANGED}
 * when the stored row already matches, and throw a {@link org.springframework.dao.DataAccessException}
 * when the write violates a constraint (including a missing referenced row).
 */
public interface DestinationStore {

    WriteOutcome upsertGenre(String genreName);

    WriteOutcome upsertTag(String tagName);

    WriteOutcome upsertGame(MergedGame game);

    /**
     * Requires the game and the period's first day to exist in {@code dim_game} and {@code dim_date}.
     */
    WriteOutcome upsertFact(FactRow fact);

    /**
     * Requires the game and the tag to exist.
     */
    WriteOutcome upsertBridge(GameTagLink link);
}
