package com.williamcallahan.steam_analytics.repository;

import com.williamcallahan.steam_analytics.model.FactRow;
import com.williamcallahan.steam_analytics.model.GameTagLink;
import com.williamcallahan.steam_analytics.model.MergedGame;
import com.williamcallahan.steam_analytics.types.WriteOutcome;
import com.williamcallahan.steam_analytics.util.JdbcUtils;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.stereotype.Repository;

import java.time.LocalDate;
import java.util.List;

/**
 * PostgreSQL upserts for the star schema.
 * <p>
 * Game and fact upserts only touch a row when a value actually changes, and report
 * insert versus update through {@code xmax = 0} on the returned row.
 */
@Repository
public class JdbcDestinationStore implements DestinationStore {

    static final String UPSERT_GENRE =
        "INSERT INTO dim_genre (genre_name, created_at) VALUES (?, NOW()) " +
        "ON CONFLICT (genre_name) DO NOTHING";

    static final String UPSERT_TAG =
        "INSERT INTO dim_tag (tag_name, created_at) VALUES (?, NOW()) " +
        "ON CONFLICT (tag_name) DO NOTHING";

    // Only the name is overwritten unconditionally; every other column keeps its stored value over a null
    static final String UPSERT_GAME =
        "INSERT INTO dim_game (appid, name, developer, publisher, release_date, is_free, steamspy_owners_min, steamspy_owners_max, positive_reviews, negative_reviews, created_at, updated_at) " +
        "VALUES (?, ?, ?, ?, ?, ?, ?, ?, ?, ?, NOW(), NOW()) " +
        "ON CONFLICT (appid) DO UPDATE SET " +
        "name = EXCLUDED.name, " +
        "developer = COALESCE(EXCLUDED.developer, dim_game.developer), " +
        "publisher = COALESCE(EXCLUDED.publisher, dim_game.publisher), " +
        "release_date = COALESCE(EXCLUDED.release_date, dim_game.release_date), " +
        "is_free = COALESCE(EXCLUDED.is_free, dim_game.is_free), " +
        "steamspy_owners_min = COALESCE(EXCLUDED.steamspy_owners_min, dim_game.steamspy_owners_min), " +
        "steamspy_owners_max = COALESCE(EXCLUDED.steamspy_owners_max, dim_game.steamspy_owners_max), " +
        "positive_reviews = COALESCE(EXCLUDED.positive_reviews, dim_game.positive_reviews), " +
        "negative_reviews = COALESCE(EXCLUDED.negative_reviews, dim_game.negative_reviews), " +
        "updated_at = NOW() " +
        "WHERE (dim_game.name, dim_game.developer, dim_game.publisher, dim_game.release_date, dim_game.is_free, " +
        "dim_game.steamspy_owners_min, dim_game.steamspy_owners_max, dim_game.positive_reviews, dim_game.negative_reviews) " +
        "IS DISTINCT FROM (EXCLUDED.name, COALESCE(EXCLUDED.developer, dim_game.developer), COALESCE(EXCLUDED.publisher, dim_game.publisher), " +
        "COALESCE(EXCLUDED.release_date, dim_game.release_date), COALESCE(EXCLUDED.is_free, dim_game.is_free), " +
        "COALESCE(EXCLUDED.steamspy_owners_min, dim_game.steamspy_owners_min), COALESCE(EXCLUDED.steamspy_owners_max, dim_game.steamspy_owners_max), " +
        "COALESCE(EXCLUDED.positive_reviews, dim_game.positive_reviews), COALESCE(EXCLUDED.negative_reviews, dim_game.negative_reviews)) " +
        "RETURNING (xmax = 0) AS inserted";

    static final String UPSERT_FACT =
        "INSERT INTO fact_player_price (game_id, date_id, genre_id, concurrent_players_avg, concurrent_players_peak, player_gain, gain_pct, current_price, original_price, discount_pct, is_discount_active, created_at, updated_at) " +
        "SELECT g.game_id, d.date_id, (SELECT genre_id FROM dim_genre WHERE genre_name = CAST(? AS VARCHAR)), " +
        "CAST(? AS INTEGER), CAST(? AS INTEGER), CAST(? AS INTEGER), CAST(? AS DECIMAL(10, 2)), " +
        "CAST(? AS DECIMAL(10, 2)), CAST(? AS DECIMAL(10, 2)), COALESCE(CAST(? AS DECIMAL(5, 2)), 0), COALESCE(CAST(? AS BOOLEAN), FALSE), NOW(), NOW() " +
        "FROM dim_game g JOIN dim_date d ON d.full_date = CAST(? AS DATE) " +
        "WHERE g.appid = ? " +
        "ON CONFLICT (game_id, date_id) DO UPDATE SET " +
        "genre_id = COALESCE(EXCLUDED.genre_id, fact_player_price.genre_id), " +
        "concurrent_players_avg = EXCLUDED.concurrent_players_avg, " +
        "concurrent_players_peak = EXCLUDED.concurrent_players_peak, " +
        "player_gain = EXCLUDED.player_gain, " +
        "gain_pct = EXCLUDED.gain_pct, " +
        "current_price = EXCLUDED.current_price, " +
        "original_price = EXCLUDED.original_price, " +
        "discount_pct = EXCLUDED.discount_pct, " +
        "is_discount_active = EXCLUDED.is_discount_active, " +
        "updated_at = NOW() " +
        "WHERE (fact_player_price.genre_id, fact_player_price.concurrent_players_avg, fact_player_price.concurrent_players_peak, " +
        "fact_player_price.player_gain, fact_player_price.gain_pct, fact_player_price.current_price, fact_player_price.original_price, " +
        "fact_player_price.discount_pct, fact_player_price.is_discount_active) " +
        "IS DISTINCT FROM (COALESCE(EXCLUDED.genre_id, fact_player_price.genre_id), EXCLUDED.concurrent_players_avg, EXCLUDED.concurrent_players_peak, " +
        "EXCLUDED.player_gain, EXCLUDED.gain_pct, EXCLUDED.current_price, EXCLUDED.original_price, " +
        "EXCLUDED.discount_pct, EXCLUDED.is_discount_active) " +
        "RETURNING (xmax = 0) AS inserted";

    static final String FACT_EXISTS =
        "SELECT 1 FROM fact_player_price f " +
        "JOIN dim_game g ON g.game_id = f.game_id " +
        "JOIN dim_date d ON d.date_id = f.date_id " +
        "WHERE g.appid = ? AND d.full_date = CAST(? AS DATE)";

    static final String UPSERT_BRIDGE =
        "INSERT INTO bridge_game_tag (game_id, tag_id) " +
        "SELECT g.game_id, t.tag_id FROM dim_game g JOIN dim_tag t ON t.tag_name = CAST(? AS VARCHAR) " +
        "WHERE g.appid = ? " +
        "ON CONFLICT (game_id, tag_id) DO NOTHING";

    static final String BRIDGE_EXISTS =
        "SELECT 1 FROM bridge_game_tag b " +
        "JOIN dim_game g ON g.game_id = b.game_id " +
        "JOIN dim_tag t ON t.tag_id = b.tag_id " +
        "WHERE t.tag_name = ? AND g.appid = ?";

    private final JdbcTemplate jdbcTemplate;

    public JdbcDestinationStore(JdbcTemplate jdbcTemplate) {
        this.jdbcTemplate = jdbcTemplate;
    }

    @Override
    public WriteOutcome upsertGenre(String genreName) {
        return jdbcTemplate.update(UPSERT_GENRE, genreName) > 0 ? WriteOutcome.INSERTED : WriteOutcome.UNCHANGED;
    }

    @Override
    public WriteOutcome upsertTag(String tagName) {
        return jdbcTemplate.update(UPSERT_TAG, tagName) > 0 ? WriteOutcome.INSERTED : WriteOutcome.UNCHANGED;
    }

    @Override
    public WriteOutcome upsertGame(MergedGame game) {
        List<Boolean> result = jdbcTemplate.query(UPSERT_GAME,
            (rs, rowNum) -> rs.getBoolean("inserted"),
            game.appId(),
            game.name(),
            game.developer(),
            game.publisher(),
            game.releaseDate(),
            game.free(),
            game.ownersMin(),
            game.ownersMax(),
            game.positiveReviews(),
            game.negativeReviews()
        );
        return toOutcome(result);
    }

    @Override
    public WriteOutcome upsertFact(FactRow fact) {
        LocalDate periodStart = fact.period().atDay(1);
        List<Boolean> result = jdbcTemplate.query(UPSERT_FACT,
            (rs, rowNum) -> rs.getBoolean("inserted"),
            fact.genreName(),
            fact.avgPlayers(),
            fact.peakPlayers(),
            fact.playerGain(),
            fact.gainPercent(),
            fact.currentPrice(),
            fact.originalPrice(),
            fact.discountPercent(),
            fact.discountActive(),
            periodStart,
            fact.appId()
        );
        if (!result.isEmpty()) {
            return toOutcome(result);
        }
        if (JdbcUtils.exists(jdbcTemplate, FACT_EXISTS, fact.appId(), periodStart)) {
            return WriteOutcome.UNCHANGED;
        }
        throw new DataIntegrityViolationException(
            "No dim_game row for appid " + fact.appId() + " or no dim_date row for " + periodStart);
    }

    @Override
    public WriteOutcome upsertBridge(GameTagLink link) {
        if (jdbcTemplate.update(UPSERT_BRIDGE, link.tagName(), link.appId()) > 0) {
            return WriteOutcome.INSERTED;
        }
        if (JdbcUtils.exists(jdbcTemplate, BRIDGE_EXISTS, link.tagName(), link.appId())) {
            return WriteOutcome.UNCHANGED;
        }
        throw new DataIntegrityViolationException(
            "No dim_game row for appid " + link.appId() + " or no dim_tag row for '" + link.tagName() + "'");
    }

    private static WriteOutcome toOutcome(List<Boolean> result) {
        if (result.isEmpty()) {
            return WriteOutcome.UNCHANGED;
        }
        return Boolean.TRUE.equals(result.get(0)) ? WriteOutcome.INSERTED : WriteOutcome.UPDATED;
    }
}
