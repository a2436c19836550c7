package com.williamcallahan.steam_analytics.repository;

import com.williamcallahan.steam_analytics.model.MetadataRecord;
import com.williamcallahan.steam_analytics.model.PlayerCountRecord;
import com.williamcallahan.steam_analytics.model.PricingRecord;
import com.williamcallahan.steam_analytics.util.JdbcUtils;
import lombok.extern.slf4j.Slf4j;
import org.springframework.jdbc.core.namedparam.MapSqlParameterSource;
import org.springframework.jdbc.core.namedparam.NamedParameterJdbcTemplate;
import org.springframework.stereotype.Repository;

import java.math.BigDecimal;
import java.time.YearMonth;
import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;
import java.util.TreeSet;

/**
 * Reads the current stored state of the sources a run does not refresh.
 * <p>
 * A pricing-only run takes its games and tags from {@code dim_game}/{@code bridge_game_tag} and
 * its player metrics from the most recent stored month; a player-count run takes its price
 * from the most recent stored snapshot.
 */
@Slf4j
@Repository
public class StoreBaselineRepository {

    static final int IN_CLAUSE_CHUNK = 1000;

    private static final String KNOWN_APP_IDS = "SELECT appid FROM dim_game ORDER BY appid";

    private static final String GAMES =
        "SELECT g.appid, g.name, g.developer, g.publisher, g.release_date, g.is_free, " +
        "g.steamspy_owners_min, g.steamspy_owners_max, g.positive_reviews, g.negative_reviews, " +
        "(SELECT gen.genre_name FROM fact_player_price f " +
        " JOIN dim_date d ON d.date_id = f.date_id " +
        " JOIN dim_genre gen ON gen.genre_id = f.genre_id " +
        " WHERE f.game_id = g.game_id ORDER BY d.full_date DESC LIMIT 1) AS primary_genre " +
        "FROM dim_game g WHERE g.appid IN (:appIds) ORDER BY g.appid";

    private static final String TAGS =
        "SELECT g.appid, t.tag_name FROM bridge_game_tag b " +
        "JOIN dim_game g ON g.game_id = b.game_id " +
        "JOIN dim_tag t ON t.tag_id = b.tag_id " +
        "WHERE g.appid IN (:appIds) ORDER BY g.appid, t.tag_name";

    private static final String LATEST_PLAYERS =
        "SELECT DISTINCT ON (g.appid) g.appid, d.full_date, f.concurrent_players_avg, f.concurrent_players_peak, " +
        "f.player_gain, f.gain_pct " +
        "FROM fact_player_price f " +
        "JOIN dim_game g ON g.game_id = f.game_id " +
        "JOIN dim_date d ON d.date_id = f.date_id " +
        "WHERE g.appid IN (:appIds) AND f.concurrent_players_avg IS NOT NULL " +
        "ORDER BY g.appid, d.full_date DESC";

    private static final String LATEST_PRICES =
        "SELECT DISTINCT ON (g.appid) g.appid, f.current_price, f.original_price, f.discount_pct " +
        "FROM fact_player_price f " +
        "JOIN dim_game g ON g.game_id = f.game_id " +
        "JOIN dim_date d ON d.date_id = f.date_id " +
        "WHERE g.appid IN (:appIds) AND f.current_price IS NOT NULL " +
        "ORDER BY g.appid, d.full_date DESC";

    private final NamedParameterJdbcTemplate jdbc;

    public StoreBaselineRepository(NamedParameterJdbcTemplate jdbc) {
        this.jdbc = jdbc;
    }

    public List<Long> knownAppIds() {
        return jdbc.getJdbcTemplate().queryForList(KNOWN_APP_IDS, Long.class);
    }

    public List<MetadataRecord> loadMetadata(Collection<Long> appIds) {
        Map<Long, List<String>> tagsByApp = new TreeMap<>();
        List<MetadataRecord> games = new ArrayList<>();
        for (List<Long> chunk : JdbcUtils.chunk(new TreeSet<>(appIds), IN_CLAUSE_CHUNK)) {
            MapSqlParameterSource params = new MapSqlParameterSource("appIds", chunk);
            jdbc.query(TAGS, params, rs -> {
                tagsByApp.computeIfAbsent(rs.getLong("appid"), k -> new ArrayList<>()).add(rs.getString("tag_name"));
            });
            games.addAll(jdbc.query(GAMES, params, (rs, rowNum) -> {
                long appId = rs.getLong("appid");
                String genre = rs.getString("primary_genre");
                return new MetadataRecord(
                    appId,
                    rs.getString("name"),
                    rs.getString("developer"),
                    rs.getString("publisher"),
                    JdbcUtils.getLocalDate(rs, "release_date"),
                    (Boolean) rs.getObject("is_free"),
                    JdbcUtils.getLong(rs, "steamspy_owners_min"),
                    JdbcUtils.getLong(rs, "steamspy_owners_max"),
                    JdbcUtils.getInteger(rs, "positive_reviews"),
                    JdbcUtils.getInteger(rs, "negative_reviews"),
                    null,
                    null,
                    null,
                    genre == null ? List.of() : List.of(genre),
                    List.of()
                );
            }));
        }
        List<MetadataRecord> withTags = new ArrayList<>(games.size());
        for (MetadataRecord game : games) {
            withTags.add(game.withTags(tagsByApp.getOrDefault(game.appId(), List.of())));
        }
        log.debug("Loaded {} baseline games ({} with tags)", withTags.size(), tagsByApp.size());
        return withTags;
    }

    public List<PlayerCountRecord> loadLatestPlayerCounts(Collection<Long> appIds) {
        List<PlayerCountRecord> records = new ArrayList<>();
        for (List<Long> chunk : JdbcUtils.chunk(new TreeSet<>(appIds), IN_CLAUSE_CHUNK)) {
            records.addAll(jdbc.query(LATEST_PLAYERS, new MapSqlParameterSource("appIds", chunk), (rs, rowNum) ->
                new PlayerCountRecord(
                    rs.getLong("appid"),
                    YearMonth.from(JdbcUtils.getLocalDate(rs, "full_date")),
                    JdbcUtils.getInteger(rs, "concurrent_players_avg"),
                    JdbcUtils.getInteger(rs, "concurrent_players_peak"),
                    JdbcUtils.getInteger(rs, "player_gain"),
                    rs.getBigDecimal("gain_pct")
                )));
        }
        return records;
    }

    public List<PricingRecord> loadLatestPricing(Collection<Long> appIds) {
        List<PricingRecord> records = new ArrayList<>();
        for (List<Long> chunk : JdbcUtils.chunk(new TreeSet<>(appIds), IN_CLAUSE_CHUNK)) {
            records.addAll(jdbc.query(LATEST_PRICES, new MapSqlParameterSource("appIds", chunk), (rs, rowNum) -> {
                BigDecimal discount = rs.getBigDecimal("discount_pct");
                return PricingRecord.priceOnly(
                    rs.getLong("appid"),
                    rs.getBigDecimal("current_price"),
                    rs.getBigDecimal("original_price"),
                    discount == null ? null : discount.intValue()
                );
            }));
        }
        return records;
    }
}
