package com.williamcallahan.steam_analytics.repository;

import com.williamcallahan.steam_analytics.dto.DataQualitySnapshot;
import com.williamcallahan.steam_analytics.dto.PlayerPriceObservation;
import com.williamcallahan.steam_analytics.util.JdbcUtils;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.core.RowMapper;
import org.springframework.jdbc.core.namedparam.MapSqlParameterSource;
import org.springframework.jdbc.core.namedparam.NamedParameterJdbcTemplate;
import org.springframework.stereotype.Repository;

import java.time.LocalDate;
import java.time.YearMonth;
import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Locale;
import java.util.TreeSet;

/**
 * Read side of {@code fact_player_price}: observation tuples for the statistical layer and the
 * data-quality snapshot.
 */
@Repository
public class FactQueryRepository {

    static final double MIN_COVERAGE_PERCENT = 80.0;
    static final double MIN_FACTS_PER_GAME = 6.0;

    private static final String OBSERVATIONS =
        "SELECT g.appid, d.full_date, f.concurrent_players_avg, f.concurrent_players_peak, f.gain_pct, " +
        "f.current_price, f.original_price, f.discount_pct, f.is_discount_active, " +
        "d.is_steam_sale_period, d.steam_sale_name " +
        "FROM fact_player_price f " +
        "JOIN dim_game g ON g.game_id = f.game_id " +
        "JOIN dim_date d ON d.date_id = f.date_id " +
        "WHERE d.full_date BETWEEN :from AND :to";

    private static final String ORDER = " ORDER BY g.appid, d.full_date";

    private static final RowMapper<PlayerPriceObservation> OBSERVATION_MAPPER = (rs, rowNum) -> new PlayerPriceObservation(
        rs.getLong("appid"),
        JdbcUtils.getLocalDate(rs, "full_date"),
        JdbcUtils.getInteger(rs, "concurrent_players_avg"),
        JdbcUtils.getInteger(rs, "concurrent_players_peak"),
        rs.getBigDecimal("gain_pct"),
        rs.getBigDecimal("current_price"),
        rs.getBigDecimal("original_price"),
        rs.getBigDecimal("discount_pct"),
        rs.getBoolean("is_discount_active"),
        rs.getBoolean("is_steam_sale_period"),
        rs.getString("steam_sale_name")
    );

    private final NamedParameterJdbcTemplate jdbc;

    public FactQueryRepository(NamedParameterJdbcTemplate jdbc) {
        this.jdbc = jdbc;
    }

    /**
     * Fact tuples for the given games with a period between {@code from} and {@code to}
     * (inclusive), ordered by appid then period. An empty appid set selects every game.
     */
    public List<PlayerPriceObservation> findObservations(Collection<Long> appIds, YearMonth from, YearMonth to) {
        if (from.isAfter(to)) {
            throw new IllegalArgumentException("Range start " + from + " is after end " + to);
        }
        MapSqlParameterSource params = new MapSqlParameterSource()
            .addValue("from", from.atDay(1))
            .addValue("to", to.atEndOfMonth());
        if (appIds == null || appIds.isEmpty()) {
            return jdbc.query(OBSERVATIONS + ORDER, params, OBSERVATION_MAPPER);
        }
        List<PlayerPriceObservation> observations = new ArrayList<>();
        for (List<Long> chunk : JdbcUtils.chunk(new TreeSet<>(appIds), StoreBaselineRepository.IN_CLAUSE_CHUNK)) {
            params.addValue("appIds", chunk);
            observations.addAll(jdbc.query(OBSERVATIONS + " AND g.appid IN (:appIds)" + ORDER, params, OBSERVATION_MAPPER));
        }
        return observations;
    }

    public DataQualitySnapshot dataQuality() {
        JdbcTemplate jdbcTemplate = jdbc.getJdbcTemplate();
        long totalGames = JdbcUtils.queryForLong(jdbcTemplate, "SELECT COUNT(*) FROM dim_game");
        long withPrice = JdbcUtils.queryForLong(jdbcTemplate,
            "SELECT COUNT(DISTINCT game_id) FROM fact_player_price WHERE current_price IS NOT NULL");
        long withPlayers = JdbcUtils.queryForLong(jdbcTemplate,
            "SELECT COUNT(DISTINCT game_id) FROM fact_player_price WHERE concurrent_players_avg IS NOT NULL");
        long missingMetadata = JdbcUtils.queryForLong(jdbcTemplate,
            "SELECT COUNT(*) FROM dim_game WHERE developer IS NULL OR publisher IS NULL OR release_date IS NULL");
        long totalFacts = JdbcUtils.queryForLong(jdbcTemplate, "SELECT COUNT(*) FROM fact_player_price");
        long gamesWithFacts = JdbcUtils.queryForLong(jdbcTemplate, "SELECT COUNT(DISTINCT game_id) FROM fact_player_price");
        LocalDate[] range = jdbcTemplate.queryForObject(
            "SELECT MIN(d.full_date) AS oldest, MAX(d.full_date) AS newest FROM fact_player_price f JOIN dim_date d ON d.date_id = f.date_id",
            (rs, rowNum) -> new LocalDate[] {JdbcUtils.getLocalDate(rs, "oldest"), JdbcUtils.getLocalDate(rs, "newest")});

        double avgFacts = gamesWithFacts == 0 ? 0.0 : (double) totalFacts / gamesWithFacts;
        LocalDate oldest = range == null ? null : range[0];
        LocalDate newest = range == null ? null : range[1];
        return new DataQualitySnapshot(totalGames, withPrice, withPlayers, missingMetadata, oldest, newest, avgFacts,
            recommendations(totalGames, withPrice, withPlayers, missingMetadata, avgFacts));
    }

    static List<String> recommendations(long totalGames, long withPrice, long withPlayers, long missingMetadata, double avgFacts) {
        List<String> recommendations = new ArrayList<>();
        if (missingMetadata > 0) {
            recommendations.add(missingMetadata + " games are missing metadata (developer, publisher, or release date)");
        }
        if (totalGames > 0) {
            double priceCoverage = withPrice * 100.0 / totalGames;
            if (priceCoverage < MIN_COVERAGE_PERCENT) {
                recommendations.add(String.format(Locale.ROOT,
                    "Only %.1f%% of games have price data. Consider running Steam Store ingestion.", priceCoverage));
            }
            double playerCoverage = withPlayers * 100.0 / totalGames;
            if (playerCoverage < MIN_COVERAGE_PERCENT) {
                recommendations.add(String.format(Locale.ROOT,
                    "Only %.1f%% of games have player data. Consider running SteamCharts ingestion.", playerCoverage));
            }
        }
        if (avgFacts < MIN_FACTS_PER_GAME) {
            recommendations.add(String.format(Locale.ROOT,
                "Average of %.1f facts per game. Consider running historical data ingestion.", avgFacts));
        }
        return recommendations;
    }
}
