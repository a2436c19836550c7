package com.williamcallahan.steam_analytics.util;

import org.springframework.dao.EmptyResultDataAccessException;
import org.springframework.jdbc.core.JdbcTemplate;

import java.sql.Date;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Optional;

/**
 * Shared JDBC helper methods for retrieving optional values without repeating
 * boilerplate try/catch blocks across repositories.
 */
public final class JdbcUtils {

    private JdbcUtils() {
    }

    /**
     * Query for an optional single result of any type, handling EmptyResultDataAccessException gracefully.
     */
    public static <T> Optional<T> queryForOptional(JdbcTemplate jdbc, String sql, Class<T> type, Object... params) {
        try {
            return Optional.ofNullable(jdbc.queryForObject(sql, type, params));
        } catch (EmptyResultDataAccessException e) {
            return Optional.empty();
        }
    }

    /**
     * Query for a Long, returning 0 if not found.
     */
    public static long queryForLong(JdbcTemplate jdbc, String sql, Object... params) {
        return queryForOptional(jdbc, sql, Long.class, params).orElse(0L);
    }

    /**
     * Check if a record exists. {@code sql} must be a SELECT returning any row when it does.
     */
    public static boolean exists(JdbcTemplate jdbc, String sql, Object... params) {
        Boolean found = queryForOptional(jdbc, "SELECT EXISTS (" + sql + ")", Boolean.class, params).orElse(Boolean.FALSE);
        return Boolean.TRUE.equals(found);
    }

    /**
     * Reads a nullable INTEGER column.
     */
    public static Integer getInteger(ResultSet rs, String column) throws SQLException {
        int value = rs.getInt(column);
        return rs.wasNull() ? null : value;
    }

    /**
     * Reads a nullable BIGINT column.
     */
    public static Long getLong(ResultSet rs, String column) throws SQLException {
        long value = rs.getLong(column);
        return rs.wasNull() ? null : value;
    }

    public static LocalDate getLocalDate(ResultSet rs, String column) throws SQLException {
        Date value = rs.getDate(column);
        return value == null ? null : value.toLocalDate();
    }

    /**
     * Splits a key collection into chunks small enough for an {@code IN (...)} list.
     */
    public static <T> List<List<T>> chunk(Collection<T> values, int size) {
        List<List<T>> chunks = new ArrayList<>();
        List<T> current = new ArrayList<>(size);
        for (T value : values) {
            current.add(value);
            if (current.size() == size) {
                chunks.add(current);
                current = new ArrayList<>(size);
            }
        }
        if (!current.isEmpty()) {
            chunks.add(current);
        }
        return chunks;
    }
}
