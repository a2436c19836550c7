package com.williamcallahan.steam_analytics.util;

import com.williamcallahan.steam_analytics.model.OwnerRange;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.time.LocalDate;
import java.time.YearMonth;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeFormatterBuilder;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.Set;

/**
 * Lenient converters for the text shapes the Steam sources emit. Unparseable input
 * yields {@code null} (or empty) rather than an exception; callers decide whether a
 * missing value makes the whole payload malformed.
 */
public final class SourceValueParsers {

    private static final List<DateTimeFormatter> STORE_RELEASE_DATE_FORMATS = List.of(
        formatter("MMM d, yyyy"),
        formatter("d MMM, yyyy"),
        formatter("MMMM d, yyyy"),
        formatter("d MMMM, yyyy")
    );

    private static final DateTimeFormatter MONTH_LABEL_FORMAT = formatter("MMMM yyyy");

    private SourceValueParsers() {
    }

    private static DateTimeFormatter formatter(String pattern) {
        return new DateTimeFormatterBuilder()
            .parseCaseInsensitive()
            .appendPattern(pattern)
            .toFormatter(Locale.ENGLISH);
    }

    /**
     * Parses SteamSpy owner strings such as {@code "50,000,000 .. 100,000,000"}.
     */
    public static Optional<OwnerRange> parseOwnerRange(String raw) {
        if (isBlank(raw)) {
            return Optional.empty();
        }
        String[] parts = raw.replace(",", "").split("\\.\\.");
        if (parts.length != 2) {
            return Optional.empty();
        }
        Long min = parseLong(parts[0]);
        Long max = parseLong(parts[1]);
        if (min == null || max == null || min < 0 || min > max) {
            return Optional.empty();
        }
        return Optional.of(new OwnerRange(min, max));
    }

    /**
     * Parses a count like {@code "1,234"}, {@code "+56"} or {@code "32456.5"}; fractions are truncated.
     */
    public static Integer parseWholeNumber(String raw) {
        BigDecimal value = parseDecimal(raw);
        if (value == null) {
            return null;
        }
        try {
            return value.setScale(0, RoundingMode.DOWN).intValueExact();
        } catch (ArithmeticException ex) {
            return null;
        }
    }

    /**
     * Parses a percentage like {@code "+5.2%"} into {@code 5.2}.
     */
    public static BigDecimal parsePercent(String raw) {
        if (raw == null) {
            return null;
        }
        return parseDecimal(raw.replace("%", ""));
    }

    public static BigDecimal parseDecimal(String raw) {
        if (isBlank(raw)) {
            return null;
        }
        String cleaned = raw.replace(",", "").replace('\u00a0', ' ').trim();
        if (cleaned.startsWith("+")) {
            cleaned = cleaned.substring(1).trim();
        }
        if (cleaned.isEmpty() || "-".equals(cleaned) || "N/A".equalsIgnoreCase(cleaned)) {
            return null;
        }
        try {
            return new BigDecimal(cleaned);
        } catch (NumberFormatException ex) {
            return null;
        }
    }

    public static Long parseLong(String raw) {
        BigDecimal value = parseDecimal(raw);
        if (value == null) {
            return null;
        }
        try {
            return value.longValueExact();
        } catch (ArithmeticException ex) {
            return null;
        }
    }

    /**
     * Converts a minor-unit amount (cents) to currency units with two decimals.
     */
    public static BigDecimal centsToAmount(Long cents) {
        return cents == null ? null : BigDecimal.valueOf(cents, 2);
    }

    /**
     * Parses Steam Store release dates ({@code "Aug 21, 2012"} or {@code "21 Aug, 2012"}).
     * Placeholders such as "Coming soon" or "Q4 2025" yield {@code null}.
     */
    public static LocalDate parseStoreReleaseDate(String raw) {
        if (isBlank(raw)) {
            return null;
        }
        String trimmed = raw.trim();
        for (DateTimeFormatter format : STORE_RELEASE_DATE_FORMATS) {
            try {
                return LocalDate.parse(trimmed, format);
            } catch (DateTimeParseException ignored) {
                // next format
            }
        }
        return null;
    }

    /**
     * Parses SteamCharts month labels such as {@code "January 2024"}.
     */
    public static YearMonth parseMonthLabel(String raw) {
        if (isBlank(raw)) {
            return null;
        }
        try {
            return YearMonth.parse(raw.trim(), MONTH_LABEL_FORMAT);
        } catch (DateTimeParseException ex) {
            return null;
        }
    }

    /**
     * Splits {@code "Action, Free to Play, Action"} into distinct, trimmed names in first-seen order.
     */
    public static List<String> splitCommaList(String raw) {
        if (isBlank(raw)) {
            return List.of();
        }
        Set<String> names = new LinkedHashSet<>();
        for (String part : raw.split(",")) {
            String name = part.trim();
            if (!name.isEmpty()) {
                names.add(name);
            }
        }
        return new ArrayList<>(names);
    }

    public static String joinAndTruncate(List<String> values, int maxLength) {
        if (values == null || values.isEmpty()) {
            return null;
        }
        List<String> cleaned = new ArrayList<>();
        for (String value : values) {
            String trimmed = trimToNull(value);
            if (trimmed != null) {
                cleaned.add(trimmed);
            }
        }
        if (cleaned.isEmpty()) {
            return null;
        }
        String joined = String.join(", ", cleaned);
        return joined.length() > maxLength ? joined.substring(0, maxLength) : joined;
    }

    public static String trimToNull(String value) {
        if (value == null) {
            return null;
        }
        String trimmed = value.trim();
        return trimmed.isEmpty() ? null : trimmed;
    }

    public static boolean isBlank(String value) {
        return value == null || value.isBlank();
    }
}
