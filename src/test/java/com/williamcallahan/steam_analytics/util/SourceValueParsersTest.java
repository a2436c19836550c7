package com.williamcallahan.steam_analytics.util;

import com.williamcallahan.steam_analytics.model.OwnerRange;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;
import org.junit.jupiter.params.provider.NullAndEmptySource;
import org.junit.jupiter.params.provider.ValueSource;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.time.YearMonth;
import java.util.Arrays;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class SourceValueParsersTest {

    @Test
    void parseOwnerRange_splitsBoundsAndStripsSeparators() {
        assertThat(SourceValueParsers.parseOwnerRange("50,000,000 .. 100,000,000"))
            .contains(new OwnerRange(50_000_000L, 100_000_000L));
        assertThat(SourceValueParsers.parseOwnerRange("0 .. 20,000"))
            .contains(new OwnerRange(0L, 20_000L));
    }

    @ParameterizedTest
    @NullAndEmptySource
    @ValueSource(strings = {"lots", "100 .. 50", "1 .. 2 .. 3", "abc .. 10"})
    void parseOwnerRange_rejectsMalformedInput(String raw) {
        assertThat(SourceValueParsers.parseOwnerRange(raw)).isEmpty();
    }

    @ParameterizedTest
    @CsvSource({
        "'32,456', 32456",
        "'+1,204', 1204",
        "'-3,100', -3100",
        "'32456.5', 32456",
        "' 7 ', 7"
    })
    void parseWholeNumber_handlesSeparatorsSignsAndFractions(String raw, int expected) {
        assertThat(SourceValueParsers.parseWholeNumber(raw)).isEqualTo(expected);
    }

    @ParameterizedTest
    @ValueSource(strings = {"-", "N/A", "", "twelve"})
    void parseWholeNumber_returnsNullForPlaceholders(String raw) {
        assertThat(SourceValueParsers.parseWholeNumber(raw)).isNull();
    }

    @ParameterizedTest
    @CsvSource({
        "'+5.2%', 5.2",
        "'-12.75%', -12.75",
        "'1,024.5%', 1024.5",
        "'0%', 0"
    })
    void parsePercent_stripsSignAndPercent(String raw, String expected) {
        assertThat(SourceValueParsers.parsePercent(raw)).isEqualByComparingTo(new BigDecimal(expected));
    }

    @Test
    void centsToAmount_dividesByOneHundred() {
        assertThat(SourceValueParsers.centsToAmount(749L)).isEqualTo(new BigDecimal("7.49"));
        assertThat(SourceValueParsers.centsToAmount(1499L)).isEqualTo(new BigDecimal("14.99"));
        assertThat(SourceValueParsers.centsToAmount(0L)).isEqualTo(new BigDecimal("0.00"));
        assertThat(SourceValueParsers.centsToAmount(null)).isNull();
    }

    @ParameterizedTest
    @CsvSource({
        "'Aug 21, 2012', 2012-08-21",
        "'21 Aug, 2012', 2012-08-21",
        "'Nov 10, 2020', 2020-11-10",
        "'December 1, 2023', 2023-12-01",
        "'1 Jan, 2024', 2024-01-01"
    })
    void parseStoreReleaseDate_acceptsBothStoreLayouts(String raw, LocalDate expected) {
        assertThat(SourceValueParsers.parseStoreReleaseDate(raw)).isEqualTo(expected);
    }

    @ParameterizedTest
    @NullAndEmptySource
    @ValueSource(strings = {"Coming soon", "Q4 2025", "To be announced"})
    void parseStoreReleaseDate_toleratesMissingOrPlaceholderDates(String raw) {
        assertThat(SourceValueParsers.parseStoreReleaseDate(raw)).isNull();
    }

    @Test
    void parseMonthLabel_readsFullMonthNamesOnly() {
        assertThat(SourceValueParsers.parseMonthLabel("January 2024")).isEqualTo(YearMonth.of(2024, 1));
        assertThat(SourceValueParsers.parseMonthLabel(" september 2019 ")).isEqualTo(YearMonth.of(2019, 9));
        assertThat(SourceValueParsers.parseMonthLabel("Last 30 Days")).isNull();
    }

    @Test
    void splitCommaList_dedupesAndTrims() {
        assertThat(SourceValueParsers.splitCommaList("Action, Free to Play, Action ,, Strategy"))
            .containsExactly("Action", "Free to Play", "Strategy");
        assertThat(SourceValueParsers.splitCommaList(null)).isEmpty();
    }

    @Test
    void joinAndTruncate_joinsWithCommaAndCapsLength() {
        assertThat(SourceValueParsers.joinAndTruncate(List.of("Valve", " Hidden Path "), 500))
            .isEqualTo("Valve, Hidden Path");

        String[] many = new String[100];
        Arrays.fill(many, "Studio");
        String joined = SourceValueParsers.joinAndTruncate(Arrays.asList(many), 500);
        assertThat(joined).hasSize(500).startsWith("Studio, Studio");

        assertThat(SourceValueParsers.joinAndTruncate(List.of(" ", ""), 500)).isNull();
    }
}
