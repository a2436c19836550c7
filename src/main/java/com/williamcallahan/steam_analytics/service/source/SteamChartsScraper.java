package com.williamcallahan.steam_analytics.service.source;

import com.williamcallahan.steam_analytics.model.PlayerCountRecord;
import com.williamcallahan.steam_analytics.types.SourceName;
import com.williamcallahan.steam_analytics.util.SourceValueParsers;
import lombok.extern.slf4j.Slf4j;
import org.jsoup.Jsoup;
import org.jsoup.nodes.Document;
import org.jsoup.nodes.Element;
import org.jsoup.select.Elements;
import org.springframework.stereotype.Component;

import java.time.YearMonth;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Scrapes the monthly player history table from SteamCharts app pages.
 * <p>
 * Columns are located by header text (Month, Avg. Players, Gain, % Gain, Peak Players) rather
 * than by position, so a reordered or extended table still parses. Rows whose month cell is not
 * a "Month YYYY" label, such as "Last 30 Days", are skipped.
 */
@Component
@Slf4j
public class SteamChartsScraper implements SourceClient<Document, PlayerCountRecord> {

    public static final String ENDPOINT_APP = "app";

    static final String COLUMN_MONTH = "month";
    static final String COLUMN_AVG_PLAYERS = "avg. players";
    static final String COLUMN_GAIN = "gain";
    static final String COLUMN_GAIN_PERCENT = "% gain";
    static final String COLUMN_PEAK_PLAYERS = "peak players";

    @Override
    public SourceName source() {
        return SourceName.STEAMCHARTS;
    }

    @Override
    public String fetchRaw(SourceSession session, long appId) {
        return session.get(ENDPOINT_APP, appId, builder -> builder.path("/app/{appid}").build(appId));
    }

    @Override
    public Document parse(long appId, String raw) {
        if (raw == null || raw.isBlank()) {
            throw PermanentSourceException.malformed(source(), appId, "Empty SteamCharts page", null);
        }
        return Jsoup.parse(raw);
    }

    @Override
    public List<PlayerCountRecord> normalize(long appId, Document document) {
        Element table = document.selectFirst("table.common-table");
        if (table == null) {
            throw PermanentSourceException.malformed(source(), appId, "No player count table on SteamCharts page", null);
        }
        Map<String, Integer> columns = headerColumns(table);
        Integer monthColumn = columns.get(COLUMN_MONTH);
        Integer avgColumn = columns.get(COLUMN_AVG_PLAYERS);
        Integer peakColumn = columns.get(COLUMN_PEAK_PLAYERS);
        if (monthColumn == null || avgColumn == null || peakColumn == null) {
            throw PermanentSourceException.malformed(source(), appId, "Player table headers not recognised: " + columns.keySet(), null);
        }
        Integer gainColumn = columns.get(COLUMN_GAIN);
        Integer gainPercentColumn = columns.get(COLUMN_GAIN_PERCENT);

        List<PlayerCountRecord> records = new ArrayList<>();
        for (Element row : table.select("tr")) {
            Elements cells = row.select("td");
            if (cells.isEmpty()) {
                continue;
            }
            YearMonth month = SourceValueParsers.parseMonthLabel(cell(cells, monthColumn));
            if (month == null) {
                continue;
            }
            records.add(new PlayerCountRecord(
                appId,
                month,
                SourceValueParsers.parseWholeNumber(cell(cells, avgColumn)),
                SourceValueParsers.parseWholeNumber(cell(cells, peakColumn)),
                gainColumn == null ? null : SourceValueParsers.parseWholeNumber(cell(cells, gainColumn)),
                gainPercentColumn == null ? null : SourceValueParsers.parsePercent(cell(cells, gainPercentColumn))
            ));
        }
        log.debug("Parsed {} monthly SteamCharts rows for appid {}", records.size(), appId);
        return records;
    }

    private static Map<String, Integer> headerColumns(Element table) {
        Elements headers = table.select("thead th");
        if (headers.isEmpty()) {
            Element firstRow = table.selectFirst("tr");
            headers = firstRow == null ? new Elements() : firstRow.select("th");
        }
        Map<String, Integer> columns = new HashMap<>();
        for (int i = 0; i < headers.size(); i++) {
            String label = headers.get(i).text().trim().toLowerCase(Locale.ROOT);
            columns.putIfAbsent(label, i);
        }
        return columns;
    }

    private static String cell(Elements cells, int index) {
        return index < cells.size() ? cells.get(index).text() : null;
    }
}
