package com.williamcallahan.steam_analytics.service.source;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.williamcallahan.steam_analytics.model.MetadataRecord;
import com.williamcallahan.steam_analytics.model.OwnerRange;
import com.williamcallahan.steam_analytics.types.SourceName;
import com.williamcallahan.steam_analytics.util.SourceValueParsers;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * SteamSpy API client: metadata authority and the only source that can discover entities.
 * <p>
 * Endpoints (governor keys): {@code appdetails} for one game, {@code all} for a page of
 * the full catalogue. SteamSpy asks for a much longer spacing on {@code all}.
 */
@Component
@Slf4j
public class SteamSpyClient implements SourceClient<JsonNode, MetadataRecord> {

    public static final String ENDPOINT_APP_DETAILS = "appdetails";
    public static final String ENDPOINT_ALL = "all";

    private final ObjectMapper objectMapper;

    public SteamSpyClient(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
    }

    @Override
    public SourceName source() {
        return SourceName.STEAMSPY;
    }

    @Override
    public String fetchRaw(SourceSession session, long appId) {
        return session.get(ENDPOINT_APP_DETAILS, appId, builder -> builder
            .queryParam("request", "appdetails")
            .queryParam("appid", appId)
            .build());
    }

    @Override
    public JsonNode parse(long appId, String raw) {
        try {
            JsonNode node = objectMapper.readTree(raw);
            if (node == null || !node.isObject()) {
                throw PermanentSourceException.malformed(source(), appId, "Expected a JSON object", null);
            }
            return node;
        } catch (JsonProcessingException e) {
            throw PermanentSourceException.malformed(source(), appId, "Invalid JSON: " + e.getOriginalMessage(), e);
        }
    }

    @Override
    public List<MetadataRecord> normalize(long appId, JsonNode node) {
        MetadataRecord record = toRecord(appId, node);
        if (record == null) {
            throw PermanentSourceException.notFound(source(), appId, "SteamSpy has no name for appid " + appId);
        }
        return List.of(record);
    }

    /**
     * Reads up to {@code pages} pages of the {@code all} listing, stopping early on an empty
     * page or once {@code maxEntities} (0 = unlimited) records were collected.
     */
    public FetchOutcome<List<MetadataRecord>> discover(SourceSession session, int pages, int maxEntities) {
        List<MetadataRecord> discovered = new ArrayList<>();
        int attempts = 0;
        for (int page = 0; page < Math.max(1, pages); page++) {
            final int pageNumber = page;
            FetchOutcome<List<MetadataRecord>> outcome = session.fetch(0, () -> parseListing(session.get(ENDPOINT_ALL, 0,
                builder -> builder.queryParam("request", "all").queryParam("page", pageNumber).build())));
            attempts += outcome.getAttempts();
            if (!outcome.isSuccess()) {
                if (discovered.isEmpty()) {
                    return outcome;
                }
                log.warn("SteamSpy discovery stopped at page {}: {} ({})", pageNumber, outcome.getFailureKind(), outcome.getFailureMessage());
                break;
            }
            List<MetadataRecord> pageRecords = outcome.getValue();
            log.info("SteamSpy discovery page {} returned {} games", pageNumber, pageRecords.size());
            if (pageRecords.isEmpty()) {
                break;
            }
            for (MetadataRecord record : pageRecords) {
                if (maxEntities > 0 && discovered.size() >= maxEntities) {
                    return FetchOutcome.success(discovered, attempts);
                }
                discovered.add(record);
            }
        }
        return FetchOutcome.success(discovered, attempts);
    }

    List<MetadataRecord> parseListing(String raw) {
        JsonNode root = parse(0, raw);
        List<MetadataRecord> records = new ArrayList<>();
        Iterator<Map.Entry<String, JsonNode>> fields = root.fields();
        while (fields.hasNext()) {
            Map.Entry<String, JsonNode> entry = fields.next();
            Long appId = SourceValueParsers.parseLong(entry.getKey());
            if (appId == null || appId <= 0) {
                continue;
            }
            MetadataRecord record = toRecord(appId, entry.getValue());
            if (record != null) {
                records.add(record);
            }
        }
        return records;
    }

    private MetadataRecord toRecord(long appId, JsonNode node) {
        String name = SourceValueParsers.trimToNull(text(node, "name"));
        if (name == null) {
            return null;
        }
        Optional<OwnerRange> owners = SourceValueParsers.parseOwnerRange(text(node, "owners"));
        Long priceCents = SourceValueParsers.parseLong(text(node, "price"));
        Long initialPriceCents = SourceValueParsers.parseLong(text(node, "initialprice"));
        Integer discount = SourceValueParsers.parseWholeNumber(text(node, "discount"));
        if (discount != null && (discount < 0 || discount > 100)) {
            discount = null;
        }
        BigDecimal currentPrice = SourceValueParsers.centsToAmount(priceCents);
        BigDecimal originalPrice = SourceValueParsers.centsToAmount(initialPriceCents);
        Boolean free = initialPriceCents == null ? null : initialPriceCents == 0L;

        return new MetadataRecord(
            appId,
            name,
            SourceValueParsers.trimToNull(text(node, "developer")),
            SourceValueParsers.trimToNull(text(node, "publisher")),
            null,
            free,
            owners.map(OwnerRange::min).orElse(null),
            owners.map(OwnerRange::max).orElse(null),
            SourceValueParsers.parseWholeNumber(text(node, "positive")),
            SourceValueParsers.parseWholeNumber(text(node, "negative")),
            currentPrice,
            originalPrice,
            discount,
            SourceValueParsers.splitCommaList(text(node, "genre")),
            tagNames(node.path("tags"))
        );
    }

    /**
     * {@code tags} is an object of tag name to vote weight, or an empty array when the game has none.
     */
    private static List<String> tagNames(JsonNode tags) {
        List<String> names = new ArrayList<>();
        if (tags != null && tags.isObject()) {
            tags.fieldNames().forEachRemaining(tag -> {
                String trimmed = SourceValueParsers.trimToNull(tag);
                if (trimmed != null) {
                    names.add(trimmed);
                }
            });
        }
        return names;
    }

    private static String text(JsonNode node, String field) {
        JsonNode value = node.get(field);
        if (value == null || value.isNull() || value.isContainerNode()) {
            return null;
        }
        return value.asText();
    }
}
