package com.williamcallahan.steam_analytics.service.source;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.williamcallahan.steam_analytics.config.IngestionProperties;
import com.williamcallahan.steam_analytics.model.PricingRecord;
import com.williamcallahan.steam_analytics.types.FailureKind;
import com.williamcallahan.steam_analytics.types.SourceName;
import com.williamcallahan.steam_analytics.util.SourceValueParsers;
import org.springframework.stereotype.Component;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.List;

/**
 * Steam Store {@code appdetails} client: authoritative for price, discount, release date,
 * developer, publisher and the free flag.
 * <p>
 * Response shape is {@code {"<appid>": {"success": bool, "data": {...}}}}. The store answers
 * a literal {@code null} body when it throttles a caller, which is treated as transient.
 */
@Component
public class SteamStoreClient implements SourceClient<JsonNode, PricingRecord> {

    public static final String ENDPOINT_APP_DETAILS = "appdetails";

    static final int MAX_PARTY_LENGTH = 500;

    private final ObjectMapper objectMapper;
    private final IngestionProperties properties;

    public SteamStoreClient(ObjectMapper objectMapper, IngestionProperties properties) {
        this.objectMapper = objectMapper;
        this.properties = properties;
    }

    @Override
    public SourceName source() {
        return SourceName.STEAM_STORE;
    }

    @Override
    public String fetchRaw(SourceSession session, long appId) {
        String countryCode = properties.getSources().getSteamStore().getCountryCode();
        return session.get(ENDPOINT_APP_DETAILS, appId, builder -> builder
            .queryParam("appids", appId)
            .queryParam("cc", countryCode)
            .build());
    }

    @Override
    public JsonNode parse(long appId, String raw) {
        JsonNode root;
        try {
            root = objectMapper.readTree(raw == null ? "" : raw);
        } catch (JsonProcessingException e) {
            throw PermanentSourceException.malformed(source(), appId, "Invalid JSON: " + e.getOriginalMessage(), e);
        }
        if (root == null || root.isNull() || root.isMissingNode()) {
            throw new TransientSourceException(source(), appId, FailureKind.THROTTLED, "Store returned a null body (rate limited)", null);
        }
        if (!root.isObject()) {
            throw PermanentSourceException.malformed(source(), appId, "Expected a JSON object", null);
        }
        return root;
    }

    @Override
    public List<PricingRecord> normalize(long appId, JsonNode root) {
        JsonNode entry = root.get(Long.toString(appId));
        if (entry == null || !entry.isObject()) {
            throw PermanentSourceException.malformed(source(), appId, "Response has no entry for appid " + appId, null);
        }
        if (!entry.path("success").asBoolean(false)) {
            throw PermanentSourceException.notFound(source(), appId, "Store reports success=false for appid " + appId);
        }
        JsonNode data = entry.path("data");
        if (!data.isObject()) {
            throw PermanentSourceException.malformed(source(), appId, "Store entry has no data object", null);
        }

        boolean free = data.path("is_free").asBoolean(false);
        JsonNode priceOverview = data.path("price_overview");
        BigDecimal currentPrice;
        BigDecimal originalPrice;
        Integer discountPercent;
        String currency;
        if (priceOverview.isObject()) {
            currentPrice = SourceValueParsers.centsToAmount(longOrNull(priceOverview, "final"));
            originalPrice = SourceValueParsers.centsToAmount(longOrNull(priceOverview, "initial"));
            discountPercent = priceOverview.path("discount_percent").asInt(0);
            currency = SourceValueParsers.trimToNull(priceOverview.path("currency").asText(null));
            if (currentPrice == null || originalPrice == null) {
                throw PermanentSourceException.malformed(source(), appId, "price_overview lacks final/initial amounts", null);
            }
        } else {
            // Free or unpriced (unreleased) titles carry no price_overview
            currentPrice = BigDecimal.ZERO.setScale(2);
            originalPrice = BigDecimal.ZERO.setScale(2);
            discountPercent = 0;
            currency = null;
        }
        if (discountPercent < 0 || discountPercent > 100) {
            throw PermanentSourceException.malformed(source(), appId, "discount_percent out of range: " + discountPercent, null);
        }

        JsonNode releaseNode = data.path("release_date");
        LocalDate releaseDate = SourceValueParsers.parseStoreReleaseDate(releaseNode.path("date").asText(null));
        boolean comingSoon = releaseNode.path("coming_soon").asBoolean(false);

        return List.of(new PricingRecord(
            appId,
            SourceValueParsers.trimToNull(data.path("name").asText(null)),
            free,
            currentPrice,
            originalPrice,
            discountPercent,
            currency,
            releaseDate,
            comingSoon,
            SourceValueParsers.joinAndTruncate(textArray(data.path("developers")), MAX_PARTY_LENGTH),
            SourceValueParsers.joinAndTruncate(textArray(data.path("publishers")), MAX_PARTY_LENGTH),
            descriptions(data.path("genres")),
            descriptions(data.path("categories"))
        ));
    }

    private static Long longOrNull(JsonNode node, String field) {
        JsonNode value = node.get(field);
        return value == null || !value.isNumber() ? null : value.asLong();
    }

    private static List<String> textArray(JsonNode array) {
        List<String> values = new ArrayList<>();
        if (array.isArray()) {
            array.forEach(item -> values.add(item.asText()));
        }
        return values;
    }

    private static List<String> descriptions(JsonNode array) {
        List<String> values = new ArrayList<>();
        if (array.isArray()) {
            array.forEach(item -> {
                String description = SourceValueParsers.trimToNull(item.path("description").asText(null));
                if (description != null && !values.contains(description)) {
                    values.add(description);
                }
            });
        }
        return values;
    }
}
