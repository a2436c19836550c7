package com.williamcallahan.steam_analytics.service;

import com.williamcallahan.steam_analytics.model.FactRow;
import com.williamcallahan.steam_analytics.model.GameTagLink;
import com.williamcallahan.steam_analytics.model.MergedEntitySet;
import com.williamcallahan.steam_analytics.model.MergedGame;
import com.williamcallahan.steam_analytics.model.MetadataRecord;
import com.williamcallahan.steam_analytics.model.PlayerCountRecord;
import com.williamcallahan.steam_analytics.model.PriceSnapshot;
import com.williamcallahan.steam_analytics.model.PricingRecord;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Comparator;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeMap;
import java.util.TreeSet;

/**
 * Joins the three sources into the star-schema entity sets.
 * <p>
 * Each source is first reduced to a map keyed by appid; the metadata key set then drives a
 * left-outer join with constant-time lookups into the other two maps. Inputs are sorted with a
 * total order before reduction, so the result does not depend on arrival order.
 * <p>
 * Field authority:
 * <ul>
 *   <li>price, original price, discount: pricing source, else metadata's fallback values, else the
 *   stored price snapshot for entities whose pricing fetch failed this run</li>
 *   <li>release date, developer, publisher, free flag: pricing source when non-null, else metadata</li>
 *   <li>player metrics: time-series source only; owner estimates stay metadata-only</li>
 * </ul>
 */
@Slf4j
@Service
public class GameDataMergeService {

    private static final Comparator<MetadataRecord> METADATA_ORDER = Comparator
        .comparingLong(MetadataRecord::appId)
        .thenComparing(Comparator.comparingInt(MetadataRecord::populatedFieldCount).reversed())
        .thenComparing(MetadataRecord::toString);

    private static final Comparator<PricingRecord> PRICING_ORDER = Comparator
        .comparingLong(PricingRecord::appId)
        .thenComparing(Comparator.comparingInt(GameDataMergeService::pricingFieldCount).reversed())
        .thenComparing(PricingRecord::toString);

    private static final Comparator<PlayerCountRecord> PLAYER_ORDER = Comparator
        .comparingLong(PlayerCountRecord::appId)
        .thenComparing(PlayerCountRecord::month)
        .thenComparing(PlayerCountRecord::toString);

    public MergedEntitySet merge(Collection<MetadataRecord> metadata,
                                 Collection<PlayerCountRecord> timeSeries,
                                 Collection<PricingRecord> pricing) {
        return merge(metadata, timeSeries, pricing, List.of());
    }

    /**
     * @param storedPricing last stored price snapshots, used only when neither the pricing source
     *                      nor metadata supplied a price for the game
     */
    public MergedEntitySet merge(Collection<MetadataRecord> metadata,
                                 Collection<PlayerCountRecord> timeSeries,
                                 Collection<PricingRecord> pricing,
                                 Collection<PricingRecord> storedPricing) {
        Map<Long, MetadataRecord> metadataByApp = indexMetadata(metadata);
        Map<Long, List<PlayerCountRecord>> playersByApp = indexPlayers(timeSeries);
        Map<Long, PricingRecord> pricingByApp = indexPricing(pricing);
        Map<Long, PricingRecord> storedPricingByApp = indexPricing(storedPricing);

        List<MergedGame> games = new ArrayList<>();
        List<FactRow> facts = new ArrayList<>();
        List<GameTagLink> bridges = new ArrayList<>();
        Set<String> genres = new TreeSet<>();
        Set<String> tags = new TreeSet<>();

        for (Map.Entry<Long, MetadataRecord> entry : metadataByApp.entrySet()) {
            long appId = entry.getKey();
            MetadataRecord meta = entry.getValue();
            PricingRecord price = pricingByApp.get(appId);

            games.add(mergeGame(meta, price));

            genres.addAll(meta.genres());
            if (price != null) {
                genres.addAll(price.genres());
            }
            String primaryGenre = primaryGenre(meta, price);

            PriceSnapshot snapshot = priceSnapshot(meta, price, storedPricingByApp.get(appId));
            for (PlayerCountRecord players : playersByApp.getOrDefault(appId, List.of())) {
                facts.add(FactRow.of(players, primaryGenre, snapshot));
            }

            for (String tag : meta.tags()) {
                tags.add(tag);
                bridges.add(new GameTagLink(appId, tag));
            }
        }

        Set<Long> outsiders = new TreeSet<>(playersByApp.keySet());
        outsiders.addAll(pricingByApp.keySet());
        outsiders.removeAll(metadataByApp.keySet());
        if (!outsiders.isEmpty()) {
            log.info("Excluded {} entities absent from metadata (first: {})", outsiders.size(), outsiders.iterator().next());
        }

        facts.sort(Comparator.comparingLong(FactRow::appId).thenComparing(FactRow::period));
        bridges.sort(Comparator.comparingLong(GameTagLink::appId).thenComparing(GameTagLink::tagName));

        MergedEntitySet merged = new MergedEntitySet(games, new ArrayList<>(genres), new ArrayList<>(tags),
            facts, bridges, outsiders.size());
        log.info("Merged {} games, {} genres, {} tags, {} facts, {} bridges",
            games.size(), genres.size(), tags.size(), facts.size(), bridges.size());
        return merged;
    }

    private static MergedGame mergeGame(MetadataRecord meta, PricingRecord price) {
        String developer = meta.developer();
        String publisher = meta.publisher();
        var releaseDate = meta.releaseDate();
        Boolean free = meta.free();
        String name = meta.name();
        if (price != null) {
            developer = price.developer() != null ? price.developer() : developer;
            publisher = price.publisher() != null ? price.publisher() : publisher;
            releaseDate = price.releaseDate() != null ? price.releaseDate() : releaseDate;
            free = price.free() != null ? price.free() : free;
            if (name == null) {
                name = price.name();
            }
        }
        return new MergedGame(
            meta.appId(),
            name,
            developer,
            publisher,
            releaseDate,
            free,
            meta.ownersMin(),
            meta.ownersMax(),
            meta.positiveReviews(),
            meta.negativeReviews()
        );
    }

    private static PriceSnapshot priceSnapshot(MetadataRecord meta, PricingRecord price, PricingRecord stored) {
        if (price != null) {
            return PriceSnapshot.from(price);
        }
        PriceSnapshot fallback = PriceSnapshot.from(meta);
        if (fallback == PriceSnapshot.EMPTY && stored != null) {
            return PriceSnapshot.from(stored);
        }
        return fallback;
    }

    private static String primaryGenre(MetadataRecord meta, PricingRecord price) {
        String genre = meta.primaryGenre();
        if (genre == null && price != null && !price.genres().isEmpty()) {
            genre = price.genres().get(0);
        }
        return genre;
    }

    private static Map<Long, MetadataRecord> indexMetadata(Collection<MetadataRecord> records) {
        List<MetadataRecord> sorted = new ArrayList<>(records);
        sorted.sort(METADATA_ORDER);
        Map<Long, MetadataRecord> byApp = new TreeMap<>();
        for (MetadataRecord record : sorted) {
            MetadataRecord first = byApp.get(record.appId());
            if (first == null) {
                byApp.put(record.appId(), record);
            } else if (!record.tags().isEmpty()) {
                // Same game reported twice: keep the richer record, union the tag sets
                Set<String> union = new LinkedHashSet<>(first.tags());
                union.addAll(record.tags());
                byApp.put(record.appId(), first.withTags(new ArrayList<>(union)));
            }
        }
        return byApp;
    }

    private static Map<Long, PricingRecord> indexPricing(Collection<PricingRecord> records) {
        List<PricingRecord> sorted = new ArrayList<>(records);
        sorted.sort(PRICING_ORDER);
        Map<Long, PricingRecord> byApp = new TreeMap<>();
        for (PricingRecord record : sorted) {
            byApp.putIfAbsent(record.appId(), record);
        }
        return byApp;
    }

    private static Map<Long, List<PlayerCountRecord>> indexPlayers(Collection<PlayerCountRecord> records) {
        List<PlayerCountRecord> sorted = new ArrayList<>(records);
        sorted.sort(PLAYER_ORDER);
        Map<Long, List<PlayerCountRecord>> byApp = new TreeMap<>();
        for (PlayerCountRecord record : sorted) {
            byApp.computeIfAbsent(record.appId(), k -> new ArrayList<>()).add(record);
        }
        return byApp;
    }

    private static int pricingFieldCount(PricingRecord record) {
        int count = 0;
        for (Object value : new Object[] {record.name(), record.free(), record.currentPrice(), record.originalPrice(),
            record.discountPercent(), record.currency(), record.releaseDate(), record.developer(), record.publisher()}) {
            if (value != null) {
                count++;
            }
        }
        return count;
    }
}
