package com.williamcallahan.steam_analytics.model;

import java.util.List;

/**
 * Output of the merge stage, each collection sorted and unique by natural key
 * (facts are made unique by the deduplicator).
 *
 * @param excludedEntities entities seen only in time-series or pricing data, dropped by the left-outer join
 */
public record MergedEntitySet(
    List<MergedGame> games,
    List<String> genres,
    List<String> tags,
    List<FactRow> facts,
    List<GameTagLink> bridges,
    int excludedEntities
) {
    public MergedEntitySet {
        games = List.copyOf(games);
        genres = List.copyOf(genres);
        tags = List.copyOf(tags);
        facts = List.copyOf(facts);
        bridges = List.copyOf(bridges);
    }

    public MergedEntitySet withFacts(List<FactRow> newFacts) {
        return new MergedEntitySet(games, genres, tags, newFacts, bridges, excludedEntities);
    }

    public boolean isEmpty() {
        return games.isEmpty();
    }
}
