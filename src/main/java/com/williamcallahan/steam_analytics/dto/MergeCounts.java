package com.williamcallahan.steam_analytics.dto;

import com.williamcallahan.steam_analytics.model.MergedEntitySet;

/**
 * Merge output sizes per entity type.
 */
public record MergeCounts(
    int games,
    int genres,
    int tags,
    int facts,
    int bridges,
    int excludedEntities,
    int duplicateFactsRemoved
) {
    public static final MergeCounts NONE = new MergeCounts(0, 0, 0, 0, 0, 0, 0);

    public static MergeCounts of(MergedEntitySet merged, int duplicateFactsRemoved) {
        return new MergeCounts(merged.games().size(), merged.genres().size(), merged.tags().size(),
            merged.facts().size(), merged.bridges().size(), merged.excludedEntities(), duplicateFactsRemoved);
    }
}
