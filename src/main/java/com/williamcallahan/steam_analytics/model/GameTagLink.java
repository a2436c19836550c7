package com.williamcallahan.steam_analytics.model;

/**
 * A {@code bridge_game_tag} association, keyed by (appId, tagName).
 */
public record GameTagLink(long appId, String tagName) {

    public String naturalKey() {
        return appId + "/" + tagName;
    }
}
