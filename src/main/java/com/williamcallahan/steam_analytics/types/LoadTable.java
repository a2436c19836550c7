package com.williamcallahan.steam_analytics.types;

/**
 * Destination tables written by the loader, declared in write order.
 */
public enum LoadTable {
    GENRE("dim_genre"),
    TAG("dim_tag"),
    GAME("dim_game"),
    FACT("fact_player_price"),
    BRIDGE("bridge_game_tag");

    private final String tableName;

    LoadTable(String tableName) {
        this.tableName = tableName;
    }

    public String getTableName() {
        return tableName;
    }
}
