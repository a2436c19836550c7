package com.williamcallahan.steam_analytics.types;

/**
 * External sources the ingestion pipeline pulls from, one per source client.
 */
public enum SourceName {
    /** SteamSpy JSON API; metadata and discovery authority. */
    STEAMSPY("steamspy", "SteamSpy"),
    /** SteamCharts HTML pages; monthly player counts. */
    STEAMCHARTS("steamcharts", "SteamCharts"),
    /** Steam Store appdetails API; pricing and release info. */
    STEAM_STORE("steam-store", "SteamStore");

    private final String configKey;
    private final String displayName;

    SourceName(String configKey, String displayName) {
        this.configKey = configKey;
        this.displayName = displayName;
    }

    public String getConfigKey() {
        return configKey;
    }

    public String getDisplayName() {
        return displayName;
    }
}
