/**
 * Ingestion pipeline configuration
 * Centralizes all app.ingestion.* properties: per-source HTTP and rate settings,
 * discovery limits, retry back-off, run guards and scheduler crons
 *
 * @author William Callahan
 */

package com.williamcallahan.steam_analytics.config;

import com.williamcallahan.steam_analytics.types.SourceName;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.NestedConfigurationProperty;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.Map;

@Component
@ConfigurationProperties(prefix = "app.ingestion")
public class IngestionProperties {

    @NestedConfigurationProperty
    private Sources sources = new Sources();

    @NestedConfigurationProperty
    private Discovery discovery = new Discovery();

    @NestedConfigurationProperty
    private Retry retry = new Retry();

    @NestedConfigurationProperty
    private Run run = new Run();

    @NestedConfigurationProperty
    private Scheduler scheduler = new Scheduler();

    public Sources getSources() { return sources; }
    public void setSources(Sources sources) { this.sources = sources; }

    public Discovery getDiscovery() { return discovery; }
    public void setDiscovery(Discovery discovery) { this.discovery = discovery; }

    public Retry getRetry() { return retry; }
    public void setRetry(Retry retry) { this.retry = retry; }

    public Run getRun() { return run; }
    public void setRun(Run run) { this.run = run; }

    public Scheduler getScheduler() { return scheduler; }
    public void setScheduler(Scheduler scheduler) { this.scheduler = scheduler; }

    /**
     * Settings for one source, looked up by name.
     */
    public Source source(SourceName name) {
        switch (name) {
            case STEAMSPY:
                return sources.getSteamspy();
            case STEAMCHARTS:
                return sources.getSteamcharts();
            case STEAM_STORE:
                return sources.getSteamStore();
            default:
                throw new IllegalArgumentException("Unknown source " + name);
        }
    }

    public static class Sources {
        private Source steamspy = new Source("https://steamspy.com/api.php",
            Map.of("appdetails", Duration.ofSeconds(1), "all", Duration.ofSeconds(60)));
        private Source steamcharts = new Source("https://steamcharts.com",
            Map.of("app", Duration.ofSeconds(2)));
        private StoreSource steamStore = new StoreSource();

        public Source getSteamspy() { return steamspy; }
        public void setSteamspy(Source steamspy) { this.steamspy = steamspy; }

        public Source getSteamcharts() { return steamcharts; }
        public void setSteamcharts(Source steamcharts) { this.steamcharts = steamcharts; }

        public StoreSource getSteamStore() { return steamStore; }
        public void setSteamStore(StoreSource steamStore) { this.steamStore = steamStore; }
    }

    public static class Source {
        private String baseUrl;
        private int maxConcurrentRequests = 1;
        private Duration connectTimeout = Duration.ofSeconds(10);
        private Duration requestTimeout = Duration.ofSeconds(30);
        private Duration defaultDelay = Duration.ofSeconds(1);
        private Map<String, Duration> endpointDelays = new LinkedHashMap<>();
        private String userAgent = "Mozilla/5.0 (compatible; SteamAnalyticsBot/1.0)";

        public Source() {
        }

        public Source(String baseUrl, Map<String, Duration> endpointDelays) {
            this.baseUrl = baseUrl;
            this.endpointDelays = new LinkedHashMap<>(endpointDelays);
        }

        public String getBaseUrl() { return baseUrl; }
        public void setBaseUrl(String baseUrl) { this.baseUrl = baseUrl; }

        public int getMaxConcurrentRequests() { return maxConcurrentRequests; }
        public void setMaxConcurrentRequests(int maxConcurrentRequests) { this.maxConcurrentRequests = maxConcurrentRequests; }

        public Duration getConnectTimeout() { return connectTimeout; }
        public void setConnectTimeout(Duration connectTimeout) { this.connectTimeout = connectTimeout; }

        public Duration getRequestTimeout() { return requestTimeout; }
        public void setRequestTimeout(Duration requestTimeout) { this.requestTimeout = requestTimeout; }

        public Duration getDefaultDelay() { return defaultDelay; }
        public void setDefaultDelay(Duration defaultDelay) { this.defaultDelay = defaultDelay; }

        public Map<String, Duration> getEndpointDelays() { return endpointDelays; }
        public void setEndpointDelays(Map<String, Duration> endpointDelays) { this.endpointDelays = endpointDelays; }

        public String getUserAgent() { return userAgent; }
        public void setUserAgent(String userAgent) { this.userAgent = userAgent; }
    }

    public static class StoreSource extends Source {
        private String countryCode = "us";
        private int batchSize = 200;

        public StoreSource() {
            super("https://store.steampowered.com/api/appdetails", Map.of("appdetails", Duration.ofMillis(1500)));
        }

        public String getCountryCode() { return countryCode; }
        public void setCountryCode(String countryCode) { this.countryCode = countryCode; }

        public int getBatchSize() { return batchSize; }
        public void setBatchSize(int batchSize) { this.batchSize = batchSize; }
    }

    public static class Discovery {
        private int pages = 1;
        private int maxEntities = 0; // 0 = unlimited
        private boolean fetchDetails = false;

        public int getPages() { return pages; }
        public void setPages(int pages) { this.pages = pages; }

        public int getMaxEntities() { return maxEntities; }
        public void setMaxEntities(int maxEntities) { this.maxEntities = maxEntities; }

        public boolean isFetchDetails() { return fetchDetails; }
        public void setFetchDetails(boolean fetchDetails) { this.fetchDetails = fetchDetails; }
    }

    public static class Retry {
        private int maxAttempts = 3;
        private Duration initialBackoff = Duration.ofSeconds(2);
        private double multiplier = 2.0;
        private Duration maxBackoff = Duration.ofSeconds(30);
        private double jitterFactor = 0.0;

        public int getMaxAttempts() { return maxAttempts; }
        public void setMaxAttempts(int maxAttempts) { this.maxAttempts = maxAttempts; }

        public Duration getInitialBackoff() { return initialBackoff; }
        public void setInitialBackoff(Duration initialBackoff) { this.initialBackoff = initialBackoff; }

        public double getMultiplier() { return multiplier; }
        public void setMultiplier(double multiplier) { this.multiplier = multiplier; }

        public Duration getMaxBackoff() { return maxBackoff; }
        public void setMaxBackoff(Duration maxBackoff) { this.maxBackoff = maxBackoff; }

        public double getJitterFactor() { return jitterFactor; }
        public void setJitterFactor(double jitterFactor) { this.jitterFactor = jitterFactor; }
    }

    public static class Run {
        private Duration timeout = Duration.ofHours(6);
        private double maxFailureRate = 0.5;
        private Duration lockWait = Duration.ofMinutes(30);
        private int historySize = 20;

        public Duration getTimeout() { return timeout; }
        public void setTimeout(Duration timeout) { this.timeout = timeout; }

        public double getMaxFailureRate() { return maxFailureRate; }
        public void setMaxFailureRate(double maxFailureRate) { this.maxFailureRate = maxFailureRate; }

        public Duration getLockWait() { return lockWait; }
        public void setLockWait(Duration lockWait) { this.lockWait = lockWait; }

        public int getHistorySize() { return historySize; }
        public void setHistorySize(int historySize) { this.historySize = historySize; }
    }

    public static class Scheduler {
        private boolean enabled = true;
        private String fullCron = "0 0 3 * * MON";
        private String pricingCron = "0 0 3 * * *";
        private String zone = "UTC";

        public boolean isEnabled() { return enabled; }
        public void setEnabled(boolean enabled) { this.enabled = enabled; }

        public String getFullCron() { return fullCron; }
        public void setFullCron(String fullCron) { this.fullCron = fullCron; }

        public String getPricingCron() { return pricingCron; }
        public void setPricingCron(String pricingCron) { this.pricingCron = pricingCron; }

        public String getZone() { return zone; }
        public void setZone(String zone) { this.zone = zone; }
    }
}
