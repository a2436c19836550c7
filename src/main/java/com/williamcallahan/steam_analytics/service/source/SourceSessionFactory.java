package com.williamcallahan.steam_analytics.service.source;

import com.williamcallahan.steam_analytics.config.IngestionProperties;
import com.williamcallahan.steam_analytics.config.RetryConfig;
import com.williamcallahan.steam_analytics.config.WebClientConfig;
import com.williamcallahan.steam_analytics.monitoring.IngestionMetricsService;
import com.williamcallahan.steam_analytics.types.SourceName;
import org.springframework.http.HttpHeaders;
import org.springframework.http.client.reactive.ReactorClientHttpConnector;
import org.springframework.stereotype.Component;
import org.springframework.web.reactive.function.client.WebClient;
import reactor.netty.http.client.HttpClient;
import reactor.netty.resources.ConnectionProvider;

import java.time.Duration;

/**
 * Opens run-scoped {@link SourceSession}s. Each session gets a fresh connection pool sized to
 * the source's concurrency ceiling, so no HTTP state is shared between sources or runs.
 */
@Component
public class SourceSessionFactory {

    private final IngestionProperties properties;
    private final WebClient.Builder webClientBuilder;
    private final RetryConfig retryConfig;
    private final IngestionMetricsService metrics;

    public SourceSessionFactory(IngestionProperties properties,
                                WebClient.Builder webClientBuilder,
                                RetryConfig retryConfig,
                                IngestionMetricsService metrics) {
        this.properties = properties;
        this.webClientBuilder = webClientBuilder;
        this.retryConfig = retryConfig;
        this.metrics = metrics;
    }

    public SourceSession open(SourceName source, CancellationToken token) {
        IngestionProperties.Source settings = properties.source(source);
        int maxConcurrent = Math.max(1, settings.getMaxConcurrentRequests());

        ConnectionProvider connectionProvider = ConnectionProvider.builder(source.getConfigKey() + "-" + token.getRunId())
            .maxConnections(maxConcurrent)
            .pendingAcquireTimeout(settings.getRequestTimeout())
            .maxIdleTime(Duration.ofSeconds(30))
            .build();
        HttpClient httpClient = WebClientConfig.sourceHttpClient(connectionProvider,
            settings.getConnectTimeout(), settings.getRequestTimeout());

        WebClient webClient = webClientBuilder.clone()
            .baseUrl(settings.getBaseUrl())
            .defaultHeader(HttpHeaders.USER_AGENT, settings.getUserAgent())
            .clientConnector(new ReactorClientHttpConnector(httpClient))
            .build();

        RateGovernor governor = new RateGovernor(source, maxConcurrent, settings.getEndpointDelays(),
            settings.getDefaultDelay(), properties.getRun().getTimeout(), token);
        RetryExecutor retryExecutor = new RetryExecutor(source, retryConfig.sourceRetryTemplate(token), metrics);

        return new SourceSession(source, webClient, connectionProvider, governor, retryExecutor, token,
            settings.getRequestTimeout(), metrics);
    }
}
