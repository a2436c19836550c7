/**
 * Configuration for WebClient
 * - Defines the shared WebClient builder (codecs, buffer limits)
 * - Builds the per-session reactor-netty HttpClient with connect/read/write timeouts
 *
 * @author William Callahan
 */
package com.williamcallahan.steam_analytics.config;

import io.netty.channel.ChannelOption;
import io.netty.handler.timeout.ReadTimeoutHandler;
import io.netty.handler.timeout.WriteTimeoutHandler;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.web.reactive.function.client.ExchangeStrategies;
import org.springframework.web.reactive.function.client.WebClient;
import reactor.netty.http.client.HttpClient;
import reactor.netty.resources.ConnectionProvider;

import java.time.Duration;
import java.util.concurrent.TimeUnit;

/**
 * Configures the WebClient instances used by the source clients
 * - Provides a pre-configured WebClient Builder that sessions clone
 * - Keeps connection pools out of the shared builder; each source session owns its own
 */
@Configuration
public class WebClientConfig {

    /**
     * Creates a pre-configured WebClient Builder bean
     * - Raises the in-memory buffer to 16MB for SteamSpy "all" pages
     *
     * @return A WebClient Builder instance
     */
    @Bean
    public WebClient.Builder webClientBuilder() {
        ExchangeStrategies exchangeStrategies = ExchangeStrategies.builder()
            .codecs(configurer -> configurer
                .defaultCodecs()
                .maxInMemorySize(16 * 1024 * 1024)) // 16MB
            .build();

        return WebClient.builder()
            .exchangeStrategies(exchangeStrategies);
    }

    /**
     * Creates an HttpClient on top of a session-owned connection pool
     * - Connect timeout from source settings
     * - Read, write and response timeouts all bounded by the request timeout
     *
     * @param connectionProvider pool owned (and later disposed) by the source session
     * @param connectTimeout     TCP connect timeout
     * @param requestTimeout     per-request timeout
     * @return configured HttpClient
     */
    public static HttpClient sourceHttpClient(ConnectionProvider connectionProvider, Duration connectTimeout, Duration requestTimeout) {
        long requestTimeoutMs = requestTimeout.toMillis();
        return HttpClient.create(connectionProvider)
            .option(ChannelOption.CONNECT_TIMEOUT_MILLIS, (int) connectTimeout.toMillis())
            .doOnConnected(conn -> conn
                .addHandlerLast(new ReadTimeoutHandler(requestTimeoutMs, TimeUnit.MILLISECONDS))
                .addHandlerLast(new WriteTimeoutHandler(requestTimeoutMs, TimeUnit.MILLISECONDS))
            )
            .responseTimeout(requestTimeout)
            .followRedirect(true);
    }
}
