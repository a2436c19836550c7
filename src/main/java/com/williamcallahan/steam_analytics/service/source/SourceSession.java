package com.williamcallahan.steam_analytics.service.source;

import com.williamcallahan.steam_analytics.monitoring.IngestionMetricsService;
import com.williamcallahan.steam_analytics.types.FailureKind;
import com.williamcallahan.steam_analytics.types.SourceName;
import com.williamcallahan.steam_analytics.util.SourceApiLogger;
import io.micrometer.core.instrument.Timer;
import lombok.extern.slf4j.Slf4j;
import org.springframework.core.io.buffer.DataBufferLimitException;
import org.springframework.web.reactive.function.client.WebClient;
import org.springframework.web.reactive.function.client.WebClientRequestException;
import org.springframework.web.util.UriBuilder;
import reactor.core.Disposable;
import reactor.core.Exceptions;

import java.io.IOException;
import java.net.URI;
import java.time.Duration;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.function.Function;
import java.util.function.Supplier;

/**
 * Everything one source client needs for one run: its own WebClient and connection pool,
 * its rate governor and its retry executor. Opened when the run starts and closed when it
 * ends, which disposes the connection pool.
 */
@Slf4j
public class SourceSession implements AutoCloseable {

    private final SourceName source;
    private final WebClient webClient;
    private final Disposable connectionResources;
    private final RateGovernor governor;
    private final RetryExecutor retryExecutor;
    private final CancellationToken token;
    private final Duration requestTimeout;
    private final IngestionMetricsService metrics;
    private final AtomicBoolean closed = new AtomicBoolean(false);

    public SourceSession(SourceName source,
                         WebClient webClient,
                         Disposable connectionResources,
                         RateGovernor governor,
                         RetryExecutor retryExecutor,
                         CancellationToken token,
                         Duration requestTimeout,
                         IngestionMetricsService metrics) {
        this.source = source;
        this.webClient = webClient;
        this.connectionResources = connectionResources;
        this.governor = governor;
        this.retryExecutor = retryExecutor;
        this.token = token;
        this.requestTimeout = requestTimeout;
        this.metrics = metrics;
    }

    public SourceName getSource() {
        return source;
    }

    public CancellationToken getToken() {
        return token;
    }

    public RateGovernor getGovernor() {
        return governor;
    }

    /**
     * Runs {@code attempt} (fetch, parse, normalize) under the retry policy.
     */
    public <T> FetchOutcome<T> fetch(long appId, Supplier<T> attempt) {
        return retryExecutor.execute(appId, attempt);
    }

    /**
     * Issues one rate-governed GET and returns the body of a 2xx response.
     *
     * @param endpoint    governor endpoint key (selects the minimum spacing)
     * @param appId       entity the request is for, or 0 for listing calls
     * @param uriFunction builds the request URI relative to the source base URL
     * @throws SourceFetchException       on non-2xx status, timeout or I/O failure
     * @throws PipelineCancelledException when the run is cancelled
     */
    public String get(String endpoint, long appId, Function<UriBuilder, URI> uriFunction) {
        if (closed.get()) {
            throw new IllegalStateException(source.getDisplayName() + " session already closed");
        }
        return governor.call(endpoint, appId, () -> exchange(endpoint, appId, uriFunction));
    }

    private String exchange(String endpoint, long appId, Function<UriBuilder, URI> uriFunction) {
        token.throwIfCancelled();
        SourceApiLogger.logRequest(log, source, endpoint, appId);
        long startedNanos = System.nanoTime();
        Timer.Sample sample = metrics != null ? metrics.startTimer() : null;
        try {
            RawResponse response = webClient.get()
                .uri(uriFunction)
                .exchangeToMono(clientResponse -> clientResponse.bodyToMono(String.class)
                    .defaultIfEmpty("")
                    .map(body -> new RawResponse(clientResponse.statusCode().value(), body)))
                .timeout(requestTimeout)
                .block();
            if (response == null) {
                throw SourceFetchException.of(source, appId, FailureKind.NETWORK, "No response");
            }
            long elapsedMs = Duration.ofNanos(System.nanoTime() - startedNanos).toMillis();
            SourceApiLogger.logResponse(log, source, endpoint, appId, response.status(), response.body().length(), elapsedMs);
            if (metrics != null) {
                metrics.recordRequest(source, response.status());
            }
            if (response.status() < 200 || response.status() >= 300) {
                throw SourceFetchException.forStatus(source, appId, response.status());
            }
            return response.body();
        } catch (SourceFetchException e) {
            throw e;
        } catch (RuntimeException e) {
            throw translate(appId, e);
        } finally {
            if (sample != null) {
                metrics.stopSourceTimer(sample, source);
            }
        }
    }

    private RuntimeException translate(long appId, RuntimeException e) {
        Throwable cause = Exceptions.unwrap(e);
        if (token.isCancelled() || cause instanceof InterruptedException || Thread.currentThread().isInterrupted()) {
            return new PipelineCancelledException("Run " + token.getRunId() + " cancelled during " + source.getDisplayName() + " request", e);
        }
        if (hasCause(cause, TimeoutException.class) || hasCause(cause, io.netty.handler.timeout.TimeoutException.class)) {
            return SourceFetchException.of(source, appId, FailureKind.TIMEOUT, "Request timed out after " + requestTimeout.toMillis() + "ms", e);
        }
        if (hasCause(cause, DataBufferLimitException.class)) {
            return SourceFetchException.of(source, appId, FailureKind.MALFORMED, "Response body exceeds buffer limit", e);
        }
        if (cause instanceof WebClientRequestException || hasCause(cause, IOException.class)) {
            return SourceFetchException.of(source, appId, FailureKind.NETWORK, String.valueOf(cause.getMessage()), e);
        }
        return SourceFetchException.of(source, appId, FailureKind.NETWORK, cause.getClass().getSimpleName() + ": " + cause.getMessage(), e);
    }

    private static boolean hasCause(Throwable error, Class<? extends Throwable> type) {
        Throwable current = error;
        while (current != null) {
            if (type.isInstance(current)) {
                return true;
            }
            current = current.getCause() == current ? null : current.getCause();
        }
        return false;
    }

    @Override
    public void close() {
        if (closed.compareAndSet(false, true) && connectionResources != null) {
            connectionResources.dispose();
            log.debug("Closed {} source session for run {}", source.getDisplayName(), token.getRunId());
        }
    }

    public boolean isClosed() {
        return closed.get();
    }

    private record RawResponse(int status, String body) {
    }
}
