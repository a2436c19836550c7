package com.williamcallahan.steam_analytics.service.source;

import com.williamcallahan.steam_analytics.monitoring.IngestionMetricsService;
import com.williamcallahan.steam_analytics.types.SourceName;
import com.williamcallahan.steam_analytics.util.SourceApiLogger;
import lombok.extern.slf4j.Slf4j;
import org.springframework.retry.RetryCallback;
import org.springframework.retry.backoff.BackOffInterruptedException;
import org.springframework.retry.support.RetryTemplate;

import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.Supplier;

/**
 * Runs one fetch attempt under the session's retry template and folds the result into a
 * {@link FetchOutcome}. Per-entity failures never escape; cancellation does.
 */
@Slf4j
public class RetryExecutor {

    private final SourceName source;
    private final RetryTemplate retryTemplate;
    private final IngestionMetricsService metrics;

    public RetryExecutor(SourceName source, RetryTemplate retryTemplate, IngestionMetricsService metrics) {
        this.source = source;
        this.retryTemplate = retryTemplate;
        this.metrics = metrics;
    }

    public <T> FetchOutcome<T> execute(long appId, Supplier<T> attempt) {
        AtomicInteger attempts = new AtomicInteger();
        RetryCallback<T, SourceFetchException> callback = context -> {
            if (context.getRetryCount() > 0 && context.getLastThrowable() instanceof SourceFetchException previous) {
                SourceApiLogger.logRetry(log, source, appId, context.getRetryCount(), previous.getKind(), previous.getMessage());
                if (metrics != null) {
                    metrics.recordRetry(source);
                }
            }
            attempts.incrementAndGet();
            return attempt.get();
        };
        try {
            T value = retryTemplate.execute(callback);
            return FetchOutcome.success(value, attempts.get());
        } catch (SourceFetchException e) {
            SourceApiLogger.logFailure(log, source, appId, e.getKind(), attempts.get(), e.getMessage());
            if (metrics != null) {
                metrics.recordFailure(source, e.getKind());
            }
            return FetchOutcome.failure(e.getKind(), e.getMessage(), attempts.get());
        } catch (BackOffInterruptedException e) {
            throw new PipelineCancelledException("Cancelled during " + source.getDisplayName() + " back-off for appid " + appId, e);
        }
    }
}
