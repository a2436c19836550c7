package com.williamcallahan.steam_analytics.service.source;

import com.williamcallahan.steam_analytics.config.IngestionProperties;
import com.williamcallahan.steam_analytics.config.RetryConfig;
import com.williamcallahan.steam_analytics.monitoring.IngestionMetricsService;
import com.williamcallahan.steam_analytics.types.FailureKind;
import com.williamcallahan.steam_analytics.types.SourceName;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.concurrent.atomic.AtomicInteger;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class RetryExecutorTest {

    private SimpleMeterRegistry registry;
    private IngestionMetricsService metrics;
    private IngestionProperties.Retry retrySettings;

    @BeforeEach
    void setUp() {
        registry = new SimpleMeterRegistry();
        metrics = new IngestionMetricsService(registry);
        retrySettings = new IngestionProperties.Retry();
        retrySettings.setMaxAttempts(3);
        retrySettings.setInitialBackoff(Duration.ofMillis(5));
        retrySettings.setMaxBackoff(Duration.ofMillis(20));
    }

    private RetryExecutor executor(CancellationToken token) {
        return new RetryExecutor(SourceName.STEAM_STORE, RetryConfig.buildSourceRetryTemplate(retrySettings, token), metrics);
    }

    @Test
    void execute_transientFailureRetriedUntilSuccess() {
        AtomicInteger calls = new AtomicInteger();

        FetchOutcome<String> outcome = executor(new CancellationToken("r1")).execute(730, () -> {
            if (calls.incrementAndGet() < 3) {
                throw SourceFetchException.forStatus(SourceName.STEAM_STORE, 730, 503);
            }
            return "ok";
        });

        assertThat(outcome.isSuccess()).isTrue();
        assertThat(outcome.getValue()).isEqualTo("ok");
        assertThat(outcome.getAttempts()).isEqualTo(3);
        assertThat(registry.counter("ingestion.source.retries", "source", "steam-store").count()).isEqualTo(2.0);
    }

    @Test
    void execute_transientFailureExhaustsAttempts() {
        AtomicInteger calls = new AtomicInteger();

        FetchOutcome<String> outcome = executor(new CancellationToken("r2")).execute(730, () -> {
            calls.incrementAndGet();
            throw SourceFetchException.forStatus(SourceName.STEAM_STORE, 730, 429);
        });

        assertThat(outcome.isSuccess()).isFalse();
        assertThat(outcome.getFailureKind()).isEqualTo(FailureKind.THROTTLED);
        assertThat(outcome.getAttempts()).isEqualTo(3);
        assertThat(calls).hasValue(3);
        assertThat(registry.counter("ingestion.source.failures", "source", "steam-store", "kind", "THROTTLED").count())
            .isEqualTo(1.0);
    }

    @Test
    void execute_permanentFailureIsNotRetried() {
        AtomicInteger calls = new AtomicInteger();

        FetchOutcome<String> outcome = executor(new CancellationToken("r3")).execute(99, () -> {
            calls.incrementAndGet();
            throw PermanentSourceException.notFound(SourceName.STEAM_STORE, 99, "gone");
        });

        assertThat(outcome.getFailureKind()).isEqualTo(FailureKind.NOT_FOUND);
        assertThat(outcome.getAttempts()).isEqualTo(1);
        assertThat(calls).hasValue(1);
    }

    @Test
    void execute_cancellationDuringBackOffPropagates() {
        retrySettings.setInitialBackoff(Duration.ofMinutes(5));
        retrySettings.setMaxBackoff(Duration.ofMinutes(5));
        CancellationToken token = new CancellationToken("r4");
        RetryExecutor executor = executor(token);

        assertThatThrownBy(() -> executor.execute(1, () -> {
            token.cancel("timeout");
            throw SourceFetchException.forStatus(SourceName.STEAM_STORE, 1, 500);
        })).isInstanceOf(PipelineCancelledException.class);
    }

    @Test
    void execute_cancellationInsideAttemptIsNotFoldedIntoFailure() {
        assertThatThrownBy(() -> executor(new CancellationToken("r5")).execute(1, () -> {
            throw new PipelineCancelledException("stop");
        })).isInstanceOf(PipelineCancelledException.class).hasMessage("stop");
    }
}
