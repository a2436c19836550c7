package com.williamcallahan.steam_analytics.service;

import com.williamcallahan.steam_analytics.config.IngestionProperties;
import com.williamcallahan.steam_analytics.config.RetryConfig;
import com.williamcallahan.steam_analytics.dto.SourceAcquisitionStats;
import com.williamcallahan.steam_analytics.dto.SourceFailure;
import com.williamcallahan.steam_analytics.service.source.CancellationToken;
import com.williamcallahan.steam_analytics.service.source.PermanentSourceException;
import com.williamcallahan.steam_analytics.service.source.PipelineCancelledException;
import com.williamcallahan.steam_analytics.service.source.RateGovernor;
import com.williamcallahan.steam_analytics.service.source.RetryExecutor;
import com.williamcallahan.steam_analytics.service.source.SourceClient;
import com.williamcallahan.steam_analytics.service.source.SourceFetchException;
import com.williamcallahan.steam_analytics.service.source.SourceSession;
import com.williamcallahan.steam_analytics.types.FailureKind;
import com.williamcallahan.steam_analytics.types.SourceName;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.time.Duration;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyLong;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class SourceAcquisitionServiceTest {

    @Mock
    private SourceClient<String, String> client;

    private CancellationToken token;
    private SourceSession session;
    private SourceAcquisitionService acquisitionService;

    @BeforeEach
    void setUp() {
        token = new CancellationToken("acq");
        IngestionProperties.Retry retry = new IngestionProperties.Retry();
        retry.setInitialBackoff(Duration.ofMillis(1));
        retry.setMaxBackoff(Duration.ofMillis(2));
        RetryExecutor retryExecutor = new RetryExecutor(SourceName.STEAMCHARTS,
            RetryConfig.buildSourceRetryTemplate(retry, token), null);
        RateGovernor governor = new RateGovernor(SourceName.STEAMCHARTS, 1, Map.of(), Duration.ZERO,
            Duration.ofSeconds(1), token);
        session = new SourceSession(SourceName.STEAMCHARTS, null, null, governor, retryExecutor, token,
            Duration.ofSeconds(1), null);
        acquisitionService = new SourceAcquisitionService(new IngestionProperties());
        when(client.source()).thenReturn(SourceName.STEAMCHARTS);
    }

    @Test
    void acquire_oneEntityFailingDoesNotAffectOthers() {
        when(client.fetchAndNormalize(any(), eq(1L))).thenReturn(List.of("a-jan", "a-feb"));
        when(client.fetchAndNormalize(any(), eq(2L)))
            .thenThrow(PermanentSourceException.notFound(SourceName.STEAMCHARTS, 2, "HTTP 404"));
        when(client.fetchAndNormalize(any(), eq(3L))).thenReturn(List.of());

        AcquisitionResult<String> result = acquisitionService.acquire(client, session, List.of(3L, 1L, 2L));

        assertThat(result.records()).containsExactly("a-jan", "a-feb");
        assertThat(result.succeededKeys()).containsExactlyInAnyOrder(1L, 3L);
        assertThat(result.failures()).singleElement().satisfies(failure -> {
            assertThat(failure.appId()).isEqualTo(2L);
            assertThat(failure.kind()).isEqualTo(FailureKind.NOT_FOUND);
            assertThat(failure.attempts()).isEqualTo(1);
        });

        SourceAcquisitionStats stats = result.toStats();
        assertThat(stats.refreshed()).isTrue();
        assertThat(stats.requestedKeys()).isEqualTo(3);
        assertThat(stats.records()).isEqualTo(2);
        assertThat(stats.succeededKeys()).isEqualTo(2);
    }

    @Test
    void acquire_transientFailureRetriedBeforeGivingUp() {
        when(client.fetchAndNormalize(any(), eq(7L)))
            .thenThrow(SourceFetchException.forStatus(SourceName.STEAMCHARTS, 7, 503))
            .thenReturn(List.of("recovered"));

        AcquisitionResult<String> result = acquisitionService.acquire(client, session, List.of(7L));

        assertThat(result.records()).containsExactly("recovered");
        assertThat(result.failures()).isEmpty();
    }

    @Test
    void acquire_unexpectedNormalizerErrorBecomesMalformedFailure() {
        when(client.fetchAndNormalize(any(), eq(9L))).thenThrow(new IllegalArgumentException("bad owner range"));

        AcquisitionResult<String> result = acquisitionService.acquire(client, session, List.of(9L));

        assertThat(result.failures()).extracting(SourceFailure::kind).containsExactly(FailureKind.MALFORMED);
        assertThat(result.succeededKeys()).isEmpty();
    }

    @Test
    void acquire_duplicateKeysFetchedOnce() {
        when(client.fetchAndNormalize(any(), eq(4L))).thenReturn(List.of("once"));

        AcquisitionResult<String> result = acquisitionService.acquire(client, session, List.of(4L, 4L));

        assertThat(result.requestedKeys()).isEqualTo(1);
        assertThat(result.records()).containsExactly("once");
    }

    @Test
    void acquire_stopsAtCancellation() {
        when(client.fetchAndNormalize(any(), eq(1L))).thenAnswer(invocation -> {
            token.cancel("operator");
            return List.of("first");
        });

        assertThatThrownBy(() -> acquisitionService.acquire(client, session, List.of(1L, 2L)))
            .isInstanceOf(PipelineCancelledException.class);
        verify(client, never()).fetchAndNormalize(any(), eq(2L));
    }

    @Test
    void acquire_emptyKeySetYieldsEmptyResult() {
        AcquisitionResult<String> result = acquisitionService.acquire(client, session, List.of());

        assertThat(result.records()).isEmpty();
        assertThat(result.failures()).isEmpty();
        verify(client, never()).fetchAndNormalize(any(), anyLong());
    }
}
