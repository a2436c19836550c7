package com.williamcallahan.steam_analytics.service;

import com.williamcallahan.steam_analytics.config.IngestionProperties;
import com.williamcallahan.steam_analytics.dto.IngestionRunReport;
import com.williamcallahan.steam_analytics.dto.RunRequest;
import com.williamcallahan.steam_analytics.dto.SourceFailure;
import com.williamcallahan.steam_analytics.model.FactRow;
import com.williamcallahan.steam_analytics.model.MergedGame;
import com.williamcallahan.steam_analytics.model.MetadataRecord;
import com.williamcallahan.steam_analytics.model.PlayerCountRecord;
import com.williamcallahan.steam_analytics.model.PricingRecord;
import com.williamcallahan.steam_analytics.repository.StoreBaselineRepository;
import com.williamcallahan.steam_analytics.service.event.IngestionRunCompletedEvent;
import com.williamcallahan.steam_analytics.service.event.IngestionRunStartedEvent;
import com.williamcallahan.steam_analytics.service.source.FetchOutcome;
import com.williamcallahan.steam_analytics.service.source.PipelineCancelledException;
import com.williamcallahan.steam_analytics.service.source.SourceSession;
import com.williamcallahan.steam_analytics.service.source.SourceSessionFactory;
import com.williamcallahan.steam_analytics.service.source.SteamChartsScraper;
import com.williamcallahan.steam_analytics.service.source.SteamSpyClient;
import com.williamcallahan.steam_analytics.service.source.SteamStoreClient;
import com.williamcallahan.steam_analytics.test.support.InMemoryDestinationStore;
import com.williamcallahan.steam_analytics.types.FailureKind;
import com.williamcallahan.steam_analytics.types.LoadTable;
import com.williamcallahan.steam_analytics.types.RunStatus;
import com.williamcallahan.steam_analytics.types.RunType;
import com.williamcallahan.steam_analytics.types.SourceName;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.scheduling.concurrent.ThreadPoolTaskScheduler;
import org.springframework.transaction.support.TransactionOperations;

import java.math.BigDecimal;
import java.time.Duration;
import java.time.LocalDate;
import java.time.YearMonth;
import java.util.ArrayList;
import java.util.List;
import java.util.Set;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;

import static com.williamcallahan.steam_analytics.test.support.SteamRecordFixtures.metadata;
import static com.williamcallahan.steam_analytics.test.support.SteamRecordFixtures.players;
import static com.williamcallahan.steam_analytics.test.support.SteamRecordFixtures.pricing;
import static com.williamcallahan.steam_analytics.test.support.SteamRecordFixtures.storedMetadata;
import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyInt;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.ArgumentMatchers.same;
import static org.mockito.Mockito.atLeast;
import static org.mockito.Mockito.lenient;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class IngestionPipelineOrchestratorTest {

    private static final YearMonth JAN = YearMonth.of(2024, 1);
    private static final List<Long> KEYS = List.of(1L, 2L, 3L);

    @Mock
    private SourceSessionFactory sessionFactory;
    @Mock
    private SteamSpyClient steamSpyClient;
    @Mock
    private SteamChartsScraper steamChartsScraper;
    @Mock
    private SteamStoreClient steamStoreClient;
    @Mock
    private SourceAcquisitionService acquisitionService;
    @Mock
    private StoreBaselineRepository baselineRepository;
    @Mock
    private ApplicationEventPublisher eventPublisher;

    private IngestionProperties properties;
    private InMemoryDestinationStore store;
    private ExecutorService executor;
    private ThreadPoolTaskScheduler scheduler;
    private IngestionPipelineOrchestrator orchestrator;

    @BeforeEach
    void setUp() {
        properties = new IngestionProperties();
        properties.getRun().setLockWait(Duration.ofMillis(100));
        store = new InMemoryDestinationStore();
        executor = Executors.newFixedThreadPool(4);
        scheduler = new ThreadPoolTaskScheduler();
        scheduler.setRemoveOnCancelPolicy(true);
        scheduler.initialize();
        lenient().when(sessionFactory.open(any(), any())).thenAnswer(invocation -> mock(SourceSession.class));
        StarSchemaLoader loader = new StarSchemaLoader(store,
            TransactionOperations.withoutTransaction(), TransactionOperations.withoutTransaction());
        orchestrator = new IngestionPipelineOrchestrator(properties, sessionFactory, steamSpyClient, steamChartsScraper,
            steamStoreClient, acquisitionService, baselineRepository, new GameDataMergeService(),
            new FactRowDeduplicator(), loader, eventPublisher, executor, scheduler);
    }

    @AfterEach
    void tearDown() {
        executor.shutdownNow();
        scheduler.shutdown();
    }

    private static <T> AcquisitionResult<T> result(SourceName source, List<T> records, Set<Long> succeeded, List<SourceFailure> failures) {
        return new AcquisitionResult<>(source, KEYS.size(), records, succeeded, failures);
    }

    private static SourceFailure failure(long appId, FailureKind kind) {
        return new SourceFailure(appId, kind, kind.name(), kind.isTransient() ? 3 : 1);
    }

    private void stubMetadata(AcquisitionResult<MetadataRecord> result) {
        when(acquisitionService.acquire(same(steamSpyClient), any(), any())).thenReturn(result);
    }

    private void stubPlayers(AcquisitionResult<PlayerCountRecord> result) {
        when(acquisitionService.acquire(same(steamChartsScraper), any(), any())).thenReturn(result);
    }

    private void stubPricing(AcquisitionResult<PricingRecord> result) {
        when(acquisitionService.acquire(same(steamStoreClient), any(), any())).thenReturn(result);
    }

    private static AcquisitionResult<MetadataRecord> allMetadata() {
        return result(SourceName.STEAMSPY, List.of(
            metadata(1, "One", List.of("Action"), List.of("FPS")),
            metadata(2, "Two", List.of("Indie"), List.of()),
            metadata(3, "Three", List.of("RPG"), List.of("Fantasy"))), Set.copyOf(KEYS), List.of());
    }

    @Test
    void run_partialSourceFailureStillLoadsEverythingElse() {
        stubMetadata(allMetadata());
        stubPlayers(result(SourceName.STEAMCHARTS, List.of(players(1, JAN, 10, 20), players(3, JAN, 30, 40)),
            Set.of(1L, 3L), List.of(failure(2, FailureKind.TIMEOUT))));
        stubPricing(result(SourceName.STEAM_STORE, List.of(pricing(1, "1.00", "1.00", 0), pricing(2, "2.00", "4.00", 50),
            pricing(3, "3.00", "3.00", 0)), Set.copyOf(KEYS), List.of()));

        IngestionRunReport report = orchestrator.run(RunRequest.forAppIds(RunType.FULL, KEYS, "test"));

        assertThat(report.status()).isEqualTo(RunStatus.COMPLETED_WITH_FAILURES);
        assertThat(report.totalSourceFailures()).isEqualTo(1);
        assertThat(report.source(SourceName.STEAMCHARTS).failures()).extracting(SourceFailure::appId).containsExactly(2L);
        assertThat(store.gameCount()).isEqualTo(3);
        assertThat(store.factCount()).isEqualTo(2);
        assertThat(report.merge().facts()).isEqualTo(2);
        assertThat(report.load().forTable(LoadTable.GAME).inserted()).isEqualTo(3);
        assertThat(orchestrator.isRunning()).isFalse();

        ArgumentCaptor<Object> events = ArgumentCaptor.forClass(Object.class);
        verify(eventPublisher, atLeast(2)).publishEvent(events.capture());
        assertThat(events.getAllValues()).hasAtLeastOneElementOfType(IngestionRunStartedEvent.class);
        assertThat(events.getAllValues()).filteredOn(IngestionRunCompletedEvent.class::isInstance)
            .singleElement()
            .satisfies(event -> assertThat(((IngestionRunCompletedEvent) event).getReport()).isSameAs(report));
    }

    @Test
    void run_cleanRunCompletes() {
        stubMetadata(allMetadata());
        stubPlayers(result(SourceName.STEAMCHARTS, List.of(players(1, JAN, 10, 20)), Set.copyOf(KEYS), List.of()));
        stubPricing(result(SourceName.STEAM_STORE, List.of(), Set.copyOf(KEYS), List.of()));

        IngestionRunReport report = orchestrator.run(RunRequest.forAppIds(RunType.FULL, KEYS, "test"));

        assertThat(report.status()).isEqualTo(RunStatus.COMPLETED);
        assertThat(report.message()).startsWith("Loaded");
        assertThat(scheduler.getScheduledThreadPoolExecutor().getQueue()).isEmpty();
    }

    @Test
    void run_timeoutCancelsAcquisitionAndLoadsNothing() {
        properties.getRun().setTimeout(Duration.ofMillis(200));
        stubMetadata(allMetadata());
        stubPricing(result(SourceName.STEAM_STORE, List.of(), Set.copyOf(KEYS), List.of()));
        when(acquisitionService.acquire(same(steamChartsScraper), any(), any())).thenAnswer(invocation -> {
            try {
                Thread.sleep(30_000);
            } catch (InterruptedException e) {
                throw new PipelineCancelledException("interrupted", e);
            }
            return result(SourceName.STEAMCHARTS, List.of(), Set.of(), List.of());
        });

        IngestionRunReport report = orchestrator.run(RunRequest.forAppIds(RunType.FULL, KEYS, "test"));

        assertThat(report.status()).isEqualTo(RunStatus.CANCELLED);
        assertThat(report.message()).contains("timeout");
        assertThat(report.duration()).isLessThan(Duration.ofSeconds(10));
        assertThat(store.writeOrder()).isEmpty();
    }

    @Test
    void run_noSuccessfulEntityFailsWithoutLoading() {
        List<SourceFailure> allFailed = List.of(failure(1, FailureKind.NETWORK), failure(2, FailureKind.NETWORK),
            failure(3, FailureKind.NETWORK));
        stubMetadata(result(SourceName.STEAMSPY, List.of(), Set.of(), allFailed));
        stubPlayers(result(SourceName.STEAMCHARTS, List.of(), Set.of(), allFailed));
        stubPricing(result(SourceName.STEAM_STORE, List.of(), Set.of(), allFailed));

        IngestionRunReport report = orchestrator.run(RunRequest.forAppIds(RunType.FULL, KEYS, "test"));

        assertThat(report.status()).isEqualTo(RunStatus.FAILED);
        assertThat(report.totalSourceFailures()).isEqualTo(9);
        assertThat(store.writeOrder()).isEmpty();
    }

    @Test
    void run_failureRateAboveThresholdAborts() {
        List<SourceFailure> allFailed = List.of(failure(1, FailureKind.SERVER_ERROR), failure(2, FailureKind.SERVER_ERROR),
            failure(3, FailureKind.SERVER_ERROR));
        stubMetadata(allMetadata());
        stubPlayers(result(SourceName.STEAMCHARTS, List.of(), Set.of(), allFailed));
        stubPricing(result(SourceName.STEAM_STORE, List.of(), Set.of(), allFailed));

        IngestionRunReport report = orchestrator.run(RunRequest.forAppIds(RunType.FULL, KEYS, "test"));

        assertThat(report.status()).isEqualTo(RunStatus.ABORTED);
        assertThat(report.message()).contains("66.7%");
        assertThat(store.writeOrder()).isEmpty();
    }

    @Test
    void run_pricingRunUsesStoredBaselineForOtherSources() {
        when(baselineRepository.knownAppIds()).thenReturn(List.of(730L));
        when(baselineRepository.loadMetadata(any())).thenReturn(List.of(storedMetadata(730, "Counter-Strike 2", List.of("Action"))));
        when(baselineRepository.loadLatestPlayerCounts(any())).thenReturn(List.of(players(730, JAN, 100, 200)));
        when(acquisitionService.acquire(same(steamStoreClient), any(), any())).thenReturn(
            new AcquisitionResult<>(SourceName.STEAM_STORE, 1, List.of(pricing(730, "3.74", "14.99", 75)), Set.of(730L), List.of()));

        IngestionRunReport report = orchestrator.run(RunRequest.of(RunType.PRICING, "test"));

        assertThat(report.status()).isEqualTo(RunStatus.COMPLETED);
        assertThat(report.source(SourceName.STEAMSPY).refreshed()).isFalse();
        assertThat(report.source(SourceName.STEAM_STORE).refreshed()).isTrue();
        assertThat(store.fact(730, JAN).discountPercent()).isEqualTo(75);
        verify(sessionFactory).open(same(SourceName.STEAM_STORE), any());
        verify(sessionFactory, never()).open(same(SourceName.STEAMSPY), any());
        verify(baselineRepository, never()).loadLatestPricing(any());
    }

    @Test
    void run_pricingRunKeepsStoredPriceWhenStoreFetchFails() {
        store.upsertGame(new MergedGame(2, "Two", "Valve", "Valve", LocalDate.of(2012, 8, 21), false, 1_000L, 2_000L, 10, 2));
        store.upsertFact(new FactRow(2, JAN, "Indie", 50, 90, null, null,
            new BigDecimal("4.00"), new BigDecimal("8.00"), 50, true));
        when(baselineRepository.knownAppIds()).thenReturn(List.of(1L, 2L));
        when(baselineRepository.loadMetadata(any())).thenReturn(List.of(
            storedMetadata(1, "One", List.of("Action")), storedMetadata(2, "Two", List.of("Indie"))));
        when(baselineRepository.loadLatestPlayerCounts(any())).thenReturn(List.of(
            players(1, JAN, 10, 20), players(2, JAN, 50, 90)));
        when(baselineRepository.loadLatestPricing(eq(Set.of(2L)))).thenReturn(List.of(
            PricingRecord.priceOnly(2, new BigDecimal("4.00"), new BigDecimal("8.00"), 50)));
        when(acquisitionService.acquire(same(steamStoreClient), any(), any())).thenReturn(
            new AcquisitionResult<>(SourceName.STEAM_STORE, 2, List.of(pricing(1, "1.00", "1.00", 0)), Set.of(1L),
                List.of(failure(2, FailureKind.TIMEOUT))));

        IngestionRunReport report = orchestrator.run(RunRequest.of(RunType.PRICING, "test"));

        assertThat(report.status()).isEqualTo(RunStatus.COMPLETED_WITH_FAILURES);
        assertThat(store.fact(1, JAN).currentPrice()).isEqualByComparingTo(new BigDecimal("1.00"));
        FactRow kept = store.fact(2, JAN);
        assertThat(kept.currentPrice()).isEqualByComparingTo(new BigDecimal("4.00"));
        assertThat(kept.originalPrice()).isEqualByComparingTo(new BigDecimal("8.00"));
        assertThat(kept.discountPercent()).isEqualTo(50);
        assertThat(kept.discountActive()).isTrue();
        assertThat(report.load().forTable(LoadTable.FACT).unchanged()).isEqualTo(1);
    }

    @Test
    void run_discoveryWithoutDetailFetchUsesDiscoveredMetadata() {
        when(steamSpyClient.discover(any(), anyInt(), anyInt())).thenReturn(FetchOutcome.success(List.of(
            metadata(10, "Ten", List.of("Action"), List.of()), metadata(20, "Twenty", List.of("Indie"), List.of())), 1));
        when(acquisitionService.acquire(same(steamChartsScraper), any(), any())).thenReturn(
            new AcquisitionResult<>(SourceName.STEAMCHARTS, 2, List.of(players(10, JAN, 1, 2)), Set.of(10L, 20L), List.of()));
        when(acquisitionService.acquire(same(steamStoreClient), any(), any())).thenReturn(
            new AcquisitionResult<>(SourceName.STEAM_STORE, 2, List.of(), Set.of(10L, 20L), List.of()));

        IngestionRunReport report = orchestrator.run(RunRequest.of(RunType.FULL, "test"));

        assertThat(report.status()).isEqualTo(RunStatus.COMPLETED);
        assertThat(report.requestedKeys()).isEqualTo(2);
        assertThat(store.gameCount()).isEqualTo(2);
        verify(acquisitionService, never()).acquire(same(steamSpyClient), any(), any());
    }

    @Test
    void run_failedDiscoveryFailsRun() {
        when(steamSpyClient.discover(any(), anyInt(), anyInt()))
            .thenReturn(FetchOutcome.failure(FailureKind.THROTTLED, "HTTP 429", 3));

        IngestionRunReport report = orchestrator.run(RunRequest.of(RunType.FULL, "test"));

        assertThat(report.status()).isEqualTo(RunStatus.FAILED);
        assertThat(report.message()).contains("Discovery failed");
        verify(acquisitionService, never()).acquire(any(), any(), any());
    }

    @Test
    void run_overlappingRunIsRejected() throws Exception {
        CountDownLatch entered = new CountDownLatch(1);
        CountDownLatch release = new CountDownLatch(1);
        stubMetadata(allMetadata());
        stubPricing(result(SourceName.STEAM_STORE, List.of(), Set.copyOf(KEYS), List.of()));
        when(acquisitionService.acquire(same(steamChartsScraper), any(), any())).thenAnswer(invocation -> {
            entered.countDown();
            release.await(10, TimeUnit.SECONDS);
            return result(SourceName.STEAMCHARTS, List.of(), Set.copyOf(KEYS), List.of());
        });

        CompletableFuture<IngestionRunReport> first = CompletableFuture.supplyAsync(
            () -> orchestrator.run(RunRequest.forAppIds(RunType.FULL, KEYS, "first")));
        assertThat(entered.await(5, TimeUnit.SECONDS)).isTrue();
        assertThat(orchestrator.isRunning()).isTrue();

        IngestionRunReport second = orchestrator.run(RunRequest.forAppIds(RunType.FULL, KEYS, "second"));
        release.countDown();

        assertThat(second.status()).isEqualTo(RunStatus.REJECTED);
        assertThat(first.get(10, TimeUnit.SECONDS).status()).isEqualTo(RunStatus.COMPLETED);
    }

    @Test
    void cancelActiveRun_withoutRunReturnsFalse() {
        assertThat(orchestrator.cancelActiveRun("nothing to do")).isFalse();
        assertThat(orchestrator.getActiveRunId()).isEmpty();
    }

    @Test
    void cancelActiveRun_stopsLiveRunBeforeAnythingIsLoaded() throws Exception {
        CountDownLatch entered = new CountDownLatch(1);
        stubMetadata(allMetadata());
        stubPricing(result(SourceName.STEAM_STORE, List.of(), Set.copyOf(KEYS), List.of()));
        when(acquisitionService.acquire(same(steamChartsScraper), any(), any())).thenAnswer(invocation -> {
            entered.countDown();
            try {
                Thread.sleep(30_000);
            } catch (InterruptedException e) {
                throw new PipelineCancelledException("interrupted", e);
            }
            return result(SourceName.STEAMCHARTS, List.of(), Set.of(), List.of());
        });

        CompletableFuture<IngestionRunReport> running = CompletableFuture.supplyAsync(
            () -> orchestrator.run(RunRequest.forAppIds(RunType.FULL, KEYS, "test")));
        assertThat(entered.await(5, TimeUnit.SECONDS)).isTrue();
        assertThat(orchestrator.getActiveRunId()).isPresent();

        assertThat(orchestrator.cancelActiveRun("operator stop")).isTrue();
        IngestionRunReport report = running.get(10, TimeUnit.SECONDS);

        assertThat(report.status()).isEqualTo(RunStatus.CANCELLED);
        assertThat(report.message()).isEqualTo("operator stop");
        assertThat(report.duration()).isLessThan(Duration.ofSeconds(10));
        assertThat(store.writeOrder()).isEmpty();
        assertThat(orchestrator.isRunning()).isFalse();
    }

    @Test
    void run_listenerFailureDoesNotBreakRun() {
        stubMetadata(allMetadata());
        stubPlayers(result(SourceName.STEAMCHARTS, List.of(), Set.copyOf(KEYS), List.of()));
        stubPricing(result(SourceName.STEAM_STORE, List.of(), Set.copyOf(KEYS), List.of()));
        org.mockito.Mockito.doThrow(new IllegalStateException("listener down")).when(eventPublisher).publishEvent(any(Object.class));

        IngestionRunReport report = orchestrator.run(RunRequest.forAppIds(RunType.FULL, new ArrayList<>(KEYS), "test"));

        assertThat(report.status()).isEqualTo(RunStatus.COMPLETED);
    }
}
