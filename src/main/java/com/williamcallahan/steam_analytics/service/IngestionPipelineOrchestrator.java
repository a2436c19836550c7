/**
 * Orchestrates one ingestion run across the three Steam sources
 *
 * @author William Callahan
 *
 * Features:
 * - Serializes runs behind a fair lock; a run that cannot get it in time is rejected
 * - Determines the entity keys (explicit, discovered through SteamSpy, or already stored)
 * - Fans the refreshed sources out concurrently and joins them before merging
 * - Stands in the stored baseline for sources a run does not refresh
 * - Aborts without loading on cancellation, timeout, zero successes or a high failure rate
 * - Publishes a structured run report when the run ends, whatever its outcome
 */

package com.williamcallahan.steam_analytics.service;

import com.williamcallahan.steam_analytics.config.IngestionProperties;
import com.williamcallahan.steam_analytics.dto.IngestionRunReport;
import com.williamcallahan.steam_analytics.dto.LoadStats;
import com.williamcallahan.steam_analytics.dto.MergeCounts;
import com.williamcallahan.steam_analytics.dto.RunRequest;
import com.williamcallahan.steam_analytics.dto.SourceAcquisitionStats;
import com.williamcallahan.steam_analytics.dto.SourceFailure;
import com.williamcallahan.steam_analytics.model.MergedEntitySet;
import com.williamcallahan.steam_analytics.model.MetadataRecord;
import com.williamcallahan.steam_analytics.model.PlayerCountRecord;
import com.williamcallahan.steam_analytics.model.PricingRecord;
import com.williamcallahan.steam_analytics.repository.StoreBaselineRepository;
import com.williamcallahan.steam_analytics.service.event.IngestionRunCompletedEvent;
import com.williamcallahan.steam_analytics.service.event.IngestionRunStartedEvent;
import com.williamcallahan.steam_analytics.service.source.CancellationToken;
import com.williamcallahan.steam_analytics.service.source.FetchOutcome;
import com.williamcallahan.steam_analytics.service.source.PipelineCancelledException;
import com.williamcallahan.steam_analytics.service.source.SourceSession;
import com.williamcallahan.steam_analytics.service.source.SourceSessionFactory;
import com.williamcallahan.steam_analytics.service.source.SteamChartsScraper;
import com.williamcallahan.steam_analytics.service.source.SteamSpyClient;
import com.williamcallahan.steam_analytics.service.source.SteamStoreClient;
import com.williamcallahan.steam_analytics.types.RunStatus;
import com.williamcallahan.steam_analytics.types.RunType;
import com.williamcallahan.steam_analytics.types.SourceName;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.scheduling.TaskScheduler;
import org.springframework.stereotype.Service;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collection;
import java.util.EnumMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.TreeSet;
import java.util.UUID;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Executor;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicReference;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Supplier;
import java.util.stream.Collectors;

@Slf4j
@Service
public class IngestionPipelineOrchestrator {

    private final IngestionProperties properties;
    private final SourceSessionFactory sessionFactory;
    private final SteamSpyClient steamSpyClient;
    private final SteamChartsScraper steamChartsScraper;
    private final SteamStoreClient steamStoreClient;
    private final SourceAcquisitionService acquisitionService;
    private final StoreBaselineRepository baselineRepository;
    private final GameDataMergeService mergeService;
    private final FactRowDeduplicator deduplicator;
    private final StarSchemaLoader loader;
    private final ApplicationEventPublisher eventPublisher;
    private final Executor ingestionExecutor;
    private final TaskScheduler taskScheduler;

    private final ReentrantLock runLock = new ReentrantLock(true);
    private final AtomicReference<CancellationToken> activeToken = new AtomicReference<>();

    public IngestionPipelineOrchestrator(IngestionProperties properties,
                                         SourceSessionFactory sessionFactory,
                                         SteamSpyClient steamSpyClient,
                                         SteamChartsScraper steamChartsScraper,
                                         SteamStoreClient steamStoreClient,
                                         SourceAcquisitionService acquisitionService,
                                         StoreBaselineRepository baselineRepository,
                                         GameDataMergeService mergeService,
                                         FactRowDeduplicator deduplicator,
                                         StarSchemaLoader loader,
                                         ApplicationEventPublisher eventPublisher,
                                         @Qualifier("ingestionTaskExecutor") Executor ingestionExecutor,
                                         @Qualifier("taskScheduler") TaskScheduler taskScheduler) {
        this.properties = properties;
        this.sessionFactory = sessionFactory;
        this.steamSpyClient = steamSpyClient;
        this.steamChartsScraper = steamChartsScraper;
        this.steamStoreClient = steamStoreClient;
        this.acquisitionService = acquisitionService;
        this.baselineRepository = baselineRepository;
        this.mergeService = mergeService;
        this.deduplicator = deduplicator;
        this.loader = loader;
        this.eventPublisher = eventPublisher;
        this.ingestionExecutor = ingestionExecutor;
        this.taskScheduler = taskScheduler;
    }

    /**
     * Runs the pipeline once. Never throws for per-entity or per-record problems: the returned
     * report carries the outcome, including REJECTED when another run held the lock too long.
     */
    public IngestionRunReport run(RunRequest request) {
        String runId = UUID.randomUUID().toString().substring(0, 8);
        Duration lockWait = properties.getRun().getLockWait();
        boolean locked;
        try {
            locked = runLock.tryLock(lockWait.toMillis(), TimeUnit.MILLISECONDS);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            locked = false;
        }
        if (!locked) {
            Instant now = Instant.now();
            log.warn("Rejected {} run {}: another run is still in progress after waiting {}", request.runType(), runId, lockWait);
            IngestionRunReport rejected = new RunTracker(runId, request, now)
                .finish(RunStatus.REJECTED, "Another ingestion run is in progress");
            publish(new IngestionRunCompletedEvent(rejected));
            return rejected;
        }
        try {
            return execute(runId, request);
        } finally {
            activeToken.set(null);
            runLock.unlock();
        }
    }

    /**
     * Fires the active run's cancellation token, if a run is in flight.
     *
     * @return true when a run was cancelled
     */
    public boolean cancelActiveRun(String reason) {
        CancellationToken token = activeToken.get();
        if (token == null) {
            return false;
        }
        log.warn("Cancelling ingestion run {}: {}", token.getRunId(), reason);
        token.cancel(reason);
        return true;
    }

    public boolean isRunning() {
        return activeToken.get() != null;
    }

    public Optional<String> getActiveRunId() {
        return Optional.ofNullable(activeToken.get()).map(CancellationToken::getRunId);
    }

    private IngestionRunReport execute(String runId, RunRequest request) {
        RunType runType = request.runType();
        CancellationToken token = new CancellationToken(runId);
        activeToken.set(token);
        RunTracker tracker = new RunTracker(runId, request, Instant.now());
        publish(new IngestionRunStartedEvent(runId, runType, tracker.startedAt));
        log.info("Starting {} ingestion run {} (trigger={}, explicit appids={})",
            runType, runId, request.trigger(), request.appIds().size());

        Duration timeout = properties.getRun().getTimeout();
        ScheduledFuture<?> timeoutTask = taskScheduler.schedule(
            () -> token.cancel("Run timeout of " + timeout + " exceeded"), Instant.now().plus(timeout));

        Map<SourceName, SourceSession> sessions = new EnumMap<>(SourceName.class);
        IngestionRunReport report;
        try {
            for (SourceName source : runType.getRefreshedSources()) {
                sessions.put(source, sessionFactory.open(source, token));
            }
            report = acquireMergeAndLoad(request, token, sessions, tracker);
        } catch (PipelineCancelledException e) {
            String reason = token.getReason() != null ? token.getReason() : e.getMessage();
            log.warn("Ingestion run {} cancelled, nothing loaded: {}", runId, reason);
            report = tracker.finish(RunStatus.CANCELLED, reason);
        } catch (RuntimeException e) {
            log.error("Ingestion run {} failed: {}", runId, e.getMessage(), e);
            report = tracker.finish(RunStatus.FAILED, e.getClass().getSimpleName() + ": " + e.getMessage());
        } finally {
            timeoutTask.cancel(false);
            // Releases every connection pool even when a source task is still unwinding
            token.cancel("Run " + runId + " finished");
            sessions.values().forEach(SourceSession::close);
        }
        log.info("Ingestion run {} finished with status {} in {}ms", runId, report.status(), report.duration().toMillis());
        publish(new IngestionRunCompletedEvent(report));
        return report;
    }

    private IngestionRunReport acquireMergeAndLoad(RunRequest request,
                                                   CancellationToken token,
                                                   Map<SourceName, SourceSession> sessions,
                                                   RunTracker tracker) {
        RunType runType = request.runType();
        IngestionProperties.Discovery discovery = properties.getDiscovery();

        // 1. Entity keys
        List<MetadataRecord> discovered = null;
        List<Long> keys;
        if (request.hasExplicitAppIds()) {
            keys = request.appIds();
        } else if (runType.refreshes(SourceName.STEAMSPY)) {
            SourceSession session = sessions.get(SourceName.STEAMSPY);
            FetchOutcome<List<MetadataRecord>> outcome = await(
                submit(token, () -> steamSpyClient.discover(session, discovery.getPages(), discovery.getMaxEntities())), token);
            if (!outcome.isSuccess()) {
                tracker.sources.put(SourceName.STEAMSPY, new SourceAcquisitionStats(SourceName.STEAMSPY, true, 0, 0, 0,
                    List.of(new SourceFailure(0, outcome.getFailureKind(), outcome.getFailureMessage(), outcome.getAttempts()))));
                return tracker.finish(RunStatus.FAILED, "Discovery failed: " + outcome.getFailureKind() + " - " + outcome.getFailureMessage());
            }
            discovered = outcome.getValue();
            keys = new ArrayList<>(discovered.stream().map(MetadataRecord::appId).collect(Collectors.toCollection(TreeSet::new)));
            log.info("Discovered {} games through SteamSpy", keys.size());
        } else {
            keys = baselineRepository.knownAppIds();
        }
        tracker.requestedKeys = keys.size();
        if (keys.isEmpty()) {
            return tracker.finish(RunStatus.FAILED, "No entities to ingest");
        }

        // 2. Baseline for the sources this run does not refresh
        List<MetadataRecord> metadata = null;
        List<PlayerCountRecord> players = null;
        List<PricingRecord> pricing = null;
        if (!runType.refreshes(SourceName.STEAMSPY)) {
            metadata = baselineRepository.loadMetadata(keys);
            tracker.sources.put(SourceName.STEAMSPY, baselineStats(SourceName.STEAMSPY, keys, metadata.size(), metadata.stream().map(MetadataRecord::appId).toList()));
        }
        if (!runType.refreshes(SourceName.STEAMCHARTS)) {
            players = baselineRepository.loadLatestPlayerCounts(keys);
            tracker.sources.put(SourceName.STEAMCHARTS, baselineStats(SourceName.STEAMCHARTS, keys, players.size(), players.stream().map(PlayerCountRecord::appId).toList()));
        }
        if (!runType.refreshes(SourceName.STEAM_STORE)) {
            pricing = baselineRepository.loadLatestPricing(keys);
            tracker.sources.put(SourceName.STEAM_STORE, baselineStats(SourceName.STEAM_STORE, keys, pricing.size(), pricing.stream().map(PricingRecord::appId).toList()));
        }

        // 3. Concurrent acquisition, joined before merge
        CompletableFuture<AcquisitionResult<MetadataRecord>> metadataTask = null;
        CompletableFuture<AcquisitionResult<PlayerCountRecord>> playersTask = null;
        CompletableFuture<AcquisitionResult<PricingRecord>> pricingTask = null;
        if (runType.refreshes(SourceName.STEAMSPY)) {
            if (discovered != null && !discovery.isFetchDetails()) {
                metadataTask = CompletableFuture.completedFuture(AcquisitionResult.of(SourceName.STEAMSPY, discovered, new TreeSet<>(keys)));
            } else {
                SourceSession session = sessions.get(SourceName.STEAMSPY);
                List<Long> targets = keys;
                metadataTask = submit(token, () -> acquisitionService.acquire(steamSpyClient, session, targets));
            }
        }
        if (runType.refreshes(SourceName.STEAMCHARTS)) {
            SourceSession session = sessions.get(SourceName.STEAMCHARTS);
            List<Long> targets = keys;
            playersTask = submit(token, () -> acquisitionService.acquire(steamChartsScraper, session, targets));
        }
        if (runType.refreshes(SourceName.STEAM_STORE)) {
            SourceSession session = sessions.get(SourceName.STEAM_STORE);
            List<Long> targets = keys;
            pricingTask = submit(token, () -> acquisitionService.acquire(steamStoreClient, session, targets));
        }
        List<CompletableFuture<?>> tasks = new ArrayList<>();
        for (CompletableFuture<?> task : new CompletableFuture<?>[] {metadataTask, playersTask, pricingTask}) {
            if (task != null) {
                tasks.add(task);
            }
        }
        await(CompletableFuture.allOf(tasks.toArray(new CompletableFuture<?>[0])), token);

        int succeeded = 0;
        int failed = 0;
        int requested = 0;
        Set<Long> pricingFailures = Set.of();
        if (metadataTask != null) {
            AcquisitionResult<MetadataRecord> result = metadataTask.join();
            metadata = result.records();
            tracker.sources.put(SourceName.STEAMSPY, result.toStats());
        }
        if (playersTask != null) {
            AcquisitionResult<PlayerCountRecord> result = playersTask.join();
            players = result.records();
            tracker.sources.put(SourceName.STEAMCHARTS, result.toStats());
        }
        if (pricingTask != null) {
            AcquisitionResult<PricingRecord> result = pricingTask.join();
            pricing = result.records();
            pricingFailures = result.failures().stream().map(SourceFailure::appId).collect(Collectors.toCollection(TreeSet::new));
            tracker.sources.put(SourceName.STEAM_STORE, result.toStats());
        }
        for (SourceAcquisitionStats stats : tracker.sources.values()) {
            if (stats.refreshed()) {
                succeeded += stats.succeededKeys();
                failed += stats.failureCount();
                requested += stats.requestedKeys();
            }
        }

        // 4. Run-level gates: nothing is loaded past a failed gate
        if (succeeded == 0) {
            return tracker.finish(RunStatus.FAILED, "No entity was acquired successfully from any refreshed source");
        }
        double failureRate = requested == 0 ? 0.0 : (double) failed / requested;
        double maxFailureRate = properties.getRun().getMaxFailureRate();
        if (failureRate > maxFailureRate) {
            return tracker.finish(RunStatus.ABORTED, String.format(Locale.ROOT, "Source failure rate %.1f%% exceeds threshold %.1f%%",
                failureRate * 100, maxFailureRate * 100));
        }

        // 5. Merge, dedupe, load; a failed price fetch keeps the last stored price
        List<PricingRecord> storedPricing = List.of();
        if (!pricingFailures.isEmpty()) {
            storedPricing = baselineRepository.loadLatestPricing(pricingFailures);
            log.info("Keeping stored prices for {} of {} games whose price fetch failed", storedPricing.size(), pricingFailures.size());
        }
        MergedEntitySet merged = mergeService.merge(metadata, players, pricing, storedPricing);
        FactRowDeduplicator.DedupResult deduped = deduplicator.dedupe(merged.facts());
        merged = merged.withFacts(deduped.rows());
        tracker.merge = MergeCounts.of(merged, deduped.collisionsRemoved());
        token.throwIfCancelled();

        tracker.load = loader.load(merged, token);

        boolean hasFailures = failed > 0 || tracker.load.hasFailures();
        return tracker.finish(hasFailures ? RunStatus.COMPLETED_WITH_FAILURES : RunStatus.COMPLETED,
            String.format(Locale.ROOT, "Loaded %d rows (%d source failures, %d load failures)",
                tracker.load.totalWritten(), failed, tracker.load.totalFailed()));
    }

    private <T> CompletableFuture<T> submit(CancellationToken token, Supplier<T> work) {
        return CompletableFuture.supplyAsync(() -> token.runBound(work), ingestionExecutor);
    }

    /**
     * Blocks until {@code work} completes or the token fires, whichever comes first.
     */
    private <T> T await(CompletableFuture<T> work, CancellationToken token) {
        try {
            CompletableFuture.anyOf(work, token.whenCancelled()).get();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            token.cancel("Orchestrator thread interrupted");
            throw new PipelineCancelledException("Run " + token.getRunId() + " interrupted", e);
        } catch (ExecutionException e) {
            Throwable cause = e.getCause();
            if (cause instanceof PipelineCancelledException cancelled) {
                throw cancelled;
            }
            token.throwIfCancelled();
            if (cause instanceof RuntimeException runtime) {
                throw runtime;
            }
            throw new IllegalStateException("Source task failed", cause);
        }
        token.throwIfCancelled();
        return work.join();
    }

    private static SourceAcquisitionStats baselineStats(SourceName source, Collection<Long> keys, int records, List<Long> appIdsWithData) {
        Set<Long> distinct = new TreeSet<>(appIdsWithData);
        return SourceAcquisitionStats.baseline(source, keys.size(), records, distinct.size());
    }

    private void publish(Object event) {
        try {
            eventPublisher.publishEvent(event);
        } catch (RuntimeException e) {
            log.warn("Listener failed for {}: {}", event.getClass().getSimpleName(), e.getMessage(), e);
        }
    }

    /**
     * Collects report sections as the run progresses.
     */
    private static final class RunTracker {
        private final String runId;
        private final RunRequest request;
        private final Instant startedAt;
        private final Map<SourceName, SourceAcquisitionStats> sources = new EnumMap<>(SourceName.class);
        private int requestedKeys;
        private MergeCounts merge = MergeCounts.NONE;
        private LoadStats load = LoadStats.NONE;

        private RunTracker(String runId, RunRequest request, Instant startedAt) {
            this.runId = runId;
            this.request = request;
            this.startedAt = startedAt;
            this.requestedKeys = request.appIds().size();
        }

        private IngestionRunReport finish(RunStatus status, String message) {
            return new IngestionRunReport(runId, request.runType(), status, request.trigger(), startedAt, Instant.now(),
                requestedKeys, sources, merge, load, message);
        }
    }
}
