package com.williamcallahan.steam_analytics.service;

import com.williamcallahan.steam_analytics.config.IngestionProperties;
import com.williamcallahan.steam_analytics.dto.SourceFailure;
import com.williamcallahan.steam_analytics.service.source.CancellationToken;
import com.williamcallahan.steam_analytics.service.source.FetchOutcome;
import com.williamcallahan.steam_analytics.service.source.PipelineCancelledException;
import com.williamcallahan.steam_analytics.service.source.SourceClient;
import com.williamcallahan.steam_analytics.service.source.SourceSession;
import com.williamcallahan.steam_analytics.types.FailureKind;
import com.williamcallahan.steam_analytics.types.SourceName;
import com.williamcallahan.steam_analytics.util.SourceApiLogger;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;
import java.util.TreeSet;

/**
 * Drives one Source Client over a key set: each entity is fetched, parsed and normalized
 * under the session's retry policy, and failures are collected per entity instead of
 * being thrown. Only cancellation escapes.
 */
@Slf4j
@Service
public class SourceAcquisitionService {

    private static final int DEFAULT_PROGRESS_INTERVAL = 100;

    private final IngestionProperties properties;

    public SourceAcquisitionService(IngestionProperties properties) {
        this.properties = properties;
    }

    /**
     * @throws PipelineCancelledException when the run token fires
     */
    public <T> AcquisitionResult<T> acquire(SourceClient<?, T> client, SourceSession session, Collection<Long> appIds) {
        SourceName source = client.source();
        CancellationToken token = session.getToken();
        Set<Long> keys = new TreeSet<>(appIds);
        List<T> records = new ArrayList<>();
        Set<Long> succeeded = new LinkedHashSet<>();
        List<SourceFailure> failures = new ArrayList<>();
        int interval = progressInterval(source);
        int processed = 0;

        log.info("Acquiring {} entities from {}", keys.size(), source.getDisplayName());
        for (Long appId : keys) {
            token.throwIfCancelled();
            FetchOutcome<List<T>> outcome = fetchOne(client, session, appId);
            if (outcome.isSuccess()) {
                records.addAll(outcome.getValue());
                succeeded.add(appId);
            } else {
                failures.add(new SourceFailure(appId, outcome.getFailureKind(), outcome.getFailureMessage(), outcome.getAttempts()));
            }
            processed++;
            if (processed % interval == 0 && processed < keys.size()) {
                SourceApiLogger.logProgress(log, source, processed, keys.size());
            }
        }
        SourceApiLogger.logAcquisitionComplete(log, source, records.size(), succeeded.size(), failures.size());
        return new AcquisitionResult<>(source, keys.size(), records, succeeded, failures);
    }

    private <T> FetchOutcome<List<T>> fetchOne(SourceClient<?, T> client, SourceSession session, long appId) {
        try {
            return session.fetch(appId, () -> client.fetchAndNormalize(session, appId));
        } catch (PipelineCancelledException e) {
            throw e;
        } catch (RuntimeException e) {
            // A normalizer bug for one entity must not take down the whole batch
            log.error("Unexpected error normalizing {} appid {}: {}", client.source().getDisplayName(), appId, e.getMessage(), e);
            return FetchOutcome.failure(FailureKind.MALFORMED, e.getClass().getSimpleName() + ": " + e.getMessage(), 1);
        }
    }

    private int progressInterval(SourceName source) {
        if (source == SourceName.STEAM_STORE) {
            return Math.max(1, properties.getSources().getSteamStore().getBatchSize());
        }
        return DEFAULT_PROGRESS_INTERVAL;
    }
}
