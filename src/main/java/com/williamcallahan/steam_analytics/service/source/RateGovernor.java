package com.williamcallahan.steam_analytics.service.source;

import com.williamcallahan.steam_analytics.types.FailureKind;
import com.williamcallahan.steam_analytics.types.SourceName;
import io.github.resilience4j.bulkhead.Bulkhead;
import io.github.resilience4j.bulkhead.BulkheadConfig;
import io.github.resilience4j.bulkhead.BulkheadFullException;
import lombok.extern.slf4j.Slf4j;

import java.time.Duration;
import java.util.HashMap;
import java.util.Map;
import java.util.function.Supplier;

/**
 * Per-source request gate: at most {@code maxConcurrentRequests} in flight (semaphore bulkhead)
 * and a minimum spacing between request starts.
 * <p>
 * A request on endpoint E starting at time s pushes the earliest next start of any request to
 * {@code s + delay(E)} and the earliest next start on E itself to the same instant, so a slow
 * bulk endpoint keeps its own long spacing even when cheaper endpoints are called in between.
 * Start slots are reserved under a lock, which keeps the spacing strict when several callers
 * share one governor.
 */
@Slf4j
public class RateGovernor {

    private static final Duration DEFAULT_PERMIT_WAIT = Duration.ofMinutes(10);

    private final SourceName source;
    private final Bulkhead bulkhead;
    private final Map<String, Duration> endpointDelays;
    private final Duration defaultDelay;
    private final CancellationToken token;

    private final Object slotLock = new Object();
    private final Map<String, Long> endpointNextStart = new HashMap<>();
    private Long globalNextStart;

    public RateGovernor(SourceName source,
                        int maxConcurrentRequests,
                        Map<String, Duration> endpointDelays,
                        Duration defaultDelay,
                        Duration maxPermitWait,
                        CancellationToken token) {
        this.source = source;
        this.endpointDelays = endpointDelays == null ? Map.of() : Map.copyOf(endpointDelays);
        this.defaultDelay = defaultDelay == null ? Duration.ZERO : defaultDelay;
        this.token = token;
        BulkheadConfig config = BulkheadConfig.custom()
            .maxConcurrentCalls(Math.max(1, maxConcurrentRequests))
            .maxWaitDuration(maxPermitWait == null ? DEFAULT_PERMIT_WAIT : maxPermitWait)
            .build();
        this.bulkhead = Bulkhead.of(source.getConfigKey() + "-governor", config);
    }

    /**
     * Runs {@code request} once a concurrency permit and a start slot for {@code endpoint} are available.
     */
    public <T> T call(String endpoint, long appId, Supplier<T> request) {
        token.throwIfCancelled();
        acquirePermit(appId);
        try {
            long start = reserveStart(endpoint);
            awaitStart(start);
            return request.get();
        } finally {
            bulkhead.onComplete();
        }
    }

    public Duration delayFor(String endpoint) {
        return endpointDelays.getOrDefault(endpoint, defaultDelay);
    }

    public int availablePermits() {
        return bulkhead.getMetrics().getAvailableConcurrentCalls();
    }

    private void acquirePermit(long appId) {
        try {
            bulkhead.acquirePermission();
        } catch (BulkheadFullException e) {
            if (token.isCancelled() || Thread.currentThread().isInterrupted()) {
                throw new PipelineCancelledException("Cancelled while waiting for a " + source.getDisplayName() + " permit", e);
            }
            throw new TransientSourceException(source, appId, FailureKind.THROTTLED,
                "No request permit for " + source.getDisplayName() + " within wait limit", e);
        } catch (RuntimeException e) {
            if (token.isCancelled() || Thread.currentThread().isInterrupted()) {
                throw new PipelineCancelledException("Cancelled while waiting for a " + source.getDisplayName() + " permit", e);
            }
            throw e;
        }
    }

    private long reserveStart(String endpoint) {
        synchronized (slotLock) {
            long start = System.nanoTime();
            if (globalNextStart != null && globalNextStart - start > 0) {
                start = globalNextStart;
            }
            Long endpointNext = endpointNextStart.get(endpoint);
            if (endpointNext != null && endpointNext - start > 0) {
                start = endpointNext;
            }
            long next = start + delayFor(endpoint).toNanos();
            globalNextStart = next;
            endpointNextStart.put(endpoint, next);
            return start;
        }
    }

    private void awaitStart(long start) {
        long remaining = start - System.nanoTime();
        if (remaining > 0 && log.isTraceEnabled()) {
            log.trace("{} governor waiting {}ms before next request", source.getDisplayName(), Duration.ofNanos(remaining).toMillis());
        }
        while (remaining > 0) {
            token.sleep(Duration.ofNanos(remaining));
            remaining = start - System.nanoTime();
        }
    }
}
