package com.williamcallahan.steam_analytics.service.source;

import java.time.Duration;
import java.util.Set;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.function.Supplier;

/**
 * Run-scoped cancellation signal.
 * <p>
 * Worker threads bind themselves with {@link #runBound(Supplier)} so {@link #cancel(String)}
 * can interrupt blocked HTTP calls; rate-limit and back-off waits go through
 * {@link #sleep(Duration)} and wake up as soon as the token fires.
 */
public final class CancellationToken {

    private final String runId;
    private final CountDownLatch cancelled = new CountDownLatch(1);
    private final CompletableFuture<String> cancellation = new CompletableFuture<>();
    private final Set<Thread> boundThreads = ConcurrentHashMap.newKeySet();
    private volatile String reason;

    public CancellationToken(String runId) {
        this.runId = runId;
    }

    public static CancellationToken none() {
        return new CancellationToken("detached");
    }

    public String getRunId() {
        return runId;
    }

    /**
     * Fires the token once; later calls are ignored.
     */
    public void cancel(String why) {
        synchronized (this) {
            if (isCancelled()) {
                return;
            }
            this.reason = why;
            cancelled.countDown();
        }
        boundThreads.forEach(Thread::interrupt);
        cancellation.complete(why);
    }

    public boolean isCancelled() {
        return cancelled.getCount() == 0;
    }

    public String getReason() {
        return reason;
    }

    /**
     * Completes with the cancellation reason when the token fires.
     */
    public CompletableFuture<String> whenCancelled() {
        return cancellation;
    }

    public void throwIfCancelled() {
        if (isCancelled()) {
            throw new PipelineCancelledException("Run " + runId + " cancelled: " + reason);
        }
    }

    /**
     * Blocks for the given duration unless the token fires first.
     *
     * @throws PipelineCancelledException when cancelled or interrupted while waiting
     */
    public void sleep(Duration duration) {
        throwIfCancelled();
        if (duration.isNegative() || duration.isZero()) {
            return;
        }
        try {
            if (cancelled.await(duration.toNanos(), TimeUnit.NANOSECONDS)) {
                throwIfCancelled();
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new PipelineCancelledException("Run " + runId + " interrupted while waiting", e);
        }
    }

    /**
     * Runs {@code work} with the current thread registered for interruption on cancel.
     * The interrupt flag is cleared afterwards so pooled threads are returned clean.
     */
    public <T> T runBound(Supplier<T> work) {
        Thread current = Thread.currentThread();
        boundThreads.add(current);
        try {
            throwIfCancelled();
            return work.get();
        } finally {
            boundThreads.remove(current);
            if (Thread.interrupted() && !isCancelled()) {
                current.interrupt();
            }
        }
    }
}
