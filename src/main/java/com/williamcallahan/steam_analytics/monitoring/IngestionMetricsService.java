/**
 * Service for tracking ingestion metrics
 * Provides per-source request/failure/retry counters and per-run status counters and timers
 *
 * @author William Callahan
 */

package com.williamcallahan.steam_analytics.monitoring;

import com.williamcallahan.steam_analytics.dto.IngestionRunReport;
import com.williamcallahan.steam_analytics.service.event.IngestionRunCompletedEvent;
import com.williamcallahan.steam_analytics.types.FailureKind;
import com.williamcallahan.steam_analytics.types.LoadTable;
import com.williamcallahan.steam_analytics.types.SourceName;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import org.springframework.context.event.EventListener;
import org.springframework.stereotype.Service;

import java.util.concurrent.atomic.AtomicLong;

@Service
public class IngestionMetricsService {

    private final MeterRegistry meterRegistry;

    // Gauges
    private final AtomicLong lastSuccessfulRunEpochSeconds = new AtomicLong(0);

    public IngestionMetricsService(MeterRegistry meterRegistry) {
        this.meterRegistry = meterRegistry;

        Gauge.builder("ingestion.last_success_timestamp", lastSuccessfulRunEpochSeconds, AtomicLong::get)
            .description("Epoch seconds of the last successful ingestion run")
            .register(meterRegistry);
    }

    public void recordRequest(SourceName source, int status) {
        Counter.builder("ingestion.source.requests")
            .description("HTTP requests sent to an external source")
            .tag("source", source.getConfigKey())
            .tag("status", Integer.toString(status))
            .register(meterRegistry)
            .increment();
    }

    public void recordRetry(SourceName source) {
        Counter.builder("ingestion.source.retries")
            .description("Retried source fetches")
            .tag("source", source.getConfigKey())
            .register(meterRegistry)
            .increment();
    }

    public void recordFailure(SourceName source, FailureKind kind) {
        Counter.builder("ingestion.source.failures")
            .description("Per-entity source failures after retries")
            .tag("source", source.getConfigKey())
            .tag("kind", kind.name())
            .register(meterRegistry)
            .increment();
    }

    public Timer.Sample startTimer() {
        return Timer.start(meterRegistry);
    }

    public void stopSourceTimer(Timer.Sample sample, SourceName source) {
        sample.stop(Timer.builder("ingestion.source.request.duration")
            .description("External source request duration")
            .tag("source", source.getConfigKey())
            .register(meterRegistry));
    }

    @EventListener
    public void onRunCompleted(IngestionRunCompletedEvent event) {
        IngestionRunReport report = event.getReport();
        Counter.builder("ingestion.runs")
            .description("Completed ingestion runs by type and status")
            .tag("type", report.runType().name())
            .tag("status", report.status().name())
            .register(meterRegistry)
            .increment();
        Timer.builder("ingestion.run.duration")
            .description("Ingestion run wall-clock duration")
            .tag("type", report.runType().name())
            .register(meterRegistry)
            .record(report.duration());
        for (LoadTable table : LoadTable.values()) {
            int written = report.load().forTable(table).inserted() + report.load().forTable(table).updated();
            if (written > 0) {
                Counter.builder("ingestion.load.rows_written")
                    .description("Rows inserted or updated by the loader")
                    .tag("table", table.getTableName())
                    .register(meterRegistry)
                    .increment(written);
            }
        }
        if (report.status().isSuccessful() && report.finishedAt() != null) {
            lastSuccessfulRunEpochSeconds.set(report.finishedAt().getEpochSecond());
        }
    }
}
