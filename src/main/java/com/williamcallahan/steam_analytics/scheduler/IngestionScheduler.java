package com.williamcallahan.steam_analytics.scheduler;

import com.williamcallahan.steam_analytics.config.IngestionProperties;
import com.williamcallahan.steam_analytics.dto.IngestionRunReport;
import com.williamcallahan.steam_analytics.dto.RunRequest;
import com.williamcallahan.steam_analytics.service.IngestionPipelineOrchestrator;
import com.williamcallahan.steam_analytics.types.RunType;
import lombok.extern.slf4j.Slf4j;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

/**
 * Triggers the recurring pipeline runs.
 * <ul>
 *     <li>Weekly full refresh of all three sources.</li>
 *     <li>Daily pricing-only refresh against the stored game set.</li>
 * </ul>
 */
@Component
@Slf4j
public class IngestionScheduler {

    static final String TRIGGER = "scheduler";

    private final IngestionPipelineOrchestrator orchestrator;
    private final IngestionProperties properties;

    public IngestionScheduler(IngestionPipelineOrchestrator orchestrator, IngestionProperties properties) {
        this.orchestrator = orchestrator;
        this.properties = properties;
    }

    @Scheduled(cron = "${app.ingestion.scheduler.full-cron:0 0 3 * * MON}", zone = "${app.ingestion.scheduler.zone:UTC}")
    public void runFullIngestion() {
        trigger(RunType.FULL);
    }

    @Scheduled(cron = "${app.ingestion.scheduler.pricing-cron:0 0 3 * * *}", zone = "${app.ingestion.scheduler.zone:UTC}")
    public void runPricingRefresh() {
        trigger(RunType.PRICING);
    }

    private void trigger(RunType runType) {
        if (!properties.getScheduler().isEnabled()) {
            log.info("Ingestion scheduler disabled via configuration; skipping {} run.", runType);
            return;
        }
        try {
            IngestionRunReport report = orchestrator.run(RunRequest.of(runType, TRIGGER));
            log.info("Scheduled {} run {} ended with {}: {}", runType, report.runId(), report.status(), report.message());
        } catch (RuntimeException e) {
            log.error("Scheduled {} run failed unexpectedly: {}", runType, e.getMessage(), e);
        }
    }
}
