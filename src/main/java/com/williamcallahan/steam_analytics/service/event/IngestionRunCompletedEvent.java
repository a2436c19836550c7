package com.williamcallahan.steam_analytics.service.event;

import com.williamcallahan.steam_analytics.dto.IngestionRunReport;

/**
 * Event published when a pipeline run finishes, whatever its status.
 * Consumed by run history, metrics and the summary logger.
 */
public class IngestionRunCompletedEvent {
    private final IngestionRunReport report;

    public IngestionRunCompletedEvent(IngestionRunReport report) {
        this.report = report;
    }

    public IngestionRunReport getReport() { return report; }
}
