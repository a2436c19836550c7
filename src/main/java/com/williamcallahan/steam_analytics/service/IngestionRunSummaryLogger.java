package com.williamcallahan.steam_analytics.service;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.williamcallahan.steam_analytics.dto.IngestionRunReport;
import com.williamcallahan.steam_analytics.dto.SourceAcquisitionStats;
import com.williamcallahan.steam_analytics.dto.TableLoadStats;
import com.williamcallahan.steam_analytics.service.event.IngestionRunCompletedEvent;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.event.EventListener;
import org.springframework.stereotype.Component;

/**
 * Writes the run report to the log: one line per source and table, then the full report as JSON.
 */
@Slf4j
@Component
public class IngestionRunSummaryLogger {

    private final ObjectMapper objectMapper;

    public IngestionRunSummaryLogger(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
    }

    @EventListener
    public void onRunCompleted(IngestionRunCompletedEvent event) {
        IngestionRunReport report = event.getReport();
        for (SourceAcquisitionStats source : report.sources().values()) {
            log.info("Run {} source {}: {} records, {} keys ok, {} failed{}", report.runId(), source.source().getDisplayName(),
                source.records(), source.succeededKeys(), source.failureCount(), source.refreshed() ? "" : " (stored baseline)");
        }
        for (TableLoadStats table : report.load().tables().values()) {
            log.info("Run {} table {}: inserted={} updated={} unchanged={} failed={}", report.runId(), table.table().getTableName(),
                table.inserted(), table.updated(), table.unchanged(), table.failed());
        }
        try {
            log.info("Run summary: {}", objectMapper.writeValueAsString(report));
        } catch (JsonProcessingException e) {
            log.warn("Could not serialize report for run {}: {}", report.runId(), e.getMessage());
        }
    }
}
