package com.williamcallahan.steam_analytics.service;

import com.williamcallahan.steam_analytics.config.IngestionProperties;
import com.williamcallahan.steam_analytics.dto.IngestionRunReport;
import com.williamcallahan.steam_analytics.dto.IngestionStatusSnapshot;
import com.williamcallahan.steam_analytics.service.event.IngestionRunCompletedEvent;
import com.williamcallahan.steam_analytics.service.event.IngestionRunStartedEvent;
import com.williamcallahan.steam_analytics.types.RunStatus;
import com.williamcallahan.steam_analytics.types.RunType;
import com.williamcallahan.steam_analytics.types.SourceName;
import org.springframework.context.event.EventListener;
import org.springframework.stereotype.Component;

import java.time.Instant;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;

/**
 * In-memory record of recent runs, fed by run events.
 * <p>
 * A successful FULL run also counts as the latest pricing refresh since it refreshes the store.
 * REJECTED runs never started and are left out of the history.
 */
@Component
public class IngestionRunHistory {

    private final int capacity;
    private final Deque<IngestionRunReport> recent = new ArrayDeque<>();
    private Instant lastFullRun;
    private Instant lastPricingRun;
    private String activeRunId;

    public IngestionRunHistory(IngestionProperties properties) {
        this.capacity = Math.max(1, properties.getRun().getHistorySize());
    }

    @EventListener
    public synchronized void onRunStarted(IngestionRunStartedEvent event) {
        activeRunId = event.getRunId();
    }

    @EventListener
    public synchronized void onRunCompleted(IngestionRunCompletedEvent event) {
        IngestionRunReport report = event.getReport();
        if (report.status() == RunStatus.REJECTED) {
            return;
        }
        if (report.runId().equals(activeRunId)) {
            activeRunId = null;
        }
        recent.addFirst(report);
        while (recent.size() > capacity) {
            recent.removeLast();
        }
        if (report.status().isSuccessful()) {
            if (report.runType() == RunType.FULL) {
                lastFullRun = report.finishedAt();
            }
            if (report.runType().refreshes(SourceName.STEAM_STORE)) {
                lastPricingRun = report.finishedAt();
            }
        }
    }

    public synchronized IngestionStatusSnapshot status() {
        return new IngestionStatusSnapshot(lastFullRun, lastPricingRun, activeRunId != null, activeRunId, new ArrayList<>(recent));
    }
}
