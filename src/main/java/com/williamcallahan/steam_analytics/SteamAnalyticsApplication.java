/**
 * Main application class for Steam Analytics
 *
 * @author William Callahan
 *
 * Features:
 * - Runs the SteamSpy, SteamCharts and Steam Store ingestion pipeline on a schedule
 * - Supports one-off runs from the command line (--ingest.run, --ingest.appids)
 * - Entry point for Spring Boot application
 */

package com.williamcallahan.steam_analytics;

import com.williamcallahan.steam_analytics.dto.IngestionRunReport;
import com.williamcallahan.steam_analytics.dto.RunRequest;
import com.williamcallahan.steam_analytics.service.IngestionPipelineOrchestrator;
import com.williamcallahan.steam_analytics.types.RunType;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.ApplicationArguments;
import org.springframework.boot.ApplicationRunner;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.scheduling.annotation.EnableScheduling;

import java.util.ArrayList;
import java.util.List;

@SpringBootApplication
@EnableScheduling
public class SteamAnalyticsApplication implements ApplicationRunner {

    private static final Logger log = LoggerFactory.getLogger(SteamAnalyticsApplication.class);

    private final IngestionPipelineOrchestrator orchestrator;

    public SteamAnalyticsApplication(IngestionPipelineOrchestrator orchestrator) {
        this.orchestrator = orchestrator;
    }

    /**
     * Main method that starts the Spring Boot application
     *
     * @param args Command line arguments passed to the application
     */
    public static void main(String[] args) {
        SpringApplication.run(SteamAnalyticsApplication.class, args);
    }

    @Override
    public void run(ApplicationArguments args) {
        if (!args.containsOption("ingest.run")) {
            return;
        }
        RunType runType = RunType.fromString(firstOptionValue(args, "ingest.run"));
        List<Long> appIds = parseAppIds(firstOptionValue(args, "ingest.appids"));
        IngestionRunReport report = orchestrator.run(RunRequest.forAppIds(runType, appIds, "cli"));
        log.info("CLI {} run {} ended with {}: {}", runType, report.runId(), report.status(), report.message());
    }

    private String firstOptionValue(ApplicationArguments args, String name) {
        List<String> values = args.getOptionValues(name);
        return (values == null || values.isEmpty()) ? null : values.get(0);
    }

    static List<Long> parseAppIds(String value) {
        List<Long> appIds = new ArrayList<>();
        if (value == null || value.isBlank()) {
            return appIds;
        }
        for (String part : value.split(",")) {
            String trimmed = part.trim();
            if (trimmed.isEmpty()) {
                continue;
            }
            try {
                appIds.add(Long.parseLong(trimmed));
            } catch (NumberFormatException e) {
                throw new IllegalArgumentException("--ingest.appids expects comma-separated Steam appids, got '" + trimmed + "'", e);
            }
        }
        return appIds;
    }
}
