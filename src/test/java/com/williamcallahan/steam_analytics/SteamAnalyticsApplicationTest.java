package com.williamcallahan.steam_analytics;

import com.williamcallahan.steam_analytics.dto.IngestionRunReport;
import com.williamcallahan.steam_analytics.dto.RunRequest;
import com.williamcallahan.steam_analytics.service.IngestionPipelineOrchestrator;
import com.williamcallahan.steam_analytics.types.RunStatus;
import com.williamcallahan.steam_analytics.types.RunType;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;
import org.springframework.boot.DefaultApplicationArguments;

import java.time.Instant;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

class SteamAnalyticsApplicationTest {

    @Test
    void parseAppIds_trimsAndSkipsEmptyEntries() {
        assertThat(SteamAnalyticsApplication.parseAppIds(" 730, 570,,440 ")).containsExactly(730L, 570L, 440L);
        assertThat(SteamAnalyticsApplication.parseAppIds(null)).isEmpty();
    }

    @Test
    void parseAppIds_rejectsNonNumericValue() {
        assertThatThrownBy(() -> SteamAnalyticsApplication.parseAppIds("730,cs2"))
            .isInstanceOf(IllegalArgumentException.class)
            .hasMessageContaining("cs2");
    }

    @Test
    void run_withoutIngestOptionDoesNothing() {
        IngestionPipelineOrchestrator orchestrator = mock(IngestionPipelineOrchestrator.class);

        new SteamAnalyticsApplication(orchestrator).run(new DefaultApplicationArguments("--server.port=0"));

        verifyNoInteractions(orchestrator);
    }

    @Test
    void run_ingestOptionStartsRequestedRun() {
        IngestionPipelineOrchestrator orchestrator = mock(IngestionPipelineOrchestrator.class);
        Instant now = Instant.now();
        when(orchestrator.run(any(RunRequest.class))).thenReturn(
            new IngestionRunReport("cli1", RunType.PRICING, RunStatus.COMPLETED, "cli", now, now, 2, Map.of(), null, null, "ok"));

        new SteamAnalyticsApplication(orchestrator)
            .run(new DefaultApplicationArguments("--ingest.run=pricing", "--ingest.appids=730,570"));

        ArgumentCaptor<RunRequest> captor = ArgumentCaptor.forClass(RunRequest.class);
        verify(orchestrator).run(captor.capture());
        assertThat(captor.getValue().runType()).isEqualTo(RunType.PRICING);
        assertThat(captor.getValue().appIds()).containsExactly(570L, 730L);
        assertThat(captor.getValue().trigger()).isEqualTo("cli");
    }
}
