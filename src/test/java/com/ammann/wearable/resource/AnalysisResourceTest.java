/* (C)2026 */
package com.ammann.wearable.resource;

import static com.ammann.wearable.support.TestDataFactory.healthyParticipant;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.ammann.wearable.config.AnalysisSettings;
import com.ammann.wearable.dto.AnalysisReportDTO;
import com.ammann.wearable.dto.ParticipantReportDTO;
import com.ammann.wearable.enumeration.ParticipantRunStatus;
import com.ammann.wearable.service.CohortAnalysisService;
import com.ammann.wearable.service.ReportMappingService;
import com.ammann.wearable.service.TimeSeriesStore;
import com.ammann.wearable.support.TestDataFactory;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import jakarta.ws.rs.NotFoundException;
import jakarta.ws.rs.core.Response;
import java.util.Map;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

class AnalysisResourceTest {

    private final AnalysisSettings settings = AnalysisSettings.defaults();

    private ExecutorService executor;
    private TimeSeriesStore store;
    private AnalysisResource resource;

    @BeforeEach
    void setUp() {
        executor = Executors.newFixedThreadPool(2);
        store = new TimeSeriesStore();
        TestDataFactory.Services services = TestDataFactory.services(settings);

        resource = new AnalysisResource();
        resource.analysisService =
                new CohortAnalysisService(
                        store, services.participant(), services.correlation(), executor, new SimpleMeterRegistry());
        resource.mappingService = new ReportMappingService();
    }

    @AfterEach
    void tearDown() {
        executor.shutdownNow();
    }

    @Test
    void latestIsNotFoundBeforeAnyRun() {
        assertThatThrownBy(() -> resource.latest()).isInstanceOf(NotFoundException.class);
        assertThatThrownBy(() -> resource.latestParticipant("P1")).isInstanceOf(NotFoundException.class);
    }

    @Test
    void runThenReadLatest() {
        store.put(healthyParticipant("P1"));
        store.put(healthyParticipant("P2"));

        AnalysisReportDTO run = resource.run();
        AnalysisReportDTO latest = resource.latest();
        ParticipantReportDTO p1 = resource.latestParticipant("P1");

        assertThat(latest.runId()).isEqualTo(run.runId());
        assertThat(run.statuses()).allSatisfy(s -> assertThat(s.status()).isEqualTo(ParticipantRunStatus.COMPLETED));
        assertThat(run.correlations()).containsKey("cohort");
        assertThat(p1.runId()).isEqualTo(run.runId());
        assertThat(p1.anomalies()).hasSize(1);
        assertThatThrownBy(() -> resource.latestParticipant("P9"))
                .isInstanceOf(NotFoundException.class)
                .hasMessageContaining("P9");
    }

    @Test
    void abortWhileIdleIsNotAccepted() {
        Response response = resource.abort();

        assertThat(response.getStatus()).isEqualTo(Response.Status.OK.getStatusCode());
        assertThat(response.getEntity()).isEqualTo(Map.of("abortRequested", false));
    }
}
