/* (C)2026 */
package com.ammann.wearable.health;

import com.ammann.wearable.enumeration.ParticipantRunStatus;
import com.ammann.wearable.model.AnalysisReport;
import com.ammann.wearable.service.CohortAnalysisService;
import com.ammann.wearable.service.TimeSeriesStore;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import java.util.Optional;
import org.eclipse.microprofile.health.HealthCheck;
import org.eclipse.microprofile.health.HealthCheckResponse;
import org.eclipse.microprofile.health.HealthCheckResponseBuilder;
import org.eclipse.microprofile.health.Readiness;

/**
 * Readiness check describing the analysis engine and its last run.
 *
 * <p>Status semantics:
 * <ul>
 *   <li>UP: settings were accepted and the engine can take a run</li>
 *   <li>data {@code state}: IDLE, RUNNING or NO_RUN_YET</li>
 * </ul>
 *
 * <p>Failed participants do not turn the check DOWN; they are reported as data only.
 */
@Readiness
@ApplicationScoped
public class AnalysisReadinessCheck implements HealthCheck {

    @Inject CohortAnalysisService analysisService;

    @Inject TimeSeriesStore store;

    @Override
    public HealthCheckResponse call() {
        Optional<AnalysisReport> latest = analysisService.latestReport();

        String state;
        if (analysisService.isRunning()) {
            state = "RUNNING";
        } else {
            state = latest.isPresent() ? "IDLE" : "NO_RUN_YET";
        }

        HealthCheckResponseBuilder builder =
                HealthCheckResponse.named("wearable-analysis")
                        .up()
                        .withData("state", state)
                        .withData("participants-loaded", store.size());

        latest.ifPresent(
                report ->
                        builder.withData("last-run-id", report.runId())
                                .withData("last-run-completed", report.completedAt().toString())
                                .withData("last-run-aborted", report.aborted())
                                .withData(
                                        "last-run-completed-units",
                                        report.countByStatus(ParticipantRunStatus.COMPLETED))
                                .withData(
                                        "last-run-failed-units",
                                        report.countByStatus(ParticipantRunStatus.FAILED)));
        return builder.build();
    }
}
