/* (C)2026 */
package com.ammann.wearable.dto;

import java.time.Instant;
import java.util.List;
import java.util.Map;
import org.eclipse.microprofile.openapi.annotations.media.Schema;

/**
 * Complete result of an analysis run.
 *
 * <p>{@code baselines}, {@code correlations} and {@code anomalies} are keyed by participant
 * id; {@code correlations} additionally has a {@code cohort} entry. Every participant of the
 * run has an entry in {@code statuses}, including failed and skipped ones.
 */
@Schema(description = "Baselines, correlations and anomaly episodes of one run")
public record AnalysisReportDTO(
        String runId,
        Instant startedAt,
        Instant completedAt,
        @Schema(description = "Run was aborted between participant units") boolean aborted,
        List<ParticipantStatusDTO> statuses,
        Map<String, List<BaselineDTO>> baselines,
        Map<String, List<CorrelationResultDTO>> correlations,
        Map<String, List<AnomalyEventDTO>> anomalies,
        Map<String, ParticipantSummaryDTO> summaries,
        Map<String, List<DriftSignalDTO>> driftSignals,
        Map<String, List<AnomalySummaryDTO>> anomalySummaries
) {
}
