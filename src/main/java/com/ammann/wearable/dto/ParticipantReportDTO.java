package com.ammann.wearable.dto;

import java.util.List;
import org.eclipse.microprofile.openapi.annotations.media.Schema;

@Schema(description = "All findings of one participant in the latest run")
public record ParticipantReportDTO(
        String runId,
        ParticipantStatusDTO status,
        ParticipantSummaryDTO summary,
        List<BaselineDTO> baselines,
        List<CorrelationResultDTO> correlations,
        List<AnomalyEventDTO> anomalies,
        List<DriftSignalDTO> driftSignals,
        List<AnomalySummaryDTO> anomalySummaries
) {
}
