package com.ammann.wearable.dto;

import com.ammann.wearable.enumeration.MetricType;
import com.ammann.wearable.model.AnomalySummary;
import com.fasterxml.jackson.annotation.JsonInclude;
import java.util.List;
import org.eclipse.microprofile.openapi.annotations.media.Schema;

@Schema(description = "Anomaly and recovery roll-up of one metric")
@JsonInclude(JsonInclude.Include.ALWAYS)
public record AnomalySummaryDTO(
        MetricType metric,
        int episodeCount,
        @Schema(description = "Anomalous samples in percent of all samples") double anomalousPercentage,
        @Schema(description = "Resolved episodes in percent") double recoveryRate,
        Double meanRecoveryDays,
        Double medianRecoveryDays,
        boolean clustered,
        List<String> insights
) {
    public static AnomalySummaryDTO from(AnomalySummary summary) {
        return new AnomalySummaryDTO(
                summary.metric(),
                summary.episodeCount(),
                summary.anomalousPercentage(),
                summary.recoveryRate(),
                summary.meanRecoveryDays(),
                summary.medianRecoveryDays(),
                summary.clustered(),
                summary.insights());
    }
}
