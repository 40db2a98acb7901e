package com.ammann.wearable.dto;

import com.ammann.wearable.enumeration.MetricType;
import com.ammann.wearable.model.ParticipantSummary;
import java.time.LocalDate;
import java.util.List;
import java.util.Map;
import org.eclipse.microprofile.openapi.annotations.media.Schema;

@Schema(description = "Coverage of a participant's monitoring period")
public record ParticipantSummaryDTO(
        LocalDate firstDay,
        LocalDate lastDay,
        int totalDays,
        List<MetricType> availableMetrics,
        @Schema(description = "Days with data divided by monitored days, per metric")
        Map<MetricType, Double> dailyCoverage
) {
    public static ParticipantSummaryDTO from(ParticipantSummary summary) {
        return new ParticipantSummaryDTO(
                summary.firstDay(),
                summary.lastDay(),
                summary.totalDays(),
                summary.availableMetrics(),
                summary.dailyCoverage());
    }
}
