package com.ammann.wearable.dto;

import com.ammann.wearable.enumeration.MetricType;
import com.ammann.wearable.enumeration.Severity;
import com.ammann.wearable.model.AnalyzedEpisode;
import com.ammann.wearable.model.AnomalyEvent;
import com.fasterxml.jackson.annotation.JsonInclude;
import java.time.Instant;
import org.eclipse.microprofile.openapi.annotations.media.Schema;

@Schema(description = "Anomaly episode with its recovery profile")
@JsonInclude(JsonInclude.Include.ALWAYS)
public record AnomalyEventDTO(
        @Schema(description = "Participant") String participantId,
        @Schema(description = "Metric") MetricType metric,
        @Schema(description = "First anomalous sample") Instant episodeStart,
        @Schema(description = "Last anomalous sample") Instant episodeEnd,
        @Schema(description = "Signed deviation with the largest magnitude, in spreads") double peakDeviation,
        @Schema(description = "MILD, MODERATE or SEVERE") Severity severity,
        @Schema(description = "Samples inside the episode") int sampleCount,
        @Schema(description = "Anomalous samples inside the episode") int anomalousSampleCount,
        @Schema(description = "False when the data ended or a gap split the episode") boolean closed,
        @Schema(description = "Recovery after the episode") RecoveryProfileDTO recovery
) {
    public static AnomalyEventDTO from(AnalyzedEpisode episode) {
        AnomalyEvent event = episode.event();
        return new AnomalyEventDTO(
                event.participantId(),
                event.metric(),
                event.episodeStart(),
                event.episodeEnd(),
                event.peakDeviation(),
                event.severity(),
                event.samples().size(),
                event.anomalousSampleCount(),
                event.closed(),
                RecoveryProfileDTO.from(episode.recovery()));
    }
}
