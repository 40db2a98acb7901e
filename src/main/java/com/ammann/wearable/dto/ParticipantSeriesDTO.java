package com.ammann.wearable.dto;

import jakarta.validation.Valid;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import java.time.Instant;
import java.util.List;
import org.eclipse.microprofile.openapi.annotations.media.Schema;

/**
 * All cleaned readings of one participant.
 *
 * <p>When the monitoring window is omitted it defaults to the first and last sample
 * timestamp. Samples of one metric must be strictly increasing in time.
 */
@Schema(description = "Cleaned time series of one participant")
public record ParticipantSeriesDTO(
        @Schema(description = "Participant identifier", required = true, example = "P001")
        @NotBlank
        String participantId,

        @Schema(description = "Start of the monitoring window, defaults to the first sample")
        Instant monitoringStart,

        @Schema(description = "End of the monitoring window, defaults to the last sample")
        Instant monitoringEnd,

        @Schema(description = "Readings across all metrics", required = true)
        @NotNull
        List<@NotNull @Valid SampleDTO> samples
) {
}
