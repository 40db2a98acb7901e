package com.ammann.wearable.dto;

import com.ammann.wearable.enumeration.MetricType;
import com.ammann.wearable.enumeration.SampleQuality;
import jakarta.validation.constraints.NotNull;
import java.time.Instant;
import org.eclipse.microprofile.openapi.annotations.media.Schema;

/**
 * One cleaned reading as submitted by the ingestion client.
 */
@Schema(description = "Single cleaned reading of one metric")
public record SampleDTO(
        @Schema(description = "Metric of the reading", required = true)
        @NotNull
        MetricType metric,

        @Schema(description = "Time of the reading (ISO-8601)", required = true)
        @NotNull
        Instant timestamp,

        @Schema(description = "Primary value", required = true)
        @NotNull
        Double value,

        @Schema(description = "Optional secondary value, e.g. sleep quality")
        Double secondaryValue,

        @Schema(description = "Cleaning outcome, VALID when omitted")
        SampleQuality quality
) {
}
