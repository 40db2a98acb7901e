package com.ammann.wearable.dto;

import com.ammann.wearable.model.DriftPoint;
import java.time.LocalDate;
import org.eclipse.microprofile.openapi.annotations.media.Schema;

@Schema(description = "Baseline center of one drift window")
public record DriftPointDTO(
        @Schema(description = "First day of the window") LocalDate windowStart,
        @Schema(description = "Last day of the window") LocalDate windowEnd,
        @Schema(description = "Median of the window's samples") double center,
        @Schema(description = "Samples in the window") int sampleCount
) {
    public static DriftPointDTO from(DriftPoint point) {
        return new DriftPointDTO(point.windowStart(), point.windowEnd(), point.center(), point.sampleCount());
    }
}
