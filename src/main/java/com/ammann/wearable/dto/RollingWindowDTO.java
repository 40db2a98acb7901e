package com.ammann.wearable.dto;

import com.ammann.wearable.enumeration.NotComputableReason;
import com.ammann.wearable.model.RollingWindow;
import com.fasterxml.jackson.annotation.JsonInclude;
import java.time.LocalDate;
import org.eclipse.microprofile.openapi.annotations.media.Schema;

@Schema(description = "Correlation of one rolling window")
@JsonInclude(JsonInclude.Include.ALWAYS)
public record RollingWindowDTO(
        @Schema(description = "First day of the window") LocalDate windowStart,
        @Schema(description = "Coefficient, null when not computable") Double coefficient,
        @Schema(description = "Aligned days in the window") int sampleSize,
        @Schema(description = "Why the coefficient is missing") NotComputableReason reason
) {
    public static RollingWindowDTO from(RollingWindow window) {
        return new RollingWindowDTO(
                window.windowStart(),
                DtoValues.finiteOrNull(window.coefficient()),
                window.sampleSize(),
                window.reason());
    }
}
