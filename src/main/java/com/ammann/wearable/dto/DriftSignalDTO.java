package com.ammann.wearable.dto;

import com.ammann.wearable.enumeration.MetricType;
import com.ammann.wearable.model.DriftSignal;
import java.time.LocalDate;
import org.eclipse.microprofile.openapi.annotations.media.Schema;

@Schema(description = "Shift of the baseline center between consecutive drift windows")
public record DriftSignalDTO(
        MetricType metric,
        LocalDate fromWindowStart,
        LocalDate toWindowStart,
        double fromCenter,
        double toCenter,
        double shift,
        @Schema(description = "Shift expressed in baseline spreads") double shiftInSpreads
) {
    public static DriftSignalDTO from(DriftSignal signal) {
        return new DriftSignalDTO(
                signal.metric(),
                signal.fromWindowStart(),
                signal.toWindowStart(),
                signal.fromCenter(),
                signal.toCenter(),
                signal.shift(),
                signal.shiftInSpreads());
    }
}
