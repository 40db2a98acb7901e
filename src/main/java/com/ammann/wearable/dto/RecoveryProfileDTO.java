package com.ammann.wearable.dto;

import com.ammann.wearable.model.RecoveryProfile;
import com.fasterxml.jackson.annotation.JsonInclude;
import java.time.Instant;
import org.eclipse.microprofile.openapi.annotations.media.Schema;

@Schema(description = "Return of a metric to its baseline band after an episode")
@JsonInclude(JsonInclude.Include.ALWAYS)
public record RecoveryProfileDTO(
        @Schema(description = "Metric returned to the band and stayed there") boolean resolved,
        @Schema(description = "ISO-8601 duration from episode end to recovery") String recoveryDuration,
        @Schema(description = "Recovery duration in days") Double recoveryDays,
        @Schema(description = "Timestamp of the first sample of the sustained in-band run") Instant recoveredAt,
        @Schema(description = "Least-squares slope of the values per day from episode start") Double trajectorySlope
) {
    private static final double SECONDS_PER_DAY = 86_400.0;

    public static RecoveryProfileDTO from(RecoveryProfile profile) {
        boolean hasDuration = profile.recoveryDuration() != null;
        return new RecoveryProfileDTO(
                profile.resolved(),
                hasDuration ? profile.recoveryDuration().toString() : null,
                hasDuration ? profile.recoveryDuration().getSeconds() / SECONDS_PER_DAY : null,
                profile.recoveredAt(),
                DtoValues.finiteOrNull(profile.trajectorySlope()));
    }
}
