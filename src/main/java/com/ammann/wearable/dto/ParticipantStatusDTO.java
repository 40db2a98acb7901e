package com.ammann.wearable.dto;

import com.ammann.wearable.enumeration.ParticipantRunStatus;
import com.ammann.wearable.model.ParticipantStatus;
import org.eclipse.microprofile.openapi.annotations.media.Schema;

@Schema(description = "Outcome of one participant's analysis unit")
public record ParticipantStatusDTO(
        String participantId,
        ParticipantRunStatus status,
        @Schema(description = "Exception type for FAILED units") String errorType,
        String message
) {
    public static ParticipantStatusDTO from(ParticipantStatus status) {
        return new ParticipantStatusDTO(
                status.participantId(), status.status(), status.errorType(), status.message());
    }
}
