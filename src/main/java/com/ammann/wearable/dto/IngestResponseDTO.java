package com.ammann.wearable.dto;

import java.util.List;
import org.eclipse.microprofile.openapi.annotations.media.Schema;

@Schema(description = "Outcome of a participant ingestion request")
public record IngestResponseDTO(
        @Schema(description = "Participants accepted in this request")
        List<String> ingested,

        @Schema(description = "Accepted participants that replaced an earlier series")
        List<String> replaced,

        @Schema(description = "Participants held in the store after the request")
        int totalParticipants
) {
}
