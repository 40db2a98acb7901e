/* (C)2026 */
package com.ammann.wearable.resource;

import com.ammann.wearable.dto.IngestResponseDTO;
import com.ammann.wearable.dto.ParticipantSeriesDTO;
import com.ammann.wearable.exception.ValidationException;
import com.ammann.wearable.model.ParticipantSeries;
import com.ammann.wearable.properties.ApiProperties;
import com.ammann.wearable.service.ReportMappingService;
import com.ammann.wearable.service.TimeSeriesStore;
import jakarta.inject.Inject;
import jakarta.validation.Valid;
import jakarta.validation.constraints.NotNull;
import jakarta.ws.rs.Consumes;
import jakarta.ws.rs.DELETE;
import jakarta.ws.rs.GET;
import jakarta.ws.rs.POST;
import jakarta.ws.rs.Path;
import jakarta.ws.rs.Produces;
import jakarta.ws.rs.core.MediaType;
import jakarta.ws.rs.core.Response;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import org.eclipse.microprofile.openapi.annotations.Operation;
import org.eclipse.microprofile.openapi.annotations.media.Content;
import org.eclipse.microprofile.openapi.annotations.media.Schema;
import org.eclipse.microprofile.openapi.annotations.responses.APIResponse;
import org.eclipse.microprofile.openapi.annotations.responses.APIResponses;
import org.eclipse.microprofile.openapi.annotations.tags.Tag;
import org.jboss.logging.Logger;

/**
 * REST resource for loading participant time series into the in-memory store.
 *
 * <p>A participant submitted again replaces its earlier series. Series are checked for
 * ordering and window violations when a run analyses them, not at ingestion.
 */
@Path(ApiProperties.BASE_URL_V1 + ApiProperties.Participants.BASE)
@Tag(name = "Participants API", description = "Ingestion of cleaned participant time series")
@Produces(MediaType.APPLICATION_JSON)
@Consumes(MediaType.APPLICATION_JSON)
public class ParticipantResource {

    private static final Logger LOG = Logger.getLogger(ParticipantResource.class);

    @Inject TimeSeriesStore store;

    @Inject ReportMappingService mappingService;

    @POST
    @Operation(
            summary = "Ingest participant series",
            description = "Stores one series per participant, replacing earlier submissions")
    @APIResponses({
        @APIResponse(
                responseCode = "200",
                description = "Series stored",
                content = @Content(schema = @Schema(implementation = IngestResponseDTO.class))),
        @APIResponse(responseCode = "400", description = "Invalid series")
    })
    public Response ingest(@NotNull @Valid List<@NotNull @Valid ParticipantSeriesDTO> participants) {
        if (participants == null || participants.isEmpty()) {
            throw ValidationException.missingField("participants");
        }

        Set<String> seen = new HashSet<>();
        List<ParticipantSeries> converted = new ArrayList<>();
        for (ParticipantSeriesDTO dto : participants) {
            ParticipantSeries series = mappingService.toModel(dto);
            if (!seen.add(series.participantId())) {
                throw ValidationException.invalidParameter(
                        "participantId", series.participantId(), "unique within one request");
            }
            converted.add(series);
        }

        List<String> ingested = new ArrayList<>();
        List<String> replaced = new ArrayList<>();
        for (ParticipantSeries series : converted) {
            if (store.put(series).isPresent()) {
                replaced.add(series.participantId());
            }
            ingested.add(series.participantId());
        }

        LOG.infof(
                "Ingested %d participants (%d replaced), store holds %d",
                ingested.size(), replaced.size(), store.size());
        return Response.ok(new IngestResponseDTO(ingested, replaced, store.size())).build();
    }

    @GET
    @Operation(summary = "List participants", description = "Returns the ids held in the store")
    public List<String> list() {
        return store.participantIds();
    }

    @DELETE
    @Operation(summary = "Clear participants", description = "Removes every series from the store")
    public Response clear() {
        int removed = store.size();
        store.clear();
        LOG.infof("Cleared %d participants from the store", removed);
        return Response.ok(Map.of("removed", removed)).build();
    }
}
