/* (C)2026 */
package com.ammann.wearable.resource;

import com.ammann.wearable.dto.AnalysisReportDTO;
import com.ammann.wearable.dto.ParticipantReportDTO;
import com.ammann.wearable.model.AnalysisReport;
import com.ammann.wearable.properties.ApiProperties;
import com.ammann.wearable.service.CohortAnalysisService;
import com.ammann.wearable.service.ReportMappingService;
import jakarta.inject.Inject;
import jakarta.ws.rs.GET;
import jakarta.ws.rs.NotFoundException;
import jakarta.ws.rs.POST;
import jakarta.ws.rs.Path;
import jakarta.ws.rs.PathParam;
import jakarta.ws.rs.Produces;
import jakarta.ws.rs.core.MediaType;
import jakarta.ws.rs.core.Response;
import java.util.Map;
import org.eclipse.microprofile.openapi.annotations.Operation;
import org.eclipse.microprofile.openapi.annotations.media.Content;
import org.eclipse.microprofile.openapi.annotations.media.Schema;
import org.eclipse.microprofile.openapi.annotations.responses.APIResponse;
import org.eclipse.microprofile.openapi.annotations.responses.APIResponses;
import org.eclipse.microprofile.openapi.annotations.tags.Tag;
import org.jboss.logging.Logger;

/**
 * REST resource for starting analysis runs and reading their reports.
 *
 * <p>A run is executed synchronously over the participants currently in the store. Only one
 * run can execute at a time; a concurrent request is rejected with HTTP 409.
 */
@Path(ApiProperties.BASE_URL_V1 + ApiProperties.Analysis.BASE)
@Tag(name = "Analysis API", description = "Baseline, correlation and anomaly analysis runs")
@Produces(MediaType.APPLICATION_JSON)
public class AnalysisResource {

    private static final Logger LOG = Logger.getLogger(AnalysisResource.class);

    @Inject CohortAnalysisService analysisService;

    @Inject ReportMappingService mappingService;

    @POST
    @Operation(
            summary = "Run analysis",
            description = "Analyses every stored participant and returns the complete report")
    @APIResponses({
        @APIResponse(
                responseCode = "200",
                description = "Run finished",
                content = @Content(schema = @Schema(implementation = AnalysisReportDTO.class))),
        @APIResponse(responseCode = "409", description = "Another run is in progress")
    })
    public AnalysisReportDTO run() {
        LOG.debug("Analysis run requested");
        AnalysisReport report = analysisService.runAnalysis();
        return mappingService.toDto(report);
    }

    @GET
    @Path(ApiProperties.Analysis.LATEST)
    @Operation(summary = "Latest report", description = "Returns the report of the last finished run")
    @APIResponses({
        @APIResponse(
                responseCode = "200",
                description = "Report found",
                content = @Content(schema = @Schema(implementation = AnalysisReportDTO.class))),
        @APIResponse(responseCode = "404", description = "No run has finished yet")
    })
    public AnalysisReportDTO latest() {
        return analysisService
                .latestReport()
                .map(mappingService::toDto)
                .orElseThrow(() -> new NotFoundException("No analysis run has finished yet"));
    }

    @GET
    @Path(ApiProperties.Analysis.LATEST_PARTICIPANT)
    @Operation(
            summary = "Latest participant report",
            description = "Returns one participant's findings from the last finished run")
    @APIResponses({
        @APIResponse(
                responseCode = "200",
                description = "Participant found",
                content = @Content(schema = @Schema(implementation = ParticipantReportDTO.class))),
        @APIResponse(responseCode = "404", description = "No run yet or participant not in it")
    })
    public ParticipantReportDTO latestParticipant(@PathParam("participantId") String participantId) {
        AnalysisReport report =
                analysisService
                        .latestReport()
                        .orElseThrow(() -> new NotFoundException("No analysis run has finished yet"));
        ParticipantReportDTO dto = mappingService.toParticipantDto(report, participantId);
        if (dto == null) {
            throw new NotFoundException(
                    "Participant " + participantId + " was not part of run " + report.runId());
        }
        return dto;
    }

    @POST
    @Path(ApiProperties.Analysis.ABORT)
    @Operation(
            summary = "Abort run",
            description = "Stops the current run from starting further participant units")
    public Response abort() {
        boolean accepted = analysisService.requestAbort();
        return Response.status(accepted ? Response.Status.ACCEPTED : Response.Status.OK)
                .entity(Map.of("abortRequested", accepted))
                .build();
    }
}
