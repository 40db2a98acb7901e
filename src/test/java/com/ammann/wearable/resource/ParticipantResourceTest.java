/* (C)2026 */
package com.ammann.wearable.resource;

import static com.ammann.wearable.support.TestDataFactory.morningOfDay;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.ammann.wearable.dto.IngestResponseDTO;
import com.ammann.wearable.dto.ParticipantSeriesDTO;
import com.ammann.wearable.dto.SampleDTO;
import com.ammann.wearable.enumeration.MetricType;
import com.ammann.wearable.exception.ValidationException;
import com.ammann.wearable.service.ReportMappingService;
import com.ammann.wearable.service.TimeSeriesStore;
import jakarta.ws.rs.core.Response;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

class ParticipantResourceTest {

    private ParticipantResource resource;

    @BeforeEach
    void setUp() {
        resource = new ParticipantResource();
        resource.store = new TimeSeriesStore();
        resource.mappingService = new ReportMappingService();
    }

    @Test
    void ingestStoresAndReportsReplacements() {
        Response first = resource.ingest(List.of(participant("P1"), participant("P2")));
        Response second = resource.ingest(List.of(participant("P2"), participant("P3")));

        IngestResponseDTO firstBody = (IngestResponseDTO) first.getEntity();
        IngestResponseDTO secondBody = (IngestResponseDTO) second.getEntity();

        assertThat(first.getStatus()).isEqualTo(Response.Status.OK.getStatusCode());
        assertThat(firstBody.ingested()).containsExactly("P1", "P2");
        assertThat(firstBody.replaced()).isEmpty();
        assertThat(secondBody.replaced()).containsExactly("P2");
        assertThat(secondBody.totalParticipants()).isEqualTo(3);
        assertThat(resource.list()).containsExactly("P1", "P2", "P3");
    }

    @Test
    void ingestRejectsEmptyAndDuplicateRequests() {
        assertThatThrownBy(() -> resource.ingest(List.of())).isInstanceOf(ValidationException.class);
        assertThatThrownBy(() -> resource.ingest(List.of(participant("P1"), participant("P1"))))
                .isInstanceOf(ValidationException.class)
                .hasMessageContaining("unique");

        assertThat(resource.store.size()).isZero();
    }

    @Test
    void clearRemovesEverything() {
        resource.ingest(List.of(participant("P1"), participant("P2")));

        Response response = resource.clear();

        assertThat(response.getEntity()).isEqualTo(Map.of("removed", 2));
        assertThat(resource.list()).isEmpty();
    }

    private static ParticipantSeriesDTO participant(String id) {
        return new ParticipantSeriesDTO(
                id,
                null,
                null,
                List.of(
                        new SampleDTO(MetricType.HR, morningOfDay(0), 61.0, null, null),
                        new SampleDTO(MetricType.HR, morningOfDay(1), 64.0, null, null)));
    }
}
