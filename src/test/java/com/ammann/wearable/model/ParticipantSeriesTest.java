/* (C)2026 */
package com.ammann.wearable.model;

import static com.ammann.wearable.support.TestDataFactory.daily;
import static com.ammann.wearable.support.TestDataFactory.morningOfDay;
import static com.ammann.wearable.support.TestDataFactory.series;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatCode;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.ammann.wearable.enumeration.MetricType;
import com.ammann.wearable.exception.MisalignedInputException;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.Test;

class ParticipantSeriesTest {

    @Test
    void validSeriesPassesValidation() {
        ParticipantSeries s = series("P1", daily("P1", MetricType.HR, 60, 61, 62));

        assertThatCode(s::validate).doesNotThrowAnyException();
        assertThat(s.metrics()).containsExactly(MetricType.HR);
        assertThat(s.samples(MetricType.STEPS)).isEmpty();
        assertThat(s.totalSamples()).isEqualTo(3);
    }

    @Test
    void rejectsSampleOutsideMonitoringWindow() {
        List<Sample> hr = daily("P1", MetricType.HR, 60, 61, 62);
        ParticipantSeries s =
                new ParticipantSeries("P1", Map.of(MetricType.HR, hr), morningOfDay(0), morningOfDay(1));

        assertThatThrownBy(s::validate)
                .isInstanceOf(MisalignedInputException.class)
                .hasMessageContaining("outside monitoring window");
    }

    @Test
    void rejectsNonIncreasingTimestamps() {
        List<Sample> hr =
                List.of(
                        Sample.of("P1", MetricType.HR, morningOfDay(1), 60),
                        Sample.of("P1", MetricType.HR, morningOfDay(1), 61));
        ParticipantSeries s =
                new ParticipantSeries("P1", Map.of(MetricType.HR, hr), morningOfDay(0), morningOfDay(2));

        assertThatThrownBy(s::validate).isInstanceOf(MisalignedInputException.class);
    }

    @Test
    void rejectsSampleFiledUnderWrongMetric() {
        List<Sample> steps = daily("P1", MetricType.STEPS, 1000, 2000);
        ParticipantSeries s =
                new ParticipantSeries("P1", Map.of(MetricType.HR, steps), morningOfDay(0), morningOfDay(1));

        assertThatThrownBy(s::validate)
                .isInstanceOf(MisalignedInputException.class)
                .extracting(e -> ((MisalignedInputException) e).getParticipantId())
                .isEqualTo("P1");
    }

    @Test
    void rejectsForeignParticipantSample() {
        ParticipantSeries s =
                new ParticipantSeries(
                        "P1",
                        Map.of(MetricType.HR, daily("P2", MetricType.HR, 60)),
                        morningOfDay(0),
                        morningOfDay(0));

        assertThatThrownBy(s::validate).isInstanceOf(MisalignedInputException.class);
    }

    @Test
    void rejectsReservedCohortId() {
        String reserved = CorrelationResult.COHORT_SCOPE;
        ParticipantSeries s = series(reserved, daily(reserved, MetricType.HR, 60, 61));

        assertThatThrownBy(s::validate)
                .isInstanceOf(MisalignedInputException.class)
                .hasMessageContaining("reserved");
    }
}
