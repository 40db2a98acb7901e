/* (C)2026 */
package com.ammann.wearable.service;

import static com.ammann.wearable.support.TestDataFactory.daily;
import static com.ammann.wearable.support.TestDataFactory.hrWithSpike;
import static com.ammann.wearable.support.TestDataFactory.morningOfDay;
import static com.ammann.wearable.support.TestDataFactory.onDays;
import static com.ammann.wearable.support.TestDataFactory.series;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.within;

import com.ammann.wearable.config.AnalysisSettings;
import com.ammann.wearable.enumeration.MetricType;
import com.ammann.wearable.enumeration.Severity;
import com.ammann.wearable.model.AnomalyEvent;
import com.ammann.wearable.model.Baseline;
import com.ammann.wearable.model.DriftSignal;
import com.ammann.wearable.model.ParticipantSeries;
import java.util.List;
import java.util.stream.IntStream;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

/**
 * Unit tests for {@link AnomalyDetectionService}.
 *
 * <p>Most scenarios use 30 daily HR readings cycling 60..80 (center 70, spread 10, band
 * 45..95 at the default multiplier) with anomalies injected on chosen days.
 */
@DisplayName("AnomalyDetectionService")
class AnomalyDetectionServiceTest {

    private static final double[] CYCLE = {60, 65, 70, 75, 80};

    private final AnalysisSettings settings = AnalysisSettings.defaults();
    private final BaselineService baselineService = new BaselineService(settings);
    private final AnomalyDetectionService service = new AnomalyDetectionService(settings);

    @Test
    @DisplayName("single spike of 130 yields exactly one closed SEVERE episode")
    void singleSpike() {
        ParticipantSeries s = series("P1", hrWithSpike("P1"));
        Baseline baseline = baselineService.compute(s, MetricType.HR);

        List<AnomalyEvent> events = service.detect(s, baseline);

        assertThat(events).hasSize(1);
        AnomalyEvent event = events.get(0);
        assertThat(event.severity()).isEqualTo(Severity.SEVERE);
        assertThat(event.peakDeviation()).isCloseTo(6.0, within(1e-9));
        assertThat(event.episodeStart()).isEqualTo(morningOfDay(14));
        assertThat(event.episodeEnd()).isEqualTo(morningOfDay(14));
        assertThat(event.closed()).isTrue();
        assertThat(event.anomalousSampleCount()).isEqualTo(1);
    }

    @Test
    @DisplayName("detection is deterministic")
    void idempotent() {
        ParticipantSeries s = series("P1", hrWithSpike("P1"));
        Baseline baseline = baselineService.compute(s, MetricType.HR);

        assertThat(service.detect(s, baseline)).isEqualTo(service.detect(s, baseline));
    }

    @Test
    @DisplayName("a single in-band sample between anomalies stays inside the episode")
    void shortReturnDoesNotSplit() {
        double[] values = cycle(30);
        values[10] = 20;
        values[12] = 22;
        ParticipantSeries s = series("P1", daily("P1", MetricType.HR, values));
        Baseline baseline = baselineService.compute(s, MetricType.HR);

        List<AnomalyEvent> events = service.detect(s, baseline);

        assertThat(events).hasSize(1);
        assertThat(events.get(0).samples()).hasSize(3);
        assertThat(events.get(0).anomalousSampleCount()).isEqualTo(2);
        assertThat(events.get(0).peakDeviation()).isNegative();
        assertThat(events.get(0).severity()).isEqualTo(Severity.SEVERE);
    }

    @Test
    @DisplayName("episodes never overlap and are ordered")
    void nonOverlapping() {
        double[] values = cycle(30);
        values[5] = 130;
        values[6] = 131;
        values[12] = 132;
        values[25] = 10;
        ParticipantSeries s = series("P1", daily("P1", MetricType.HR, values));
        Baseline baseline = baselineService.compute(s, MetricType.HR);

        List<AnomalyEvent> events = service.detect(s, baseline);

        assertThat(events).hasSize(3);
        for (int i = 1; i < events.size(); i++) {
            assertThat(events.get(i).episodeStart()).isAfter(events.get(i - 1).episodeEnd());
        }
        assertThat(events.get(0).severity()).isEqualTo(Severity.MODERATE);
    }

    @Test
    @DisplayName("a gap longer than the tolerance splits the episode and leaves the first one open")
    void gapSplitsEpisode() {
        int[] days = IntStream.range(0, 30).filter(d -> d < 11 || d > 13).toArray();
        double[] values = new double[days.length];
        for (int i = 0; i < days.length; i++) {
            values[i] = CYCLE[days[i] % CYCLE.length];
        }
        values[10] = 120;
        values[11] = 125;
        ParticipantSeries s = series("P1", onDays("P1", MetricType.HR, days, values));
        Baseline baseline = baselineService.compute(s, MetricType.HR);

        List<AnomalyEvent> events = service.detect(s, baseline);

        assertThat(events).hasSize(2);
        assertThat(events.get(0).episodeEnd()).isEqualTo(morningOfDay(10));
        assertThat(events.get(0).closed()).isFalse();
        assertThat(events.get(1).episodeStart()).isEqualTo(morningOfDay(14));
        assertThat(events.get(1).closed()).isTrue();
    }

    @Test
    @DisplayName("an episode still running when the data ends is not closed")
    void openAtEnd() {
        double[] values = cycle(30);
        values[29] = 140;
        ParticipantSeries s = series("P1", daily("P1", MetricType.HR, values));
        Baseline baseline = baselineService.compute(s, MetricType.HR);

        List<AnomalyEvent> events = service.detect(s, baseline);

        assertThat(events).singleElement().satisfies(e -> assertThat(e.closed()).isFalse());
    }

    @Test
    @DisplayName("fewer than 14 samples produce no episodes")
    void insufficientBaseline() {
        double[] values = cycle(13);
        values[6] = 200;
        ParticipantSeries s = series("P1", daily("P1", MetricType.HR, values));
        Baseline baseline = baselineService.compute(s, MetricType.HR);

        assertThat(baseline.valid()).isFalse();
        assertThat(service.detect(s, baseline)).isEmpty();
        assertThat(service.detectDrift(baseline)).isEmpty();
    }

    @Test
    @DisplayName("drift between windows beyond half a spread is signalled")
    void driftSignal() {
        double[] values = new double[28];
        double[] low = {68, 70, 72};
        double[] high = {88, 90, 92};
        for (int i = 0; i < 28; i++) {
            values[i] = i < 14 ? low[i % 3] : high[i % 3];
        }
        ParticipantSeries s = series("P1", daily("P1", MetricType.HR, values));
        Baseline baseline = baselineService.compute(s, MetricType.HR);

        List<DriftSignal> signals = service.detectDrift(baseline);

        assertThat(signals).singleElement().satisfies(signal -> {
            assertThat(signal.shift()).isCloseTo(20.0, within(1e-9));
            assertThat(signal.shiftInSpreads()).isGreaterThan(0.5);
        });
    }

    @Test
    @DisplayName("windows on either side of a dropped sparse window are not compared")
    void driftNotBridgedAcrossSparseWindow() {
        // days 0-13 low, window 14-27 holds only two samples, days 28-41 high
        int[] days = new int[30];
        double[] values = new double[30];
        double[] low = {68, 70, 72};
        double[] high = {88, 90, 92};
        for (int i = 0; i < 14; i++) {
            days[i] = i;
            values[i] = low[i % 3];
            days[16 + i] = 28 + i;
            values[16 + i] = high[i % 3];
        }
        days[14] = 20;
        values[14] = 80;
        days[15] = 21;
        values[15] = 80;
        ParticipantSeries s = series("P1", onDays("P1", MetricType.HR, days, values));
        Baseline baseline = baselineService.compute(s, MetricType.HR);

        assertThat(baseline.driftCurve()).hasSize(2);
        assertThat(service.detectDrift(baseline)).isEmpty();
    }

    private static double[] cycle(int days) {
        double[] values = new double[days];
        for (int i = 0; i < days; i++) {
            values[i] = CYCLE[i % CYCLE.length];
        }
        return values;
    }
}
