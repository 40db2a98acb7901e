/* (C)2026 */
package com.ammann.wearable.service;

import static com.ammann.wearable.support.TestDataFactory.daily;
import static com.ammann.wearable.support.TestDataFactory.healthyParticipant;
import static com.ammann.wearable.support.TestDataFactory.mirrored;
import static com.ammann.wearable.support.TestDataFactory.series;
import static com.ammann.wearable.support.TestDataFactory.wobblyRamp;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.within;

import com.ammann.wearable.config.AnalysisSettings;
import com.ammann.wearable.enumeration.CorrelationConfidence;
import com.ammann.wearable.enumeration.CorrelationKind;
import com.ammann.wearable.enumeration.CorrelationMethod;
import com.ammann.wearable.enumeration.CorrelationTrend;
import com.ammann.wearable.enumeration.MetricType;
import com.ammann.wearable.enumeration.NotComputableReason;
import com.ammann.wearable.model.CorrelationResult;
import com.ammann.wearable.model.DailySeries;
import com.ammann.wearable.model.MetricPair;
import com.ammann.wearable.model.ParticipantAnalysis;
import com.ammann.wearable.model.ParticipantSeries;
import com.ammann.wearable.support.TestDataFactory;
import java.util.Arrays;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

/**
 * Unit tests for {@link CorrelationService}.
 */
@DisplayName("CorrelationService")
class CorrelationServiceTest {

    private static final MetricPair STEPS_SLEEP = MetricPair.of(MetricType.STEPS, MetricType.SLEEP);

    private final AnalysisSettings settings =
            AnalysisSettings.builder().metricPairs(List.of(STEPS_SLEEP)).build();
    private final DailyAlignmentService alignment = new DailyAlignmentService(settings);
    private final CorrelationService service = new CorrelationService(settings, alignment);

    @Test
    @DisplayName("perfectly anti-correlated series yield -1 with both estimators")
    void antiCorrelated() {
        List<CorrelationResult> results = correlate(healthyParticipant("P1"));

        for (CorrelationMethod method : CorrelationMethod.values()) {
            CorrelationResult daily = find(results, CorrelationKind.DAILY, method);
            assertThat(daily.coefficient()).isCloseTo(-1.0, within(1e-9));
            assertThat(daily.sampleSize()).isEqualTo(30);
            assertThat(daily.significant()).isTrue();
            assertThat(daily.confidence()).isEqualTo(CorrelationConfidence.STRONG);
            assertThat(daily.interpretation()).isEqualTo("Strong negative correlation");
            assertThat(daily.participantCount()).isEqualTo(1);
        }
    }

    @Test
    @DisplayName("each pair yields daily, lag-1 and rolling results for both estimators")
    void sixResultsPerPair() {
        List<CorrelationResult> results = correlate(healthyParticipant("P1"));

        assertThat(results).hasSize(6);
        assertThat(results).extracting(CorrelationResult::scope).containsOnly("P1");
        assertThat(results).allMatch(r -> r.coefficient() >= -1.0 && r.coefficient() <= 1.0);
    }

    @Test
    @DisplayName("lag-1 pairs each day with the following day")
    void lagOne() {
        CorrelationResult lag =
                find(correlate(healthyParticipant("P1")), CorrelationKind.LAG1, CorrelationMethod.SPEARMAN);

        assertThat(lag.computable()).isTrue();
        assertThat(lag.sampleSize()).isEqualTo(29);
        assertThat(lag.coefficient()).isCloseTo(-1.0, within(1e-9));
        assertThat(lag.interpretation()).isEqualTo("Higher STEPS today strongly decreases SLEEP tomorrow");
    }

    @Test
    @DisplayName("rolling windows slide one day at a time over the span")
    void rollingWindows() {
        CorrelationResult rolling =
                find(correlate(healthyParticipant("P1")), CorrelationKind.ROLLING, CorrelationMethod.PEARSON);

        assertThat(rolling.windows()).hasSize(30 - 14 + 1);
        assertThat(rolling.windows()).allMatch(w -> w.sampleSize() == 14 && w.computable());
        assertThat(rolling.sampleSize()).isEqualTo(17);
        assertThat(rolling.coefficient()).isCloseTo(-1.0, within(1e-9));
        assertThat(rolling.trend().trend()).isEqualTo(CorrelationTrend.STABLE);
        assertThat(rolling.confidence()).isNull();
        assertThat(rolling.pValue()).isNaN();
    }

    @Test
    @DisplayName("five aligned days are not computable, not zero")
    void fiveDaysNotComputable() {
        double[] steps = wobblyRamp(5, 4000, 150);
        ParticipantSeries s =
                series(
                        "P1",
                        daily("P1", MetricType.STEPS, steps),
                        daily("P1", MetricType.SLEEP, mirrored(steps, 12_000)));

        List<CorrelationResult> results = correlate(s);

        assertThat(results).hasSize(6).noneMatch(CorrelationResult::computable);
        assertThat(results).allMatch(r -> Double.isNaN(r.coefficient()));
        assertThat(results).allMatch(r -> r.reason() == NotComputableReason.INSUFFICIENT_DATA);
        CorrelationResult rolling = find(results, CorrelationKind.ROLLING, CorrelationMethod.PEARSON);
        assertThat(rolling.windows()).isEmpty();
        assertThat(rolling.trend().trend()).isEqualTo(CorrelationTrend.INSUFFICIENT_DATA);
    }

    @Test
    @DisplayName("a constant series is degenerate")
    void constantSeriesDegenerate() {
        double[] sleep = new double[20];
        Arrays.fill(sleep, 7.5);
        ParticipantSeries s =
                series(
                        "P1",
                        daily("P1", MetricType.STEPS, wobblyRamp(20, 4000, 150)),
                        daily("P1", MetricType.SLEEP, sleep));

        List<CorrelationResult> results = correlate(s);

        assertThat(results).allMatch(r -> r.reason() == NotComputableReason.DEGENERATE_SERIES);
    }

    @Test
    @DisplayName("swapping the pair order gives identical results")
    void symmetricInPairOrder() {
        Map<MetricType, DailySeries> daily = alignment.aggregateAll(healthyParticipant("P1"));

        List<CorrelationResult> ab =
                service.correlatePair("P1", MetricPair.of(MetricType.HR, MetricType.STEPS), daily);
        List<CorrelationResult> ba =
                service.correlatePair("P1", MetricPair.of(MetricType.STEPS, MetricType.HR), daily);

        assertThat(ab).isEqualTo(ba);
    }

    @Test
    @DisplayName("cohort pools only participants with a computable result")
    void cohortPooling() {
        TestDataFactory.Services services = TestDataFactory.services(settings);
        double[] shortSteps = wobblyRamp(5, 4000, 150);
        ParticipantAnalysis p1 = services.participant().analyze(healthyParticipant("P1"));
        ParticipantAnalysis p2 = services.participant().analyze(healthyParticipant("P2"));
        ParticipantAnalysis p3 =
                services.participant()
                        .analyze(
                                series(
                                        "P3",
                                        daily("P3", MetricType.STEPS, shortSteps),
                                        daily("P3", MetricType.SLEEP, mirrored(shortSteps, 12_000))));

        List<CorrelationResult> cohort = service.correlateCohort(List.of(p1, p2, p3));

        assertThat(cohort).hasSize(6).allMatch(CorrelationResult::isCohort);
        CorrelationResult daily = find(cohort, CorrelationKind.DAILY, CorrelationMethod.PEARSON);
        assertThat(daily.participantCount()).isEqualTo(2);
        assertThat(daily.sampleSize()).isEqualTo(60);
        assertThat(daily.coefficient()).isCloseTo(-1.0, within(1e-9));
        CorrelationResult lag = find(cohort, CorrelationKind.LAG1, CorrelationMethod.PEARSON);
        assertThat(lag.sampleSize()).isEqualTo(58);
    }

    @Test
    @DisplayName("cohort without contributors is not computable")
    void emptyCohort() {
        List<CorrelationResult> cohort = service.correlateCohort(List.of());

        assertThat(cohort).hasSize(6).noneMatch(CorrelationResult::computable);
        assertThat(cohort).allMatch(r -> r.participantCount() == 0);
    }

    private List<CorrelationResult> correlate(ParticipantSeries s) {
        return service.correlateParticipant(s.participantId(), alignment.aggregateAll(s));
    }

    private static CorrelationResult find(
            List<CorrelationResult> results, CorrelationKind kind, CorrelationMethod method) {
        return results.stream()
                .filter(r -> r.kind() == kind && r.method() == method)
                .findFirst()
                .orElseThrow();
    }
}
