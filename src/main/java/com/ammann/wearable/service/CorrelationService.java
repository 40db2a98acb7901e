/* (C)2026 */
package com.ammann.wearable.service;

import com.ammann.wearable.config.AnalysisSettings;
import com.ammann.wearable.enumeration.CorrelationConfidence;
import com.ammann.wearable.enumeration.CorrelationKind;
import com.ammann.wearable.enumeration.CorrelationMethod;
import com.ammann.wearable.enumeration.CorrelationTrend;
import com.ammann.wearable.enumeration.MetricType;
import com.ammann.wearable.enumeration.NotComputableReason;
import com.ammann.wearable.exception.DegenerateSeriesException;
import com.ammann.wearable.exception.InsufficientDataException;
import com.ammann.wearable.model.AlignedSeries;
import com.ammann.wearable.model.CorrelationResult;
import com.ammann.wearable.model.DailySeries;
import com.ammann.wearable.model.MetricPair;
import com.ammann.wearable.model.ParticipantAnalysis;
import com.ammann.wearable.model.RollingTrend;
import com.ammann.wearable.model.RollingWindow;
import com.ammann.wearable.service.DailyAlignmentService.DaySpan;
import com.ammann.wearable.service.StatisticsSupport.CorrelationStatistic;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.Collection;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import org.jboss.logging.Logger;

/**
 * Computes daily, lag-1 and rolling correlations between metric pairs, per participant and
 * pooled over the cohort.
 *
 * <p>Every statistic is computed with both Pearson and Spearman estimators. A statistic with
 * fewer aligned days than {@code correlationMinAlignedDays}, or over a zero-variance input,
 * is reported with the NOT_COMPUTABLE sentinel and a reason instead of a number.
 *
 * <p>Pairs are unordered: a pair's components are always taken in canonical order, so
 * correlating (A, B) and (B, A) yields identical results. Lag-1 correlations relate the
 * canonical first metric on day d to the second metric on day d+1.
 */
@ApplicationScoped
public class CorrelationService {

    private static final Logger LOG = Logger.getLogger(CorrelationService.class);

    private static final List<CorrelationMethod> METHODS = List.of(CorrelationMethod.values());
    private static final int MIN_WINDOWS_FOR_TREND = 3;

    private final AnalysisSettings settings;
    private final DailyAlignmentService alignment;

    @Inject
    public CorrelationService(AnalysisSettings settings, DailyAlignmentService alignment) {
        this.settings = settings;
        this.alignment = alignment;
    }

    /**
     * Correlates all configured pairs for one participant.
     *
     * @param participantId participant id, used as the result scope
     * @param daily calendar-day aggregates of the participant's metrics
     * @return six results per configured pair (three kinds times two methods)
     */
    public List<CorrelationResult> correlateParticipant(
            String participantId, Map<MetricType, DailySeries> daily) {
        List<CorrelationResult> results = new ArrayList<>();
        for (MetricPair pair : settings.metricPairs()) {
            results.addAll(correlatePair(participantId, pair, daily));
        }

        long computable = results.stream().filter(CorrelationResult::computable).count();
        LOG.debugf(
                "Participant %s: %d of %d correlation results computable",
                participantId, computable, results.size());
        return results;
    }

    /**
     * Computes DAILY, LAG1 and ROLLING results for one pair with both estimators.
     */
    public List<CorrelationResult> correlatePair(
            String scope, MetricPair pair, Map<MetricType, DailySeries> daily) {
        DailySeries first = seriesOf(daily, pair.first());
        DailySeries second = seriesOf(daily, pair.second());

        AlignedSeries sameDay = alignment.alignSameDay(first, second);
        AlignedSeries nextDay = alignment.alignNextDay(first, second);
        DaySpan span = alignment.span(List.of(first, second));

        List<CorrelationResult> results = new ArrayList<>(6);
        for (CorrelationMethod method : METHODS) {
            results.add(fixedResult(scope, pair, CorrelationKind.DAILY, method, sameDay, 1));
        }
        for (CorrelationMethod method : METHODS) {
            results.add(fixedResult(scope, pair, CorrelationKind.LAG1, method, nextDay, 1));
        }
        results.addAll(rollingResults(scope, pair, List.of(sameDay), span, 1));
        return results;
    }

    /**
     * Pools aligned day pairs across participants and computes the same three statistics
     * with scope {@link CorrelationResult#COHORT_SCOPE}.
     *
     * <p>A participant contributes to a pair's DAILY and ROLLING pool only if its own DAILY
     * result for that pair was computable, and to the LAG1 pool only if its LAG1 result was.
     * Excluded participants are left out, never imputed.
     *
     * @param analyses finished participant analyses
     */
    public List<CorrelationResult> correlateCohort(Collection<ParticipantAnalysis> analyses) {
        List<CorrelationResult> results = new ArrayList<>();

        for (MetricPair pair : settings.metricPairs()) {
            List<AlignedSeries> dailyPool = new ArrayList<>();
            List<AlignedSeries> lagPool = new ArrayList<>();
            List<DailySeries> spanInputs = new ArrayList<>();

            for (ParticipantAnalysis analysis : analyses) {
                DailySeries first = seriesOf(analysis.dailySeries(), pair.first());
                DailySeries second = seriesOf(analysis.dailySeries(), pair.second());

                if (wasComputable(analysis, pair, CorrelationKind.DAILY)) {
                    dailyPool.add(alignment.alignSameDay(first, second));
                    spanInputs.add(first);
                    spanInputs.add(second);
                }
                if (wasComputable(analysis, pair, CorrelationKind.LAG1)) {
                    lagPool.add(alignment.alignNextDay(first, second));
                }
            }

            AlignedSeries pooledDaily = AlignedSeries.concat(dailyPool);
            AlignedSeries pooledLag = AlignedSeries.concat(lagPool);
            String scope = CorrelationResult.COHORT_SCOPE;

            for (CorrelationMethod method : METHODS) {
                results.add(
                        fixedResult(scope, pair, CorrelationKind.DAILY, method, pooledDaily, dailyPool.size()));
            }
            for (CorrelationMethod method : METHODS) {
                results.add(
                        fixedResult(scope, pair, CorrelationKind.LAG1, method, pooledLag, lagPool.size()));
            }
            results.addAll(
                    rollingResults(scope, pair, dailyPool, alignment.span(spanInputs), dailyPool.size()));

            LOG.debugf(
                    "Cohort %s: %d participants pooled (%d days), %d for lag-1 (%d days)",
                    pair.label(), dailyPool.size(), pooledDaily.size(), lagPool.size(), pooledLag.size());
        }

        return results;
    }

    private CorrelationResult fixedResult(
            String scope,
            MetricPair pair,
            CorrelationKind kind,
            CorrelationMethod method,
            AlignedSeries aligned,
            int participantCount) {
        try {
            CorrelationStatistic stat =
                    StatisticsSupport.correlate(
                            aligned.firstArray(),
                            aligned.secondArray(),
                            method,
                            settings.correlationMinAlignedDays());

            return new CorrelationResult(
                    scope,
                    pair,
                    kind,
                    method,
                    stat.coefficient(),
                    null,
                    stat.sampleSize(),
                    stat.pValue(),
                    CorrelationConfidence.of(stat.sampleSize(), stat.coefficient()),
                    interpret(kind, pair, stat),
                    List.of(),
                    null,
                    participantCount);
        } catch (InsufficientDataException e) {
            return notComputable(
                    scope, pair, kind, method, NotComputableReason.INSUFFICIENT_DATA,
                    aligned.size(), participantCount,
                    String.format(
                            "Not computable: %d aligned days, at least %d required",
                            aligned.size(), settings.correlationMinAlignedDays()));
        } catch (DegenerateSeriesException e) {
            return notComputable(
                    scope, pair, kind, method, NotComputableReason.DEGENERATE_SERIES,
                    aligned.size(), participantCount,
                    "Not computable: " + e.getMessage().toLowerCase());
        }
    }

    /**
     * Slides a window of {@code rollingWindowDays} calendar days over {@code span}, one day at
     * a time, pooling the observations of all {@code parts} inside each window. Yields
     * {@code totalDays - window + 1} windows, or none when the span is shorter than a window.
     */
    private List<CorrelationResult> rollingResults(
            String scope,
            MetricPair pair,
            List<AlignedSeries> parts,
            DaySpan span,
            int participantCount) {
        int windowDays = settings.rollingWindowDays();
        int windowCount = span == null ? 0 : Math.max(0, span.totalDays() - windowDays + 1);

        Map<CorrelationMethod, List<RollingWindow>> windows = new EnumMap<>(CorrelationMethod.class);
        METHODS.forEach(m -> windows.put(m, new ArrayList<>(windowCount)));

        for (int i = 0; i < windowCount; i++) {
            LocalDate start = span.first().plusDays(i);
            LocalDate end = start.plusDays(windowDays - 1L);
            AlignedSeries inWindow =
                    AlignedSeries.concat(parts.stream().map(p -> p.between(start, end)).toList());

            for (CorrelationMethod method : METHODS) {
                windows.get(method).add(window(start, inWindow, method));
            }
        }

        List<CorrelationResult> results = new ArrayList<>(METHODS.size());
        for (CorrelationMethod method : METHODS) {
            results.add(summarizeRolling(scope, pair, method, windows.get(method), participantCount));
        }
        return results;
    }

    private RollingWindow window(LocalDate start, AlignedSeries aligned, CorrelationMethod method) {
        try {
            CorrelationStatistic stat =
                    StatisticsSupport.correlate(
                            aligned.firstArray(),
                            aligned.secondArray(),
                            method,
                            settings.correlationMinAlignedDays());
            return new RollingWindow(start, stat.coefficient(), stat.sampleSize(), null);
        } catch (InsufficientDataException e) {
            return new RollingWindow(
                    start, CorrelationResult.NOT_COMPUTABLE, aligned.size(), NotComputableReason.INSUFFICIENT_DATA);
        } catch (DegenerateSeriesException e) {
            return new RollingWindow(
                    start, CorrelationResult.NOT_COMPUTABLE, aligned.size(), NotComputableReason.DEGENERATE_SERIES);
        }
    }

    private CorrelationResult summarizeRolling(
            String scope,
            MetricPair pair,
            CorrelationMethod method,
            List<RollingWindow> windows,
            int participantCount) {
        List<double[]> computable = new ArrayList<>();
        for (int i = 0; i < windows.size(); i++) {
            RollingWindow w = windows.get(i);
            if (w.computable()) {
                computable.add(new double[] {i, w.coefficient()});
            }
        }

        if (computable.isEmpty()) {
            boolean allDegenerate =
                    !windows.isEmpty()
                            && windows.stream()
                                    .allMatch(w -> w.reason() == NotComputableReason.DEGENERATE_SERIES);
            NotComputableReason reason =
                    allDegenerate ? NotComputableReason.DEGENERATE_SERIES : NotComputableReason.INSUFFICIENT_DATA;
            String interpretation =
                    windows.isEmpty()
                            ? String.format(
                                    "Not computable: observed span shorter than the %d-day window",
                                    settings.rollingWindowDays())
                            : "Not computable: no window had enough usable aligned days";
            return new CorrelationResult(
                    scope, pair, CorrelationKind.ROLLING, method, CorrelationResult.NOT_COMPUTABLE,
                    reason, 0, Double.NaN, null, interpretation, windows,
                    new RollingTrend(CorrelationTrend.INSUFFICIENT_DATA, Double.NaN, Double.NaN),
                    participantCount);
        }

        double[] index = computable.stream().mapToDouble(p -> p[0]).toArray();
        double[] coefficients = computable.stream().mapToDouble(p -> p[1]).toArray();
        double mean = Math.max(-1.0, Math.min(1.0, StatisticsSupport.mean(coefficients)));
        double slope =
                coefficients.length < MIN_WINDOWS_FOR_TREND
                        ? Double.NaN
                        : StatisticsSupport.slope(index, coefficients);
        RollingTrend trend =
                new RollingTrend(
                        CorrelationTrend.fromSlope(slope),
                        slope,
                        StatisticsSupport.standardDeviation(coefficients));

        return new CorrelationResult(
                scope, pair, CorrelationKind.ROLLING, method, mean, null, coefficients.length,
                Double.NaN, null, interpretRolling(trend), windows, trend, participantCount);
    }

    private CorrelationResult notComputable(
            String scope,
            MetricPair pair,
            CorrelationKind kind,
            CorrelationMethod method,
            NotComputableReason reason,
            int sampleSize,
            int participantCount,
            String interpretation) {
        return new CorrelationResult(
                scope, pair, kind, method, CorrelationResult.NOT_COMPUTABLE, reason, sampleSize,
                Double.NaN, null, interpretation, List.of(), null, participantCount);
    }

    private static boolean wasComputable(ParticipantAnalysis analysis, MetricPair pair, CorrelationKind kind) {
        return analysis.correlations().stream()
                .anyMatch(r -> r.pair().equals(pair) && r.kind() == kind && r.computable());
    }

    private static DailySeries seriesOf(Map<MetricType, DailySeries> daily, MetricType metric) {
        DailySeries series = daily.get(metric);
        return series != null ? series : DailySeries.empty(metric);
    }

    static String interpret(CorrelationKind kind, MetricPair pair, CorrelationStatistic stat) {
        double r = stat.coefficient();
        boolean significant = stat.pValue() < CorrelationResult.SIGNIFICANCE_LEVEL;

        if (kind == CorrelationKind.LAG1) {
            if (!significant) {
                return String.format(
                        "No significant next-day effect of %s on %s", pair.first(), pair.second());
            }
            String direction = r > 0 ? "increases" : "decreases";
            String strength =
                    Math.abs(r) >= 0.5 ? "strongly" : Math.abs(r) >= 0.3 ? "moderately" : "slightly";
            return String.format(
                    "Higher %s today %s %s %s tomorrow", pair.first(), strength, direction, pair.second());
        }

        if (!significant) {
            return "No significant relationship detected";
        }
        String strength;
        if (Math.abs(r) >= 0.7) {
            strength = "Strong";
        } else if (Math.abs(r) >= 0.5) {
            strength = "Moderate";
        } else if (Math.abs(r) >= 0.3) {
            strength = "Weak";
        } else {
            strength = "Very weak";
        }
        return strength + (r > 0 ? " positive" : " negative") + " correlation";
    }

    private String interpretRolling(RollingTrend trend) {
        return switch (trend.trend()) {
            case STRENGTHENING -> "Relationship strengthening over time";
            case WEAKENING -> "Relationship weakening over time";
            case STABLE -> String.format(
                    "Relationship stable across %d-day windows", settings.rollingWindowDays());
            case INSUFFICIENT_DATA -> "Too few computable windows to judge a trend";
        };
    }
}
