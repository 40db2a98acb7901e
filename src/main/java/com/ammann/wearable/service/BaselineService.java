/* (C)2026 */
package com.ammann.wearable.service;

import com.ammann.wearable.config.AnalysisSettings;
import com.ammann.wearable.enumeration.BaselineStatus;
import com.ammann.wearable.enumeration.MetricType;
import com.ammann.wearable.model.Baseline;
import com.ammann.wearable.model.DriftPoint;
import com.ammann.wearable.model.HourlyPattern;
import com.ammann.wearable.model.ParticipantSeries;
import com.ammann.wearable.model.Sample;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import java.time.LocalDate;
import java.time.ZoneId;
import java.util.ArrayList;
import java.util.Collections;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;
import org.jboss.logging.Logger;

/**
 * Derives personal baselines from a participant's full history of one metric.
 *
 * <p>Center and spread come from robust statistics (median and interquartile range) so that
 * single extreme readings barely move them. When the IQR is zero because most readings are
 * identical, the scaled median absolute deviation is used; if that is zero too the baseline
 * is marked {@link BaselineStatus#DEGENERATE_SERIES}. The drift curve holds the median of
 * trailing, non-overlapping windows ending on the last observed day.
 */
@ApplicationScoped
public class BaselineService {

    private static final Logger LOG = Logger.getLogger(BaselineService.class);

    private static final int MIN_READINGS_PER_HOUR = 2;

    private final int minSamples;
    private final int driftWindowDays;
    private final int driftMinWindowSamples;
    private final ZoneId zone;

    @Inject
    public BaselineService(AnalysisSettings settings) {
        this.minSamples = settings.baselineMinSamples();
        this.driftWindowDays = settings.driftWindowDays();
        this.driftMinWindowSamples = settings.driftMinWindowSamples();
        this.zone = settings.zone();
    }

    /**
     * Computes the baseline of one metric.
     *
     * @param series participant series
     * @param metric metric to summarise
     * @return a valid baseline, or one flagged as insufficient or degenerate
     */
    public Baseline compute(ParticipantSeries series, MetricType metric) {
        String participantId = series.participantId();
        List<Sample> samples = series.samples(metric);
        int n = samples.size();

        if (n < minSamples) {
            LOG.debugf(
                    "Baseline %s/%s invalid: %d samples, need %d",
                    participantId, metric, n, minSamples);
            return Baseline.invalid(participantId, metric, BaselineStatus.INSUFFICIENT_DATA, n);
        }

        double[] values = samples.stream().mapToDouble(Sample::value).toArray();
        double center = StatisticsSupport.median(values);
        double spread = StatisticsSupport.interquartileRange(values);
        if (!(spread > 0)) {
            spread = StatisticsSupport.scaledMedianAbsoluteDeviation(values);
        }
        if (!(spread > 0)) {
            LOG.debugf("Baseline %s/%s degenerate: no dispersion in %d samples", participantId, metric, n);
            return Baseline.invalid(participantId, metric, BaselineStatus.DEGENERATE_SERIES, n);
        }

        Baseline baseline =
                new Baseline(
                        participantId,
                        metric,
                        BaselineStatus.VALID,
                        n,
                        center,
                        spread,
                        StatisticsSupport.mean(values),
                        StatisticsSupport.standardDeviation(values),
                        StatisticsSupport.percentile(values, 10.0),
                        StatisticsSupport.percentile(values, 25.0),
                        StatisticsSupport.percentile(values, 75.0),
                        StatisticsSupport.percentile(values, 90.0),
                        hourlyPattern(samples),
                        driftCurve(samples));

        LOG.debugf(
                "Baseline %s/%s: center=%.2f spread=%.2f n=%d drift windows=%d",
                participantId, metric, center, spread, n, baseline.driftCurve().size());

        return baseline;
    }

    /**
     * Computes baselines for every metric type, so that metrics without data appear
     * explicitly as insufficient.
     */
    public Map<MetricType, Baseline> computeAll(ParticipantSeries series) {
        Map<MetricType, Baseline> baselines = new EnumMap<>(MetricType.class);
        for (MetricType metric : MetricType.values()) {
            baselines.put(metric, compute(series, metric));
        }
        return baselines;
    }

    /**
     * Medians of consecutive non-overlapping windows counted backwards from the last observed
     * day. Windows with fewer than the configured number of samples are left out.
     */
    List<DriftPoint> driftCurve(List<Sample> samples) {
        if (samples.isEmpty()) {
            return List.of();
        }

        TreeMap<LocalDate, List<Double>> byDay = new TreeMap<>();
        for (Sample sample : samples) {
            byDay.computeIfAbsent(sample.timestamp().atZone(zone).toLocalDate(), d -> new ArrayList<>())
                    .add(sample.value());
        }

        LocalDate firstDay = byDay.firstKey();
        LocalDate windowEnd = byDay.lastKey();
        List<DriftPoint> points = new ArrayList<>();

        while (!windowEnd.isBefore(firstDay)) {
            LocalDate windowStart = windowEnd.minusDays(driftWindowDays - 1L);
            double[] windowValues =
                    byDay.subMap(windowStart, true, windowEnd, true).values().stream()
                            .flatMap(List::stream)
                            .mapToDouble(Double::doubleValue)
                            .toArray();

            if (windowValues.length >= driftMinWindowSamples) {
                points.add(
                        new DriftPoint(
                                windowStart,
                                windowEnd,
                                StatisticsSupport.median(windowValues),
                                windowValues.length));
            }
            windowEnd = windowStart.minusDays(1);
        }

        Collections.reverse(points);
        return points;
    }

    HourlyPattern hourlyPattern(List<Sample> samples) {
        Map<Integer, double[]> byHour = new TreeMap<>();
        for (Sample sample : samples) {
            int hour = sample.timestamp().atZone(zone).getHour();
            double[] acc = byHour.computeIfAbsent(hour, h -> new double[2]);
            acc[0] += sample.value();
            acc[1] += 1;
        }

        Integer peakHour = null;
        Integer lowHour = null;
        double peak = Double.NEGATIVE_INFINITY;
        double low = Double.POSITIVE_INFINITY;

        for (Map.Entry<Integer, double[]> entry : byHour.entrySet()) {
            double[] acc = entry.getValue();
            if (acc[1] < MIN_READINGS_PER_HOUR) {
                continue;
            }
            double mean = acc[0] / acc[1];
            if (mean > peak) {
                peak = mean;
                peakHour = entry.getKey();
            }
            if (mean < low) {
                low = mean;
                lowHour = entry.getKey();
            }
        }

        if (peakHour == null) {
            return HourlyPattern.none();
        }
        return new HourlyPattern(peakHour, peak, lowHour, low);
    }
}
