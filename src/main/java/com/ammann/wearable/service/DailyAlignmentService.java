/* (C)2026 */
package com.ammann.wearable.service;

import com.ammann.wearable.config.AnalysisSettings;
import com.ammann.wearable.enumeration.MetricType;
import com.ammann.wearable.model.AlignedSeries;
import com.ammann.wearable.model.DailySeries;
import com.ammann.wearable.model.ParticipantSeries;
import com.ammann.wearable.model.Sample;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import java.time.LocalDate;
import java.time.ZoneId;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;

/**
 * Calendar-day aggregation and keyed joins between metrics.
 *
 * <p>A sample belongs to the calendar day of its timestamp in the configured zone. Several
 * samples on one day are averaged; days without samples are absent from the daily series and
 * therefore from every join that involves them.
 */
@ApplicationScoped
public class DailyAlignmentService {

    private final ZoneId zone;

    @Inject
    public DailyAlignmentService(AnalysisSettings settings) {
        this.zone = settings.zone();
    }

    public LocalDate dayOf(Sample sample) {
        return sample.timestamp().atZone(zone).toLocalDate();
    }

    /**
     * Averages the samples of one metric per calendar day.
     */
    public DailySeries aggregate(MetricType metric, List<Sample> samples) {
        Map<LocalDate, double[]> sums = new TreeMap<>();
        for (Sample sample : samples) {
            double[] acc = sums.computeIfAbsent(dayOf(sample), d -> new double[2]);
            acc[0] += sample.value();
            acc[1] += 1;
        }

        TreeMap<LocalDate, Double> means = new TreeMap<>();
        sums.forEach((day, acc) -> means.put(day, acc[0] / acc[1]));
        return new DailySeries(metric, means);
    }

    /**
     * Aggregates every metric of a participant, including metrics without samples.
     */
    public Map<MetricType, DailySeries> aggregateAll(ParticipantSeries series) {
        Map<MetricType, DailySeries> daily = new EnumMap<>(MetricType.class);
        for (MetricType metric : MetricType.values()) {
            daily.put(metric, aggregate(metric, series.samples(metric)));
        }
        return daily;
    }

    /**
     * Joins two daily series on identical days.
     */
    public AlignedSeries alignSameDay(DailySeries first, DailySeries second) {
        return align(first, second, 0);
    }

    /**
     * Joins {@code first} on day d with {@code second} on day d+1.
     */
    public AlignedSeries alignNextDay(DailySeries first, DailySeries second) {
        return align(first, second, 1);
    }

    private AlignedSeries align(DailySeries first, DailySeries second, int lagDays) {
        List<LocalDate> days = new ArrayList<>();
        List<Double> a = new ArrayList<>();
        List<Double> b = new ArrayList<>();

        for (Map.Entry<LocalDate, Double> entry : first.dailyMeans().entrySet()) {
            Double other = second.valueOn(entry.getKey().plusDays(lagDays));
            if (other != null) {
                days.add(entry.getKey());
                a.add(entry.getValue());
                b.add(other);
            }
        }
        return new AlignedSeries(days, a, b);
    }

    /**
     * First and last calendar day over the union of the given series, or {@code null} when
     * all are empty.
     */
    public DaySpan span(List<DailySeries> series) {
        LocalDate first = null;
        LocalDate last = null;
        for (DailySeries s : series) {
            if (s.isEmpty()) {
                continue;
            }
            LocalDate f = s.dailyMeans().firstKey();
            LocalDate l = s.dailyMeans().lastKey();
            first = first == null || f.isBefore(first) ? f : first;
            last = last == null || l.isAfter(last) ? l : last;
        }
        return first == null ? null : new DaySpan(first, last);
    }

    /**
     * Inclusive range of calendar days.
     */
    public record DaySpan(LocalDate first, LocalDate last) {

        public int totalDays() {
            return (int) (last.toEpochDay() - first.toEpochDay()) + 1;
        }
    }
}
