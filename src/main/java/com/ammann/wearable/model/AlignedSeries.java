package com.ammann.wearable.model;

import java.time.LocalDate;
import java.util.ArrayList;
import java.util.List;

/**
 * Paired observations produced by a calendar-day join of two daily series.
 *
 * <p>{@code days.get(i)} is the day of the first value; for lagged alignments the second
 * value was observed on the following day. Pooled cohort series may repeat days.
 */
public record AlignedSeries(List<LocalDate> days, List<Double> firstValues, List<Double> secondValues)
{
    public AlignedSeries
    {
        if (days.size() != firstValues.size() || days.size() != secondValues.size()) {
            throw new IllegalArgumentException("Aligned series components differ in length");
        }
        days = List.copyOf(days);
        firstValues = List.copyOf(firstValues);
        secondValues = List.copyOf(secondValues);
    }

    public static AlignedSeries empty()
    {
        return new AlignedSeries(List.of(), List.of(), List.of());
    }

    public int size()
    {
        return days.size();
    }

    public double[] firstArray()
    {
        return firstValues.stream().mapToDouble(Double::doubleValue).toArray();
    }

    public double[] secondArray()
    {
        return secondValues.stream().mapToDouble(Double::doubleValue).toArray();
    }

    /**
     * Keeps the observations whose day lies within {@code [from, to]}.
     */
    public AlignedSeries between(LocalDate from, LocalDate to)
    {
        List<LocalDate> d = new ArrayList<>();
        List<Double> a = new ArrayList<>();
        List<Double> b = new ArrayList<>();
        for (int i = 0; i < days.size(); i++) {
            LocalDate day = days.get(i);
            if (!day.isBefore(from) && !day.isAfter(to)) {
                d.add(day);
                a.add(firstValues.get(i));
                b.add(secondValues.get(i));
            }
        }
        return new AlignedSeries(d, a, b);
    }

    /**
     * Concatenates several aligned series, used for cohort pooling.
     */
    public static AlignedSeries concat(List<AlignedSeries> parts)
    {
        List<LocalDate> d = new ArrayList<>();
        List<Double> a = new ArrayList<>();
        List<Double> b = new ArrayList<>();
        for (AlignedSeries part : parts) {
            d.addAll(part.days());
            a.addAll(part.firstValues());
            b.addAll(part.secondValues());
        }
        return new AlignedSeries(d, a, b);
    }
}
