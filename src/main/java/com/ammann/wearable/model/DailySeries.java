package com.ammann.wearable.model;

import com.ammann.wearable.enumeration.MetricType;

import java.time.LocalDate;
import java.util.Collections;
import java.util.NavigableMap;
import java.util.TreeMap;

/**
 * Calendar-day aggregate of one metric: the mean of all samples recorded on each day.
 * Days without samples are absent, never zero.
 */
public record DailySeries(MetricType metric, NavigableMap<LocalDate, Double> dailyMeans)
{
    public DailySeries
    {
        dailyMeans = Collections.unmodifiableNavigableMap(new TreeMap<>(dailyMeans));
    }

    public static DailySeries empty(MetricType metric)
    {
        return new DailySeries(metric, new TreeMap<>());
    }

    public boolean isEmpty()
    {
        return dailyMeans.isEmpty();
    }

    public int dayCount()
    {
        return dailyMeans.size();
    }

    public Double valueOn(LocalDate day)
    {
        return dailyMeans.get(day);
    }
}
