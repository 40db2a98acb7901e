package com.ammann.wearable.model;

import com.ammann.wearable.enumeration.MetricType;

import java.time.LocalDate;
import java.util.List;
import java.util.Map;

/**
 * Coverage overview of a participant's data.
 *
 * @param firstDay first calendar day with any sample, {@code null} without samples
 * @param lastDay last calendar day with any sample, {@code null} without samples
 * @param totalDays calendar days from {@code firstDay} to {@code lastDay} inclusive
 * @param dailyCoverage per metric, days with data divided by {@code totalDays}
 */
public record ParticipantSummary(
        LocalDate firstDay,
        LocalDate lastDay,
        int totalDays,
        List<MetricType> availableMetrics,
        Map<MetricType, Double> dailyCoverage)
{
    public ParticipantSummary
    {
        availableMetrics = List.copyOf(availableMetrics);
        dailyCoverage = Map.copyOf(dailyCoverage);
    }
}
