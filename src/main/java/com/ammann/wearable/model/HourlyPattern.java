package com.ammann.wearable.model;

/**
 * Hour-of-day extremes of a metric. Only hours with at least two readings take part;
 * all fields are {@code null} when no hour qualifies.
 */
public record HourlyPattern(Integer peakHour, Double peakValue, Integer lowHour, Double lowValue) {

    public static HourlyPattern none() {
        return new HourlyPattern(null, null, null, null);
    }
}
