/* (C)2026 */
package com.ammann.wearable.model;

import com.ammann.wearable.enumeration.MetricType;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Unordered pair of metrics.
 *
 * <p>The components are stored in enum declaration order, so {@code new MetricPair(A, B)}
 * and {@code new MetricPair(B, A)} are equal. Lagged correlations run from {@link #first()}
 * on day d to {@link #second()} on day d+1.
 */
public record MetricPair(MetricType first, MetricType second) {

    /** Metrics covered by the default pair list. */
    public static final List<MetricType> DEFAULT_METRICS =
            List.of(
                    MetricType.BP_SYSTOLIC,
                    MetricType.HR,
                    MetricType.STEPS,
                    MetricType.SLEEP,
                    MetricType.SPO2,
                    MetricType.TEMP);

    public MetricPair {
        Objects.requireNonNull(first, "first");
        Objects.requireNonNull(second, "second");
        if (first.ordinal() > second.ordinal()) {
            MetricType swap = first;
            first = second;
            second = swap;
        }
    }

    public static MetricPair of(MetricType a, MetricType b) {
        return new MetricPair(a, b);
    }

    /**
     * Parses {@code "HR:STEPS"} (case-insensitive, surrounding whitespace ignored).
     *
     * @throws IllegalArgumentException when the text is not two known metric names
     */
    public static MetricPair parse(String text) {
        String[] parts = text.trim().split(":");
        if (parts.length != 2) {
            throw new IllegalArgumentException("Expected METRIC:METRIC but got '" + text + "'");
        }
        return of(
                MetricType.valueOf(parts[0].trim().toUpperCase()),
                MetricType.valueOf(parts[1].trim().toUpperCase()));
    }

    /** All 15 unordered pairs over {@link #DEFAULT_METRICS}. */
    public static List<MetricPair> defaultPairs() {
        List<MetricPair> pairs = new ArrayList<>();
        for (int i = 0; i < DEFAULT_METRICS.size(); i++) {
            for (int j = i + 1; j < DEFAULT_METRICS.size(); j++) {
                pairs.add(of(DEFAULT_METRICS.get(i), DEFAULT_METRICS.get(j)));
            }
        }
        return List.copyOf(pairs);
    }

    public boolean contains(MetricType metric) {
        return first == metric || second == metric;
    }

    public String label() {
        return first + "_vs_" + second;
    }
}
