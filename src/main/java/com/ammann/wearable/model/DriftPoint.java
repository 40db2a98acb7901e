package com.ammann.wearable.model;

import java.time.LocalDate;

/**
 * Median of one non-overlapping drift window of a baseline.
 *
 * @param windowStart first calendar day of the window
 * @param windowEnd last calendar day of the window
 * @param center median of the samples in the window
 * @param sampleCount number of samples in the window
 */
public record DriftPoint(LocalDate windowStart, LocalDate windowEnd, double center, int sampleCount) {
}
