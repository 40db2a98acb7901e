package com.ammann.wearable.model;

import com.ammann.wearable.enumeration.CorrelationTrend;

/**
 * Summary of a rolling correlation series over its computable windows.
 *
 * @param trend direction derived from {@code slope}
 * @param slope least-squares slope of the coefficients per window step, {@code NaN} if fewer
 *              than three windows are computable
 * @param standardDeviation dispersion of the computable coefficients
 */
public record RollingTrend(CorrelationTrend trend, double slope, double standardDeviation)
{
}
