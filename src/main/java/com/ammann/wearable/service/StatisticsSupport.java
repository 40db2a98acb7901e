/* (C)2026 */
package com.ammann.wearable.service;

import com.ammann.wearable.enumeration.CorrelationMethod;
import com.ammann.wearable.exception.DegenerateSeriesException;
import com.ammann.wearable.exception.InsufficientDataException;
import org.apache.commons.math3.distribution.TDistribution;
import org.apache.commons.math3.stat.correlation.PearsonsCorrelation;
import org.apache.commons.math3.stat.correlation.SpearmansCorrelation;
import org.apache.commons.math3.stat.descriptive.moment.Mean;
import org.apache.commons.math3.stat.descriptive.moment.StandardDeviation;
import org.apache.commons.math3.stat.descriptive.rank.Percentile;
import org.apache.commons.math3.stat.descriptive.rank.Percentile.EstimationType;
import org.apache.commons.math3.stat.regression.SimpleRegression;

/**
 * Robust and correlation statistics shared by the analysis services.
 *
 * <p>Percentiles use linear interpolation between closest ranks (estimation type R-7).
 * Standard deviations are population standard deviations. Correlation routines signal
 * unusable input with {@link InsufficientDataException} or {@link DegenerateSeriesException};
 * callers translate those into NOT_COMPUTABLE results.
 */
public final class StatisticsSupport {

    /** Consistency constant making the MAD comparable to a standard deviation. */
    static final double MAD_SCALE = 1.4826;

    private static final double VARIANCE_EPSILON = 1e-12;

    private StatisticsSupport() {}

    /**
     * Correlation coefficient with its two-sided p-value.
     */
    public record CorrelationStatistic(double coefficient, double pValue, int sampleSize) {}

    public static double percentile(double[] values, double p) {
        requireNotEmpty(values);
        return new Percentile(p).withEstimationType(EstimationType.R_7).evaluate(values);
    }

    public static double median(double[] values) {
        return percentile(values, 50.0);
    }

    public static double interquartileRange(double[] values) {
        return percentile(values, 75.0) - percentile(values, 25.0);
    }

    /**
     * Median absolute deviation scaled by {@value #MAD_SCALE}.
     */
    public static double scaledMedianAbsoluteDeviation(double[] values) {
        double median = median(values);
        double[] deviations = new double[values.length];
        for (int i = 0; i < values.length; i++) {
            deviations[i] = Math.abs(values[i] - median);
        }
        return MAD_SCALE * median(deviations);
    }

    public static double mean(double[] values) {
        requireNotEmpty(values);
        return new Mean().evaluate(values);
    }

    public static double standardDeviation(double[] values) {
        requireNotEmpty(values);
        return new StandardDeviation(false).evaluate(values);
    }

    public static boolean hasVariance(double[] values) {
        if (values.length < 2) {
            return false;
        }
        double min = values[0];
        double max = values[0];
        for (double v : values) {
            min = Math.min(min, v);
            max = Math.max(max, v);
        }
        return max - min > VARIANCE_EPSILON * Math.max(1.0, Math.abs(max));
    }

    /**
     * Correlates two paired samples.
     *
     * @param x first sample
     * @param y second sample, same length as {@code x}
     * @param method estimator
     * @param minSamples minimum number of pairs
     * @return coefficient clamped to [-1, 1] with its p-value
     * @throws InsufficientDataException if fewer than {@code minSamples} pairs exist
     * @throws DegenerateSeriesException if either sample has zero variance
     */
    public static CorrelationStatistic correlate(
            double[] x, double[] y, CorrelationMethod method, int minSamples) {
        if (x.length != y.length) {
            throw new IllegalArgumentException(
                    "Paired samples differ in length: " + x.length + " vs " + y.length);
        }
        int n = x.length;
        if (n < Math.max(minSamples, 2)) {
            throw new InsufficientDataException("aligned days", Math.max(minSamples, 2), n);
        }
        if (!hasVariance(x) || !hasVariance(y)) {
            throw new DegenerateSeriesException(
                    "Zero variance in " + (hasVariance(x) ? "second" : "first") + " series");
        }

        double r =
                switch (method) {
                    case PEARSON -> new PearsonsCorrelation().correlation(x, y);
                    case SPEARMAN -> new SpearmansCorrelation().correlation(x, y);
                };

        if (Double.isNaN(r)) {
            throw new DegenerateSeriesException("Correlation undefined for " + method + " input");
        }

        double clamped = Math.max(-1.0, Math.min(1.0, r));
        return new CorrelationStatistic(clamped, pValue(clamped, n), n);
    }

    /**
     * Two-sided p-value of a correlation coefficient under the t-distribution with
     * {@code n - 2} degrees of freedom. {@code NaN} for fewer than three observations.
     */
    public static double pValue(double r, int n) {
        if (n < 3 || Double.isNaN(r)) {
            return Double.NaN;
        }
        if (Math.abs(r) >= 1.0) {
            return 0.0;
        }
        double degreesOfFreedom = n - 2.0;
        double t = r * Math.sqrt(degreesOfFreedom / (1.0 - r * r));
        TDistribution distribution = new TDistribution(degreesOfFreedom);
        return Math.min(1.0, 2.0 * distribution.cumulativeProbability(-Math.abs(t)));
    }

    /**
     * Least-squares slope of {@code y} over {@code x}, {@code NaN} with fewer than two points
     * or constant {@code x}.
     */
    public static double slope(double[] x, double[] y) {
        if (x.length != y.length) {
            throw new IllegalArgumentException("Regression inputs differ in length");
        }
        if (x.length < 2 || !hasVariance(x)) {
            return Double.NaN;
        }
        SimpleRegression regression = new SimpleRegression();
        for (int i = 0; i < x.length; i++) {
            regression.addData(x[i], y[i]);
        }
        return regression.getSlope();
    }

    private static void requireNotEmpty(double[] values) {
        if (values == null || values.length == 0) {
            throw new InsufficientDataException("values", 1, 0);
        }
    }
}
