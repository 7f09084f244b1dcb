/* (C)2026 */
package com.ammann.impact.util;

/**
 * Pure numeric reductions shared by the analysis services.
 *
 * <p>Every method reads its input slice without modifying it. Degenerate inputs (empty
 * arrays, zero variance) yield {@code 0} rather than {@code NaN} so results can be
 * serialized and compared without special casing.
 */
public final class SeriesMath
{
    private SeriesMath()
    {
    }

    public static double mean(double[] values)
    {
        return mean(values, 0, values.length);
    }

    /** Mean of {@code values[from, to)}. */
    public static double mean(double[] values, int from, int to)
    {
        int n = to - from;
        if (n <= 0) {
            return 0.0;
        }
        double sum = 0.0;
        for (int i = from; i < to; i++) {
            sum += values[i];
        }
        return sum / n;
    }

    /** Population variance (divides by n). */
    public static double variance(double[] values)
    {
        return variance(values, 0, values.length);
    }

    /** Population variance of {@code values[from, to)}. */
    public static double variance(double[] values, int from, int to)
    {
        int n = to - from;
        if (n <= 0) {
            return 0.0;
        }
        double mean = mean(values, from, to);
        double sum = 0.0;
        for (int i = from; i < to; i++) {
            double d = values[i] - mean;
            sum += d * d;
        }
        return sum / n;
    }

    /** Sample variance (divides by n - 1), zero for fewer than two values. */
    public static double sampleVariance(double[] values)
    {
        int n = values.length;
        if (n < 2) {
            return 0.0;
        }
        return variance(values) * n / (n - 1);
    }

    public static double standardDeviation(double[] values)
    {
        return Math.sqrt(variance(values));
    }

    public static double min(double[] values)
    {
        double min = Double.POSITIVE_INFINITY;
        for (double v : values) {
            min = Math.min(min, v);
        }
        return values.length == 0 ? 0.0 : min;
    }

    public static double max(double[] values)
    {
        double max = Double.NEGATIVE_INFINITY;
        for (double v : values) {
            max = Math.max(max, v);
        }
        return values.length == 0 ? 0.0 : max;
    }

    public static double slope(double[] values)
    {
        return slope(values, 0, values.length);
    }

    /**
     * Ordinary least-squares slope of value against position within {@code values[from, to)},
     * positions counted from 0.
     */
    public static double slope(double[] values, int from, int to)
    {
        int n = to - from;
        if (n < 2) {
            return 0.0;
        }
        double sumX = n * (n - 1) / 2.0;
        double sumX2 = n * (n - 1) * (2.0 * n - 1) / 6.0;
        double sumY = 0.0;
        double sumXY = 0.0;
        for (int i = 0; i < n; i++) {
            double y = values[from + i];
            sumY += y;
            sumXY += i * y;
        }
        double denominator = n * sumX2 - sumX * sumX;
        return denominator == 0.0 ? 0.0 : (n * sumXY - sumX * sumY) / denominator;
    }

    /** Least-squares intercept matching {@link #slope(double[])}. */
    public static double intercept(double[] values)
    {
        int n = values.length;
        if (n == 0) {
            return 0.0;
        }
        return mean(values) - slope(values) * (n - 1) / 2.0;
    }

    /**
     * Residual sum of squares of a least-squares line fitted to {@code values[from, to)}.
     */
    public static double linearResidualSumOfSquares(double[] values, int from, int to)
    {
        int n = to - from;
        if (n < 3) {
            return 0.0;
        }
        double slope = slope(values, from, to);
        double intercept = mean(values, from, to) - slope * (n - 1) / 2.0;
        double sum = 0.0;
        for (int i = 0; i < n; i++) {
            double residual = values[from + i] - (intercept + slope * i);
            sum += residual * residual;
        }
        return sum;
    }

    /**
     * Pearson correlation of two equally long slices starting at {@code from}.
     * Returns 0 when either slice is constant.
     */
    public static double pearson(double[] a, double[] b, int from, int length)
    {
        if (length < 2) {
            return 0.0;
        }
        double sumA = 0.0;
        double sumB = 0.0;
        double sumAB = 0.0;
        double sumA2 = 0.0;
        double sumB2 = 0.0;
        for (int i = from; i < from + length; i++) {
            sumA += a[i];
            sumB += b[i];
            sumAB += a[i] * b[i];
            sumA2 += a[i] * a[i];
            sumB2 += b[i] * b[i];
        }
        double numerator = length * sumAB - sumA * sumB;
        double denominator = Math.sqrt((length * sumA2 - sumA * sumA) * (length * sumB2 - sumB * sumB));
        if (denominator == 0.0 || Double.isNaN(denominator)) {
            return 0.0;
        }
        return numerator / denominator;
    }

    public static double clamp(double value, double min, double max)
    {
        return Math.max(min, Math.min(max, value));
    }
}
