/* (C)2026 */
package com.ammann.impact.util;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.within;

class SeriesMathTest
{
    private static final double[] LINE = {1.0, 3.0, 5.0, 7.0, 9.0};

    @Test
    void momentsOfSmallSample()
    {
        double[] values = {2, 4, 4, 4, 5, 5, 7, 9};

        assertThat(SeriesMath.mean(values)).isEqualTo(5.0);
        assertThat(SeriesMath.variance(values)).isEqualTo(4.0);
        assertThat(SeriesMath.standardDeviation(values)).isEqualTo(2.0);
        assertThat(SeriesMath.sampleVariance(values)).isCloseTo(32.0 / 7.0, within(1e-12));
        assertThat(SeriesMath.min(values)).isEqualTo(2.0);
        assertThat(SeriesMath.max(values)).isEqualTo(9.0);
    }

    @Test
    void emptyInputYieldsZeros()
    {
        double[] empty = new double[0];

        assertThat(SeriesMath.mean(empty)).isZero();
        assertThat(SeriesMath.variance(empty)).isZero();
        assertThat(SeriesMath.min(empty)).isZero();
        assertThat(SeriesMath.max(empty)).isZero();
        assertThat(SeriesMath.slope(empty)).isZero();
        assertThat(SeriesMath.intercept(empty)).isZero();
    }

    @Test
    void slopeAndInterceptOfExactLine()
    {
        assertThat(SeriesMath.slope(LINE)).isCloseTo(2.0, within(1e-12));
        assertThat(SeriesMath.intercept(LINE)).isCloseTo(1.0, within(1e-12));
        assertThat(SeriesMath.linearResidualSumOfSquares(LINE, 0, LINE.length)).isCloseTo(0.0, within(1e-12));
    }

    @Test
    void rangeOverloadsUseOffsetPositions()
    {
        assertThat(SeriesMath.mean(LINE, 1, 3)).isEqualTo(4.0);
        assertThat(SeriesMath.slope(LINE, 2, 5)).isCloseTo(2.0, within(1e-12));
        assertThat(SeriesMath.variance(LINE, 0, 2)).isEqualTo(1.0);
    }

    @Test
    void residualSumOfSquaresOfBentSeries()
    {
        double[] bent = {0.0, 1.0, 0.0};

        // best line is the constant 1/3
        assertThat(SeriesMath.linearResidualSumOfSquares(bent, 0, 3)).isCloseTo(2.0 / 3.0, within(1e-12));
    }

    @Test
    void pearsonOfLinearlyRelatedSlices()
    {
        double[] a = {1, 2, 3, 4, 5};
        double[] b = {10, 8, 6, 4, 2};
        double[] flat = {3, 3, 3, 3, 3};

        assertThat(SeriesMath.pearson(a, a, 0, 5)).isCloseTo(1.0, within(1e-12));
        assertThat(SeriesMath.pearson(a, b, 1, 3)).isCloseTo(-1.0, within(1e-12));
        assertThat(SeriesMath.pearson(a, flat, 0, 5)).isZero();
    }

    @Test
    void clampKeepsValueInRange()
    {
        assertThat(SeriesMath.clamp(1.5, 0.0, 1.0)).isEqualTo(1.0);
        assertThat(SeriesMath.clamp(-0.5, 0.0, 1.0)).isEqualTo(0.0);
        assertThat(SeriesMath.clamp(0.25, 0.0, 1.0)).isEqualTo(0.25);
    }
}
