/* (C)2026 */
package com.ammann.impact.service;

import com.ammann.impact.dto.PeriodicPatternsDTO;
import com.ammann.impact.support.TestSeries;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.within;

class PeriodicityDetectionServiceTest
{
    private final PeriodicityDetectionService service = new PeriodicityDetectionService();

    @Test
    void recoversDailyPeriodOfHourlySine()
    {
        double[] values = TestSeries.sine(480, 24);

        PeriodicPatternsDTO result = service.detectPeriods(values, TestSeries.hourly(480),
                List.of("12h", "24h", "48h"), 0.5);

        assertThat(result.dominantFrequency()).isEqualTo("24h");
        assertThat(result.periodicityStrength().get("24h"))
                .isGreaterThan(result.periodicityStrength().get("12h"));
        assertThat(result.periodicityStrength().get("24h")).isCloseTo(1.0, within(1e-6));
        assertThat(result.periodicityStrength().get("12h")).isZero();
        assertThat(result.detectedPeriods()).containsExactly("24h", "48h");
    }

    @Test
    void autocorrelationAndSpectrumSizes()
    {
        double[] values = TestSeries.sine(480, 24);

        PeriodicPatternsDTO result = service.detectPeriods(values, TestSeries.hourly(480), List.of("24h"), 0.5);

        // lags 0..min(480 / 4, 100)
        assertThat(result.autocorrelationFunction()).hasSize(101);
        assertThat(result.autocorrelationFunction().get(0)).isCloseTo(1.0, within(1e-9));
        assertThat(result.spectralDensity()).hasSize(240);
        // 20 full cycles put all power in bin 20
        int peak = result.spectralDensity().indexOf(result.spectralDensity().stream().max(Double::compare).orElseThrow());
        assertThat(peak + 1).isEqualTo(20);
    }

    @Test
    void twoCyclesAreEnoughByDefault()
    {
        double[] values = TestSeries.sine(48, 24);

        PeriodicPatternsDTO result = service.detectPeriods(values, TestSeries.hourly(48), List.of("24h"), 0.5);

        assertThat(result.periodicityStrength().get("24h")).isCloseTo(1.0, within(1e-6));
        assertThat(result.detectedPeriods()).containsExactly("24h");
    }

    @Test
    void stricterCycleRequirementIsConfigurable()
    {
        PeriodicityDetectionService strict = new PeriodicityDetectionService();
        strict.minCycles = 4;
        double[] values = TestSeries.sine(48, 24);

        PeriodicPatternsDTO result = strict.detectPeriods(values, TestSeries.hourly(48), List.of("24h"), 0.5);

        assertThat(result.periodicityStrength().get("24h")).isZero();
        assertThat(result.detectedPeriods()).isEmpty();
    }

    @Test
    void tooFewCyclesGiveZeroStrength()
    {
        double[] values = TestSeries.sine(30, 24);

        PeriodicPatternsDTO result = service.detectPeriods(values, TestSeries.hourly(30), List.of("24h"), 0.1);

        assertThat(result.periodicityStrength().get("24h")).isZero();
        assertThat(result.detectedPeriods()).isEmpty();
        assertThat(result.dominantFrequency()).isEqualTo("24h");
    }

    @Test
    void constantSeriesHasNoPeriodicity()
    {
        double[] values = TestSeries.values(96, i -> 0.5);

        PeriodicPatternsDTO result = service.detectPeriods(values, TestSeries.hourly(96), List.of("24h"), 0.1);

        assertThat(result.periodicityStrength().get("24h")).isZero();
        assertThat(result.autocorrelationFunction()).containsOnly(0.0);
    }

    @Test
    void candidateLagFollowsSamplingInterval()
    {
        // 30-minute sampling: a 24h period spans 48 samples
        double[] values = TestSeries.sine(480, 48);

        PeriodicPatternsDTO result = service.detectPeriods(values,
                TestSeries.timestamps(480, Duration.ofMinutes(30)), List.of("12h", "24h"), 0.5);

        assertThat(result.dominantFrequency()).isEqualTo("24h");
        assertThat(result.detectedPeriods()).containsExactly("24h");
    }
}
