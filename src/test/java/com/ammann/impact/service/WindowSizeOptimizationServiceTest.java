/* (C)2026 */
package com.ammann.impact.service;

import com.ammann.impact.dto.OptimalWindowSizeDTO;
import com.ammann.impact.enumeration.OptimizationCriterion;
import com.ammann.impact.exception.ValidationException;
import com.ammann.impact.support.TestSeries;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class WindowSizeOptimizationServiceTest
{
    private final WindowSizeOptimizationService service = new WindowSizeOptimizationService();

    @Test
    void candidatesLongerThanTheDataScoreZero()
    {
        double[] values = TestSeries.values(24, i -> 0.1 * i + (i % 2 == 0 ? 0.05 : -0.05));

        OptimalWindowSizeDTO result = service.chooseWindow(values, TestSeries.hourly(24),
                List.of("6h", "12h", "48h"), OptimizationCriterion.SIGNAL_TO_NOISE_RATIO);

        assertThat(result.windowScores().get("48h")).isZero();
        assertThat(result.windowScores().get("6h")).isPositive();
        assertThat(result.recommendedWindow()).isNotEqualTo("48h");
        assertThat(result.optimizationMetric()).isEqualTo(OptimizationCriterion.SIGNAL_TO_NOISE_RATIO);
    }

    @Test
    void confidenceStaysWithinBounds()
    {
        double[] flat = TestSeries.values(48, i -> 0.5);
        double[] steep = TestSeries.values(48, i -> i);

        OptimalWindowSizeDTO none = service.chooseWindow(flat, TestSeries.hourly(48),
                List.of("12h", "24h"), OptimizationCriterion.SIGNAL_TO_NOISE_RATIO);
        OptimalWindowSizeDTO strong = service.chooseWindow(steep, TestSeries.hourly(48),
                List.of("12h", "24h"), OptimizationCriterion.SIGNAL_TO_NOISE_RATIO);

        assertThat(none.confidence()).isEqualTo(0.51);
        assertThat(none.recommendedWindow()).isEqualTo("12h");
        assertThat(strong.confidence()).isBetween(0.51, 0.95);
    }

    @Test
    void statisticalPowerFavoursWindowsSpanningAShift()
    {
        double[] values = TestSeries.values(48, i -> i < 36 ? 0.5 + (i % 2) * 0.01 : 0.9 + (i % 2) * 0.01);

        OptimalWindowSizeDTO result = service.chooseWindow(values, TestSeries.hourly(48),
                List.of("8h", "24h"), OptimizationCriterion.STATISTICAL_POWER);

        // the trailing 8 h lie entirely after the shift
        assertThat(result.windowScores().get("24h")).isGreaterThan(result.windowScores().get("8h"));
        assertThat(result.recommendedWindow()).isEqualTo("24h");
    }

    @Test
    void requiresCandidates()
    {
        assertThatThrownBy(() -> service.chooseWindow(new double[] {1, 2}, TestSeries.hourly(2),
                List.of(), OptimizationCriterion.SIGNAL_TO_NOISE_RATIO))
                .isInstanceOf(ValidationException.class);
    }
}
