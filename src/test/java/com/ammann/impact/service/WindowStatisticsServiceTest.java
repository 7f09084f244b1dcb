/* (C)2026 */
package com.ammann.impact.service;

import com.ammann.impact.dto.SlidingWindowsDTO;
import com.ammann.impact.dto.WindowStatisticsDTO;
import com.ammann.impact.enumeration.TrendDirection;
import com.ammann.impact.model.TimeSeriesPoint;
import com.ammann.impact.support.TestSeries;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.within;

class WindowStatisticsServiceTest
{
    private final WindowStatisticsService service = new WindowStatisticsService();

    @Test
    void emptyWindowHasDegenerateStatistics()
    {
        List<TimeSeriesPoint> series = TestSeries.points("sentiment", Duration.ofHours(1), 0.1, 0.2, 0.3);
        Instant afterAllData = TestSeries.START.plus(Duration.ofDays(10));

        SlidingWindowsDTO result = service.buildWindows(afterAllData, List.of("1h"), List.of("sentiment"), series);

        WindowStatisticsDTO post = result.windowStatistics().get("post_1h").get("sentiment");
        assertThat(post).isEqualTo(new WindowStatisticsDTO(0, 0, 0, 0, TrendDirection.STABLE, 0));
        assertThat(result.postEventWindows().get("1h").isEmpty()).isTrue();
    }

    @Test
    void missingFieldInWindowIsDegenerate()
    {
        List<TimeSeriesPoint> series = TestSeries.points("sentiment", Duration.ofHours(1), 0.1, 0.2, 0.3, 0.4);

        Map<String, WindowStatisticsDTO> stats = service.describe(series, List.of("churn_risk"));

        assertThat(stats.get("churn_risk")).isEqualTo(WindowStatisticsDTO.empty());
    }

    @Test
    void windowsExcludeTheEventInstant()
    {
        double[] values = TestSeries.values(7, i -> i);
        List<TimeSeriesPoint> series = TestSeries.points("score", Duration.ofHours(1), values);
        Instant event = TestSeries.START.plus(Duration.ofHours(3));

        SlidingWindowsDTO result = service.buildWindows(event, List.of("2h"), List.of("score"), series);

        // pre = [1h, 3h) -> values 1, 2; post = (3h, 5h] -> values 4, 5
        assertThat(result.preEventWindows().get("2h").points())
                .extracting(p -> p.value("score"))
                .containsExactly(1.0, 2.0);
        assertThat(result.postEventWindows().get("2h").points())
                .extracting(p -> p.value("score"))
                .containsExactly(4.0, 5.0);
        assertThat(result.windowStatistics()).containsOnlyKeys("pre_2h", "post_2h");
    }

    @Test
    void statisticsDescribeValues()
    {
        WindowStatisticsDTO stats = service.statistics(new double[] {1.0, 2.0, 3.0, 4.0});

        assertThat(stats.mean()).isEqualTo(2.5);
        assertThat(stats.std()).isCloseTo(Math.sqrt(1.25), within(1e-12));
        assertThat(stats.min()).isEqualTo(1.0);
        assertThat(stats.max()).isEqualTo(4.0);
        assertThat(stats.trend()).isEqualTo(TrendDirection.INCREASING);
        assertThat(stats.count()).isEqualTo(4);
    }

    @Test
    void smallSlopeIsStable()
    {
        WindowStatisticsDTO flat = service.statistics(new double[] {0.5, 0.505, 0.51, 0.515});
        WindowStatisticsDTO falling = service.statistics(new double[] {0.9, 0.7, 0.5});

        assertThat(flat.trend()).isEqualTo(TrendDirection.STABLE);
        assertThat(falling.trend()).isEqualTo(TrendDirection.DECREASING);
    }
}
