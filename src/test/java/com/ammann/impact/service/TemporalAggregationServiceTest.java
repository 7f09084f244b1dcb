/* (C)2026 */
package com.ammann.impact.service;

import com.ammann.impact.dto.AggregationBucketDTO;
import com.ammann.impact.dto.TemporalAggregationDTO;
import com.ammann.impact.enumeration.AggregationMethod;
import com.ammann.impact.exception.ValidationException;
import com.ammann.impact.model.TimeSeriesPoint;
import com.ammann.impact.support.TestSeries;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.within;

class TemporalAggregationServiceTest
{
    private static final List<String> RESOLUTIONS = List.of("5m", "15m", "1h", "4h");

    private final TemporalAggregationService service = new TemporalAggregationService();

    @ParameterizedTest
    @CsvSource({"5m, 288", "15m, 96", "1h, 24", "4h, 6"})
    void oneDayOfMinutesFillsEveryBucket(String resolution, int expectedBuckets)
    {
        List<TimeSeriesPoint> series = TestSeries.points("sentiment", Duration.ofMinutes(1),
                TestSeries.values(1440, i -> (i % 60) / 60.0));

        TemporalAggregationDTO result = service.aggregate(series, "sentiment", RESOLUTIONS,
                List.of(AggregationMethod.MEAN), null);

        List<AggregationBucketDTO> buckets = result.buckets(resolution);
        assertThat(buckets).hasSize(expectedBuckets);
        assertThat(buckets.stream().mapToInt(AggregationBucketDTO::count).sum()).isEqualTo(1440);
        assertThat(buckets.get(0).timestamp()).isEqualTo(TestSeries.START);
    }

    @Test
    void computesRequestedStatisticsOnly()
    {
        List<TimeSeriesPoint> series = TestSeries.points("score", Duration.ofMinutes(10), 1, 2, 3, 4, 10, 20);

        TemporalAggregationDTO result = service.aggregate(series, "score", List.of("30m"),
                List.of(AggregationMethod.MEDIAN, AggregationMethod.PERCENTILE_95), null);

        List<AggregationBucketDTO> buckets = result.buckets("30m");
        assertThat(buckets).hasSize(2);
        assertThat(buckets.get(0).count()).isEqualTo(3);
        assertThat(buckets.get(0).median()).isEqualTo(2.0);
        assertThat(buckets.get(0).percentile95()).isEqualTo(3.0);
        assertThat(buckets.get(0).mean()).isNull();
        assertThat(buckets.get(0).weightedMean()).isNull();
        assertThat(buckets.get(1).median()).isEqualTo(10.0);
        assertThat(buckets.get(1).timestamp()).isEqualTo(TestSeries.START.plus(Duration.ofMinutes(30)));
    }

    @Test
    void sparseSeriesSkipsEmptyBuckets()
    {
        List<TimeSeriesPoint> series = List.of(
                TimeSeriesPoint.of(TestSeries.START, "score", 1.0),
                TimeSeriesPoint.of(TestSeries.START.plus(Duration.ofHours(5)), "score", 3.0));

        TemporalAggregationDTO result = service.aggregate(series, "score", List.of("1h"),
                List.of(AggregationMethod.MEAN), null);

        assertThat(result.buckets("1h")).extracting(AggregationBucketDTO::timestamp)
                .containsExactly(TestSeries.START, TestSeries.START.plus(Duration.ofHours(5)));
    }

    @Test
    void weightedMeanUsesWeightField()
    {
        List<TimeSeriesPoint> series = new ArrayList<>();
        series.add(TestSeries.point(TestSeries.START, "c1", Map.of("score", 1.0, "volume", 3.0)));
        series.add(TestSeries.point(TestSeries.START.plusSeconds(60), "c2", Map.of("score", 5.0, "volume", 1.0)));

        TemporalAggregationDTO result = service.aggregate(series, "score", List.of("1h"),
                List.of(AggregationMethod.MEAN, AggregationMethod.WEIGHTED_MEAN), "volume");

        AggregationBucketDTO bucket = result.buckets("1h").get(0);
        assertThat(bucket.mean()).isEqualTo(3.0);
        assertThat(bucket.weightedMean()).isCloseTo(2.0, within(1e-12));
    }

    @Test
    void zeroTotalWeightFallsBackToMean()
    {
        List<TimeSeriesPoint> series = List.of(
                TestSeries.point(TestSeries.START, "c1", Map.of("score", 1.0, "volume", 0.0)),
                TestSeries.point(TestSeries.START.plusSeconds(60), "c2", Map.of("score", 4.0)));

        TemporalAggregationDTO result = service.aggregate(series, "score", List.of("1h"),
                List.of(AggregationMethod.WEIGHTED_MEAN), "volume");

        assertThat(result.buckets("1h").get(0).weightedMean()).isEqualTo(2.5);
    }

    @Test
    void weightedMeanWithoutWeightFieldIsRejected()
    {
        assertThatThrownBy(() -> service.validate(List.of("1h"), List.of(AggregationMethod.WEIGHTED_MEAN), null))
                .isInstanceOf(ValidationException.class)
                .hasMessageContaining("weightField");
    }

    @Test
    void rejectsInvalidResolution()
    {
        assertThatThrownBy(() -> service.validate(List.of("1h", "soon"), List.of(AggregationMethod.MEAN), null))
                .isInstanceOf(ValidationException.class);
        assertThatThrownBy(() -> service.validate(List.of(), List.of(AggregationMethod.MEAN), null))
                .isInstanceOf(ValidationException.class);
    }
}
