/* (C)2026 */
package com.ammann.impact.service;

import com.ammann.impact.dto.PeriodicPatternsDTO;
import com.ammann.impact.dto.RollingCorrelationDTO;
import com.ammann.impact.dto.SlidingWindowsDTO;
import com.ammann.impact.dto.WindowComparisonDTO;
import com.ammann.impact.enumeration.AggregationMethod;
import com.ammann.impact.enumeration.SignificanceTestType;
import com.ammann.impact.exception.EventNotFoundException;
import com.ammann.impact.exception.ValidationException;
import com.ammann.impact.model.EventBounds;
import com.ammann.impact.model.TimeSeriesPoint;
import com.ammann.impact.repository.TimeSeriesRepository;
import com.ammann.impact.support.TestSeries;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.Timer;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyList;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

/**
 * Exercises the analysis facade against an in-memory repository: option validation, event
 * lookup, series preparation and metrics.
 */
class TemporalImpactAnalysisServiceTest
{
    private static final String EVENT_ID = "evt-price-change";
    private static final Instant EVENT_START = TestSeries.START.plus(Duration.ofHours(24));

    private TimeSeriesRepository repository;
    private ChangePointSignificanceService significanceService;
    private SimpleMeterRegistry registry;
    private TemporalImpactAnalysisService service;

    @BeforeEach
    void setUp()
    {
        repository = mock(TimeSeriesRepository.class);
        significanceService = mock(ChangePointSignificanceService.class);
        registry = new SimpleMeterRegistry();
        service = new TemporalImpactAnalysisService(
                repository,
                new WindowStatisticsService(),
                new WindowSizeOptimizationService(),
                new PeriodicityDetectionService(),
                new SeasonalDecompositionService(),
                new BreakpointDetectionService(),
                new WindowComparisonService(),
                new RollingCorrelationService(),
                significanceService,
                new TemporalAggregationService(),
                new GapAnalysisService(),
                new TemporalFeatureService(),
                new EventWindowOptimizationService(),
                new ImpactTimingService(),
                registry);
        when(repository.findEventBounds(EVENT_ID))
                .thenReturn(Optional.of(new EventBounds(EVENT_ID, EVENT_START, null)));
    }

    @Test
    void unknownEventFailsBeforeFetching()
    {
        when(repository.findEventBounds("missing")).thenReturn(Optional.empty());

        assertThatThrownBy(() -> service.detectPeriodicPatterns("missing", "sentiment", List.of("24h"), 0.5))
                .isInstanceOf(EventNotFoundException.class);

        verify(repository, never()).fetch(anyString(), anyList());
        Counter failures = registry.find(TemporalImpactAnalysisService.FAILURE_COUNTER_NAME)
                .tag("operation", "periodicity")
                .tag("reason", "EventNotFoundException")
                .counter();
        assertThat(failures).isNotNull();
        assertThat(failures.count()).isEqualTo(1.0);
    }

    @Test
    void invalidOptionsAreRejectedBeforeLookup()
    {
        assertThatThrownBy(() -> service.detectPeriodicPatterns(EVENT_ID, "sentiment", List.of(), 0.5))
                .isInstanceOf(ValidationException.class);
        assertThatThrownBy(() -> service.detectTrendBreakpoints(EVENT_ID, "sentiment", 0, 1))
                .isInstanceOf(ValidationException.class);
        assertThatThrownBy(() -> service.createSlidingWindows(EVENT_ID, null, List.of("soon"), List.of("sentiment")))
                .isInstanceOf(ValidationException.class);
        assertThatThrownBy(() -> service.calculateImpactTiming(EVENT_ID, "sentiment", null, 0.1, 2.0, 1))
                .isInstanceOf(ValidationException.class);

        verifyNoInteractions(repository);
    }

    @Test
    void detectsDailyCycleAcrossCustomers()
    {
        when(repository.fetch(EVENT_ID, List.of("sentiment"))).thenReturn(dailyCycle(48));

        PeriodicPatternsDTO result = service.detectPeriodicPatterns(EVENT_ID, "sentiment", List.of("24h"), 0.5);

        assertThat(result.detectedPeriods()).containsExactly("24h");
        assertThat(result.dominantFrequency()).isEqualTo("24h");

        Timer timer = registry.find(TemporalImpactAnalysisService.TIMER_NAME).tag("operation", "periodicity").timer();
        assertThat(timer).isNotNull();
        assertThat(timer.count()).isEqualTo(1L);
    }

    @Test
    void slidingWindowsDefaultToEventStartAndUseEveryReading()
    {
        when(repository.fetch(EVENT_ID, List.of("sentiment"))).thenReturn(dailyCycle(48));

        SlidingWindowsDTO result = service.createSlidingWindows(EVENT_ID, null, List.of("1h"), List.of("sentiment"));

        assertThat(result.preEventWindows().get("1h").end()).isEqualTo(EVENT_START);
        assertThat(result.windowStatistics()).containsOnlyKeys("pre_1h", "post_1h");
        assertThat(result.windowStatistics().get("pre_1h").get("sentiment").count()).isEqualTo(2);
    }

    @Test
    void comparisonWindowsIncludeBothBounds()
    {
        when(repository.fetch(EVENT_ID, List.of("sentiment"))).thenReturn(dailyCycle(48));

        WindowComparisonDTO result = service.compareTimeWindows(EVENT_ID, List.of("sentiment"),
                TestSeries.START, TestSeries.START.plus(Duration.ofHours(2)),
                EVENT_START, EVENT_START.plus(Duration.ofHours(2)));

        assertThat(result.fieldComparisons().get("sentiment").beforeCount()).isEqualTo(6);
        assertThat(result.fieldComparisons().get("sentiment").afterCount()).isEqualTo(6);
    }

    @Test
    void changePointWindowsSplitAtTheChangePoint()
    {
        when(repository.fetch(EVENT_ID, List.of("sentiment")))
                .thenReturn(TestSeries.points("sentiment", Duration.ofHours(1), 1, 2, 3, 4, 5, 6, 7));
        Instant changePoint = TestSeries.START.plus(Duration.ofHours(3));

        service.analyzeChangePointSignificance(EVENT_ID, "sentiment", changePoint, "2h", "2h",
                List.of(SignificanceTestType.PARAMETRIC));

        ArgumentCaptor<double[]> pre = ArgumentCaptor.forClass(double[].class);
        ArgumentCaptor<double[]> post = ArgumentCaptor.forClass(double[].class);
        verify(significanceService)
                .testSignificance(pre.capture(), post.capture(), eq(List.of(SignificanceTestType.PARAMETRIC)));
        assertThat(pre.getValue()).containsExactly(2.0, 3.0);
        assertThat(post.getValue()).containsExactly(4.0, 5.0, 6.0);
    }

    @Test
    void rollingCorrelationPairsReadingsCarryingBothFields()
    {
        List<TimeSeriesPoint> series = new ArrayList<>();
        for (int i = 0; i < 6; i++) {
            series.add(TestSeries.point(TestSeries.START.plus(Duration.ofHours(i)), "c1",
                    Map.of("sentiment", (double) i, "engagement", 2.0 * i)));
        }
        series.add(TimeSeriesPoint.of(TestSeries.START.plus(Duration.ofHours(6)), "sentiment", 9.0));
        when(repository.fetch(EVENT_ID, List.of("sentiment", "engagement"))).thenReturn(series);

        RollingCorrelationDTO result = service.calculateRollingCorrelations(EVENT_ID, "sentiment", "engagement", 3, 1);

        assertThat(result.correlations()).hasSize(4);
    }

    @Test
    void aggregationFetchesTheWeightField()
    {
        when(repository.fetch(eq(EVENT_ID), any())).thenReturn(List.of());

        service.aggregateTemporalData(EVENT_ID, "sentiment", List.of("1h"),
                List.of(AggregationMethod.WEIGHTED_MEAN), "volume");

        verify(repository).fetch(EVENT_ID, List.of("sentiment", "volume"));
    }

    /** Two customers offset symmetrically around {@code 0.5 + 0.3 sin(2 pi h / 24)}. */
    private static List<TimeSeriesPoint> dailyCycle(int hours)
    {
        List<TimeSeriesPoint> points = new ArrayList<>();
        for (int h = 0; h < hours; h++) {
            double base = 0.5 + 0.3 * Math.sin(2 * Math.PI * h / 24);
            Instant timestamp = TestSeries.START.plus(Duration.ofHours(h));
            points.add(TestSeries.point(timestamp, "c1", Map.of("sentiment", base + 0.05)));
            points.add(TestSeries.point(timestamp, "c2", Map.of("sentiment", base - 0.05)));
        }
        return points;
    }
}
