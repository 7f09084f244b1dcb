/* (C)2026 */
package com.ammann.impact.service;

import com.ammann.impact.dto.BreakpointAnalysisDTO;
import com.ammann.impact.dto.ChangePointSignificanceDTO;
import com.ammann.impact.dto.GapAnalysisDTO;
import com.ammann.impact.dto.ImpactTimingDTO;
import com.ammann.impact.dto.OptimalEventWindowsDTO;
import com.ammann.impact.dto.OptimalWindowSizeDTO;
import com.ammann.impact.dto.PeriodicPatternsDTO;
import com.ammann.impact.dto.RollingCorrelationDTO;
import com.ammann.impact.dto.SeasonalDecompositionDTO;
import com.ammann.impact.dto.SlidingWindowsDTO;
import com.ammann.impact.dto.TemporalAggregationDTO;
import com.ammann.impact.dto.TemporalFeatureSetDTO;
import com.ammann.impact.dto.WindowComparisonDTO;
import com.ammann.impact.enumeration.AggregationMethod;
import com.ammann.impact.enumeration.FeatureType;
import com.ammann.impact.enumeration.InterpolationMethod;
import com.ammann.impact.enumeration.OptimizationCriterion;
import com.ammann.impact.enumeration.SeasonalComponent;
import com.ammann.impact.enumeration.SignificanceTestType;
import com.ammann.impact.exception.EventNotFoundException;
import com.ammann.impact.exception.ValidationException;
import com.ammann.impact.model.EventBounds;
import com.ammann.impact.model.TimeSeriesPoint;
import com.ammann.impact.repository.TimeSeriesRepository;
import com.ammann.impact.util.DurationFormat;
import com.ammann.impact.util.SeriesSelector;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import org.jboss.logging.Logger;

import java.time.Duration;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.function.Supplier;

/**
 * Entry point of the temporal impact analyses of a business event.
 *
 * <p>Every operation follows the same sequence: validate the options, resolve the event's
 * boundary record, fetch the readings of the requested fields and hand them to the matching
 * analysis service. Invalid options therefore fail with a {@link ValidationException} and an
 * unknown event with an {@link EventNotFoundException} before any reading is fetched.
 *
 * <p>Analyses of a series' time structure (window sizing, periodicity, seasonality,
 * breakpoints, gaps, features, event windows and impact timing) run on the event-level
 * series, in which readings of several customers taken at the same instant are averaged.
 * Sample-based analyses (window statistics, comparisons, significance tests, aggregation and
 * rolling correlation) use the individual readings.
 */
@ApplicationScoped
public class TemporalImpactAnalysisService
{
    private static final Logger LOG = Logger.getLogger(TemporalImpactAnalysisService.class);

    static final String TIMER_NAME = "impact_analysis_duration";
    static final String FAILURE_COUNTER_NAME = "impact_analysis_failures_total";

    private final TimeSeriesRepository repository;
    private final WindowStatisticsService windowStatisticsService;
    private final WindowSizeOptimizationService windowSizeOptimizationService;
    private final PeriodicityDetectionService periodicityDetectionService;
    private final SeasonalDecompositionService seasonalDecompositionService;
    private final BreakpointDetectionService breakpointDetectionService;
    private final WindowComparisonService windowComparisonService;
    private final RollingCorrelationService rollingCorrelationService;
    private final ChangePointSignificanceService changePointSignificanceService;
    private final TemporalAggregationService temporalAggregationService;
    private final GapAnalysisService gapAnalysisService;
    private final TemporalFeatureService temporalFeatureService;
    private final EventWindowOptimizationService eventWindowOptimizationService;
    private final ImpactTimingService impactTimingService;
    private final MeterRegistry meterRegistry;

    @Inject
    public TemporalImpactAnalysisService(TimeSeriesRepository repository,
                                         WindowStatisticsService windowStatisticsService,
                                         WindowSizeOptimizationService windowSizeOptimizationService,
                                         PeriodicityDetectionService periodicityDetectionService,
                                         SeasonalDecompositionService seasonalDecompositionService,
                                         BreakpointDetectionService breakpointDetectionService,
                                         WindowComparisonService windowComparisonService,
                                         RollingCorrelationService rollingCorrelationService,
                                         ChangePointSignificanceService changePointSignificanceService,
                                         TemporalAggregationService temporalAggregationService,
                                         GapAnalysisService gapAnalysisService,
                                         TemporalFeatureService temporalFeatureService,
                                         EventWindowOptimizationService eventWindowOptimizationService,
                                         ImpactTimingService impactTimingService,
                                         MeterRegistry meterRegistry)
    {
        this.repository = repository;
        this.windowStatisticsService = windowStatisticsService;
        this.windowSizeOptimizationService = windowSizeOptimizationService;
        this.periodicityDetectionService = periodicityDetectionService;
        this.seasonalDecompositionService = seasonalDecompositionService;
        this.breakpointDetectionService = breakpointDetectionService;
        this.windowComparisonService = windowComparisonService;
        this.rollingCorrelationService = rollingCorrelationService;
        this.changePointSignificanceService = changePointSignificanceService;
        this.temporalAggregationService = temporalAggregationService;
        this.gapAnalysisService = gapAnalysisService;
        this.temporalFeatureService = temporalFeatureService;
        this.eventWindowOptimizationService = eventWindowOptimizationService;
        this.impactTimingService = impactTimingService;
        this.meterRegistry = meterRegistry;
    }

    /**
     * Pre- and post-event windows with per-field statistics.
     *
     * @param eventTimestamp anchor of the windows; the event start when {@code null}
     */
    public SlidingWindowsDTO createSlidingWindows(String eventId,
                                                  Instant eventTimestamp,
                                                  List<String> windowSizes,
                                                  List<String> fields)
    {
        requireDurations("windowSizes", windowSizes);
        requireFields("fields", fields);

        return timed("sliding_windows", () -> {
            EventBounds bounds = requireEvent(eventId);
            Instant anchor = eventTimestamp != null ? eventTimestamp : bounds.start();
            List<TimeSeriesPoint> series = repository.fetch(eventId, fields);
            return windowStatisticsService.buildWindows(anchor, windowSizes, fields, series);
        });
    }

    public OptimalWindowSizeDTO detectOptimalWindowSizes(String eventId,
                                                         String field,
                                                         List<String> candidateWindows,
                                                         OptimizationCriterion criterion)
    {
        requireField("field", field);
        requireDurations("candidateWindows", candidateWindows);
        requireOption("optimizationCriteria", criterion);

        return timed("optimal_window_size", () -> {
            List<TimeSeriesPoint> series = eventLevelSeries(eventId, field);
            return windowSizeOptimizationService.chooseWindow(
                    SeriesSelector.values(series, field),
                    SeriesSelector.timestamps(series, field),
                    candidateWindows,
                    criterion);
        });
    }

    public PeriodicPatternsDTO detectPeriodicPatterns(String eventId,
                                                      String field,
                                                      List<String> candidatePeriods,
                                                      double significanceThreshold)
    {
        requireField("field", field);
        requireDurations("candidatePeriods", candidatePeriods);

        return timed("periodicity", () -> {
            List<TimeSeriesPoint> series = eventLevelSeries(eventId, field);
            return periodicityDetectionService.detectPeriods(
                    SeriesSelector.values(series, field),
                    SeriesSelector.timestamps(series, field),
                    candidatePeriods,
                    significanceThreshold);
        });
    }

    public SeasonalDecompositionDTO detectSeasonalTrends(String eventId,
                                                         String field,
                                                         List<SeasonalComponent> components)
    {
        requireField("field", field);
        requireNonEmpty("seasonalComponents", components);

        return timed("seasonality", () -> {
            List<TimeSeriesPoint> series = eventLevelSeries(eventId, field);
            return seasonalDecompositionService.decompose(
                    SeriesSelector.values(series, field),
                    SeriesSelector.timestamps(series, field),
                    components);
        });
    }

    public BreakpointAnalysisDTO detectTrendBreakpoints(String eventId,
                                                        String field,
                                                        int minSegmentLength,
                                                        int maxBreakpoints)
    {
        requireField("field", field);
        requirePositive("minSegmentLength", minSegmentLength);
        requirePositive("maxBreakpoints", maxBreakpoints);

        return timed("breakpoints", () -> {
            List<TimeSeriesPoint> series = eventLevelSeries(eventId, field);
            return breakpointDetectionService.findBreakpoints(
                    SeriesSelector.values(series, field),
                    SeriesSelector.timestamps(series, field),
                    minSegmentLength,
                    maxBreakpoints);
        });
    }

    /**
     * Compares readings inside two explicit windows. Both bounds of each window are inclusive.
     */
    public WindowComparisonDTO compareTimeWindows(String eventId,
                                                  List<String> fields,
                                                  Instant beforeStart,
                                                  Instant beforeEnd,
                                                  Instant afterStart,
                                                  Instant afterEnd)
    {
        requireFields("fields", fields);
        requireRange("beforeWindow", beforeStart, beforeEnd);
        requireRange("afterWindow", afterStart, afterEnd);

        return timed("comparison", () -> {
            requireEvent(eventId);
            List<TimeSeriesPoint> series = repository.fetch(eventId, fields);
            List<TimeSeriesPoint> before = within(series, beforeStart, beforeEnd);
            List<TimeSeriesPoint> after = within(series, afterStart, afterEnd);

            Map<String, double[]> beforeValues = new LinkedHashMap<>();
            Map<String, double[]> afterValues = new LinkedHashMap<>();
            for (String field : fields) {
                beforeValues.put(field, SeriesSelector.values(before, field));
                afterValues.put(field, SeriesSelector.values(after, field));
            }
            return windowComparisonService.compare(beforeValues, afterValues);
        });
    }

    public RollingCorrelationDTO calculateRollingCorrelations(String eventId,
                                                              String fieldA,
                                                              String fieldB,
                                                              int windowSize,
                                                              int stepSize)
    {
        requireField("fieldA", fieldA);
        requireField("fieldB", fieldB);
        if (windowSize < 2) {
            throw ValidationException.invalidParameter("windowSize", windowSize, "an integer of at least 2");
        }
        requirePositive("stepSize", stepSize);

        return timed("rolling_correlation", () -> {
            requireEvent(eventId);
            List<TimeSeriesPoint> paired = repository.fetch(eventId, List.of(fieldA, fieldB)).stream()
                    .filter(p -> p.hasValue(fieldA) && p.hasValue(fieldB))
                    .toList();
            return rollingCorrelationService.rollingCorrelation(
                    SeriesSelector.values(paired, fieldA),
                    SeriesSelector.values(paired, fieldB),
                    SeriesSelector.timestamps(paired, fieldA),
                    windowSize,
                    stepSize);
        });
    }

    /**
     * Tests the readings in {@code [changePoint - preWindow, changePoint)} against those in
     * {@code [changePoint, changePoint + postWindow]}.
     */
    public ChangePointSignificanceDTO analyzeChangePointSignificance(String eventId,
                                                                     String field,
                                                                     Instant changePointTimestamp,
                                                                     String preChangeWindow,
                                                                     String postChangeWindow,
                                                                     List<SignificanceTestType> tests)
    {
        requireField("field", field);
        requireOption("changePointTimestamp", changePointTimestamp);
        Duration pre = DurationFormat.parsePositive("preChangeWindow", preChangeWindow);
        Duration post = DurationFormat.parsePositive("postChangeWindow", postChangeWindow);
        requireNonEmpty("significanceTests", tests);

        return timed("change_point_significance", () -> {
            requireEvent(eventId);
            List<TimeSeriesPoint> series = SeriesSelector.withField(repository.fetch(eventId, List.of(field)), field);
            Instant preStart = changePointTimestamp.minus(pre);
            Instant postEnd = changePointTimestamp.plus(post);

            double[] preValues = series.stream()
                    .filter(p -> !p.timestamp().isBefore(preStart) && p.timestamp().isBefore(changePointTimestamp))
                    .mapToDouble(p -> p.value(field))
                    .toArray();
            double[] postValues = series.stream()
                    .filter(p -> !p.timestamp().isBefore(changePointTimestamp) && !p.timestamp().isAfter(postEnd))
                    .mapToDouble(p -> p.value(field))
                    .toArray();
            return changePointSignificanceService.testSignificance(preValues, postValues, tests);
        });
    }

    public TemporalAggregationDTO aggregateTemporalData(String eventId,
                                                        String field,
                                                        List<String> resolutions,
                                                        List<AggregationMethod> methods,
                                                        String weightField)
    {
        requireField("field", field);
        temporalAggregationService.validate(resolutions, methods, weightField);

        return timed("aggregation", () -> {
            requireEvent(eventId);
            List<String> fields = weightField == null || weightField.isBlank()
                    ? List.of(field)
                    : List.of(field, weightField);
            List<TimeSeriesPoint> series = repository.fetch(eventId, fields);
            return temporalAggregationService.aggregate(series, field, resolutions, methods, weightField);
        });
    }

    public GapAnalysisDTO handleTemporalGaps(String eventId,
                                             String field,
                                             String expectedInterval,
                                             InterpolationMethod method,
                                             String maxGapSize,
                                             boolean qualityMetrics)
    {
        requireField("field", field);
        Duration expected = DurationFormat.parsePositive("expectedInterval", expectedInterval);
        Duration maxGap = DurationFormat.parse(maxGapSize);
        requireOption("interpolationMethod", method);

        return timed("gaps", () -> gapAnalysisService.handleGaps(
                eventLevelSeries(eventId, field), field, expected, method, maxGap, qualityMetrics));
    }

    public TemporalFeatureSetDTO generateTemporalFeatures(String eventId,
                                                          String field,
                                                          List<FeatureType> featureTypes,
                                                          List<Integer> lagPeriods,
                                                          List<Integer> rollingWindows)
    {
        requireField("field", field);
        requireNonEmpty("featureTypes", featureTypes);
        if (featureTypes.contains(FeatureType.LAG)) {
            requirePositiveSizes("lagPeriods", lagPeriods);
        }
        if (featureTypes.contains(FeatureType.ROLLING_STATS)) {
            requirePositiveSizes("rollingWindows", rollingWindows);
        }

        return timed("features", () -> {
            List<TimeSeriesPoint> series = eventLevelSeries(eventId, field);
            return temporalFeatureService.generateFeatures(
                    SeriesSelector.values(series, field),
                    SeriesSelector.timestamps(series, field),
                    featureTypes,
                    lagPeriods,
                    rollingWindows);
        });
    }

    /**
     * @param eventTimestamp anchor of the windows; the event start when {@code null}
     */
    public OptimalEventWindowsDTO determineOptimalEventWindows(String eventId,
                                                               String field,
                                                               Instant eventTimestamp,
                                                               String maxPreEventWindow,
                                                               String maxPostEventWindow,
                                                               boolean stationarityTests)
    {
        requireField("field", field);
        Duration maxPre = DurationFormat.parsePositive("maxPreEventWindow", maxPreEventWindow);
        Duration maxPost = DurationFormat.parsePositive("maxPostEventWindow", maxPostEventWindow);

        return timed("event_windows", () -> {
            EventBounds bounds = requireEvent(eventId);
            Instant anchor = eventTimestamp != null ? eventTimestamp : bounds.start();
            List<TimeSeriesPoint> series = SeriesSelector.collapseByTimestamp(
                    repository.fetch(eventId, List.of(field)), field);
            return eventWindowOptimizationService.determineWindows(
                    series, field, anchor, maxPre, maxPost, stationarityTests);
        });
    }

    /**
     * @param eventTimestamp anchor of the analysis; the event start when {@code null}
     */
    public ImpactTimingDTO calculateImpactTiming(String eventId,
                                                 String field,
                                                 Instant eventTimestamp,
                                                 double baselineThreshold,
                                                 double recoveryThreshold,
                                                 int smoothingWindow)
    {
        requireField("field", field);
        if (baselineThreshold < 0) {
            throw ValidationException.invalidParameter("baselineThreshold", baselineThreshold, "a non-negative number");
        }
        if (recoveryThreshold < 0 || recoveryThreshold > 1) {
            throw ValidationException.invalidParameter("recoveryThreshold", recoveryThreshold, "a number in [0, 1]");
        }
        requirePositive("smoothingWindow", smoothingWindow);

        return timed("impact_timing", () -> {
            EventBounds bounds = requireEvent(eventId);
            Instant anchor = eventTimestamp != null ? eventTimestamp : bounds.start();
            List<TimeSeriesPoint> series = SeriesSelector.collapseByTimestamp(
                    repository.fetch(eventId, List.of(field)), field);
            return impactTimingService.calculateImpactTiming(
                    SeriesSelector.values(series, field),
                    SeriesSelector.timestamps(series, field),
                    anchor,
                    baselineThreshold,
                    recoveryThreshold,
                    smoothingWindow);
        });
    }

    private EventBounds requireEvent(String eventId)
    {
        return repository.findEventBounds(eventId).orElseThrow(() -> {
            LOG.debugf("No boundary record for event %s", eventId);
            return new EventNotFoundException(eventId);
        });
    }

    private List<TimeSeriesPoint> eventLevelSeries(String eventId, String field)
    {
        requireEvent(eventId);
        return SeriesSelector.collapseByTimestamp(repository.fetch(eventId, List.of(field)), field);
    }

    private <T> T timed(String operation, Supplier<T> analysis)
    {
        Timer timer = Timer.builder(TIMER_NAME)
                .description("Duration of temporal impact analyses")
                .tag("operation", operation)
                .register(meterRegistry);
        try {
            return timer.record(analysis);
        } catch (RuntimeException e) {
            Counter.builder(FAILURE_COUNTER_NAME)
                    .description("Failed temporal impact analyses")
                    .tag("operation", operation)
                    .tag("reason", e.getClass().getSimpleName())
                    .register(meterRegistry)
                    .increment();
            throw e;
        }
    }

    private static List<TimeSeriesPoint> within(List<TimeSeriesPoint> series, Instant start, Instant end)
    {
        return series.stream()
                .filter(p -> !p.timestamp().isBefore(start) && !p.timestamp().isAfter(end))
                .toList();
    }

    private static void requireField(String paramName, String field)
    {
        if (field == null || field.isBlank()) {
            throw ValidationException.missingParameter(paramName);
        }
    }

    private static void requireFields(String paramName, List<String> fields)
    {
        requireNonEmpty(paramName, fields);
        fields.forEach(f -> requireField(paramName, f));
    }

    private static void requireDurations(String paramName, List<String> durations)
    {
        requireNonEmpty(paramName, durations);
        durations.forEach(d -> DurationFormat.parsePositive(paramName, d));
    }

    private static void requireNonEmpty(String paramName, List<?> values)
    {
        if (values == null || values.isEmpty()) {
            throw ValidationException.missingParameter(paramName);
        }
    }

    private static void requireOption(String paramName, Object value)
    {
        if (value == null) {
            throw ValidationException.missingParameter(paramName);
        }
    }

    private static void requirePositive(String paramName, int value)
    {
        if (value < 1) {
            throw ValidationException.invalidParameter(paramName, value, "a positive integer");
        }
    }

    private static void requirePositiveSizes(String paramName, List<Integer> sizes)
    {
        requireNonEmpty(paramName, sizes);
        for (Integer size : sizes) {
            if (size == null || size < 1) {
                throw ValidationException.invalidParameter(paramName, size, "positive integers");
            }
        }
    }

    private static void requireRange(String paramName, Instant start, Instant end)
    {
        if (start == null || end == null) {
            throw ValidationException.missingParameter(paramName);
        }
        if (end.isBefore(start)) {
            throw ValidationException.invalidParameter(paramName, start + "/" + end, "start not after end");
        }
    }
}
