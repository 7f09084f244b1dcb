/* (C)2026 */
package com.ammann.impact.resource;

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
import com.ammann.impact.exception.ValidationException;
import com.ammann.impact.properties.ApiProperties;
import com.ammann.impact.service.TemporalImpactAnalysisService;
import jakarta.inject.Inject;
import jakarta.ws.rs.*;
import jakarta.ws.rs.core.MediaType;
import jakarta.ws.rs.core.Response;
import java.time.Instant;
import java.time.format.DateTimeParseException;
import java.util.List;
import java.util.function.Function;
import org.eclipse.microprofile.openapi.annotations.Operation;
import org.eclipse.microprofile.openapi.annotations.media.Content;
import org.eclipse.microprofile.openapi.annotations.media.Schema;
import org.eclipse.microprofile.openapi.annotations.parameters.Parameter;
import org.eclipse.microprofile.openapi.annotations.responses.APIResponse;
import org.eclipse.microprofile.openapi.annotations.responses.APIResponses;
import org.eclipse.microprofile.openapi.annotations.tags.Tag;
import org.jboss.logging.Logger;

/**
 * REST resource exposing the temporal impact analyses of a business event.
 *
 * <p>List-valued options are passed as repeated query parameters, for example
 * {@code ?windowSizes=1h&windowSizes=24h}. Timestamps use ISO-8601 instants.
 */
@Path(ApiProperties.BASE_URL_V1 + ApiProperties.Temporal.BASE)
@Tag(name = "Temporal Impact API", description = "Time-window analysis of business event impact")
@Produces(MediaType.APPLICATION_JSON)
public class ImpactWindowResource {

    private static final Logger LOG = Logger.getLogger(ImpactWindowResource.class);

    @Inject TemporalImpactAnalysisService analysisService;

    @GET
    @Path(ApiProperties.Temporal.WINDOWS)
    @Operation(
            summary = "Pre/post-event windows",
            description = "Splits the event's readings into pre- and post-event windows of each requested size and describes every field inside them")
    @APIResponses({
        @APIResponse(
                responseCode = "200",
                description = "Windows built",
                content = @Content(schema = @Schema(implementation = SlidingWindowsDTO.class))),
        @APIResponse(responseCode = "400", description = "Invalid parameters"),
        @APIResponse(responseCode = "404", description = "Unknown event")
    })
    public Response getSlidingWindows(
            @PathParam("eventId") String eventId,
            @Parameter(description = "Window anchor (ISO-8601), defaults to the event start")
                    @QueryParam("eventTimestamp")
                    String eventTimestamp,
            @Parameter(description = "Window sizes such as 1h, 30m, 7d") @QueryParam("windowSizes")
                    List<String> windowSizes,
            @Parameter(description = "Metric fields") @QueryParam("fields") List<String> fields) {

        LOG.debugf("Sliding windows request: event=%s, sizes=%s, fields=%s", eventId, windowSizes, fields);
        SlidingWindowsDTO result = analysisService.createSlidingWindows(
                eventId, parseOptionalInstant("eventTimestamp", eventTimestamp), windowSizes, fields);
        return Response.ok(result).build();
    }

    @GET
    @Path(ApiProperties.Temporal.OPTIMAL_WINDOW_SIZE)
    @Operation(summary = "Optimal window size", description = "Scores candidate window sizes and recommends one")
    @APIResponses({
        @APIResponse(
                responseCode = "200",
                description = "Recommendation computed",
                content = @Content(schema = @Schema(implementation = OptimalWindowSizeDTO.class))),
        @APIResponse(responseCode = "400", description = "Invalid parameters"),
        @APIResponse(responseCode = "404", description = "Unknown event")
    })
    public Response getOptimalWindowSize(
            @PathParam("eventId") String eventId,
            @QueryParam("field") String field,
            @QueryParam("candidateWindows") List<String> candidateWindows,
            @QueryParam("optimizationCriteria") @DefaultValue("signal_to_noise_ratio") String criterion) {

        OptimalWindowSizeDTO result = analysisService.detectOptimalWindowSizes(
                eventId, field, candidateWindows, OptimizationCriterion.fromString(criterion));
        return Response.ok(result).build();
    }

    @GET
    @Path(ApiProperties.Temporal.PERIODICITY)
    @Operation(summary = "Periodic patterns", description = "Autocorrelation-based detection of candidate periods")
    @APIResponses({
        @APIResponse(
                responseCode = "200",
                description = "Periodicity analyzed",
                content = @Content(schema = @Schema(implementation = PeriodicPatternsDTO.class))),
        @APIResponse(responseCode = "400", description = "Invalid parameters"),
        @APIResponse(responseCode = "404", description = "Unknown event")
    })
    public Response getPeriodicPatterns(
            @PathParam("eventId") String eventId,
            @QueryParam("field") String field,
            @QueryParam("candidatePeriods") List<String> candidatePeriods,
            @Parameter(description = "Strength a period must exceed to be reported")
                    @QueryParam("significanceThreshold")
                    @DefaultValue("0.5")
                    double significanceThreshold) {

        PeriodicPatternsDTO result = analysisService.detectPeriodicPatterns(
                eventId, field, candidatePeriods, significanceThreshold);
        return Response.ok(result).build();
    }

    @GET
    @Path(ApiProperties.Temporal.SEASONALITY)
    @Operation(summary = "Seasonal decomposition", description = "Trend, hour-of-day seasonal profile and residual")
    @APIResponses({
        @APIResponse(
                responseCode = "200",
                description = "Decomposition computed",
                content = @Content(schema = @Schema(implementation = SeasonalDecompositionDTO.class))),
        @APIResponse(responseCode = "400", description = "Invalid parameters"),
        @APIResponse(responseCode = "404", description = "Unknown event")
    })
    public Response getSeasonalTrends(
            @PathParam("eventId") String eventId,
            @QueryParam("field") String field,
            @QueryParam("seasonalComponents") List<String> components) {

        SeasonalDecompositionDTO result = analysisService.detectSeasonalTrends(
                eventId, field, parseAll(components, SeasonalComponent::fromString));
        return Response.ok(result).build();
    }

    @GET
    @Path(ApiProperties.Temporal.BREAKPOINTS)
    @Operation(summary = "Trend breakpoints", description = "Locates where the series' level or trend shifts")
    @APIResponses({
        @APIResponse(
                responseCode = "200",
                description = "Breakpoints detected",
                content = @Content(schema = @Schema(implementation = BreakpointAnalysisDTO.class))),
        @APIResponse(responseCode = "400", description = "Invalid parameters"),
        @APIResponse(responseCode = "404", description = "Unknown event")
    })
    public Response getTrendBreakpoints(
            @PathParam("eventId") String eventId,
            @QueryParam("field") String field,
            @QueryParam("minSegmentLength") @DefaultValue("5") int minSegmentLength,
            @QueryParam("maxBreakpoints") @DefaultValue("1") int maxBreakpoints) {

        BreakpointAnalysisDTO result = analysisService.detectTrendBreakpoints(
                eventId, field, minSegmentLength, maxBreakpoints);
        return Response.ok(result).build();
    }

    @GET
    @Path(ApiProperties.Temporal.COMPARISON)
    @Operation(summary = "Window comparison", description = "Two-sample t-test and effect size per field between two windows")
    @APIResponses({
        @APIResponse(
                responseCode = "200",
                description = "Windows compared",
                content = @Content(schema = @Schema(implementation = WindowComparisonDTO.class))),
        @APIResponse(responseCode = "400", description = "Invalid parameters"),
        @APIResponse(responseCode = "404", description = "Unknown event")
    })
    public Response compareWindows(
            @PathParam("eventId") String eventId,
            @QueryParam("fields") List<String> fields,
            @QueryParam("beforeStart") String beforeStart,
            @QueryParam("beforeEnd") String beforeEnd,
            @QueryParam("afterStart") String afterStart,
            @QueryParam("afterEnd") String afterEnd) {

        WindowComparisonDTO result = analysisService.compareTimeWindows(
                eventId,
                fields,
                parseInstant("beforeStart", beforeStart),
                parseInstant("beforeEnd", beforeEnd),
                parseInstant("afterStart", afterStart),
                parseInstant("afterEnd", afterEnd));
        return Response.ok(result).build();
    }

    @GET
    @Path(ApiProperties.Temporal.ROLLING_CORRELATION)
    @Operation(summary = "Rolling correlation", description = "Pearson correlation of two fields over a sliding window")
    @APIResponses({
        @APIResponse(
                responseCode = "200",
                description = "Correlation computed",
                content = @Content(schema = @Schema(implementation = RollingCorrelationDTO.class))),
        @APIResponse(responseCode = "400", description = "Invalid parameters"),
        @APIResponse(responseCode = "404", description = "Unknown event")
    })
    public Response getRollingCorrelation(
            @PathParam("eventId") String eventId,
            @QueryParam("fieldA") String fieldA,
            @QueryParam("fieldB") String fieldB,
            @QueryParam("windowSize") @DefaultValue("20") int windowSize,
            @QueryParam("stepSize") @DefaultValue("1") int stepSize) {

        RollingCorrelationDTO result = analysisService.calculateRollingCorrelations(
                eventId, fieldA, fieldB, windowSize, stepSize);
        return Response.ok(result).build();
    }

    @GET
    @Path(ApiProperties.Temporal.CHANGE_POINT_SIGNIFICANCE)
    @Operation(summary = "Change point significance", description = "Resampling and parametric tests around a change point")
    @APIResponses({
        @APIResponse(
                responseCode = "200",
                description = "Significance tested",
                content = @Content(schema = @Schema(implementation = ChangePointSignificanceDTO.class))),
        @APIResponse(responseCode = "400", description = "Invalid parameters"),
        @APIResponse(responseCode = "404", description = "Unknown event")
    })
    public Response getChangePointSignificance(
            @PathParam("eventId") String eventId,
            @QueryParam("field") String field,
            @QueryParam("changePointTimestamp") String changePointTimestamp,
            @QueryParam("preChangeWindow") String preChangeWindow,
            @QueryParam("postChangeWindow") String postChangeWindow,
            @QueryParam("significanceTests") List<String> tests) {

        ChangePointSignificanceDTO result = analysisService.analyzeChangePointSignificance(
                eventId,
                field,
                parseInstant("changePointTimestamp", changePointTimestamp),
                preChangeWindow,
                postChangeWindow,
                parseAll(tests, SignificanceTestType::fromString));
        return Response.ok(result).build();
    }

    @GET
    @Path(ApiProperties.Temporal.AGGREGATION)
    @Operation(summary = "Temporal aggregation", description = "Resamples a field into fixed time buckets")
    @APIResponses({
        @APIResponse(
                responseCode = "200",
                description = "Buckets computed",
                content = @Content(schema = @Schema(implementation = TemporalAggregationDTO.class))),
        @APIResponse(responseCode = "400", description = "Invalid parameters"),
        @APIResponse(responseCode = "404", description = "Unknown event")
    })
    public Response getAggregation(
            @PathParam("eventId") String eventId,
            @QueryParam("field") String field,
            @QueryParam("resolutions") List<String> resolutions,
            @QueryParam("aggregationMethods") List<String> methods,
            @QueryParam("weightField") String weightField) {

        TemporalAggregationDTO result = analysisService.aggregateTemporalData(
                eventId, field, resolutions, parseAll(methods, AggregationMethod::fromString), weightField);
        return Response.ok(result).build();
    }

    @GET
    @Path(ApiProperties.Temporal.GAPS)
    @Operation(summary = "Gap analysis", description = "Detects missing-data intervals and interpolates short ones")
    @APIResponses({
        @APIResponse(
                responseCode = "200",
                description = "Gaps analyzed",
                content = @Content(schema = @Schema(implementation = GapAnalysisDTO.class))),
        @APIResponse(responseCode = "400", description = "Invalid parameters"),
        @APIResponse(responseCode = "404", description = "Unknown event")
    })
    public Response getGaps(
            @PathParam("eventId") String eventId,
            @QueryParam("field") String field,
            @QueryParam("expectedInterval") @DefaultValue("1h") String expectedInterval,
            @QueryParam("interpolationMethod") @DefaultValue("linear") String interpolationMethod,
            @QueryParam("maxGapSize") @DefaultValue("6h") String maxGapSize,
            @QueryParam("qualityMetrics") @DefaultValue("false") boolean qualityMetrics) {

        GapAnalysisDTO result = analysisService.handleTemporalGaps(
                eventId,
                field,
                expectedInterval,
                InterpolationMethod.fromString(interpolationMethod),
                maxGapSize,
                qualityMetrics);
        return Response.ok(result).build();
    }

    @GET
    @Path(ApiProperties.Temporal.FEATURES)
    @Operation(summary = "Temporal features", description = "Lag, rolling, seasonal and trend features aligned with the readings")
    @APIResponses({
        @APIResponse(
                responseCode = "200",
                description = "Features generated",
                content = @Content(schema = @Schema(implementation = TemporalFeatureSetDTO.class))),
        @APIResponse(responseCode = "400", description = "Invalid parameters"),
        @APIResponse(responseCode = "404", description = "Unknown event")
    })
    public Response getFeatures(
            @PathParam("eventId") String eventId,
            @QueryParam("field") String field,
            @QueryParam("featureTypes") List<String> featureTypes,
            @QueryParam("lagPeriods") List<Integer> lagPeriods,
            @QueryParam("rollingWindows") List<Integer> rollingWindows) {

        TemporalFeatureSetDTO result = analysisService.generateTemporalFeatures(
                eventId, field, parseAll(featureTypes, FeatureType::fromString), lagPeriods, rollingWindows);
        return Response.ok(result).build();
    }

    @GET
    @Path(ApiProperties.Temporal.EVENT_WINDOWS)
    @Operation(summary = "Optimal event windows", description = "Pre/post-event windows with power and detectability estimates")
    @APIResponses({
        @APIResponse(
                responseCode = "200",
                description = "Windows determined",
                content = @Content(schema = @Schema(implementation = OptimalEventWindowsDTO.class))),
        @APIResponse(responseCode = "400", description = "Invalid parameters"),
        @APIResponse(responseCode = "404", description = "Unknown event")
    })
    public Response getEventWindows(
            @PathParam("eventId") String eventId,
            @QueryParam("field") String field,
            @QueryParam("eventTimestamp") String eventTimestamp,
            @QueryParam("maxPreEventWindow") @DefaultValue("7d") String maxPreEventWindow,
            @QueryParam("maxPostEventWindow") @DefaultValue("7d") String maxPostEventWindow,
            @QueryParam("stationarityTests") @DefaultValue("false") boolean stationarityTests) {

        OptimalEventWindowsDTO result = analysisService.determineOptimalEventWindows(
                eventId,
                field,
                parseOptionalInstant("eventTimestamp", eventTimestamp),
                maxPreEventWindow,
                maxPostEventWindow,
                stationarityTests);
        return Response.ok(result).build();
    }

    @GET
    @Path(ApiProperties.Temporal.IMPACT_TIMING)
    @Operation(summary = "Impact timing", description = "Onset delay and recovery times relative to the pre-event baseline")
    @APIResponses({
        @APIResponse(
                responseCode = "200",
                description = "Timing computed",
                content = @Content(schema = @Schema(implementation = ImpactTimingDTO.class))),
        @APIResponse(responseCode = "400", description = "Invalid parameters"),
        @APIResponse(responseCode = "404", description = "Unknown event")
    })
    public Response getImpactTiming(
            @PathParam("eventId") String eventId,
            @QueryParam("field") String field,
            @QueryParam("eventTimestamp") String eventTimestamp,
            @Parameter(description = "Relative deviation from baseline that marks the impact onset")
                    @QueryParam("baselineThreshold")
                    @DefaultValue("0.1")
                    double baselineThreshold,
            @Parameter(description = "Fraction of the baseline that counts as partially recovered")
                    @QueryParam("recoveryThreshold")
                    @DefaultValue("0.9")
                    double recoveryThreshold,
            @QueryParam("smoothingWindow") @DefaultValue("1") int smoothingWindow) {

        ImpactTimingDTO result = analysisService.calculateImpactTiming(
                eventId,
                field,
                parseOptionalInstant("eventTimestamp", eventTimestamp),
                baselineThreshold,
                recoveryThreshold,
                smoothingWindow);
        return Response.ok(result).build();
    }

    static Instant parseInstant(String paramName, String value) {
        if (value == null || value.isBlank()) {
            throw ValidationException.missingParameter(paramName);
        }
        try {
            return Instant.parse(value);
        } catch (DateTimeParseException e) {
            throw ValidationException.invalidParameter(paramName, value, "ISO-8601 timestamp");
        }
    }

    static Instant parseOptionalInstant(String paramName, String value) {
        return value == null || value.isBlank() ? null : parseInstant(paramName, value);
    }

    private static <T> List<T> parseAll(List<String> values, Function<String, T> parser) {
        return values == null ? List.of() : values.stream().map(parser).toList();
    }
}
