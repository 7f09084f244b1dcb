/* (C)2026 */
package com.ammann.impact.service;

import com.ammann.impact.dto.GapAnalysisDTO;
import com.ammann.impact.dto.InterpolationQualityDTO;
import com.ammann.impact.dto.TemporalGapDTO;
import com.ammann.impact.enumeration.InterpolationMethod;
import com.ammann.impact.model.TimeSeriesPoint;
import com.ammann.impact.util.DurationFormat;
import com.ammann.impact.util.SeriesMath;
import jakarta.enterprise.context.ApplicationScoped;
import org.eclipse.microprofile.config.inject.ConfigProperty;
import org.jboss.logging.Logger;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;

/**
 * Detects missing-data intervals in a series and fills short ones with a single
 * interpolated value at their midpoint.
 */
@ApplicationScoped
public class GapAnalysisService
{
    private static final Logger LOG = Logger.getLogger(GapAnalysisService.class);

    @ConfigProperty(name = "impact.gaps.gap-factor", defaultValue = "1.5")
    double gapFactor = 1.5;

    /**
     * @param series           readings; sorted by timestamp before analysis
     * @param field            field to inspect
     * @param expectedInterval nominal spacing between readings
     * @param method           how the midpoint value is derived from the gap's boundary values
     * @param maxGapSize       longest gap that is still interpolated
     * @param qualityMetrics   whether to estimate interpolation accuracy
     */
    public GapAnalysisDTO handleGaps(List<TimeSeriesPoint> series,
                                     String field,
                                     Duration expectedInterval,
                                     InterpolationMethod method,
                                     Duration maxGapSize,
                                     boolean qualityMetrics)
    {
        List<TimeSeriesPoint> points = series.stream()
                .filter(p -> p.hasValue(field))
                .sorted(Comparator.comparing(TimeSeriesPoint::timestamp))
                .toList();

        long thresholdMillis = (long) (expectedInterval.toMillis() * gapFactor);
        List<TemporalGapDTO> gaps = new ArrayList<>();
        Map<Instant, Double> interpolated = new TreeMap<>();
        long gapMillis = 0;

        for (int i = 1; i < points.size(); i++) {
            TimeSeriesPoint previous = points.get(i - 1);
            TimeSeriesPoint next = points.get(i);
            Duration delta = Duration.between(previous.timestamp(), next.timestamp());
            if (delta.toMillis() <= thresholdMillis) {
                continue;
            }

            gaps.add(new TemporalGapDTO(previous.timestamp(), next.timestamp(), DurationFormat.format(delta)));
            gapMillis += delta.toMillis();

            if (delta.compareTo(maxGapSize) <= 0) {
                Instant midpoint = previous.timestamp().plus(delta.dividedBy(2));
                interpolated.put(midpoint, interpolate(previous.value(field), next.value(field), method));
            }
        }

        double completeness = completeness(points, gapMillis);
        InterpolationQualityDTO quality = qualityMetrics && !interpolated.isEmpty()
                ? leaveOneOutQuality(points, field, method)
                : InterpolationQualityDTO.none();

        LOG.infof("Gap analysis of '%s': %d gap(s), %d interpolated, completeness=%.3f",
                field, gaps.size(), interpolated.size(), completeness);
        return new GapAnalysisDTO(gaps, interpolated, completeness, quality);
    }

    static double interpolate(double before, double after, InterpolationMethod method)
    {
        return switch (method) {
            case LINEAR -> (before + after) / 2.0;
            case FORWARD_FILL -> before;
            case BACKWARD_FILL -> after;
        };
    }

    private static double completeness(List<TimeSeriesPoint> points, long gapMillis)
    {
        if (points.size() < 2) {
            return 1.0;
        }
        long span = Duration.between(points.get(0).timestamp(), points.get(points.size() - 1).timestamp()).toMillis();
        return span > 0 ? 1.0 - (double) gapMillis / span : 1.0;
    }

    /**
     * Re-estimates every interior observed value from its two neighbours and compares the
     * estimates with the observations.
     */
    private static InterpolationQualityDTO leaveOneOutQuality(List<TimeSeriesPoint> points,
                                                              String field,
                                                              InterpolationMethod method)
    {
        int interior = points.size() - 2;
        if (interior < 1) {
            return InterpolationQualityDTO.none();
        }
        double[] actual = new double[interior];
        double squaredError = 0.0;
        for (int i = 1; i <= interior; i++) {
            double observed = points.get(i).value(field);
            double estimate = interpolate(points.get(i - 1).value(field), points.get(i + 1).value(field), method);
            actual[i - 1] = observed;
            squaredError += (estimate - observed) * (estimate - observed);
        }

        double totalSquares = SeriesMath.variance(actual) * interior;
        double r2;
        if (totalSquares > 0) {
            r2 = 1.0 - squaredError / totalSquares;
        } else {
            r2 = squaredError == 0.0 ? 1.0 : 0.0;
        }
        return new InterpolationQualityDTO(squaredError / interior, r2);
    }
}
