/* (C)2026 */
package com.ammann.impact.service;

import com.ammann.impact.dto.SeasonalDecompositionDTO;
import com.ammann.impact.enumeration.SeasonalComponent;
import com.ammann.impact.exception.ValidationException;
import com.ammann.impact.util.SeriesMath;
import jakarta.enterprise.context.ApplicationScoped;
import org.eclipse.microprofile.config.inject.ConfigProperty;
import org.jboss.logging.Logger;

import java.time.Instant;
import java.time.ZoneId;
import java.time.ZonedDateTime;
import java.time.temporal.IsoFields;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.function.ToIntFunction;

/**
 * Additive decomposition of a series into a linear trend, an hour-of-day seasonal profile and
 * a residual, together with the strength of each requested calendar granularity.
 */
@ApplicationScoped
public class SeasonalDecompositionService
{
    private static final Logger LOG = Logger.getLogger(SeasonalDecompositionService.class);

    @ConfigProperty(name = "impact.features.zone", defaultValue = "UTC")
    String zone = "UTC";

    public SeasonalDecompositionDTO decompose(double[] values,
                                              List<Instant> timestamps,
                                              List<SeasonalComponent> components)
    {
        if (values.length != timestamps.size()) {
            throw new ValidationException(String.format(
                    "Values (%d) and timestamps (%d) must have the same length", values.length, timestamps.size()));
        }
        if (components == null || components.isEmpty()) {
            throw ValidationException.missingParameter("seasonalComponents");
        }

        ZoneId zoneId = ZoneId.of(zone);
        List<ZonedDateTime> local = timestamps.stream().map(t -> t.atZone(zoneId)).toList();

        double slope = SeriesMath.slope(values);
        double intercept = SeriesMath.intercept(values);

        Map<Integer, Double> hourMeans = bucketMeans(values, local, ZonedDateTime::getHour);

        List<Double> trend = new ArrayList<>(values.length);
        List<Double> seasonal = new ArrayList<>(values.length);
        List<Double> residual = new ArrayList<>(values.length);
        for (int i = 0; i < values.length; i++) {
            double t = intercept + slope * i;
            double s = hourMeans.get(local.get(i).getHour());
            trend.add(t);
            seasonal.add(s);
            residual.add(values[i] - t - s);
        }

        Map<String, Double> strengths = new LinkedHashMap<>();
        String dominant = components.get(0).key();
        double dominantStrength = Double.NEGATIVE_INFINITY;
        for (SeasonalComponent component : components) {
            double strength = strength(values, local, component);
            strengths.put(component.key(), strength);
            if (strength > dominantStrength) {
                dominantStrength = strength;
                dominant = component.key();
            }
        }

        LOG.infof("Seasonal decomposition of %d points: strengths=%s, dominant=%s", values.length, strengths, dominant);
        return new SeasonalDecompositionDTO(trend, seasonal, residual, strengths, dominant);
    }

    private static double strength(double[] values, List<ZonedDateTime> local, SeasonalComponent component)
    {
        Map<Integer, Double> means = switch (component) {
            case HOURLY -> bucketMeans(values, local, ZonedDateTime::getHour);
            case DAILY -> bucketMeans(values, local, t -> t.getDayOfWeek().getValue());
            case WEEKLY -> bucketMeans(values, local, t -> t.get(IsoFields.WEEK_OF_WEEK_BASED_YEAR));
        };
        return SeriesMath.variance(means.values().stream().mapToDouble(Double::doubleValue).toArray());
    }

    private static Map<Integer, Double> bucketMeans(double[] values,
                                                    List<ZonedDateTime> local,
                                                    ToIntFunction<ZonedDateTime> bucketOf)
    {
        Map<Integer, double[]> sums = new LinkedHashMap<>();
        for (int i = 0; i < values.length; i++) {
            double[] acc = sums.computeIfAbsent(bucketOf.applyAsInt(local.get(i)), k -> new double[2]);
            acc[0] += values[i];
            acc[1]++;
        }
        Map<Integer, Double> means = new LinkedHashMap<>();
        sums.forEach((bucket, acc) -> means.put(bucket, acc[0] / acc[1]));
        return means;
    }
}
