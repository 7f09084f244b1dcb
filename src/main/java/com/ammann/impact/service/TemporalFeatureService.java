/* (C)2026 */
package com.ammann.impact.service;

import com.ammann.impact.dto.TemporalFeatureSetDTO;
import com.ammann.impact.enumeration.FeatureType;
import com.ammann.impact.exception.ValidationException;
import com.ammann.impact.util.SeriesMath;
import jakarta.enterprise.context.ApplicationScoped;
import org.eclipse.microprofile.config.inject.ConfigProperty;
import org.jboss.logging.Logger;

import java.time.Instant;
import java.time.ZoneId;
import java.time.ZonedDateTime;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.function.ToDoubleFunction;

/**
 * Derives model-ready features from a series. Every feature list has exactly one entry per
 * input value.
 */
@ApplicationScoped
public class TemporalFeatureService
{
    private static final Logger LOG = Logger.getLogger(TemporalFeatureService.class);

    @ConfigProperty(name = "impact.features.zone", defaultValue = "UTC")
    String zone = "UTC";

    public TemporalFeatureSetDTO generateFeatures(double[] values,
                                                  List<Instant> timestamps,
                                                  List<FeatureType> featureTypes,
                                                  List<Integer> lagPeriods,
                                                  List<Integer> rollingWindows)
    {
        if (featureTypes == null || featureTypes.isEmpty()) {
            throw ValidationException.missingParameter("featureTypes");
        }
        if (values.length != timestamps.size()) {
            throw new ValidationException(String.format(
                    "Values (%d) and timestamps (%d) must have the same length", values.length, timestamps.size()));
        }

        Map<String, List<Double>> lag = new LinkedHashMap<>();
        Map<String, List<Double>> rolling = new LinkedHashMap<>();
        Map<String, List<Double>> seasonal = new LinkedHashMap<>();
        Map<String, List<Double>> trend = new LinkedHashMap<>();

        if (featureTypes.contains(FeatureType.LAG)) {
            for (int period : positive("lagPeriods", lagPeriods)) {
                lag.put("lag_" + period, lagFeature(values, period));
            }
        }
        if (featureTypes.contains(FeatureType.ROLLING_STATS)) {
            for (int window : positive("rollingWindows", rollingWindows)) {
                rolling.put("rolling_mean_" + window, rolling(values, window, false));
                rolling.put("rolling_std_" + window, rolling(values, window, true));
            }
        }
        if (featureTypes.contains(FeatureType.SEASONAL)) {
            ZoneId zoneId = ZoneId.of(zone);
            List<ZonedDateTime> local = timestamps.stream().map(t -> t.atZone(zoneId)).toList();
            // Sunday = 0
            ToDoubleFunction<ZonedDateTime> dayOfWeek = t -> t.getDayOfWeek().getValue() % 7;
            seasonal.put("hour_sin", cyclic(local, ZonedDateTime::getHour, 24, true));
            seasonal.put("hour_cos", cyclic(local, ZonedDateTime::getHour, 24, false));
            seasonal.put("day_of_week_sin", cyclic(local, dayOfWeek, 7, true));
            seasonal.put("day_of_week_cos", cyclic(local, dayOfWeek, 7, false));
        }
        if (featureTypes.contains(FeatureType.TREND)) {
            List<Double> index = new ArrayList<>(values.length);
            List<Double> momentum = new ArrayList<>(values.length);
            for (int i = 0; i < values.length; i++) {
                index.add((double) i);
                momentum.add(i == 0 ? 0.0 : values[i] - values[i - 1]);
            }
            trend.put("linear_trend", index);
            trend.put("momentum", momentum);
        }

        LOG.infof("Generated %d feature(s) of types %s over %d points",
                lag.size() + rolling.size() + seasonal.size() + trend.size(), featureTypes, values.length);
        return new TemporalFeatureSetDTO(lag, rolling, seasonal, trend);
    }

    private static List<Integer> positive(String paramName, List<Integer> sizes)
    {
        if (sizes == null || sizes.isEmpty()) {
            throw ValidationException.missingParameter(paramName);
        }
        for (Integer size : sizes) {
            if (size == null || size < 1) {
                throw ValidationException.invalidParameter(paramName, size, "positive integers");
            }
        }
        return sizes;
    }

    static List<Double> lagFeature(double[] values, int lag)
    {
        List<Double> feature = new ArrayList<>(values.length);
        for (int i = 0; i < values.length; i++) {
            feature.add(i >= lag ? values[i - lag] : 0.0);
        }
        return feature;
    }

    /** Trailing window {@code [max(0, i - W + 1), i]}, never looking ahead. */
    static List<Double> rolling(double[] values, int window, boolean std)
    {
        List<Double> feature = new ArrayList<>(values.length);
        for (int i = 0; i < values.length; i++) {
            int from = Math.max(0, i - window + 1);
            feature.add(std
                    ? Math.sqrt(SeriesMath.variance(values, from, i + 1))
                    : SeriesMath.mean(values, from, i + 1));
        }
        return feature;
    }

    private static List<Double> cyclic(List<ZonedDateTime> local,
                                       ToDoubleFunction<ZonedDateTime> position,
                                       int cycle,
                                       boolean sine)
    {
        List<Double> feature = new ArrayList<>(local.size());
        for (ZonedDateTime t : local) {
            double angle = 2.0 * Math.PI * position.applyAsDouble(t) / cycle;
            feature.add(sine ? Math.sin(angle) : Math.cos(angle));
        }
        return feature;
    }
}
