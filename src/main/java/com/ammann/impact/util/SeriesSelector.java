/* (C)2026 */
package com.ammann.impact.util;

import com.ammann.impact.model.TimeSeriesPoint;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Extracts single-field views from fetched time series.
 *
 * <p>Points lacking a value for the requested field are skipped, so the value array and the
 * timestamp list of a view always have the same length.
 */
public final class SeriesSelector
{
    /** Sampling interval assumed when fewer than two distinct timestamps are available. */
    public static final Duration DEFAULT_SAMPLING_INTERVAL = Duration.ofHours(1);

    private SeriesSelector()
    {
    }

    /** Points that carry a value for {@code field}, in input order. */
    public static List<TimeSeriesPoint> withField(List<TimeSeriesPoint> series, String field)
    {
        return series.stream().filter(p -> p.hasValue(field)).toList();
    }

    /** Values of {@code field} in input order. */
    public static double[] values(List<TimeSeriesPoint> series, String field)
    {
        return series.stream()
                .filter(p -> p.hasValue(field))
                .mapToDouble(p -> p.value(field))
                .toArray();
    }

    /** Timestamps of the points that carry {@code field}. */
    public static List<Instant> timestamps(List<TimeSeriesPoint> series, String field)
    {
        return series.stream()
                .filter(p -> p.hasValue(field))
                .map(TimeSeriesPoint::timestamp)
                .toList();
    }

    /**
     * Collapses readings that share a timestamp (several customers observed at the same
     * instant) into one point holding their mean, producing the event-level series.
     *
     * @param series time-ordered points
     * @param field  field to keep
     * @return one point per distinct timestamp, ordered as the input
     */
    public static List<TimeSeriesPoint> collapseByTimestamp(List<TimeSeriesPoint> series, String field)
    {
        Map<Instant, double[]> sums = new LinkedHashMap<>();
        for (TimeSeriesPoint point : series) {
            if (!point.hasValue(field)) {
                continue;
            }
            double[] acc = sums.computeIfAbsent(point.timestamp(), t -> new double[2]);
            acc[0] += point.value(field);
            acc[1] += 1;
        }

        List<TimeSeriesPoint> collapsed = new ArrayList<>(sums.size());
        sums.forEach((timestamp, acc) ->
                collapsed.add(TimeSeriesPoint.of(timestamp, field, acc[0] / acc[1])));
        return collapsed;
    }

    /**
     * Estimates the sampling interval as the median positive gap between consecutive
     * timestamps.
     *
     * @param timestamps time-ordered timestamps
     * @return median spacing, or {@link #DEFAULT_SAMPLING_INTERVAL} when it cannot be estimated
     */
    public static Duration samplingInterval(List<Instant> timestamps)
    {
        long[] deltas = new long[Math.max(0, timestamps.size() - 1)];
        int count = 0;
        for (int i = 1; i < timestamps.size(); i++) {
            long delta = Duration.between(timestamps.get(i - 1), timestamps.get(i)).toMillis();
            if (delta > 0) {
                deltas[count++] = delta;
            }
        }
        if (count == 0) {
            return DEFAULT_SAMPLING_INTERVAL;
        }
        long[] positive = Arrays.copyOf(deltas, count);
        Arrays.sort(positive);
        return Duration.ofMillis(positive[count / 2]);
    }

    /**
     * Number of samples covering {@code duration} at the given sampling interval, rounded to
     * the nearest whole sample.
     */
    public static int sampleCount(Duration duration, Duration samplingInterval)
    {
        if (samplingInterval.isZero() || samplingInterval.isNegative()) {
            return 0;
        }
        return (int) Math.round((double) duration.toMillis() / samplingInterval.toMillis());
    }
}
