/* (C)2026 */
package com.ammann.impact.service;

import com.ammann.impact.dto.AggregationBucketDTO;
import com.ammann.impact.dto.TemporalAggregationDTO;
import com.ammann.impact.enumeration.AggregationMethod;
import com.ammann.impact.exception.ValidationException;
import com.ammann.impact.model.TimeSeriesPoint;
import com.ammann.impact.util.DurationFormat;
import com.ammann.impact.util.SeriesMath;
import com.ammann.impact.util.SeriesSelector;
import jakarta.enterprise.context.ApplicationScoped;
import org.jboss.logging.Logger;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;

/**
 * Resamples a series into fixed-length time buckets anchored at its earliest reading.
 *
 * <p>A reading at {@code t} falls into bucket {@code floor((t - first) / resolution)}, which
 * spans {@code [first + k * resolution, first + (k + 1) * resolution)}. Buckets without
 * readings are not emitted, so the bucket counts of any resolution add up to the number of
 * readings carrying the field.
 */
@ApplicationScoped
public class TemporalAggregationService
{
    private static final Logger LOG = Logger.getLogger(TemporalAggregationService.class);

    /**
     * @param series      readings in any order
     * @param field       field to aggregate
     * @param resolutions bucket lengths as duration strings
     * @param methods     statistics to compute per bucket
     * @param weightField field holding weights, required for {@link AggregationMethod#WEIGHTED_MEAN}
     */
    public TemporalAggregationDTO aggregate(List<TimeSeriesPoint> series,
                                            String field,
                                            List<String> resolutions,
                                            List<AggregationMethod> methods,
                                            String weightField)
    {
        validate(resolutions, methods, weightField);

        List<TimeSeriesPoint> points = SeriesSelector.withField(series, field);
        Map<String, List<AggregationBucketDTO>> result = new LinkedHashMap<>();

        for (String resolution : resolutions) {
            Duration length = DurationFormat.parsePositive("resolution", resolution);
            List<AggregationBucketDTO> buckets = bucketize(points, length).entrySet().stream()
                    .map(e -> summarize(e.getKey(), e.getValue(), field, methods, weightField))
                    .toList();
            result.put(resolution, buckets);
            LOG.debugf("Resolution %s: %d buckets from %d points", resolution, buckets.size(), points.size());
        }

        LOG.infof("Aggregated %d '%s' readings at resolutions %s using %s", points.size(), field, resolutions, methods);
        return new TemporalAggregationDTO(field, result);
    }

    void validate(List<String> resolutions, List<AggregationMethod> methods, String weightField)
    {
        if (resolutions == null || resolutions.isEmpty()) {
            throw ValidationException.missingParameter("resolutions");
        }
        if (methods == null || methods.isEmpty()) {
            throw ValidationException.missingParameter("aggregationMethods");
        }
        if (methods.contains(AggregationMethod.WEIGHTED_MEAN) && (weightField == null || weightField.isBlank())) {
            throw new ValidationException("Aggregation method 'weighted_mean' requires a weightField");
        }
        resolutions.forEach(r -> DurationFormat.parsePositive("resolution", r));
    }

    private static TreeMap<Instant, List<TimeSeriesPoint>> bucketize(List<TimeSeriesPoint> points, Duration length)
    {
        TreeMap<Instant, List<TimeSeriesPoint>> buckets = new TreeMap<>();
        if (points.isEmpty()) {
            return buckets;
        }
        Instant first = points.stream().map(TimeSeriesPoint::timestamp).min(Instant::compareTo).orElseThrow();
        long lengthMillis = length.toMillis();
        for (TimeSeriesPoint point : points) {
            long index = Duration.between(first, point.timestamp()).toMillis() / lengthMillis;
            Instant start = first.plusMillis(index * lengthMillis);
            buckets.computeIfAbsent(start, k -> new ArrayList<>()).add(point);
        }
        return buckets;
    }

    private static AggregationBucketDTO summarize(Instant start,
                                                  List<TimeSeriesPoint> bucket,
                                                  String field,
                                                  List<AggregationMethod> methods,
                                                  String weightField)
    {
        double[] values = SeriesSelector.values(bucket, field);
        double[] sorted = values.clone();
        Arrays.sort(sorted);

        Double mean = null;
        Double weightedMean = null;
        Double median = null;
        Double p95 = null;
        for (AggregationMethod method : methods) {
            switch (method) {
                case MEAN -> mean = SeriesMath.mean(values);
                case WEIGHTED_MEAN -> weightedMean = weightedMean(bucket, field, weightField);
                case MEDIAN -> median = median(sorted);
                case PERCENTILE_95 -> p95 = sorted[Math.min((int) Math.floor(sorted.length * 0.95), sorted.length - 1)];
            }
        }
        return new AggregationBucketDTO(start, values.length, mean, weightedMean, median, p95);
    }

    // Readings without a weight count with weight 0; an all-zero bucket falls back to the plain mean.
    private static double weightedMean(List<TimeSeriesPoint> bucket, String field, String weightField)
    {
        double weightedSum = 0.0;
        double weightSum = 0.0;
        for (TimeSeriesPoint point : bucket) {
            double weight = point.hasValue(weightField) ? point.value(weightField) : 0.0;
            weightedSum += point.value(field) * weight;
            weightSum += weight;
        }
        if (weightSum == 0.0) {
            LOG.warnf("Zero total weight in bucket of %d readings, using unweighted mean", bucket.size());
            return SeriesMath.mean(SeriesSelector.values(bucket, field));
        }
        return weightedSum / weightSum;
    }

    private static double median(double[] sorted)
    {
        int mid = sorted.length / 2;
        return sorted.length % 2 == 0 ? (sorted[mid - 1] + sorted[mid]) / 2.0 : sorted[mid];
    }
}
