/* (C)2026 */
package com.ammann.impact.service;

import com.ammann.impact.dto.RollingCorrelationDTO;
import com.ammann.impact.exception.ValidationException;
import com.ammann.impact.util.SeriesMath;
import jakarta.enterprise.context.ApplicationScoped;
import org.jboss.logging.Logger;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

/**
 * Tracks the Pearson correlation of two aligned series over a sliding window.
 */
@ApplicationScoped
public class RollingCorrelationService
{
    private static final Logger LOG = Logger.getLogger(RollingCorrelationService.class);

    /**
     * Produces {@code floor((N - windowSize) / stepSize) + 1} coefficients, or none when the
     * series is shorter than one window.
     *
     * @param seriesA    first series
     * @param seriesB    second series, same length as {@code seriesA}
     * @param timestamps timestamps aligned with both series
     * @param windowSize points per window, at least 2
     * @param stepSize   stride between window starts, at least 1
     */
    public RollingCorrelationDTO rollingCorrelation(double[] seriesA,
                                                    double[] seriesB,
                                                    List<Instant> timestamps,
                                                    int windowSize,
                                                    int stepSize)
    {
        if (windowSize < 2) {
            throw ValidationException.invalidParameter("windowSize", windowSize, "an integer of at least 2");
        }
        if (stepSize < 1) {
            throw ValidationException.invalidParameter("stepSize", stepSize, "a positive integer");
        }
        if (seriesA.length != seriesB.length || seriesA.length != timestamps.size()) {
            throw new ValidationException(String.format(
                    "Series must be aligned: %d, %d values and %d timestamps",
                    seriesA.length, seriesB.length, timestamps.size()));
        }

        List<Double> correlations = new ArrayList<>();
        List<Instant> centres = new ArrayList<>();
        for (int start = 0; start + windowSize <= seriesA.length; start += stepSize) {
            correlations.add(SeriesMath.pearson(seriesA, seriesB, start, windowSize));
            centres.add(timestamps.get(start + windowSize / 2));
        }

        double[] r = correlations.stream().mapToDouble(Double::doubleValue).toArray();
        double meanCorrelation = SeriesMath.mean(r);
        double stability = stability(r);

        LOG.infof("Rolling correlation: %d windows of %d (step %d), mean=%.3f, stability=%.3f",
                r.length, windowSize, stepSize, meanCorrelation, stability);
        return new RollingCorrelationDTO(correlations, centres, meanCorrelation, stability);
    }

    /** {@code 1 / (1 + variance / range)}; 1 when the coefficients do not vary. */
    static double stability(double[] correlations)
    {
        double range = SeriesMath.max(correlations) - SeriesMath.min(correlations);
        if (range <= 0) {
            return 1.0;
        }
        return 1.0 / (1.0 + SeriesMath.variance(correlations) / range);
    }
}
