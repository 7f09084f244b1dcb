/* (C)2026 */
package com.ammann.impact.service;

import com.ammann.impact.dto.OptimalWindowSizeDTO;
import com.ammann.impact.enumeration.OptimizationCriterion;
import com.ammann.impact.exception.ValidationException;
import com.ammann.impact.util.DurationFormat;
import com.ammann.impact.util.HypothesisTests;
import com.ammann.impact.util.SeriesMath;
import com.ammann.impact.util.SeriesSelector;
import jakarta.enterprise.context.ApplicationScoped;
import org.jboss.logging.Logger;

import java.time.Duration;
import java.time.Instant;
import java.util.Arrays;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Scores candidate analysis window sizes and recommends the best one.
 *
 * <p>A candidate is converted to a sample count using the sampling interval inferred from the
 * timestamps and scored over the most recent samples of that count. Candidates that need more
 * samples than the series holds score 0.
 */
@ApplicationScoped
public class WindowSizeOptimizationService
{
    private static final Logger LOG = Logger.getLogger(WindowSizeOptimizationService.class);

    private static final double MIN_CONFIDENCE = 0.51;
    private static final double MAX_CONFIDENCE = 0.95;

    /**
     * @param values         time-ordered values
     * @param timestamps     timestamps aligned with {@code values}
     * @param candidateSizes duration strings, at least one
     * @param criterion      scoring criterion
     * @return recommendation with every candidate's score
     */
    public OptimalWindowSizeDTO chooseWindow(double[] values,
                                             List<Instant> timestamps,
                                             List<String> candidateSizes,
                                             OptimizationCriterion criterion)
    {
        if (candidateSizes == null || candidateSizes.isEmpty()) {
            throw ValidationException.missingParameter("candidateWindows");
        }

        Duration sampling = SeriesSelector.samplingInterval(timestamps);
        Map<String, Double> scores = new LinkedHashMap<>();
        String recommended = candidateSizes.get(0);
        double bestScore = Double.NEGATIVE_INFINITY;

        for (String candidate : candidateSizes) {
            int samples = SeriesSelector.sampleCount(DurationFormat.parsePositive("candidateWindow", candidate), sampling);
            double score = score(values, samples, criterion);
            scores.put(candidate, score);
            if (score > bestScore) {
                bestScore = score;
                recommended = candidate;
            }
        }

        double confidence = SeriesMath.clamp(bestScore / (bestScore + 1.0), MIN_CONFIDENCE, MAX_CONFIDENCE);

        LOG.infof("Recommended window %s (score=%.4f, confidence=%.2f) among %d candidates using %s",
                recommended, bestScore, confidence, candidateSizes.size(), criterion);
        return new OptimalWindowSizeDTO(recommended, scores, criterion, confidence);
    }

    double score(double[] values, int samples, OptimizationCriterion criterion)
    {
        if (samples < 2 || samples > values.length) {
            LOG.debugf("Window of %d samples does not fit %d values", samples, values.length);
            return 0.0;
        }
        double[] window = Arrays.copyOfRange(values, values.length - samples, values.length);

        return switch (criterion) {
            case SIGNAL_TO_NOISE_RATIO -> signalToNoise(window);
            case STATISTICAL_POWER -> halfSplitPower(window);
        };
    }

    private static double signalToNoise(double[] window)
    {
        double variance = SeriesMath.variance(window);
        return variance > 0 ? Math.abs(SeriesMath.slope(window)) / Math.sqrt(variance) : 0.0;
    }

    // d * sqrt(n) / 3 between the two halves of the window
    private static double halfSplitPower(double[] window)
    {
        int half = window.length / 2;
        double[] first = Arrays.copyOfRange(window, 0, half);
        double[] second = Arrays.copyOfRange(window, half, window.length);
        double pooled = HypothesisTests.pooledVariance(first, second);
        double d = HypothesisTests.cohensD(SeriesMath.mean(second) - SeriesMath.mean(first), pooled);
        return d * Math.sqrt(window.length) / 3.0;
    }
}
