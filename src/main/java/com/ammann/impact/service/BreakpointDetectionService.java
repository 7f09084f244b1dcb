/* (C)2026 */
package com.ammann.impact.service;

import com.ammann.impact.dto.BreakpointAnalysisDTO;
import com.ammann.impact.dto.BreakpointDTO;
import com.ammann.impact.dto.SegmentDTO;
import com.ammann.impact.enumeration.ChangeType;
import com.ammann.impact.enumeration.TrendDirection;
import com.ammann.impact.exception.ValidationException;
import com.ammann.impact.util.SeriesMath;
import jakarta.enterprise.context.ApplicationScoped;
import org.eclipse.microprofile.config.inject.ConfigProperty;
import org.jboss.logging.Logger;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;

/**
 * Locates trend breakpoints in a value series.
 *
 * <p>A split at index {@code i} of {@code values[from, to)} is scored by the absolute difference
 * between the means on either side. When the two sides trend in opposite directions and both
 * slopes stand clear of their noise (|t| &gt; 2), the score is boosted by
 * {@code n * |slopeRight - slopeLeft|}, so a clean reversal outranks a small level shift.
 * The highest-scoring split wins; the first index wins ties.
 *
 * <p>The reported confidence is the share of the segment's linear residual sum of squares that
 * fitting two separate lines removes, {@code 1 - (SSE[from, i) + SSE[i, to)) / SSE[from, to)}.
 * It never suppresses the first breakpoint: any series with at least
 * {@code 2 * minSegmentLength + 1} points reports one.
 *
 * <p>Further breakpoints come from binary segmentation: each round splits whichever segment
 * offers the most confident split, until the requested number is reached or the best remaining
 * split falls below the minimum confidence.
 */
@ApplicationScoped
public class BreakpointDetectionService
{
    private static final Logger LOG = Logger.getLogger(BreakpointDetectionService.class);

    private static final double FLAT_SSE = 1e-12;
    private static final double VARIANCE_RATIO_THRESHOLD = 4.0;
    private static final double SLOPE_T_THRESHOLD = 2.0;

    @ConfigProperty(name = "impact.breakpoint.min-confidence", defaultValue = "0.5")
    double minConfidence = 0.5;

    @ConfigProperty(name = "impact.trend.stable-threshold", defaultValue = "0.01")
    double stableThreshold = 0.01;

    /** Single dominant breakpoint, without timestamps. */
    public BreakpointAnalysisDTO findBreakpoint(double[] values, int minSegmentLength)
    {
        return findBreakpoints(values, null, minSegmentLength, 1);
    }

    /**
     * @param values           time-ordered values
     * @param timestamps       timestamps aligned with {@code values}, or {@code null}
     * @param minSegmentLength smallest number of points on either side of a split
     * @param maxBreakpoints   upper bound on the number of breakpoints reported
     * @return breakpoints ordered by location and the segments between them
     */
    public BreakpointAnalysisDTO findBreakpoints(double[] values,
                                                 List<Instant> timestamps,
                                                 int minSegmentLength,
                                                 int maxBreakpoints)
    {
        if (minSegmentLength < 1) {
            throw ValidationException.invalidParameter("minSegmentLength", minSegmentLength, "a positive integer");
        }
        if (maxBreakpoints < 1) {
            throw ValidationException.invalidParameter("maxBreakpoints", maxBreakpoints, "a positive integer");
        }
        if (timestamps != null && timestamps.size() != values.length) {
            throw new ValidationException(String.format(
                    "Values (%d) and timestamps (%d) must have the same length", values.length, timestamps.size()));
        }

        List<int[]> segments = new ArrayList<>();
        if (values.length > 0) {
            segments.add(new int[] {0, values.length});
        }
        List<BreakpointDTO> breakpoints = new ArrayList<>();

        while (breakpoints.size() < maxBreakpoints) {
            Split best = null;
            int[] bestSegment = null;
            for (int[] segment : segments) {
                Split split = bestSplit(values, segment[0], segment[1], minSegmentLength);
                if (split != null && (best == null || split.confidence() > best.confidence())) {
                    best = split;
                    bestSegment = segment;
                }
            }
            if (best == null || (!breakpoints.isEmpty() && best.confidence() < minConfidence)) {
                break;
            }

            Instant at = timestamps == null ? null : timestamps.get(best.index());
            breakpoints.add(new BreakpointDTO(best.index(), at, best.confidence(),
                    classify(values, bestSegment[0], best.index(), bestSegment[1])));

            segments.remove(bestSegment);
            segments.add(new int[] {bestSegment[0], best.index()});
            segments.add(new int[] {best.index(), bestSegment[1]});
            LOG.debugf("Split [%d, %d) at %d with score %.4f and confidence %.4f",
                    bestSegment[0], bestSegment[1], best.index(), best.score(), best.confidence());
        }

        breakpoints.sort(Comparator.comparingInt(BreakpointDTO::location));
        segments.sort(Comparator.comparingInt(s -> s[0]));

        List<SegmentDTO> segmentDtos = new ArrayList<>(segments.size());
        for (int[] segment : segments) {
            double slope = SeriesMath.slope(values, segment[0], segment[1]);
            segmentDtos.add(new SegmentDTO(segment[0], segment[1],
                    TrendDirection.fromSlope(slope, stableThreshold), slope));
        }

        LOG.infof("Breakpoint detection over %d points found %d breakpoint(s)", values.length, breakpoints.size());
        return new BreakpointAnalysisDTO(breakpoints, segmentDtos);
    }

    /**
     * Best split of {@code values[from, to)}, or {@code null} when the segment cannot hold two
     * sides of {@code minSegmentLength} points. The first index wins among equal scores.
     */
    Split bestSplit(double[] values, int from, int to, int minSegmentLength)
    {
        int n = to - from;
        int bestIndex = -1;
        double bestScore = 0.0;
        for (int i = from + minSegmentLength; i < to - minSegmentLength; i++) {
            double score = Math.abs(SeriesMath.mean(values, from, i) - SeriesMath.mean(values, i, to));
            double leftSlope = SeriesMath.slope(values, from, i);
            double rightSlope = SeriesMath.slope(values, i, to);
            if (leftSlope * rightSlope < 0
                    && isSignificantSlope(values, from, i)
                    && isSignificantSlope(values, i, to)) {
                score += n * Math.abs(rightSlope - leftSlope);
            }
            if (bestIndex < 0 || score > bestScore) {
                bestIndex = i;
                bestScore = score;
            }
        }
        if (bestIndex < 0) {
            return null;
        }
        return new Split(bestIndex, bestScore, confidence(values, from, bestIndex, to));
    }

    private static double confidence(double[] values, int from, int split, int to)
    {
        double whole = SeriesMath.linearResidualSumOfSquares(values, from, to);
        if (whole <= FLAT_SSE) {
            return 0.0;
        }
        double remaining = SeriesMath.linearResidualSumOfSquares(values, from, split)
                + SeriesMath.linearResidualSumOfSquares(values, split, to);
        return SeriesMath.clamp(1.0 - remaining / whole, 0.0, 1.0);
    }

    /** Whether the OLS slope of {@code values[from, to)} exceeds twice its standard error. */
    private static boolean isSignificantSlope(double[] values, int from, int to)
    {
        int n = to - from;
        if (n < 3) {
            return false;
        }
        double slope = SeriesMath.slope(values, from, to);
        double sxx = n * ((double) n * n - 1) / 12.0;
        double standardError = Math.sqrt(SeriesMath.linearResidualSumOfSquares(values, from, to) / (n - 2) / sxx);
        return Math.abs(slope) > SLOPE_T_THRESHOLD * standardError;
    }

    private static ChangeType classify(double[] values, int from, int split, int to)
    {
        double leftSlope = SeriesMath.slope(values, from, split);
        double rightSlope = SeriesMath.slope(values, split, to);
        if (leftSlope * rightSlope < 0) {
            return ChangeType.TREND;
        }

        double leftNoise = SeriesMath.linearResidualSumOfSquares(values, from, split) / (split - from);
        double rightNoise = SeriesMath.linearResidualSumOfSquares(values, split, to) / (to - split);
        double low = Math.min(leftNoise, rightNoise);
        double high = Math.max(leftNoise, rightNoise);
        if (high > FLAT_SSE && (low <= FLAT_SSE || high / low > VARIANCE_RATIO_THRESHOLD)) {
            return ChangeType.VARIANCE;
        }
        return ChangeType.MEAN;
    }

    record Split(int index, double score, double confidence) {
    }
}
