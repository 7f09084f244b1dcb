/* (C)2026 */
package com.ammann.impact.service;

import com.ammann.impact.dto.ImpactTimingDTO;
import com.ammann.impact.dto.ImpactTimingDTO.ImpactOnset;
import com.ammann.impact.dto.ImpactTimingDTO.RecoveryTiming;
import com.ammann.impact.exception.ValidationException;
import com.ammann.impact.util.DurationFormat;
import com.ammann.impact.util.SeriesMath;
import jakarta.enterprise.context.ApplicationScoped;
import org.jboss.logging.Logger;

import java.time.Duration;
import java.time.Instant;
import java.util.List;

/**
 * Measures when an event's impact on a metric began and how long the metric took to return
 * to its pre-event baseline.
 *
 * <p>The baseline is the mean of the readings before the event. Post-event readings (at or
 * after the event) are optionally smoothed with a trailing moving average, then scanned in
 * order. Onset is the first reading whose deviation from the baseline exceeds the baseline
 * threshold; deviations are relative to the baseline, or absolute when the baseline is 0.
 * The direction of the impact (drop or spike) is taken from the onset reading, and recovery
 * is looked for after it:
 * <ul>
 *   <li>partial recovery: back within {@code (1 - recoveryThreshold) * |baseline|} of the baseline</li>
 *   <li>full recovery: back at the baseline</li>
 * </ul>
 * Recovery times are measured from the event. The impact amplitude is the distance from the
 * baseline to the lowest post-event reading for a drop, or the highest for a spike, taken over
 * every post-event reading. Severity is that amplitude relative to {@code |baseline|} (0 when
 * the baseline is 0) and the recovery rate is the amplitude per hour from the event to full
 * recovery (0 when the metric never recovers).
 */
@ApplicationScoped
public class ImpactTimingService
{
    private static final Logger LOG = Logger.getLogger(ImpactTimingService.class);

    private static final double MILLIS_PER_HOUR = 3_600_000.0;

    public ImpactTimingDTO calculateImpactTiming(double[] values,
                                                 List<Instant> timestamps,
                                                 Instant eventTimestamp,
                                                 double baselineThreshold,
                                                 double recoveryThreshold,
                                                 int smoothingWindow)
    {
        if (values.length != timestamps.size()) {
            throw new ValidationException(String.format(
                    "Values (%d) and timestamps (%d) must have the same length", values.length, timestamps.size()));
        }
        if (baselineThreshold < 0) {
            throw ValidationException.invalidParameter("baselineThreshold", baselineThreshold, "a non-negative number");
        }
        if (recoveryThreshold < 0 || recoveryThreshold > 1) {
            throw ValidationException.invalidParameter("recoveryThreshold", recoveryThreshold, "a number in [0, 1]");
        }
        if (smoothingWindow < 1) {
            throw ValidationException.invalidParameter("smoothingWindow", smoothingWindow, "a positive integer");
        }

        int firstPost = 0;
        while (firstPost < timestamps.size() && timestamps.get(firstPost).isBefore(eventTimestamp)) {
            firstPost++;
        }
        double baseline = SeriesMath.mean(values, 0, firstPost);
        if (firstPost == 0) {
            LOG.warnf("No readings before %s, using baseline 0", eventTimestamp);
        }

        double[] post = smooth(values, firstPost, smoothingWindow);
        List<Instant> postTimes = timestamps.subList(firstPost, timestamps.size());

        int onset = -1;
        for (int i = 0; i < post.length; i++) {
            if (deviation(post[i], baseline) > baselineThreshold) {
                onset = i;
                break;
            }
        }

        if (onset < 0) {
            LOG.infof("No impact detected after %s (baseline=%.4f, %d post-event readings)",
                    eventTimestamp, baseline, post.length);
            return new ImpactTimingDTO(baseline,
                    new ImpactOnset(false, "0m", eventTimestamp),
                    new RecoveryTiming("0m", "0m"),
                    "0m", 0.0, 0.0);
        }

        boolean drop = post[onset] < baseline;
        double tolerance = 1e-9 * Math.max(1.0, Math.abs(baseline));
        double partialBand = (1.0 - recoveryThreshold) * Math.abs(baseline);

        int partial = -1;
        int full = -1;
        for (int i = onset + 1; i < post.length; i++) {
            double v = post[i];
            if (partial < 0 && (drop ? v >= baseline - partialBand : v <= baseline + partialBand)) {
                partial = i;
            }
            if (drop ? v >= baseline - tolerance : v <= baseline + tolerance) {
                full = i;
                if (partial < 0) {
                    partial = i;
                }
                break;
            }
        }
        double extreme = drop ? SeriesMath.min(post) : SeriesMath.max(post);

        Instant onsetAt = postTimes.get(onset);
        Instant impactEnd = full >= 0 ? postTimes.get(full) : postTimes.get(post.length - 1);
        Duration toFull = full >= 0 ? Duration.between(eventTimestamp, postTimes.get(full)) : Duration.ZERO;

        double amplitude = Math.abs(baseline - extreme);
        double recoveryRate = toFull.isZero() ? 0.0 : amplitude / (toFull.toMillis() / MILLIS_PER_HOUR);
        double severity = baseline != 0.0 ? amplitude / Math.abs(baseline) : 0.0;

        ImpactOnset impactOnset = new ImpactOnset(true,
                DurationFormat.format(Duration.between(eventTimestamp, onsetAt)), onsetAt);
        RecoveryTiming recovery = new RecoveryTiming(
                sinceEvent(eventTimestamp, postTimes, full),
                sinceEvent(eventTimestamp, postTimes, partial));
        String impactDuration = DurationFormat.format(Duration.between(onsetAt, impactEnd));

        LOG.infof("Impact %s detected at %s: severity=%.3f, full recovery=%s, duration=%s",
                drop ? "drop" : "spike", onsetAt, severity, recovery.fullRecoveryTime(), impactDuration);
        return new ImpactTimingDTO(baseline, impactOnset, recovery, impactDuration, recoveryRate, severity);
    }

    private static double deviation(double value, double baseline)
    {
        double difference = Math.abs(value - baseline);
        return baseline != 0.0 ? difference / Math.abs(baseline) : difference;
    }

    private static String sinceEvent(Instant eventTimestamp, List<Instant> postTimes, int index)
    {
        if (index < 0) {
            return ImpactTimingDTO.NOT_RECOVERED;
        }
        return DurationFormat.format(Duration.between(eventTimestamp, postTimes.get(index)));
    }

    /** Trailing moving average over {@code values[from..]}; a window of 1 copies the values. */
    static double[] smooth(double[] values, int from, int window)
    {
        double[] smoothed = new double[values.length - from];
        for (int i = 0; i < smoothed.length; i++) {
            int start = Math.max(0, i - window + 1);
            smoothed[i] = SeriesMath.mean(values, from + start, from + i + 1);
        }
        return smoothed;
    }
}
