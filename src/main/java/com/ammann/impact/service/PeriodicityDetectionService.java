/* (C)2026 */
package com.ammann.impact.service;

import com.ammann.impact.dto.PeriodicPatternsDTO;
import com.ammann.impact.util.DurationFormat;
import com.ammann.impact.util.SeriesMath;
import com.ammann.impact.util.SeriesSelector;
import jakarta.enterprise.context.ApplicationScoped;
import org.eclipse.microprofile.config.inject.ConfigProperty;
import org.jboss.logging.Logger;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Detects periodic structure in a series using its autocorrelation function.
 *
 * <p>Candidate periods are converted to a lag in samples using the sampling interval inferred
 * from the timestamps. The strength of a candidate is the autocorrelation at that lag, floored
 * at 0 so anti-phase lags (half a true period) do not count as periodic.
 */
@ApplicationScoped
public class PeriodicityDetectionService
{
    private static final Logger LOG = Logger.getLogger(PeriodicityDetectionService.class);

    private static final double TIE_TOLERANCE = 1e-9;

    @ConfigProperty(name = "impact.periodicity.max-lag", defaultValue = "100")
    int maxLag = 100;

    @ConfigProperty(name = "impact.periodicity.min-cycles", defaultValue = "2")
    int minCycles = 2;

    /**
     * @param values                time-ordered, evenly sampled values
     * @param timestamps            timestamps aligned with {@code values}
     * @param candidatePeriods      duration strings such as {@code 24h}
     * @param significanceThreshold strength a candidate must exceed to be detected
     * @return detected periods, strengths, periodogram and autocorrelation function
     */
    public PeriodicPatternsDTO detectPeriods(double[] values,
                                             List<Instant> timestamps,
                                             List<String> candidatePeriods,
                                             double significanceThreshold)
    {
        Duration sampling = SeriesSelector.samplingInterval(timestamps);
        double variance = SeriesMath.variance(values);
        double mean = SeriesMath.mean(values);

        Map<String, Double> strengths = new LinkedHashMap<>();
        List<String> detected = new ArrayList<>();
        for (String period : candidatePeriods) {
            int lag = SeriesSelector.sampleCount(DurationFormat.parsePositive("candidatePeriod", period), sampling);
            double strength = periodStrength(values, mean, variance, lag);
            strengths.put(period, strength);
            if (strength > significanceThreshold) {
                detected.add(period);
            }
            LOG.debugf("Period %s -> lag %d, strength %.4f", period, lag, strength);
        }

        String dominant = dominantPeriod(candidatePeriods, strengths);
        List<Double> acf = autocorrelation(values, Math.min(values.length / 4, maxLag));
        List<Double> spectrum = periodogram(values);

        LOG.infof("Periodicity analysis of %d points: detected=%s, dominant=%s", values.length, detected, dominant);
        return new PeriodicPatternsDTO(detected, strengths, dominant, spectrum, acf);
    }

    /**
     * Autocorrelation for lags {@code 0..maxLag}, normalized by {@code (N - L) * variance}.
     * All zeros for a constant series.
     */
    public List<Double> autocorrelation(double[] values, int maxLag)
    {
        double mean = SeriesMath.mean(values);
        double variance = SeriesMath.variance(values);
        List<Double> acf = new ArrayList<>(Math.max(0, maxLag + 1));
        for (int lag = 0; lag <= maxLag && lag < values.length; lag++) {
            acf.add(autocorrelationAt(values, mean, variance, lag));
        }
        return acf;
    }

    /** Periodogram {@code |sum x[t] e^(-2 pi i f t / N)|^2 / N} for {@code f = 1..N/2}. */
    public List<Double> periodogram(double[] values)
    {
        int n = values.length;
        List<Double> density = new ArrayList<>(n / 2);
        for (int f = 1; f <= n / 2; f++) {
            double re = 0.0;
            double im = 0.0;
            for (int t = 0; t < n; t++) {
                double angle = 2.0 * Math.PI * f * t / n;
                re += values[t] * Math.cos(angle);
                im -= values[t] * Math.sin(angle);
            }
            density.add((re * re + im * im) / n);
        }
        return density;
    }

    private double periodStrength(double[] values, double mean, double variance, int lag)
    {
        if (lag < 1 || values.length < (long) minCycles * lag) {
            return 0.0;
        }
        return SeriesMath.clamp(autocorrelationAt(values, mean, variance, lag), 0.0, 1.0);
    }

    private static double autocorrelationAt(double[] values, double mean, double variance, int lag)
    {
        int n = values.length;
        if (variance == 0.0 || lag >= n) {
            return 0.0;
        }
        double sum = 0.0;
        for (int i = 0; i < n - lag; i++) {
            sum += (values[i] - mean) * (values[i + lag] - mean);
        }
        return sum / ((n - lag) * variance);
    }

    // Shortest candidate wins among (near-)equal strengths: its multiples correlate just as well.
    private static String dominantPeriod(List<String> candidates, Map<String, Double> strengths)
    {
        List<String> byLength = new ArrayList<>(candidates);
        byLength.sort(Comparator.comparing(DurationFormat::parse));

        String best = byLength.isEmpty() ? null : byLength.get(0);
        double bestStrength = best == null ? 0.0 : strengths.get(best);
        for (String candidate : byLength) {
            double strength = strengths.get(candidate);
            if (strength > bestStrength + TIE_TOLERANCE) {
                best = candidate;
                bestStrength = strength;
            }
        }
        return best;
    }
}
