/* (C)2026 */
package com.ammann.impact.service;

import com.ammann.impact.dto.EventWindowDTO;
import com.ammann.impact.dto.OptimalEventWindowsDTO;
import com.ammann.impact.model.TimeSeriesPoint;
import com.ammann.impact.util.DurationFormat;
import com.ammann.impact.util.HypothesisTests;
import com.ammann.impact.util.SeriesMath;
import com.ammann.impact.util.SeriesSelector;
import jakarta.enterprise.context.ApplicationScoped;
import org.eclipse.microprofile.config.inject.ConfigProperty;
import org.jboss.logging.Logger;

import java.time.Duration;
import java.time.Instant;
import java.util.Arrays;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Chooses pre- and post-event analysis windows and estimates how well an effect of the event
 * could be detected with them.
 *
 * <p>Each side's window covers a quarter of that side's readings (at least
 * {@value #MIN_WINDOW_POINTS} sampling intervals), capped by the caller's maximum.
 */
@ApplicationScoped
public class EventWindowOptimizationService
{
    private static final Logger LOG = Logger.getLogger(EventWindowOptimizationService.class);

    static final int MIN_WINDOW_POINTS = 10;

    @ConfigProperty(name = "impact.window.max-points", defaultValue = "100")
    int maxPoints = 100;

    public OptimalEventWindowsDTO determineWindows(List<TimeSeriesPoint> series,
                                                   String field,
                                                   Instant eventTimestamp,
                                                   Duration maxPreEventWindow,
                                                   Duration maxPostEventWindow,
                                                   boolean stationarityTests)
    {
        List<TimeSeriesPoint> points = SeriesSelector.withField(series, field);
        Duration sampling = SeriesSelector.samplingInterval(SeriesSelector.timestamps(points, field));

        double[] pre = points.stream()
                .filter(p -> p.timestamp().isBefore(eventTimestamp))
                .mapToDouble(p -> p.value(field))
                .toArray();
        double[] post = points.stream()
                .filter(p -> p.timestamp().isAfter(eventTimestamp))
                .mapToDouble(p -> p.value(field))
                .toArray();

        Duration preLength = windowLength(pre.length, sampling, maxPreEventWindow);
        Duration postLength = windowLength(post.length, sampling, maxPostEventWindow);

        double[] preTail = Arrays.copyOfRange(pre, Math.max(0, pre.length - maxPoints), pre.length);
        double[] postHead = Arrays.copyOfRange(post, 0, Math.min(maxPoints, post.length));
        double effect = HypothesisTests.averageVarianceEffectSize(preTail, postHead);
        int n = Math.min(preTail.length, postHead.length);

        double power = SeriesMath.clamp(effect * Math.sqrt(n) / 3.0, 0.5, 0.95);
        double detectability = SeriesMath.clamp(effect, 0.3, 0.95);

        Map<String, Boolean> stationarity = new LinkedHashMap<>();
        if (stationarityTests) {
            stationarity.put("preEvent", isVarianceStationary(pre));
            stationarity.put("postEvent", isVarianceStationary(post));
        }

        EventWindowDTO preWindow = new EventWindowDTO(DurationFormat.format(preLength),
                eventTimestamp.minus(preLength), eventTimestamp);
        EventWindowDTO postWindow = new EventWindowDTO(DurationFormat.format(postLength),
                eventTimestamp, eventTimestamp.plus(postLength));

        LOG.infof("Event windows for '%s': pre=%s, post=%s, power=%.2f, detectability=%.2f",
                field, preWindow.duration(), postWindow.duration(), power, detectability);
        return new OptimalEventWindowsDTO(preWindow, postWindow, power, detectability, stationarity);
    }

    static Duration windowLength(int sidePoints, Duration sampling, Duration max)
    {
        Duration optimal = sampling.multipliedBy(Math.max(MIN_WINDOW_POINTS, sidePoints / 4));
        return optimal.compareTo(max) > 0 ? max : optimal;
    }

    /**
     * Variance-ratio check between the first and second half: stationary when the ratio lies
     * strictly between 0.5 and 2. A flat first half counts as ratio 1.
     */
    static boolean isVarianceStationary(double[] values)
    {
        int half = values.length / 2;
        double first = SeriesMath.variance(values, 0, half);
        double second = SeriesMath.variance(values, half, values.length);
        double ratio = first > 0 ? second / first : 1.0;
        return ratio > 0.5 && ratio < 2.0;
    }
}
