/* (C)2026 */
package com.ammann.impact.service;

import com.ammann.impact.dto.SlidingWindowsDTO;
import com.ammann.impact.dto.WindowStatisticsDTO;
import com.ammann.impact.enumeration.TrendDirection;
import com.ammann.impact.model.TimeSeriesPoint;
import com.ammann.impact.model.TimeWindow;
import com.ammann.impact.util.DurationFormat;
import com.ammann.impact.util.SeriesMath;
import com.ammann.impact.util.SeriesSelector;
import jakarta.enterprise.context.ApplicationScoped;
import org.eclipse.microprofile.config.inject.ConfigProperty;
import org.jboss.logging.Logger;

import java.time.Duration;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Builds pre- and post-event windows around an event and describes every requested field
 * inside them.
 *
 * <p>The pre-event window of size {@code s} is {@code [event - s, event)} and the post-event
 * window is {@code (event, event + s]}; a reading taken exactly at the event instant belongs to
 * neither.
 */
@ApplicationScoped
public class WindowStatisticsService
{
    private static final Logger LOG = Logger.getLogger(WindowStatisticsService.class);

    @ConfigProperty(name = "impact.trend.stable-threshold", defaultValue = "0.01")
    double stableThreshold = 0.01;

    /**
     * Slices {@code series} into one pre- and one post-event window per requested size.
     *
     * @param eventTimestamp event instant the windows are anchored at
     * @param windowSizes    duration strings such as {@code 1h}; also used as result keys
     * @param fields         fields to describe
     * @param series         time-ordered readings
     * @return windows and per-field statistics keyed {@code pre_<size>} / {@code post_<size>}
     */
    public SlidingWindowsDTO buildWindows(Instant eventTimestamp,
                                          List<String> windowSizes,
                                          List<String> fields,
                                          List<TimeSeriesPoint> series)
    {
        Map<String, TimeWindow> pre = new LinkedHashMap<>();
        Map<String, TimeWindow> post = new LinkedHashMap<>();
        Map<String, Map<String, WindowStatisticsDTO>> statistics = new LinkedHashMap<>();

        for (String size : windowSizes) {
            Duration length = DurationFormat.parsePositive("windowSize", size);

            Instant preStart = eventTimestamp.minus(length);
            Instant postEnd = eventTimestamp.plus(length);

            List<TimeSeriesPoint> prePoints = series.stream()
                    .filter(p -> !p.timestamp().isBefore(preStart) && p.timestamp().isBefore(eventTimestamp))
                    .toList();
            List<TimeSeriesPoint> postPoints = series.stream()
                    .filter(p -> p.timestamp().isAfter(eventTimestamp) && !p.timestamp().isAfter(postEnd))
                    .toList();

            pre.put(size, new TimeWindow(preStart, eventTimestamp, prePoints));
            post.put(size, new TimeWindow(eventTimestamp, postEnd, postPoints));

            statistics.put("pre_" + size, describe(prePoints, fields));
            statistics.put("post_" + size, describe(postPoints, fields));

            LOG.debugf("Window %s: %d pre-event and %d post-event points", size, prePoints.size(), postPoints.size());
        }

        LOG.infof("Built %d window pairs around %s for fields %s", windowSizes.size(), eventTimestamp, fields);
        return new SlidingWindowsDTO(pre, post, statistics);
    }

    /**
     * Statistics of each field over the given points. Points without a value for a field are
     * ignored for that field only.
     */
    public Map<String, WindowStatisticsDTO> describe(List<TimeSeriesPoint> points, List<String> fields)
    {
        Map<String, WindowStatisticsDTO> result = new LinkedHashMap<>();
        for (String field : fields) {
            result.put(field, statistics(SeriesSelector.values(points, field)));
        }
        return result;
    }

    public WindowStatisticsDTO statistics(double[] values)
    {
        if (values.length == 0) {
            return WindowStatisticsDTO.empty();
        }
        return new WindowStatisticsDTO(
                SeriesMath.mean(values),
                SeriesMath.standardDeviation(values),
                SeriesMath.min(values),
                SeriesMath.max(values),
                TrendDirection.fromSlope(SeriesMath.slope(values), stableThreshold),
                values.length);
    }
}
