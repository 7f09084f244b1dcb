/* (C)2026 */
package com.ammann.impact.repository;

import com.ammann.impact.model.BusinessEvent;
import com.ammann.impact.model.EventBounds;
import com.ammann.impact.model.MetricReading;
import com.ammann.impact.model.TimeSeriesPoint;
import jakarta.enterprise.context.ApplicationScoped;
import org.jboss.logging.Logger;

import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * {@link TimeSeriesRepository} backed by the {@link MetricReading} and {@link BusinessEvent}
 * tables.
 *
 * <p>Readings are stored one row per field; rows sharing a timestamp and customer are folded
 * back into a single {@link TimeSeriesPoint}.
 */
@ApplicationScoped
public class PanacheTimeSeriesRepository implements TimeSeriesRepository
{
    private static final Logger LOG = Logger.getLogger(PanacheTimeSeriesRepository.class);

    @Override
    public List<TimeSeriesPoint> fetch(String eventId, List<String> fields)
    {
        List<MetricReading> readings = MetricReading.findForEvent(eventId, fields);
        List<TimeSeriesPoint> points = toPoints(readings);

        LOG.debugf("Fetched %d readings as %d points for event %s (fields=%s)",
                readings.size(), points.size(), eventId, fields);
        return points;
    }

    @Override
    public Optional<EventBounds> findEventBounds(String eventId)
    {
        return BusinessEvent.findByEventId(eventId).map(BusinessEvent::toBounds);
    }

    /**
     * Groups time-ordered long-format readings into points keyed by (timestamp, customer).
     */
    static List<TimeSeriesPoint> toPoints(List<MetricReading> readings)
    {
        Map<PointKey, Map<String, Double>> grouped = new LinkedHashMap<>();
        for (MetricReading reading : readings) {
            if (reading.value == null) {
                continue;
            }
            grouped.computeIfAbsent(new PointKey(reading.observedAt, reading.customerId), k -> new LinkedHashMap<>())
                    .put(reading.fieldName, reading.value);
        }

        List<TimeSeriesPoint> points = new ArrayList<>(grouped.size());
        grouped.forEach((key, fields) -> points.add(new TimeSeriesPoint(key.timestamp(), key.customerId(), fields)));
        return points;
    }

    private record PointKey(Instant timestamp, String customerId)
    {
        PointKey
        {
            Objects.requireNonNull(timestamp, "timestamp");
        }
    }
}
