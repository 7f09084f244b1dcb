/* (C)2026 */
package com.ammann.impact.repository;

import com.ammann.impact.model.EventBounds;
import com.ammann.impact.model.TimeSeriesPoint;

import java.util.List;
import java.util.Optional;

/**
 * Source of the raw readings an analysis runs on.
 *
 * <p>Passed into the analysis facade instead of being looked up globally, so analyses can be
 * exercised against in-memory data.
 */
public interface TimeSeriesRepository
{
    /**
     * Fetches the readings of the given fields for an event.
     *
     * @param eventId business event identifier
     * @param fields  metric fields to load
     * @return points ordered ascending by timestamp; a point only carries fields that were
     *         observed (non-null) at that instant
     */
    List<TimeSeriesPoint> fetch(String eventId, List<String> fields);

    /**
     * Looks up the boundary record of an event.
     *
     * @param eventId business event identifier
     * @return bounds, or empty when the event is unknown
     */
    Optional<EventBounds> findEventBounds(String eventId);
}
