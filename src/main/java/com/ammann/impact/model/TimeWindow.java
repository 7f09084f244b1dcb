/* (C)2026 */
package com.ammann.impact.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonProperty;
import java.time.Instant;
import java.util.List;

/**
 * Contiguous slice of a time series bounded by two instants. May be empty.
 *
 * @param start  lower bound
 * @param end    upper bound
 * @param points points inside the bounds, time-ordered
 */
public record TimeWindow(Instant start, Instant end, List<TimeSeriesPoint> points) {

    public TimeWindow {
        points = List.copyOf(points);
    }

    @JsonProperty("count")
    public int count() {
        return points.size();
    }

    @JsonIgnore
    public boolean isEmpty() {
        return points.isEmpty();
    }
}
