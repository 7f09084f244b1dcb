/* (C)2026 */
package com.ammann.impact.model;

import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * One time-stamped reading of one or more metric fields, optionally attributed to a customer.
 *
 * <p>Instances are immutable: the field map is copied on construction. A field that was not
 * observed is simply absent from the map.
 *
 * @param timestamp  observation time
 * @param customerId customer the reading belongs to, {@code null} for event-level series
 * @param fields     metric name to value
 */
public record TimeSeriesPoint(Instant timestamp, String customerId, Map<String, Double> fields) {

    public TimeSeriesPoint {
        Objects.requireNonNull(timestamp, "timestamp");
        Map<String, Double> copy = new LinkedHashMap<>();
        if (fields != null) {
            fields.forEach((name, value) -> {
                if (value != null) {
                    copy.put(name, value);
                }
            });
        }
        fields = Collections.unmodifiableMap(copy);
    }

    /** Event-level point carrying a single field. */
    public static TimeSeriesPoint of(Instant timestamp, String field, double value) {
        return new TimeSeriesPoint(timestamp, null, Map.of(field, value));
    }

    public boolean hasValue(String field) {
        return fields.containsKey(field);
    }

    /**
     * @return the value of {@code field}, or {@code null} when it was not observed
     */
    public Double value(String field) {
        return fields.get(field);
    }
}
