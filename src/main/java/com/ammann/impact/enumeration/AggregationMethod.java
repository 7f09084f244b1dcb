/* (C)2026 */
package com.ammann.impact.enumeration;

import com.ammann.impact.exception.ValidationException;
import com.fasterxml.jackson.annotation.JsonValue;
import java.util.Arrays;

/**
 * Statistic computed per temporal aggregation bucket.
 */
public enum AggregationMethod {
    /** Arithmetic mean of the bucket values. */
    MEAN("mean"),

    /** Mean weighted by a companion weight field. */
    WEIGHTED_MEAN("weighted_mean"),

    /** Middle value, averaging the two central values for even counts. */
    MEDIAN("median"),

    /** Nearest-rank 95th percentile. */
    PERCENTILE_95("percentile_95");

    private final String key;

    AggregationMethod(String key) {
        this.key = key;
    }

    /** Wire representation used in requests and serialized results. */
    @JsonValue
    public String key() {
        return key;
    }

    /**
     * Case-insensitive conversion from either the wire key or the constant name.
     *
     * @param value raw option value
     * @return matching constant
     * @throws ValidationException if the value is missing or unsupported
     */
    public static AggregationMethod fromString(String value) {
        if (value == null || value.isBlank()) {
            throw ValidationException.missingParameter("aggregationMethod");
        }
        String normalized = value.trim();
        for (AggregationMethod candidate : values()) {
            if (candidate.key.equalsIgnoreCase(normalized) || candidate.name().equalsIgnoreCase(normalized)) {
                return candidate;
            }
        }
        throw ValidationException.invalidParameter(
                "aggregationMethod", value, "one of " + Arrays.toString(values()));
    }

    @Override
    public String toString() {
        return key;
    }
}
