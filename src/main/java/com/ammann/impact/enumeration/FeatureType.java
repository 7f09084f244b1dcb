/* (C)2026 */
package com.ammann.impact.enumeration;

import com.ammann.impact.exception.ValidationException;
import com.fasterxml.jackson.annotation.JsonValue;
import java.util.Arrays;

/**
 * Family of temporal features produced for downstream modeling.
 */
public enum FeatureType {
    /** Values shifted by a fixed number of samples. */
    LAG("lag"),

    /** Trailing rolling mean and standard deviation. */
    ROLLING_STATS("rolling_stats"),

    /** Sine and cosine encodings of hour of day and day of week. */
    SEASONAL("seasonal"),

    /** Linear index trend and first-difference momentum. */
    TREND("trend");

    private final String key;

    FeatureType(String key) {
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
    public static FeatureType fromString(String value) {
        if (value == null || value.isBlank()) {
            throw ValidationException.missingParameter("featureType");
        }
        String normalized = value.trim();
        for (FeatureType candidate : values()) {
            if (candidate.key.equalsIgnoreCase(normalized) || candidate.name().equalsIgnoreCase(normalized)) {
                return candidate;
            }
        }
        throw ValidationException.invalidParameter(
                "featureType", value, "one of " + Arrays.toString(values()));
    }

    @Override
    public String toString() {
        return key;
    }
}
