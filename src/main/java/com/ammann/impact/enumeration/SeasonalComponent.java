/* (C)2026 */
package com.ammann.impact.enumeration;

import com.ammann.impact.exception.ValidationException;
import com.fasterxml.jackson.annotation.JsonValue;
import java.util.Arrays;

/**
 * Calendar granularity used to score seasonal structure.
 */
public enum SeasonalComponent {
    /** Hour of day. */
    HOURLY("hourly"),

    /** Day of week. */
    DAILY("daily"),

    /** ISO week of the year. */
    WEEKLY("weekly");

    private final String key;

    SeasonalComponent(String key) {
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
    public static SeasonalComponent fromString(String value) {
        if (value == null || value.isBlank()) {
            throw ValidationException.missingParameter("seasonalComponent");
        }
        String normalized = value.trim();
        for (SeasonalComponent candidate : values()) {
            if (candidate.key.equalsIgnoreCase(normalized) || candidate.name().equalsIgnoreCase(normalized)) {
                return candidate;
            }
        }
        throw ValidationException.invalidParameter(
                "seasonalComponent", value, "one of " + Arrays.toString(values()));
    }

    @Override
    public String toString() {
        return key;
    }
}
