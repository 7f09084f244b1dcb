/* (C)2026 */
package com.ammann.impact.enumeration;

import com.ammann.impact.exception.ValidationException;
import com.fasterxml.jackson.annotation.JsonValue;
import java.util.Arrays;

/**
 * Strategy used to fill a detected gap with a single value at its midpoint.
 */
public enum InterpolationMethod {
    /** Linear interpolation between the two boundary readings. */
    LINEAR("linear"),

    /** Carries the reading before the gap forward. */
    FORWARD_FILL("forward_fill"),

    /** Carries the reading after the gap backward. */
    BACKWARD_FILL("backward_fill");

    private final String key;

    InterpolationMethod(String key) {
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
    public static InterpolationMethod fromString(String value) {
        if (value == null || value.isBlank()) {
            throw ValidationException.missingParameter("interpolationMethod");
        }
        String normalized = value.trim();
        for (InterpolationMethod candidate : values()) {
            if (candidate.key.equalsIgnoreCase(normalized) || candidate.name().equalsIgnoreCase(normalized)) {
                return candidate;
            }
        }
        throw ValidationException.invalidParameter(
                "interpolationMethod", value, "one of " + Arrays.toString(values()));
    }

    @Override
    public String toString() {
        return key;
    }
}
