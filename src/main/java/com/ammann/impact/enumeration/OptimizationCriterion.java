/* (C)2026 */
package com.ammann.impact.enumeration;

import com.ammann.impact.exception.ValidationException;
import com.fasterxml.jackson.annotation.JsonValue;
import java.util.Arrays;

/**
 * Criterion used to score candidate analysis window sizes.
 */
public enum OptimizationCriterion {
    /** Absolute trend slope divided by the standard deviation. */
    SIGNAL_TO_NOISE_RATIO("signal_to_noise_ratio"),

    /** Effect-size based detectability of a pre/post difference. */
    STATISTICAL_POWER("statistical_power");

    private final String key;

    OptimizationCriterion(String key) {
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
    public static OptimizationCriterion fromString(String value) {
        if (value == null || value.isBlank()) {
            throw ValidationException.missingParameter("optimizationCriterion");
        }
        String normalized = value.trim();
        for (OptimizationCriterion candidate : values()) {
            if (candidate.key.equalsIgnoreCase(normalized) || candidate.name().equalsIgnoreCase(normalized)) {
                return candidate;
            }
        }
        throw ValidationException.invalidParameter(
                "optimizationCriterion", value, "one of " + Arrays.toString(values()));
    }

    @Override
    public String toString() {
        return key;
    }
}
