/* (C)2026 */
package com.ammann.impact.enumeration;

import com.ammann.impact.exception.ValidationException;
import com.fasterxml.jackson.annotation.JsonValue;
import java.util.Arrays;

/**
 * Significance test applied around a hypothesized change point.
 */
public enum SignificanceTestType {
    /** Shuffles the pooled sample without replacement. */
    PERMUTATION("permutation"),

    /** Resamples the pooled sample with replacement. */
    BOOTSTRAP("bootstrap"),

    /** Pooled-variance t statistic. */
    PARAMETRIC("parametric");

    private final String key;

    SignificanceTestType(String key) {
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
    public static SignificanceTestType fromString(String value) {
        if (value == null || value.isBlank()) {
            throw ValidationException.missingParameter("significanceTestType");
        }
        String normalized = value.trim();
        for (SignificanceTestType candidate : values()) {
            if (candidate.key.equalsIgnoreCase(normalized) || candidate.name().equalsIgnoreCase(normalized)) {
                return candidate;
            }
        }
        throw ValidationException.invalidParameter(
                "significanceTestType", value, "one of " + Arrays.toString(values()));
    }

    @Override
    public String toString() {
        return key;
    }
}
