/* (C)2026 */
package com.ammann.impact.enumeration;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Direction of a least-squares trend fitted against sequence index.
 */
public enum TrendDirection {
    INCREASING("increasing"),
    DECREASING("decreasing"),
    STABLE("stable");

    private final String key;

    TrendDirection(String key) {
        this.key = key;
    }

    @JsonValue
    public String key() {
        return key;
    }

    /**
     * Classifies a slope. Slopes whose magnitude does not exceed the threshold are stable.
     *
     * @param slope           least-squares slope per sample
     * @param stableThreshold largest magnitude still considered stable
     * @return trend direction
     */
    public static TrendDirection fromSlope(double slope, double stableThreshold) {
        if (slope > stableThreshold) {
            return INCREASING;
        }
        if (slope < -stableThreshold) {
            return DECREASING;
        }
        return STABLE;
    }
}
