/* (C)2026 */
package com.ammann.impact.enumeration;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Qualitative classification of the mean effect size across compared fields.
 */
public enum ImpactMagnitude {
    WEAK("weak"),
    MODERATE("moderate"),
    STRONG("strong");

    static final double STRONG_EFFECT = 0.8;
    static final double MODERATE_EFFECT = 0.5;

    private final String key;

    ImpactMagnitude(String key) {
        this.key = key;
    }

    @JsonValue
    public String key() {
        return key;
    }

    /**
     * Classifies a mean absolute Cohen's d.
     *
     * @param meanEffectSize mean |d| across compared fields
     * @return STRONG above 0.8, MODERATE above 0.5, otherwise WEAK
     */
    public static ImpactMagnitude fromEffectSize(double meanEffectSize) {
        if (meanEffectSize > STRONG_EFFECT) {
            return STRONG;
        }
        return meanEffectSize > MODERATE_EFFECT ? MODERATE : WEAK;
    }

    @Override
    public String toString() {
        return key;
    }
}
