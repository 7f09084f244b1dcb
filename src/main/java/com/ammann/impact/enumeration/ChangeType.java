/* (C)2026 */
package com.ammann.impact.enumeration;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Kind of structural change located at a breakpoint.
 */
public enum ChangeType {
    /** Level shift between segments. */
    MEAN("mean"),

    /** Change in dispersion around the segment trends. */
    VARIANCE("variance"),

    /** Reversal of the segment slopes. */
    TREND("trend");

    private final String key;

    ChangeType(String key) {
        this.key = key;
    }

    @JsonValue
    public String key() {
        return key;
    }
}
