/* (C)2026 */
package com.ammann.impact.dto;

import com.ammann.impact.enumeration.TrendDirection;
import org.eclipse.microprofile.openapi.annotations.media.Schema;

/**
 * Descriptive statistics of one field inside one window.
 *
 * <p>An empty window is reported as {@link #empty()}: all moments zero and a stable trend.
 *
 * @param mean  arithmetic mean
 * @param std   population standard deviation
 * @param min   smallest value
 * @param max   largest value
 * @param trend direction of the least-squares slope against sequence index
 * @param count number of values
 */
@Schema(description = "Descriptive statistics of a metric field within a time window")
public record WindowStatisticsDTO(
        @Schema(description = "Arithmetic mean") double mean,
        @Schema(description = "Population standard deviation") double std,
        @Schema(description = "Minimum value") double min,
        @Schema(description = "Maximum value") double max,
        @Schema(description = "Trend direction of the least-squares slope") TrendDirection trend,
        @Schema(description = "Number of values") int count) {

    private static final WindowStatisticsDTO EMPTY =
            new WindowStatisticsDTO(0.0, 0.0, 0.0, 0.0, TrendDirection.STABLE, 0);

    public static WindowStatisticsDTO empty() {
        return EMPTY;
    }
}
