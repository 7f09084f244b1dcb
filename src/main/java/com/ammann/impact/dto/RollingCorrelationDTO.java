/* (C)2026 */
package com.ammann.impact.dto;

import java.time.Instant;
import java.util.List;
import org.eclipse.microprofile.openapi.annotations.media.Schema;

/**
 * Pearson correlation of two fields over a sliding window.
 *
 * @param correlations    one coefficient per window position
 * @param timestamps      timestamp of the centre point of each window
 * @param meanCorrelation mean of the coefficients, 0 when there are none
 * @param stability       {@code 1 / (1 + variance / range)}, 1 when the coefficients do not vary
 */
@Schema(description = "Rolling correlation between two metric fields")
public record RollingCorrelationDTO(
        List<Double> correlations,
        List<Instant> timestamps,
        double meanCorrelation,
        double stability) {
}
