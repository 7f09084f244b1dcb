/* (C)2026 */
package com.ammann.impact.dto;

import java.util.List;
import java.util.Map;
import org.eclipse.microprofile.openapi.annotations.media.Schema;

@Schema(description = "Additive trend/seasonal/residual decomposition of a metric")
public record SeasonalDecompositionDTO(
        @Schema(description = "Least-squares linear trend") List<Double> trend,
        @Schema(description = "Hour-of-day bucket means broadcast to each point") List<Double> seasonal,
        @Schema(description = "value - trend - seasonal") List<Double> residual,
        @Schema(description = "Variance of bucket means per requested granularity") Map<String, Double> seasonalStrengths,
        @Schema(description = "Granularity with the highest strength") String dominantSeasonality) {
}
