/* (C)2026 */
package com.ammann.impact.dto;

import com.ammann.impact.enumeration.OptimizationCriterion;
import java.util.Map;
import org.eclipse.microprofile.openapi.annotations.media.Schema;

@Schema(description = "Recommended analysis window size among the candidates")
public record OptimalWindowSizeDTO(
        @Schema(description = "Best scoring candidate") String recommendedWindow,
        @Schema(description = "Score per candidate, 0 for candidates longer than the data") Map<String, Double> windowScores,
        @Schema(description = "Criterion used for scoring") OptimizationCriterion optimizationMetric,
        @Schema(description = "Confidence in the recommendation, within [0.51, 0.95]") double confidence) {
}
