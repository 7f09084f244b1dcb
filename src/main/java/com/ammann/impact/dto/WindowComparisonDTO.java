/* (C)2026 */
package com.ammann.impact.dto;

import com.ammann.impact.enumeration.ImpactMagnitude;
import java.util.Map;
import org.eclipse.microprofile.openapi.annotations.media.Schema;

@Schema(description = "Per-field comparisons between two windows and their aggregate verdict")
public record WindowComparisonDTO(
        @Schema(description = "Comparison per field") Map<String, FieldComparisonDTO> fieldComparisons,
        @Schema(description = "True when at least one field is significant") boolean overallSignificance,
        @Schema(description = "Classification of the mean effect size") ImpactMagnitude impactMagnitude) {
}
