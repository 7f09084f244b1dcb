/* (C)2026 */
package com.ammann.impact.dto;

import java.time.Instant;
import java.util.List;
import java.util.Map;
import org.eclipse.microprofile.openapi.annotations.media.Schema;

@Schema(description = "Detected gaps, interpolated midpoint values and completeness of a series")
public record GapAnalysisDTO(
        @Schema(description = "Every gap, interpolated or not") List<TemporalGapDTO> detectedGaps,
        @Schema(description = "Interpolated value at the midpoint of each gap no longer than the cap")
        Map<Instant, Double> interpolatedValues,
        @Schema(description = "1 - total gap time / observed span") double dataCompleteness,
        InterpolationQualityDTO interpolationQuality) {
}
