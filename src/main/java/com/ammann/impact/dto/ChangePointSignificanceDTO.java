/* (C)2026 */
package com.ammann.impact.dto;

import java.util.Map;
import org.eclipse.microprofile.openapi.annotations.media.Schema;

@Schema(description = "Significance of a hypothesized change point")
public record ChangePointSignificanceDTO(
        @Schema(description = "pValue below the significance level") boolean isSignificant,
        @Schema(description = "Smallest p-value across the requested tests") double pValue,
        @Schema(description = "Standardized mean difference between the two sides") double effectSize,
        @Schema(description = "1 - pValue") double confidenceLevel,
        @Schema(description = "Result per requested test") Map<String, TestResultDTO> testResults) {
}
