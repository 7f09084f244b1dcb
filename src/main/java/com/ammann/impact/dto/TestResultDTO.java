/* (C)2026 */
package com.ammann.impact.dto;

import org.eclipse.microprofile.openapi.annotations.media.Schema;

@Schema(description = "Outcome of one significance test")
public record TestResultDTO(
        @Schema(description = "p-value of the test") double pValue,
        @Schema(description = "Observed statistic: |mean difference| for resampling tests, |t| for the parametric test")
        double statistic) {
}
