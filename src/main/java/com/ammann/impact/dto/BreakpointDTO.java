/* (C)2026 */
package com.ammann.impact.dto;

import com.ammann.impact.enumeration.ChangeType;
import com.fasterxml.jackson.annotation.JsonInclude;
import java.time.Instant;
import org.eclipse.microprofile.openapi.annotations.media.Schema;

@Schema(description = "Location in a series where its mean or trend shifts")
@JsonInclude(JsonInclude.Include.NON_NULL)
public record BreakpointDTO(
        @Schema(description = "Index of the first point of the new regime") int location,
        @Schema(description = "Timestamp of that point, when known") Instant timestamp,
        @Schema(description = "Share of variance explained by splitting here, in [0, 1]") double confidence,
        @Schema(description = "Kind of change") ChangeType changeType) {
}
