/* (C)2026 */
package com.ammann.impact.dto;

import java.time.Instant;
import org.eclipse.microprofile.openapi.annotations.media.Schema;

@Schema(description = "Analysis window on one side of an event")
public record EventWindowDTO(
        @Schema(description = "Formatted window length") String duration,
        Instant start,
        Instant end) {
}
