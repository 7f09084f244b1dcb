/* (C)2026 */
package com.ammann.impact.dto;

import java.util.Map;
import org.eclipse.microprofile.openapi.annotations.media.Schema;

@Schema(description = "Recommended pre/post-event windows and how well they can reveal an effect")
public record OptimalEventWindowsDTO(
        EventWindowDTO preEventWindow,
        EventWindowDTO postEventWindow,
        @Schema(description = "Heuristic power within [0.5, 0.95]") double statisticalPower,
        @Schema(description = "Heuristic detectability within [0.3, 0.95]") double effectDetectability,
        @Schema(description = "Variance-ratio stationarity per side, empty when not requested")
        Map<String, Boolean> stationarityResults) {
}
