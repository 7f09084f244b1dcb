/* (C)2026 */
package com.ammann.impact.dto;

import com.ammann.impact.model.TimeWindow;
import java.util.Map;
import org.eclipse.microprofile.openapi.annotations.media.Schema;

/**
 * Pre- and post-event windows for each requested size, with per-field statistics keyed
 * {@code pre_<size>} and {@code post_<size>}.
 */
@Schema(description = "Pre/post-event windows and their statistics")
public record SlidingWindowsDTO(
        @Schema(description = "Pre-event window per requested size") Map<String, TimeWindow> preEventWindows,
        @Schema(description = "Post-event window per requested size") Map<String, TimeWindow> postEventWindows,
        @Schema(description = "Per-field statistics keyed pre_<size> / post_<size>")
        Map<String, Map<String, WindowStatisticsDTO>> windowStatistics) {
}
