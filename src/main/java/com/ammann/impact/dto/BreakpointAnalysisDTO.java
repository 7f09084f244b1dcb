/* (C)2026 */
package com.ammann.impact.dto;

import java.util.List;
import org.eclipse.microprofile.openapi.annotations.media.Schema;

@Schema(description = "Breakpoints of a series and the segments they imply")
public record BreakpointAnalysisDTO(List<BreakpointDTO> changePoints, List<SegmentDTO> segments) {
}
