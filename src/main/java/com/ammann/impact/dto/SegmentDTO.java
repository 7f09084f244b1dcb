/* (C)2026 */
package com.ammann.impact.dto;

import com.ammann.impact.enumeration.TrendDirection;
import org.eclipse.microprofile.openapi.annotations.media.Schema;

/**
 * Contiguous run of points between breakpoints, {@code [start, end)}.
 */
@Schema(description = "Series segment between breakpoints")
public record SegmentDTO(int start, int end, TrendDirection trend, double slope) {
}
