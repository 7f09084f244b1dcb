/* (C)2026 */
package com.ammann.impact.dto;

import java.time.Instant;
import org.eclipse.microprofile.openapi.annotations.media.Schema;

/**
 * Interval between two consecutive readings that is longer than the expected sampling allows.
 *
 * @param start    timestamp of the reading before the gap
 * @param end      timestamp of the reading after the gap
 * @param duration formatted length, for example {@code 2h}
 */
@Schema(description = "Missing-data interval")
public record TemporalGapDTO(Instant start, Instant end, String duration) {
}
