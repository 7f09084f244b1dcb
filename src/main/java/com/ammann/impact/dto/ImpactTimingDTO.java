/* (C)2026 */
package com.ammann.impact.dto;

import java.time.Instant;
import org.eclipse.microprofile.openapi.annotations.media.Schema;

/**
 * Onset and recovery timing of an event's impact on a metric.
 *
 * <p>Recovery times are measured from the event timestamp and reported as
 * {@value #NOT_RECOVERED} when the threshold is never reached.
 */
@Schema(description = "Impact onset and recovery timing relative to the pre-event baseline")
public record ImpactTimingDTO(
        @Schema(description = "Mean of the pre-event values") double baseline,
        ImpactOnset impactOnset,
        RecoveryTiming recoveryTiming,
        @Schema(description = "Time from onset to full recovery, or to the last reading") String impactDuration,
        @Schema(description = "Baseline-to-extreme distance recovered per hour") double recoveryRate,
        @Schema(description = "|baseline - extreme| / |baseline|") double impactSeverity) {

    public static final String NOT_RECOVERED = "not_recovered";

    /**
     * @param detected  whether any post-event reading deviated beyond the onset threshold
     * @param delay     time from the event to the onset
     * @param timestamp onset timestamp, the event timestamp when nothing was detected
     */
    public record ImpactOnset(boolean detected, String delay, Instant timestamp) {
    }

    public record RecoveryTiming(String fullRecoveryTime, String partialRecoveryTime) {
    }
}
