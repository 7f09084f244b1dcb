/* (C)2026 */
package com.ammann.impact.dto;

import java.util.List;
import java.util.Map;
import org.eclipse.microprofile.openapi.annotations.media.Schema;

/**
 * Periodicity analysis of a single field.
 *
 * @param detectedPeriods         candidates whose strength exceeded the significance threshold
 * @param periodicityStrength     autocorrelation at each candidate lag, floored at 0
 * @param dominantFrequency       strongest candidate, the shortest one among equals
 * @param spectralDensity         periodogram for frequency bins 1..N/2
 * @param autocorrelationFunction autocorrelation for lags 0..min(N/4, max lag)
 */
@Schema(description = "Detected periodic structure of a metric")
public record PeriodicPatternsDTO(
        List<String> detectedPeriods,
        Map<String, Double> periodicityStrength,
        String dominantFrequency,
        List<Double> spectralDensity,
        List<Double> autocorrelationFunction) {
}
