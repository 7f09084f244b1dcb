/* (C)2026 */
package com.ammann.impact.dto;

import java.util.List;
import java.util.Map;
import org.eclipse.microprofile.openapi.annotations.media.Schema;

/**
 * Feature families derived from a series. Every feature sequence is aligned index for index
 * with the input points.
 */
@Schema(description = "Temporal features for downstream modeling")
public record TemporalFeatureSetDTO(
        Map<String, List<Double>> lagFeatures,
        Map<String, List<Double>> rollingFeatures,
        Map<String, List<Double>> seasonalFeatures,
        Map<String, List<Double>> trendFeatures) {
}
