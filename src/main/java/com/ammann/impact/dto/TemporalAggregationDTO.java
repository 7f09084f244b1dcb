/* (C)2026 */
package com.ammann.impact.dto;

import java.util.List;
import java.util.Map;
import org.eclipse.microprofile.openapi.annotations.media.Schema;

@Schema(description = "Buckets per requested resolution")
public record TemporalAggregationDTO(String field, Map<String, List<AggregationBucketDTO>> resolutions) {

    /** Buckets of one resolution, empty when the resolution was not requested. */
    public List<AggregationBucketDTO> buckets(String resolution) {
        return resolutions.getOrDefault(resolution, List.of());
    }
}
