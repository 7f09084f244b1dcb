/* (C)2026 */
package com.ammann.impact.dto;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import java.time.Instant;
import org.eclipse.microprofile.openapi.annotations.media.Schema;

/**
 * One temporal aggregation bucket. Statistics that were not requested are {@code null} and
 * omitted from JSON.
 */
@Schema(description = "Aggregated statistics of one time bucket")
@JsonInclude(JsonInclude.Include.NON_NULL)
public record AggregationBucketDTO(
        @Schema(description = "Inclusive bucket start") Instant timestamp,
        @Schema(description = "Values in the bucket") int count,
        Double mean,
        @JsonProperty("weighted_mean") Double weightedMean,
        Double median,
        @JsonProperty("percentile_95") Double percentile95) {
}
