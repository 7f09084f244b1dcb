/* (C)2026 */
package com.ammann.impact.dto;

import java.util.List;
import org.eclipse.microprofile.openapi.annotations.media.Schema;

/**
 * Two-sample comparison of one field between a before and an after window.
 *
 * @param meanDifference     mean(after) - mean(before)
 * @param tStatistic         pooled-variance t statistic
 * @param pValue             two-sided p-value
 * @param effectSize         Cohen's d, never negative
 * @param confidenceInterval 95 % interval of the mean difference, [lower, upper]
 * @param beforeCount        observations before
 * @param afterCount         observations after
 */
@Schema(description = "Statistical comparison of a field across two windows")
public record FieldComparisonDTO(
        double meanDifference,
        double tStatistic,
        double pValue,
        double effectSize,
        List<Double> confidenceInterval,
        int beforeCount,
        int afterCount) {
}
