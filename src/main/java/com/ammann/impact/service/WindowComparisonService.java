/* (C)2026 */
package com.ammann.impact.service;

import com.ammann.impact.dto.FieldComparisonDTO;
import com.ammann.impact.dto.WindowComparisonDTO;
import com.ammann.impact.enumeration.ImpactMagnitude;
import com.ammann.impact.util.HypothesisTests;
import com.ammann.impact.util.SeriesMath;
import jakarta.enterprise.context.ApplicationScoped;
import org.eclipse.microprofile.config.inject.ConfigProperty;
import org.jboss.logging.Logger;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Compares metric values between a "before" and an "after" window with a pooled-variance
 * two-sample t-test and Cohen's d.
 */
@ApplicationScoped
public class WindowComparisonService
{
    private static final Logger LOG = Logger.getLogger(WindowComparisonService.class);

    private static final double Z_95 = 1.96;

    @ConfigProperty(name = "impact.significance.alpha", defaultValue = "0.05")
    double alpha = 0.05;

    @ConfigProperty(name = "impact.significance.exact-p-values", defaultValue = "false")
    boolean exactPValues;

    /**
     * Compares every field present in {@code before}. A field missing from {@code after} is
     * compared against an empty sample.
     */
    public WindowComparisonDTO compare(Map<String, double[]> before, Map<String, double[]> after)
    {
        Map<String, FieldComparisonDTO> comparisons = new LinkedHashMap<>();
        int significant = 0;
        double effectSum = 0.0;

        for (Map.Entry<String, double[]> entry : before.entrySet()) {
            FieldComparisonDTO comparison = compareField(entry.getValue(), after.getOrDefault(entry.getKey(), new double[0]));
            comparisons.put(entry.getKey(), comparison);
            if (comparison.pValue() < alpha) {
                significant++;
            }
            effectSum += Math.abs(comparison.effectSize());
        }

        double meanEffect = comparisons.isEmpty() ? 0.0 : effectSum / comparisons.size();
        ImpactMagnitude magnitude = ImpactMagnitude.fromEffectSize(meanEffect);

        LOG.infof("Compared %d field(s): %d significant, mean effect size %.3f (%s)",
                comparisons.size(), significant, meanEffect, magnitude);
        return new WindowComparisonDTO(comparisons, significant > 0, magnitude);
    }

    public FieldComparisonDTO compareField(double[] before, double[] after)
    {
        int n1 = before.length;
        int n2 = after.length;
        if (n1 == 0 || n2 == 0) {
            LOG.debugf("Nothing to compare (before=%d, after=%d values)", n1, n2);
            return new FieldComparisonDTO(0.0, 0.0, 1.0, 0.0, List.of(0.0, 0.0), n1, n2);
        }

        double meanDifference = SeriesMath.mean(after) - SeriesMath.mean(before);
        double pooledVariance = HypothesisTests.pooledVariance(before, after);
        double se = HypothesisTests.standardError(pooledVariance, n1, n2);
        double t = HypothesisTests.tStatistic(meanDifference, se);
        double pValue = exactPValues
                ? HypothesisTests.exactTwoSidedPValue(t, n1 + n2 - 2.0)
                : HypothesisTests.coarsePValue(t);
        double effectSize = HypothesisTests.cohensD(meanDifference, pooledVariance);
        double margin = Z_95 * se;

        return new FieldComparisonDTO(meanDifference, t, pValue, effectSize,
                List.of(meanDifference - margin, meanDifference + margin), n1, n2);
    }
}
