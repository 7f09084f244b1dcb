/* (C)2026 */
package com.ammann.impact.service;

import com.ammann.impact.dto.ChangePointSignificanceDTO;
import com.ammann.impact.dto.TestResultDTO;
import com.ammann.impact.enumeration.SignificanceTestType;
import com.ammann.impact.exception.ValidationException;
import com.ammann.impact.util.HypothesisTests;
import com.ammann.impact.util.SeriesMath;
import jakarta.enterprise.context.ApplicationScoped;
import org.eclipse.microprofile.config.inject.ConfigProperty;
import org.jboss.logging.Logger;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Random;

/**
 * Tests whether a hypothesized change point separates two samples with different means.
 *
 * <p>Resampling tests compare the observed absolute difference of means with an empirical null
 * distribution drawn from the pooled sample: PERMUTATION reshuffles it without replacement,
 * BOOTSTRAP draws with replacement. PARAMETRIC uses the pooled-variance t statistic. The
 * reported p-value is the smallest over the requested tests.
 *
 * <p>Every call uses its own {@link Random}; a non-negative configured seed makes results
 * reproducible.
 */
@ApplicationScoped
public class ChangePointSignificanceService
{
    private static final Logger LOG = Logger.getLogger(ChangePointSignificanceService.class);

    @ConfigProperty(name = "impact.significance.alpha", defaultValue = "0.05")
    double alpha = 0.05;

    @ConfigProperty(name = "impact.significance.resamples", defaultValue = "100")
    int resamples = 100;

    @ConfigProperty(name = "impact.significance.seed", defaultValue = "-1")
    long seed = -1;

    @ConfigProperty(name = "impact.significance.exact-p-values", defaultValue = "false")
    boolean exactPValues;

    public ChangePointSignificanceDTO testSignificance(double[] pre,
                                                       double[] post,
                                                       List<SignificanceTestType> tests)
    {
        if (tests == null || tests.isEmpty()) {
            throw ValidationException.missingParameter("significanceTests");
        }

        Map<String, TestResultDTO> results = new LinkedHashMap<>();
        double pValue = 1.0;
        Random random = seed >= 0 ? new Random(seed) : new Random();

        for (SignificanceTestType test : tests) {
            TestResultDTO result = run(test, pre, post, random);
            results.put(test.key(), result);
            pValue = Math.min(pValue, result.pValue());
        }

        double effectSize = HypothesisTests.averageVarianceEffectSize(pre, post);
        boolean significant = pValue < alpha;

        LOG.infof("Change point significance (pre=%d, post=%d): p=%.4f, effect=%.3f, significant=%s",
                pre.length, post.length, pValue, effectSize, significant);
        return new ChangePointSignificanceDTO(significant, pValue, effectSize, 1.0 - pValue, results);
    }

    TestResultDTO run(SignificanceTestType test, double[] pre, double[] post, Random random)
    {
        if (pre.length == 0 || post.length == 0) {
            return new TestResultDTO(1.0, 0.0);
        }
        return switch (test) {
            case PERMUTATION -> resamplingTest(pre, post, random, false);
            case BOOTSTRAP -> resamplingTest(pre, post, random, true);
            case PARAMETRIC -> parametricTest(pre, post);
        };
    }

    private TestResultDTO resamplingTest(double[] pre, double[] post, Random random, boolean withReplacement)
    {
        double observed = Math.abs(SeriesMath.mean(post) - SeriesMath.mean(pre));

        double[] pooled = new double[pre.length + post.length];
        System.arraycopy(pre, 0, pooled, 0, pre.length);
        System.arraycopy(post, 0, pooled, pre.length, post.length);

        double[] sample = new double[pooled.length];
        int extreme = 0;
        for (int r = 0; r < resamples; r++) {
            if (withReplacement) {
                for (int i = 0; i < sample.length; i++) {
                    sample[i] = pooled[random.nextInt(pooled.length)];
                }
            } else {
                System.arraycopy(pooled, 0, sample, 0, pooled.length);
                shuffle(sample, random);
            }
            double difference = Math.abs(SeriesMath.mean(sample, pre.length, sample.length)
                    - SeriesMath.mean(sample, 0, pre.length));
            if (difference >= observed) {
                extreme++;
            }
        }

        double pValue = resamples > 0 ? (double) extreme / resamples : 1.0;
        return new TestResultDTO(pValue, observed);
    }

    private TestResultDTO parametricTest(double[] pre, double[] post)
    {
        double pooledVariance = HypothesisTests.pooledVariance(pre, post);
        double se = HypothesisTests.standardError(pooledVariance, pre.length, post.length);
        double t = HypothesisTests.tStatistic(SeriesMath.mean(post) - SeriesMath.mean(pre), se);
        double pValue = exactPValues
                ? HypothesisTests.exactTwoSidedPValue(t, pre.length + post.length - 2.0)
                : HypothesisTests.coarsePValue(t);
        return new TestResultDTO(pValue, Math.abs(t));
    }

    // Fisher-Yates
    private static void shuffle(double[] values, Random random)
    {
        for (int i = values.length - 1; i > 0; i--) {
            int j = random.nextInt(i + 1);
            double tmp = values[i];
            values[i] = values[j];
            values[j] = tmp;
        }
    }
}
