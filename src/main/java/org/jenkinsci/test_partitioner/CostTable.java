package org.jenkinsci.test_partitioner;

import com.google.common.collect.ImmutableSet;
import edu.umd.cs.findbugs.annotations.NonNull;
import java.math.BigDecimal;
import java.math.RoundingMode;
import java.util.List;

/**
 * Resolves tests to their averaged historical cost.
 */
public class CostTable {

    /**
     * Cost of a test that has never been recorded.
     */
    public static final double DEFAULT_COST = 1;

    /**
     * Number of most recent samples taken into account.
     */
    public static final int MAX_SAMPLES = 10;

    /**
     * Regress types whose history is keyed by the bare number rather than {@code regress<n>}.
     */
    static final ImmutableSet<String> BARE_NAME_TYPES = ImmutableSet.of("gap", "gst", "gus");

    private final CostHistory history;

    public CostTable(@NonNull CostHistory history) {
        this.history = history;
    }

    public double unitTestCost(@NonNull String identifier) {
        return averageCost(history.unitTestSamples(identifier));
    }

    public double regressCost(@NonNull String type, @NonNull String number) {
        return averageCost(history.regressSamples(type, regressName(type, number)));
    }

    public static String regressName(@NonNull String type, @NonNull String number) {
        return BARE_NAME_TYPES.contains(type) ? number : "regress" + number;
    }

    /**
     * Mean of the most recent samples rounded to one decimal, or {@link #DEFAULT_COST} if there are none.
     */
    public static double averageCost(@NonNull List<Double> samples) {
        if (samples.isEmpty()) {
            return DEFAULT_COST;
        }
        List<Double> recent = samples.subList(Math.max(0, samples.size() - MAX_SAMPLES), samples.size());
        double total = 0;
        for (double sample : recent) {
            total += sample;
        }
        return new BigDecimal(total / recent.size()).setScale(1, RoundingMode.HALF_EVEN).doubleValue();
    }
}
