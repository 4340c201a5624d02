package org.jenkinsci.test_partitioner.algorithm;

import edu.umd.cs.findbugs.annotations.NonNull;
import java.util.ArrayList;
import java.util.List;
import java.util.logging.Logger;
import org.jenkinsci.test_partitioner.TestEntity;

/**
 * Fills the slots one after another with the subset of the remaining items whose cost is nearest to the average
 * still owed to each slot. The last slot takes whatever is left.
 * <p>
 * The subset search is exact and exponential in the pool size, so it is bounded by a {@link SearchBudget}.
 * It is a heuristic overall: it may do worse than {@link FirstFitDecreasing}.
 * </p>
 */
public class NearestTarget extends PartitionAlgorithm {

    private static final Logger LOGGER = Logger.getLogger(NearestTarget.class.getName());

    static final String NAME = "nearest";

    private final SearchBudget budget;

    public NearestTarget(@NonNull SearchBudget budget) {
        this.budget = budget;
    }

    @NonNull
    @Override
    <T extends TestEntity> Partition<T> doPartition(@NonNull List<T> items, @NonNull double[] bias) {
        int n = bias.length;
        double[] totals = bias.clone();
        List<List<T>> groups = emptyGroups(n);
        if (n == 0) {
            return new Partition<>(groups, totals);
        }

        List<T> pool = sortedByCost(items, false);
        double remaining = sum(pool);
        for (double b : bias) {
            remaining += b;
        }
        for (int i = 0; i < n - 1; i++) {
            double target = remaining / (n - i) - bias[i];
            double nearest = 0;
            if (target > 0 && !pool.isEmpty()) {
                SubsetSearch search = new SubsetSearch(pool, target, budget.start());
                search.run();
                if (search.isExhausted()) {
                    int slot = i;
                    LOGGER.warning(() -> "Search budget of " + budget.getMaxNodes() + " nodes exhausted for slot " + slot
                            + ", keeping the nearest subset found so far");
                }
                boolean[] best = search.getBest();
                List<T> rest = new ArrayList<>();
                for (int j = 0; j < pool.size(); j++) {
                    if (best[j]) {
                        groups.get(i).add(pool.get(j));
                    } else {
                        rest.add(pool.get(j));
                    }
                }
                nearest = search.getBestSum();
                pool = rest;
            }
            totals[i] += nearest;
            remaining -= nearest + bias[i];
        }
        groups.get(n - 1).addAll(pool);
        totals[n - 1] += sum(pool);
        return new Partition<>(groups, totals);
    }

    private static double sum(List<? extends TestEntity> items) {
        double total = 0;
        for (TestEntity item : items) {
            total += item.getCost();
        }
        return total;
    }

    /**
     * Nearest subset-sum search over an ascending cost array.
     * <p>
     * Each index is first left out, then taken. A partial sum that has reached the target is never extended, since
     * every further item moves it away. Only a strictly nearer sum replaces the best one, so ties go to the subset
     * found first; the empty subset is the initial candidate.
     * </p>
     */
    static final class SubsetSearch {
        private final double[] costs;
        private final double target;
        private final SearchBudget.Counter counter;
        /** Current branch; an index is set while it is part of the partial subset and reverted on return. */
        private final boolean[] chosen;
        private boolean[] best;
        private double bestSum;

        SubsetSearch(List<? extends TestEntity> pool, double target, SearchBudget.Counter counter) {
            this.costs = new double[pool.size()];
            for (int i = 0; i < costs.length; i++) {
                costs[i] = pool.get(i).getCost();
            }
            this.target = target;
            this.counter = counter;
            this.chosen = new boolean[costs.length];
            this.best = new boolean[costs.length];
        }

        void run() {
            search(0, 0);
        }

        private void search(int index, double sum) {
            if (!counter.visit()) {
                return;
            }
            if (index == costs.length || sum >= target) {
                if (Math.abs(sum - target) < Math.abs(bestSum - target)) {
                    bestSum = sum;
                    best = chosen.clone();
                }
                return;
            }
            search(index + 1, sum);
            chosen[index] = true;
            search(index + 1, sum + costs[index]);
            chosen[index] = false;
        }

        boolean[] getBest() {
            return best.clone();
        }

        double getBestSum() {
            return bestSum;
        }

        boolean isExhausted() {
            return counter.isExhausted();
        }
    }

    @NonNull
    @Override
    public String getName() {
        return NAME;
    }
}
