package org.jenkinsci.test_partitioner.algorithm;

import edu.umd.cs.findbugs.annotations.CheckForNull;
import edu.umd.cs.findbugs.annotations.NonNull;
import java.util.Arrays;
import java.util.Comparator;
import java.util.List;
import java.util.logging.Level;
import java.util.logging.Logger;
import java.util.stream.IntStream;
import org.jenkinsci.test_partitioner.TestEntity;

/**
 * Exhaustive depth-first search over all assignments, returning one with the smallest possible makespan.
 * <p>
 * Exponential in the worst case. Meant for small pools or to check the heuristics offline, and bounded by a
 * {@link SearchBudget}: when the budget runs out the best assignment found so far is kept, or the
 * {@link FirstFitDecreasing} result if none was complete yet.
 * </p>
 */
public class BranchAndBound extends PartitionAlgorithm {

    private static final Logger LOGGER = Logger.getLogger(BranchAndBound.class.getName());

    static final String NAME = "bruteforce";

    private final SearchBudget budget;

    public BranchAndBound(@NonNull SearchBudget budget) {
        this.budget = budget;
    }

    @NonNull
    @Override
    <T extends TestEntity> Partition<T> doPartition(@NonNull List<T> items, @NonNull double[] bias) {
        int n = bias.length;
        List<T> sorted = sortedByCost(items, false);
        double[] costs = new double[sorted.size()];
        for (int i = 0; i < costs.length; i++) {
            costs[i] = sorted.get(i).getCost();
        }

        AssignmentSearch search = new AssignmentSearch(costs, bias, budget.start());
        search.run();
        int[] assignment = search.getBest();
        if (search.isExhausted()) {
            LOGGER.warning(() -> "Search budget of " + budget.getMaxNodes() + " nodes exhausted after " + items.size()
                    + " items, " + (assignment == null ? "falling back to " + FirstFitDecreasing.NAME : "keeping the best assignment found so far"));
        }
        if (assignment == null) {
            return new FirstFitDecreasing().doPartition(items, bias);
        }
        LOGGER.log(Level.FINE, () -> "Makespan " + search.getBestMax() + " found after " + search.counter.getVisited() + " nodes");

        List<List<T>> groups = emptyGroups(n);
        double[] totals = bias.clone();
        for (int i = 0; i < assignment.length; i++) {
            groups.get(assignment[i]).add(sorted.get(i));
            totals[assignment[i]] += costs[i];
        }
        return new Partition<>(groups, totals);
    }

    /**
     * Search state: the slot totals, the slots ordered by ascending total, and the slot chosen for each item so far.
     * <p>
     * Trying a slot adds the item cost to its total and moves the slot right until the order is ascending again;
     * returning from the branch moves it back to its former position and restores the former total, so every branch
     * point sees exactly the state its parent saw.
     * </p>
     */
    static final class AssignmentSearch {
        private final double[] costs;
        private final double[] totals;
        private final int[] order;
        private final int[] assignment;
        private final double lowerBound;
        private final SearchBudget.Counter counter;
        @CheckForNull
        private int[] best;
        private double bestMax = Double.POSITIVE_INFINITY;

        AssignmentSearch(double[] costs, double[] bias, SearchBudget.Counter counter) {
            this.costs = costs;
            this.totals = bias.clone();
            this.order = IntStream.range(0, bias.length).boxed()
                    .sorted(Comparator.<Integer>comparingDouble(i -> bias[i]).thenComparingInt(i -> i))
                    .mapToInt(Integer::intValue).toArray();
            this.assignment = new int[costs.length];
            this.counter = counter;

            // no assignment can beat this, so the search may stop once it is reached
            double sum = Arrays.stream(costs).sum() + Arrays.stream(bias).sum();
            double maxBias = Arrays.stream(bias).max().orElse(0);
            double minBias = Arrays.stream(bias).min().orElse(0);
            double maxCost = Arrays.stream(costs).max().orElse(0);
            this.lowerBound = Math.max(Math.max(maxBias, minBias + maxCost), bias.length == 0 ? 0 : sum / bias.length);
        }

        void run() {
            if (order.length > 0) {
                search(0, Arrays.stream(totals).max().orElse(0));
            }
        }

        private void search(int item, double max) {
            if (!counter.visit() || bestMax <= lowerBound) {
                return;
            }
            if (item == costs.length) {
                if (max < bestMax) {
                    bestMax = max;
                    best = assignment.clone();
                }
                return;
            }
            double cost = costs[item];
            for (int p = 0; p < order.length; p++) {
                int slot = order[p];
                double previous = totals[slot];
                if (p > 0 && totals[order[p - 1]] == previous) {
                    // same total as the slot just tried, which leads to the same makespans
                    continue;
                }
                double total = previous + cost;
                if (total >= bestMax) {
                    // the remaining slots are at least as full
                    break;
                }
                assignment[item] = slot;
                totals[slot] = total;
                int q = moveRight(p);
                search(item + 1, Math.max(max, total));
                moveBack(q, p);
                totals[slot] = previous;
            }
        }

        /**
         * Moves the slot at position {@code p}, whose total just grew, behind every slot with a total not above it.
         * @return its new position
         */
        private int moveRight(int p) {
            int slot = order[p];
            int q = p;
            while (q + 1 < order.length && totals[order[q + 1]] <= totals[slot]) {
                order[q] = order[q + 1];
                q++;
            }
            order[q] = slot;
            return q;
        }

        /**
         * Reverts {@link #moveRight(int)}.
         */
        private void moveBack(int q, int p) {
            int slot = order[q];
            System.arraycopy(order, p, order, p + 1, q - p);
            order[p] = slot;
        }

        @CheckForNull
        int[] getBest() {
            return best == null ? null : best.clone();
        }

        double getBestMax() {
            return bestMax;
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
