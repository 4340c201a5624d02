package org.jenkinsci.test_partitioner.algorithm;

import edu.umd.cs.findbugs.annotations.NonNull;
import java.util.List;
import java.util.PriorityQueue;
import org.jenkinsci.test_partitioner.TestEntity;

/**
 * Greedy first-fit-decreasing packing. Fast and good enough for any pool size, hence the default.
 */
public class FirstFitDecreasing extends PartitionAlgorithm {

    static final String NAME = "ffd";

    @NonNull
    @Override
    <T extends TestEntity> Partition<T> doPartition(@NonNull List<T> items, @NonNull double[] bias) {
        int n = bias.length;
        double[] totals = bias;
        List<List<T>> groups = emptyGroups(n);

        /*
            This packing problem is a NP-complete problem, so we solve
            this simply by a greedy algorithm. We pack heavier items first,
            and the result should be of roughly equal size
         */
        PriorityQueue<Integer> q = new PriorityQueue<>(Math.max(1, n), (a, b) -> {
            int c = Double.compare(totals[a], totals[b]);
            return c != 0 ? c : Integer.compare(a, b);
        });
        for (int i = 0; i < n; i++) {
            q.add(i);
        }
        for (T item : sortedByCost(items, true)) {
            int slot = q.poll();
            groups.get(slot).add(item);
            totals[slot] += item.getCost();
            q.add(slot);
        }
        return new Partition<>(groups, totals);
    }

    @NonNull
    @Override
    public String getName() {
        return NAME;
    }
}
