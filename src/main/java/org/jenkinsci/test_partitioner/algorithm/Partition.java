package org.jenkinsci.test_partitioner.algorithm;

import com.google.common.base.Preconditions;
import com.google.common.collect.ImmutableList;
import edu.umd.cs.findbugs.annotations.NonNull;
import java.util.Arrays;
import java.util.List;
import org.jenkinsci.test_partitioner.TestEntity;

/**
 * Groups produced by a {@link PartitionAlgorithm}, one per slot, with the slot totals including the initial bias.
 */
public final class Partition<T extends TestEntity> {

    private final ImmutableList<ImmutableList<T>> groups;
    private final double[] totals;

    Partition(@NonNull List<? extends List<T>> groups, @NonNull double[] totals) {
        Preconditions.checkArgument(groups.size() == totals.length, "%s groups but %s totals", groups.size(), totals.length);
        ImmutableList.Builder<ImmutableList<T>> b = ImmutableList.builder();
        for (List<T> group : groups) {
            b.add(ImmutableList.copyOf(group));
        }
        this.groups = b.build();
        this.totals = totals.clone();
    }

    public int size() {
        return groups.size();
    }

    @NonNull
    public List<T> getGroup(int slot) {
        return groups.get(slot);
    }

    @NonNull
    public List<ImmutableList<T>> getGroups() {
        return groups;
    }

    public double getTotal(int slot) {
        return totals[slot];
    }

    @NonNull
    public double[] getTotals() {
        return totals.clone();
    }

    /**
     * @return the makespan, 0 if there are no slots
     */
    public double getMaxTotal() {
        return Arrays.stream(totals).max().orElse(0);
    }

    @Override
    public String toString() {
        return groups + " " + Arrays.toString(totals);
    }
}
