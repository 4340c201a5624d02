package org.jenkinsci.test_partitioner.algorithm;

import com.google.common.base.Preconditions;
import edu.umd.cs.findbugs.annotations.NonNull;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Locale;
import org.jenkinsci.test_partitioner.ConfigurationException;
import org.jenkinsci.test_partitioner.TestEntity;

/**
 * Strategy splitting weighted items into a fixed number of groups so that the largest group total is as small as possible.
 * <p>
 * Implementations are deterministic: the same items in the same order always give the same partition.
 * </p>
 */
public abstract class PartitionAlgorithm {

    /**
     * System property selecting the algorithm used by the command line.
     */
    public static final String PROPERTY = "org.jenkinsci.test_partitioner.algorithm";

    /*package*/ PartitionAlgorithm() {}

    /**
     * @param items the items to distribute
     * @param bias capacity already used in each slot; its length is the number of slots
     * @return one group per slot; totals include the bias
     */
    @NonNull
    public final <T extends TestEntity> Partition<T> partition(@NonNull List<T> items, @NonNull double[] bias) {
        Preconditions.checkArgument(bias.length > 0 || items.isEmpty(), "%s items but no slot", items.size());
        return doPartition(items, bias.clone());
    }

    @NonNull
    abstract <T extends TestEntity> Partition<T> doPartition(@NonNull List<T> items, @NonNull double[] bias);

    /**
     * @return the name accepted by {@link #forName(String)}
     */
    @NonNull
    public abstract String getName();

    @Override
    public String toString() {
        return getName() + " algorithm";
    }

    public static PartitionAlgorithm getDefault() {
        return new FirstFitDecreasing();
    }

    /**
     * @param name {@code ffd}, {@code nearest} or {@code bruteforce}, or the legacy option numbers 1 to 3
     */
    @NonNull
    public static PartitionAlgorithm forName(@NonNull String name) throws ConfigurationException {
        switch (name.trim().toLowerCase(Locale.ROOT)) {
            case "1":
            case FirstFitDecreasing.NAME:
                return new FirstFitDecreasing();
            case "2":
            case NearestTarget.NAME:
                return new NearestTarget(SearchBudget.getDefault());
            case "3":
            case BranchAndBound.NAME:
                return new BranchAndBound(SearchBudget.getDefault());
            default:
                throw new ConfigurationException("Unknown partition algorithm: " + name);
        }
    }

    static <T extends TestEntity> List<T> sortedByCost(List<T> items, boolean descending) {
        List<T> sorted = new ArrayList<>(items);
        // stable, so equal costs keep the input order
        Comparator<T> order = descending ? Comparator.naturalOrder() : Comparator.comparingDouble(TestEntity::getCost);
        sorted.sort(order);
        return sorted;
    }

    static <T> List<List<T>> emptyGroups(int n) {
        List<List<T>> groups = new ArrayList<>(n);
        for (int i = 0; i < n; i++) {
            groups.add(new ArrayList<>());
        }
        return groups;
    }
}
