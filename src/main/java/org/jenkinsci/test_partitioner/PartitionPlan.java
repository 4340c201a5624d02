package org.jenkinsci.test_partitioner;

import com.google.common.collect.ImmutableList;
import edu.umd.cs.findbugs.annotations.NonNull;
import java.util.List;

/**
 * Final assignment of one run, in the order it is emitted to the pipeline.
 */
public final class PartitionPlan {

    private final ImmutableList<Slot> slots;
    private final String line;
    private final double maxUnitTotal;
    private final double maxRegressTotal;
    private final double maxTotal;

    PartitionPlan(@NonNull List<Slot> slots, @NonNull String line, double maxUnitTotal, double maxRegressTotal, double maxTotal) {
        this.slots = ImmutableList.copyOf(slots);
        this.line = line;
        this.maxUnitTotal = maxUnitTotal;
        this.maxRegressTotal = maxRegressTotal;
        this.maxTotal = maxTotal;
    }

    public List<Slot> getSlots() {
        return slots;
    }

    /**
     * @return the line printed for the pipeline
     */
    @NonNull
    public String getLine() {
        return line;
    }

    public double getMaxUnitTotal() {
        return maxUnitTotal;
    }

    public double getMaxRegressTotal() {
        return maxRegressTotal;
    }

    /**
     * @return the makespan
     */
    public double getMaxTotal() {
        return maxTotal;
    }

    @Override
    public String toString() {
        return line;
    }
}
