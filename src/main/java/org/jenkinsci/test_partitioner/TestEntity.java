package org.jenkinsci.test_partitioner;

import edu.umd.cs.findbugs.annotations.NonNull;
import edu.umd.cs.findbugs.annotations.SuppressFBWarnings;

/**
 * A schedulable test item together with its averaged historical cost.
 */
@SuppressFBWarnings(value="EQ_COMPARETO_USE_OBJECT_EQUALS", justification="Ordering is only used for sorting by cost, identity is by reference.")
public abstract class TestEntity implements Comparable<TestEntity> {

    final double cost;

    TestEntity(double cost) {
        this.cost = cost;
    }

    public double getCost() {
        return cost;
    }

    /**
     * Whether this item may only run on a slot with an eligible OS.
     */
    public boolean isSpecial() {
        return false;
    }

    @Override
    public int compareTo(TestEntity that) {
        // sort them in the descending order
        return Double.compare(that.cost, this.cost);
    }

    /**
     * @return the identifier printed in the trace, e.g. {@code gle_unit} or {@code gap 3}
     */
    @NonNull
    public abstract String getKey();

    @Override
    public String toString() {
        return getKey();
    }
}
