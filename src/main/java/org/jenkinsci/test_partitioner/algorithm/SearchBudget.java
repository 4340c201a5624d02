package org.jenkinsci.test_partitioner.algorithm;

import com.google.common.base.Preconditions;

/**
 * Upper bound on the number of search nodes an exhaustive algorithm may visit in one call.
 */
public final class SearchBudget {

    public static final String PROPERTY = SearchBudget.class.getName() + ".maxNodes";

    static final long DEFAULT_MAX_NODES = 5_000_000L;

    private final long maxNodes;

    public SearchBudget(long maxNodes) {
        Preconditions.checkArgument(maxNodes > 0, "budget must be positive: %s", maxNodes);
        this.maxNodes = maxNodes;
    }

    public static SearchBudget getDefault() {
        return new SearchBudget(Long.getLong(PROPERTY, DEFAULT_MAX_NODES));
    }

    public long getMaxNodes() {
        return maxNodes;
    }

    Counter start() {
        return new Counter();
    }

    /**
     * Tracks one search. Once exhausted it stays exhausted.
     */
    final class Counter {
        private long visited;
        private boolean exhausted;

        /**
         * @return false if the node must not be expanded because the budget is used up
         */
        boolean visit() {
            if (exhausted) {
                return false;
            }
            if (++visited > maxNodes) {
                exhausted = true;
                return false;
            }
            return true;
        }

        boolean isExhausted() {
            return exhausted;
        }

        long getVisited() {
            return visited;
        }
    }

    @Override
    public String toString() {
        return "SearchBudget{maxNodes=" + maxNodes + '}';
    }
}
