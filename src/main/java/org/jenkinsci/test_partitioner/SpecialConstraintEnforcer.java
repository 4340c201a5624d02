package org.jenkinsci.test_partitioner;

import edu.umd.cs.findbugs.annotations.NonNull;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import java.util.Random;
import java.util.logging.Level;
import java.util.logging.Logger;
import org.jenkinsci.test_partitioner.algorithm.Partition;
import org.jenkinsci.test_partitioner.algorithm.PartitionAlgorithm;

/**
 * Distributes the unit tests over the slots so that special tests only land on slots with an eligible OS.
 * <p>
 * Special tests are partitioned over the eligible slots first and the other tests over all slots on top of them.
 * Slots that still end up with special tests on a restricted OS are repaired by exchanging OS labels with slots that
 * have no special test, then by repartitioning a reshuffled pool a few times, and finally by moving the offending
 * tests to the next eligible slot, which may unbalance the totals.
 * </p>
 */
public class SpecialConstraintEnforcer {

    private static final Logger LOGGER = Logger.getLogger(SpecialConstraintEnforcer.class.getName());

    /**
     * Number of repartitioning attempts after the first one.
     */
    static final int MAX_RESHUFFLES = 3;

    /**
     * How the constraint ended up being met.
     * <p>
     * Since special tests are only ever partitioned over eligible slots, {@link #enforce} finds no invalid slot as
     * soon as one slot is eligible, and finds no slot to swap with or relocate to otherwise. {@link #SWAPPED},
     * {@link #RESHUFFLED} and {@link #RELOCATED} are therefore not returned by {@link #enforce} while that holds.
     * </p>
     */
    public enum Resolution {
        /** No slot was invalid after the first partitioning. */
        SATISFIED,
        /** Exchanging OS labels was enough. */
        SWAPPED,
        /** A reshuffled pool was partitioned without violation. */
        RESHUFFLED,
        /** Special tests had to be moved to another slot. */
        RELOCATED,
        /** Some special tests remain on restricted slots because no slot is eligible. */
        UNSATISFIABLE
    }

    private final PartitionAlgorithm algorithm;
    private final Random random;
    private final TraceLog log;

    public SpecialConstraintEnforcer(@NonNull PartitionAlgorithm algorithm, @NonNull Random random, @NonNull TraceLog log) {
        this.algorithm = algorithm;
        this.random = random;
        this.log = log;
    }

    /**
     * Replaces the unit tests of the given slots with a partition of {@code tests}, and may exchange their OS labels.
     *
     * @param tests all unit tests, special or not
     * @param slots the slots in index order
     */
    @NonNull
    public Resolution enforce(@NonNull List<UnitTest> tests, @NonNull List<Slot> slots) {
        assign(tests, slots);
        log.println("start to handle special unit tests");
        List<Slot> invalid = invalidSlots(slots);
        if (invalid.isEmpty()) {
            return Resolution.SATISFIED;
        }
        invalid = swapLabels(slots, invalid);
        if (invalid.isEmpty()) {
            return Resolution.SWAPPED;
        }

        List<UnitTest> pool = new ArrayList<>(tests);
        for (int attempt = 1; attempt <= MAX_RESHUFFLES; attempt++) {
            log.println("Special cases are not satisfied, so split unit test groups again (attempt " + attempt + ")");
            Collections.shuffle(pool, random);
            assign(pool, slots);
            invalid = swapLabels(slots, invalidSlots(slots));
            if (invalid.isEmpty()) {
                return Resolution.RESHUFFLED;
            }
        }

        String message = "Special cases are still not satisfied after " + MAX_RESHUFFLES + " retries, moving special tests off slots "
                + indices(invalid);
        LOGGER.warning(message);
        log.println("WARNING: " + message);
        relocate(slots, invalid);
        invalid = invalidSlots(slots);
        if (invalid.isEmpty()) {
            return Resolution.RELOCATED;
        }
        message = "No slot with an eligible OS, special tests remain on slots " + indices(invalid);
        LOGGER.warning(message);
        log.println("WARNING: " + message);
        return Resolution.UNSATISFIABLE;
    }

    /**
     * Partitions the special tests over the eligible slots, then the others over all slots biased by the former.
     */
    void assign(@NonNull List<UnitTest> tests, @NonNull List<Slot> slots) {
        List<UnitTest> special = new ArrayList<>();
        List<UnitTest> normal = new ArrayList<>();
        for (UnitTest test : tests) {
            (test.isSpecial() ? special : normal).add(test);
        }
        List<Integer> eligible = new ArrayList<>();
        for (int i = 0; i < slots.size(); i++) {
            slots.get(i).clearUnitTests();
            if (slots.get(i).isEligible()) {
                eligible.add(i);
            }
        }

        double[] bias = new double[slots.size()];
        Partition<UnitTest> specialPartition = null;
        if (!eligible.isEmpty()) {
            specialPartition = algorithm.partition(special, new double[eligible.size()]);
            for (int j = 0; j < eligible.size(); j++) {
                bias[eligible.get(j)] = specialPartition.getTotal(j);
            }
            log.println("special unit test groups: " + specialPartition.getGroups());
        } else if (!special.isEmpty()) {
            LOGGER.log(Level.FINE, "No eligible slot for {0} special tests", special.size());
            normal = new ArrayList<>(tests);
        }

        Partition<UnitTest> partition = algorithm.partition(normal, bias);
        for (int i = 0; i < slots.size(); i++) {
            slots.get(i).addUnitTests(partition.getGroup(i));
        }
        if (specialPartition != null) {
            for (int j = 0; j < eligible.size(); j++) {
                slots.get(eligible.get(j)).addUnitTests(specialPartition.getGroup(j));
            }
        }
        List<List<UnitTest>> groups = new ArrayList<>();
        for (Slot slot : slots) {
            groups.add(slot.getUnitTests());
        }
        log.println(groups.toString());
        log.println(Arrays.toString(partition.getTotals()));
    }

    /**
     * Slots holding special tests while their OS is restricted.
     */
    static List<Slot> invalidSlots(@NonNull List<Slot> slots) {
        List<Slot> invalid = new ArrayList<>();
        for (Slot slot : slots) {
            if (slot.getSpecialCount() > 0 && !slot.isEligible()) {
                invalid.add(slot);
            }
        }
        return invalid;
    }

    /**
     * Pairs the invalid slots with slots that have an eligible OS and no special test, and exchanges their labels.
     *
     * @return the invalid slots left without a partner
     */
    List<Slot> swapLabels(@NonNull List<Slot> slots, @NonNull List<Slot> invalid) {
        List<Slot> usable = new ArrayList<>();
        for (Slot slot : slots) {
            if (slot.getSpecialCount() == 0 && slot.isEligible()) {
                usable.add(slot);
            }
        }
        int pairs = Math.min(invalid.size(), usable.size());
        for (int i = 0; i < pairs; i++) {
            Slot from = invalid.get(i);
            Slot to = usable.get(i);
            log.println("swap OS of slot " + from.getIndex() + " (" + from.getOsLabel() + ") with slot " + to.getIndex() + " (" + to.getOsLabel() + ")");
            from.swapOsLabel(to);
        }
        List<Slot> remaining = new ArrayList<>(invalid.subList(pairs, invalid.size()));
        log.println("invalid slots: " + indices(remaining));
        return remaining;
    }

    /**
     * Moves the special tests of each invalid slot to the next eligible slot, wrapping around.
     */
    void relocate(@NonNull List<Slot> slots, @NonNull List<Slot> invalid) {
        int n = slots.size();
        for (Slot slot : invalid) {
            int from = slots.indexOf(slot);
            Slot target = null;
            for (int k = 1; k < n && target == null; k++) {
                Slot candidate = slots.get((from + k) % n);
                if (candidate.isEligible()) {
                    target = candidate;
                }
            }
            if (target == null) {
                continue;
            }
            List<UnitTest> moved = slot.removeSpecialTests();
            target.addUnitTests(moved);
            log.println("moved " + moved + " from slot " + slot.getIndex() + " to slot " + target.getIndex());
        }
    }

    private static List<Integer> indices(List<Slot> slots) {
        List<Integer> indices = new ArrayList<>();
        for (Slot slot : slots) {
            indices.add(slot.getIndex());
        }
        return indices;
    }
}
