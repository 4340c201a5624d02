package org.jenkinsci.test_partitioner;

import com.google.common.base.Preconditions;
import edu.umd.cs.findbugs.annotations.NonNull;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Iterator;
import java.util.List;
import java.util.Random;

/**
 * One worker machine of the pipeline: an OS label and the tests it will run.
 */
public class Slot {

    /**
     * OS on which special tests must not run.
     */
    public static final String RESTRICTED_OS = "centos6";

    /**
     * Label prefix of the Kubernetes pod workers, on which special tests must not run either.
     */
    public static final String RESTRICTED_OS_PREFIX = "k8s";

    final int index;
    private String osLabel;
    private final List<UnitTest> unitTests = new ArrayList<>();
    private final List<RegressTest> regressTests = new ArrayList<>();

    Slot(int index, @NonNull String osLabel) {
        this.index = index;
        this.osLabel = osLabel;
    }

    /**
     * Creates {@code count} slots, assigning the labels round-robin.
     */
    public static List<Slot> create(int count, @NonNull List<String> osLabels) {
        Preconditions.checkArgument(count > 0, "slot count must be positive: %s", count);
        Preconditions.checkArgument(!osLabels.isEmpty(), "no OS label");
        List<Slot> slots = new ArrayList<>(count);
        for (int i = 0; i < count; i++) {
            slots.add(new Slot(i, osLabels.get(i % osLabels.size())));
        }
        return slots;
    }

    public static boolean isEligibleOs(@NonNull String osLabel) {
        return !osLabel.equals(RESTRICTED_OS) && !osLabel.startsWith(RESTRICTED_OS_PREFIX);
    }

    public int getIndex() {
        return index;
    }

    @NonNull
    public String getOsLabel() {
        return osLabel;
    }

    /**
     * Whether special tests may run here.
     */
    public boolean isEligible() {
        return isEligibleOs(osLabel);
    }

    /**
     * Exchanges the OS labels of the two slots, leaving their tests in place.
     */
    void swapOsLabel(@NonNull Slot other) {
        String label = osLabel;
        osLabel = other.osLabel;
        other.osLabel = label;
    }

    public List<UnitTest> getUnitTests() {
        return Collections.unmodifiableList(unitTests);
    }

    public List<RegressTest> getRegressTests() {
        return Collections.unmodifiableList(regressTests);
    }

    void addUnitTests(@NonNull List<? extends UnitTest> tests) {
        unitTests.addAll(tests);
    }

    void addRegressTests(@NonNull List<? extends RegressTest> tests) {
        regressTests.addAll(tests);
    }

    void clearUnitTests() {
        unitTests.clear();
    }

    /**
     * Removes and returns the special unit tests of this slot.
     */
    List<UnitTest> removeSpecialTests() {
        List<UnitTest> removed = new ArrayList<>();
        for (Iterator<UnitTest> it = unitTests.iterator(); it.hasNext(); ) {
            UnitTest test = it.next();
            if (test.isSpecial()) {
                it.remove();
                removed.add(test);
            }
        }
        return removed;
    }

    public int getSpecialCount() {
        int count = 0;
        for (UnitTest test : unitTests) {
            if (test.isSpecial()) {
                count++;
            }
        }
        return count;
    }

    /**
     * Rearranges both test lists; totals are unaffected.
     */
    void shuffle(@NonNull Random random) {
        Collections.shuffle(unitTests, random);
        Collections.shuffle(regressTests, random);
    }

    public double getUnitTotal() {
        return total(unitTests);
    }

    public double getRegressTotal() {
        return total(regressTests);
    }

    public double getTotal() {
        return getUnitTotal() + getRegressTotal();
    }

    private static double total(List<? extends TestEntity> tests) {
        double total = 0;
        for (TestEntity test : tests) {
            total += test.getCost();
        }
        return total;
    }

    @Override
    public String toString() {
        return "Slot{" + index + ", " + osLabel + ", ut=" + unitTests + ", it=" + regressTests + '}';
    }
}
