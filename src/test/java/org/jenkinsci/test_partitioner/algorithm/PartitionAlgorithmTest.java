package org.jenkinsci.test_partitioner.algorithm;

import java.util.ArrayList;
import java.util.Collections;
import java.util.IdentityHashMap;
import java.util.List;
import java.util.Map;
import java.util.Random;
import org.jenkinsci.test_partitioner.ConfigurationException;
import org.jenkinsci.test_partitioner.UnitTest;
import org.junit.jupiter.api.Test;

import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.instanceOf;
import static org.hamcrest.Matchers.lessThanOrEqualTo;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

class PartitionAlgorithmTest {

    @Test
    void forName() throws Exception {
        assertThat(PartitionAlgorithm.forName("ffd"), instanceOf(FirstFitDecreasing.class));
        assertThat(PartitionAlgorithm.forName(" Nearest "), instanceOf(NearestTarget.class));
        assertThat(PartitionAlgorithm.forName("BRUTEFORCE"), instanceOf(BranchAndBound.class));
        assertThat(PartitionAlgorithm.forName("1"), instanceOf(FirstFitDecreasing.class));
        assertThat(PartitionAlgorithm.forName("2"), instanceOf(NearestTarget.class));
        assertThat(PartitionAlgorithm.forName("3"), instanceOf(BranchAndBound.class));
        assertThrows(ConfigurationException.class, () -> PartitionAlgorithm.forName("best"));
        assertThat(PartitionAlgorithm.getDefault(), instanceOf(FirstFitDecreasing.class));
    }

    @Test
    void itemsWithoutSlotAreRejected() {
        List<UnitTest> items = List.of(new UnitTest("a", 1, false));
        assertThrows(IllegalArgumentException.class, () -> new FirstFitDecreasing().partition(items, new double[0]));
    }

    @Test
    void everyItemIsPlacedExactlyOnce() {
        Random random = new Random(42);
        List<PartitionAlgorithm> algorithms = List.of(
                new FirstFitDecreasing(), new NearestTarget(new SearchBudget(1_000_000)), new BranchAndBound(new SearchBudget(1_000_000)));
        for (int round = 0; round < 30; round++) {
            List<UnitTest> items = randomItems(random, random.nextInt(9));
            double[] bias = randomBias(random, 1 + random.nextInt(4));
            for (PartitionAlgorithm algorithm : algorithms) {
                Partition<UnitTest> p = algorithm.partition(items, bias);
                assertEquals(bias.length, p.size(), algorithm.getName());
                Map<UnitTest, Integer> seen = new IdentityHashMap<>();
                double placed = 0;
                for (int i = 0; i < p.size(); i++) {
                    double total = bias[i];
                    for (UnitTest item : p.getGroup(i)) {
                        seen.merge(item, 1, Integer::sum);
                        total += item.getCost();
                    }
                    assertEquals(total, p.getTotal(i), algorithm.getName() + " total of slot " + i);
                    placed += total - bias[i];
                }
                assertEquals(items.size(), seen.size(), algorithm.getName());
                assertEquals(Collections.nCopies(items.size(), 1), new ArrayList<>(seen.values()), algorithm.getName());
                assertEquals(sum(items), placed, algorithm.getName());
            }
        }
    }

    @Test
    void exhaustiveSearchIsNeverWorseThanHeuristics() {
        Random random = new Random(7);
        for (int round = 0; round < 30; round++) {
            List<UnitTest> items = randomItems(random, 1 + random.nextInt(8));
            double[] bias = randomBias(random, 1 + random.nextInt(3));
            double optimal = new BranchAndBound(new SearchBudget(10_000_000)).partition(items, bias).getMaxTotal();
            assertThat(optimal, lessThanOrEqualTo(new FirstFitDecreasing().partition(items, bias).getMaxTotal()));
            assertThat(optimal, lessThanOrEqualTo(new NearestTarget(new SearchBudget(10_000_000)).partition(items, bias).getMaxTotal()));
        }
    }

    private static List<UnitTest> randomItems(Random random, int count) {
        List<UnitTest> items = new ArrayList<>();
        for (int i = 0; i < count; i++) {
            // whole numbers keep the sums exact
            items.add(new UnitTest("t" + i, 1 + random.nextInt(20), false));
        }
        return items;
    }

    private static double[] randomBias(Random random, int slots) {
        double[] bias = new double[slots];
        for (int i = 0; i < slots; i++) {
            bias[i] = random.nextInt(6);
        }
        return bias;
    }

    private static double sum(List<UnitTest> items) {
        double total = 0;
        for (UnitTest item : items) {
            total += item.getCost();
        }
        return total;
    }
}
