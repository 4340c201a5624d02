package org.jenkinsci.test_partitioner.algorithm;

import java.util.List;
import org.jenkinsci.test_partitioner.UnitTest;
import org.junit.jupiter.api.Test;

import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.containsInAnyOrder;
import static org.hamcrest.Matchers.empty;
import static org.junit.jupiter.api.Assertions.assertArrayEquals;
import static org.junit.jupiter.api.Assertions.assertEquals;

class BranchAndBoundTest {

    private final BranchAndBound bruteForce = new BranchAndBound(new SearchBudget(1_000_000));

    private static UnitTest test(String name, double cost) {
        return new UnitTest(name, cost, false);
    }

    @Test
    void beatsGreedyPacking() {
        UnitTest a = test("a", 3), b = test("b", 3), c = test("c", 2), d = test("d", 2), e = test("e", 2);
        List<UnitTest> items = List.of(a, b, c, d, e);
        assertEquals(7, new FirstFitDecreasing().partition(items, new double[2]).getMaxTotal());

        Partition<UnitTest> p = bruteForce.partition(items, new double[2]);
        assertEquals(6, p.getMaxTotal());
        assertArrayEquals(new double[] {6, 6}, p.getTotals());
    }

    @Test
    void takesBiasIntoAccount() {
        UnitTest a = test("a", 4), b = test("b", 3), c = test("c", 1);
        Partition<UnitTest> p = bruteForce.partition(List.of(a, b, c), new double[] {5, 0, 2});
        assertEquals(5, p.getMaxTotal());
        assertThat(p.getGroup(0), empty());
        assertThat(p.getGroup(1), containsInAnyOrder(a, c));
        assertThat(p.getGroup(2), containsInAnyOrder(b));
    }

    @Test
    void moreSlotsThanItems() {
        UnitTest a = test("a", 4), b = test("b", 3);
        Partition<UnitTest> p = bruteForce.partition(List.of(a, b), new double[4]);
        assertEquals(4, p.getMaxTotal());
        assertEquals(2, p.getGroups().stream().filter(List::isEmpty).count());
    }

    @Test
    void exhaustedBudgetFallsBackToGreedy() {
        UnitTest a = test("a", 3), b = test("b", 3), c = test("c", 2), d = test("d", 2), e = test("e", 2);
        List<UnitTest> items = List.of(a, b, c, d, e);
        Partition<UnitTest> p = new BranchAndBound(new SearchBudget(1)).partition(items, new double[2]);
        assertEquals(new FirstFitDecreasing().partition(items, new double[2]).getGroups(), p.getGroups());
    }

    @Test
    void searchStopsAtLowerBound() {
        BranchAndBound.AssignmentSearch search = new BranchAndBound.AssignmentSearch(new double[] {1, 1, 1, 1}, new double[2], new SearchBudget(1000).start());
        search.run();
        assertEquals(2, search.getBestMax());
        assertArrayEquals(new int[] {0, 1, 0, 1}, search.getBest());
    }
}
