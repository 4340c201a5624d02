package org.jenkinsci.test_partitioner;

import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.assertEquals;

class CostTableTest {

    @Test
    void averageIsRoundedToOneDecimal() {
        assertEquals(20.0, CostTable.averageCost(List.of(10.0, 20.0, 30.0)));
        assertEquals(3.3, CostTable.averageCost(List.of(1.0, 2.0, 7.0)));
        assertEquals(0.2, CostTable.averageCost(List.of(0.25)));
    }

    @Test
    void noSampleMeansDefaultCost() {
        assertEquals(1, CostTable.averageCost(List.of()));
        CostTable costs = new CostTable(CostHistory.empty());
        assertEquals(1, costs.unitTestCost("gle_unit"));
        assertEquals(1, costs.regressCost("gap", "3"));
    }

    @Test
    void onlyMostRecentSamplesCount() {
        List<Double> samples = List.of(100.0, 100.0, 3.0, 4.0, 5.0, 6.0, 7.0, 8.0, 9.0, 10.0, 11.0, 12.0);
        assertEquals(7.5, CostTable.averageCost(samples));
    }

    @Test
    void regressNames() {
        assertEquals("3", CostTable.regressName("gap", "3"));
        assertEquals("3", CostTable.regressName("gst", "3"));
        assertEquals("3", CostTable.regressName("gus", "3"));
        assertEquals("regress3", CostTable.regressName("gle", "3"));
    }

    @Test
    void lookups() {
        CostTable costs = new CostTable(new CostHistory(
                Map.of("gle_unit", List.of(10.0, 20.0)),
                Map.of("gap", Map.of("4", List.of(50.0)), "gle", Map.of("regress4", List.of(7.0)))));
        assertEquals(15.0, costs.unitTestCost("gle_unit"));
        assertEquals(50.0, costs.regressCost("gap", "4"));
        assertEquals(7.0, costs.regressCost("gle", "4"));
        assertEquals(1, costs.regressCost("gle", "5"));
        assertEquals(1, costs.regressCost("gst", "4"));
    }
}
