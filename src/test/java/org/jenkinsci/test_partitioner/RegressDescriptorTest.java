package org.jenkinsci.test_partitioner;

import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;
import org.junit.jupiter.api.Test;

import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.contains;
import static org.hamcrest.Matchers.containsString;
import static org.hamcrest.Matchers.empty;
import static org.junit.jupiter.api.Assertions.assertThrows;

class RegressDescriptorTest {

    private final CostTable noHistory = new CostTable(CostHistory.empty());

    private static List<String> keys(List<RegressTest> tests) {
        return tests.stream().map(RegressTest::getKey).collect(Collectors.toList());
    }

    private static List<Double> costs(List<RegressTest> tests) {
        return tests.stream().map(RegressTest::getCost).collect(Collectors.toList());
    }

    @Test
    void oneRegressPerNumber() throws Exception {
        List<RegressTest> tests = RegressDescriptor.parse("gap: 1 2; case: 3", noHistory);
        assertThat(keys(tests), contains("gap 1", "gap 2", "case 3"));
        assertThat(costs(tests), contains(1.0, 1.0, 1.0));
    }

    @Test
    void costsAreLookedUpByRegressName() throws Exception {
        CostTable costs = new CostTable(new CostHistory(Map.of(),
                Map.of("gap", Map.of("1", List.of(12.0)), "case", Map.of("regress3", List.of(10.0, 20.0, 30.0)))));
        List<RegressTest> tests = RegressDescriptor.parse("gap: 1 2; case: 3", costs);
        assertThat(costs(tests), contains(12.0, 1.0, 20.0));
    }

    @Test
    void none() throws Exception {
        assertThat(RegressDescriptor.parse("none", noHistory), empty());
        assertThat(RegressDescriptor.parse("  none ", noHistory), empty());
        assertThat(RegressDescriptor.parse("", noHistory), empty());
    }

    @Test
    void emptyClausesAreSkipped() throws Exception {
        assertThat(keys(RegressDescriptor.parse(" ; gle:  4\t5 ;; ", noHistory)), contains("gle 4", "gle 5"));
        assertThat(RegressDescriptor.parse("gle:", noHistory), empty());
    }

    @Test
    void duplicatesAreListedOnce() throws Exception {
        assertThat(keys(RegressDescriptor.parse("gap: 1 1 2; case: 3; gap: 2 4", noHistory)), contains("gap 1", "gap 2", "case 3", "gap 4"));
    }

    @Test
    void clauseWithoutTypeSeparator() {
        ConfigurationException e = assertThrows(ConfigurationException.class, () -> RegressDescriptor.parse("gap: 1; gle 2 3", noHistory));
        assertThat(e.getMessage(), containsString("gle 2 3"));
        assertThrows(ConfigurationException.class, () -> RegressDescriptor.parse(": 2", noHistory));
    }

    @Test
    void delimitersAreRejected() {
        assertThrows(ConfigurationException.class, () -> RegressDescriptor.parse("gap: 1#2", noHistory));
        assertThrows(ConfigurationException.class, () -> RegressDescriptor.parse("g$$$p: 1", noHistory));
    }
}
