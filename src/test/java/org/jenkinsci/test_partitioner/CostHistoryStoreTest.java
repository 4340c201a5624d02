package org.jenkinsci.test_partitioner;

import java.io.File;
import java.net.URISyntaxException;
import java.net.URL;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.TestInfo;
import org.junit.jupiter.api.io.TempDir;

import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.contains;
import static org.hamcrest.Matchers.empty;
import static org.hamcrest.Matchers.is;
import static org.junit.jupiter.api.Assertions.assertTrue;

class CostHistoryStoreTest {

    private File resourceDir;

    @BeforeEach
    void findResourceDir(TestInfo info) {
        URL url = getClass().getResource(getClass().getSimpleName() + "/" + info.getTestMethod().orElseThrow().getName());
        if (url == null) {
            return;
        }
        try {
            resourceDir = new File(url.toURI());
        } catch (URISyntaxException e) {
            resourceDir = new File(url.getPath());
        }
    }

    @Test
    void loadsSamples() {
        CostHistory history = CostHistoryStore.load(new File(resourceDir, "unittest_timecost.json").toPath(),
                new File(resourceDir, "integration_timecost.json").toPath());
        assertThat(history.unitTestSamples("gle_unit"), contains(10.0, 20.0, 30.0));
        assertThat(history.unitTestSamples("gpe_unit"), contains(5.0, 7.5));
        assertThat(history.regressSamples("gap", "3"), contains(100.0));
        assertThat(history.regressSamples("gle", "regress3"), contains(40.0, 60.0));
        assertThat(history.unitTestSamples("gse_unit"), empty());
        assertThat(history.regressSamples("gus", "1"), empty());
    }

    @Test
    void ignoresMalformedEntries() {
        CostHistory history = CostHistoryStore.load(new File(resourceDir, "unittest_timecost.json").toPath(),
                new File(resourceDir, "integration_timecost.json").toPath());
        assertThat(history.unitTestSamples("bad_unit"), contains(4.0));
        assertThat(history.unitTestSamples("scalar_unit"), empty());
        assertThat(history.regressSamples("broken", "5"), empty());
        assertThat(history.regressSamples("gle", "regress1"), contains(2.0));

        // NaN, infinities and numbers beyond the double range are dropped
        assertThat(history.unitTestSamples("nan_unit"), empty());
        assertThat(history.unitTestSamples("huge_unit"), contains(6.0));
        CostTable costs = new CostTable(history);
        assertThat(costs.unitTestCost("nan_unit"), is(CostTable.DEFAULT_COST));
        assertThat(costs.unitTestCost("huge_unit"), is(6.0));
        assertThat(costs.unitTestCost("scalar_unit"), is(CostTable.DEFAULT_COST));
    }

    @Test
    void missingFilesGiveEmptyHistory(@TempDir Path dir) {
        CostHistory history = CostHistoryStore.load(dir.resolve("unittest_timecost.json"), null);
        assertTrue(history.isEmpty());
    }

    @Test
    void unreadableFilesGiveEmptyHistory(@TempDir Path dir) throws Exception {
        Path ut = dir.resolve("unittest_timecost.json");
        Files.writeString(ut, "{\"gle_unit\": [1, 2", StandardCharsets.UTF_8);
        Path it = dir.resolve("integration_timecost.json");
        Files.writeString(it, "[1, 2]", StandardCharsets.UTF_8);
        CostHistory history = CostHistoryStore.load(ut, it);
        assertTrue(history.isEmpty());
        assertThat(history.unitTestSamples("gle_unit"), empty());
        assertThat(new CostTable(history).unitTestCost("gle_unit"), is(CostTable.DEFAULT_COST));
    }
}
