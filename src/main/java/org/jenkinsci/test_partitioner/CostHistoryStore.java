package org.jenkinsci.test_partitioner;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import edu.umd.cs.findbugs.annotations.CheckForNull;
import edu.umd.cs.findbugs.annotations.NonNull;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Reads the cost history files maintained by the pipeline. Never fails: anything that cannot be read counts as no history.
 */
public final class CostHistoryStore {

    private static final Logger LOGGER = Logger.getLogger(CostHistoryStore.class.getName());

    private static final ObjectMapper MAPPER = new ObjectMapper();

    /**
     * @param unitTestFile JSON object of unit test identifier to sample array
     * @param regressFile JSON object of regress type to an object of regress name to sample array
     */
    @NonNull
    public static CostHistory load(@CheckForNull Path unitTestFile, @CheckForNull Path regressFile) {
        Map<String, List<Double>> unitTests = new LinkedHashMap<>();
        JsonNode ut = read(unitTestFile);
        if (ut != null) {
            ut.fields().forEachRemaining(e -> unitTests.put(e.getKey(), samples(e.getValue(), e.getKey())));
        }
        Map<String, Map<String, List<Double>>> regressions = new LinkedHashMap<>();
        JsonNode it = read(regressFile);
        if (it != null) {
            it.fields().forEachRemaining(type -> {
                if (!type.getValue().isObject()) {
                    LOGGER.log(Level.FINE, () -> "Ignoring regress type " + type.getKey() + " which is not an object");
                    return;
                }
                Map<String, List<Double>> byName = new LinkedHashMap<>();
                type.getValue().fields().forEachRemaining(e -> byName.put(e.getKey(), samples(e.getValue(), type.getKey() + "/" + e.getKey())));
                regressions.put(type.getKey(), byName);
            });
        }
        return new CostHistory(unitTests, regressions);
    }

    @CheckForNull
    private static JsonNode read(@CheckForNull Path file) {
        if (file == null || !Files.isRegularFile(file)) {
            LOGGER.log(Level.FINE, () -> "No cost history at " + file);
            return null;
        }
        try {
            JsonNode node = MAPPER.readTree(file.toFile());
            if (node == null || !node.isObject()) {
                LOGGER.warning(() -> "Cost history " + file + " is not a JSON object, ignoring it");
                return null;
            }
            return node;
        } catch (IOException e) {
            LOGGER.log(Level.WARNING, "Failed to read cost history " + file + ", ignoring it", e);
            return null;
        }
    }

    /**
     * Samples are stored either as numbers or as the raw strings the timing reports contained.
     */
    private static List<Double> samples(JsonNode array, String key) {
        List<Double> result = new ArrayList<>();
        if (!array.isArray()) {
            LOGGER.log(Level.FINE, () -> "Ignoring samples of " + key + " which are not an array");
            return result;
        }
        for (JsonNode sample : array) {
            double value;
            if (sample.isNumber()) {
                value = sample.doubleValue();
            } else if (sample.isTextual()) {
                try {
                    value = Double.parseDouble(sample.textValue().trim());
                } catch (NumberFormatException e) {
                    LOGGER.log(Level.FINE, () -> "Skipping unparsable sample " + sample + " of " + key);
                    continue;
                }
            } else {
                LOGGER.log(Level.FINE, () -> "Skipping sample " + sample + " of " + key);
                continue;
            }
            if (!Double.isFinite(value)) {
                // NaN, Infinity, or a number out of the double range
                LOGGER.log(Level.FINE, () -> "Skipping non finite sample " + sample + " of " + key);
                continue;
            }
            result.add(value);
        }
        return result;
    }

    private CostHistoryStore() {}
}
