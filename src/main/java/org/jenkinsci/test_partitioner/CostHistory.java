package org.jenkinsci.test_partitioner;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;
import edu.umd.cs.findbugs.annotations.NonNull;
import java.util.List;
import java.util.Map;

/**
 * Recent cost samples as recorded by previous pipeline runs, oldest first.
 */
public final class CostHistory {

    private static final CostHistory EMPTY = new CostHistory(Map.of(), Map.of());

    private final ImmutableMap<String, ImmutableList<Double>> unitTests;
    private final ImmutableMap<String, ImmutableMap<String, ImmutableList<Double>>> regressions;

    /**
     * @param unitTests unit test identifier to samples
     * @param regressions regress type to regress name to samples
     */
    public CostHistory(@NonNull Map<String, ? extends List<Double>> unitTests,
                       @NonNull Map<String, ? extends Map<String, ? extends List<Double>>> regressions) {
        ImmutableMap.Builder<String, ImmutableList<Double>> ut = ImmutableMap.builder();
        unitTests.forEach((k, v) -> ut.put(k, ImmutableList.copyOf(v)));
        this.unitTests = ut.build();
        ImmutableMap.Builder<String, ImmutableMap<String, ImmutableList<Double>>> it = ImmutableMap.builder();
        regressions.forEach((type, byName) -> {
            ImmutableMap.Builder<String, ImmutableList<Double>> names = ImmutableMap.builder();
            byName.forEach((k, v) -> names.put(k, ImmutableList.copyOf(v)));
            it.put(type, names.build());
        });
        this.regressions = it.build();
    }

    public static CostHistory empty() {
        return EMPTY;
    }

    @NonNull
    public List<Double> unitTestSamples(@NonNull String identifier) {
        return unitTests.getOrDefault(identifier, ImmutableList.of());
    }

    @NonNull
    public List<Double> regressSamples(@NonNull String type, @NonNull String name) {
        ImmutableMap<String, ImmutableList<Double>> byName = regressions.get(type);
        return byName == null ? ImmutableList.of() : byName.getOrDefault(name, ImmutableList.of());
    }

    public boolean isEmpty() {
        return unitTests.isEmpty() && regressions.isEmpty();
    }
}
