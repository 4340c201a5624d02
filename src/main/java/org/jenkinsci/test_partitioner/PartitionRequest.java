package org.jenkinsci.test_partitioner;

import com.google.common.base.CharMatcher;
import com.google.common.base.Splitter;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableSet;
import edu.umd.cs.findbugs.annotations.NonNull;
import java.util.List;
import java.util.Set;

/**
 * What the pipeline asks to partition, as parsed from its raw arguments.
 */
public final class PartitionRequest {

    private static final Splitter WHITESPACE = Splitter.on(CharMatcher.whitespace()).omitEmptyStrings();
    private static final Splitter COMMA = Splitter.on(',').trimResults().omitEmptyStrings();

    private final ImmutableList<String> unitTests;
    private final String regressDescriptor;
    private final int groupCount;
    private final ImmutableList<String> osLabels;
    private final ImmutableSet<String> specialPrefixes;

    PartitionRequest(@NonNull List<String> unitTests, @NonNull String regressDescriptor, int groupCount,
                     @NonNull List<String> osLabels, @NonNull Set<String> specialPrefixes) {
        this.unitTests = ImmutableList.copyOf(unitTests);
        this.regressDescriptor = regressDescriptor;
        this.groupCount = groupCount;
        this.osLabels = ImmutableList.copyOf(osLabels);
        this.specialPrefixes = ImmutableSet.copyOf(specialPrefixes);
    }

    /**
     * @param unitTests space separated unit test identifiers, or {@code none}
     * @param regressDescriptor integration tests as understood by {@link RegressDescriptor}
     * @param groupCount number of slots
     * @param osLabels comma separated OS labels, assigned to the slots round-robin
     * @param specialPrefixes comma separated prefixes of the special unit tests
     */
    @NonNull
    public static PartitionRequest parse(@NonNull String unitTests, @NonNull String regressDescriptor, @NonNull String groupCount,
                                         @NonNull String osLabels, @NonNull String specialPrefixes) throws ConfigurationException {
        int count;
        try {
            count = Integer.parseInt(groupCount.trim());
        } catch (NumberFormatException e) {
            throw new ConfigurationException("Group count is not a number: " + groupCount, e);
        }
        if (count <= 0) {
            throw new ConfigurationException("Group count must be positive: " + count);
        }

        List<String> labels = COMMA.splitToList(osLabels);
        if (labels.isEmpty()) {
            throw new ConfigurationException("No OS label given");
        }
        for (String label : labels) {
            ResultAssembler.checkToken("OS label", label);
        }

        List<String> tests = ImmutableList.of();
        String trimmed = unitTests.trim();
        if (!trimmed.equals(RegressDescriptor.NONE)) {
            tests = WHITESPACE.splitToList(trimmed);
            for (String test : tests) {
                ResultAssembler.checkToken("unit test", test);
            }
        }
        return new PartitionRequest(tests, regressDescriptor, count, labels, ImmutableSet.copyOf(COMMA.split(specialPrefixes)));
    }

    public List<String> getUnitTests() {
        return unitTests;
    }

    public String getRegressDescriptor() {
        return regressDescriptor;
    }

    public int getGroupCount() {
        return groupCount;
    }

    public List<String> getOsLabels() {
        return osLabels;
    }

    public Set<String> getSpecialPrefixes() {
        return specialPrefixes;
    }

    @Override
    public String toString() {
        return "PartitionRequest{" +
                "unitTests=" + unitTests +
                ", regressDescriptor='" + regressDescriptor + '\'' +
                ", groupCount=" + groupCount +
                ", osLabels=" + osLabels +
                ", specialPrefixes=" + specialPrefixes +
                '}';
    }
}
