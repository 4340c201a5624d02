package org.jenkinsci.test_partitioner;

import com.google.common.base.CharMatcher;
import com.google.common.base.Splitter;
import edu.umd.cs.findbugs.annotations.NonNull;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Parses the integration test descriptor of the pipeline, e.g. {@code gap: 1 2; gle: 3 4 5}.
 */
public final class RegressDescriptor {

    private static final Logger LOGGER = Logger.getLogger(RegressDescriptor.class.getName());

    /**
     * Descriptor value meaning that no test of this kind should run.
     */
    public static final String NONE = "none";

    private static final Splitter CLAUSES = Splitter.on(';').trimResults().omitEmptyStrings();
    private static final Splitter NUMBERS = Splitter.on(CharMatcher.whitespace()).omitEmptyStrings();

    /**
     * @return one regress per distinct type and number, costed from the table, in descriptor order
     * @throws ConfigurationException if a clause has no {@code :} or no type, or contains a delimiter of the output line
     */
    @NonNull
    public static List<RegressTest> parse(@NonNull String descriptor, @NonNull CostTable costs) throws ConfigurationException {
        List<RegressTest> result = new ArrayList<>();
        Set<String> seen = new HashSet<>();
        String trimmed = descriptor.trim();
        if (trimmed.isEmpty() || trimmed.equals(NONE)) {
            return result;
        }
        for (String clause : CLAUSES.split(trimmed)) {
            int colon = clause.indexOf(':');
            if (colon < 0) {
                throw new ConfigurationException("Missing ':' in integration test clause \"" + clause + "\"");
            }
            String type = clause.substring(0, colon).trim();
            if (type.isEmpty()) {
                throw new ConfigurationException("Missing regress type in integration test clause \"" + clause + "\"");
            }
            ResultAssembler.checkToken("regress type", type);
            for (String number : NUMBERS.split(clause.substring(colon + 1))) {
                ResultAssembler.checkToken("regress number", number);
                if (!seen.add(type + " " + number)) {
                    LOGGER.log(Level.FINE, "Ignoring duplicate regress {0} {1}", new Object[] {type, number});
                    continue;
                }
                result.add(new RegressTest(type, number, costs.regressCost(type, number)));
            }
        }
        return result;
    }

    private RegressDescriptor() {}
}
