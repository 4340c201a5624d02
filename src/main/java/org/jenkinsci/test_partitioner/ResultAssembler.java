package org.jenkinsci.test_partitioner;

import com.google.common.collect.ListMultimap;
import com.google.common.collect.MultimapBuilder;
import edu.umd.cs.findbugs.annotations.NonNull;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.Random;

/**
 * Turns the slots into the line consumed by the pipeline scripts.
 * <p>
 * Records are separated by {@code "# "}, and each record reads
 * {@code <os> $$$ <unit tests> $$$ <type>: <n> <n> ; <type>: <n> ; }, where an empty list is written as {@code none}.
 * Every token is followed by a single space and the line starts with one, exactly as the scripts parse it.
 * </p>
 */
public class ResultAssembler {

    static final String FIELD_SEPARATOR = "$$$";
    static final String RECORD_SEPARATOR = "#";
    static final String TYPE_SEPARATOR = ";";

    private final Random random;
    private final TraceLog log;

    public ResultAssembler(@NonNull Random random, @NonNull TraceLog log) {
        this.random = random;
        this.log = log;
    }

    /**
     * Rejects tokens that would make the output line ambiguous.
     */
    static void checkToken(@NonNull String what, @NonNull String token) throws ConfigurationException {
        if (token.contains(FIELD_SEPARATOR) || token.contains(RECORD_SEPARATOR) || token.contains(TYPE_SEPARATOR)) {
            throw new ConfigurationException("Invalid " + what + " \"" + token + "\": it must not contain '" + FIELD_SEPARATOR + "', '"
                    + RECORD_SEPARATOR + "' or '" + TYPE_SEPARATOR + "'");
        }
    }

    /**
     * Shuffles the tests of each slot and the slots themselves, then writes the line and the per slot trace.
     */
    @NonNull
    public PartitionPlan assemble(@NonNull List<Slot> slots) {
        List<Slot> ordered = new ArrayList<>(slots);
        for (Slot slot : ordered) {
            slot.shuffle(random);
        }
        Collections.shuffle(ordered, random);

        log.println("");
        log.println("start to generate result string");
        StringBuilder line = new StringBuilder();
        double maxUnit = 0, maxRegress = 0, maxTotal = 0;
        for (int i = 0; i < ordered.size(); i++) {
            Slot slot = ordered.get(i);
            log.println("Group " + i + " , os " + slot.getOsLabel() + " :");
            line.append(line.length() > 0 ? RECORD_SEPARATOR + " " : " ");
            line.append(slot.getOsLabel()).append(' ').append(FIELD_SEPARATOR).append(' ');

            log.println("unit test:");
            if (slot.getUnitTests().isEmpty()) {
                line.append(RegressDescriptor.NONE).append(' ');
                log.println(RegressDescriptor.NONE);
            } else {
                for (UnitTest test : slot.getUnitTests()) {
                    line.append(test.getKey()).append(' ');
                    log.println(test.getKey() + " : " + test.getCost());
                }
            }
            log.println("unit test total is " + slot.getUnitTotal());
            log.println("");
            line.append(' ').append(FIELD_SEPARATOR).append(' ');

            log.println("integration test:");
            if (slot.getRegressTests().isEmpty()) {
                line.append(RegressDescriptor.NONE).append(' ');
                log.println(RegressDescriptor.NONE);
            } else {
                for (Map.Entry<String, Collection<RegressTest>> type : byType(slot.getRegressTests()).asMap().entrySet()) {
                    line.append(type.getKey()).append(": ");
                    for (RegressTest test : type.getValue()) {
                        line.append(test.getNumber()).append(' ');
                        log.println(test.getKey() + " : " + test.getCost());
                    }
                    line.append(TYPE_SEPARATOR).append(' ');
                }
            }
            log.println("integration test total is " + slot.getRegressTotal());
            log.println("Total is " + slot.getTotal());
            log.println("");
            log.println("");

            maxUnit = Math.max(maxUnit, slot.getUnitTotal());
            maxRegress = Math.max(maxRegress, slot.getRegressTotal());
            maxTotal = Math.max(maxTotal, slot.getTotal());
        }
        log.println("max ut time: " + maxUnit);
        log.println("max it time: " + maxRegress);
        log.println("max total time: " + maxTotal);
        logBalance(ordered);
        log.println("");
        log.println(line.toString());
        return new PartitionPlan(ordered, line.toString(), maxUnit, maxRegress, maxTotal);
    }

    /**
     * Groups the regressions by type, types and numbers in first seen order.
     */
    private static ListMultimap<String, RegressTest> byType(List<RegressTest> tests) {
        ListMultimap<String, RegressTest> result = MultimapBuilder.linkedHashKeys().arrayListValues().build();
        for (RegressTest test : tests) {
            result.put(test.getType(), test);
        }
        return result;
    }

    private void logBalance(List<Slot> slots) {
        if (slots.isEmpty()) {
            return;
        }
        int count = 0;
        double total = 0, min = Double.MAX_VALUE, max = -Double.MAX_VALUE;
        for (Slot slot : slots) {
            count += slot.getUnitTests().size() + slot.getRegressTests().size();
            total += slot.getTotal();
            min = Math.min(min, slot.getTotal());
            max = Math.max(max, slot.getTotal());
        }
        double average = total / slots.size();
        double variance = 0;
        for (Slot slot : slots) {
            variance += pow(slot.getTotal() - average);
        }
        variance /= slots.size();
        double stddev = Math.sqrt(variance);
        log.printf("%d tests (%.1f) divided into %d sets. Min=%.1f, Average=%.1f, Max=%.1f, stddev=%.1f%n",
                count, total, slots.size(), min, average, max, stddev);
    }

    private static double pow(double d) {
        return d * d;
    }
}
