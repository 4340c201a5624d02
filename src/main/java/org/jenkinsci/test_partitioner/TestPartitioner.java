/*
 * The MIT License
 *
 * Copyright 2024 CloudBees, Inc.
 *
 * Permission is hereby granted, free of charge, to any person obtaining a copy
 * of this software and associated documentation files (the "Software"), to deal
 * in the Software without restriction, including without limitation the rights
 * to use, copy, modify, merge, publish, distribute, sublicense, and/or sell
 * copies of the Software, and to permit persons to whom the Software is
 * furnished to do so, subject to the following conditions:
 *
 * The above copyright notice and this permission notice shall be included in
 * all copies or substantial portions of the Software.
 *
 * THE SOFTWARE IS PROVIDED "AS IS", WITHOUT WARRANTY OF ANY KIND, EXPRESS OR
 * IMPLIED, INCLUDING BUT NOT LIMITED TO THE WARRANTIES OF MERCHANTABILITY,
 * FITNESS FOR A PARTICULAR PURPOSE AND NONINFRINGEMENT. IN NO EVENT SHALL THE
 * AUTHORS OR COPYRIGHT HOLDERS BE LIABLE FOR ANY CLAIM, DAMAGES OR OTHER
 * LIABILITY, WHETHER IN AN ACTION OF CONTRACT, TORT OR OTHERWISE, ARISING FROM,
 * OUT OF OR IN CONNECTION WITH THE SOFTWARE OR THE USE OR OTHER DEALINGS IN
 * THE SOFTWARE.
 */

package org.jenkinsci.test_partitioner;

import edu.umd.cs.findbugs.annotations.NonNull;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Random;
import java.util.logging.Level;
import java.util.logging.Logger;
import org.jenkinsci.test_partitioner.algorithm.Partition;
import org.jenkinsci.test_partitioner.algorithm.PartitionAlgorithm;

/**
 * Splits the unit tests and the integration regressions of one pipeline run over its worker slots.
 */
public class TestPartitioner {

    private static final Logger LOGGER = Logger.getLogger(TestPartitioner.class.getName());

    private final CostTable costs;
    private final PartitionAlgorithm algorithm;
    private final Random random;
    private final TraceLog log;

    public TestPartitioner(@NonNull CostTable costs, @NonNull PartitionAlgorithm algorithm, @NonNull Random random, @NonNull TraceLog log) {
        this.costs = costs;
        this.algorithm = algorithm;
        this.random = random;
        this.log = log;
    }

    @NonNull
    public PartitionPlan partition(@NonNull PartitionRequest request) throws ConfigurationException {
        log.println("start to parse tests from parameters");
        List<UnitTest> unitTests = new ArrayList<>();
        List<UnitTest> special = new ArrayList<>();
        List<UnitTest> normal = new ArrayList<>();
        double specialTotal = 0, unitTotal = 0;
        for (String identifier : request.getUnitTests()) {
            UnitTest test = UnitTest.of(identifier, costs, request.getSpecialPrefixes());
            unitTests.add(test);
            unitTotal += test.getCost();
            if (test.isSpecial()) {
                special.add(test);
                specialTotal += test.getCost();
            } else {
                normal.add(test);
            }
        }
        log.println("special ut array:" + special);
        log.println("special unit tests total is " + specialTotal);
        log.println("other ut array:" + normal);
        log.println("all unit tests total is " + unitTotal);

        List<RegressTest> regressions = RegressDescriptor.parse(request.getRegressDescriptor(), costs);
        double regressTotal = 0;
        for (RegressTest test : regressions) {
            regressTotal += test.getCost();
        }
        log.println("it array:" + regressions);
        log.println("all integration tests total is " + regressTotal);

        List<Slot> slots = Slot.create(request.getGroupCount(), request.getOsLabels());
        log.println("");
        log.println("start to split unittest costs with " + algorithm);
        SpecialConstraintEnforcer.Resolution resolution = new SpecialConstraintEnforcer(algorithm, random, log).enforce(unitTests, slots);
        LOGGER.log(Level.FINE, "Special unit tests: {0}", resolution);

        log.println("");
        log.println("start to split integration tests costs with " + algorithm);
        double[] bias = new double[slots.size()];
        for (int i = 0; i < slots.size(); i++) {
            bias[i] = slots.get(i).getUnitTotal();
        }
        Partition<RegressTest> partition = algorithm.partition(regressions, bias);
        for (int i = 0; i < slots.size(); i++) {
            slots.get(i).addRegressTests(partition.getGroup(i));
        }
        log.println(partition.getGroups().toString());
        log.println(Arrays.toString(partition.getTotals()));

        return new ResultAssembler(random, log).assemble(slots);
    }
}
