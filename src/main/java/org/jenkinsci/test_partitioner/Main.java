package org.jenkinsci.test_partitioner;

import java.io.IOException;
import java.io.PrintStream;
import java.nio.file.Paths;
import java.util.Arrays;
import java.util.Random;
import java.util.logging.Level;
import java.util.logging.Logger;
import org.jenkinsci.test_partitioner.algorithm.PartitionAlgorithm;

/**
 * Command line entry point called by the pipeline.
 * <p>
 * The algorithm is chosen with the {@value PartitionAlgorithm#PROPERTY} system property (default {@code ffd}), and
 * shuffling can be made reproducible with {@value #SEED_PROPERTY}.
 * </p>
 */
public final class Main {

    private static final Logger LOGGER = Logger.getLogger(Main.class.getName());

    public static final String SEED_PROPERTY = "org.jenkinsci.test_partitioner.seed";

    static final String USAGE = "Usage: <unit test cost json> <integration test cost json> <unit tests|none> <integration tests|none>"
            + " <group count> <os,os,...> <special prefix,...> <log file>";

    public static void main(String[] args) {
        System.exit(run(args, System.out, System.err));
    }

    /**
     * @return the process exit code: 0 on success, 1 on invalid arguments, 2 if the trace could not be written
     */
    static int run(String[] args, PrintStream out, PrintStream err) {
        if (args.length < 8) {
            err.println("Invalid arguments: " + Arrays.toString(args));
            err.println(USAGE);
            return 1;
        }
        try (PrintStreamTraceLog log = PrintStreamTraceLog.open(Paths.get(args[7]))) {
            try {
                PartitionRequest request = PartitionRequest.parse(args[2], args[3], args[4], args[5], args[6]);
                PartitionAlgorithm algorithm = PartitionAlgorithm.forName(System.getProperty(PartitionAlgorithm.PROPERTY, "ffd"));
                CostTable costs = new CostTable(CostHistoryStore.load(Paths.get(args[0]), Paths.get(args[1])));
                log.println(request.toString());
                PartitionPlan plan = new TestPartitioner(costs, algorithm, random(), log).partition(request);
                out.println(plan.getLine());
                return 0;
            } catch (ConfigurationException e) {
                log.println("Invalid arguments: " + e.getMessage());
                err.println("Invalid arguments: " + e.getMessage());
                return 1;
            }
        } catch (IOException e) {
            LOGGER.log(Level.SEVERE, "Cannot write the trace to " + args[7], e);
            err.println("Cannot write the trace to " + args[7] + ": " + e.getMessage());
            return 2;
        }
    }

    private static Random random() {
        Long seed = Long.getLong(SEED_PROPERTY);
        return seed == null ? new Random() : new Random(seed);
    }

    private Main() {}
}
