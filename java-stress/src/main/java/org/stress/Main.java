package org.stress;

import javax.sql.DataSource;
import java.util.Arrays;
import java.util.List;
import java.util.Random;

/**
 * Main entry point for the key/value stress tool.
 *
 * <p>Generates a set of unique keys, then drives them through four workloads in
 * order (insert, select, update, delete) against the {@code stress_kv} table.
 * Each workload runs on its own Workpool stamped from one blueprint, with one
 * JDBC connection per worker. Results go to the console, to CSV files in the
 * results directory, and to the Prometheus endpoint while the run lasts.
 *
 * <p>Command-line arguments override the matching system properties (see {@link Config}):
 * <ul>
 *   <li>{@code --workers N}: Workers per pool</li>
 *   <li>{@code --queries N}: Keys driven through each workload</li>
 *   <li>{@code --keysize N}: Key length in bytes</li>
 *   <li>{@code --valuesize N}: Value length in bytes</li>
 *   <li>{@code --queue N}: Job queue bound, 0 for unbounded</li>
 * </ul>
 *
 * @author krishna.sundar
 * @version 1.0
 */
public class Main {
    static final List<Workload> WORKLOADS = Arrays.asList(
            new InsertWorkload(), new SelectWorkload(), new UpdateWorkload(), new DeleteWorkload());

    public static void main(String[] args) throws Exception {
        int workers = intArg(args, "--workers", Config.DEFAULT_WORKERS);
        int queries = intArg(args, "--queries", Config.DEFAULT_QUERIES);
        int keySize = intArg(args, "--keysize", Config.DEFAULT_KEY_SIZE);
        int valueSize = intArg(args, "--valuesize", Config.DEFAULT_VALUE_SIZE);
        int queue = intArg(args, "--queue", Config.DEFAULT_QUEUE);

        if (Config.METRICS_PORT >= 0) {
            StressMetrics.startHttpServer(Config.METRICS_PORT);
        }

        DataSource ds = DBPool.getDataSource(workers + 4);
        DatabaseAdapter adapter = Config.DB_ADAPTER;

        DBSetup.createTables(ds, adapter, keySize);
        DBSetup.clearTables(ds, adapter);

        System.out.println("Starting stress run. db=" + adapter.getType() + " workers=" + workers
                + " queries=" + queries + " keysize=" + keySize + " valuesize=" + valueSize
                + " queue=" + (queue > 0 ? queue : "unbounded"));

        System.out.println("Generating " + queries + " unique keys...");
        List<KeyValue> payloads = KeyValue.generate(queries, keySize, valueSize, new Random());

        ReportWriter.resetSummary();
        WorkloadRunner runner = new WorkloadRunner(ds, adapter, workers, queue > 0 ? queue : null);
        boolean failed = false;
        try {
            for (Workload workload : WORKLOADS) {
                System.out.println("Running " + workload.name() + "...");
                try {
                    WorkloadResult result = runner.run(workload, payloads);
                    ReportWriter.writeSummary(result);
                } catch (WorkerFaultException e) {
                    System.err.println("Workload " + workload.name() + " lost workers " + e.getFaultedWorkers());
                    e.printStackTrace();
                    failed = true;
                }
            }
            ReportWriter.writeFinalSummary();
        } finally {
            DBPool.close();
            StressMetrics.stopHttpServer();
        }

        System.out.println("All workloads finished. Results in '" + Config.RESULTS_DIR + "'");
        if (failed) {
            System.exit(1);
        }
    }

    /**
     * Reads {@code --name N} from the arguments.
     *
     * @return the parsed value, or {@code fallback} when the flag is absent
     * @throws IllegalArgumentException if the flag has no value or the value is not an integer
     */
    static int intArg(String[] args, String name, int fallback) {
        for (int i = 0; i < args.length; i++) {
            if (name.equals(args[i])) {
                if (i + 1 >= args.length) {
                    throw new IllegalArgumentException("Missing value for " + name);
                }
                try {
                    return Integer.parseInt(args[i + 1]);
                } catch (NumberFormatException e) {
                    throw new IllegalArgumentException("Bad value for " + name + ": " + args[i + 1], e);
                }
            }
        }
        return fallback;
    }
}
