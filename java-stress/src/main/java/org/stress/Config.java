package org.stress;

/**
 * Central configuration class for stress run parameters.
 * 
 * <p>All values are read once from system properties. {@link Main} lets
 * command-line flags override the workload sizing values.
 * 
 * <p><b>System Properties:</b>
 * <ul>
 *   <li>{@code db.url}: Database JDBC URL (default: MySQL on port 33306)</li>
 *   <li>{@code db.user}: Database username (default: admin)</li>
 *   <li>{@code db.pass}: Database password (default: admin)</li>
 *   <li>{@code stress.workers}: Number of pool workers (default: 2 x processors)</li>
 *   <li>{@code stress.queries}: Number of keys driven through each workload (default: 100000)</li>
 *   <li>{@code stress.keysize}: Key length in bytes (default: 16)</li>
 *   <li>{@code stress.valuesize}: Value length in bytes (default: 64)</li>
 *   <li>{@code stress.queue}: Job queue bound, 0 for unbounded (default: 0)</li>
 *   <li>{@code stress.results.dir}: Results directory (default: results)</li>
 *   <li>{@code stress.metrics.port}: Prometheus exporter port, negative to disable (default: 9100)</li>
 * </ul>
 * 
 * @author krishna.sundar
 * @version 1.0
 */
public class Config {
    public static final String DB_URL = System.getProperty("db.url", "jdbc:mysql://127.0.0.1:33306/stressdb?useServerPrepStmts=true");
    public static final String DB_USER = System.getProperty("db.user", "admin");
    public static final String DB_PASS = System.getProperty("db.pass", "admin");
    public static final int DEFAULT_WORKERS = Integer.getInteger("stress.workers", Workpool.defaultWorkerCount());
    public static final int DEFAULT_QUERIES = Integer.getInteger("stress.queries", 100000);
    public static final int DEFAULT_KEY_SIZE = Integer.getInteger("stress.keysize", 16);
    public static final int DEFAULT_VALUE_SIZE = Integer.getInteger("stress.valuesize", 64);
    public static final int DEFAULT_QUEUE = Integer.getInteger("stress.queue", 0);
    public static final String RESULTS_DIR = System.getProperty("stress.results.dir", "results");
    public static final int METRICS_PORT = Integer.getInteger("stress.metrics.port", 9100);

    // Database adapter instance
    public static final DatabaseAdapter DB_ADAPTER = DatabaseAdapter.fromUrl(DB_URL);
}
