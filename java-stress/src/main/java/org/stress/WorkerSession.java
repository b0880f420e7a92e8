package org.stress;

import org.HdrHistogram.Histogram;

import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.SQLException;
import java.util.HashMap;
import java.util.Map;

/**
 * Private state of one Workpool worker in a stress run.
 * 
 * <p>A session owns a single JDBC connection borrowed in the worker's setup stage,
 * the prepared statements built on it (one per workload), and a worker-local
 * latency histogram. Only the owning worker thread touches it, so nothing here is
 * synchronized; the runner merges the histogram once the worker tears down.
 * 
 * <p>Latencies are recorded in microseconds per operation, retries included.
 * 
 * @author krishna.sundar
 * @version 1.0
 */
public class WorkerSession implements AutoCloseable {
    /** One hour in microseconds; slower operations are clamped to it. */
    public static final long HIGHEST_TRACKABLE_MICROS = 3_600_000_000L;

    private final Connection connection;
    private final DatabaseAdapter adapter;
    private final Map<String, PreparedStatement> statements = new HashMap<>();
    private final Histogram latency = new Histogram(HIGHEST_TRACKABLE_MICROS, 3);
    private long ops;
    private long misses;

    public WorkerSession(Connection connection, DatabaseAdapter adapter) {
        this.connection = connection;
        this.adapter = adapter;
    }

    /**
     * Runs one operation of the given workload for one payload and records its latency.
     * 
     * @param workload The operation to run
     * @param kv The payload to bind
     * @throws SQLException if the statement fails after retries
     */
    public void run(Workload workload, KeyValue kv) throws SQLException {
        PreparedStatement ps = statementFor(workload);
        int[] rows = new int[1];
        long start = System.nanoTime();
        TransientRetry.executeWithRetry(connection, () -> {
            workload.bind(ps, kv);
            rows[0] = workload.execute(ps);
        });
        long micros = (System.nanoTime() - start) / 1000;
        latency.recordValue(Math.max(1, Math.min(micros, HIGHEST_TRACKABLE_MICROS)));
        ops++;
        if (rows[0] == 0) {
            misses++;
        }
        StressMetrics.record(workload.name(), micros);
    }

    private PreparedStatement statementFor(Workload workload) throws SQLException {
        PreparedStatement ps = statements.get(workload.name());
        if (ps == null) {
            ps = connection.prepareStatement(workload.sql(adapter));
            statements.put(workload.name(), ps);
        }
        return ps;
    }

    public Histogram getLatency() {
        return latency;
    }

    public long getOps() {
        return ops;
    }

    public long getMisses() {
        return misses;
    }

    /**
     * Closes every cached statement and returns the connection to the pool. A failure
     * closing a statement does not keep the connection from being closed.
     */
    @Override
    public void close() throws SQLException {
        SQLException first = null;
        for (PreparedStatement ps : statements.values()) {
            try {
                ps.close();
            } catch (SQLException e) {
                if (first == null) first = e; else first.addSuppressed(e);
            }
        }
        statements.clear();
        try {
            connection.close();
        } catch (SQLException e) {
            if (first == null) first = e; else first.addSuppressed(e);
        }
        if (first != null) {
            throw first;
        }
    }
}
