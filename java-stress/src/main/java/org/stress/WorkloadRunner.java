package org.stress;

import org.HdrHistogram.Histogram;

import javax.sql.DataSource;
import java.sql.SQLException;
import java.util.Collection;

/**
 * Drives workloads through Workpools that share one blueprint.
 * 
 * <p>The blueprint's setup stage borrows a connection and wraps it in a
 * {@link WorkerSession}; its teardown stage merges the session's counters into
 * this runner and closes the session. Each {@link #run} stamps a fresh pool from
 * the blueprint with the workload as its loop stage, submits every payload
 * through the pool's iterator pool, and closes the pool, so a run returns once
 * every payload has been processed and every connection released.
 * 
 * <p>A statement that fails kills its worker, and a dead worker never reaches the
 * teardown stage. The loop stage therefore releases the session itself before
 * rethrowing, so a failed run does not leak connections into the next one.
 * 
 * <p>Runs are sequential: the per-run totals are reset at the start of each run.
 * 
 * @author krishna.sundar
 * @version 1.0
 */
public class WorkloadRunner {
    /** Loop stage of the blueprint itself, used by {@link #getBlueprint()} pools. */
    public static final Workload DEFAULT_WORKLOAD = new InsertWorkload();

    private final DataSource ds;
    private final DatabaseAdapter adapter;
    private final PoolConfig<WorkerSession, KeyValue> blueprint;

    private final Histogram runLatency = new Histogram(WorkerSession.HIGHEST_TRACKABLE_MICROS, 3);
    private long runOps;
    private long runMisses;

    /**
     * Creates a new runner.
     * 
     * @param ds The DataSource workers borrow their connections from
     * @param adapter The SQL dialect of the target database
     * @param workers Number of workers per pool
     * @param queueCapacity Job queue bound, or {@code null} for unbounded
     */
    public WorkloadRunner(DataSource ds, DatabaseAdapter adapter, int workers, Integer queueCapacity) {
        this.ds = ds;
        this.adapter = adapter;
        this.blueprint = new PoolConfig<>(workers,
                this::openSession,
                loopFor(DEFAULT_WORKLOAD),
                this::closeSession,
                true,
                queueCapacity);
    }

    public PoolConfig<WorkerSession, KeyValue> getBlueprint() {
        return blueprint;
    }

    /**
     * Runs one workload over all payloads.
     * 
     * @param workload The operation to drive
     * @param payloads The keys and values to drive it with
     * @return The merged result of every worker
     * @throws WorkpoolException if a worker could not open its session
     * @throws WorkerFaultException if a worker died mid-run
     */
    public WorkloadResult run(Workload workload, Collection<KeyValue> payloads) throws WorkpoolException {
        synchronized (this) {
            runLatency.reset();
            runOps = 0;
            runMisses = 0;
        }
        Workpool<WorkerSession, KeyValue> pool = blueprint.withLoopClosure(loopFor(workload));
        long start = System.nanoTime();
        pool.executeAndFinishIter(payloads);
        long elapsed = System.nanoTime() - start;
        synchronized (this) {
            return new WorkloadResult(workload.name(), runLatency.copy(), runOps, runMisses, elapsed);
        }
    }

    private WorkerLifecycle.Process<WorkerSession, KeyValue> loopFor(Workload workload) {
        return (session, kv) -> {
            try {
                session.run(workload, kv);
            } catch (SQLException | RuntimeException e) {
                releaseAfterFault(session, e);
                throw e;
            }
        };
    }

    private void releaseAfterFault(WorkerSession session, Exception fault) {
        try {
            closeSession(session);
        } catch (SQLException e) {
            fault.addSuppressed(e);
        }
    }

    private WorkerSession openSession() throws SQLException {
        WorkerSession session = new WorkerSession(ds.getConnection(), adapter);
        StressMetrics.sessions.inc();
        return session;
    }

    private void closeSession(WorkerSession session) throws SQLException {
        synchronized (this) {
            runLatency.add(session.getLatency());
            runOps += session.getOps();
            runMisses += session.getMisses();
        }
        StressMetrics.sessions.dec();
        session.close();
    }
}
