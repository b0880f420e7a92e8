package org.stress;

/**
 * Immutable template for stamping out {@link Workpool}s without restating their lifecycle.
 *
 * <p>A config holds the worker count, the three {@link WorkerLifecycle} stages, whether
 * pools get their own bulk-submission pool, and the optional job queue bound. Every
 * {@link #getPool()} call builds a fresh pool with its own queue and threads; the stages
 * themselves are shared by reference.
 *
 * <p>Example:
 * <pre>{@code
 * PoolConfig<Connection, String> cfg = new PoolConfig<>(8,
 *         ds::getConnection,
 *         (conn, sql) -> conn.createStatement().execute(sql),
 *         Connection::close,
 *         true, 1024);
 * try (Workpool<Connection, String> pool = cfg.getPool()) {
 *     pool.execute("SELECT 1");
 * }
 * }</pre>
 *
 * @param <S> per-worker private state type
 * @param <P> job payload type
 * @author krishna.sundar
 * @version 1.0
 */
public final class PoolConfig<S, P> {
    private final int count;
    private final WorkerLifecycle.Setup<S> setup;
    private final WorkerLifecycle.Process<S, P> process;
    private final WorkerLifecycle.Teardown<S> teardown;
    private final boolean needsIteratorPool;
    private final Integer expectedMaxSends;

    /**
     * Creates a new pool config.
     *
     * @param count Number of workers, at least 1
     * @param setup Pre-loop stage, run once per worker
     * @param process In-loop stage, run once per job
     * @param teardown Post-loop stage, run once per worker on shutdown
     * @param needsIteratorPool If true, pools own a fork/join pool sized {@code count} for bulk submission
     * @param expectedMaxSends Job queue bound, or {@code null} for an unbounded queue
     * @throws IllegalArgumentException if {@code count < 1} or {@code expectedMaxSends < 1}
     */
    public PoolConfig(int count,
                      WorkerLifecycle.Setup<S> setup,
                      WorkerLifecycle.Process<S, P> process,
                      WorkerLifecycle.Teardown<S> teardown,
                      boolean needsIteratorPool,
                      Integer expectedMaxSends) {
        if (count < 1) {
            throw new IllegalArgumentException("Bad value `" + count + "` for thread count");
        }
        if (expectedMaxSends != null && expectedMaxSends < 1) {
            throw new IllegalArgumentException("Bad value `" + expectedMaxSends + "` for queue capacity");
        }
        if (setup == null || process == null || teardown == null) {
            throw new IllegalArgumentException("setup, process and teardown are required");
        }
        this.count = count;
        this.setup = setup;
        this.process = process;
        this.teardown = teardown;
        this.needsIteratorPool = needsIteratorPool;
        this.expectedMaxSends = expectedMaxSends;
    }

    /**
     * Builds a new pool from this config.
     *
     * @return a started pool with {@link #getCount()} workers
     * @throws WorkpoolException if not every worker completed setup
     */
    public Workpool<S, P> getPool() throws WorkpoolException {
        return new Workpool<>(this);
    }

    /**
     * Builds a new pool from this config with a different number of workers.
     *
     * @param workers Number of workers, at least 1
     * @return a started pool
     * @throws WorkpoolException if not every worker completed setup
     */
    public Workpool<S, P> getPoolWithWorkers(int workers) throws WorkpoolException {
        return new Workpool<>(new PoolConfig<>(workers, setup, process, teardown, needsIteratorPool, expectedMaxSends));
    }

    /**
     * Builds a new pool with this config's setup, teardown and sizing but another in-loop stage.
     *
     * @param loop The in-loop stage for the new pool
     * @return a started pool
     * @throws WorkpoolException if not every worker completed setup
     */
    public Workpool<S, P> withLoopClosure(WorkerLifecycle.Process<S, P> loop) throws WorkpoolException {
        return new Workpool<>(new PoolConfig<>(count, setup, loop, teardown, needsIteratorPool, expectedMaxSends));
    }

    public int getCount() {
        return count;
    }

    public WorkerLifecycle.Setup<S> getSetup() {
        return setup;
    }

    public WorkerLifecycle.Process<S, P> getProcess() {
        return process;
    }

    public WorkerLifecycle.Teardown<S> getTeardown() {
        return teardown;
    }

    public boolean needsIteratorPool() {
        return needsIteratorPool;
    }

    /** @return the job queue bound, or {@code null} when unbounded */
    public Integer getExpectedMaxSends() {
        return expectedMaxSends;
    }

    @Override
    public String toString() {
        return "PoolConfig{" +
                "count=" + count +
                ", needsIteratorPool=" + needsIteratorPool +
                ", expectedMaxSends=" + expectedMaxSends +
                '}';
    }
}
