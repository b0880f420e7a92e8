package org.stress;

/**
 * The three stages every {@link Workpool} worker runs.
 *
 * <p>A worker calls {@link Setup#init()} once to build its private state, then
 * {@link Process#process(Object, Object)} for each job it dequeues, and finally
 * {@link Teardown#exit(Object)} when the pool shuts down. Implementations are
 * shared by reference between all workers of a pool (and all pools stamped from
 * one {@link PoolConfig}), so they must not keep per-worker data in fields; that
 * belongs in the state object returned by {@code init()}.
 *
 * <p>Anything thrown from a stage kills the calling worker thread. The fault is
 * reported when the pool is closed.
 *
 * @author krishna.sundar
 * @version 1.0
 */
public final class WorkerLifecycle {
    private WorkerLifecycle() {}

    /**
     * Pre-loop stage: produces the worker's private state.
     *
     * @param <S> private state type
     */
    @FunctionalInterface
    public interface Setup<S> {
        S init() throws Exception;
    }

    /**
     * In-loop stage: handles one job with exclusive access to the worker's state.
     *
     * @param <S> private state type
     * @param <P> job payload type
     */
    @FunctionalInterface
    public interface Process<S, P> {
        void process(S state, P job) throws Exception;
    }

    /**
     * Post-loop stage: releases whatever {@link Setup} acquired.
     *
     * @param <S> private state type
     */
    @FunctionalInterface
    public interface Teardown<S> {
        void exit(S state) throws Exception;
    }
}
