package org.stress;

import java.util.concurrent.BlockingQueue;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * One pool thread running the setup, process and teardown loop.
 *
 * <p>The private state returned by the setup stage lives on this thread's stack and
 * never escapes it. A {@code Throwable} escaping any stage ends the thread for good;
 * it is kept in {@link #fault} and handed back by {@link #join()}.
 *
 * @author krishna.sundar
 * @version 1.0
 */
final class Worker<S, P> {
    private final int id;
    private final BlockingQueue<JobUnit<P>> jobs;
    private final PoolConfig<S, P> config;
    private final StartupBarrier barrier;
    private final AtomicInteger liveWorkers;

    // cleared once joined
    private Thread thread;
    private volatile Throwable fault;
    private volatile boolean ready;

    Worker(int id, BlockingQueue<JobUnit<P>> jobs, PoolConfig<S, P> config,
           StartupBarrier barrier, AtomicInteger liveWorkers) {
        this.id = id;
        this.jobs = jobs;
        this.config = config;
        this.barrier = barrier;
        this.liveWorkers = liveWorkers;
        this.thread = new Thread(this::runLoop, "worker-" + id);
    }

    void start() {
        thread.start();
    }

    /**
     * Interrupts the thread unless it has already been joined.
     */
    void interrupt() {
        Thread t = thread;
        if (t != null) {
            t.interrupt();
        }
    }

    int id() {
        return id;
    }

    /**
     * @return true once the setup stage has completed
     */
    boolean wasReady() {
        return ready;
    }

    private void runLoop() {
        boolean reported = false;
        try {
            S state = config.getSetup().init();
            ready = true;
            barrier.ready();
            reported = true;
            while (true) {
                JobUnit<P> unit = jobs.take();
                if (unit.isTerminate()) {
                    config.getTeardown().exit(state);
                    return;
                }
                config.getProcess().process(state, unit.payload());
            }
        } catch (Throwable t) {
            fault = t;
        } finally {
            if (!reported) {
                barrier.failedBeforeReady();
            }
            liveWorkers.decrementAndGet();
        }
    }

    /**
     * Waits for the thread to end. A worker that was already joined returns at once.
     *
     * @return the fault that killed the thread, or {@code null} if it exited cleanly
     * @throws InterruptedException if interrupted while waiting; the worker stays joinable
     */
    Throwable join() throws InterruptedException {
        if (thread != null) {
            thread.join();
            thread = null;
        }
        return fault;
    }
}
