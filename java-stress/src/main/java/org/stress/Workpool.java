package org.stress;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.List;
import java.util.concurrent.ArrayBlockingQueue;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.ForkJoinPool;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.locks.ReentrantLock;

/**
 * A fixed-size pool of worker threads, each running a three-stage lifecycle.
 *
 * <p>Unlike a general purpose executor, a Workpool does not run arbitrary tasks. Every
 * worker first runs the {@link WorkerLifecycle.Setup setup} stage to build private
 * state (a database connection, a socket, a buffer), then hands each job it dequeues to
 * the {@link WorkerLifecycle.Process process} stage together with that state, and runs
 * the {@link WorkerLifecycle.Teardown teardown} stage once the pool is closed.
 *
 * <p><b>Construction</b> starts all workers and blocks until each one has either finished
 * setup or died trying. If any died, the constructor stops the others and throws a
 * {@link WorkpoolException}, so a pool that exists always has all of its workers ready.
 * An interrupt during that wait interrupts the workers still in setup, joins every
 * worker and throws a {@code WorkpoolException} with the interrupt flag restored.
 *
 * <p><b>Submission</b> places jobs on one queue shared by all workers. Whichever worker is
 * free first takes the next job; no ordering across workers is guaranteed. With a bounded
 * queue, {@link #execute(Object)} blocks while the queue is full. Blocked submitters are
 * admitted in FIFO order: a fair admission lock lets one submitter at a time wait for
 * room, and the others queue behind it in arrival order.
 *
 * <p><b>Shutdown</b> via {@link #close()} (or try-with-resources) enqueues one terminate
 * sentinel per configured worker behind all pending jobs, then joins every thread. A
 * worker that died from a fault earlier is reported at that point as a
 * {@link WorkerFaultException}. Jobs are never retried or redelivered.
 *
 * <p>Worker thread states:
 * <pre>
 * Initializing -&gt; Ready -&gt; Looping &lt;-&gt; Processing -&gt; Tearingdown -&gt; Exited
 * Initializing -&gt; Exited (faulted)
 * Processing   -&gt; Exited (faulted)
 * Tearingdown  -&gt; Exited (faulted)
 * </pre>
 *
 * @param <S> per-worker private state type
 * @param <P> job payload type
 * @author krishna.sundar
 * @version 1.0
 */
public class Workpool<S, P> implements AutoCloseable {
    private static final long LIVENESS_POLL_MS = 50;

    private final PoolConfig<S, P> config;
    private final int count;
    private final BlockingQueue<JobUnit<P>> jobs;
    private final List<Worker<S, P>> workers;
    private final AtomicInteger liveWorkers;
    private final ForkJoinPool iteratorPool;
    // null when the queue is unbounded
    private final ReentrantLock admission;
    private final AtomicBoolean closed = new AtomicBoolean();

    /**
     * Creates a new workpool.
     *
     * @param count Number of workers, at least 1
     * @param setup Pre-loop stage, run once per worker
     * @param process In-loop stage, run once per job
     * @param teardown Post-loop stage, run once per worker on shutdown
     * @param needsIteratorPool If true, the pool owns a fork/join pool sized {@code count} used by {@link #executeIter(Collection)}
     * @param expectedMaxSends Job queue bound, or {@code null} for an unbounded queue
     * @throws WorkpoolException if not every worker completed setup
     * @throws IllegalArgumentException if {@code count < 1}
     */
    public Workpool(int count,
                    WorkerLifecycle.Setup<S> setup,
                    WorkerLifecycle.Process<S, P> process,
                    WorkerLifecycle.Teardown<S> teardown,
                    boolean needsIteratorPool,
                    Integer expectedMaxSends) throws WorkpoolException {
        this(new PoolConfig<>(count, setup, process, teardown, needsIteratorPool, expectedMaxSends));
    }

    /**
     * Creates a new workpool from a config.
     *
     * @param config The pool template
     * @throws WorkpoolException if not every worker completed setup
     */
    public Workpool(PoolConfig<S, P> config) throws WorkpoolException {
        this.config = config;
        this.count = config.getCount();
        Integer bound = config.getExpectedMaxSends();
        this.jobs = bound == null ? new LinkedBlockingQueue<>() : new ArrayBlockingQueue<>(bound);
        this.admission = bound == null ? null : new ReentrantLock(true);
        this.liveWorkers = new AtomicInteger(count);
        this.iteratorPool = config.needsIteratorPool() ? new ForkJoinPool(count) : null;

        StartupBarrier barrier = new StartupBarrier(count);
        List<Worker<S, P>> spawned = new ArrayList<>(count);
        for (int i = 0; i < count; i++) {
            Worker<S, P> worker = new Worker<>(i, jobs, config, barrier, liveWorkers);
            spawned.add(worker);
            worker.start();
        }
        this.workers = Collections.unmodifiableList(spawned);

        int started;
        try {
            started = barrier.await();
        } catch (InterruptedException e) {
            started = barrier.readyCount();
            for (Worker<S, P> worker : workers) {
                if (!worker.wasReady()) {
                    worker.interrupt();
                }
            }
            WorkpoolException error = abandon(started, e);
            Thread.currentThread().interrupt();
            throw error;
        }
        if (started != count) {
            throw abandon(started, null);
        }
    }

    /**
     * Creates a new workpool sized to twice the number of available processors.
     *
     * @see #Workpool(int, WorkerLifecycle.Setup, WorkerLifecycle.Process, WorkerLifecycle.Teardown, boolean, Integer)
     */
    public static <S, P> Workpool<S, P> newDefaultThreads(WorkerLifecycle.Setup<S> setup,
                                                          WorkerLifecycle.Process<S, P> process,
                                                          WorkerLifecycle.Teardown<S> teardown,
                                                          boolean needsIteratorPool,
                                                          Integer expectedMaxSends) throws WorkpoolException {
        return new Workpool<>(defaultWorkerCount(), setup, process, teardown, needsIteratorPool, expectedMaxSends);
    }

    /**
     * @return twice the number of available processors, at least 1
     */
    public static int defaultWorkerCount() {
        return Math.max(1, Runtime.getRuntime().availableProcessors() * 2);
    }

    /**
     * Stops every worker after a failed construction, waits for all of them to exit and
     * builds the error. Workers still in setup must finish or fail it first.
     *
     * @param interruption The interrupt that cut the startup wait short, or {@code null}
     */
    private WorkpoolException abandon(int started, InterruptedException interruption) {
        List<Throwable> setupFaults = new ArrayList<>();
        List<Throwable> stopFaults = new ArrayList<>();
        boolean interrupted = terminateAll();
        for (Worker<S, P> worker : workers) {
            Throwable fault = joinUninterruptibly(worker);
            if (fault == null) {
                continue;
            }
            if (worker.wasReady()) {
                stopFaults.add(fault);
            } else {
                setupFaults.add(fault);
            }
        }
        if (iteratorPool != null) {
            iteratorPool.shutdown();
        }
        if (interrupted) {
            Thread.currentThread().interrupt();
        }
        List<Throwable> causes = new ArrayList<>();
        if (interruption != null) {
            causes.add(interruption);
        }
        causes.addAll(setupFaults);
        WorkpoolException error = new WorkpoolException(count, started, causes.isEmpty() ? null : causes.get(0));
        for (int i = 1; i < causes.size(); i++) {
            error.addSuppressed(causes.get(i));
        }
        stopFaults.forEach(error::addSuppressed);
        return error;
    }

    /**
     * Builds a brand-new pool with this pool's config and worker count. The new pool has its
     * own queue and threads and goes through the full startup protocol.
     *
     * @return an independent pool
     * @throws WorkpoolException if not every worker of the new pool completed setup
     */
    public Workpool<S, P> clonePool() throws WorkpoolException {
        return new Workpool<>(config);
    }

    /**
     * Enqueues one job. Blocks while a bounded queue is full.
     *
     * @param job The job payload, not {@code null}
     * @throws IllegalStateException if the pool is closed, or if every worker has died and the
     *         job could never be taken
     */
    public void execute(P job) {
        JobUnit<P> unit = JobUnit.task(job);
        if (closed.get()) {
            throw new IllegalStateException("Workpool is closed");
        }
        if (liveWorkers.get() == 0) {
            throw new IllegalStateException("Worker thread crashed");
        }
        try {
            if (!enqueue(unit)) {
                throw new IllegalStateException("Worker thread crashed");
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new IllegalStateException("Interrupted while submitting a job", e);
        }
    }

    /**
     * Enqueues every item of a collection. When the pool owns an iterator pool, items are
     * submitted concurrently from its threads; otherwise the calling thread submits them in
     * iteration order. Returns once every item is enqueued, not processed.
     *
     * @param items The jobs to submit
     * @throws IllegalStateException if the pool is closed, or if every worker has died
     */
    public void executeIter(Collection<? extends P> items) {
        if (closed.get()) {
            throw new IllegalStateException("Workpool is closed");
        }
        if (iteratorPool != null) {
            iteratorPool.submit(() -> items.parallelStream().forEach(this::execute)).join();
        } else {
            for (P item : items) {
                execute(item);
            }
        }
    }

    /**
     * Submits every item and then closes the pool, so this returns only after all items are
     * processed and every worker has exited.
     *
     * @param items The jobs to submit
     * @throws WorkerFaultException if a worker died during the pool's lifetime
     */
    public void executeAndFinishIter(Collection<? extends P> items) {
        try {
            executeIter(items);
        } finally {
            close();
        }
    }

    /**
     * @return the number of workers this pool was built with
     */
    public int workerCount() {
        return count;
    }

    /**
     * @return the number of worker threads that have not exited yet
     */
    public int liveWorkers() {
        return liveWorkers.get();
    }

    public PoolConfig<S, P> getConfig() {
        return config;
    }

    /**
     * Shuts the pool down: queues one terminate sentinel per configured worker behind any
     * pending jobs, waits for every thread to finish, and releases the iterator pool. Only the
     * first call has any effect.
     *
     * @throws WorkerFaultException if one or more workers died from a fault at any point
     */
    @Override
    public void close() {
        if (!closed.compareAndSet(false, true)) {
            return;
        }
        boolean interrupted = terminateAll();
        List<Integer> faultedIds = new ArrayList<>();
        List<Throwable> faults = new ArrayList<>();
        for (Worker<S, P> worker : workers) {
            Throwable fault = joinUninterruptibly(worker);
            if (fault != null) {
                faultedIds.add(worker.id());
                faults.add(fault);
            }
        }
        if (iteratorPool != null) {
            iteratorPool.shutdown();
        }
        if (interrupted) {
            Thread.currentThread().interrupt();
        }
        if (!faults.isEmpty()) {
            throw new WorkerFaultException(faultedIds, faults);
        }
    }

    /**
     * Queues {@code count} sentinels. Stops early once no worker is left to take them.
     *
     * @return true if the calling thread was interrupted along the way
     */
    private boolean terminateAll() {
        boolean interrupted = false;
        int sent = 0;
        while (sent < count) {
            try {
                if (!enqueue(JobUnit.terminate())) {
                    break;
                }
                sent++;
            } catch (InterruptedException e) {
                interrupted = true;
            }
        }
        return interrupted;
    }

    /**
     * Puts a unit on the queue, waiting for room as long as some worker is alive to make it.
     * On a bounded queue only the holder of the admission lock polls for room, so waiting
     * submitters get in strictly in the order they arrived.
     *
     * @return false if the queue stayed full and every worker has exited
     */
    private boolean enqueue(JobUnit<P> unit) throws InterruptedException {
        if (admission == null) {
            jobs.put(unit);
            return true;
        }
        admission.lockInterruptibly();
        try {
            while (!jobs.offer(unit, LIVENESS_POLL_MS, TimeUnit.MILLISECONDS)) {
                if (liveWorkers.get() == 0) {
                    return false;
                }
            }
            return true;
        } finally {
            admission.unlock();
        }
    }

    private static Throwable joinUninterruptibly(Worker<?, ?> worker) {
        boolean interrupted = false;
        try {
            while (true) {
                try {
                    return worker.join();
                } catch (InterruptedException e) {
                    interrupted = true;
                }
            }
        } finally {
            if (interrupted) {
                Thread.currentThread().interrupt();
            }
        }
    }
}
