package org.stress;

import java.util.concurrent.CountDownLatch;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Countdown used by {@link Workpool} construction. Every worker reports exactly
 * once, either {@link #ready()} after its setup stage or {@link #failedBeforeReady()}
 * when it dies first. The constructor waits for all reports and compares the
 * ready count with the number of workers it spawned.
 */
final class StartupBarrier {
    private final CountDownLatch reports;
    private final AtomicInteger ready = new AtomicInteger();

    StartupBarrier(int workers) {
        this.reports = new CountDownLatch(workers);
    }

    void ready() {
        ready.incrementAndGet();
        reports.countDown();
    }

    void failedBeforeReady() {
        reports.countDown();
    }

    /**
     * Blocks until every worker has reported.
     *
     * @return the number of workers that reported ready
     */
    int await() throws InterruptedException {
        reports.await();
        return ready.get();
    }

    int readyCount() {
        return ready.get();
    }
}
