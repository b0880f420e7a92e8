package org.stress;

import org.HdrHistogram.Histogram;

/**
 * Outcome of one workload run: merged latency histogram (microseconds), operation
 * and miss counts, and the wall-clock time between the first submission and the
 * last worker exiting.
 */
public class WorkloadResult {
    private final String workload;
    private final Histogram latency;
    private final long ops;
    private final long misses;
    private final long elapsedNanos;

    public WorkloadResult(String workload, Histogram latency, long ops, long misses, long elapsedNanos) {
        this.workload = workload;
        this.latency = latency;
        this.ops = ops;
        this.misses = misses;
        this.elapsedNanos = elapsedNanos;
    }

    public String getWorkload() {
        return workload;
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

    public double getElapsedSeconds() {
        return elapsedNanos / 1_000_000_000.0;
    }

    /**
     * @return operations per second over the elapsed time, or 0.0 if nothing ran
     */
    public double getThroughput() {
        double seconds = getElapsedSeconds();
        return seconds > 0 ? ops / seconds : 0.0;
    }
}
