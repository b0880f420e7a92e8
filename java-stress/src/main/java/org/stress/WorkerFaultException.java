package org.stress;

import java.util.Collections;
import java.util.List;

/**
 * Raised by {@link Workpool#close()} when one or more worker threads died from an uncaught
 * fault during the pool's lifetime. The first fault is the cause, the rest are suppressed.
 *
 * @author krishna.sundar
 * @version 1.0
 */
public class WorkerFaultException extends RuntimeException {
    private final List<Integer> faultedWorkers;

    public WorkerFaultException(List<Integer> faultedWorkers, List<Throwable> faults) {
        super("worker thread(s) " + faultedWorkers + " terminated abnormally", faults.isEmpty() ? null : faults.get(0));
        this.faultedWorkers = Collections.unmodifiableList(faultedWorkers);
        for (int i = 1; i < faults.size(); i++) {
            addSuppressed(faults.get(i));
        }
    }

    /** @return ids of the workers that faulted, in join order */
    public List<Integer> getFaultedWorkers() {
        return faultedWorkers;
    }
}
