package org.stress;

import java.util.Objects;

/**
 * A message on a pool's job queue: either a task payload or the terminate sentinel.
 */
final class JobUnit<P> {
    private static final JobUnit<?> TERMINATE = new JobUnit<>(null);

    private final P payload;

    private JobUnit(P payload) {
        this.payload = payload;
    }

    static <P> JobUnit<P> task(P payload) {
        return new JobUnit<>(Objects.requireNonNull(payload, "job"));
    }

    @SuppressWarnings("unchecked")
    static <P> JobUnit<P> terminate() {
        return (JobUnit<P>) TERMINATE;
    }

    boolean isTerminate() {
        return this == TERMINATE;
    }

    P payload() {
        return payload;
    }
}
