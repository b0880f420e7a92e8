package org.stress;

/**
 * Thrown when a {@link Workpool} could not bring all of its workers past the setup stage.
 *
 * <p>The first setup fault, if any worker died with one, is attached as the cause; further
 * setup faults and any faults raised while stopping the workers that did start are added as
 * suppressed exceptions.
 *
 * @author krishna.sundar
 * @version 1.0
 */
public class WorkpoolException extends Exception {
    private final int expected;
    private final int started;

    public WorkpoolException(int expected, int started, Throwable cause) {
        super("couldn't start all threads. expected " + expected + " but started " + started, cause);
        this.expected = expected;
        this.started = started;
    }

    public WorkpoolException(int expected, int started) {
        this(expected, started, null);
    }

    /** @return the number of workers the pool was configured with */
    public int getExpected() {
        return expected;
    }

    /** @return the number of workers that completed their setup stage */
    public int getStarted() {
        return started;
    }
}
