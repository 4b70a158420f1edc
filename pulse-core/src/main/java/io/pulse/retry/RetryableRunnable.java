package io.pulse.retry;

/**
 * A unit of work without a result that {@link Retrier#run} may invoke several times.
 */
@FunctionalInterface
public interface RetryableRunnable {
    void run() throws Exception;
}
