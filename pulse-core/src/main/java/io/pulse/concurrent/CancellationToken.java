package io.pulse.concurrent;

import java.time.Duration;

/**
 * Read-only view of a cancellation signal.
 *
 * <p>A token fires at most once and never resets. Consumers such as
 * {@link io.pulse.retry.RetryParams#backoff(CancellationToken, int)} can observe or wait
 * for it but cannot fire it; only the owning {@link CancellationSource} can.
 *
 * @see CancellationSource
 */
public interface CancellationToken {

    /**
     * A token that never fires.
     */
    CancellationToken NONE = new CancellationToken() {
        @Override
        public boolean isCancellationRequested() {
            return false;
        }

        @Override
        public boolean awaitCancellation(Duration timeout) throws InterruptedException {
            if (!timeout.isNegative() && !timeout.isZero()) {
                Thread.sleep(timeout.toMillis(), timeout.toNanosPart() % 1_000_000);
            }
            return false;
        }

        @Override
        public String toString() {
            return "CancellationToken.NONE";
        }
    };

    /**
     * Returns whether the signal has fired.
     *
     * @return {@code true} once cancelled
     */
    boolean isCancellationRequested();

    /**
     * Blocks the calling thread until the signal fires or the timeout elapses.
     *
     * <p>Returns immediately for a zero or negative timeout.
     *
     * @param timeout the maximum time to wait
     * @return {@code true} if the signal fired, {@code false} if the timeout elapsed first
     * @throws InterruptedException if the calling thread is interrupted while waiting
     */
    boolean awaitCancellation(Duration timeout) throws InterruptedException;
}
