package io.pulse.spi;

/**
 * Observability hook for exporting retry counters to a metrics backend.
 *
 * <p>The {@link #NOOP} instance discards all metrics silently. Implement this interface
 * to bridge into Micrometer, Prometheus, or other monitoring systems.
 *
 * @see io.pulse.retry.Retrier
 */
public interface RetryMetrics {

    /**
     * No-op instance that discards all metrics.
     */
    RetryMetrics NOOP = new Noop();

    /**
     * Increments the count of operations that eventually succeeded.
     */
    void incrementSuccess();

    /**
     * Increments the count of failed attempts that were scheduled for another try.
     */
    void incrementRetry();

    /**
     * Increments the count of operations abandoned after {@code maxTries}.
     */
    void incrementExhausted();

    /**
     * Increments the count of retry sequences aborted by cancellation.
     */
    void incrementCancelled();

    /**
     * Records a computed backoff wait.
     *
     * @param backoffMs wait in milliseconds (always non-negative)
     */
    default void recordBackoffMs(long backoffMs) {
    }

    /**
     * Default no-op implementation that discards all metrics.
     */
    final class Noop implements RetryMetrics {
        @Override
        public void incrementSuccess() {
        }

        @Override
        public void incrementRetry() {
        }

        @Override
        public void incrementExhausted() {
        }

        @Override
        public void incrementCancelled() {
        }
    }
}
