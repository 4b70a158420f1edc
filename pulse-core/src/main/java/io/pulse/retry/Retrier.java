package io.pulse.retry;

import io.pulse.concurrent.CancellationToken;
import io.pulse.spi.RetryMetrics;

import java.time.Duration;
import java.util.Objects;
import java.util.concurrent.Callable;
import java.util.function.Predicate;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Runs an operation until it succeeds, the retry budget of its {@link RetryParams} is
 * spent, or cancellation fires.
 *
 * <p>Each failed attempt increments the try count and calls
 * {@link RetryParams#backoff(CancellationToken, int)} before the next attempt, so an
 * operation runs at most {@code maxTries + 1} times. Outcomes:
 * <ul>
 *   <li>success: the operation's result is returned</li>
 *   <li>non-retryable failure (rejected by {@code retryOn}): rethrown unchanged</li>
 *   <li>budget spent: {@link MaxRetriesExceededException} with the last failure as cause</li>
 *   <li>cancelled: {@link RetryCancelledException} with the last failure suppressed</li>
 * </ul>
 *
 * <p>Create instances via {@link #builder()}. Instances are immutable and thread-safe;
 * every {@code execute} call is an independent retry sequence.
 */
public final class Retrier {
    private static final Logger defaultLogger = Logger.getLogger(Retrier.class.getName());

    private final RetryParams params;
    private final RetryMetrics metrics;
    private final Logger logger;
    private final Predicate<Exception> retryOn;

    private Retrier(Builder builder) {
        this.params = builder.params != null ? builder.params : RetryParams.DEFAULT;
        this.metrics = builder.metrics != null ? builder.metrics : RetryMetrics.NOOP;
        this.logger = builder.logger != null ? builder.logger : defaultLogger;
        this.retryOn = builder.retryOn != null ? builder.retryOn : e -> true;
    }

    public static Builder builder() {
        return new Builder();
    }

    public RetryParams params() {
        return params;
    }

    /**
     * Invokes {@code operation} with retries.
     *
     * @param token     cancellation signal for the backoff waits
     * @param operation the operation to invoke
     * @param <T>       result type
     * @return the first successful result
     * @throws MaxRetriesExceededException if every allowed attempt failed
     * @throws RetryCancelledException     if cancelled while waiting between attempts, or if
     *                                     the operation throws {@link InterruptedException}; the
     *                                     thread's interrupt flag is restored
     * @throws Exception                   a failure rejected by the {@code retryOn} predicate
     */
    public <T> T execute(CancellationToken token, Callable<T> operation) throws Exception {
        Objects.requireNonNull(token, "token");
        Objects.requireNonNull(operation, "operation");
        int tries = 0;
        while (true) {
            Exception failure;
            try {
                T result = operation.call();
                metrics.incrementSuccess();
                if (tries > 0 && logger.isLoggable(Level.FINE)) {
                    logger.fine("Operation succeeded after " + tries + " retries");
                }
                return result;
            } catch (RetryException e) {
                // nested retry outcomes are final
                throw e;
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                metrics.incrementCancelled();
                logger.info("Operation interrupted after " + tries + " failed attempts");
                throw new RetryCancelledException(tries, e);
            } catch (Exception e) {
                failure = e;
            }

            if (!retryOn.test(failure)) {
                throw failure;
            }
            tries++;
            awaitNextTry(token, tries, failure);
        }
    }

    /**
     * Invokes {@code operation} with retries; the no-result variant of
     * {@link #execute(CancellationToken, Callable)}.
     *
     * @param token     cancellation signal for the backoff waits
     * @param operation the operation to invoke
     * @throws Exception see {@link #execute(CancellationToken, Callable)}
     */
    public void run(CancellationToken token, RetryableRunnable operation) throws Exception {
        Objects.requireNonNull(operation, "operation");
        execute(token, () -> {
            operation.run();
            return null;
        });
    }

    private void awaitNextTry(CancellationToken token, int tries, Exception failure) {
        if (tries > params.maxTries()) {
            metrics.incrementExhausted();
            logger.log(Level.SEVERE, "Giving up after " + params.maxTries() + " retries", failure);
            throw new MaxRetriesExceededException(tries, params.maxTries(), failure);
        }
        Duration wait = params.backoffFor(tries);
        metrics.incrementRetry();
        metrics.recordBackoffMs(Math.max(0L, wait.toMillis()));
        logger.log(Level.WARNING, "Attempt " + tries + " failed, retrying in " + wait.toMillis() + "ms", failure);
        try {
            params.backoff(token, tries);
        } catch (RetryCancelledException e) {
            metrics.incrementCancelled();
            e.addSuppressed(failure);
            logger.info("Retry cancelled after " + tries + " failed attempts");
            throw e;
        }
    }

    /**
     * Builder for {@link Retrier}.
     */
    public static final class Builder {
        private RetryParams params;
        private RetryMetrics metrics;
        private Logger logger;
        private Predicate<Exception> retryOn;

        private Builder() {
        }

        /**
         * Optional. Defaults to {@link RetryParams#DEFAULT}.
         */
        public Builder params(RetryParams params) {
            this.params = params;
            return this;
        }

        /**
         * Optional. Defaults to {@link RetryMetrics#NOOP}.
         */
        public Builder metrics(RetryMetrics metrics) {
            this.metrics = metrics;
            return this;
        }

        /**
         * Sets the logger for retry diagnostics, e.g. one obtained from a
         * {@link io.pulse.logging.LoggerRegistry}.
         *
         * <p>Optional. Defaults to the logger named after this class.
         */
        public Builder logger(Logger logger) {
            this.logger = logger;
            return this;
        }

        /**
         * Sets which failures are retried. Failures rejected by the predicate are rethrown
         * at once.
         *
         * <p>Optional. Defaults to retrying every {@link Exception}.
         */
        public Builder retryOn(Predicate<Exception> retryOn) {
            this.retryOn = retryOn;
            return this;
        }

        public Retrier build() {
            return new Retrier(this);
        }
    }
}
