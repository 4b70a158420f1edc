package io.pulse.retry;

import io.pulse.concurrent.CancellationToken;

import java.time.Duration;
import java.util.Objects;

/**
 * Immutable retry configuration: a {@link BackoffStrategy}, a ceiling on retries and the
 * base {@code period} the strategy scales.
 *
 * <p>Carries no per-sequence state (the try count is passed in on every call), so one
 * instance can be shared by any number of concurrent retry sequences.
 *
 * @param strategy the backoff strategy
 * @param maxTries the maximum try count accepted by {@link #backoff} (must be &gt;= 1)
 * @param period   the base duration (must not be negative)
 * @see Retrier
 */
public record RetryParams(BackoffStrategy strategy, int maxTries, Duration period) {

    private static final Duration MAX_BACKOFF = Duration.ofNanos(Long.MAX_VALUE);

    /**
     * Linear backoff, 30 tries, 10ms period: waits of 10ms, 20ms ... 300ms.
     */
    public static final RetryParams DEFAULT = new RetryParams(BackoffStrategy.LINEAR, 30, Duration.ofMillis(10));

    public RetryParams {
        Objects.requireNonNull(strategy, "strategy");
        Objects.requireNonNull(period, "period");
        if (maxTries < 1) {
            throw new IllegalArgumentException("maxTries must be >= 1, got: " + maxTries);
        }
        if (period.isNegative()) {
            throw new IllegalArgumentException("period must not be negative, got: " + period);
        }
        if (period.compareTo(MAX_BACKOFF) > 0) {
            throw new IllegalArgumentException("period too large: " + period);
        }
    }

    /**
     * Returns the wait before the next try. Pure: the same {@code tries} always yields the
     * same duration.
     *
     * <p>{@code tries} is not validated. With {@code tries = 0}, {@link BackoffStrategy#LINEAR}
     * yields zero and {@link BackoffStrategy#EXPONENTIAL} yields {@code period}. Results that
     * would overflow are capped at {@code Long.MAX_VALUE} nanoseconds.
     *
     * @param tries the number of tries the caller has already made
     * @return the backoff duration
     */
    public Duration backoffFor(int tries) {
        switch (strategy) {
            case CONSTANT:
                return period;
            case LINEAR:
                return scale(tries);
            case EXPONENTIAL:
                // (long) truncates: negative tries give a factor of 0, huge tries saturate
                return scale((long) Math.pow(2.0, tries));
            case NONE:
            default:
                return period;
        }
    }

    /**
     * Blocks for {@link #backoffFor(int) backoffFor(tries)} or until {@code token} fires.
     *
     * <p>Only the calling thread is blocked. The wait ends within scheduler wake-up latency
     * of cancellation, and no timer outlives the call.
     *
     * @param token cancellation signal, observed read-only
     * @param tries the number of tries the caller has already made
     * @throws MaxRetriesExceededException if {@code tries > maxTries}; thrown without waiting
     * @throws RetryCancelledException     if the token fires before the wait completes, or the
     *                                     thread is interrupted (its interrupt flag is restored)
     */
    public void backoff(CancellationToken token, int tries) {
        Objects.requireNonNull(token, "token");
        if (tries > maxTries) {
            throw new MaxRetriesExceededException(tries, maxTries);
        }
        if (token.isCancellationRequested()) {
            throw new RetryCancelledException(tries);
        }
        Duration wait = backoffFor(tries);
        try {
            if (token.awaitCancellation(wait)) {
                throw new RetryCancelledException(tries);
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new RetryCancelledException(tries, e);
        }
    }

    private Duration scale(long factor) {
        long nanos = period.toNanos();
        if (factor != 0 && Math.abs(nanos) > Long.MAX_VALUE / Math.abs(factor)) {
            return factor > 0 ? MAX_BACKOFF : MAX_BACKOFF.negated();
        }
        return Duration.ofNanos(nanos * factor);
    }
}
