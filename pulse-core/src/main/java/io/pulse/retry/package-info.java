/**
 * Retry backoff: {@link io.pulse.retry.RetryParams} computes waits and blocks for them,
 * {@link io.pulse.retry.Retrier} drives a whole retry sequence.
 *
 * @see io.pulse.retry.BackoffStrategy
 * @see io.pulse.retry.RetryException
 */
package io.pulse.retry;
