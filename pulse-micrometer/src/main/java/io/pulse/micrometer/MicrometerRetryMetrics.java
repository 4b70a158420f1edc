package io.pulse.micrometer;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.DistributionSummary;
import io.micrometer.core.instrument.Meter;
import io.micrometer.core.instrument.MeterRegistry;
import io.pulse.spi.RetryMetrics;

import java.util.List;
import java.util.Objects;

/**
 * Micrometer-based implementation of {@link RetryMetrics}.
 *
 * <h3>Counters</h3>
 * <ul>
 *   <li>{@code pulse.retry.success} - operations that eventually succeeded</li>
 *   <li>{@code pulse.retry.attempt} - failed attempts scheduled for another try</li>
 *   <li>{@code pulse.retry.exhausted} - operations abandoned after max tries</li>
 *   <li>{@code pulse.retry.cancelled} - retry sequences aborted by cancellation</li>
 * </ul>
 *
 * <h3>Distribution Summaries</h3>
 * <ul>
 *   <li>{@code pulse.retry.backoff.ms} - computed backoff waits</li>
 * </ul>
 *
 * @see RetryMetrics
 */
public final class MicrometerRetryMetrics implements RetryMetrics, AutoCloseable {

    private final MeterRegistry registry;
    private final Counter success;
    private final Counter retry;
    private final Counter exhausted;
    private final Counter cancelled;
    private final DistributionSummary backoff;
    private volatile boolean closed;

    /**
     * Creates an exporter with the default metric name prefix {@code "pulse"}.
     *
     * @param registry the Micrometer meter registry
     */
    public MicrometerRetryMetrics(MeterRegistry registry) {
        this(registry, "pulse");
    }

    /**
     * Creates an exporter with a custom metric name prefix for multi-instance use.
     *
     * @param registry   the Micrometer meter registry
     * @param namePrefix prefix for all meter names (e.g. {@code "orders.pulse"})
     */
    public MicrometerRetryMetrics(MeterRegistry registry, String namePrefix) {
        Objects.requireNonNull(registry, "registry");
        Objects.requireNonNull(namePrefix, "namePrefix");
        if (namePrefix.isEmpty()) {
            throw new IllegalArgumentException("namePrefix must not be empty");
        }
        if (namePrefix.endsWith(".")) {
            throw new IllegalArgumentException("namePrefix must not end with '.'");
        }

        this.registry = registry;
        this.success = Counter.builder(namePrefix + ".retry.success")
                .description("Operations that eventually succeeded")
                .register(registry);
        this.retry = Counter.builder(namePrefix + ".retry.attempt")
                .description("Failed attempts scheduled for another try")
                .register(registry);
        this.exhausted = Counter.builder(namePrefix + ".retry.exhausted")
                .description("Operations abandoned after max tries")
                .register(registry);
        this.cancelled = Counter.builder(namePrefix + ".retry.cancelled")
                .description("Retry sequences aborted by cancellation")
                .register(registry);
        this.backoff = DistributionSummary.builder(namePrefix + ".retry.backoff.ms")
                .description("Computed backoff wait in milliseconds")
                .register(registry);
    }

    @Override
    public void incrementSuccess() {
        if (closed) return;
        success.increment();
    }

    @Override
    public void incrementRetry() {
        if (closed) return;
        retry.increment();
    }

    @Override
    public void incrementExhausted() {
        if (closed) return;
        exhausted.increment();
    }

    @Override
    public void incrementCancelled() {
        if (closed) return;
        cancelled.increment();
    }

    @Override
    public void recordBackoffMs(long backoffMs) {
        if (closed) return;
        backoff.record(backoffMs);
    }

    /**
     * Removes all meters registered by this exporter from the registry.
     */
    @Override
    public void close() {
        closed = true;
        RuntimeException first = null;
        for (Meter meter : List.of(success, retry, exhausted, cancelled, backoff)) {
            try {
                registry.remove(meter);
            } catch (RuntimeException e) {
                if (first == null) first = e;
                else first.addSuppressed(e);
            }
        }
        if (first != null) throw first;
    }
}
