package io.pulse.concurrent;

import java.time.Duration;
import java.util.Objects;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.ScheduledThreadPoolExecutor;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Owner of a {@link CancellationToken}.
 *
 * <p>Hand {@link #token()} to code that should observe cancellation, keep the source
 * for the code that decides when to cancel. {@link #cancelAfter(Duration)} arms a
 * deadline on a shared scheduler; {@link #close()} disarms it without firing the token.
 *
 * <p>This class is thread-safe.
 */
public final class CancellationSource implements AutoCloseable {
    private static final ScheduledThreadPoolExecutor TIMER = newTimer();

    private final CountDownLatch fired = new CountDownLatch(1);
    private final AtomicReference<ScheduledFuture<?>> deadline = new AtomicReference<>();
    private final CancellationToken token = new LatchToken();

    /**
     * Returns the read-only token fired by this source.
     *
     * @return the token
     */
    public CancellationToken token() {
        return token;
    }

    /**
     * Fires the token. Idempotent.
     */
    public void cancel() {
        fired.countDown();
        disarm();
    }

    /**
     * Fires the token once {@code delay} has elapsed, replacing any deadline armed earlier.
     *
     * @param delay the delay before cancellation (zero or negative cancels immediately)
     * @return this source
     */
    public CancellationSource cancelAfter(Duration delay) {
        Objects.requireNonNull(delay, "delay");
        if (delay.isZero() || delay.isNegative()) {
            cancel();
            return this;
        }
        ScheduledFuture<?> scheduled = TIMER.schedule(this::cancel, delay.toNanos(), TimeUnit.NANOSECONDS);
        ScheduledFuture<?> previous = deadline.getAndSet(scheduled);
        if (previous != null) {
            previous.cancel(false);
        }
        return this;
    }

    public boolean isCancellationRequested() {
        return fired.getCount() == 0;
    }

    /**
     * Disarms a pending {@link #cancelAfter(Duration)} deadline. Does not fire the token.
     */
    @Override
    public void close() {
        disarm();
    }

    /**
     * Returns the number of deadlines queued on the shared timer, across all sources.
     */
    static int pendingDeadlines() {
        return TIMER.getQueue().size();
    }

    private static ScheduledThreadPoolExecutor newTimer() {
        ScheduledThreadPoolExecutor timer = new ScheduledThreadPoolExecutor(1, new TimerThreadFactory());
        // disarmed deadlines leave the queue at once instead of at their expiry
        timer.setRemoveOnCancelPolicy(true);
        return timer;
    }

    private void disarm() {
        ScheduledFuture<?> pending = deadline.getAndSet(null);
        if (pending != null) {
            pending.cancel(false);
        }
    }

    @Override
    public String toString() {
        return "CancellationSource{cancelled=" + isCancellationRequested() + '}';
    }

    private final class LatchToken implements CancellationToken {
        @Override
        public boolean isCancellationRequested() {
            return fired.getCount() == 0;
        }

        @Override
        public boolean awaitCancellation(Duration timeout) throws InterruptedException {
            Objects.requireNonNull(timeout, "timeout");
            if (timeout.isZero() || timeout.isNegative()) {
                return isCancellationRequested();
            }
            return fired.await(timeout.toNanos(), TimeUnit.NANOSECONDS);
        }

        @Override
        public String toString() {
            return "CancellationToken{cancelled=" + isCancellationRequested() + '}';
        }
    }

    private static final class TimerThreadFactory implements ThreadFactory {
        private final AtomicInteger counter = new AtomicInteger(1);

        @Override
        public Thread newThread(Runnable runnable) {
            Thread thread = new Thread(runnable, "pulse-cancel-" + counter.getAndIncrement());
            thread.setDaemon(true);
            return thread;
        }
    }
}
