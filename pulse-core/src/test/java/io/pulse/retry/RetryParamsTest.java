package io.pulse.retry;

import io.pulse.concurrent.CancellationSource;
import io.pulse.concurrent.CancellationToken;
import org.junit.jupiter.api.Test;

import java.time.Duration;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class RetryParamsTest {

    private static final Duration TEN_MS = Duration.ofMillis(10);

    @Test
    void defaultIsLinearThirtyTriesTenMillis() {
        assertEquals(BackoffStrategy.LINEAR, RetryParams.DEFAULT.strategy());
        assertEquals(30, RetryParams.DEFAULT.maxTries());
        assertEquals(TEN_MS, RetryParams.DEFAULT.period());
        assertEquals(Duration.ofMillis(300), RetryParams.DEFAULT.backoffFor(30));
    }

    @Test
    void linearScalesPeriodByTries() {
        RetryParams params = new RetryParams(BackoffStrategy.LINEAR, 30, TEN_MS);

        assertEquals(Duration.ZERO, params.backoffFor(0));
        assertEquals(Duration.ofMillis(10), params.backoffFor(1));
        assertEquals(Duration.ofMillis(50), params.backoffFor(5));
        assertEquals(Duration.ofMillis(300), params.backoffFor(30));
    }

    @Test
    void exponentialDoublesPerTry() {
        RetryParams params = new RetryParams(BackoffStrategy.EXPONENTIAL, 10, Duration.ofMillis(1));

        assertEquals(Duration.ofMillis(1), params.backoffFor(0));
        assertEquals(Duration.ofMillis(2), params.backoffFor(1));
        assertEquals(Duration.ofMillis(8), params.backoffFor(3));
        assertEquals(Duration.ofMillis(1024), params.backoffFor(10));
    }

    @Test
    void constantAndNoneReturnPeriod() {
        RetryParams constant = new RetryParams(BackoffStrategy.CONSTANT, 3, TEN_MS);
        RetryParams none = new RetryParams(BackoffStrategy.NONE, 3, TEN_MS);

        for (int tries : new int[]{0, 1, 7, 100}) {
            assertEquals(TEN_MS, constant.backoffFor(tries));
            assertEquals(TEN_MS, none.backoffFor(tries));
        }
    }

    @Test
    void backoffForIsDeterministic() {
        RetryParams params = new RetryParams(BackoffStrategy.EXPONENTIAL, 5, Duration.ofMillis(3));

        assertEquals(params.backoffFor(4), params.backoffFor(4));
        assertEquals(new RetryParams(BackoffStrategy.EXPONENTIAL, 5, Duration.ofMillis(3)).backoffFor(4),
                params.backoffFor(4));
    }

    @Test
    void negativeTriesApplyFormulaUnvalidated() {
        RetryParams linear = new RetryParams(BackoffStrategy.LINEAR, 3, TEN_MS);
        RetryParams exponential = new RetryParams(BackoffStrategy.EXPONENTIAL, 3, TEN_MS);

        assertEquals(Duration.ofMillis(-10), linear.backoffFor(-1));
        assertEquals(Duration.ZERO, exponential.backoffFor(-1));
    }

    @Test
    void exponentialSaturatesInsteadOfOverflowing() {
        RetryParams params = new RetryParams(BackoffStrategy.EXPONENTIAL, 100, Duration.ofSeconds(1));

        assertEquals(Duration.ofNanos(Long.MAX_VALUE), params.backoffFor(80));
        assertEquals(Duration.ofNanos(Long.MAX_VALUE), params.backoffFor(2000));
    }

    @Test
    void rejectsInvalidParameters() {
        assertThrows(NullPointerException.class, () -> new RetryParams(null, 1, TEN_MS));
        assertThrows(NullPointerException.class, () -> new RetryParams(BackoffStrategy.LINEAR, 1, null));
        assertThrows(IllegalArgumentException.class, () -> new RetryParams(BackoffStrategy.LINEAR, 0, TEN_MS));
        assertThrows(IllegalArgumentException.class,
                () -> new RetryParams(BackoffStrategy.LINEAR, 1, Duration.ofMillis(-1)));
    }

    @Test
    void zeroPeriodIsAllowed() {
        RetryParams params = new RetryParams(BackoffStrategy.CONSTANT, 1, Duration.ZERO);

        assertEquals(Duration.ZERO, params.backoffFor(1));
    }

    @Test
    void backoffBeyondMaxTriesFailsWithoutWaiting() {
        RetryParams params = new RetryParams(BackoffStrategy.CONSTANT, 3, Duration.ofSeconds(10));

        long start = System.nanoTime();
        MaxRetriesExceededException ex = assertThrows(MaxRetriesExceededException.class,
                () -> params.backoff(CancellationToken.NONE, 4));
        long elapsedMs = (System.nanoTime() - start) / 1_000_000;

        assertTrue(elapsedMs < 100, "Expected no wait, took " + elapsedMs + "ms");
        assertEquals(4, ex.tries());
        assertEquals(3, ex.maxTries());
        assertNull(ex.getCause());
    }

    @Test
    void backoffAtMaxTriesStillWaits() {
        RetryParams params = new RetryParams(BackoffStrategy.CONSTANT, 3, Duration.ofMillis(20));

        long start = System.nanoTime();
        params.backoff(CancellationToken.NONE, 3);
        long elapsedMs = (System.nanoTime() - start) / 1_000_000;

        assertTrue(elapsedMs >= 15, "Expected ~20ms wait, took " + elapsedMs + "ms");
    }

    @Test
    void backoffWaitsForComputedDuration() {
        RetryParams params = new RetryParams(BackoffStrategy.LINEAR, 10, Duration.ofMillis(15));

        try (CancellationSource source = new CancellationSource()) {
            long start = System.nanoTime();
            params.backoff(source.token(), 2);
            long elapsedMs = (System.nanoTime() - start) / 1_000_000;

            assertTrue(elapsedMs >= 25, "Expected ~30ms wait, took " + elapsedMs + "ms");
        }
    }

    @Test
    void cancellationAbortsWaitPromptly() {
        RetryParams params = new RetryParams(BackoffStrategy.CONSTANT, 5, Duration.ofMillis(100));

        try (CancellationSource source = new CancellationSource()) {
            source.cancelAfter(Duration.ofMillis(5));
            long start = System.nanoTime();
            RetryCancelledException ex = assertThrows(RetryCancelledException.class,
                    () -> params.backoff(source.token(), 1));
            long elapsedMs = (System.nanoTime() - start) / 1_000_000;

            assertTrue(elapsedMs < 80, "Expected early return, took " + elapsedMs + "ms");
            assertEquals(1, ex.tries());
        }
    }

    @Test
    void alreadyCancelledTokenFailsImmediately() {
        RetryParams params = new RetryParams(BackoffStrategy.CONSTANT, 5, Duration.ofSeconds(10));
        CancellationSource source = new CancellationSource();
        source.cancel();

        assertThrows(RetryCancelledException.class, () -> params.backoff(source.token(), 1));
    }

    @Test
    void alreadyCancelledTokenFailsEvenForZeroWait() {
        RetryParams params = new RetryParams(BackoffStrategy.LINEAR, 5, TEN_MS);
        CancellationSource source = new CancellationSource();
        source.cancel();

        assertThrows(RetryCancelledException.class, () -> params.backoff(source.token(), 0));
    }

    @Test
    void maxTriesCheckPrecedesCancellation() {
        RetryParams params = new RetryParams(BackoffStrategy.CONSTANT, 1, TEN_MS);
        CancellationSource source = new CancellationSource();
        source.cancel();

        assertThrows(MaxRetriesExceededException.class, () -> params.backoff(source.token(), 2));
    }

    @Test
    void interruptionCancelsAndRestoresFlag() {
        RetryParams params = new RetryParams(BackoffStrategy.CONSTANT, 5, Duration.ofSeconds(10));

        try (CancellationSource source = new CancellationSource()) {
            Thread.currentThread().interrupt();
            RetryCancelledException ex = assertThrows(RetryCancelledException.class,
                    () -> params.backoff(source.token(), 1));

            assertTrue(Thread.interrupted());
            assertTrue(ex.getCause() instanceof InterruptedException);
        }
    }

    @Test
    void zeroWaitReturnsImmediately() {
        RetryParams params = new RetryParams(BackoffStrategy.LINEAR, 5, Duration.ofSeconds(1));

        try (CancellationSource source = new CancellationSource()) {
            long start = System.nanoTime();
            params.backoff(source.token(), 0);
            long elapsedMs = (System.nanoTime() - start) / 1_000_000;

            assertTrue(elapsedMs < 100, "Expected no wait, took " + elapsedMs + "ms");
        }
    }

    @Test
    void rejectsNullToken() {
        assertThrows(NullPointerException.class, () -> RetryParams.DEFAULT.backoff(null, 1));
    }
}
