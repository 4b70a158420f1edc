package io.pulse.retry;

/**
 * Thrown when the cancellation signal fires, or the waiting thread is interrupted,
 * before the backoff wait completes.
 */
public class RetryCancelledException extends RetryException {

    public RetryCancelledException(int tries) {
        this(tries, null);
    }

    /**
     * @param tries the try count of the aborted wait
     * @param cause the {@link InterruptedException} if the thread was interrupted, else {@code null}
     */
    public RetryCancelledException(int tries, Throwable cause) {
        super("Retry cancelled while waiting for try " + tries, tries, cause);
    }
}
