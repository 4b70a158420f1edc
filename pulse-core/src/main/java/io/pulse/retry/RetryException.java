package io.pulse.retry;

/**
 * Base class for the terminal outcomes of {@link RetryParams#backoff}.
 *
 * <p>Neither subclass means "try again": callers stop their retry sequence and
 * propagate the exception.
 *
 * @see MaxRetriesExceededException
 * @see RetryCancelledException
 */
public abstract class RetryException extends RuntimeException {

    private final int tries;

    protected RetryException(String message, int tries, Throwable cause) {
        super(message, cause);
        this.tries = tries;
    }

    /**
     * Returns the try count passed to the backoff call that failed.
     *
     * @return the try count
     */
    public int tries() {
        return tries;
    }
}
