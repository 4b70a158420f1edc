package io.pulse.retry;

/**
 * Thrown when the try count exceeds {@link RetryParams#maxTries()}. No wait was performed.
 */
public class MaxRetriesExceededException extends RetryException {

    private final int maxTries;

    public MaxRetriesExceededException(int tries, int maxTries) {
        this(tries, maxTries, null);
    }

    /**
     * @param tries    the try count that was rejected
     * @param maxTries the configured ceiling
     * @param cause    the failure of the last attempt, or {@code null}
     */
    public MaxRetriesExceededException(int tries, int maxTries, Throwable cause) {
        super("Too many retries: " + tries + " > " + maxTries, tries, cause);
        this.maxTries = maxTries;
    }

    public int maxTries() {
        return maxTries;
    }
}
