package io.pulse.retry;

import java.util.Locale;

/**
 * How {@link RetryParams#backoffFor(int)} scales the base {@code period} with the try count.
 *
 * <ul>
 *   <li>{@link #NONE}: flat wait of {@code period}</li>
 *   <li>{@link #CONSTANT}: {@code period}</li>
 *   <li>{@link #LINEAR}: {@code period * tries}</li>
 *   <li>{@link #EXPONENTIAL}: {@code period * 2^tries} (doubling, not {@code tries^2})</li>
 * </ul>
 */
public enum BackoffStrategy {
    NONE,
    CONSTANT,
    LINEAR,
    EXPONENTIAL;

    /**
     * Resolves a strategy name, ignoring case and surrounding whitespace.
     * Unrecognized or {@code null} names resolve to {@link #NONE}.
     *
     * @param name the strategy name, e.g. {@code "linear"}
     * @return the matching strategy, or {@link #NONE}
     */
    public static BackoffStrategy of(String name) {
        if (name == null) {
            return NONE;
        }
        switch (name.trim().toLowerCase(Locale.ROOT)) {
            case "constant":
                return CONSTANT;
            case "linear":
                return LINEAR;
            case "exponential":
                return EXPONENTIAL;
            default:
                return NONE;
        }
    }
}
