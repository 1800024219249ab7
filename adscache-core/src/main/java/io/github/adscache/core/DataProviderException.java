package io.github.adscache.core;

/**
 * Raised by a {@link DataProvider} when the upstream advertising API call fails.
 */
public class DataProviderException extends RuntimeException {
    private final boolean transientFailure;

    public DataProviderException(String message, boolean transientFailure) {
        super(message);
        this.transientFailure = transientFailure;
    }

    public DataProviderException(String message, boolean transientFailure, Throwable cause) {
        super(message, cause);
        this.transientFailure = transientFailure;
    }

    /**
     * Whether retrying the same request later may succeed (quota, timeout, 5xx).
     */
    public boolean isTransient() {
        return transientFailure;
    }
}
