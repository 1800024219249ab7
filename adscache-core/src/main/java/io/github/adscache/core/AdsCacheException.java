package io.github.adscache.core;

/**
 * Base exception for adscache errors.
 */
public class AdsCacheException extends RuntimeException {
    public AdsCacheException(String message) {
        super(message);
    }

    public AdsCacheException(String message, Throwable cause) {
        super(message, cause);
    }
}
