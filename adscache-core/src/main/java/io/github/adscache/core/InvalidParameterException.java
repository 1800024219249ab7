package io.github.adscache.core;

/**
 * Thrown when a cache key cannot be derived from the given namespace and parameters,
 * for example because a parameter cannot be represented as JSON.
 */
public class InvalidParameterException extends AdsCacheException {
    public InvalidParameterException(String message) {
        super(message);
    }

    public InvalidParameterException(String message, Throwable cause) {
        super(message, cause);
    }
}
