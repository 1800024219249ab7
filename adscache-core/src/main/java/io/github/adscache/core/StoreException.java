package io.github.adscache.core;

/**
 * Failure of a durable-tier operation.
 *
 * <p>Checked on purpose: every {@link PersistentStore} call site inside
 * {@link TieredCacheManager} has to decide how the failure degrades the cache.</p>
 */
public class StoreException extends Exception {
    private static final long serialVersionUID = 1L;

    public StoreException(String message) {
        super(message);
    }

    public StoreException(String message, Throwable cause) {
        super(message, cause);
    }
}
