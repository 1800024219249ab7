package io.github.adscache.core;

import java.util.Optional;

/**
 * Durable tier behind {@link TieredCacheManager}.
 *
 * <p>Values cross this boundary as serialized JSON. Implementations may block on I/O; the
 * manager bounds every call with its store timeout and never lets a {@link StoreException}
 * reach its own callers.</p>
 */
public interface PersistentStore {

    /**
     * @return the serialized value stored under {@code key}, empty if absent or expired
     */
    Optional<String> getByKey(String key) throws StoreException;

    /**
     * Inserts or replaces the value stored under {@code key}.
     *
     * @param hints account/date partition and segmentation for the entry
     */
    void put(String key, PartitionHints hints, String serializedValue) throws StoreException;

    /**
     * Removes every entry.
     */
    void clearAll() throws StoreException;

    /**
     * Purges entries past the store's own retention. Stores without retention return 0.
     *
     * @return number of entries removed
     */
    default int cleanupExpired() throws StoreException {
        return 0;
    }

    /**
     * @return number of live entries, or -1 if the store cannot count cheaply
     */
    default long size() throws StoreException {
        return -1;
    }
}
