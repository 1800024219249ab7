package io.github.adscache.core;

import com.fasterxml.jackson.databind.JsonNode;

/**
 * Listener for cache events. Callbacks run on the calling thread; exceptions they throw are
 * logged and otherwise ignored.
 */
public interface CacheEventListener {

    default void onPut(String key, JsonNode value) {}

    default void onEvict(String key) {}

    /**
     * @param prefix the cleared namespace, or {@code null} for a full clear of both tiers
     */
    default void onClear(String prefix) {}

    /**
     * A durable-store call failed and was absorbed by the manager.
     *
     * @param operation the store method that failed, for example {@code put}
     * @param key the affected key, {@code null} for whole-store operations
     */
    default void onDurableFailure(String operation, String key, StoreException failure) {}
}
