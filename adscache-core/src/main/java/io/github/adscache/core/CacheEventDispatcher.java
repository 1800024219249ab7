package io.github.adscache.core;

import java.util.List;
import java.util.function.Consumer;

import com.fasterxml.jackson.databind.JsonNode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Fans cache events out to the registered listeners. A failing listener is logged and skipped;
 * it never affects the cache operation or the other listeners.
 */
final class CacheEventDispatcher {

    private static final Logger logger = LoggerFactory.getLogger(CacheEventDispatcher.class);

    private final List<CacheEventListener> listeners;

    CacheEventDispatcher(List<CacheEventListener> listeners) {
        this.listeners = listeners != null ? List.copyOf(listeners) : List.of();
    }

    void fireOnPut(String key, JsonNode value) {
        dispatch("onPut", key, l -> l.onPut(key, value));
    }

    void fireOnEvict(String key) {
        dispatch("onEvict", key, l -> l.onEvict(key));
    }

    void fireOnClear(String prefix) {
        dispatch("onClear", prefix, l -> l.onClear(prefix));
    }

    void fireOnDurableFailure(String operation, String key, StoreException failure) {
        dispatch("onDurableFailure", key, l -> l.onDurableFailure(operation, key, failure));
    }

    private void dispatch(String event, String subject, Consumer<CacheEventListener> call) {
        if (listeners.isEmpty()) {
            return;
        }
        for (CacheEventListener listener : listeners) {
            try {
                call.accept(listener);
            } catch (RuntimeException e) {
                logger.warn("{}.{} failed for '{}': {}",
                            listener.getClass().getSimpleName(), event, subject, e.getMessage());
            }
        }
    }
}
