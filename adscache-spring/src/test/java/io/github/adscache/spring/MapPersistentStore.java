package io.github.adscache.spring;

import io.github.adscache.core.PartitionHints;
import io.github.adscache.core.PersistentStore;
import io.github.adscache.core.StoreException;
import io.github.adscache.core.StoreUnavailableException;

import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

class MapPersistentStore implements PersistentStore {

    final Map<String, String> values = new ConcurrentHashMap<>();
    volatile boolean down;

    @Override
    public Optional<String> getByKey(String key) throws StoreException {
        checkUp();
        return Optional.ofNullable(values.get(key));
    }

    @Override
    public void put(String key, PartitionHints hints, String serializedValue) throws StoreException {
        checkUp();
        values.put(key, serializedValue);
    }

    @Override
    public void clearAll() throws StoreException {
        checkUp();
        values.clear();
    }

    @Override
    public long size() throws StoreException {
        checkUp();
        return values.size();
    }

    private void checkUp() throws StoreUnavailableException {
        if (down) {
            throw new StoreUnavailableException("connection refused");
        }
    }
}
