package io.github.adscache.core;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.ArrayBlockingQueue;
import java.util.concurrent.Callable;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.ThreadPoolExecutor;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.LongAdder;
import java.util.function.Supplier;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.NullNode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Two-tier cache: an in-process map in front of a {@link PersistentStore}.
 *
 * <p>Lookups try the fast tier, then the durable store, back-filling the fast tier on a
 * durable hit. Writes go to the fast tier unconditionally and are then persisted on a best-effort
 * basis. Durable-store failures and timeouts are logged, counted and reported to listeners but
 * never thrown to callers: the fast tier stays authoritative for the lifetime of its entries.</p>
 *
 * <p><strong>Thread Safety:</strong></p>
 * <ul>
 *   <li>The fast tier is a {@link ConcurrentHashMap} of immutable {@link CacheEntry} objects, so a
 *       reader sees a whole entry or none</li>
 *   <li>Expired entries are removed with {@code remove(key, entry)} so a concurrent write is never lost</li>
 *   <li>Durable calls run on a dedicated executor and are bounded by the store timeout</li>
 * </ul>
 */
public class TieredCacheManager implements AutoCloseable {
    private static final Logger logger = LoggerFactory.getLogger(TieredCacheManager.class);

    private static final Duration DEFAULT_TTL = Duration.ofHours(1);
    private static final Duration DEFAULT_STORE_TIMEOUT = Duration.ofSeconds(2);
    private static final int DEFAULT_STORE_THREADS = 4;
    private static final int DEFAULT_STORE_QUEUE_CAPACITY = 256;

    private final ConcurrentMap<String, CacheEntry> fastTier = new ConcurrentHashMap<>();
    private final PersistentStore store;
    private final ObjectMapper objectMapper;
    private final Duration defaultTtl;
    private final Duration storeTimeout;
    private final PartitionHintsResolver hintsResolver;
    private final Clock clock;
    private final CacheEventDispatcher eventDispatcher;
    private final ExecutorService storeExecutor;
    private volatile ScheduledExecutorService cleanupExecutor;

    private final LongAdder fastHits = new LongAdder();
    private final LongAdder durableHits = new LongAdder();
    private final LongAdder misses = new LongAdder();
    private final LongAdder puts = new LongAdder();
    private final LongAdder evictions = new LongAdder();
    private final LongAdder durableFailures = new LongAdder();

    private TieredCacheManager(Builder builder) {
        this.store = builder.store;
        this.objectMapper = builder.objectMapper;
        this.defaultTtl = builder.defaultTtl;
        this.storeTimeout = builder.storeTimeout;
        this.hintsResolver = new PartitionHintsResolver(builder.defaultHints);
        this.clock = builder.clock;
        this.eventDispatcher = new CacheEventDispatcher(builder.listeners);
        // bounded so a stuck store rejects new calls instead of queueing them without limit
        this.storeExecutor = new ThreadPoolExecutor(builder.storeThreads, builder.storeThreads,
                                                    0L, TimeUnit.MILLISECONDS,
                                                    new ArrayBlockingQueue<>(builder.storeQueueCapacity),
                                                    daemonThreads("adscache-store"));

        logger.info("TieredCacheManager initialized with default TTL: {}, store timeout: {}, store: {}",
                    defaultTtl, storeTimeout, store.getClass().getSimpleName());

        if (builder.backgroundCleanup) {
            startBackgroundCleanup(builder.cleanupInterval);
        }
    }

    // ==================== Lookup ====================

    /**
     * Looks a key up in the fast tier, then in the durable store.
     *
     * @param key a key produced by {@link CacheKeyGenerator}
     * @return the outcome; never throws for durable-store problems
     */
    public CacheLookup lookup(String key) {
        requireKey(key);
        Instant now = clock.instant();

        CacheEntry entry = fastTier.get(key);
        if (entry != null) {
            if (!entry.isExpired(now)) {
                fastHits.increment();
                logger.debug("Fast-tier hit for key: {}", key);
                return CacheLookup.fastHit(entry.getValue().deepCopy());
            }
            if (fastTier.remove(key, entry)) {
                evictions.increment();
                logger.debug("Removed expired fast-tier entry for key: {}", key);
            }
        }

        Optional<String> serialized;
        try {
            serialized = callStore("getByKey", () -> store.getByKey(key));
        } catch (StoreException e) {
            misses.increment();
            recordDurableFailure("getByKey", key, e);
            return CacheLookup.durableFailure(e);
        }

        if (serialized == null || !serialized.isPresent()) {
            misses.increment();
            logger.debug("Cache miss for key: {}", key);
            return CacheLookup.miss();
        }

        JsonNode value;
        try {
            value = objectMapper.readTree(serialized.get());
        } catch (JsonProcessingException e) {
            misses.increment();
            StoreException failure = new StoreException("Durable value for key '" + key + "' is not valid JSON", e);
            recordDurableFailure("getByKey", key, failure);
            return CacheLookup.durableFailure(failure);
        }

        CacheEntry backfilled = new CacheEntry(value, now.plus(defaultTtl));
        // a write that landed since the fast-tier miss is newer than the durable copy
        CacheEntry current = fastTier.compute(key, (k, existing) ->
            existing != null && !existing.isExpired(now) ? existing : backfilled);

        if (current != backfilled) {
            fastHits.increment();
            return CacheLookup.fastHit(current.getValue().deepCopy());
        }
        durableHits.increment();
        logger.debug("Durable-tier hit for key: {}, back-filled fast tier", key);
        return CacheLookup.durableHit(value.deepCopy());
    }

    /**
     * @return the cached value, empty on miss or durable-store failure
     */
    public Optional<JsonNode> get(String key) {
        return lookup(key).value();
    }

    /**
     * Gets a cached value converted to {@code type}.
     *
     * @throws AdsCacheException if the cached value cannot be converted to {@code type}
     */
    public <T> Optional<T> get(String key, Class<T> type) {
        Optional<JsonNode> value = get(key);
        if (!value.isPresent()) {
            return Optional.empty();
        }
        return Optional.ofNullable(convert(key, value.get(), type));
    }

    // ==================== Store ====================

    public boolean set(String key, Object value) {
        return set(key, value, defaultTtl, null);
    }

    public boolean set(String key, Object value, Duration ttl) {
        return set(key, value, ttl, null);
    }

    /**
     * Stores a value in both tiers.
     *
     * @param ttl   fast-tier time to live, must be positive
     * @param hints partition hints for the durable store; {@code null} to read them from the value
     * @return {@code false} only if the value cannot be represented as JSON; a durable-store
     *         failure still returns {@code true}
     */
    public boolean set(String key, Object value, Duration ttl, PartitionHints hints) {
        requireKey(key);
        if (ttl == null || ttl.isNegative() || ttl.isZero()) {
            throw new IllegalArgumentException("TTL must be positive");
        }

        JsonNode tree;
        String serialized;
        try {
            tree = toTree(value);
            serialized = objectMapper.writeValueAsString(tree);
        } catch (IllegalArgumentException | InvalidParameterException | JsonProcessingException e) {
            logger.warn("Value for key '{}' cannot be cached: {}", key, e.getMessage());
            return false;
        }

        fastTier.put(key, new CacheEntry(tree, clock.instant().plus(ttl)));
        puts.increment();
        eventDispatcher.fireOnPut(key, tree);

        PartitionHints effectiveHints = hints != null
            ? hints.withSegmentation(CacheKeyGenerator.namespaceOf(key), ttl.getSeconds())
            : hintsResolver.resolve(key, tree, ttl);
        try {
            callStore("put", () -> {
                store.put(key, effectiveHints, serialized);
                return null;
            });
            logger.debug("Data cached with key: {}, TTL: {}s, {}", key, ttl.getSeconds(), effectiveHints);
        } catch (StoreException e) {
            recordDurableFailure("put", key, e);
        }
        return true;
    }

    /**
     * Returns the cached value or computes, caches and returns it. Loader exceptions propagate
     * and nothing is cached.
     */
    public <T> T getOrCompute(String key, Class<T> type, Supplier<? extends T> loader) {
        return getOrCompute(key, type, defaultTtl, loader);
    }

    public <T> T getOrCompute(String key, Class<T> type, Duration ttl, Supplier<? extends T> loader) {
        Optional<JsonNode> cached = get(key);
        if (cached.isPresent()) {
            return convert(key, cached.get(), type);
        }
        T value = loader.get();
        set(key, value, ttl);
        return value;
    }

    // ==================== Invalidation ====================

    /**
     * Removes one key from the fast tier. The durable copy is left to expire; a later lookup
     * may back-fill it again.
     *
     * @return whether a fast-tier entry was removed
     */
    public boolean evict(String key) {
        requireKey(key);
        boolean removed = fastTier.remove(key) != null;
        if (removed) {
            evictions.increment();
            eventDispatcher.fireOnEvict(key);
        }
        return removed;
    }

    /**
     * Removes every fast-tier key in namespace {@code prefix} (including nested namespaces such as
     * {@code prefix:sub}). Memory only: durable entries are left untouched.
     * A {@code null} prefix behaves like {@link #clear()}.
     *
     * @return always {@code true} for a prefix clear
     */
    public boolean clear(String prefix) {
        if (prefix == null) {
            return clear();
        }
        if (prefix.isEmpty()) {
            throw new IllegalArgumentException("Clear prefix cannot be empty");
        }

        String scope = prefix + CacheKeyGenerator.NAMESPACE_SEPARATOR;
        int removed = 0;
        for (Iterator<String> it = fastTier.keySet().iterator(); it.hasNext(); ) {
            if (it.next().startsWith(scope)) {
                it.remove();
                removed++;
            }
        }
        logger.info("Cleared {} fast-tier entries with prefix '{}'", removed, prefix);
        eventDispatcher.fireOnClear(prefix);
        return true;
    }

    /**
     * Clears the fast tier and then the whole durable store.
     *
     * @return {@code false} if the durable clear failed; the fast tier is cleared regardless
     */
    public boolean clear() {
        int removed = fastTier.size();
        fastTier.clear();
        eventDispatcher.fireOnClear(null);

        try {
            callStore("clearAll", () -> {
                store.clearAll();
                return null;
            });
        } catch (StoreException e) {
            recordDurableFailure("clearAll", null, e);
            return false;
        }
        logger.info("All cache entries cleared ({} fast-tier entries and durable store)", removed);
        return true;
    }

    // ==================== Housekeeping ====================

    /**
     * @return number of live fast-tier entries
     */
    public int size() {
        Instant now = clock.instant();
        int live = 0;
        for (CacheEntry entry : fastTier.values()) {
            if (!entry.isExpired(now)) {
                live++;
            }
        }
        return live;
    }

    /**
     * @return number of live fast-tier entries in namespace {@code prefix}, nested ones included
     */
    public int size(String prefix) {
        String scope = prefix + CacheKeyGenerator.NAMESPACE_SEPARATOR;
        Instant now = clock.instant();
        int live = 0;
        for (Map.Entry<String, CacheEntry> e : fastTier.entrySet()) {
            if (e.getKey().startsWith(scope) && !e.getValue().isExpired(now)) {
                live++;
            }
        }
        return live;
    }

    /**
     * Remaining fast-tier TTL for a key, empty if absent or expired.
     */
    public Optional<Duration> getRemainingTtl(String key) {
        requireKey(key);
        CacheEntry entry = fastTier.get(key);
        Instant now = clock.instant();
        if (entry == null || entry.isExpired(now)) {
            return Optional.empty();
        }
        return Optional.of(entry.remainingTtl(now));
    }

    /**
     * Removes all expired entries from the fast tier.
     *
     * @return the number of entries removed
     */
    public int cleanupExpired() {
        Instant now = clock.instant();
        int removed = 0;
        for (Map.Entry<String, CacheEntry> e : fastTier.entrySet()) {
            if (e.getValue().isExpired(now) && fastTier.remove(e.getKey(), e.getValue())) {
                removed++;
            }
        }
        if (removed > 0) {
            evictions.add(removed);
            logger.info("Cleaned up {} expired fast-tier entries", removed);
        } else {
            logger.debug("No expired fast-tier entries found during cleanup");
        }
        return removed;
    }

    /**
     * Asks the durable store to purge entries past its own retention.
     *
     * @return the number of durable entries removed, or -1 if the store failed
     */
    public int cleanupDurable() {
        try {
            return callStore("cleanupExpired", store::cleanupExpired);
        } catch (StoreException e) {
            recordDurableFailure("cleanupExpired", null, e);
            return -1;
        }
    }

    /**
     * Asks the durable store for its live entry count, bounded by the store timeout.
     * Unlike the other operations this surfaces the failure, for health probes.
     *
     * @return the store's count, or -1 if it cannot count cheaply
     * @throws StoreException if the store failed or timed out
     */
    public long durableSize() throws StoreException {
        return callStore("size", store::size);
    }

    public CacheStatistics getStatistics() {
        return new CacheStatistics(fastHits.sum(), durableHits.sum(), misses.sum(),
                                   puts.sum(), evictions.sum(), durableFailures.sum());
    }

    public void resetStatistics() {
        fastHits.reset();
        durableHits.reset();
        misses.reset();
        puts.reset();
        evictions.reset();
        durableFailures.reset();
    }

    public Duration getDefaultTtl() {
        return defaultTtl;
    }

    public Duration getStoreTimeout() {
        return storeTimeout;
    }

    public PersistentStore getStore() {
        return store;
    }

    public PartitionHints getDefaultHints() {
        return hintsResolver.getDefaults();
    }

    // ==================== Internals ====================

    /**
     * Runs a durable-store call on the store executor, bounded by the store timeout.
     */
    private <T> T callStore(String operation, StoreCall<T> call) throws StoreException {
        Future<T> future;
        try {
            future = storeExecutor.submit((Callable<T>) call::call);
        } catch (RejectedExecutionException e) {
            if (storeExecutor.isShutdown()) {
                throw new StoreUnavailableException("Cache manager is closed", e);
            }
            throw new StoreUnavailableException(operation + " rejected: durable store call queue is full", e);
        }

        try {
            return future.get(storeTimeout.toMillis(), TimeUnit.MILLISECONDS);
        } catch (TimeoutException e) {
            future.cancel(true);
            throw new StoreUnavailableException(operation + " timed out after " + storeTimeout.toMillis() + "ms", e);
        } catch (InterruptedException e) {
            future.cancel(true);
            Thread.currentThread().interrupt();
            throw new StoreException(operation + " interrupted", e);
        } catch (ExecutionException e) {
            Throwable cause = e.getCause();
            if (cause instanceof StoreException) {
                throw (StoreException) cause;
            }
            if (cause instanceof Error) {
                throw (Error) cause;
            }
            throw new StoreException(operation + " failed: " + cause.getMessage(), cause);
        }
    }

    private void recordDurableFailure(String operation, String key, StoreException e) {
        durableFailures.increment();
        if (key != null) {
            logger.warn("Durable store {} failed for key '{}': {}", operation, key, e.getMessage());
        } else {
            logger.warn("Durable store {} failed: {}", operation, e.getMessage());
        }
        eventDispatcher.fireOnDurableFailure(operation, key, e);
    }

    private JsonNode toTree(Object value) {
        if (value == null) {
            return NullNode.getInstance();
        }
        if (value instanceof JsonNode) {
            return ((JsonNode) value).deepCopy();
        }
        CacheKeyGenerator.requireAcyclic(value);
        return objectMapper.valueToTree(value);
    }

    private <T> T convert(String key, JsonNode value, Class<T> type) {
        try {
            return objectMapper.treeToValue(value, type);
        } catch (JsonProcessingException | IllegalArgumentException e) {
            throw new AdsCacheException("Cached value for key '" + key + "' cannot be read as " + type.getSimpleName(), e);
        }
    }

    private static void requireKey(String key) {
        if (key == null || key.isEmpty()) {
            throw new IllegalArgumentException("Cache key cannot be null or empty");
        }
    }

    private void startBackgroundCleanup(Duration interval) {
        cleanupExecutor = Executors.newSingleThreadScheduledExecutor(daemonThreads("adscache-cleanup"));
        long millis = interval.toMillis();
        cleanupExecutor.scheduleWithFixedDelay(() -> {
            try {
                cleanupExpired();
                cleanupDurable();
            } catch (Exception e) {
                logger.warn("Background cleanup failed", e);
            }
        }, millis, millis, TimeUnit.MILLISECONDS);
        logger.info("Started background cleanup with interval: {}", interval);
    }

    private static ThreadFactory daemonThreads(String name) {
        AtomicInteger counter = new AtomicInteger();
        return r -> {
            Thread t = new Thread(r, name + "-" + counter.incrementAndGet());
            t.setDaemon(true);
            return t;
        };
    }

    /**
     * Stops the background cleanup task and the durable-call executor.
     */
    @Override
    public void close() {
        ScheduledExecutorService cleanup = cleanupExecutor;
        if (cleanup != null) {
            shutdown(cleanup);
            logger.info("Background cleanup shutdown completed");
        }
        shutdown(storeExecutor);
    }

    private static void shutdown(ExecutorService executor) {
        executor.shutdown();
        try {
            if (!executor.awaitTermination(5, TimeUnit.SECONDS)) {
                executor.shutdownNow();
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            executor.shutdownNow();
        }
    }

    @FunctionalInterface
    private interface StoreCall<T> {
        T call() throws StoreException;
    }

    /**
     * Creates a builder for TieredCacheManager.
     */
    public static Builder builder() {
        return new Builder();
    }

    /**
     * Builder for TieredCacheManager.
     */
    public static class Builder {
        private PersistentStore store;
        private ObjectMapper objectMapper = new ObjectMapper();
        private Duration defaultTtl = DEFAULT_TTL;
        private Duration storeTimeout = DEFAULT_STORE_TIMEOUT;
        private int storeThreads = DEFAULT_STORE_THREADS;
        private int storeQueueCapacity = DEFAULT_STORE_QUEUE_CAPACITY;
        private PartitionHints defaultHints = PartitionHints.DEFAULTS;
        private Clock clock = Clock.systemUTC();
        private final List<CacheEventListener> listeners = new ArrayList<>();
        private boolean backgroundCleanup = false;
        private Duration cleanupInterval = Duration.ofMinutes(5);

        private Builder() {
        }

        /**
         * Sets the durable store backing the fast tier. Required.
         */
        public Builder store(PersistentStore store) {
            this.store = store;
            return this;
        }

        /**
         * Sets the object mapper used to convert values to and from JSON.
         */
        public Builder objectMapper(ObjectMapper objectMapper) {
            this.objectMapper = objectMapper;
            return this;
        }

        /**
         * Sets the TTL used by {@code set} without explicit TTL and for back-filled entries.
         */
        public Builder defaultTtl(Duration defaultTtl) {
            this.defaultTtl = defaultTtl;
            return this;
        }

        /**
         * Sets the upper bound on any single durable-store call.
         */
        public Builder storeTimeout(Duration storeTimeout) {
            this.storeTimeout = storeTimeout;
            return this;
        }

        public Builder storeThreads(int storeThreads) {
            this.storeThreads = storeThreads;
            return this;
        }

        /**
         * Sets how many durable-store calls may wait for a free store thread. Calls beyond that
         * fail fast as store-unavailable.
         */
        public Builder storeQueueCapacity(int storeQueueCapacity) {
            this.storeQueueCapacity = storeQueueCapacity;
            return this;
        }

        /**
         * Sets the partition hints used when a value carries none.
         */
        public Builder defaultHints(PartitionHints defaultHints) {
            this.defaultHints = defaultHints;
            return this;
        }

        public Builder clock(Clock clock) {
            this.clock = clock;
            return this;
        }

        public Builder addEventListener(CacheEventListener listener) {
            this.listeners.add(Objects.requireNonNull(listener, "listener"));
            return this;
        }

        /**
         * Enables a periodic sweep of expired fast-tier entries and of the durable store's retention.
         */
        public Builder enableBackgroundCleanup(boolean backgroundCleanup) {
            this.backgroundCleanup = backgroundCleanup;
            return this;
        }

        public Builder cleanupInterval(Duration cleanupInterval) {
            this.cleanupInterval = cleanupInterval;
            return this;
        }

        /**
         * @throws IllegalStateException if the store is not set or a duration is not positive
         */
        public TieredCacheManager build() {
            if (store == null) {
                throw new IllegalStateException("PersistentStore must be set");
            }
            if (objectMapper == null) {
                objectMapper = new ObjectMapper();
            }
            requirePositive(defaultTtl, "defaultTtl");
            requirePositive(storeTimeout, "storeTimeout");
            if (backgroundCleanup) {
                requirePositive(cleanupInterval, "cleanupInterval");
            }
            if (storeThreads < 1) {
                throw new IllegalStateException("storeThreads must be at least 1");
            }
            if (storeQueueCapacity < 1) {
                throw new IllegalStateException("storeQueueCapacity must be at least 1");
            }
            if (defaultHints == null) {
                defaultHints = PartitionHints.DEFAULTS;
            }
            if (clock == null) {
                clock = Clock.systemUTC();
            }
            return new TieredCacheManager(this);
        }

        private static void requirePositive(Duration value, String name) {
            if (value == null || value.isNegative() || value.isZero()) {
                throw new IllegalStateException(name + " must be positive");
            }
        }
    }
}
