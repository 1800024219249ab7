package io.github.adscache.core;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.jupiter.api.Assertions.*;

class TieredCacheManagerTest {

    private final ObjectMapper mapper = new ObjectMapper();

    private InMemoryPersistentStore store;
    private MutableClock clock;
    private RecordingListener listener;
    private TieredCacheManager cache;

    @BeforeEach
    void setUp() {
        store = new InMemoryPersistentStore();
        clock = new MutableClock(Instant.parse("2024-03-01T10:00:00Z"));
        listener = new RecordingListener();
        cache = TieredCacheManager.builder()
                .store(store)
                .clock(clock)
                .storeTimeout(Duration.ofMillis(500))
                .addEventListener(listener)
                .build();
    }

    @AfterEach
    void tearDown() {
        store.release();
        cache.close();
    }

    @Test
    void testSetThenGetReturnsValueFromFastTier() throws Exception {
        // Arrange
        ObjectNode value = mapper.createObjectNode().put("clicks", 10);

        // Act
        assertTrue(cache.set("campaigns:1", value));
        CacheLookup lookup = cache.lookup("campaigns:1");

        // Assert
        assertEquals(CacheLookup.Outcome.FAST_HIT, lookup.getOutcome());
        assertEquals(value, lookup.value().get());
        assertEquals(0, store.getCalls.get());
        assertEquals(1, store.putCalls.get());
        assertEquals(mapper.readTree("{\"clicks\":10}"), mapper.readTree(store.values.get("campaigns:1")));
    }

    @Test
    void testReturnedValuesAreCopies() {
        ObjectNode value = mapper.createObjectNode().put("clicks", 10);
        cache.set("campaigns:1", value);

        // Mutating the caller's tree or a returned tree must not leak into the cache
        value.put("clicks", 99);
        ((ObjectNode) cache.get("campaigns:1").get()).put("clicks", 77);

        assertEquals(10, cache.get("campaigns:1").get().get("clicks").asInt());
    }

    @Test
    void testTtlExpiryWithRealClock() throws InterruptedException {
        // Arrange - durable writes are dropped so the stub store answers Missing as well
        store.dropWrites();
        try (TieredCacheManager realTime = TieredCacheManager.builder().store(store).build()) {
            realTime.set("campaigns:ttl", Collections.singletonMap("cost", 1), Duration.ofSeconds(1));

            // Act & Assert - immediately available
            assertTrue(realTime.get("campaigns:ttl").isPresent());

            Thread.sleep(1100);

            CacheLookup lookup = realTime.lookup("campaigns:ttl");
            assertEquals(CacheLookup.Outcome.MISS, lookup.getOutcome());
            assertFalse(lookup.value().isPresent());
            assertEquals(0, realTime.size());
        }
    }

    @Test
    void testTtlBoundaryWithControlledClock() {
        store.dropWrites();
        cache.set("k:1", "v", Duration.ofSeconds(60));

        clock.advance(Duration.ofSeconds(60));
        assertTrue(cache.get("k:1").isPresent(), "entry is live at its expiration instant");

        clock.advance(Duration.ofMillis(1));
        assertFalse(cache.get("k:1").isPresent());
        assertEquals(1, cache.getStatistics().getEvictionCount());
    }

    @Test
    void testDurableHitBackfillsFastTierAndSurvivesOutage() throws Exception {
        // Arrange - prime only the durable store
        store.values.put("campaigns:abc", "{\"id\":1,\"cost\":42.0}");
        JsonNode expected = mapper.readTree("{\"id\":1,\"cost\":42.0}");

        // Act
        CacheLookup first = cache.lookup("campaigns:abc");
        store.goDown();
        CacheLookup second = cache.lookup("campaigns:abc");

        // Assert
        assertEquals(CacheLookup.Outcome.DURABLE_HIT, first.getOutcome());
        assertEquals(expected, first.value().get());
        assertEquals(CacheLookup.Outcome.FAST_HIT, second.getOutcome());
        assertEquals(expected, second.value().get());
        assertEquals(1, store.getCalls.get());
        assertEquals(Optional.of(Duration.ofHours(1)), cache.getRemainingTtl("campaigns:abc"));
    }

    @Test
    void testDurableWriteFailureKeepsFastTierAndIsObservable() {
        // Arrange
        store.failWrites();
        Map<String, Object> value = Collections.singletonMap("clicks", 3);

        // Act
        boolean stored = cache.set("campaigns:fail", value);

        // Assert
        assertTrue(stored);
        assertEquals(3, cache.get("campaigns:fail").get().get("clicks").asInt());
        assertEquals(1, cache.getStatistics().getDurableFailureCount());
        assertEquals(1, listener.failures.size());
        assertEquals("put:campaigns:fail", listener.failures.get(0));
        assertFalse(store.values.containsKey("campaigns:fail"));
    }

    @Test
    void testDurableOutageOnLookupIsDistinguishableFromMiss() {
        store.goDown();

        CacheLookup lookup = cache.lookup("campaigns:missing");

        assertEquals(CacheLookup.Outcome.DURABLE_FAILURE, lookup.getOutcome());
        assertFalse(lookup.isHit());
        assertFalse(lookup.value().isPresent());
        assertTrue(lookup.failure().get() instanceof StoreUnavailableException);
        assertFalse(cache.get("campaigns:missing").isPresent());
        assertEquals(2, cache.getStatistics().getMissCount());
    }

    @Test
    void testUndecodableDurablePayloadIsReportedAsFailure() {
        store.values.put("campaigns:bad", "{not json");

        CacheLookup lookup = cache.lookup("campaigns:bad");

        assertEquals(CacheLookup.Outcome.DURABLE_FAILURE, lookup.getOutcome());
        assertEquals(1, cache.getStatistics().getDurableFailureCount());
    }

    @Test
    void testHungStoreTimesOut() {
        // Arrange
        store.hang();
        long start = System.nanoTime();

        // Act
        CacheLookup lookup = cache.lookup("campaigns:slow");
        boolean stored = cache.set("campaigns:slow", "value");

        // Assert
        long elapsedMillis = TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - start);
        assertEquals(CacheLookup.Outcome.DURABLE_FAILURE, lookup.getOutcome());
        assertTrue(lookup.failure().get() instanceof StoreUnavailableException);
        assertTrue(stored);
        assertEquals("value", cache.get("campaigns:slow").get().asText());
        assertTrue(elapsedMillis < 5000, "store calls must be bounded by the timeout, took " + elapsedMillis);
        assertEquals(2, cache.getStatistics().getDurableFailureCount());
    }

    @Test
    void testStuckStoreRejectsCallsOnceQueueIsFull() {
        // Arrange
        store.hangIgnoringInterrupts();
        try (TieredCacheManager bounded = TieredCacheManager.builder()
                .store(store)
                .clock(clock)
                .storeTimeout(Duration.ofMillis(50))
                .storeThreads(1)
                .storeQueueCapacity(1)
                .build()) {
            // first call pins the only store thread, second one waits in the queue
            assertEquals(CacheLookup.Outcome.DURABLE_FAILURE, bounded.lookup("campaigns:1").getOutcome());
            assertEquals(CacheLookup.Outcome.DURABLE_FAILURE, bounded.lookup("campaigns:2").getOutcome());
            long start = System.nanoTime();

            // Act
            CacheLookup rejected = bounded.lookup("campaigns:3");
            boolean stored = bounded.set("campaigns:3", "value");

            // Assert
            long elapsedMillis = TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - start);
            assertEquals(CacheLookup.Outcome.DURABLE_FAILURE, rejected.getOutcome());
            Throwable failure = rejected.failure().get();
            assertTrue(failure instanceof StoreUnavailableException);
            assertTrue(failure.getMessage().contains("queue is full"), failure.getMessage());
            assertTrue(stored);
            assertEquals("value", bounded.get("campaigns:3").get().asText());
            assertTrue(elapsedMillis < 1000, "rejected calls must not wait for the timeout, took " + elapsedMillis);
            store.release();
        }
    }

    @Test
    void testPrefixClearIsolation() {
        // Arrange
        cache.set("a:1", "v1");
        cache.set("b:1", "v2");
        cache.set("a:nested:2", "v3");
        cache.set("ab:1", "v4");

        // Act
        assertTrue(cache.clear("a"));

        // Assert - only fast-tier entries under "a" are gone, durable copies remain
        assertEquals(CacheLookup.Outcome.FAST_HIT, cache.lookup("b:1").getOutcome());
        assertEquals(CacheLookup.Outcome.FAST_HIT, cache.lookup("ab:1").getOutcome());
        assertEquals(CacheLookup.Outcome.DURABLE_HIT, cache.lookup("a:1").getOutcome());
        assertEquals(CacheLookup.Outcome.DURABLE_HIT, cache.lookup("a:nested:2").getOutcome());
        assertEquals(4, store.values.size());
        assertEquals(Collections.singletonList("a"), listener.clears);
    }

    @Test
    void testEmptyPrefixIsRejected() {
        assertThrows(IllegalArgumentException.class, () -> cache.clear(""));
    }

    @Test
    void testFullClearFailureReturnsFalseButClearsFastTier() {
        cache.set("campaigns:1", "v");
        store.goDown();

        assertFalse(cache.clear());
        assertEquals(0, cache.size());
    }

    @Test
    void testEndToEndScenario() throws Exception {
        // Arrange
        JsonNode value = mapper.readTree("{\"id\":1,\"cost\":42.0}");

        // Act & Assert
        assertTrue(cache.set("campaigns:abc", value, Duration.ofSeconds(3600)));
        assertEquals(value, cache.get("campaigns:abc").get());

        assertTrue(cache.clear());

        assertFalse(cache.get("campaigns:abc").isPresent());
        assertEquals(0, store.size());
        assertEquals(Collections.singletonList(null), listener.clears);
    }

    @Test
    void testConcurrentSetAndGetNeverObserveTornValues() throws Exception {
        // Arrange
        int threads = 8;
        int iterations = 500;
        ExecutorService executor = Executors.newFixedThreadPool(threads);
        CountDownLatch start = new CountDownLatch(1);
        AtomicInteger torn = new AtomicInteger();
        List<Future<?>> futures = new ArrayList<>();

        // Act
        for (int t = 0; t < threads; t++) {
            final int writer = t;
            futures.add(executor.submit(() -> {
                start.await();
                for (int i = 0; i < iterations; i++) {
                    int stamp = writer * iterations + i;
                    ObjectNode value = mapper.createObjectNode().put("a", stamp).put("b", stamp).put("c", "v" + stamp);
                    cache.set("campaigns:shared", value);

                    Optional<JsonNode> read = cache.get("campaigns:shared");
                    if (read.isPresent()) {
                        JsonNode node = read.get();
                        int a = node.get("a").asInt();
                        if (a != node.get("b").asInt() || !("v" + a).equals(node.get("c").asText())) {
                            torn.incrementAndGet();
                        }
                    }
                }
                return null;
            }));
        }
        start.countDown();
        for (Future<?> future : futures) {
            future.get(30, TimeUnit.SECONDS);
        }
        executor.shutdown();

        // Assert
        assertEquals(0, torn.get());
        assertTrue(executor.awaitTermination(5, TimeUnit.SECONDS));
    }

    @Test
    void testPartitionHintDefaultsAreSentToStore() {
        cache.set("campaigns:abc", Collections.singletonMap("clicks", 1), Duration.ofMinutes(10));

        PartitionHints hints = store.hints.get("campaigns:abc");
        assertEquals("0", hints.getAccountId());
        assertEquals("2023-01-01", hints.getStartDate());
        assertEquals("2023-12-31", hints.getEndDate());
        assertEquals("campaigns", hints.getPrefix());
        assertEquals(600L, hints.getTtlSeconds());
    }

    @Test
    void testConfiguredDefaultHintsAndExplicitHints() {
        try (TieredCacheManager custom = TieredCacheManager.builder()
                .store(store)
                .defaultHints(PartitionHints.of("555", "2024-01-01", "2024-06-30"))
                .build()) {
            custom.set("keywords:1", "v");
            custom.set("keywords:2", "v", Duration.ofMinutes(1), PartitionHints.of("777", "2024-02-01", "2024-02-29"));

            assertEquals("555", store.hints.get("keywords:1").getAccountId());
            assertEquals("2024-06-30", store.hints.get("keywords:1").getEndDate());
            assertEquals(PartitionHints.of("777", "2024-02-01", "2024-02-29").withSegmentation("keywords", 60),
                store.hints.get("keywords:2"));
        }
    }

    @Test
    void testTypedGetAndConversionFailure() {
        cache.set("budgets:1", new Budget("daily", 1500));

        Budget budget = cache.get("budgets:1", Budget.class).get();
        assertEquals("daily", budget.name);
        assertEquals(1500, budget.amountMicros);

        cache.set("budgets:2", "not a budget");
        assertThrows(AdsCacheException.class, () -> cache.get("budgets:2", Budget.class));
    }

    @Test
    void testGetOrComputeCachesLoaderResult() {
        AtomicInteger calls = new AtomicInteger();

        Budget first = cache.getOrCompute("budgets:x", Budget.class, () -> {
            calls.incrementAndGet();
            return new Budget("x", 1);
        });
        Budget second = cache.getOrCompute("budgets:x", Budget.class, () -> {
            calls.incrementAndGet();
            return new Budget("y", 2);
        });

        assertEquals("x", first.name);
        assertEquals("x", second.name);
        assertEquals(1, calls.get());
    }

    @Test
    void testGetOrComputeLoaderFailurePropagatesAndCachesNothing() {
        assertThrows(IllegalStateException.class, () -> cache.getOrCompute("budgets:err", Budget.class, () -> {
            throw new IllegalStateException("api down");
        }));

        assertFalse(cache.get("budgets:err").isPresent());
        assertTrue(store.values.isEmpty());
    }

    @Test
    void testUnrepresentableValueIsNotCached() {
        assertFalse(cache.set("misc:1", new Object()));
        assertFalse(cache.get("misc:1").isPresent());
        assertEquals(0, store.putCalls.get());
    }

    @Test
    void testSelfReferencingValueIsNotCached() {
        Map<String, Object> map = new HashMap<>();
        map.put("self", map);
        List<Object> list = new ArrayList<>();
        list.add(list);

        assertFalse(cache.set("misc:map", map));
        assertFalse(cache.set("misc:list", list));
        assertFalse(cache.get("misc:map").isPresent());
        assertEquals(0, store.putCalls.get());
    }

    @Test
    void testNullValueIsCachedAsJsonNull() {
        assertTrue(cache.set("misc:null", null));

        CacheLookup lookup = cache.lookup("misc:null");
        assertTrue(lookup.isHit());
        assertTrue(lookup.value().get().isNull());
    }

    @Test
    void testInvalidArguments() {
        assertThrows(IllegalArgumentException.class, () -> cache.set("", "v"));
        assertThrows(IllegalArgumentException.class, () -> cache.set(null, "v"));
        assertThrows(IllegalArgumentException.class, () -> cache.set("k:1", "v", Duration.ZERO));
        assertThrows(IllegalArgumentException.class, () -> cache.set("k:1", "v", Duration.ofSeconds(-1)));
        assertThrows(IllegalArgumentException.class, () -> cache.get(""));
    }

    @Test
    void testEvictRemovesFastTierEntryOnly() {
        cache.set("campaigns:1", "v");

        assertTrue(cache.evict("campaigns:1"));
        assertFalse(cache.evict("campaigns:1"));
        assertEquals(CacheLookup.Outcome.DURABLE_HIT, cache.lookup("campaigns:1").getOutcome());
        assertEquals(Collections.singletonList("campaigns:1"), listener.evictions);
    }

    @Test
    void testCleanupExpiredAndSize() {
        cache.set("k:1", "v", Duration.ofSeconds(10));
        cache.set("k:2", "v", Duration.ofSeconds(100));
        assertEquals(2, cache.size());

        clock.advance(Duration.ofSeconds(11));

        assertEquals(1, cache.size());
        assertEquals(1, cache.size("k"));
        assertEquals(0, cache.size("other"));
        assertEquals(1, cache.cleanupExpired());
        assertEquals(0, cache.cleanupExpired());
    }

    @Test
    void testStatistics() {
        store.values.put("k:durable", "1");
        cache.set("k:fast", "v");

        cache.get("k:fast");
        cache.get("k:durable");
        cache.get("k:none");

        CacheStatistics stats = cache.getStatistics();
        assertEquals(1, stats.getFastHitCount());
        assertEquals(1, stats.getDurableHitCount());
        assertEquals(1, stats.getMissCount());
        assertEquals(1, stats.getPutCount());
        assertEquals(3, stats.getRequestCount());
        assertEquals(2.0 / 3, stats.getHitRate(), 0.0001);

        cache.resetStatistics();
        assertEquals(0, cache.getStatistics().getRequestCount());
    }

    @Test
    void testFailingListenerDoesNotBreakOperations() {
        try (TieredCacheManager withBadListener = TieredCacheManager.builder()
                .store(store)
                .addEventListener(new CacheEventListener() {
                    @Override
                    public void onPut(String key, JsonNode value) {
                        throw new RuntimeException("listener bug");
                    }
                })
                .build()) {
            assertTrue(withBadListener.set("k:1", "v"));
            assertTrue(withBadListener.get("k:1").isPresent());
        }
    }

    @Test
    void testClosedManagerKeepsServingFastTier() {
        cache.set("k:1", "v");
        cache.close();

        assertTrue(cache.set("k:2", "w"));
        assertEquals("w", cache.get("k:2").get().asText());
        assertEquals(CacheLookup.Outcome.DURABLE_FAILURE, cache.lookup("k:3").getOutcome());
    }

    @Test
    void testBackgroundCleanupPurgesExpiredEntries() throws InterruptedException {
        try (TieredCacheManager background = TieredCacheManager.builder()
                .store(store)
                .clock(clock)
                .enableBackgroundCleanup(true)
                .cleanupInterval(Duration.ofMillis(50))
                .build()) {
            background.set("k:1", "v", Duration.ofSeconds(1));
            clock.advance(Duration.ofSeconds(2));

            long deadline = System.currentTimeMillis() + 5000;
            while (background.getStatistics().getEvictionCount() == 0 && System.currentTimeMillis() < deadline) {
                Thread.sleep(20);
            }

            assertEquals(1, background.getStatistics().getEvictionCount());
        }
    }

    @Test
    void testDurableSizeSurfacesStoreFailure() throws Exception {
        cache.set("k:1", "v");
        assertEquals(1L, cache.durableSize());

        store.goDown();

        assertThrows(StoreUnavailableException.class, () -> cache.durableSize());
    }

    @Test
    void testBuilderValidation() {
        assertThrows(IllegalStateException.class, () -> TieredCacheManager.builder().build());
        assertThrows(IllegalStateException.class,
            () -> TieredCacheManager.builder().store(store).defaultTtl(Duration.ZERO).build());
        assertThrows(IllegalStateException.class,
            () -> TieredCacheManager.builder().store(store).storeTimeout(Duration.ofSeconds(-1)).build());
        assertThrows(IllegalStateException.class,
            () -> TieredCacheManager.builder().store(store).storeThreads(0).build());
        assertThrows(IllegalStateException.class,
            () -> TieredCacheManager.builder().store(store).storeQueueCapacity(0).build());
    }

    static class Budget {
        public String name;
        public long amountMicros;

        Budget() {
        }

        Budget(String name, long amountMicros) {
            this.name = name;
            this.amountMicros = amountMicros;
        }
    }

    static class RecordingListener implements CacheEventListener {
        final List<String> failures = new CopyOnWriteArrayList<>();
        final List<String> clears = new CopyOnWriteArrayList<>();
        final List<String> evictions = new CopyOnWriteArrayList<>();

        @Override
        public void onEvict(String key) {
            evictions.add(key);
        }

        @Override
        public void onClear(String prefix) {
            clears.add(prefix);
        }

        @Override
        public void onDurableFailure(String operation, String key, StoreException failure) {
            failures.add(operation + ":" + key);
        }
    }
}
