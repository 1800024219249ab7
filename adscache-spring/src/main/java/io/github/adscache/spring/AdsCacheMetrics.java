package io.github.adscache.spring;

import io.github.adscache.core.TieredCacheManager;
import io.micrometer.core.instrument.FunctionCounter;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Tag;
import io.micrometer.core.instrument.binder.MeterBinder;

import java.util.Collections;

/**
 * Micrometer metrics binder for the tiered cache.
 *
 * <p>Metrics exposed:</p>
 * <ul>
 *   <li>{@code adscache.gets} - Counter for lookups (tagged by tier: fast/durable/none, result: hit/miss)</li>
 *   <li>{@code adscache.puts} - Counter for cache writes</li>
 *   <li>{@code adscache.evictions} - Counter for fast-tier evictions and expirations</li>
 *   <li>{@code adscache.durable.failures} - Counter for failed or timed-out durable-store calls</li>
 *   <li>{@code adscache.size} - Gauge for live fast-tier entries</li>
 *   <li>{@code adscache.hit.rate} - Gauge for cache hit rate (0.0 - 1.0)</li>
 * </ul>
 */
public class AdsCacheMetrics implements MeterBinder {

    private final TieredCacheManager cacheManager;
    private final Iterable<Tag> tags;

    public AdsCacheMetrics(TieredCacheManager cacheManager) {
        this(cacheManager, Collections.emptyList());
    }

    /**
     * @param tags additional tags to apply to all metrics
     */
    public AdsCacheMetrics(TieredCacheManager cacheManager, Iterable<Tag> tags) {
        this.cacheManager = cacheManager;
        this.tags = tags;
    }

    @Override
    public void bindTo(MeterRegistry registry) {
        FunctionCounter.builder("adscache.gets", cacheManager, c -> c.getStatistics().getFastHitCount())
                .tags(tags)
                .tag("tier", "fast")
                .tag("result", "hit")
                .description("The number of lookups answered by the in-process tier")
                .register(registry);

        FunctionCounter.builder("adscache.gets", cacheManager, c -> c.getStatistics().getDurableHitCount())
                .tags(tags)
                .tag("tier", "durable")
                .tag("result", "hit")
                .description("The number of lookups answered by the durable store")
                .register(registry);

        FunctionCounter.builder("adscache.gets", cacheManager, c -> c.getStatistics().getMissCount())
                .tags(tags)
                .tag("tier", "none")
                .tag("result", "miss")
                .description("The number of lookups answered by neither tier")
                .register(registry);

        FunctionCounter.builder("adscache.puts", cacheManager, c -> c.getStatistics().getPutCount())
                .tags(tags)
                .description("The number of cache writes")
                .register(registry);

        FunctionCounter.builder("adscache.evictions", cacheManager, c -> c.getStatistics().getEvictionCount())
                .tags(tags)
                .description("The number of fast-tier evictions")
                .register(registry);

        FunctionCounter.builder("adscache.durable.failures", cacheManager, c -> c.getStatistics().getDurableFailureCount())
                .tags(tags)
                .description("The number of durable-store calls that failed or timed out")
                .register(registry);

        Gauge.builder("adscache.size", cacheManager, c -> c.size())
                .tags(tags)
                .description("The current number of live fast-tier entries")
                .register(registry);

        Gauge.builder("adscache.hit.rate", cacheManager, c -> c.getStatistics().getHitRate())
                .tags(tags)
                .description("The cache hit rate (0.0 - 1.0)")
                .register(registry);
    }

    /**
     * Convenience method to bind metrics for a cache manager to a registry.
     *
     * @return the cache manager (for chaining)
     */
    public static TieredCacheManager monitor(TieredCacheManager cacheManager, MeterRegistry registry, Iterable<Tag> tags) {
        new AdsCacheMetrics(cacheManager, tags).bindTo(registry);
        return cacheManager;
    }
}
