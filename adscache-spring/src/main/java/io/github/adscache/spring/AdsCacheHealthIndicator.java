package io.github.adscache.spring;

import io.github.adscache.core.CacheStatistics;
import io.github.adscache.core.TieredCacheManager;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.actuate.health.Health;
import org.springframework.boot.actuate.health.HealthIndicator;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Health indicator for the tiered cache.
 * Reports DOWN when the durable store cannot be reached within the store timeout.
 */
public class AdsCacheHealthIndicator implements HealthIndicator {

    private static final Logger logger = LoggerFactory.getLogger(AdsCacheHealthIndicator.class);

    private final TieredCacheManager cacheManager;

    public AdsCacheHealthIndicator(TieredCacheManager cacheManager) {
        this.cacheManager = cacheManager;
    }

    @Override
    public Health health() {
        Map<String, Object> details = new LinkedHashMap<>();
        details.put("fast.size", cacheManager.size());

        CacheStatistics stats = cacheManager.getStatistics();
        details.put("stats.fastHits", stats.getFastHitCount());
        details.put("stats.durableHits", stats.getDurableHitCount());
        details.put("stats.misses", stats.getMissCount());
        details.put("stats.hitRate", String.format("%.2f%%", stats.getHitRate() * 100));
        details.put("stats.puts", stats.getPutCount());
        details.put("stats.evictions", stats.getEvictionCount());
        details.put("stats.durableFailures", stats.getDurableFailureCount());

        try {
            details.put("durable.size", cacheManager.durableSize());
            return Health.up().withDetails(details).build();
        } catch (Exception e) {
            logger.error("Tiered cache health check failed: {}", e.getMessage());
            return Health.down()
                    .withDetails(details)
                    .withDetail("error", e.getMessage())
                    .build();
        }
    }
}
