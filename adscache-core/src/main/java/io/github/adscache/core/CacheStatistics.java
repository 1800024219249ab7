package io.github.adscache.core;

/**
 * Point-in-time snapshot of {@link TieredCacheManager} counters.
 */
public class CacheStatistics {
    private final long fastHitCount;
    private final long durableHitCount;
    private final long missCount;
    private final long putCount;
    private final long evictionCount;
    private final long durableFailureCount;

    public CacheStatistics(long fastHitCount, long durableHitCount, long missCount,
                           long putCount, long evictionCount, long durableFailureCount) {
        this.fastHitCount = fastHitCount;
        this.durableHitCount = durableHitCount;
        this.missCount = missCount;
        this.putCount = putCount;
        this.evictionCount = evictionCount;
        this.durableFailureCount = durableFailureCount;
    }

    /**
     * Returns the number of lookups answered by the in-process tier.
     */
    public long getFastHitCount() {
        return fastHitCount;
    }

    /**
     * Returns the number of lookups answered by the durable store (each one back-fills the fast tier).
     */
    public long getDurableHitCount() {
        return durableHitCount;
    }

    public long getHitCount() {
        return fastHitCount + durableHitCount;
    }

    /**
     * Returns the number of lookups that found nothing, including those where the durable store failed.
     */
    public long getMissCount() {
        return missCount;
    }

    public long getPutCount() {
        return putCount;
    }

    /**
     * Returns the number of fast-tier entries removed because they expired or were evicted.
     */
    public long getEvictionCount() {
        return evictionCount;
    }

    /**
     * Returns the number of durable-store calls that failed or timed out.
     */
    public long getDurableFailureCount() {
        return durableFailureCount;
    }

    public long getRequestCount() {
        return getHitCount() + missCount;
    }

    /**
     * Returns the hit rate as a value between 0.0 and 1.0.
     * Returns 0.0 if there are no requests.
     */
    public double getHitRate() {
        long total = getRequestCount();
        return total == 0 ? 0.0 : (double) getHitCount() / total;
    }

    public double getMissRate() {
        long total = getRequestCount();
        return total == 0 ? 0.0 : (double) missCount / total;
    }

    @Override
    public String toString() {
        return String.format(
            "CacheStatistics{fastHits=%d, durableHits=%d, misses=%d, hitRate=%.2f%%, puts=%d, evictions=%d, durableFailures=%d}",
            fastHitCount, durableHitCount, missCount, getHitRate() * 100, putCount, evictionCount, durableFailureCount
        );
    }
}
