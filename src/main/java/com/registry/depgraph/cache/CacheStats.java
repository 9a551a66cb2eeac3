package com.registry.depgraph.cache;

/**
 * Point-in-time counters of a {@link ResultCache}. A read that found only a
 * stale entry counts as a miss and as a stale eviction.
 */
public record CacheStats(long epoch, long size, long hits, long misses, long staleEvictions, long evictions) {

    public double hitRate() {
        long total = hits + misses;
        return total == 0 ? 0.0 : (double) hits / total;
    }
}
