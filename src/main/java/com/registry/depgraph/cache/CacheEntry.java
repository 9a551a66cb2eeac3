package com.registry.depgraph.cache;

/** A memoized payload, valid only while {@code epoch} is the cache's current epoch. */
public record CacheEntry(CacheKey key, long epoch, Object payload) {
}
