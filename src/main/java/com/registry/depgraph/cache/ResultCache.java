package com.registry.depgraph.cache;

import java.util.Optional;
import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.atomic.LongAdder;

import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;

import lombok.extern.log4j.Log4j2;

/**
 * Epoch-stamped memo of query results on top of a size-bounded Caffeine
 * cache.
 *
 * <p>
 * Every entry carries the epoch it was computed under. {@link #get} serves an
 * entry only if that epoch is still current; otherwise the entry is removed on
 * the spot and the lookup is a miss. {@link #invalidateAll} just advances the
 * epoch, so a publish never pays for clearing storage. Stale entries that are
 * never looked up again age out through Caffeine's size bound.
 *
 * <h3>Filling the cache</h3>
 * Read {@link #epoch()} <b>before</b> taking the graph snapshot, compute, then
 * {@link #put(CacheKey, long, Object)} with that epoch. If a publish lands in
 * between, the entry is born stale and is never served:
 *
 * <pre>{@code
 * long epoch = cache.epoch();
 * GraphSnapshot snapshot = store.current();
 * Object result = compute(snapshot);
 * cache.put(key, epoch, result);
 * }</pre>
 */
@Log4j2
public final class ResultCache {
    public static final long DEFAULT_MAXIMUM_SIZE = 10_000;

    private final Cache<CacheKey, CacheEntry> entries;
    private final AtomicLong epoch = new AtomicLong();
    // Caffeine saw these reads as hits; they are reported as misses.
    private final LongAdder staleReads = new LongAdder();

    public ResultCache() {
        this(DEFAULT_MAXIMUM_SIZE);
    }

    public ResultCache(long maximumSize) {
        if (maximumSize < 1)
            throw new IllegalArgumentException("maximumSize must be >= 1: " + maximumSize);
        this.entries = Caffeine.newBuilder()
                .maximumSize(maximumSize)
                .recordStats()
                .build();
    }

    public long epoch() {
        return epoch.get();
    }

    /** Returns a current entry, or empty on a miss. Stale entries are evicted. */
    public Optional<CacheEntry> get(CacheKey key) {
        CacheEntry entry = entries.getIfPresent(key);
        if (entry == null)
            return Optional.empty();
        long current = epoch.get();
        if (entry.epoch() != current) {
            staleReads.increment();
            // Only remove the exact stale entry; a fresh one may have replaced it.
            entries.asMap().remove(key, entry);
            log.debug("Evicted stale entry {} (epoch {} < {})", key, entry.epoch(), current);
            return Optional.empty();
        }
        return Optional.of(entry);
    }

    /**
     * Typed lookup of a current payload.
     *
     * @throws ClassCastException if the key holds a payload of another type
     */
    public <T> Optional<T> get(CacheKey key, Class<T> type) {
        return get(key).map(CacheEntry::payload).map(type::cast);
    }

    /** Stores a payload under the current epoch. */
    public void put(CacheKey key, Object payload) {
        put(key, epoch.get(), payload);
    }

    /**
     * Stores a payload computed under {@code computedAtEpoch}. Payloads from an
     * epoch that is already stale are dropped.
     */
    public void put(CacheKey key, long computedAtEpoch, Object payload) {
        if (computedAtEpoch != epoch.get())
            return;
        entries.put(key, new CacheEntry(key, computedAtEpoch, payload));
    }

    /** Advances the epoch. Every existing entry becomes stale. O(1). */
    public long invalidateAll() {
        long next = epoch.incrementAndGet();
        log.debug("Cache epoch advanced to {}", next);
        return next;
    }

    public CacheStats stats() {
        entries.cleanUp();
        com.github.benmanes.caffeine.cache.stats.CacheStats raw = entries.stats();
        long stale = staleReads.sum();
        return new CacheStats(epoch.get(), entries.estimatedSize(), raw.hitCount() - stale,
                raw.missCount() + stale, stale, raw.evictionCount());
    }
}
