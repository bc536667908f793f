package org.example.mystery.service.cache;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.function.Predicate;
import java.util.function.Supplier;

/**
 * Bounded in-memory cache with per-entry time-to-live.
 *
 * <p>Entries are kept in access order: a successful {@link #get} moves an entry to the
 * most recent end, and inserting a new key into a full cache evicts from the opposite end.
 * Nothing is evicted on access. Expiry is checked lazily on lookup; {@link #cleanupExpired()}
 * removes expired entries eagerly.
 *
 * <p>Every operation synchronizes on the store. {@link #getOrCompute} holds no lock
 * while the supplier runs, so two callers missing the same key may both compute; the later
 * {@code set} wins.
 */
public class CacheStore<V> {

    private static final Logger log = LoggerFactory.getLogger(CacheStore.class);

    private final int maxSize;
    private final Duration defaultTtl;
    private final Clock clock;
    private final LinkedHashMap<String, CacheEntry<V>> entries = new LinkedHashMap<>(16, 0.75f, true);
    private long hits;
    private long misses;

    public CacheStore(int maxSize, Duration defaultTtl) {
        this(maxSize, defaultTtl, Clock.systemUTC());
    }

    CacheStore(int maxSize, Duration defaultTtl, Clock clock) {
        if (maxSize < 1) {
            throw new IllegalArgumentException("maxSize must be at least 1");
        }
        this.maxSize = maxSize;
        this.defaultTtl = requireTtl(defaultTtl);
        this.clock = Objects.requireNonNull(clock, "clock must not be null");
    }

    public synchronized Optional<V> get(String key) {
        CacheEntry<V> entry = entries.get(key);
        if (entry == null) {
            misses++;
            return Optional.empty();
        }
        if (entry.isExpired(clock.instant())) {
            entries.remove(key);
            misses++;
            log.debug("Cache entry expired: {}", key);
            return Optional.empty();
        }
        hits++;
        return Optional.of(entry.access());
    }

    public void set(String key, V content) {
        set(key, content, defaultTtl);
    }

    public void set(String key, V content, Duration ttl) {
        Objects.requireNonNull(key, "key must not be null");
        Objects.requireNonNull(content, "content must not be null");
        Duration effectiveTtl = ttl == null ? defaultTtl : requireTtl(ttl);

        synchronized (this) {
            if (entries.remove(key) == null && entries.size() >= maxSize) {
                evictOldest();
            }
            entries.put(key, new CacheEntry<>(content, clock.instant(), effectiveTtl));
        }
    }

    public V getOrCompute(String key, Supplier<? extends V> compute, Duration ttl) {
        Optional<V> cached = get(key);
        if (cached.isPresent()) {
            return cached.get();
        }
        V computed = compute.get();
        set(key, computed, ttl);
        return computed;
    }

    public synchronized void invalidate(String key) {
        entries.remove(key);
    }

    /**
     * Removes every key matching the predicate, e.g. all entries of one character.
     */
    public synchronized int invalidateMatching(Predicate<String> keyFilter) {
        int before = entries.size();
        entries.keySet().removeIf(keyFilter);
        return before - entries.size();
    }

    public synchronized void clear() {
        entries.clear();
        hits = 0;
        misses = 0;
    }

    public synchronized int cleanupExpired() {
        Instant now = clock.instant();
        int removed = 0;
        Iterator<Map.Entry<String, CacheEntry<V>>> it = entries.entrySet().iterator();
        while (it.hasNext()) {
            if (it.next().getValue().isExpired(now)) {
                it.remove();
                removed++;
            }
        }
        if (removed > 0) {
            log.debug("Removed {} expired cache entries", removed);
        }
        return removed;
    }

    public synchronized CacheStats stats() {
        return CacheStats.of(entries.size(), maxSize, hits, misses);
    }

    public synchronized int size() {
        return entries.size();
    }

    synchronized int accessCount(String key) {
        // iterate rather than get() so that peeking does not reorder the entries
        for (Map.Entry<String, CacheEntry<V>> e : entries.entrySet()) {
            if (e.getKey().equals(key)) {
                return e.getValue().getAccessCount();
            }
        }
        return 0;
    }

    private void evictOldest() {
        Iterator<String> it = entries.keySet().iterator();
        if (it.hasNext()) {
            String eldest = it.next();
            it.remove();
            log.debug("Cache full ({} entries), evicted {}", maxSize, eldest);
        }
    }

    private static Duration requireTtl(Duration ttl) {
        if (ttl == null || ttl.isNegative()) {
            throw new IllegalArgumentException("ttl must be zero or positive");
        }
        return ttl;
    }
}
