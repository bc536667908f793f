package org.example.mystery.service.cache;

import java.time.Duration;
import java.time.Instant;

/**
 * A cached value with its creation time, TTL and hit counter.
 * Only {@link CacheStore} creates and mutates entries, always while holding the store's monitor.
 */
final class CacheEntry<V> {

    private final V content;
    private final Instant createdAt;
    private final Duration ttl;
    private int accessCount;

    CacheEntry(V content, Instant createdAt, Duration ttl) {
        this.content = content;
        this.createdAt = createdAt;
        this.ttl = ttl;
    }

    boolean isExpired(Instant now) {
        return now.isAfter(createdAt.plus(ttl));
    }

    V access() {
        accessCount++;
        return content;
    }

    int getAccessCount() {
        return accessCount;
    }
}
