package org.example.mystery.service.cache;

import java.util.Locale;

public record CacheStats(
    int size,
    int maxSize,
    long hits,
    long misses,
    double hitRate,
    long totalRequests
) {
    static CacheStats of(int size, int maxSize, long hits, long misses) {
        long total = hits + misses;
        double rate = total > 0 ? (double) hits / total : 0.0;
        return new CacheStats(size, maxSize, hits, misses, rate, total);
    }

    public String hitRatePercent() {
        return String.format(Locale.ROOT, "%.2f%%", hitRate * 100);
    }
}
