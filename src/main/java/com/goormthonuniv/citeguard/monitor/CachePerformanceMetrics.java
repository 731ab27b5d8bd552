package com.goormthonuniv.citeguard.monitor;

import com.goormthonuniv.citeguard.cache.CacheStats;

public record CachePerformanceMetrics(
        long totalRequests,
        long cacheHits,
        long cacheMisses,
        int cacheSize,
        long evictions
) {
    public static CachePerformanceMetrics from(CacheStats stats) {
        return new CachePerformanceMetrics(stats.lookups(), stats.lookupHits(), stats.lookupMisses(),
                stats.totalEntries(), stats.evictions());
    }

    public double hitRate() {
        return totalRequests == 0 ? 0.0 : (double) cacheHits / totalRequests;
    }
}
