package com.goormthonuniv.citeguard.cache;

import java.util.Map;

public record CacheStats(
        boolean enabled,
        int totalEntries,
        int maxSize,
        long ttlMinutes,
        int expiredEntries,
        long totalHits,          // 현재 엔트리들의 hitCount 합
        double averageHits,
        Map<String, Integer> entriesByType,
        Map<String, Long> hitsByType,
        long lookups,            // get 호출 누계
        long lookupHits,
        long lookupMisses,
        long evictions
) {
    public double hitRate() {
        return lookups == 0 ? 0.0 : (double) lookupHits / lookups;
    }
}
