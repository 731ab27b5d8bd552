package com.goormthonuniv.citeguard.cache;

import java.time.Instant;

/** 캐시 엔트리의 읽기 전용 스냅샷. 저장소 내부 상태는 밖으로 나가지 않는다. */
public record CitationCacheEntry<T>(
        String key,
        T result,
        Instant createdAt,
        Instant expiresAt,
        int hitCount
) {}
