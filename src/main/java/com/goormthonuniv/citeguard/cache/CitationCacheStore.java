package com.goormthonuniv.citeguard.cache;

import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicLong;

/**
 * 프로세스 로컬 인용 검증 캐시.
 * <ul>
 *   <li>키: "&lt;kind&gt;:&lt;rawKey&gt;" (citation / domain / url)</li>
 *   <li>만료: 쓰기 시점에 expiresAt 고정. url 은 min(ttl, 60분)</li>
 *   <li>용량 초과 시 createdAt 이 가장 오래된 것부터 제거 (LRU 아님)</li>
 *   <li>비활성화 시 get 은 항상 empty, set 은 no-op</li>
 * </ul>
 * 같은 키 동시 쓰기는 마지막 쓰기가 이긴다. 결과는 같은 입력이면 동일하므로 허용.
 */
@Slf4j
@Component
public class CitationCacheStore {

    private static final long URL_TTL_CAP_MINUTES = 60;

    private final ConcurrentHashMap<String, Slot> entries = new ConcurrentHashMap<>();
    private final Object evictionLock = new Object();
    private final AtomicLong insertSeq = new AtomicLong();
    private final AtomicLong lookups = new AtomicLong();
    private final AtomicLong lookupHits = new AtomicLong();
    private final AtomicLong evictions = new AtomicLong();

    private final boolean enabled;
    private final long ttlMinutes;
    private final int maxSize;
    private final Clock clock;

    @Autowired
    public CitationCacheStore(@Value("${citeguard.cache.enabled:true}") boolean enabled,
                              @Value("${citeguard.cache.ttl-minutes:1440}") long ttlMinutes,
                              @Value("${citeguard.cache.max-size:10000}") int maxSize) {
        this(enabled, ttlMinutes, maxSize, Clock.systemUTC());
    }

    public CitationCacheStore(boolean enabled, long ttlMinutes, int maxSize, Clock clock) {
        this.enabled = enabled;
        this.ttlMinutes = Math.max(0, ttlMinutes);
        this.maxSize = Math.max(1, maxSize);
        this.clock = clock;
    }

    public boolean isEnabled() {
        return enabled;
    }

    public <T> Optional<T> get(CacheKind<T> kind, String rawKey) {
        if (!enabled || rawKey == null) return Optional.empty();
        lookups.incrementAndGet();

        String key = kind.compositeKey(rawKey);
        Slot slot = entries.get(key);
        if (slot == null) return Optional.empty();

        if (slot.isExpired(clock.instant())) {
            entries.remove(key, slot);
            return Optional.empty();
        }

        int hits = slot.hitCount.incrementAndGet();
        lookupHits.incrementAndGet();
        log.debug("cache hit key={} hitCount={}", key, hits);
        return Optional.of(kind.cast(slot.result));
    }

    public <T> void set(CacheKind<T> kind, String rawKey, T value) {
        if (!enabled || rawKey == null || value == null) return;

        long ttl = kind == CacheKind.URL ? Math.min(ttlMinutes, URL_TTL_CAP_MINUTES) : ttlMinutes;
        Instant now = clock.instant();
        String key = kind.compositeKey(rawKey);
        entries.put(key, new Slot(key, value, now, now.plus(Duration.ofMinutes(ttl)), insertSeq.incrementAndGet()));

        if (entries.size() > maxSize) {
            enforceMaxSize();
        }
    }

    /** hitCount 를 올리지 않고 엔트리 상태를 본다. */
    public <T> Optional<CitationCacheEntry<T>> peek(CacheKind<T> kind, String rawKey) {
        if (rawKey == null) return Optional.empty();
        Slot slot = entries.get(kind.compositeKey(rawKey));
        if (slot == null) return Optional.empty();
        return Optional.of(new CitationCacheEntry<>(slot.key, kind.cast(slot.result),
                slot.createdAt, slot.expiresAt, slot.hitCount.get()));
    }

    public void clear() {
        int size = entries.size();
        entries.clear();
        log.info("Cache cleared: {} entries removed", size);
    }

    public int size() {
        return entries.size();
    }

    @Scheduled(fixedDelayString = "${citeguard.cache.sweep-interval-ms:3600000}",
               initialDelayString = "${citeguard.cache.sweep-interval-ms:3600000}")
    public void sweepExpired() {
        if (!enabled) return;
        Instant now = clock.instant();
        int before = entries.size();
        int removed = 0;
        for (Map.Entry<String, Slot> e : entries.entrySet()) {
            if (e.getValue().isExpired(now) && entries.remove(e.getKey(), e.getValue())) {
                removed++;
            }
        }
        if (removed > 0) {
            log.info("Cache cleanup: removed {} expired entries ({} -> {})", removed, before, entries.size());
        }
    }

    public CacheStats stats() {
        Instant now = clock.instant();
        List<Slot> snapshot = new ArrayList<>(entries.values());

        Map<String, Integer> byType = new LinkedHashMap<>();
        Map<String, Long> hitsByType = new LinkedHashMap<>();
        for (CacheKind<?> k : CacheKind.values()) {
            byType.put(k.prefix(), 0);
            hitsByType.put(k.prefix(), 0L);
        }

        long totalHits = 0;
        int expired = 0;
        for (Slot s : snapshot) {
            int hits = s.hitCount.get();
            totalHits += hits;
            if (s.isExpired(now)) expired++;
            String type = s.key.substring(0, s.key.indexOf(':'));
            byType.merge(type, 1, Integer::sum);
            hitsByType.merge(type, (long) hits, Long::sum);
        }

        long l = lookups.get();
        long h = lookupHits.get();
        return new CacheStats(
                enabled,
                snapshot.size(),
                maxSize,
                ttlMinutes,
                expired,
                totalHits,
                snapshot.isEmpty() ? 0.0 : (double) totalHits / snapshot.size(),
                byType,
                hitsByType,
                l,
                h,
                l - h,
                evictions.get()
        );
    }

    private void enforceMaxSize() {
        synchronized (evictionLock) {
            int overflow = entries.size() - maxSize;
            if (overflow <= 0) return;

            List<Slot> oldestFirst = new ArrayList<>(entries.values());
            oldestFirst.sort(Comparator.comparing((Slot s) -> s.createdAt).thenComparingLong(s -> s.seq));

            int removed = 0;
            for (Slot s : oldestFirst) {
                if (removed >= overflow) break;
                if (entries.remove(s.key, s)) removed++;
            }
            evictions.addAndGet(removed);
            log.info("Cache size enforced: removed {} oldest entries", removed);
        }
    }

    private static final class Slot {
        final String key;
        final Object result;
        final Instant createdAt;
        final Instant expiresAt;
        final long seq;
        final AtomicInteger hitCount = new AtomicInteger();

        Slot(String key, Object result, Instant createdAt, Instant expiresAt, long seq) {
            this.key = key;
            this.result = result;
            this.createdAt = createdAt;
            this.expiresAt = expiresAt;
            this.seq = seq;
        }

        boolean isExpired(Instant now) {
            return !now.isBefore(expiresAt);
        }
    }
}
