package com.goormthonuniv.citeguard.monitor;

import com.goormthonuniv.citeguard.dto.CitationVerificationResult;
import com.goormthonuniv.citeguard.dto.Segment;
import com.goormthonuniv.citeguard.dto.VerificationStatus;
import com.goormthonuniv.citeguard.verify.CitationScorer;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.DistributionSummary;
import io.micrometer.core.instrument.MeterRegistry;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentLinkedDeque;
import java.util.concurrent.atomic.AtomicLong;

/**
 * 인용 검증 세션/외부 API/캐시 지표 집계와 임계치 알림.
 * 측정값은 Micrometer 로 내보내고, 세션은 메모리 버퍼에 쌓아 리포트/헬스 계산에 쓴다.
 */
@Slf4j
@Service
public class CitationMonitoringService {

    static final Duration HEALTH_WINDOW = Duration.ofMinutes(5);
    static final Duration BUFFER_RETENTION = Duration.ofHours(24);
    static final int BUFFER_FLUSH_THRESHOLD = 1000;
    static final int MIN_API_CALLS_FOR_ERROR_RATE = 20;
    // 콜드 스타트 직후의 누적 적중률로는 알리지 않는다
    static final int MIN_CACHE_LOOKUPS_FOR_HIT_RATE = 50;
    private static final int RECENT_ALERT_LIMIT = 100;

    private final MeterRegistry registry;
    private final ApplicationEventPublisher events;
    private final AlertThresholds thresholds;
    private final Clock clock;

    private final ConcurrentHashMap<String, SessionRecord> metricsBuffer = new ConcurrentHashMap<>();
    private final ConcurrentHashMap<String, ApiCounters> apiCounters = new ConcurrentHashMap<>();
    private final ConcurrentLinkedDeque<CitationAlert> recentAlerts = new ConcurrentLinkedDeque<>();

    @Autowired
    public CitationMonitoringService(MeterRegistry registry,
                                     ApplicationEventPublisher events,
                                     @Value("${citeguard.alerts.low-verification-rate:0.5}") double lowVerificationRate,
                                     @Value("${citeguard.alerts.high-error-rate:0.1}") double highErrorRate,
                                     @Value("${citeguard.alerts.slow-response-ms:10000}") long slowResponseMs,
                                     @Value("${citeguard.alerts.low-cache-hit-rate:0.3}") double lowCacheHitRate) {
        this(registry, events,
                new AlertThresholds(lowVerificationRate, highErrorRate, slowResponseMs, lowCacheHitRate),
                Clock.systemUTC());
    }

    public CitationMonitoringService(MeterRegistry registry, ApplicationEventPublisher events,
                                     AlertThresholds thresholds, Clock clock) {
        this.registry = registry;
        this.events = events;
        this.thresholds = thresholds;
        this.clock = clock;
    }

    public AlertThresholds thresholds() {
        return thresholds;
    }

    public void trackVerificationSession(String sessionId, VerificationSessionMetrics metrics) {
        log.debug("Tracking verification session: {}", sessionId);
        String segment = metrics.segment();

        summary("citation.verification.session.duration", "segment", segment).record(metrics.verificationTime());
        summary("citation.verification.citations.found", "segment", segment).record(metrics.citationsFound());
        summary("citation.verification.success.rate", "segment", segment).record(metrics.successRate());
        summary("citation.verification.cache.hit.rate", "segment", segment).record(metrics.cacheHitRate());
        summary("citation.verification.overall.score", "segment", segment).record(metrics.overallScore());

        metricsBuffer.put(sessionId, new SessionRecord(clock.instant(), metrics));
        checkSessionAlerts(metrics);
    }

    public void trackApiCall(String apiName, ApiCallMetrics metrics) {
        String api = safeTag(apiName);
        summary("citation.api.duration", "api", api, "success", String.valueOf(metrics.success()))
                .record(metrics.duration());
        Counter.builder("citation.api.calls")
                .tag("api", api)
                .tag("outcome", metrics.success() ? "success" : safeTag(metrics.errorType()))
                .register(registry)
                .increment();

        if (!metrics.success()) {
            log.debug("External API {} failed: status={} errorType={} duration={}ms",
                    apiName, metrics.statusCode(), metrics.errorType(), metrics.duration());
        }

        if (metrics.duration() > thresholds.slowResponseTime()) {
            sendAlert(CitationAlert.SLOW_API_RESPONSE, details(
                    "apiName", apiName,
                    "duration", metrics.duration(),
                    "threshold", thresholds.slowResponseTime()));
        }

        ApiCounters c = apiCounters.computeIfAbsent(api, k -> new ApiCounters());
        long calls = c.calls.incrementAndGet();
        long failures = metrics.success() ? c.failures.get() : c.failures.incrementAndGet();
        double errorRate = (double) failures / calls;
        if (calls >= MIN_API_CALLS_FOR_ERROR_RATE && errorRate > thresholds.highErrorRate()) {
            sendAlert(CitationAlert.HIGH_API_ERROR_RATE, details(
                    "apiName", apiName,
                    "errorRate", errorRate,
                    "threshold", thresholds.highErrorRate(),
                    "calls", calls));
        }
    }

    public void trackCitationQuality(List<CitationVerificationResult> citations, Segment segment) {
        QualityMetrics q = QualityMetrics.of(citations);
        String tag = segment.label();

        summary("citation.quality.authority.average", "segment", tag).record(q.averageAuthorityScore);
        summary("citation.quality.high.authority.share", "segment", tag).record(q.highAuthorityPercentage);
        summary("citation.quality.recency.average", "segment", tag).record(q.averageRecencyScore);
        summary("citation.quality.source.diversity", "segment", tag).record(q.sourceDiversity);
        q.typeDistribution.forEach((type, count) ->
                summary("citation.quality.type.count", "segment", tag, "type", type).record(count));
    }

    public void trackCachePerformance(CachePerformanceMetrics metrics) {
        if (metrics.totalRequests() == 0) return;
        double hitRate = metrics.hitRate();

        summary("citation.cache.hit.rate").record(hitRate);
        summary("citation.cache.size").record(metrics.cacheSize());
        summary("citation.cache.evictions").record(metrics.evictions());

        if (metrics.totalRequests() >= MIN_CACHE_LOOKUPS_FOR_HIT_RATE && hitRate < thresholds.lowCacheHitRate()) {
            sendAlert(CitationAlert.LOW_CACHE_HIT_RATE, details(
                    "hitRate", hitRate,
                    "threshold", thresholds.lowCacheHitRate(),
                    "cacheSize", metrics.cacheSize(),
                    "lookups", metrics.totalRequests()));
        }
    }

    public CitationAnalysisMetrics generateAnalyticsReport(Instant start, Instant end) {
        List<VerificationSessionMetrics> sessions = new ArrayList<>();
        for (SessionRecord r : metricsBuffer.values()) {
            if (!r.timestamp.isBefore(start) && !r.timestamp.isAfter(end)) {
                sessions.add(r.metrics);
            }
        }
        if (sessions.isEmpty()) {
            return CitationAnalysisMetrics.empty();
        }

        int totalCitations = 0, verified = 0, failed = 0, high = 0, moderate = 0, low = 0;
        long words = 0;
        double scoreSum = 0, recencySum = 0;
        Map<String, Integer> types = new LinkedHashMap<>();
        for (VerificationSessionMetrics s : sessions) {
            totalCitations += s.citationsFound();
            verified += s.successfulVerifications();
            failed += s.failedVerifications();
            high += s.highAuthority();
            moderate += s.moderateAuthority();
            low += s.lowAuthority();
            words += s.contentLength();
            scoreSum += s.overallScore();
            recencySum += s.averageRecencyScore();
            s.typeDistribution().forEach((k, v) -> types.merge(k, v, Integer::sum));
        }

        List<String> issues = new ArrayList<>();
        if (failed > 0) {
            issues.add(failed + " citations could not be verified");
        }
        if (totalCitations > 0 && (double) low / totalCitations > 0.5) {
            issues.add("Majority of citations are low authority");
        }

        return new CitationAnalysisMetrics(
                totalCitations,
                verified,
                high,
                moderate,
                low,
                failed,
                CitationScorer.round2(scoreSum / sessions.size()),
                CitationScorer.round2(recencySum / sessions.size()),
                words == 0 ? 0.0 : CitationScorer.round2(totalCitations * 1000.0 / words),
                types,
                issues,
                improvementSuggestions(sessions, totalCitations, high)
        );
    }

    public HealthStatus getHealthStatus() {
        Instant now = clock.instant();
        Instant windowStart = now.minus(HEALTH_WINDOW);

        int sessions = 0;
        long total = 0, successful = 0, timeSum = 0;
        for (SessionRecord r : metricsBuffer.values()) {
            if (r.timestamp.isBefore(windowStart)) continue;
            sessions++;
            total += r.metrics.successfulVerifications() + r.metrics.failedVerifications();
            successful += r.metrics.successfulVerifications();
            timeSum += r.metrics.verificationTime();
        }

        double successRate = total > 0 ? (double) successful / total : 1.0;
        double averageResponseTime = sessions > 0 ? (double) timeSum / sessions : 0.0;
        return new HealthStatus(determineHealth(successRate, averageResponseTime),
                successRate, averageResponseTime, sessions, (int) total, now);
    }

    public List<CitationAlert> recentAlerts() {
        return List.copyOf(recentAlerts);
    }

    public int bufferedSessions() {
        return metricsBuffer.size();
    }

    @Scheduled(fixedRateString = "${citeguard.monitoring.flush-interval-ms:300000}",
               initialDelayString = "${citeguard.monitoring.flush-interval-ms:300000}")
    public void flushMetrics() {
        int size = metricsBuffer.size();
        if (size <= BUFFER_FLUSH_THRESHOLD) return;

        Instant cutoff = clock.instant().minus(BUFFER_RETENTION);
        metricsBuffer.entrySet().removeIf(e -> e.getValue().timestamp.isBefore(cutoff));
        log.info("Flushed old metrics: {} -> {} entries", size, metricsBuffer.size());
    }

    HealthState determineHealth(double successRate, double averageResponseTime) {
        long slow = thresholds.slowResponseTime();
        if (successRate < 0.8 || averageResponseTime > slow) {
            return HealthState.UNHEALTHY;
        }
        if (successRate < 0.95 || averageResponseTime > slow * 0.7) {
            return HealthState.DEGRADED;
        }
        return HealthState.HEALTHY;
    }

    private void checkSessionAlerts(VerificationSessionMetrics metrics) {
        double rate = metrics.successRate();
        if (rate < thresholds.lowVerificationRate()) {
            sendAlert(CitationAlert.LOW_VERIFICATION_RATE, details(
                    "rate", rate,
                    "threshold", thresholds.lowVerificationRate(),
                    "segment", metrics.segment()));
        }
        if (metrics.verificationTime() > thresholds.slowResponseTime()) {
            sendAlert(CitationAlert.SLOW_VERIFICATION_RESPONSE, details(
                    "duration", metrics.verificationTime(),
                    "threshold", thresholds.slowResponseTime()));
        }
    }

    private void sendAlert(String type, Map<String, Object> details) {
        CitationAlert alert = new CitationAlert(type, details, clock.instant());
        log.warn("Citation verification alert: {} {}", type, details);

        Counter.builder("citation.alerts").tag("type", type).register(registry).increment();
        recentAlerts.addFirst(alert);
        while (recentAlerts.size() > RECENT_ALERT_LIMIT) {
            recentAlerts.pollLast();
        }
        events.publishEvent(alert);
    }

    private List<String> improvementSuggestions(List<VerificationSessionMetrics> sessions, int totalCitations, int high) {
        List<String> suggestions = new ArrayList<>();

        double avgCacheHitRate = sessions.stream().mapToDouble(VerificationSessionMetrics::cacheHitRate).average().orElse(1.0);
        if (avgCacheHitRate < 0.5) {
            suggestions.add("Consider increasing cache TTL to improve cache hit rates");
        }
        double avgTime = sessions.stream().mapToLong(VerificationSessionMetrics::verificationTime).average().orElse(0);
        if (avgTime > 5000) {
            suggestions.add("Optimize external API calls or implement request batching");
        }
        if (totalCitations > 0 && (double) high / totalCitations < 0.3) {
            suggestions.add("Favor tier-1 sources to raise the share of high-authority citations");
        }
        return suggestions;
    }

    private DistributionSummary summary(String name, String... tags) {
        return DistributionSummary.builder(name).tags(tags).register(registry);
    }

    private static Map<String, Object> details(Object... kv) {
        Map<String, Object> m = new LinkedHashMap<>();
        for (int i = 0; i + 1 < kv.length; i += 2) {
            if (kv[i + 1] != null) m.put(String.valueOf(kv[i]), kv[i + 1]);
        }
        return m;
    }

    private static String safeTag(String raw) {
        if (raw == null || raw.isBlank()) return "none";
        String s = raw.trim();
        if (s.length() > 64) s = s.substring(0, 64);
        return s.toLowerCase(Locale.ROOT).replace(' ', '_');
    }

    private record SessionRecord(Instant timestamp, VerificationSessionMetrics metrics) {}

    private static final class ApiCounters {
        final AtomicLong calls = new AtomicLong();
        final AtomicLong failures = new AtomicLong();
    }

    private static final class QualityMetrics {
        double averageAuthorityScore;
        double highAuthorityPercentage;
        double averageRecencyScore;
        int sourceDiversity;
        Map<String, Integer> typeDistribution = new LinkedHashMap<>();

        static QualityMetrics of(List<CitationVerificationResult> citations) {
            QualityMetrics q = new QualityMetrics();
            if (citations == null || citations.isEmpty()) return q;

            Set<String> sources = new HashSet<>();
            int high = 0;
            double authority = 0, recency = 0;
            for (CitationVerificationResult r : citations) {
                authority += r.score(CitationScorer.AUTHORITY_SCORE);
                recency += r.score(CitationScorer.RECENCY);
                if (r.verificationStatus() == VerificationStatus.HIGH_AUTHORITY) high++;
                if (r.citation().source() != null && !r.citation().source().isBlank()) sources.add(r.citation().source());
                q.typeDistribution.merge(r.citation().type().label(), 1, Integer::sum);
            }
            q.averageAuthorityScore = authority / citations.size();
            q.highAuthorityPercentage = (double) high / citations.size();
            q.averageRecencyScore = recency / citations.size();
            q.sourceDiversity = sources.size();
            return q;
        }
    }
}
