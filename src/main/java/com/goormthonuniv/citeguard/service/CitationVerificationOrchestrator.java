package com.goormthonuniv.citeguard.service;

import com.goormthonuniv.citeguard.cache.CacheKind;
import com.goormthonuniv.citeguard.cache.CitationCacheStore;
import com.goormthonuniv.citeguard.dto.CitationEnhancementReport;
import com.goormthonuniv.citeguard.dto.CitationEnhancementReport.CountDelta;
import com.goormthonuniv.citeguard.dto.CitationEnhancementReport.ImprovementSummary;
import com.goormthonuniv.citeguard.dto.CitationEnhancementReport.ScoreDelta;
import com.goormthonuniv.citeguard.dto.CitationExtractionResult;
import com.goormthonuniv.citeguard.dto.CitationStrategy;
import com.goormthonuniv.citeguard.dto.CitationVerificationResult;
import com.goormthonuniv.citeguard.dto.ContentDocument;
import com.goormthonuniv.citeguard.dto.ContentVerificationReport;
import com.goormthonuniv.citeguard.dto.ContentVerificationReport.ContentSummary;
import com.goormthonuniv.citeguard.dto.DoiVerificationResult;
import com.goormthonuniv.citeguard.dto.DomainAuthorityResult;
import com.goormthonuniv.citeguard.dto.EnhancedCitation;
import com.goormthonuniv.citeguard.dto.ExtractedCitation;
import com.goormthonuniv.citeguard.dto.Segment;
import com.goormthonuniv.citeguard.dto.UrlValidationResult;
import com.goormthonuniv.citeguard.dto.VerificationMetadata;
import com.goormthonuniv.citeguard.dto.VerificationStatus;
import com.goormthonuniv.citeguard.monitor.CachePerformanceMetrics;
import com.goormthonuniv.citeguard.monitor.CitationMonitoringService;
import com.goormthonuniv.citeguard.monitor.VerificationSessionMetrics;
import com.goormthonuniv.citeguard.verify.CitationEnhancer;
import com.goormthonuniv.citeguard.verify.CitationScorer;
import com.goormthonuniv.citeguard.verify.CitationStrategyPlanner;
import com.goormthonuniv.citeguard.verify.DomainAuthorityHeuristics;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Executor;
import java.util.concurrent.ThreadLocalRandom;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * 인용 검증 메인 엔트리.
 * 추출 → 인용별 (캐시 → 게이트웨이 → 채점) fan-out → 집계 → 모니터링 보고.
 * 호출자에게 예외를 던지지 않는다. 실패는 unverified 결과나 error 필드로 나타난다.
 */
@Slf4j
@Service
public class CitationVerificationOrchestrator {

    static final double DEFAULT_AUTHORITY = 5.0;
    static final double DOI_AUTHORITY_FLOOR = 8.0;
    static final double FALLBACK_SCORE = 5.0;

    // ===== 의존성 =====
    private final CitationExtractionService extractor;
    private final ExternalAuthorityGateway gateway;
    private final DomainAuthorityResolver authorityResolver;
    private final RelevanceAnalyzer relevanceAnalyzer;
    private final CitationScorer scorer;
    private final CitationEnhancer enhancer;
    private final CitationStrategyPlanner strategyPlanner;
    private final CitationCacheStore cache;
    private final CitationMonitoringService monitoring;
    private final Executor executor;
    private final long citationTimeoutMs;

    public CitationVerificationOrchestrator(CitationExtractionService extractor,
                                            ExternalAuthorityGateway gateway,
                                            DomainAuthorityResolver authorityResolver,
                                            RelevanceAnalyzer relevanceAnalyzer,
                                            CitationScorer scorer,
                                            CitationEnhancer enhancer,
                                            CitationStrategyPlanner strategyPlanner,
                                            CitationCacheStore cache,
                                            CitationMonitoringService monitoring,
                                            @Qualifier("citationVerificationExecutor") Executor executor,
                                            @Value("${citeguard.verification.citation-timeout-ms:30000}") long citationTimeoutMs) {
        this.extractor = extractor;
        this.gateway = gateway;
        this.authorityResolver = authorityResolver;
        this.relevanceAnalyzer = relevanceAnalyzer;
        this.scorer = scorer;
        this.enhancer = enhancer;
        this.strategyPlanner = strategyPlanner;
        this.cache = cache;
        this.monitoring = monitoring;
        this.executor = executor;
        this.citationTimeoutMs = citationTimeoutMs;
    }

    /** 메인 엔트리 */
    public ContentVerificationReport verifyCitations(ContentDocument content, Segment segment) {
        Objects.requireNonNull(content, "content");
        Objects.requireNonNull(segment, "segment");

        long start = System.currentTimeMillis();
        String sessionId = "session-" + start + "-" + Integer.toString(ThreadLocalRandom.current().nextInt(1 << 24), 36);
        log.info("Verifying citations: session={} segment={}", sessionId, segment.label());

        try {
            // 1) 추출
            CitationExtractionResult extraction = extractor.extractCitations(content);

            // 2) 인용별 검증 fan-out
            SessionCounters counters = new SessionCounters();
            List<CompletableFuture<CitationVerificationResult>> futures = new ArrayList<>();
            for (ExtractedCitation c : extraction.citations()) {
                futures.add(submitWithBudget(c, segment, counters));
            }
            CompletableFuture.allOf(futures.toArray(new CompletableFuture[0])).join();

            List<CitationVerificationResult> results = futures.stream()
                    .map(CompletableFuture::join)
                    .sorted(Comparator.comparingDouble(CitationVerificationResult::overallScore).reversed())
                    .toList();

            // 3) 집계
            double overall = results.isEmpty() ? 0.0 : CitationScorer.round2(
                    results.stream().mapToDouble(CitationVerificationResult::overallScore).average().orElse(0));
            long elapsed = System.currentTimeMillis() - start;

            ContentVerificationReport report = new ContentVerificationReport(
                    new ContentSummary(content.title(), results.size()),
                    results,
                    overall,
                    segment,
                    extraction,
                    Instant.now(),
                    elapsed,
                    null
            );

            // 4) 보고
            reportSession(sessionId, content, segment, extraction, results, overall, elapsed, counters);
            log.info("Citation verification completed: session={} citations={} score={} {}ms",
                    sessionId, results.size(), overall, elapsed);
            return report;
        } catch (RuntimeException e) {
            log.error("Citation verification failed: session={}", sessionId, e);
            return new ContentVerificationReport(
                    new ContentSummary(content.title(), 0),
                    List.of(),
                    0.0,
                    segment,
                    null,
                    Instant.now(),
                    System.currentTimeMillis() - start,
                    e.getMessage() == null ? e.getClass().getSimpleName() : e.getMessage()
            );
        }
    }

    /**
     * 인용 하나를 풀에 넣는다. 시간 제한은 작업이 실제로 시작될 때부터 잰다.
     * 큐에서 기다린 시간은 제한에 들어가지 않는다.
     */
    private CompletableFuture<CitationVerificationResult> submitWithBudget(ExtractedCitation c, Segment segment,
                                                                          SessionCounters counters) {
        CompletableFuture<CitationVerificationResult> result = new CompletableFuture<>();
        executor.execute(() -> {
            result.completeOnTimeout(fallbackResult(c, segment, "verification timed out"),
                    citationTimeoutMs, TimeUnit.MILLISECONDS);
            try {
                result.complete(verifySingleCitation(c, segment, counters));
            } catch (RuntimeException e) {
                result.completeExceptionally(e);
            }
        });
        return result.exceptionally(ex -> fallbackResult(c, segment, ex.getMessage()));
    }

    public CitationVerificationResult verifySingleCitation(ExtractedCitation citation, Segment segment) {
        return verifySingleCitation(citation, segment, new SessionCounters());
    }

    /**
     * 낮은 권위 인용을 권위 출처로 바꾼 뒤 다시 검증해서 전후 비교를 돌려준다.
     */
    public CitationEnhancementReport enhanceCitationAuthority(ContentDocument content, Segment segment) {
        Objects.requireNonNull(content, "content");
        Objects.requireNonNull(segment, "segment");

        ContentVerificationReport before = verifyCitations(content, segment);
        List<EnhancedCitation> enhanced = enhancer.enhance(before.citations(), segment);
        ContentDocument enhancedContent = enhancer.integrate(content, enhanced);
        ContentVerificationReport after = verifyCitations(enhancedContent, segment);

        long replaced = enhanced.stream().filter(EnhancedCitation::enhanced).count();
        log.info("Citation enhancement: {} of {} citations replaced, score {} -> {}",
                replaced, enhanced.size(), before.overallCredibilityScore(), after.overallCredibilityScore());

        return new CitationEnhancementReport(
                content,
                enhancedContent,
                before,
                after,
                new ImprovementSummary(
                        new CountDelta(before.citationCount(), after.citationCount()),
                        new ScoreDelta(before.overallCredibilityScore(), after.overallCredibilityScore(),
                                CitationScorer.round2(after.overallCredibilityScore() - before.overallCredibilityScore()))
                ),
                Instant.now()
        );
    }

    public CitationStrategy generateCitationStrategy(String topic, Segment segment) {
        log.info("Generating citation strategy for {} ({})", topic, segment == null ? null : segment.label());
        return strategyPlanner.plan(topic, segment);
    }

    // ===================== 인용 단위 =====================

    private CitationVerificationResult verifySingleCitation(ExtractedCitation c, Segment segment, SessionCounters counters) {
        String cacheKey = c.identityKey() + "-" + segment.label();
        Optional<CitationVerificationResult> cached = cache.get(CacheKind.CITATION, cacheKey);
        if (cached.isPresent()) {
            counters.cacheHits.incrementAndGet();
            return cached.get();
        }

        counters.apiCalls.incrementAndGet();
        CitationVerificationResult result;
        try {
            result = score(c, segment);
        } catch (RuntimeException e) {
            log.error("Citation verification failed for {}", c.id(), e);
            result = fallbackResult(c, segment, e.getMessage());
        }

        cache.set(CacheKind.CITATION, cacheKey, result);
        return result;
    }

    private CitationVerificationResult score(ExtractedCitation c, Segment segment) {
        log.debug("Verifying citation {} ({})", c.id(), c.identityKey());
        Map<String, Object> apiResponses = new LinkedHashMap<>();
        List<String> issues = new ArrayList<>();
        List<String> suggestions = new ArrayList<>();

        double authority = DEFAULT_AUTHORITY;
        Boolean urlValid = null;
        Boolean doiValid = null;

        // 1) URL → 도메인 권위
        if (c.hasUrl()) {
            UrlValidationResult v = validateUrl(c.url());
            urlValid = v.usable();
            apiResponses.put("urlValidation", urlSummary(v));

            if (!urlValid) {
                issues.add("URL not accessible: " + String.join(", ", v.errors()));
                suggestions.add("Replace with an accessible, authoritative source");
                authority = 0.0;
            } else {
                String domain = DomainAuthorityHeuristics.normalizeHost(c.url());
                DomainAuthorityResult d = authorityResolver.resolve(domain);
                authority = DomainAuthorityHeuristics.toVerificationScore(d);
                apiResponses.put("domainAuthority", Map.of(
                        "domain", d.domain(),
                        "authorityScore", d.authorityScore(),
                        "source", d.source().label()));
            }
        }

        // 2) DOI
        if (c.hasDoi()) {
            DoiVerificationResult d = gateway.verifyDoi(c.doi());
            doiValid = d.valid();
            if (d.valid()) {
                authority = Math.max(authority, DOI_AUTHORITY_FLOOR);
                apiResponses.put("doi", d.metadata());
            } else {
                issues.add("DOI could not be verified: " + c.doi());
            }
        }

        // 3) 공통 기준 + 세그먼트 기준
        Map<String, Double> verification = new LinkedHashMap<>();
        verification.put(CitationScorer.SOURCE_REPUTATION, scorer.sourceReputation(c, segment));
        verification.put(CitationScorer.RECENCY, scorer.recency(c.year()));
        verification.put(CitationScorer.AUTHORITY_SCORE, authority);
        verification.put(CitationScorer.RELEVANCE_SCORE, relevanceAnalyzer.analyzeRelevance(c, segment));
        verification.putAll(scorer.segmentCriteria(c, segment));

        if (verification.get(CitationScorer.RECENCY) < 6) {
            suggestions.add("Cite a more recent source (published within the last 5 years)");
        }
        if (authority < 5 && !Boolean.FALSE.equals(urlValid)) {
            suggestions.add("Use a higher-authority source for this claim");
        }

        double overall = CitationScorer.overallScore(verification);
        return new CitationVerificationResult(
                c,
                verification,
                urlValid,
                doiValid,
                overall,
                CitationScorer.classify(overall),
                issues,
                suggestions,
                new VerificationMetadata(Instant.now(), VerificationMetadata.METHOD_PRODUCTION, apiResponses, null)
        );
    }

    private UrlValidationResult validateUrl(String url) {
        Optional<UrlValidationResult> cached = cache.get(CacheKind.URL, url);
        if (cached.isPresent()) return cached.get();
        UrlValidationResult v = gateway.validateUrl(url);
        cache.set(CacheKind.URL, url, v);
        return v;
    }

    /** 모든 기준 5점, unverified */
    CitationVerificationResult fallbackResult(ExtractedCitation c, Segment segment, String error) {
        Map<String, Double> verification = new LinkedHashMap<>();
        verification.put(CitationScorer.SOURCE_REPUTATION, FALLBACK_SCORE);
        verification.put(CitationScorer.RECENCY, FALLBACK_SCORE);
        verification.put(CitationScorer.AUTHORITY_SCORE, FALLBACK_SCORE);
        verification.put(CitationScorer.RELEVANCE_SCORE, FALLBACK_SCORE);
        for (String criterion : scorer.segmentCriteria(c, segment).keySet()) {
            verification.put(criterion, FALLBACK_SCORE);
        }

        String reason = error == null ? "unknown error" : error;
        return new CitationVerificationResult(
                c,
                verification,
                null,
                null,
                CitationScorer.overallScore(verification),
                VerificationStatus.UNVERIFIED,
                List.of("Verification failed: " + reason),
                List.of("Verify this citation manually"),
                new VerificationMetadata(Instant.now(), VerificationMetadata.METHOD_FALLBACK, Map.of(), reason)
        );
    }

    // ===================== 보고 =====================

    private void reportSession(String sessionId, ContentDocument content, Segment segment,
                               CitationExtractionResult extraction, List<CitationVerificationResult> results,
                               double overall, long elapsed, SessionCounters counters) {
        try {
            int high = 0, moderate = 0, low = 0, unverified = 0;
            double recency = 0;
            for (CitationVerificationResult r : results) {
                switch (r.verificationStatus()) {
                    case HIGH_AUTHORITY -> high++;
                    case MODERATE_AUTHORITY -> moderate++;
                    case LOW_AUTHORITY -> low++;
                    case UNVERIFIED -> unverified++;
                }
                recency += r.score(CitationScorer.RECENCY);
            }

            monitoring.trackVerificationSession(sessionId, new VerificationSessionMetrics(
                    segment.label(),
                    content.wordCount(),
                    results.size(),
                    elapsed,
                    results.size() - unverified,
                    unverified,
                    counters.cacheHits.get(),
                    counters.apiCalls.get(),
                    overall,
                    high,
                    moderate,
                    low,
                    results.isEmpty() ? 0.0 : CitationScorer.round2(recency / results.size()),
                    extraction.byType()
            ));
            monitoring.trackCitationQuality(results, segment);
            monitoring.trackCachePerformance(CachePerformanceMetrics.from(cache.stats()));
        } catch (RuntimeException e) {
            log.warn("Failed to report verification metrics for {}: {}", sessionId, e.getMessage());
        }
    }

    private static Map<String, Object> urlSummary(UrlValidationResult v) {
        Map<String, Object> m = new LinkedHashMap<>();
        m.put("isValid", v.isValid());
        m.put("isAccessible", v.isAccessible());
        if (v.statusCode() != null) m.put("statusCode", v.statusCode());
        if (v.title() != null) m.put("title", v.title());
        m.put("responseTime", v.responseTimeMs());
        return m;
    }

    private static final class SessionCounters {
        final AtomicInteger cacheHits = new AtomicInteger();
        final AtomicInteger apiCalls = new AtomicInteger();
    }
}
