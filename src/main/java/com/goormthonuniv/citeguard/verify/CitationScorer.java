package com.goormthonuniv.citeguard.verify;

import com.goormthonuniv.citeguard.dto.CitationType;
import com.goormthonuniv.citeguard.dto.ExtractedCitation;
import com.goormthonuniv.citeguard.dto.Segment;
import com.goormthonuniv.citeguard.dto.VerificationStatus;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.time.Clock;
import java.time.ZoneOffset;
import java.util.Arrays;
import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;
import java.util.regex.Pattern;
import java.util.stream.Collectors;

/**
 * 인용 한 건의 기준별 점수(0~10)와 종합 판정.
 * 네트워크 신호(authorityScore, relevanceScore)는 오케스트레이터가 채우고,
 * 여기서는 메타데이터만으로 정해지는 기준을 계산한다.
 */
@Component
public class CitationScorer {

    public static final String AUTHORITY_SCORE = "authorityScore";
    public static final String SOURCE_REPUTATION = "sourceReputation";
    public static final String RECENCY = "recency";
    public static final String RELEVANCE_SCORE = "relevanceScore";
    public static final String METHODOLOGY_RIGOR = "methodologyRigor";
    public static final String INDUSTRY_RELEVANCE = "industryRelevance";
    public static final String AUDIENCE_RELEVANCE = "audienceRelevance";
    public static final String CLAIM_VERIFICATION = "claimVerification";

    static final double HIGH_AUTHORITY_THRESHOLD = 8.0;
    static final double MODERATE_AUTHORITY_THRESHOLD = 6.0;

    private static final Pattern B2B_REPUTABLE = words(
            "harvard", "mit", "stanford", "gartner", "forrester", "mckinsey", "deloitte", "pwc",
            "accenture", "idc", "ieee", "acm", "nature", "science", "journal", "university", "institute"
    );
    private static final Pattern B2C_REPUTABLE = words(
            "nih", "cdc", "who", "world health organization", "fda", "mayo clinic", "pew", "nielsen", "consumer reports",
            "national institutes", "nature", "science", "journal", "university", "institute"
    );

    private static final Pattern RIGOR_KEYWORDS = words(
            "study", "studies", "research", "survey", "analysis", "methodology", "peer-reviewed",
            "experiment", "meta-analysis", "sample size", "data"
    );
    private static final Pattern INDUSTRY_KEYWORDS = words(
            "industry", "market", "markets", "enterprise", "business", "b2b", "sector", "vendor",
            "analyst", "roi", "technology"
    );
    private static final Pattern AUDIENCE_KEYWORDS = words(
            "consumer", "customer", "people", "household", "family", "families", "users",
            "shoppers", "patients", "parents", "health"
    );
    private static final Pattern FACT_CHECKERS = words(
            "snopes", "factcheck", "fact-check", "fact check", "politifact", "fullfact",
            "reuters", "apnews", "associated press"
    );

    private final Clock clock;

    @Autowired
    public CitationScorer() {
        this(Clock.systemUTC());
    }

    public CitationScorer(Clock clock) {
        this.clock = clock;
    }

    /**
     * 평판 목록에 걸리면 9, 아니면 6, 출처를 모르면 5.
     * 출처가 비어 있는 URL 인용은 호스트로 목록을 대조하고, 걸리지 않으면 출처 미상(5)으로 본다.
     */
    public double sourceReputation(ExtractedCitation c, Segment segment) {
        Pattern reputable = segment == Segment.B2B ? B2B_REPUTABLE : B2C_REPUTABLE;
        String source = c.source();
        if (source != null && !source.isBlank()) {
            return matches(source.toLowerCase(Locale.ROOT), reputable) ? 9 : 6;
        }
        String host = c.url() == null ? null : DomainAuthorityHeuristics.normalizeHost(c.url());
        if (host != null && matches(host, reputable)) return 9;
        return 5;
    }

    /** 연식 기준 단계 감쇠. 연도를 모르면 5 */
    public double recency(Integer year) {
        if (year == null) return 5;
        int age = clock.instant().atZone(ZoneOffset.UTC).getYear() - year;
        if (age <= 1) return 10;
        if (age <= 2) return 9;
        if (age <= 3) return 8;
        if (age <= 5) return 7;
        if (age <= 10) return 6;
        return Math.max(1.0, 6 - age / 5.0);
    }

    /** 세그먼트 전용 기준 두 개 */
    public Map<String, Double> segmentCriteria(ExtractedCitation c, Segment segment) {
        String haystack = haystack(c);
        Map<String, Double> out = new LinkedHashMap<>();
        if (segment == Segment.B2B) {
            double rigor;
            if (c.type() == CitationType.ACADEMIC || c.hasDoi()) rigor = 9;
            else if (matches(haystack, RIGOR_KEYWORDS)) rigor = 7;
            else rigor = 5;
            out.put(METHODOLOGY_RIGOR, rigor);
            out.put(INDUSTRY_RELEVANCE, matches(haystack, INDUSTRY_KEYWORDS) ? 8.0 : 6.0);
        } else {
            out.put(AUDIENCE_RELEVANCE, matches(haystack, AUDIENCE_KEYWORDS) ? 8.0 : 6.0);
            out.put(CLAIM_VERIFICATION, matches(haystack, FACT_CHECKERS) ? 10.0 : 6.0);
        }
        return out;
    }

    /** verification 값 전체의 산술 평균, 소수 둘째 자리 */
    public static double overallScore(Map<String, Double> verification) {
        if (verification.isEmpty()) return 0.0;
        double sum = 0;
        for (double v : verification.values()) sum += v;
        return round2(sum / verification.size());
    }

    public static VerificationStatus classify(double overallScore) {
        if (overallScore > HIGH_AUTHORITY_THRESHOLD) return VerificationStatus.HIGH_AUTHORITY;
        if (overallScore > MODERATE_AUTHORITY_THRESHOLD) return VerificationStatus.MODERATE_AUTHORITY;
        return VerificationStatus.LOW_AUTHORITY;
    }

    public static double round2(double v) {
        if (Double.isNaN(v) || Double.isInfinite(v)) return 0.0;
        return BigDecimal.valueOf(v).setScale(2, RoundingMode.HALF_UP).doubleValue();
    }

    private static String haystack(ExtractedCitation c) {
        StringBuilder sb = new StringBuilder();
        sb.append(c.text()).append(' ');
        if (c.title() != null) sb.append(c.title()).append(' ');
        if (c.source() != null) sb.append(c.source()).append(' ');
        if (c.url() != null) sb.append(c.url()).append(' ');
        return sb.toString().toLowerCase(Locale.ROOT);
    }

    /** 단어 경계 매칭. 앞뒤가 영숫자가 아니어야 한다 (nih 는 annihilate 에 걸리지 않는다) */
    private static Pattern words(String... keywords) {
        String alternation = Arrays.stream(keywords).map(Pattern::quote).collect(Collectors.joining("|"));
        return Pattern.compile("(?<![a-z0-9])(?:" + alternation + ")(?![a-z0-9])");
    }

    private static boolean matches(String haystack, Pattern keywords) {
        return keywords.matcher(haystack).find();
    }
}
