package com.goormthonuniv.citeguard.verify;

import com.goormthonuniv.citeguard.dto.AuthoritySource;
import com.goormthonuniv.citeguard.dto.DomainAuthorityResult;
import org.springframework.stereotype.Component;

import java.net.URI;
import java.net.URISyntaxException;
import java.time.Instant;
import java.util.List;
import java.util.Locale;

/**
 * 외부 권위 프로바이더가 모두 실패했을 때 쓰는 정적 도메인 권위 추정.
 * 패턴 점수(0~10)를 0~100 authority 로 환산해 {@link DomainAuthorityResult} 로 돌려준다.
 *
 * - .gov, 명명된 연구/학술 기관: 9
 * - .edu, 주요 언론사: 7
 * - 그 외 TLD 기본치: edu 7 / gov 8 / org 6 / com 5 / 기타 4
 */
@Component
public class DomainAuthorityHeuristics {

    private static final double GOV_SCORE = 9;
    private static final double INSTITUTION_SCORE = 9;
    private static final double EDU_SCORE = 7;
    private static final double NEWS_OUTLET_SCORE = 7;

    /** 고권위 기관 (도메인 또는 그 서브도메인) */
    private static final List<String> HIGH_AUTHORITY_DOMAINS = List.of(
            "nature.com", "science.org", "sciencedirect.com", "springer.com", "wiley.com",
            "cell.com", "thelancet.com", "nejm.org", "bmj.com", "jamanetwork.com",
            "nih.gov", "who.int", "cdc.gov", "nasa.gov", "europa.eu", "oecd.org", "worldbank.org",
            "ieee.org", "acm.org", "arxiv.org", "pubmed.ncbi.nlm.nih.gov",
            "harvard.edu", "stanford.edu", "mit.edu", "ox.ac.uk", "cam.ac.uk"
    );

    /** 주요 언론사 (도메인 또는 그 서브도메인) */
    private static final List<String> MAJOR_NEWS_DOMAINS = List.of(
            "reuters.com", "apnews.com", "bbc.com", "bbc.co.uk", "nytimes.com", "wsj.com",
            "washingtonpost.com", "theguardian.com", "economist.com", "ft.com", "bloomberg.com",
            "npr.org", "cnn.com"
    );

    /** 라벨('.' 또는 '-' 로 나뉜 조각) 전체가 일치해야 하는 언론사 이름 */
    private static final List<String> NEWS_LABELS = List.of(
            "reuters", "bbc", "cnn", "npr", "pbs", "abc", "nbc", "cbs",
            "fox", "guardian", "economist", "wsj", "nytimes", "washingtonpost"
    );

    /** 라벨 끝에 붙는 제호 단어 (latimes, huffpost, chicagotribune) */
    private static final List<String> NEWS_MASTHEAD_SUFFIXES = List.of(
            "news", "times", "post", "herald", "tribune", "journal", "gazette"
    );

    public DomainAuthorityResult assess(String urlOrHost, Instant checkedAt) {
        String host = normalizeHost(urlOrHost);
        if (host == null) host = "";
        double score = patternScore(host) * 10;

        return new DomainAuthorityResult(
                host,
                score,
                score,
                null,
                null,
                null,
                isGovernment(host),
                isEducational(host),
                isNonProfit(host),
                isNewsDomain(host),
                AuthoritySource.INTERNAL_HEURISTIC,
                checkedAt
        );
    }

    /** 0~10 패턴 점수 */
    public double patternScore(String host) {
        if (host == null || host.isEmpty()) return tldDefault("");
        if (isGovernment(host)) return GOV_SCORE;
        if (matchesDomain(host, HIGH_AUTHORITY_DOMAINS)) return INSTITUTION_SCORE;
        if (isEducational(host)) return EDU_SCORE;
        if (matchesDomain(host, MAJOR_NEWS_DOMAINS)) return NEWS_OUTLET_SCORE;
        return tldDefault(host);
    }

    /**
     * 0~100 도메인 권위를 0~10 검증 점수로.
     * /10 후 정부 +2, 교육 +1.5, 뉴스 +1, 최대 10.
     */
    public static double toVerificationScore(DomainAuthorityResult r) {
        double score = r.authorityScore() / 10.0;
        if (r.isGovernment()) score += 2;
        if (r.isEducational()) score += 1.5;
        if (r.isNews()) score += 1;
        return Math.min(10.0, score);
    }

    public static boolean isGovernment(String host) {
        return host != null && (host.endsWith(".gov") || host.contains(".gov."));
    }

    public static boolean isEducational(String host) {
        return host != null && (host.endsWith(".edu") || host.contains(".edu."));
    }

    public static boolean isNonProfit(String host) {
        return host != null && host.endsWith(".org");
    }

    public static boolean isNewsDomain(String host) {
        if (host == null) return false;
        for (String label : host.toLowerCase(Locale.ROOT).split("[.\\-]")) {
            if (label.isEmpty()) continue;
            if (NEWS_LABELS.contains(label)) return true;
            if (label.startsWith("news")) return true;
            for (String suffix : NEWS_MASTHEAD_SUFFIXES) {
                if (label.endsWith(suffix)) return true;
            }
        }
        return false;
    }

    /** URL 이든 호스트든 받아서 소문자 host 로. www. 는 한 번만 떼어낸다. */
    public static String normalizeHost(String urlOrHost) {
        if (urlOrHost == null || urlOrHost.isBlank()) return null;
        String raw = urlOrHost.trim().toLowerCase(Locale.ROOT);

        String host = raw;
        String candidate = raw.contains("://") ? raw : "https://" + raw;
        try {
            URI uri = new URI(candidate);
            if (uri.getHost() != null) host = uri.getHost();
        } catch (URISyntaxException e) {
            int slash = raw.indexOf('/');
            if (slash > 0 && !raw.contains("://")) host = raw.substring(0, slash);
        }

        for (String pref : List.of("www.", "m.", "mobile.", "amp.")) {
            if (host.startsWith(pref)) {
                host = host.substring(pref.length());
                break;
            }
        }
        return host;
    }

    private static double tldDefault(String host) {
        if (host.endsWith(".edu")) return 7;
        if (host.endsWith(".gov")) return 8;
        if (host.endsWith(".org")) return 6;
        if (host.endsWith(".com")) return 5;
        return 4;
    }

    private static boolean matchesDomain(String host, List<String> domains) {
        for (String d : domains) {
            if (host.equals(d) || host.endsWith("." + d)) return true;
        }
        return false;
    }
}
