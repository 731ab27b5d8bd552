package com.goormthonuniv.citeguard.authority;

import com.fasterxml.jackson.databind.JsonNode;
import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import com.goormthonuniv.citeguard.dto.DoiVerificationResult;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.http.HttpHeaders;
import org.springframework.stereotype.Component;
import org.springframework.web.client.RestClient;

import java.time.Duration;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;

/**
 * CrossRef works API 로 DOI 존재 여부와 서지 요약을 확인한다.
 * 성공한 조회는 6시간 메모이즈 (인용 캐시와 별개).
 */
@Slf4j
@Component
public class CrossRefDoiRegistry {

    private final RestClient rest;
    private final String endpoint;
    private final String userAgent;

    private final Cache<String, DoiVerificationResult> memo = Caffeine.newBuilder()
            .expireAfterWrite(Duration.ofHours(6))
            .maximumSize(5000)
            .build();

    public CrossRefDoiRegistry(RestClient rest,
                               @Value("${citeguard.authority.crossref.endpoint:https://api.crossref.org}") String endpoint,
                               @Value("${citeguard.authority.crossref.userAgent:CiteGuard/0.1 (citation verification)}") String userAgent) {
        this.rest = rest;
        this.endpoint = endpoint;
        this.userAgent = userAgent;
    }

    public ProviderOutcome<DoiVerificationResult> lookup(String doi) {
        String key = doi.trim().toLowerCase(Locale.ROOT);
        DoiVerificationResult cached = memo.getIfPresent(key);
        if (cached != null) {
            return ProviderOutcome.success(cached, 200);
        }

        try {
            log.debug("Verifying DOI: {}", doi);
            JsonNode res = rest.get()
                    .uri(endpoint + "/works/{doi}", doi.trim())
                    .header(HttpHeaders.USER_AGENT, userAgent)
                    .retrieve()
                    .body(JsonNode.class);

            JsonNode message = res == null ? null : res.get("message");
            if (message == null || !message.isObject()) {
                return ProviderOutcome.failed("CrossRef response had no message", 200, false);
            }

            DoiVerificationResult result = new DoiVerificationResult(doi, true, summarize(message), null, Instant.now());
            memo.put(key, result);
            return ProviderOutcome.success(result, 200);
        } catch (Exception e) {
            log.warn("DOI verification failed for {}: {}", doi, e.getMessage());
            return ProviderOutcome.fromException(e);
        }
    }

    void clearMemo() {
        memo.invalidateAll();
    }

    /** 원응답 전체 대신 서지 핵심 필드만. null 값은 넣지 않는다. */
    private static Map<String, Object> summarize(JsonNode message) {
        Map<String, Object> m = new LinkedHashMap<>();
        putText(m, "doi", message.path("DOI"));
        putText(m, "title", firstOf(message.path("title")));
        putText(m, "containerTitle", firstOf(message.path("container-title")));
        putText(m, "publisher", message.path("publisher"));
        putText(m, "type", message.path("type"));

        JsonNode parts = message.path("issued").path("date-parts");
        if (parts.isArray() && parts.size() > 0 && parts.get(0).isArray() && parts.get(0).size() > 0) {
            int year = parts.get(0).get(0).asInt(0);
            if (year > 0) m.put("year", year);
        }
        if (message.path("author").isArray()) {
            m.put("authorCount", message.path("author").size());
        }
        return m;
    }

    private static JsonNode firstOf(JsonNode node) {
        return node.isArray() && node.size() > 0 ? node.get(0) : node;
    }

    private static void putText(Map<String, Object> m, String key, JsonNode node) {
        if (node != null && node.isTextual() && !node.asText().isBlank()) {
            m.put(key, node.asText());
        }
    }
}
