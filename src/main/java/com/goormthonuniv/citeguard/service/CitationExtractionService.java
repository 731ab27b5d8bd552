package com.goormthonuniv.citeguard.service;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.goormthonuniv.citeguard.dto.CitationExtractionResult;
import com.goormthonuniv.citeguard.dto.CitationPosition;
import com.goormthonuniv.citeguard.dto.CitationType;
import com.goormthonuniv.citeguard.dto.ContentDocument;
import com.goormthonuniv.citeguard.dto.ExtractedCitation;
import com.goormthonuniv.citeguard.llm.CompletionRequest;
import com.goormthonuniv.citeguard.llm.CompletionResponse;
import com.goormthonuniv.citeguard.llm.TextGenerator;
import com.goormthonuniv.citeguard.util.TextUtils;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.ThreadLocalRandom;
import java.util.function.Function;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * 콘텐츠에서 인용을 뽑는다.
 * URL / DOI / 학술 패턴 / AI 구조화 추출 네 가지를 섹션별로 돌린 뒤 합치고, 중복 제거 후 id 를 붙인다.
 * 개별 추출기 실패는 빈 기여로 강등되고, 전체 실패만 "error-fallback" 결과가 된다.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class CitationExtractionService {

    static final String METHOD_HYBRID = "hybrid-nlp-pattern";
    static final String METHOD_ERROR_FALLBACK = "error-fallback";
    static final String AI_SECTION = "ai-extracted";
    static final int AI_INPUT_LIMIT = 8000;

    private static final int URL_CONTEXT = 100;
    private static final int DOI_CONTEXT = 150;

    private static final Pattern URL = Pattern.compile("https?://[^\\s)]+", Pattern.CASE_INSENSITIVE);
    private static final Pattern DOI = Pattern.compile(
            "(?:doi:\\s*|https?://(?:dx\\.)?doi\\.org/)([^\\s)]+)", Pattern.CASE_INSENSITIVE);
    private static final String DOI_RESOLVER = "https://doi.org/";
    private static final Pattern DOI_URL = Pattern.compile(
            "^https?://(?:dx\\.)?doi\\.org/(.+)$", Pattern.CASE_INSENSITIVE);
    // Author(s) (Year). Title. Source.
    private static final Pattern ACADEMIC = Pattern.compile(
            "([A-Z][a-z]+(?:,?\\s+[A-Z]\\.?)*(?:\\s+(?:and|&)\\s+[A-Z][a-z]+(?:,?\\s+[A-Z]\\.?)*)*)"
                    + "\\s*\\((\\d{4})\\)\\.\\s*([^.]+)\\.\\s*([^.]+)\\.");
    private static final Pattern AUTHOR_SPLIT = Pattern.compile("\\s+(?:and|&)\\s+");

    private static final String BASE36 = "0123456789abcdefghijklmnopqrstuvwxyz";

    private final TextGenerator textGenerator;
    private final ObjectMapper objectMapper;

    public CitationExtractionResult extractCitations(ContentDocument content) {
        long start = System.currentTimeMillis();
        String extractionId = newExtractionId();
        log.info("Starting citation extraction: {}", extractionId);

        try {
            Map<String, String> sectionMap = content == null ? Map.of() : content.toSectionMap();
            String totalText = joinSections(sectionMap, content != null && content.hasSections());

            List<ExtractedCitation> all = new ArrayList<>();
            all.addAll(runExtractor("url", sectionMap, this::extractUrlCitations));
            all.addAll(runExtractor("doi", sectionMap, this::extractDoiCitations));
            all.addAll(runExtractor("academic", sectionMap, this::extractAcademicCitations));
            all.addAll(extractStructuredCitations(totalText));

            List<ExtractedCitation> unique = deduplicate(all);
            List<ExtractedCitation> numbered = new ArrayList<>(unique.size());
            for (int i = 0; i < unique.size(); i++) {
                numbered.add(unique.get(i).withId("citation-" + extractionId + "-" + (i + 1)));
            }

            CitationExtractionResult result = new CitationExtractionResult(
                    numbered,
                    numbered.size(),
                    countBy(numbered, c -> c.type().label()),
                    countBy(numbered, ExtractedCitation::section),
                    METHOD_HYBRID,
                    confidence(numbered),
                    System.currentTimeMillis() - start
            );
            log.info("Citation extraction completed: {} citations found ({})", numbered.size(), extractionId);
            return result;
        } catch (RuntimeException e) {
            log.error("Citation extraction failed: {}", extractionId, e);
            return CitationExtractionResult.empty(METHOD_ERROR_FALLBACK, System.currentTimeMillis() - start);
        }
    }

    // ===== extractors =====

    List<ExtractedCitation> extractUrlCitations(String section, String text) {
        List<ExtractedCitation> out = new ArrayList<>();
        Matcher m = URL.matcher(text);
        while (m.find()) {
            String url = TextUtils.trimTrailingPunctuation(m.group());
            if (url.length() <= "https://".length()) continue;
            int s = m.start();
            int e = s + url.length();

            // doi.org 링크는 DOI 도 같이 들고 가고, DOI 추출기와 같은 https://doi.org/ 형태로 맞춘다
            Matcher doiUrl = DOI_URL.matcher(url);
            String doi = null;
            if (doiUrl.matches()) {
                doi = doiUrl.group(1);
                url = DOI_RESOLVER + doi;
            }

            out.add(new ExtractedCitation(null, TextUtils.context(text, s, e, URL_CONTEXT), url, doi,
                    null, null, null, null, section, new CitationPosition(s, e), CitationType.URL));
        }
        return out;
    }

    List<ExtractedCitation> extractDoiCitations(String section, String text) {
        List<ExtractedCitation> out = new ArrayList<>();
        Matcher m = DOI.matcher(text);
        while (m.find()) {
            String doi = TextUtils.trimTrailingPunctuation(m.group(1));
            if (doi.isEmpty()) continue;
            int s = m.start();
            int e = m.end();
            out.add(new ExtractedCitation(null, TextUtils.context(text, s, e, DOI_CONTEXT), DOI_RESOLVER + doi, doi,
                    null, null, null, null, section, new CitationPosition(s, e), CitationType.DOI));
        }
        return out;
    }

    List<ExtractedCitation> extractAcademicCitations(String section, String text) {
        List<ExtractedCitation> out = new ArrayList<>();
        Matcher m = ACADEMIC.matcher(text);
        while (m.find()) {
            List<String> authors = new ArrayList<>();
            for (String a : AUTHOR_SPLIT.split(m.group(1))) {
                if (!a.isBlank()) authors.add(a.trim());
            }
            out.add(new ExtractedCitation(null, m.group().trim(), null, null,
                    m.group(3).trim(), authors, Integer.parseInt(m.group(2)), m.group(4).trim(),
                    section, new CitationPosition(m.start(), m.end()), CitationType.ACADEMIC));
        }
        return out;
    }

    /** LLM 에게 JSON 배열을 요청한다. 응답이 깨지거나 호출이 실패하면 빈 목록. */
    List<ExtractedCitation> extractStructuredCitations(String totalText) {
        if (totalText == null || totalText.isBlank()) return List.of();

        String prompt = """
                You are an expert at extracting citations from academic and professional content.
                Analyze the following text and extract all citations, references, and source attributions.

                For each citation found, identify:
                1. The citation text
                2. Type (academic, book, report, website, other)
                3. Author(s) if mentioned
                4. Year if mentioned
                5. Title if mentioned
                6. Source/publisher if mentioned

                Text to analyze:
                \"\"\"
                %s
                \"\"\"

                Return only a JSON array of citations in this format:
                [{"text": "full citation text", "type": "academic|book|report|website|other",
                  "authors": ["author1"], "year": 2023, "title": "title", "source": "journal/publisher"}]
                """.formatted(TextUtils.truncate(totalText, AI_INPUT_LIMIT));

        try {
            CompletionResponse res = textGenerator.generateCompletion(new CompletionRequest(prompt, 2000, 0.1));
            return parseStructuredCitations(res == null ? null : res.text());
        } catch (Exception e) {
            log.warn("AI citation extraction failed: {}", e.getMessage());
            return List.of();
        }
    }

    List<ExtractedCitation> parseStructuredCitations(String raw) throws IOException {
        if (raw == null || raw.isBlank()) return List.of();
        JsonNode root = objectMapper.readTree(TextUtils.stripCodeFence(raw));
        if (root == null || !root.isArray()) {
            log.warn("AI citation extraction returned non-array JSON");
            return List.of();
        }

        List<ExtractedCitation> out = new ArrayList<>();
        for (JsonNode n : root) {
            String text = textOrNull(n.get("text"));
            String title = textOrNull(n.get("title"));
            if (text == null && title == null) continue;

            List<String> authors = new ArrayList<>();
            JsonNode an = n.get("authors");
            if (an != null && an.isArray()) {
                for (JsonNode a : an) {
                    String name = textOrNull(a);
                    if (name != null) authors.add(name);
                }
            }

            out.add(new ExtractedCitation(null, text != null ? text : title, null, null,
                    title, authors, yearOrNull(n.get("year")), textOrNull(n.get("source")),
                    AI_SECTION, CitationPosition.UNKNOWN, CitationType.fromLabel(textOrNull(n.get("type")))));
        }
        return out;
    }

    // ===== helpers =====

    /** url, doi, text 앞 100자 순으로 키를 잡고 먼저 나온 것을 남긴다 */
    static List<ExtractedCitation> deduplicate(List<ExtractedCitation> citations) {
        Set<String> seen = new HashSet<>();
        List<ExtractedCitation> out = new ArrayList<>();
        for (ExtractedCitation c : citations) {
            if (!c.hasIdentity()) continue;
            if (seen.add(c.identityKey())) out.add(c);
        }
        return out;
    }

    /** 0.5 + 0.3 × 식별 필드 보유 비율 + 0.2 × 유형 수/5, 최대 1 */
    static double confidence(List<ExtractedCitation> citations) {
        if (citations.isEmpty()) return 0.0;

        long structured = citations.stream()
                .filter(c -> c.hasUrl() || c.hasDoi() || !c.authors().isEmpty())
                .count();
        long types = citations.stream().map(ExtractedCitation::type).distinct().count();

        double confidence = 0.5
                + ((double) structured / citations.size()) * 0.3
                + (types / 5.0) * 0.2;
        return Math.min(1.0, confidence);
    }

    private List<ExtractedCitation> runExtractor(String name, Map<String, String> sectionMap,
                                                 SectionExtractor extractor) {
        List<ExtractedCitation> out = new ArrayList<>();
        try {
            sectionMap.forEach((section, text) -> out.addAll(extractor.extract(section, text == null ? "" : text)));
            return out;
        } catch (RuntimeException e) {
            log.warn("{} citation extractor failed: {}", name, e.getMessage());
            return List.of();
        }
    }

    private static String joinSections(Map<String, String> sectionMap, boolean tagged) {
        if (!tagged) {
            return sectionMap.getOrDefault(ContentDocument.MAIN_SECTION, "");
        }
        StringBuilder sb = new StringBuilder();
        sectionMap.forEach((k, v) -> sb.append("\n\n[SECTION:").append(k).append("]\n").append(v));
        return sb.toString();
    }

    private static Map<String, Integer> countBy(List<ExtractedCitation> citations,
                                                Function<ExtractedCitation, String> key) {
        Map<String, Integer> out = new LinkedHashMap<>();
        for (ExtractedCitation c : citations) {
            String k = key.apply(c);
            out.merge(k == null ? "unknown" : k, 1, Integer::sum);
        }
        return out;
    }

    private static String textOrNull(JsonNode n) {
        if (n == null || n.isNull()) return null;
        String s = n.asText("").trim();
        return s.isEmpty() ? null : s;
    }

    private static Integer yearOrNull(JsonNode n) {
        if (n == null || n.isNull()) return null;
        if (n.isNumber()) return n.asInt();
        String s = n.asText("").trim();
        return s.matches("\\d{4}") ? Integer.valueOf(s) : null;
    }

    private static String newExtractionId() {
        ThreadLocalRandom rnd = ThreadLocalRandom.current();
        StringBuilder sb = new StringBuilder("extract-").append(System.currentTimeMillis()).append('-');
        for (int i = 0; i < 6; i++) sb.append(BASE36.charAt(rnd.nextInt(BASE36.length())));
        return sb.toString();
    }

    @FunctionalInterface
    interface SectionExtractor {
        List<ExtractedCitation> extract(String section, String text);
    }
}
