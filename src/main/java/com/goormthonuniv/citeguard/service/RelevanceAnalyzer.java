package com.goormthonuniv.citeguard.service;

import com.goormthonuniv.citeguard.dto.ExtractedCitation;
import com.goormthonuniv.citeguard.dto.Segment;
import com.goormthonuniv.citeguard.llm.CompletionRequest;
import com.goormthonuniv.citeguard.llm.CompletionResponse;
import com.goormthonuniv.citeguard.llm.TextGenerator;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.regex.Matcher;
import java.util.regex.Pattern;

/** 인용이 세그먼트 독자에게 얼마나 관련 있는지 LLM 에게 1~10 으로 묻는다. 실패하면 5. */
@Slf4j
@Service
@RequiredArgsConstructor
public class RelevanceAnalyzer {

    static final double DEFAULT_RELEVANCE = 5.0;
    private static final Pattern NUMBER = Pattern.compile("\\d+(?:\\.\\d+)?");

    private final TextGenerator textGenerator;

    public double analyzeRelevance(ExtractedCitation citation, Segment segment) {
        String prompt = """
                Rate how relevant and useful the following citation is for a %s audience.
                Answer with a single number from 1 (irrelevant) to 10 (highly relevant) and nothing else.

                Citation: %s
                Source: %s
                Title: %s
                """.formatted(
                segment == Segment.B2B ? "business (B2B)" : "consumer (B2C)",
                citation.text(),
                citation.source() == null ? "unknown" : citation.source(),
                citation.title() == null ? "unknown" : citation.title());

        try {
            CompletionResponse res = textGenerator.generateCompletion(new CompletionRequest(prompt, 10, 0.1));
            return parseScore(res == null ? null : res.text());
        } catch (Exception e) {
            log.debug("Relevance analysis degraded to default: {}", e.getMessage());
            return DEFAULT_RELEVANCE;
        }
    }

    /** 응답의 첫 숫자를 [1, 10] 으로 자른다. 숫자가 없으면 5. */
    static double parseScore(String text) {
        if (text == null) return DEFAULT_RELEVANCE;
        Matcher m = NUMBER.matcher(text);
        if (!m.find()) return DEFAULT_RELEVANCE;
        double v = Double.parseDouble(m.group());
        return Math.max(1.0, Math.min(10.0, v));
    }
}
