package com.goormthonuniv.citeguard.dto;

import com.fasterxml.jackson.annotation.JsonInclude;

import java.time.Instant;
import java.util.List;

@JsonInclude(JsonInclude.Include.NON_NULL)
public record ContentVerificationReport(
        ContentSummary contentSummary,
        List<CitationVerificationResult> citations,
        double overallCredibilityScore,   // 인용별 overallScore 평균, 인용이 없으면 0
        Segment segment,
        CitationExtractionResult extractionResult,
        Instant timestamp,
        long processingTime,
        String error                      // 경계에서 잡힌 예외 메시지
) {
    public ContentVerificationReport {
        citations = List.copyOf(citations);
    }

    public int citationCount() {
        return contentSummary.citationCount();
    }

    public record ContentSummary(String title, int citationCount) {}
}
