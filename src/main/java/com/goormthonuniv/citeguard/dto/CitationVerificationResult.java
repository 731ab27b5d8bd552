package com.goormthonuniv.citeguard.dto;

import com.fasterxml.jackson.annotation.JsonInclude;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

@JsonInclude(JsonInclude.Include.NON_NULL)
public record CitationVerificationResult(
        ExtractedCitation citation,
        Map<String, Double> verification,   // 기준별 점수 0~10
        Boolean urlValid,
        Boolean doiValid,
        double overallScore,                // verification 값들의 평균(소수 둘째 자리)
        VerificationStatus verificationStatus,
        List<String> issues,
        List<String> suggestions,
        VerificationMetadata metadata
) {
    public CitationVerificationResult {
        verification = Collections.unmodifiableMap(new LinkedHashMap<>(verification));
        issues = List.copyOf(issues);
        suggestions = List.copyOf(suggestions);
    }

    public double score(String criterion) {
        Double v = verification.get(criterion);
        return v == null ? 0.0 : v;
    }
}
