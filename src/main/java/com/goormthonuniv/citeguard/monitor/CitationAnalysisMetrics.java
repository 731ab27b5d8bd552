package com.goormthonuniv.citeguard.monitor;

import java.util.List;
import java.util.Map;

public record CitationAnalysisMetrics(
        int totalCitations,
        int verifiedCitations,
        int highAuthorityCitations,
        int moderateAuthorityCitations,
        int lowAuthorityCitations,
        int unverifiedCitations,
        double averageAuthorityScore,
        double averageRecencyScore,
        double citationDensity,    // 1000 단어당 인용 수
        Map<String, Integer> sourceTypeDistribution,
        List<String> issuesFound,
        List<String> improvementSuggestions
) {
    public static CitationAnalysisMetrics empty() {
        return new CitationAnalysisMetrics(0, 0, 0, 0, 0, 0, 0, 0, 0, Map.of(), List.of(), List.of());
    }
}
