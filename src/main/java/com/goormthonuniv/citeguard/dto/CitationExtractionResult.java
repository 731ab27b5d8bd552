package com.goormthonuniv.citeguard.dto;

import java.util.List;
import java.util.Map;

public record CitationExtractionResult(
        List<ExtractedCitation> citations,
        int totalFound,
        Map<String, Integer> byType,
        Map<String, Integer> bySection,
        String extractionMethod,    // "hybrid-nlp-pattern" | "error-fallback"
        double confidence,          // 0~1
        long processingTime         // ms
) {
    public CitationExtractionResult {
        citations = List.copyOf(citations);
        byType = Map.copyOf(byType);
        bySection = Map.copyOf(bySection);
    }

    public static CitationExtractionResult empty(String method, long processingTime) {
        return new CitationExtractionResult(List.of(), 0, Map.of(), Map.of(), method, 0.0, processingTime);
    }
}
