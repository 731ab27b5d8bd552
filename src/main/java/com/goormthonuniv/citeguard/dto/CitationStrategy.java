package com.goormthonuniv.citeguard.dto;

import java.time.Instant;
import java.util.List;

public record CitationStrategy(
        String topic,
        Segment segment,
        List<String> recommendedSources,
        List<String> preferredFormats,
        AuthorityHierarchy authorityHierarchy,
        DensityRecommendation densityRecommendation,
        VisualPresentation visualPresentation,
        QualityThresholds qualityThresholds,
        Instant timestamp
) {
    public record AuthorityHierarchy(List<String> tier1, List<String> tier2, List<String> tier3, List<String> tier4) {}

    public record DensityRecommendation(int minimumCitations, int recommendedCitationsPerSection, String keyClaimRequirement) {}

    public record VisualPresentation(String inlineStyle, String referenceSection, String citationHighlighting) {}

    public record QualityThresholds(double minimumAuthorityScore, int maximumAge, List<String> requiredSourceTypes) {}
}
