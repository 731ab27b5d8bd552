package com.goormthonuniv.citeguard.dto;

import java.time.Instant;

public record CitationEnhancementReport(
        ContentDocument originalContent,
        ContentDocument enhancedContent,
        ContentVerificationReport originalVerification,
        ContentVerificationReport enhancedVerification,
        ImprovementSummary improvementSummary,
        Instant timestamp
) {
    public record ImprovementSummary(CountDelta citationCount, ScoreDelta credibilityScore) {}

    public record CountDelta(int before, int after) {}

    public record ScoreDelta(double before, double after, double improvement) {}
}
