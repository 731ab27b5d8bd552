package com.goormthonuniv.citeguard.dto;

import com.fasterxml.jackson.annotation.JsonInclude;

@JsonInclude(JsonInclude.Include.NON_NULL)
public record EnhancedCitation(
        ExtractedCitation citation,
        boolean enhanced,
        String enhancementReason,
        ExtractedCitation originalCitation   // enhanced=false 면 null
) {
    public static EnhancedCitation unchanged(ExtractedCitation citation) {
        return new EnhancedCitation(citation, false, "Already high authority", null);
    }
}
