package com.goormthonuniv.citeguard.dto;

import com.fasterxml.jackson.annotation.JsonInclude;

import java.time.Instant;
import java.util.Map;

@JsonInclude(JsonInclude.Include.NON_NULL)
public record DoiVerificationResult(
        String doi,
        boolean valid,
        Map<String, Object> metadata,   // 레지스트리 message 요약(title, publisher, ...)
        String error,
        Instant checkedAt
) {
    public DoiVerificationResult {
        metadata = metadata == null ? Map.of() : Map.copyOf(metadata);
    }

    public static DoiVerificationResult invalid(String doi, String error, Instant at) {
        return new DoiVerificationResult(doi, false, Map.of(), error, at);
    }
}
