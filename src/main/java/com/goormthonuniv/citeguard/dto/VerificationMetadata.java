package com.goormthonuniv.citeguard.dto;

import com.fasterxml.jackson.annotation.JsonInclude;

import java.time.Instant;
import java.util.Map;

@JsonInclude(JsonInclude.Include.NON_NULL)
public record VerificationMetadata(
        Instant verifiedAt,
        String verificationMethod,        // "production-api" | "fallback"
        Map<String, Object> apiResponses, // 프로바이더 원응답 요약
        String error
) {
    public static final String METHOD_PRODUCTION = "production-api";
    public static final String METHOD_FALLBACK = "fallback";

    public VerificationMetadata {
        apiResponses = apiResponses == null ? Map.of() : Map.copyOf(apiResponses);
    }
}
