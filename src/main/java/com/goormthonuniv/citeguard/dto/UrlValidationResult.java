package com.goormthonuniv.citeguard.dto;

import com.fasterxml.jackson.annotation.JsonInclude;

import java.time.Instant;
import java.util.List;

@JsonInclude(JsonInclude.Include.NON_NULL)
public record UrlValidationResult(
        String url,
        boolean isValid,        // 형식상 올바른 URL
        boolean isAccessible,   // status < 400 으로 응답
        Integer statusCode,
        String contentType,
        String title,
        String lastModified,
        boolean isSecure,       // https
        List<String> errors,
        Instant checkedAt,
        long responseTimeMs
) {
    public UrlValidationResult {
        errors = errors == null ? List.of() : List.copyOf(errors);
    }

    public boolean usable() {
        return isValid && isAccessible;
    }

    public UrlValidationResult withTitle(String newTitle) {
        return new UrlValidationResult(url, isValid, isAccessible, statusCode, contentType, newTitle,
                lastModified, isSecure, errors, checkedAt, responseTimeMs);
    }
}
