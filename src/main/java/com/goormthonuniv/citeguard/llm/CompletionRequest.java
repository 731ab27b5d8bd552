package com.goormthonuniv.citeguard.llm;

public record CompletionRequest(
        String prompt,
        int maxTokens,
        double temperature
) {}
