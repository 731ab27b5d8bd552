package com.goormthonuniv.citeguard.llm;

public record CompletionResponse(String text) {}
