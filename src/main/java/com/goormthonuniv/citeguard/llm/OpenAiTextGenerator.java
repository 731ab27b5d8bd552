package com.goormthonuniv.citeguard.llm;

import com.fasterxml.jackson.databind.JsonNode;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.http.MediaType;
import org.springframework.stereotype.Component;
import org.springframework.web.client.RestClient;

import java.util.List;
import java.util.Map;

@Component
public class OpenAiTextGenerator implements TextGenerator {

    private final RestClient rest;
    private final String endpoint;
    private final String apiKey;
    private final String model;
    private final String provider;

    public OpenAiTextGenerator(RestClient rest,
                               @Value("${citeguard.ai.openai.endpoint:https://api.openai.com/v1/chat/completions}") String endpoint,
                               @Value("${citeguard.ai.openai.apiKey:}") String apiKey,
                               @Value("${citeguard.ai.openai.model:gpt-4o-mini}") String model,
                               @Value("${citeguard.ai.provider:none}") String provider) {
        this.rest = rest;
        this.endpoint = endpoint;
        this.apiKey = apiKey;
        this.model = model;
        this.provider = provider;
    }

    public boolean isConfigured() {
        return "openai".equalsIgnoreCase(provider) && apiKey != null && !apiKey.isBlank();
    }

    @Override
    public CompletionResponse generateCompletion(CompletionRequest request) {
        if (!isConfigured()) {
            throw new TextGenerationException("text generation provider not configured");
        }

        Map<String, Object> body = Map.of(
                "model", model,
                "messages", List.of(Map.of("role", "user", "content", request.prompt())),
                "max_tokens", request.maxTokens(),
                "temperature", request.temperature()
        );

        JsonNode res;
        try {
            res = rest.post()
                    .uri(endpoint)
                    .header("Authorization", "Bearer " + apiKey)
                    .contentType(MediaType.APPLICATION_JSON)
                    .body(body)
                    .retrieve()
                    .body(JsonNode.class);
        } catch (Exception e) {
            throw new TextGenerationException("completion call failed: " + e.getMessage(), e);
        }

        JsonNode choices = res == null ? null : res.path("choices");
        if (choices == null || !choices.isArray() || choices.isEmpty()) {
            throw new TextGenerationException("completion response had no choices");
        }
        return new CompletionResponse(choices.get(0).path("message").path("content").asText(""));
    }
}
