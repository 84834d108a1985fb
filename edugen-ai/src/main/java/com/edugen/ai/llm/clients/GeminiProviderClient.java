package com.edugen.ai.llm.clients;

import com.edugen.ai.config.LlmProperties;
import com.edugen.ai.llm.AbstractLlmProviderClient;
import com.edugen.ai.llm.LlmProvider;
import com.edugen.ai.llm.model.GenerationOptions;
import com.edugen.ai.llm.model.GenerationResult;
import com.edugen.ai.llm.model.TokenUsage;
import com.edugen.ai.provider.ProviderErrorKind;
import com.edugen.ai.provider.ProviderException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.stereotype.Component;
import org.springframework.web.reactive.function.client.WebClient;

import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

@Component
@Slf4j
public class GeminiProviderClient extends AbstractLlmProviderClient {
    
    private final WebClient webClient;
    private final LlmProperties properties;
    private final LlmProperties.Vendor vendor;
    
    public GeminiProviderClient(WebClient.Builder webClientBuilder, ObjectMapper objectMapper, LlmProperties properties) {
        super(objectMapper);
        this.properties = properties;
        this.vendor = properties.getGemini();
        this.webClient = webClientBuilder.clone()
            .baseUrl(vendor.getBaseUrl() != null ? vendor.getBaseUrl() : LlmProvider.GEMINI.getDefaultBaseUrl())
            .defaultHeader(HttpHeaders.CONTENT_TYPE, MediaType.APPLICATION_JSON_VALUE)
            .build();
    }
    
    @Override
    public GenerationResult generate(String prompt, GenerationOptions options) {
        if (!isAvailable()) {
            throw new ProviderException("Gemini API key is not configured", ProviderErrorKind.AUTHENTICATION, getName());
        }
        
        long startTime = System.currentTimeMillis();
        String model = options.getModel() != null ? options.getModel() : getModel();
        Duration timeout = options.getTimeout() != null ? options.getTimeout() : Duration.ofSeconds(properties.getTimeoutSeconds());
        
        log.info("[GEMINI] Starting content generation | model={} | promptLength={} | jsonMode={}", 
            model, prompt.length(), options.isJsonMode());
        
        Map<String, Object> request = buildRequest(prompt, options);
        
        String response;
        try {
            response = webClient.post()
                .uri(uriBuilder -> uriBuilder
                    .path("/{model}:generateContent")
                    .queryParam("key", vendor.getApiKey())
                    .build(model))
                .bodyValue(request)
                .retrieve()
                .bodyToMono(String.class)
                .timeout(timeout)
                .block();
        } catch (Exception e) {
            ProviderException error = mapTransportError(e);
            log.error("[GEMINI] Request failed | model={} | kind={} | statusCode={} | durationMs={} | error={}", 
                model, error.getKind(), error.getStatusCode(), System.currentTimeMillis() - startTime, error.getMessage());
            throw error;
        }
        
        GenerationResult result = parseResponse(response, prompt, model, System.currentTimeMillis() - startTime);
        log.info("[GEMINI] Content generated successfully | model={} | durationMs={} | responseLength={} | inputTokens={} | outputTokens={}", 
            model, result.getLatencyMs(), result.getContent().length(), 
            result.getTokenUsage().getInputTokens(), result.getTokenUsage().getOutputTokens());
        return result;
    }
    
    private Map<String, Object> buildRequest(String prompt, GenerationOptions options) {
        Map<String, Object> generationConfig = new LinkedHashMap<>();
        generationConfig.put("temperature", options.temperatureOr(properties.getDefaultTemperature()));
        generationConfig.put("maxOutputTokens", options.maxTokensOr(properties.getDefaultMaxTokens()));
        if (options.isJsonMode()) {
            generationConfig.put("responseMimeType", MediaType.APPLICATION_JSON_VALUE);
        }
        
        Map<String, Object> request = new LinkedHashMap<>();
        request.put("contents", List.of(
            Map.of("role", "user", "parts", List.of(Map.of("text", prompt)))
        ));
        if (options.getSystemPrompt() != null) {
            request.put("systemInstruction", Map.of("parts", List.of(Map.of("text", options.getSystemPrompt()))));
        }
        request.put("generationConfig", generationConfig);
        return request;
    }
    
    private GenerationResult parseResponse(String response, String prompt, String model, long latencyMs) {
        JsonNode root;
        try {
            root = objectMapper.readTree(response);
        } catch (Exception e) {
            throw new ProviderException("Failed to parse Gemini response", ProviderErrorKind.RESPONSE, getName(), e);
        }
        
        String blockReason = root.path("promptFeedback").path("blockReason").asText(null);
        if (blockReason != null) {
            throw new ProviderException("Gemini blocked the prompt: " + blockReason, 
                ProviderErrorKind.CONTENT_FILTER, getName());
        }
        
        JsonNode candidate = root.path("candidates").path(0);
        if (candidate.isMissingNode()) {
            throw new ProviderException("Gemini response has no candidates", ProviderErrorKind.RESPONSE, getName());
        }
        String finishReason = candidate.path("finishReason").asText(null);
        if ("SAFETY".equals(finishReason)) {
            throw new ProviderException("Gemini stopped generation for safety", ProviderErrorKind.CONTENT_FILTER, getName());
        }
        
        // Thinking models interleave "thought" parts; only answer parts are kept
        StringBuilder content = new StringBuilder();
        for (JsonNode part : candidate.path("content").path("parts")) {
            if (part.path("thought").asBoolean(false)) {
                continue;
            }
            content.append(part.path("text").asText(""));
        }
        if (content.length() == 0) {
            throw new ProviderException("Gemini returned empty content | finishReason=" + finishReason, 
                ProviderErrorKind.RESPONSE, getName());
        }
        
        JsonNode usage = root.path("usageMetadata");
        TokenUsage tokenUsage = usage.has("promptTokenCount")
            ? TokenUsage.of(usage.path("promptTokenCount").asInt(), usage.path("candidatesTokenCount").asInt())
            : TokenUsage.estimate(prompt, content.toString());
        
        return GenerationResult.builder()
            .provider(LlmProvider.GEMINI)
            .model(model)
            .content(content.toString())
            .tokenUsage(tokenUsage)
            .latencyMs(latencyMs)
            .finishReason(finishReason)
            .build();
    }
    
    @Override
    public boolean isAvailable() {
        return vendor.hasApiKey();
    }
    
    @Override
    public LlmProvider getProvider() {
        return LlmProvider.GEMINI;
    }
    
    @Override
    public String getModel() {
        return vendor.getModel() != null ? vendor.getModel() : LlmProvider.GEMINI.getDefaultModel();
    }
}
