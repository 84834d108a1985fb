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
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * DeepSeek chat completions (OpenAI-compatible wire format).
 */
@Component
@Slf4j
public class DeepSeekProviderClient extends AbstractLlmProviderClient {
    
    private final WebClient webClient;
    private final LlmProperties properties;
    private final LlmProperties.Vendor vendor;
    
    public DeepSeekProviderClient(WebClient.Builder webClientBuilder, ObjectMapper objectMapper, LlmProperties properties) {
        super(objectMapper);
        this.properties = properties;
        this.vendor = properties.getDeepseek();
        this.webClient = webClientBuilder.clone()
            .baseUrl(vendor.getBaseUrl() != null ? vendor.getBaseUrl() : LlmProvider.DEEPSEEK.getDefaultBaseUrl())
            .defaultHeader(HttpHeaders.CONTENT_TYPE, MediaType.APPLICATION_JSON_VALUE)
            .build();
    }
    
    @Override
    public GenerationResult generate(String prompt, GenerationOptions options) {
        if (!isAvailable()) {
            throw new ProviderException("DeepSeek API key is not configured", ProviderErrorKind.AUTHENTICATION, getName());
        }
        
        long startTime = System.currentTimeMillis();
        String model = options.getModel() != null ? options.getModel() : getModel();
        Duration timeout = options.getTimeout() != null ? options.getTimeout() : Duration.ofSeconds(properties.getTimeoutSeconds());
        
        log.info("[DEEPSEEK] Starting content generation | model={} | promptLength={} | jsonMode={}", 
            model, prompt.length(), options.isJsonMode());
        
        Map<String, Object> request = buildRequest(prompt, options, model);
        
        String response;
        try {
            response = webClient.post()
                .uri("/chat/completions")
                .header(HttpHeaders.AUTHORIZATION, "Bearer " + vendor.getApiKey())
                .bodyValue(request)
                .retrieve()
                .bodyToMono(String.class)
                .timeout(timeout)
                .block();
        } catch (Exception e) {
            ProviderException error = mapTransportError(e);
            log.error("[DEEPSEEK] Request failed | model={} | kind={} | statusCode={} | durationMs={} | error={}", 
                model, error.getKind(), error.getStatusCode(), System.currentTimeMillis() - startTime, error.getMessage());
            throw error;
        }
        
        GenerationResult result = parseResponse(response, prompt, model, System.currentTimeMillis() - startTime);
        log.info("[DEEPSEEK] Content generated successfully | model={} | durationMs={} | responseLength={} | inputTokens={} | outputTokens={}", 
            model, result.getLatencyMs(), result.getContent().length(), 
            result.getTokenUsage().getInputTokens(), result.getTokenUsage().getOutputTokens());
        return result;
    }
    
    private Map<String, Object> buildRequest(String prompt, GenerationOptions options, String model) {
        List<Map<String, String>> messages = new ArrayList<>();
        if (options.getSystemPrompt() != null) {
            messages.add(Map.of("role", "system", "content", options.getSystemPrompt()));
        }
        messages.add(Map.of("role", "user", "content", prompt));
        
        Map<String, Object> request = new LinkedHashMap<>();
        request.put("model", model);
        request.put("messages", messages);
        request.put("temperature", options.temperatureOr(properties.getDefaultTemperature()));
        request.put("max_tokens", options.maxTokensOr(properties.getDefaultMaxTokens()));
        if (options.isJsonMode()) {
            request.put("response_format", Map.of("type", "json_object"));
        }
        return request;
    }
    
    private GenerationResult parseResponse(String response, String prompt, String model, long latencyMs) {
        JsonNode root;
        try {
            root = objectMapper.readTree(response);
        } catch (Exception e) {
            throw new ProviderException("Failed to parse DeepSeek response", ProviderErrorKind.RESPONSE, getName(), e);
        }
        
        JsonNode choice = root.path("choices").path(0);
        if (choice.isMissingNode()) {
            throw new ProviderException("DeepSeek response has no choices", ProviderErrorKind.RESPONSE, getName());
        }
        String content = choice.path("message").path("content").asText("");
        String finishReason = choice.path("finish_reason").asText(null);
        
        if ("content_filter".equals(finishReason)) {
            throw new ProviderException("DeepSeek blocked the response", ProviderErrorKind.CONTENT_FILTER, getName());
        }
        if (content.isBlank()) {
            throw new ProviderException("DeepSeek returned empty content", ProviderErrorKind.RESPONSE, getName());
        }
        
        JsonNode usage = root.path("usage");
        TokenUsage tokenUsage = usage.has("prompt_tokens")
            ? TokenUsage.of(usage.path("prompt_tokens").asInt(), usage.path("completion_tokens").asInt())
            : TokenUsage.estimate(prompt, content);
        
        return GenerationResult.builder()
            .provider(LlmProvider.DEEPSEEK)
            .model(root.path("model").asText(model))
            .content(content)
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
        return LlmProvider.DEEPSEEK;
    }
    
    @Override
    public String getModel() {
        return vendor.getModel() != null ? vendor.getModel() : LlmProvider.DEEPSEEK.getDefaultModel();
    }
}
