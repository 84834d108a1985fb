package com.edugen.ai.llm;

import com.edugen.ai.llm.model.GenerationOptions;
import com.edugen.ai.llm.model.GenerationResult;
import com.edugen.ai.llm.structured.JsonPayloads;
import com.edugen.ai.llm.structured.JsonSchema;
import com.edugen.ai.provider.ProviderErrorKind;
import com.edugen.ai.provider.ProviderException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;
import org.springframework.web.reactive.function.client.WebClientRequestException;
import org.springframework.web.reactive.function.client.WebClientResponseException;
import reactor.core.Exceptions;

import java.util.concurrent.TimeoutException;

/**
 * Shared structured-output handling and HTTP error translation for LLM clients.
 */
@Slf4j
public abstract class AbstractLlmProviderClient implements LlmProviderClient {
    
    protected final ObjectMapper objectMapper;
    
    protected AbstractLlmProviderClient(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
    }
    
    @Override
    public GenerationResult generateStructured(String prompt, JsonSchema schema, GenerationOptions options) {
        String structuredPrompt = JsonPayloads.withSchemaInstructions(prompt, schema.toJson(objectMapper));
        GenerationOptions jsonOptions = options.toBuilder().jsonMode(true).build();
        
        GenerationResult result = generate(structuredPrompt, jsonOptions);
        JsonNode payload = JsonPayloads.extractObject(objectMapper, result.getContent(), getName());
        
        log.debug("[STRUCTURED] Payload parsed | provider={} | fields={}", getName(), payload.size());
        return result.withPayload(payload);
    }
    
    protected ProviderException mapHttpError(WebClientResponseException e) {
        int status = e.getStatusCode().value();
        String vendorMessage = extractErrorMessage(e.getResponseBodyAsString());
        String message = String.format("%s API error: %d %s", getName(), status, 
            vendorMessage != null ? vendorMessage : e.getStatusText());
        
        ProviderErrorKind kind = ProviderErrorKind.fromHttpStatus(status);
        if (kind == ProviderErrorKind.RESPONSE && looksLikeContentFilter(vendorMessage)) {
            kind = ProviderErrorKind.CONTENT_FILTER;
        }
        
        Integer retryAfter = null;
        if (kind == ProviderErrorKind.RATE_LIMIT) {
            retryAfter = parseRetryAfter(e.getHeaders().getFirst("Retry-After"));
        }
        return new ProviderException(message, kind, getName(), status, retryAfter, e);
    }
    
    /**
     * Translates anything other than an HTTP error status raised while calling the vendor.
     */
    protected ProviderException mapTransportError(Throwable error) {
        Throwable e = Exceptions.unwrap(error);
        if (e instanceof ProviderException) {
            return (ProviderException) e;
        }
        if (e instanceof WebClientResponseException) {
            return mapHttpError((WebClientResponseException) e);
        }
        if (e instanceof TimeoutException) {
            return new ProviderException(getName() + " request timed out", ProviderErrorKind.TIMEOUT, getName(), e);
        }
        if (e instanceof WebClientRequestException) {
            return new ProviderException(getName() + " connection failed: " + e.getMessage(), 
                ProviderErrorKind.CONNECTION, getName(), e);
        }
        return new ProviderException(getName() + " request failed: " + e.getMessage(), 
            ProviderErrorKind.RESPONSE, getName(), e);
    }
    
    private String extractErrorMessage(String body) {
        if (body == null || body.isBlank()) {
            return null;
        }
        try {
            JsonNode error = objectMapper.readTree(body).path("error");
            if (error.isTextual()) {
                return error.asText();
            }
            if (error.hasNonNull("message")) {
                return error.get("message").asText();
            }
        } catch (Exception e) {
            log.debug("Error body is not JSON | provider={} | error={}", getName(), e.getMessage());
        }
        return body.length() > 200 ? body.substring(0, 200) : body;
    }
    
    private static boolean looksLikeContentFilter(String message) {
        if (message == null) {
            return false;
        }
        String lower = message.toLowerCase();
        return lower.contains("content_filter") || lower.contains("safety") || lower.contains("content risk");
    }
    
    static Integer parseRetryAfter(String header) {
        if (header == null || header.isBlank()) {
            return null;
        }
        try {
            return Integer.parseInt(header.trim());
        } catch (NumberFormatException e) {
            return null;
        }
    }
}
