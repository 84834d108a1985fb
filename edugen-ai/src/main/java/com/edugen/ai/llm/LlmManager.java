package com.edugen.ai.llm;

import com.edugen.ai.config.LlmProperties;
import com.edugen.ai.llm.model.GenerationOptions;
import com.edugen.ai.llm.model.GenerationResult;
import com.edugen.ai.llm.model.TokenUsage;
import com.edugen.ai.llm.structured.JsonSchema;
import com.edugen.ai.llm.structured.SchemaValidationException;
import com.edugen.ai.llm.structured.SchemaValidator;
import com.edugen.ai.provider.AttemptResult;
import com.edugen.ai.provider.FailoverExecutor;
import com.edugen.ai.provider.ProviderException;
import com.edugen.ai.provider.ProviderUnavailableException;
import com.edugen.ai.provider.RetryPolicy;
import com.edugen.ai.usage.UsageContext;
import com.edugen.ai.usage.UsageTracker;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;

import java.time.Duration;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ExecutorService;
import java.util.function.Function;

/**
 * Single entry point for language-model calls.
 *
 * Turns the configured primary/fallback pair into one reliable call: every attempt is
 * time-bounded, retried per {@link RetryPolicy}, and written to the usage log before the
 * next decision is taken.
 */
@Service
@Slf4j
public class LlmManager {
    
    private final Map<LlmProvider, LlmProviderClient> clients = new EnumMap<>(LlmProvider.class);
    private final LlmProperties properties;
    private final UsageTracker usageTracker;
    private final FailoverExecutor failover;
    private final SchemaValidator validator = new SchemaValidator();
    
    public LlmManager(List<LlmProviderClient> providerClients, LlmProperties properties, UsageTracker usageTracker,
                      @Qualifier("providerExecutor") ExecutorService providerExecutor) {
        providerClients.forEach(client -> clients.put(client.getProvider(), client));
        this.properties = properties;
        this.usageTracker = usageTracker;
        this.failover = new FailoverExecutor(providerExecutor, new RetryPolicy(
            properties.getMaxRetries(),
            properties.getRetryDelayMs(),
            properties.getMaxRetryAfterSeconds(),
            Duration.ofSeconds(properties.getTimeoutSeconds())
        ), "llm");
        
        log.info("[LLM_MANAGER] Initialized | enabled={} | primary={} | fallback={} | registered={}", 
            properties.isEnabled(), properties.getPrimaryProvider(), properties.getFallbackProvider(), clients.keySet());
    }
    
    public GenerationResult generate(String prompt, GenerationOptions options, UsageContext context) {
        return execute(prompt, options, context, client -> client.generate(prompt, options));
    }
    
    /**
     * Structured generation: the first provider whose payload satisfies {@code schema} wins.
     * A payload that fails validation counts as a failed RESPONSE attempt on that provider.
     */
    public GenerationResult generateStructured(String prompt, JsonSchema schema, GenerationOptions options,
                                               UsageContext context) {
        return execute(prompt, options, context, client -> {
            GenerationResult result = client.generateStructured(prompt, schema, options);
            SchemaValidator.Outcome outcome = validator.validate(result.getPayload(), schema);
            if (!outcome.isValid()) {
                log.warn("[STRUCTURED] Schema validation failed | provider={} | violations={}", 
                    client.getName(), outcome.violations());
                throw new SchemaValidationException(client.getName(), outcome.violations(), result);
            }
            return result.withStructured(outcome.value());
        });
    }
    
    private GenerationResult execute(String prompt, GenerationOptions options, UsageContext context,
                                     Function<LlmProviderClient, GenerationResult> call) {
        List<LlmProviderClient> chain = providerChain();
        UsageContext ctx = context != null ? context : UsageContext.of(null, "unknown");
        
        return failover.execute(ctx.getRequestId(), chain, policyFor(options), call::apply,
            (client, attempt) -> recordAttempt(ctx, client, prompt, attempt));
    }
    
    /**
     * Primary first, then the fallback when it differs and is available.
     */
    public List<LlmProviderClient> providerChain() {
        if (!properties.isEnabled()) {
            throw new ProviderUnavailableException("AI generation is disabled");
        }
        List<LlmProviderClient> chain = new ArrayList<>(2);
        addIfAvailable(chain, properties.getPrimaryProvider());
        addIfAvailable(chain, properties.getFallbackProvider());
        if (chain.isEmpty()) {
            throw new ProviderUnavailableException("No LLM provider is configured with credentials");
        }
        return chain;
    }
    
    private void addIfAvailable(List<LlmProviderClient> chain, String name) {
        if (name == null || name.isBlank()) {
            return;
        }
        LlmProviderClient client = clients.get(LlmProvider.fromString(name));
        if (client == null) {
            log.warn("[LLM_MANAGER] No client registered | provider={}", name);
            return;
        }
        if (chain.contains(client)) {
            return;
        }
        if (!client.isAvailable()) {
            log.debug("[LLM_MANAGER] Skipping provider without credentials | provider={}", client.getName());
            return;
        }
        chain.add(client);
    }
    
    private RetryPolicy policyFor(GenerationOptions options) {
        RetryPolicy policy = failover.getDefaultPolicy();
        if (options == null) {
            return policy;
        }
        if (options.getTimeout() != null) {
            policy = policy.withAttemptTimeout(options.getTimeout());
        }
        if (options.getMaxRetries() != null) {
            policy = policy.withMaxRetries(options.getMaxRetries());
        }
        return policy;
    }
    
    private void recordAttempt(UsageContext ctx, LlmProviderClient client, String prompt,
                               AttemptResult<GenerationResult> attempt) {
        ProviderException error = attempt.getError();
        GenerationResult billed = attempt.isOk() ? attempt.getValue() : null;
        if (error instanceof SchemaValidationException) {
            billed = ((SchemaValidationException) error).getResult();
        }
        TokenUsage usage = billed != null && billed.getTokenUsage() != null ? billed.getTokenUsage() : TokenUsage.of(0, 0);
        String model = billed != null && billed.getModel() != null ? billed.getModel() : client.getModel();
        
        usageTracker.recordGeneration(ctx, client.getName(), model, prompt,
            usage.getInputTokens(), usage.getOutputTokens(), error, attempt.getDurationMs());
    }
    
    public Map<String, Object> getStatistics() {
        Map<String, Object> stats = new LinkedHashMap<>();
        stats.put("enabled", properties.isEnabled());
        stats.put("primaryProvider", properties.getPrimaryProvider());
        stats.put("fallbackProvider", properties.getFallbackProvider());
        stats.put("maxRetries", failover.getDefaultPolicy().maxRetries());
        stats.put("attemptTimeoutSeconds", failover.getDefaultPolicy().attemptTimeout().toSeconds());
        
        Map<String, Object> providerStats = new LinkedHashMap<>();
        for (LlmProviderClient client : clients.values()) {
            providerStats.put(client.getName(), Map.of(
                "model", client.getModel(),
                "available", client.isAvailable()
            ));
        }
        stats.put("providers", providerStats);
        return stats;
    }
}
