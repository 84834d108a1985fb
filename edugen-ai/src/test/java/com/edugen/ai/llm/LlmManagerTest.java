package com.edugen.ai.llm;

import com.edugen.ai.config.LlmProperties;
import com.edugen.ai.llm.model.GenerationOptions;
import com.edugen.ai.llm.model.GenerationResult;
import com.edugen.ai.llm.structured.JsonSchema;
import com.edugen.ai.provider.AllProvidersFailedException;
import com.edugen.ai.provider.ProviderErrorKind;
import com.edugen.ai.provider.ProviderException;
import com.edugen.ai.provider.ProviderUnavailableException;
import com.edugen.ai.support.FakeLlmClient;
import com.edugen.ai.support.RecordingSink;
import com.edugen.ai.usage.UsageContext;
import com.edugen.ai.usage.UsageLogEntry;
import com.edugen.ai.usage.UsageTracker;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.List;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class LlmManagerTest {
    
    private static final String QUESTIONS_JSON = "{\"questions\":[{\"question\":\"Q1\"}]}";
    
    private ExecutorService executor;
    private RecordingSink sink;
    private UsageTracker usageTracker;
    private LlmProperties properties;
    private FakeLlmClient deepseek;
    private FakeLlmClient gemini;
    private final UsageContext context = UsageContext.of("teacher-1", "listening_quiz");
    
    @BeforeEach
    void setUp() {
        executor = Executors.newCachedThreadPool();
        sink = new RecordingSink();
        usageTracker = new UsageTracker(List.of(sink));
        properties = new LlmProperties();
        properties.setRetryDelayMs(1);
        properties.setMaxRetries(2);
        deepseek = new FakeLlmClient(LlmProvider.DEEPSEEK);
        gemini = new FakeLlmClient(LlmProvider.GEMINI);
    }
    
    @AfterEach
    void tearDown() {
        executor.shutdownNow();
    }
    
    private LlmManager manager() {
        return new LlmManager(List.of(deepseek, gemini), properties, usageTracker, executor);
    }
    
    @Test
    @DisplayName("Fallback is never invoked when the primary succeeds")
    void should_NotCallFallback_When_PrimarySucceeds() {
        deepseek.respond("hello");
        gemini.respond("unused");
        
        GenerationResult result = manager().generate("prompt", GenerationOptions.defaults(), context);
        
        assertThat(result.getProvider()).isEqualTo(LlmProvider.DEEPSEEK);
        assertThat(gemini.calls()).isZero();
        assertThat(sink.entries()).hasSize(1);
        assertThat(sink.entries().get(0).isSuccess()).isTrue();
    }
    
    @Test
    @DisplayName("Authentication error skips retry and falls back; both attempts are logged")
    void should_FallBackWithoutRetry_When_PrimaryAuthFails() {
        deepseek.fail(new ProviderException("bad key", ProviderErrorKind.AUTHENTICATION, "DeepSeek", 401, null, null));
        gemini.respond("from gemini");
        
        GenerationResult result = manager().generate("prompt", GenerationOptions.defaults(), context);
        
        assertThat(result.getContent()).isEqualTo("from gemini");
        assertThat(deepseek.calls()).isEqualTo(1);
        
        List<UsageLogEntry> entries = sink.entries();
        assertThat(entries).extracting(UsageLogEntry::getProvider).containsExactly("DeepSeek", "Gemini");
        assertThat(entries).extracting(UsageLogEntry::isSuccess).containsExactly(false, true);
        assertThat(entries.get(0).getErrorType()).isEqualTo("AUTHENTICATION");
        assertThat(entries).extracting(UsageLogEntry::getRequestId).containsOnly(context.getRequestId());
    }
    
    @Test
    void should_RetryTransientErrors_When_ConnectionFails() {
        deepseek.fail(new ProviderException("reset", ProviderErrorKind.CONNECTION, "DeepSeek"))
            .fail(new ProviderException("reset", ProviderErrorKind.CONNECTION, "DeepSeek"))
            .respond("third time lucky");
        
        GenerationResult result = manager().generate("prompt", GenerationOptions.defaults(), context);
        
        assertThat(result.getContent()).isEqualTo("third time lucky");
        assertThat(deepseek.calls()).isEqualTo(3);
        assertThat(gemini.calls()).isZero();
        assertThat(sink.entries()).extracting(UsageLogEntry::isSuccess).containsExactly(false, false, true);
    }
    
    @Test
    @DisplayName("Exhausted chain lists exactly the configured providers in order")
    void should_ListProvidersInOrder_When_AllFail() {
        deepseek.fail(new ProviderException("filtered", ProviderErrorKind.CONTENT_FILTER, "DeepSeek"));
        gemini.fail(new ProviderException("quota", ProviderErrorKind.QUOTA_EXCEEDED, "Gemini", 402, null, null));
        
        assertThatThrownBy(() -> manager().generate("prompt", GenerationOptions.defaults(), context))
            .isInstanceOfSatisfying(AllProvidersFailedException.class, e -> {
                assertThat(e.getAttemptedProviders()).containsExactly("DeepSeek", "Gemini");
                assertThat(e.getFailures()).extracting(f -> f.kind())
                    .containsExactly(ProviderErrorKind.CONTENT_FILTER, ProviderErrorKind.QUOTA_EXCEEDED);
                assertThat(e.getTotalAttempts()).isEqualTo(2);
            });
    }
    
    @Test
    void should_ClassifyAsTimeout_When_AttemptExceedsBound() {
        deepseek.then(() -> {
            try {
                Thread.sleep(2_000);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            }
            return "too late";
        });
        gemini.respond("fast");
        GenerationOptions options = GenerationOptions.builder()
            .timeout(Duration.ofMillis(100))
            .maxRetries(0)
            .build();
        
        GenerationResult result = manager().generate("prompt", options, context);
        
        assertThat(result.getProvider()).isEqualTo(LlmProvider.GEMINI);
        assertThat(sink.entries().get(0).getErrorType()).isEqualTo("TIMEOUT");
    }
    
    @Test
    @DisplayName("A payload failing schema validation counts as a failed attempt and falls back")
    void should_FallBack_When_StructuredPayloadViolatesSchema() {
        deepseek.respond("{\"items\":[]}");
        gemini.respond("```json\n" + QUESTIONS_JSON + "\n```");
        JsonSchema schema = JsonSchema.object()
            .required("questions", JsonSchema.arrayOf(JsonSchema.object()).minItems(1));
        
        GenerationResult result = manager().generateStructured("prompt", schema, GenerationOptions.defaults(), context);
        
        assertThat(result.getProvider()).isEqualTo(LlmProvider.GEMINI);
        assertThat(result.getStructured().array("questions").objects()).hasSize(1);
        assertThat(deepseek.calls()).isEqualTo(1);
        UsageLogEntry rejected = sink.entries().get(0);
        assertThat(rejected.isSuccess()).isFalse();
        assertThat(rejected.getErrorType()).isEqualTo("RESPONSE");
        assertThat(rejected.getInputTokens()).isEqualTo(100);
    }
    
    @Test
    void should_SkipProvidersWithoutCredentials() {
        deepseek.unavailable();
        gemini.respond("ok");
        
        assertThat(manager().providerChain()).extracting(LlmProviderClient::getName).containsExactly("Gemini");
        assertThat(manager().generate("p", GenerationOptions.defaults(), context).getProvider())
            .isEqualTo(LlmProvider.GEMINI);
    }
    
    @Test
    void should_ThrowUnavailable_When_Disabled() {
        properties.setEnabled(false);
        
        assertThatThrownBy(() -> manager().generate("p", GenerationOptions.defaults(), context))
            .isInstanceOf(ProviderUnavailableException.class);
        assertThat(deepseek.calls()).isZero();
    }
}
