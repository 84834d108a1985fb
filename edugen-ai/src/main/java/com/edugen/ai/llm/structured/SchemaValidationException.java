package com.edugen.ai.llm.structured;

import com.edugen.ai.llm.model.GenerationResult;
import com.edugen.ai.provider.ProviderErrorKind;
import com.edugen.ai.provider.ProviderException;

import java.util.List;

/**
 * Provider returned parseable JSON that does not satisfy the requested shape.
 * Counts as a failed attempt of kind RESPONSE, so the next provider is tried.
 */
public class SchemaValidationException extends ProviderException {
    
    private final List<String> violations;
    private final transient GenerationResult result;
    
    public SchemaValidationException(String provider, List<String> violations, GenerationResult result) {
        super("Response from " + provider + " does not match schema: " + String.join("; ", violations),
            ProviderErrorKind.RESPONSE, provider);
        this.violations = List.copyOf(violations);
        this.result = result;
    }
    
    public List<String> getViolations() {
        return violations;
    }
    
    /**
     * The rejected generation, kept so its token usage is still billed.
     */
    public GenerationResult getResult() {
        return result;
    }
}
