package com.edugen.ai.llm;

import com.edugen.ai.llm.model.GenerationOptions;
import com.edugen.ai.llm.model.GenerationResult;
import com.edugen.ai.llm.structured.JsonSchema;
import com.edugen.ai.provider.AiProvider;
import com.edugen.ai.provider.ProviderException;

public interface LlmProviderClient extends AiProvider {
    
    GenerationResult generate(String prompt, GenerationOptions options) throws ProviderException;
    
    /**
     * Requests a JSON object shaped by {@code schema}. The returned result carries the
     * parsed object as its payload; schema conformance is checked by the caller.
     */
    GenerationResult generateStructured(String prompt, JsonSchema schema, GenerationOptions options) throws ProviderException;
    
    LlmProvider getProvider();
    
    String getModel();
    
    @Override
    default String getName() {
        return getProvider().getDisplayName();
    }
}
