package com.edugen.ai.llm;

import lombok.Getter;
import lombok.RequiredArgsConstructor;

/**
 * Supported language-model vendors.
 */
@Getter
@RequiredArgsConstructor
public enum LlmProvider {
    
    DEEPSEEK(
        "DeepSeek",
        "https://api.deepseek.com/v1",
        "deepseek-chat"
    ),
    
    GEMINI(
        "Gemini",
        "https://generativelanguage.googleapis.com/v1beta/models",
        "gemini-2.5-flash"
    );
    
    private final String displayName;
    private final String defaultBaseUrl;
    private final String defaultModel;
    
    public static LlmProvider fromString(String name) {
        for (LlmProvider provider : values()) {
            if (provider.name().equalsIgnoreCase(name) || 
                provider.getDisplayName().equalsIgnoreCase(name)) {
                return provider;
            }
        }
        throw new IllegalArgumentException("Unknown LLM provider: " + name);
    }
}
