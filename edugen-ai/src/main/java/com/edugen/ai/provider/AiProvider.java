package com.edugen.ai.provider;

/**
 * Common surface of every external generation vendor (LLM or TTS).
 */
public interface AiProvider {
    
    /**
     * Display name used in logs, usage records and the cost table.
     */
    String getName();
    
    /**
     * Whether credentials and endpoint are configured.
     */
    boolean isAvailable();
}
