package com.edugen.ai.usage;

public enum OperationType {
    LLM_GENERATION,
    TTS_SYNTHESIS
}
