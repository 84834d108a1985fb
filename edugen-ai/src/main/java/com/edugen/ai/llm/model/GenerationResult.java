package com.edugen.ai.llm.model;

import com.edugen.ai.llm.LlmProvider;
import com.edugen.ai.llm.structured.StructuredValue;
import com.fasterxml.jackson.databind.JsonNode;
import lombok.Builder;
import lombok.Value;
import lombok.With;

/**
 * Output of one successful provider attempt.
 */
@Value
@Builder
@With
public class GenerationResult {
    LlmProvider provider;
    String model;
    String content;
    // Parsed JSON object for structured calls, null for free text
    JsonNode payload;
    // Schema-checked view of payload, set once validation passed
    StructuredValue.ObjectValue structured;
    TokenUsage tokenUsage;
    long latencyMs;
    String finishReason;
}
