package com.edugen.ai.llm.model;

import com.edugen.common.util.TokenCounter;
import lombok.Value;

@Value
public class TokenUsage {
    int inputTokens;
    int outputTokens;
    // True when the vendor omitted usage and counts were approximated from text length
    boolean estimated;
    
    public static TokenUsage of(int inputTokens, int outputTokens) {
        return new TokenUsage(inputTokens, outputTokens, false);
    }
    
    public static TokenUsage estimate(String prompt, String completion) {
        return new TokenUsage(TokenCounter.countTokens(prompt), TokenCounter.countTokens(completion), true);
    }
    
    public int getTotalTokens() {
        return inputTokens + outputTokens;
    }
}
