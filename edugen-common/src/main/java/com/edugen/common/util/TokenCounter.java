package com.edugen.common.util;

/**
 * Token estimator used when a provider response carries no usage block.
 * Approximation: 1 token ≈ 4 characters for English text
 */
public final class TokenCounter {
    private static final double CHARS_PER_TOKEN = 4.0;
    
    private TokenCounter() {}
    
    public static int countTokens(String text) {
        if (text == null || text.isEmpty()) {
            return 0;
        }
        return (int) Math.ceil(text.length() / CHARS_PER_TOKEN);
    }
}
