package com.edugen.ai.tts;

import lombok.Getter;
import lombok.RequiredArgsConstructor;

@Getter
@RequiredArgsConstructor
public enum TtsProvider {
    
    EDGE("Edge"),
    AZURE("Azure");
    
    private final String displayName;
    
    public static TtsProvider fromString(String name) {
        for (TtsProvider provider : values()) {
            if (provider.name().equalsIgnoreCase(name) || provider.getDisplayName().equalsIgnoreCase(name)) {
                return provider;
            }
        }
        throw new IllegalArgumentException("Unknown TTS provider: " + name);
    }
}
