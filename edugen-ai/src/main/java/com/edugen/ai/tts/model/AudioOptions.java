package com.edugen.ai.tts.model;

import lombok.Builder;
import lombok.Value;

/**
 * Synthesis settings. {@code rate} and {@code pitch} are multipliers where 1.0 means unchanged.
 */
@Value
@Builder(toBuilder = true)
public class AudioOptions {
    @Builder.Default
    String language = "en";
    // Explicit voice id; null picks the language default
    String voice;
    @Builder.Default
    double rate = 1.0;
    @Builder.Default
    double pitch = 1.0;
    @Builder.Default
    AudioFormat format = AudioFormat.MP3;
    
    public static AudioOptions forLanguage(String language) {
        return AudioOptions.builder().language(language).build();
    }
}
