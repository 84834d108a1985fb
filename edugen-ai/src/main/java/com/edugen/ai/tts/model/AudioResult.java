package com.edugen.ai.tts.model;

import com.edugen.ai.tts.TtsProvider;
import lombok.Builder;
import lombok.Value;
import lombok.With;

@Value
@Builder
@With
public class AudioResult {
    byte[] audio;
    AudioFormat format;
    TtsProvider provider;
    String voice;
    String language;
    int characters;
    long latencyMs;
    boolean cached;
    
    public int getSizeBytes() {
        return audio != null ? audio.length : 0;
    }
}
