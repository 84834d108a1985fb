package com.edugen.ai.tts.model;

import java.util.List;

/**
 * Per-text outcome of a batch synthesis; failed items carry an error instead of audio.
 */
public record BatchAudioResult(List<Item> items, long totalDurationMs) {
    
    public record Item(int index, String text, AudioResult result, String error) {
        public boolean isSuccess() {
            return result != null;
        }
    }
    
    public long successCount() {
        return items.stream().filter(Item::isSuccess).count();
    }
    
    public long failureCount() {
        return items.size() - successCount();
    }
}
