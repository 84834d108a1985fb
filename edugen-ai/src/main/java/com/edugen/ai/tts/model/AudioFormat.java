package com.edugen.ai.tts.model;

import lombok.Getter;
import lombok.RequiredArgsConstructor;

@Getter
@RequiredArgsConstructor
public enum AudioFormat {
    
    MP3("audio-24khz-48kbitrate-mono-mp3", "audio/mpeg", "mp3");
    
    // Output format name understood by the speech service
    private final String outputFormat;
    private final String mimeType;
    private final String extension;
}
