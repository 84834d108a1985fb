package com.edugen.api.controller;

import com.edugen.ai.tts.TtsManager;
import com.edugen.ai.tts.VoiceCatalog;
import com.edugen.ai.tts.model.AudioOptions;
import com.edugen.ai.tts.model.AudioResult;
import com.edugen.ai.usage.UsageContext;
import lombok.RequiredArgsConstructor;
import org.springframework.http.CacheControl;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestHeader;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.time.Duration;

/**
 * Ad-hoc speech for teachers previewing text. Student-facing audio goes through
 * the activity item endpoint instead.
 */
@RestController
@RequestMapping("/api/v1/ai/tts")
@RequiredArgsConstructor
public class TtsController {
    
    static final int MAX_TEXT_LENGTH = 2000;
    
    private final TtsManager ttsManager;
    
    @GetMapping("/audio")
    public ResponseEntity<byte[]> audio(
            @RequestParam String text,
            @RequestParam(defaultValue = "en") String lang,
            @RequestParam(required = false) String voice,
            @RequestHeader(value = GenerationController.TEACHER_HEADER, required = false) String teacherId
    ) {
        if (text.isBlank() || text.length() > MAX_TEXT_LENGTH) {
            throw new IllegalArgumentException("Text must be between 1 and " + MAX_TEXT_LENGTH + " characters");
        }
        if (!VoiceCatalog.supports(lang)) {
            throw new IllegalArgumentException("Unsupported speech language: " + lang);
        }
        
        AudioOptions options = AudioOptions.builder().language(lang).voice(voice).build();
        AudioResult audio = ttsManager.synthesize(text, options, UsageContext.of(teacherId, "tts_preview"));
        return ResponseEntity.ok()
            .contentType(MediaType.parseMediaType(audio.getFormat().getMimeType()))
            .cacheControl(CacheControl.maxAge(Duration.ofHours(1)))
            .header("X-Audio-Cached", String.valueOf(audio.isCached()))
            .body(audio.getAudio());
    }
}
