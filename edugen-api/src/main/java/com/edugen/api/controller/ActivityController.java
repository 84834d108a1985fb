package com.edugen.api.controller;

import com.edugen.ai.tts.model.AudioResult;
import com.edugen.core.activity.ActivityAudioService;
import com.edugen.core.activity.AudioSynthesisReport;
import com.edugen.core.generation.GenerationOrchestrator;
import com.fasterxml.jackson.databind.node.ObjectNode;
import lombok.RequiredArgsConstructor;
import org.springframework.http.CacheControl;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestHeader;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.time.Duration;

@RestController
@RequestMapping("/api/v1/ai/activities")
@RequiredArgsConstructor
public class ActivityController {
    
    private final GenerationOrchestrator orchestrator;
    private final ActivityAudioService audioService;
    
    /** Student view: no answers, no provider details. */
    @GetMapping("/{activityId}")
    public ResponseEntity<ObjectNode> publicView(@PathVariable String activityId) {
        return ResponseEntity.ok(orchestrator.publicView(activityId));
    }
    
    @GetMapping("/{activityId}/authoring")
    public ResponseEntity<ObjectNode> authoringView(@PathVariable String activityId) {
        return ResponseEntity.ok(orchestrator.authoringView(activityId));
    }
    
    @PostMapping("/{activityId}/audio")
    public ResponseEntity<AudioSynthesisReport> synthesizeAudio(
            @PathVariable String activityId,
            @RequestHeader(value = GenerationController.TEACHER_HEADER, required = false) String teacherId
    ) {
        return ResponseEntity.ok(audioService.synthesizePending(activityId, teacherId));
    }
    
    @GetMapping("/{activityId}/items/{itemId}/audio")
    public ResponseEntity<byte[]> itemAudio(@PathVariable String activityId, @PathVariable String itemId) {
        AudioResult audio = audioService.itemAudio(activityId, itemId);
        return ResponseEntity.ok()
            .contentType(MediaType.parseMediaType(audio.getFormat().getMimeType()))
            .cacheControl(CacheControl.maxAge(Duration.ofHours(1)))
            .body(audio.getAudio());
    }
}
