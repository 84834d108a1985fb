package com.edugen.api.controller;

import com.edugen.api.dto.request.GenerateActivityRequest;
import com.edugen.api.dto.response.GenerateActivityResponse;
import com.edugen.api.dto.response.QuotaResponse;
import com.edugen.ai.ratelimit.GenerationRateLimiter;
import com.edugen.core.generation.GenerationOrchestrator;
import com.edugen.core.generation.GenerationOutcome;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestHeader;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

/**
 * Teacher-facing generation endpoints. The teacher id is set by the upstream gateway.
 */
@RestController
@RequestMapping("/api/v1/ai")
@RequiredArgsConstructor
@Slf4j
public class GenerationController {
    
    static final String TEACHER_HEADER = "X-Teacher-Id";
    
    private final GenerationOrchestrator orchestrator;
    private final GenerationRateLimiter rateLimiter;
    
    @PostMapping("/generate")
    public ResponseEntity<GenerateActivityResponse> generate(
            @RequestHeader(TEACHER_HEADER) String teacherId,
            @Valid @RequestBody GenerateActivityRequest request
    ) {
        log.info("Generate request | teacherId={} | skill={} | format={} | count={}", 
            teacherId, request.getSkill(), request.getFormat(), request.getCount());
        GenerationOutcome outcome = orchestrator.generate(request.toGenerationRequest(teacherId));
        return ResponseEntity.ok(GenerateActivityResponse.from(outcome));
    }
    
    @GetMapping("/quota")
    public ResponseEntity<QuotaResponse> quota(@RequestHeader(TEACHER_HEADER) String teacherId) {
        return ResponseEntity.ok(QuotaResponse.from(rateLimiter.getQuotaInfo(teacherId)));
    }
}
