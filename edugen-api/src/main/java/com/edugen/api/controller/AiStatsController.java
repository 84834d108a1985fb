package com.edugen.api.controller;

import com.edugen.ai.llm.LlmManager;
import com.edugen.ai.llm.LlmProviderClient;
import com.edugen.ai.provider.ProviderUnavailableException;
import com.edugen.ai.tts.TtsManager;
import com.edugen.ai.usage.UsageTracker;
import com.edugen.api.dto.response.UsageSummaryResponse;
import com.edugen.api.service.UsageReportService;
import com.edugen.core.context.ContextResolver;
import com.edugen.core.generation.GenerationServiceRegistry;
import com.edugen.core.generation.model.ActivityType;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

@RestController
@RequestMapping("/api/v1/ai")
@RequiredArgsConstructor
@Slf4j
public class AiStatsController {
    
    private final LlmManager llmManager;
    private final TtsManager ttsManager;
    private final UsageTracker usageTracker;
    private final ContextResolver contextResolver;
    private final GenerationServiceRegistry registry;
    private final UsageReportService usageReportService;
    
    @GetMapping("/stats")
    public ResponseEntity<Map<String, Object>> getStatistics() {
        Map<String, Object> stats = new LinkedHashMap<>();
        stats.put("llm", llmManager.getStatistics());
        stats.put("tts", ttsManager.getStatistics());
        stats.put("usage", usageTracker.getStatistics());
        stats.put("contextCache", contextResolver.getCacheStats());
        stats.put("activityTypes", registry.supportedTypes().stream()
            .map(ActivityType::slug)
            .collect(Collectors.toList()));
        return ResponseEntity.ok(stats);
    }
    
    @GetMapping("/health")
    public ResponseEntity<Map<String, Object>> healthCheck() {
        List<String> available;
        try {
            available = llmManager.providerChain().stream()
                .map(LlmProviderClient::getName)
                .collect(Collectors.toList());
        } catch (ProviderUnavailableException e) {
            log.warn("[HEALTH] No LLM provider available | reason={}", e.getMessage());
            available = List.of();
        }
        boolean healthy = !available.isEmpty();
        
        return ResponseEntity.status(healthy ? 200 : 503).body(Map.of(
            "status", healthy ? "UP" : "DOWN",
            "availableProviders", available
        ));
    }
    
    @GetMapping("/usage/summary")
    public ResponseEntity<UsageSummaryResponse> usageSummary(@RequestParam(defaultValue = "7") int days) {
        return ResponseEntity.ok(usageReportService.summarize(days));
    }
}
