package com.edugen.core.generation;

import com.edugen.ai.ratelimit.GenerationRateLimiter;
import com.edugen.ai.ratelimit.QuotaInfo;
import com.edugen.ai.usage.UsageContext;
import com.edugen.core.activity.ActivityStore;
import com.edugen.core.generation.mix.MixModeService;
import com.edugen.core.generation.model.ActivityType;
import com.edugen.core.generation.model.GeneratedActivity;
import com.edugen.core.generation.model.GenerationRequest;
import com.fasterxml.jackson.databind.node.ObjectNode;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

/**
 * Entry point for a generation request: validate it, charge the teacher's quota,
 * run the responsible service, store the result and project the public view.
 *
 * Quota is reserved before any provider is contacted. A request that fails before
 * an activity is produced hands its slot back.
 */
@Service
@Slf4j
@RequiredArgsConstructor
public class GenerationOrchestrator {
    
    private final GenerationServiceRegistry registry;
    private final MixModeService mixModeService;
    private final GenerationRateLimiter rateLimiter;
    private final ActivityStore activityStore;
    private final ActivityRedactor redactor;
    
    public GenerationOutcome generate(GenerationRequest request) {
        long startTime = System.currentTimeMillis();
        ActivityType type = validate(request);
        
        log.info("[ORCHESTRATOR] Generation requested | teacherId={} | type={} | count={} | bookId={} | modules={}", 
            request.getTeacherId(), type.slug(), request.getCount(), request.getBookId(), request.getModuleIds());
        
        QuotaInfo quota = rateLimiter.checkAndConsume(request.getTeacherId(), request.getCount());
        UsageContext usage = UsageContext.of(request.getTeacherId(), type.slug());
        
        GeneratedActivity activity;
        try {
            activity = run(type, request, usage);
        } catch (RuntimeException e) {
            rateLimiter.release(request.getTeacherId(), quota.resetAt());
            log.warn("[ORCHESTRATOR] Generation failed, quota released | requestId={} | teacherId={} | type={} | error={}", 
                usage.getRequestId(), request.getTeacherId(), type.slug(), e.getMessage());
            throw e;
        }
        
        activityStore.save(activity);
        ObjectNode publicView = redactor.toPublicView(activity);
        
        log.info("[ORCHESTRATOR] Generation completed | requestId={} | activityId={} | type={} | totalItems={} | remainingQuota={} | durationMs={}", 
            usage.getRequestId(), activity.getActivityId(), type.slug(), activity.getTotalItems(), 
            quota.remaining(), System.currentTimeMillis() - startTime);
        return new GenerationOutcome(activity, publicView, quota);
    }
    
    private GeneratedActivity run(ActivityType type, GenerationRequest request, UsageContext usage) {
        if (type == ActivityType.MIX) {
            return mixModeService.generate(request, usage);
        }
        AbstractGenerationService service = registry.find(type)
            .orElseThrow(() -> new InvalidGenerationRequestException("format",
                "No generator available for " + type.slug()));
        return service.generate(request, usage);
    }
    
    public ObjectNode publicView(String activityId) {
        return redactor.toPublicView(activityStore.require(activityId));
    }
    
    public ObjectNode authoringView(String activityId) {
        return redactor.toAuthoringView(activityStore.require(activityId));
    }
    
    ActivityType validate(GenerationRequest request) {
        if (request.getTeacherId() == null || request.getTeacherId().isBlank()) {
            throw new InvalidGenerationRequestException("teacher_id", "Teacher id is required");
        }
        if (request.getSkill() == null) {
            throw new InvalidGenerationRequestException("skill", "Unknown or missing skill");
        }
        if (request.getFormat() == null) {
            throw new InvalidGenerationRequestException("format", "Unknown or missing format");
        }
        ActivityType type = ActivityType.of(request.getSkill(), request.getFormat())
            .orElseThrow(() -> new InvalidGenerationRequestException("format",
                "Format " + request.getFormat().slug() + " is not available for skill " + request.getSkill().slug()));
        
        if (request.hasBookSource() == request.hasTextSource()) {
            throw new InvalidGenerationRequestException("source",
                "Provide either book_id with module_ids or source_text, not both");
        }
        if (request.hasBookSource() && request.getModuleIds() != null) {
            for (Long moduleId : request.getModuleIds()) {
                if (moduleId == null || moduleId <= 0) {
                    throw new InvalidGenerationRequestException("module_ids", "Module ids must be positive numbers");
                }
            }
        }
        if (request.getDifficulty() == null) {
            throw new InvalidGenerationRequestException("difficulty", "Difficulty must be auto, easy, medium or hard");
        }
        if (request.getCount() < type.getMinCount() || request.getCount() > type.getMaxCount()) {
            throw new InvalidGenerationRequestException("count", "Count for " + type.slug() + " must be between "
                + type.getMinCount() + " and " + type.getMaxCount());
        }
        return type;
    }
}
