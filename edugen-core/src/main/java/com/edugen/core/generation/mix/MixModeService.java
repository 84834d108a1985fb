package com.edugen.core.generation.mix;

import com.edugen.ai.usage.UsageContext;
import com.edugen.core.context.ContextResolver;
import com.edugen.core.context.MetadataContext;
import com.edugen.core.generation.AbstractGenerationService;
import com.edugen.core.generation.GenerationException;
import com.edugen.core.generation.GenerationProperties;
import com.edugen.core.generation.GenerationServiceRegistry;
import com.edugen.core.generation.model.ActivityFormat;
import com.edugen.core.generation.model.ActivityItem;
import com.edugen.core.generation.model.ActivityType;
import com.edugen.core.generation.model.Difficulty;
import com.edugen.core.generation.model.DifficultySelection;
import com.edugen.core.generation.model.GeneratedActivity;
import com.edugen.core.generation.model.GenerationRequest;
import com.edugen.core.generation.model.Skill;
import com.edugen.core.generation.model.SkillAllocation;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;

import java.time.Instant;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.UUID;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * Generates one activity spanning all five skills. The item count is split by
 * {@link SkillDistributor}, each share is produced by the regular service for that
 * skill's default format, and the results are merged in skill order.
 */
@Service
@Slf4j
public class MixModeService {

    static final Map<Skill, ActivityType> DEFAULT_TYPES = new EnumMap<>(Skill.class);

    static {
        DEFAULT_TYPES.put(Skill.VOCABULARY, ActivityType.VOCABULARY_MULTIPLE_CHOICE);
        DEFAULT_TYPES.put(Skill.GRAMMAR, ActivityType.GRAMMAR_FILL_BLANK);
        DEFAULT_TYPES.put(Skill.READING, ActivityType.READING_MULTIPLE_CHOICE);
        DEFAULT_TYPES.put(Skill.LISTENING, ActivityType.LISTENING_QUIZ);
        DEFAULT_TYPES.put(Skill.WRITING, ActivityType.WRITING_FILL_BLANK);
    }

    private final GenerationServiceRegistry registry;
    private final ContextResolver contextResolver;
    private final GenerationProperties properties;
    private final ExecutorService executor;

    public MixModeService(GenerationServiceRegistry registry, ContextResolver contextResolver,
                          GenerationProperties properties,
                          @Qualifier("generationExecutor") ExecutorService executor) {
        this.registry = registry;
        this.contextResolver = contextResolver;
        this.properties = properties;
        this.executor = executor;
    }

    public GeneratedActivity generate(GenerationRequest request, UsageContext usage) {
        long startTime = System.currentTimeMillis();
        MetadataContext context = request.hasBookSource()
            ? contextResolver.resolve(request.getBookId(), request.getModuleIds(), request.getLanguage())
            : contextResolver.fromText(request.getSourceText(), request.getLanguage());

        String analysedText = context.getTextSample().isBlank()
            ? String.join(" ", context.getSummaries())
            : context.getTextSample();
        Map<Skill, Double> weights = ContentAnalysis.weigh(analysedText);
        Map<Skill, Integer> allocation = SkillDistributor.distribute(weights, request.getCount());

        log.info("[MIX] Starting mix generation | bookId={} | count={} | weights={} | allocation={}",
            request.getBookId(), request.getCount(), weights, allocation);

        Map<ActivityType, CompletableFuture<GeneratedActivity>> futures = new LinkedHashMap<>();
        allocation.forEach((skill, count) -> {
            ActivityType type = DEFAULT_TYPES.get(skill);
            AbstractGenerationService service = registry.find(type)
                .orElseThrow(() -> new IllegalStateException("No generation service for " + type.slug()));
            GenerationRequest constituent = request.toBuilder()
                .skill(type.getSkill())
                .format(type.getFormat())
                .count(count)
                .build();
            futures.put(type, CompletableFuture.supplyAsync(
                () -> service.generate(constituent, context, usage), executor));
        });

        List<GeneratedActivity> parts = new ArrayList<>();
        RuntimeException firstFailure = null;
        long deadline = System.currentTimeMillis() + TimeUnit.SECONDS.toMillis(properties.getMixTimeoutSeconds());
        for (Map.Entry<ActivityType, CompletableFuture<GeneratedActivity>> entry : futures.entrySet()) {
            ActivityType type = entry.getKey();
            CompletableFuture<GeneratedActivity> future = entry.getValue();
            try {
                long remaining = Math.max(0, deadline - System.currentTimeMillis());
                parts.add(future.get(remaining, TimeUnit.MILLISECONDS));
            } catch (ExecutionException e) {
                RuntimeException cause = asRuntime(type, e.getCause());
                log.warn("[MIX] Constituent failed | type={} | error={}", type.slug(), cause.getMessage());
                if (firstFailure == null) {
                    firstFailure = cause;
                }
            } catch (TimeoutException e) {
                future.cancel(true);
                log.warn("[MIX] Constituent timed out | type={} | timeoutSeconds={}",
                    type.slug(), properties.getMixTimeoutSeconds());
                if (firstFailure == null) {
                    firstFailure = new GenerationException(type, type.slug() + " generation timed out", e);
                }
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                futures.values().forEach(pending -> pending.cancel(true));
                throw new GenerationException(ActivityType.MIX, "Mix generation interrupted", e);
            }
        }

        if (parts.isEmpty()) {
            log.error("[MIX] All constituents failed | bookId={} | durationMs={}",
                request.getBookId(), System.currentTimeMillis() - startTime);
            throw firstFailure != null
                ? firstFailure
                : new GenerationException(ActivityType.MIX, "Mix generation produced no activities", null);
        }

        GeneratedActivity activity = merge(request, context, parts);
        log.info("[MIX] Mix generated | activityId={} | requested={} | totalItems={} | distribution={} | durationMs={}",
            activity.getActivityId(), request.getCount(), activity.getTotalItems(),
            activity.getSkillDistribution().keySet(), System.currentTimeMillis() - startTime);
        return activity;
    }

    private GeneratedActivity merge(GenerationRequest request, MetadataContext context, List<GeneratedActivity> parts) {
        List<ActivityItem> items = new ArrayList<>();
        Map<String, SkillAllocation> distribution = new LinkedHashMap<>();
        for (GeneratedActivity part : parts) {
            ActivityType type = part.getType();
            part.getItems().forEach(item -> item.tagWith(type));
            items.addAll(part.getItems());
            distribution.put(type.getSkill().slug(), new SkillAllocation(part.getItems().size(), type.getFormat().slug()));
        }

        DifficultySelection difficulty = Difficulty.select(request.getDifficulty(), context.getDifficultyLevel());
        String source = context.getPrimaryModuleTitle();
        return GeneratedActivity.builder()
            .activityId(UUID.randomUUID().toString())
            .type(ActivityType.MIX)
            .skill(Skill.MIX)
            .format(ActivityFormat.MIX)
            .title(source == null || source.isBlank() ? "Mixed skills" : "Mixed skills: " + source)
            .bookId(context.getBookId())
            .moduleIds(context.isFreeText() ? null : context.getModuleIds())
            .difficulty(difficulty.difficulty())
            .cefrLevel(difficulty.cefrLevel())
            .language(context.getLanguage())
            .requestedItems(request.getCount())
            .totalItems(items.size())
            .skillDistribution(distribution)
            .provider(parts.get(0).getProvider())
            .model(parts.get(0).getModel())
            .createdAt(Instant.now())
            .items(items)
            .build();
    }

    private static RuntimeException asRuntime(ActivityType type, Throwable cause) {
        if (cause instanceof RuntimeException) {
            return (RuntimeException) cause;
        }
        return new GenerationException(type, "Generation of " + type.slug() + " failed", cause);
    }
}
