package com.edugen.core.generation;

import com.edugen.ai.llm.LlmManager;
import com.edugen.ai.llm.model.GenerationOptions;
import com.edugen.ai.llm.model.GenerationResult;
import com.edugen.ai.llm.structured.JsonSchema;
import com.edugen.ai.llm.structured.StructuredValue.ObjectValue;
import com.edugen.ai.provider.AllProvidersFailedException;
import com.edugen.ai.usage.UsageContext;
import com.edugen.core.context.ContextResolver;
import com.edugen.core.context.MetadataContext;
import com.edugen.core.generation.model.ActivityItem;
import com.edugen.core.generation.model.ActivityType;
import com.edugen.core.generation.model.AudioItem;
import com.edugen.core.generation.model.AudioStatus;
import com.edugen.core.generation.model.Difficulty;
import com.edugen.core.generation.model.DifficultySelection;
import com.edugen.core.generation.model.GeneratedActivity;
import com.edugen.core.generation.model.GenerationRequest;
import lombok.extern.slf4j.Slf4j;

import java.time.Instant;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.Random;
import java.util.Set;
import java.util.UUID;

/**
 * Shared flow of every skill and format: resolve context, pick the difficulty,
 * build the prompt, ask for a structured payload, normalize its items and hand
 * back the authoring view.
 *
 * Subclasses supply the item schema, the prompt and the per-item normalization.
 */
@Slf4j
public abstract class AbstractGenerationService {

    protected static final String BLANK = "_______";
    protected static final int MCQ_OPTION_COUNT = 4;

    protected final LlmManager llmManager;
    protected final ContextResolver contextResolver;
    protected final GenerationProperties properties;
    protected final Random random;

    protected AbstractGenerationService(LlmManager llmManager, ContextResolver contextResolver,
                                        GenerationProperties properties, Random random) {
        this.llmManager = llmManager;
        this.contextResolver = contextResolver;
        this.properties = properties;
        this.random = random;
    }

    public abstract ActivityType getActivityType();

    protected abstract JsonSchema itemSchema(GenerationRequest request);

    protected abstract String buildPrompt(GenerationJob job);

    /**
     * Turns one candidate into an item, or empty when a required field is missing.
     * Ids, type and audio status are filled in by the caller.
     */
    protected abstract Optional<? extends ActivityItem> normalizeItem(ObjectValue candidate, GenerationJob job, int index);

    public GeneratedActivity generate(GenerationRequest request, UsageContext usage) {
        return generate(request, resolveContext(request), usage);
    }

    /**
     * Generates against an already resolved context. Mix mode uses this to share one
     * context between its constituents.
     */
    public GeneratedActivity generate(GenerationRequest request, MetadataContext context, UsageContext usage) {
        ActivityType type = getActivityType();
        long startTime = System.currentTimeMillis();

        DifficultySelection difficulty = Difficulty.select(request.getDifficulty(), context.getDifficultyLevel());
        GenerationJob job = new GenerationJob(request, context, difficulty);
        String prompt = buildPrompt(job);

        log.info("[GEN] Generating | type={} | count={} | difficulty={} | level={} | bookId={} | promptLength={}",
            type.slug(), request.getCount(), difficulty.difficulty().slug(), difficulty.cefrLevel(),
            context.getBookId(), prompt.length());

        GenerationResult result;
        try {
            result = llmManager.generateStructured(prompt, rootSchema(request), options(), usage.forActivity(type.slug()));
        } catch (AllProvidersFailedException e) {
            log.error("[GEN] Generation failed | type={} | providers={} | attempts={}",
                type.slug(), e.getAttemptedProviders(), e.getTotalAttempts());
            throw new GenerationException(type, "Could not generate " + type.slug() + " activity: "
                + e.getMessage(), e);
        }

        ObjectValue payload = result.getStructured();
        checkPayload(payload, job);

        List<ObjectValue> candidates = payload.array(type.getRootKey()).objects();
        List<ActivityItem> items = new ArrayList<>();
        int limit = Math.min(candidates.size(), request.getCount());
        for (int i = 0; i < limit; i++) {
            Optional<? extends ActivityItem> item = normalizeItem(candidates.get(i), job, items.size());
            if (item.isEmpty()) {
                log.debug("[GEN] Candidate dropped | type={} | index={}", type.slug(), i);
                continue;
            }
            ActivityItem normalized = item.get();
            normalized.setItemId(UUID.randomUUID().toString());
            normalized.setType(type);
            if (normalized instanceof AudioItem) {
                ((AudioItem) normalized).setAudioStatus(AudioStatus.PENDING);
            }
            items.add(normalized);
        }

        if (items.isEmpty()) {
            log.warn("[GEN] No valid items | type={} | candidates={}", type.slug(), candidates.size());
            throw new NoValidItemsException(type, candidates.size());
        }

        GeneratedActivity activity = GeneratedActivity.builder()
            .activityId(UUID.randomUUID().toString())
            .type(type)
            .skill(type.getSkill())
            .format(type.getFormat())
            .title(title(type, context))
            .bookId(context.getBookId())
            .moduleIds(context.isFreeText() ? null : context.getModuleIds())
            .difficulty(difficulty.difficulty())
            .cefrLevel(difficulty.cefrLevel())
            .language(context.getLanguage())
            .requestedItems(request.getCount())
            .totalItems(items.size())
            .provider(result.getProvider() != null ? result.getProvider().getDisplayName() : null)
            .model(result.getModel())
            .createdAt(Instant.now())
            .items(items)
            .build();
        completeActivity(activity, payload, job);

        log.info("[GEN] Activity generated | type={} | activityId={} | requested={} | totalItems={} | candidates={} | provider={} | durationMs={}",
            type.slug(), activity.getActivityId(), request.getCount(), items.size(), candidates.size(),
            activity.getProvider(), System.currentTimeMillis() - startTime);
        return activity;
    }

    protected MetadataContext resolveContext(GenerationRequest request) {
        if (request.hasBookSource()) {
            return contextResolver.resolve(request.getBookId(), request.getModuleIds(), request.getLanguage());
        }
        return contextResolver.fromText(request.getSourceText(), request.getLanguage());
    }

    protected JsonSchema rootSchema(GenerationRequest request) {
        return JsonSchema.object()
            .required(getActivityType().getRootKey(), JsonSchema.arrayOf(itemSchema(request)).minItems(1));
    }

    /** Rejects payloads that are unusable as a whole. */
    protected void checkPayload(ObjectValue payload, GenerationJob job) {
    }

    /** Copies activity-level payload fields onto the built activity. */
    protected void completeActivity(GeneratedActivity activity, ObjectValue payload, GenerationJob job) {
    }

    protected GenerationOptions options() {
        return GenerationOptions.builder()
            .systemPrompt(ActivityPrompts.SYSTEM_PROMPT)
            .temperature(properties.getTemperature())
            .maxTokens(properties.getMaxTokens())
            .build();
    }

    /** Exactly four non-blank options, or null. */
    protected static List<String> fourOptions(ObjectValue candidate) {
        List<String> options = candidate.texts("options");
        return options.size() == MCQ_OPTION_COUNT ? options : null;
    }

    protected static int clampIndex(Integer index, int size) {
        return index == null || index < 0 || index >= size ? 0 : index;
    }

    protected static int countBlanks(String sentence) {
        int count = 0;
        int from = 0;
        while ((from = sentence.indexOf(BLANK, from)) >= 0) {
            count++;
            from += BLANK.length();
        }
        return count;
    }

    /** Keeps the first spelling of each value, ignoring case and blanks. */
    protected static List<String> distinctIgnoreCase(List<String> values) {
        List<String> result = new ArrayList<>();
        Set<String> seen = new HashSet<>();
        for (String value : values) {
            if (value != null && !value.isBlank() && seen.add(value.trim().toLowerCase(Locale.ROOT))) {
                result.add(value.trim());
            }
        }
        return result;
    }

    private static String title(ActivityType type, MetadataContext context) {
        String name = type.getSkill().slug() + " " + type.getFormat().slug().replace('_', ' ');
        String label = Character.toUpperCase(name.charAt(0)) + name.substring(1).toLowerCase(Locale.ROOT);
        String source = context.getPrimaryModuleTitle();
        return source == null || source.isBlank() ? label : label + ": " + source;
    }
}
