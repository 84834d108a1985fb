package com.edugen.core.generation.formats;

import com.edugen.ai.llm.LlmManager;
import com.edugen.ai.llm.structured.JsonSchema;
import com.edugen.ai.llm.structured.StructuredValue.ObjectValue;
import com.edugen.core.context.ContextResolver;
import com.edugen.core.generation.AbstractGenerationService;
import com.edugen.core.generation.ActivityPrompts;
import com.edugen.core.generation.GenerationJob;
import com.edugen.core.generation.GenerationProperties;
import com.edugen.core.generation.model.ActivityType;
import com.edugen.core.generation.model.GenerationRequest;
import com.edugen.core.generation.model.WritingGapItem;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.Random;

/**
 * Gaps that test word choice rather than form; several answers may be accepted.
 */
@Service
public class WritingFillBlankService extends AbstractGenerationService {
    
    public WritingFillBlankService(LlmManager llmManager, ContextResolver contextResolver,
                                   GenerationProperties properties) {
        super(llmManager, contextResolver, properties, new Random());
    }
    
    @Override
    public ActivityType getActivityType() {
        return ActivityType.WRITING_FILL_BLANK;
    }
    
    @Override
    protected JsonSchema itemSchema(GenerationRequest request) {
        return JsonSchema.object()
            .required("sentence", JsonSchema.string())
            .required("correct_answer", JsonSchema.string())
            .optional("acceptable_answers", JsonSchema.stringArray())
            .optional("hint", JsonSchema.string())
            .optional("context", JsonSchema.string());
    }
    
    @Override
    protected String buildPrompt(GenerationJob job) {
        return ActivityPrompts.writingFillBlank(job.context(), job.count(), job.cefrLevel());
    }
    
    @Override
    protected Optional<WritingGapItem> normalizeItem(ObjectValue candidate, GenerationJob job, int index) {
        String sentence = candidate.text("sentence");
        String answer = candidate.text("correct_answer");
        if (sentence == null || answer == null || countBlanks(sentence) == 0) {
            return Optional.empty();
        }
        
        List<String> accepted = new ArrayList<>();
        accepted.add(answer);
        accepted.addAll(candidate.texts("acceptable_answers"));
        
        return Optional.of(WritingGapItem.builder()
            .sentence(sentence)
            .correctAnswer(answer)
            .acceptableAnswers(distinctIgnoreCase(accepted))
            .hint(candidate.text("hint"))
            .context(candidate.text("context"))
            .difficulty(job.cefrLevel())
            .build());
    }
}
