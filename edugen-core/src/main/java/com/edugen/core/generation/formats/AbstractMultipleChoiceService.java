package com.edugen.core.generation.formats;

import com.edugen.ai.llm.LlmManager;
import com.edugen.ai.llm.structured.JsonSchema;
import com.edugen.ai.llm.structured.StructuredValue.ObjectValue;
import com.edugen.core.context.ContextResolver;
import com.edugen.core.generation.AbstractGenerationService;
import com.edugen.core.generation.GenerationJob;
import com.edugen.core.generation.GenerationProperties;
import com.edugen.core.generation.model.GenerationRequest;
import com.edugen.core.generation.model.MultipleChoiceQuestion;

import java.util.List;
import java.util.Optional;
import java.util.Random;

/**
 * Four-option questions. Items are attributed to the requested modules in turn.
 */
public abstract class AbstractMultipleChoiceService extends AbstractGenerationService {
    
    protected AbstractMultipleChoiceService(LlmManager llmManager, ContextResolver contextResolver,
                                            GenerationProperties properties) {
        super(llmManager, contextResolver, properties, new Random());
    }
    
    @Override
    protected JsonSchema itemSchema(GenerationRequest request) {
        JsonSchema item = JsonSchema.object()
            .required("question", JsonSchema.string())
            .required("options", JsonSchema.stringArray().exactly(MCQ_OPTION_COUNT))
            .required("correct_index", JsonSchema.integer());
        if (request.isIncludeExplanations()) {
            item.optional("explanation", JsonSchema.string());
        }
        return item;
    }
    
    @Override
    protected Optional<MultipleChoiceQuestion> normalizeItem(ObjectValue candidate, GenerationJob job, int index) {
        String question = candidate.text("question");
        List<String> options = fourOptions(candidate);
        if (question == null || options == null) {
            return Optional.empty();
        }
        int correctIndex = clampIndex(candidate.integer("correct_index"), options.size());
        
        return Optional.of(MultipleChoiceQuestion.builder()
            .question(question)
            .options(options)
            .correctIndex(correctIndex)
            .correctAnswer(options.get(correctIndex))
            .explanation(job.request().isIncludeExplanations() ? candidate.text("explanation") : null)
            .sourceModuleId(job.moduleForIndex(index))
            .difficulty(job.cefrLevel())
            .build());
    }
}
