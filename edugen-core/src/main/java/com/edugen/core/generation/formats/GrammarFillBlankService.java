package com.edugen.core.generation.formats;

import com.edugen.ai.llm.LlmManager;
import com.edugen.ai.llm.structured.JsonSchema;
import com.edugen.ai.llm.structured.StructuredValue.ObjectValue;
import com.edugen.core.context.ContextResolver;
import com.edugen.core.generation.AbstractGenerationService;
import com.edugen.core.generation.ActivityPrompts;
import com.edugen.core.generation.GenerationJob;
import com.edugen.core.generation.GenerationProperties;
import com.edugen.core.generation.ItemShuffler;
import com.edugen.core.generation.model.ActivityType;
import com.edugen.core.generation.model.GenerationRequest;
import com.edugen.core.generation.model.GrammarGapItem;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.Random;

@Service
public class GrammarFillBlankService extends AbstractGenerationService {
    
    private static final int MAX_DISTRACTORS = 3;
    
    @Autowired
    public GrammarFillBlankService(LlmManager llmManager, ContextResolver contextResolver,
                                   GenerationProperties properties) {
        this(llmManager, contextResolver, properties, new Random());
    }
    
    GrammarFillBlankService(LlmManager llmManager, ContextResolver contextResolver,
                            GenerationProperties properties, Random random) {
        super(llmManager, contextResolver, properties, random);
    }
    
    @Override
    public ActivityType getActivityType() {
        return ActivityType.GRAMMAR_FILL_BLANK;
    }
    
    @Override
    protected JsonSchema itemSchema(GenerationRequest request) {
        JsonSchema item = JsonSchema.object()
            .required("sentence", JsonSchema.string().describedAs("Exactly one " + BLANK))
            .required("correct_answer", JsonSchema.string())
            .optional("distractors", JsonSchema.stringArray().maxItems(MAX_DISTRACTORS))
            .optional("grammar_focus", JsonSchema.string());
        if (request.isIncludeExplanations()) {
            item.optional("explanation", JsonSchema.string());
        }
        return item;
    }
    
    @Override
    protected String buildPrompt(GenerationJob job) {
        return ActivityPrompts.grammarFillBlank(job.context(), job.count(), job.cefrLevel(),
            job.request().isIncludeExplanations());
    }
    
    @Override
    protected Optional<GrammarGapItem> normalizeItem(ObjectValue candidate, GenerationJob job, int index) {
        String sentence = candidate.text("sentence");
        String answer = candidate.text("correct_answer");
        if (sentence == null || answer == null || countBlanks(sentence) != 1) {
            return Optional.empty();
        }
        
        List<String> bank = new ArrayList<>();
        bank.add(answer);
        bank.addAll(candidate.texts("distractors"));
        List<String> distinct = distinctIgnoreCase(bank);
        List<String> wordBank = distinct.subList(0, Math.min(distinct.size(), MAX_DISTRACTORS + 1));
        
        return Optional.of(GrammarGapItem.builder()
            .sentence(sentence)
            .correctAnswer(answer)
            .wordBank(ItemShuffler.shuffle(wordBank, random))
            .grammarFocus(candidate.text("grammar_focus"))
            .explanation(job.request().isIncludeExplanations() ? candidate.text("explanation") : null)
            .difficulty(job.cefrLevel())
            .build());
    }
}
