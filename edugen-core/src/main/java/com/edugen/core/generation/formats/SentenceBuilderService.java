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
import com.edugen.core.generation.model.SentenceBuilderItem;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;

import java.util.Arrays;
import java.util.List;
import java.util.Optional;
import java.util.Random;

/**
 * Listen and put the words back in order.
 */
@Service
public class SentenceBuilderService extends AbstractGenerationService {
    
    private static final int MIN_WORDS = 2;
    
    @Autowired
    public SentenceBuilderService(LlmManager llmManager, ContextResolver contextResolver,
                                  GenerationProperties properties) {
        this(llmManager, contextResolver, properties, new Random());
    }
    
    SentenceBuilderService(LlmManager llmManager, ContextResolver contextResolver,
                           GenerationProperties properties, Random random) {
        super(llmManager, contextResolver, properties, random);
    }
    
    @Override
    public ActivityType getActivityType() {
        return ActivityType.LISTENING_SENTENCE_BUILDER;
    }
    
    @Override
    protected JsonSchema itemSchema(GenerationRequest request) {
        return JsonSchema.object()
            .required("sentence", JsonSchema.string());
    }
    
    @Override
    protected String buildPrompt(GenerationJob job) {
        return ActivityPrompts.listeningSentenceBuilder(job.context(), job.count(), job.cefrLevel());
    }
    
    @Override
    protected Optional<SentenceBuilderItem> normalizeItem(ObjectValue candidate, GenerationJob job, int index) {
        String sentence = candidate.text("sentence");
        if (sentence == null) {
            return Optional.empty();
        }
        List<String> words = Arrays.asList(sentence.split("\\s+"));
        if (words.size() < MIN_WORDS) {
            return Optional.empty();
        }
        
        return Optional.of(SentenceBuilderItem.builder()
            .correctSentence(sentence)
            .words(ItemShuffler.shuffleAwayFrom(words, random))
            .wordCount(words.size())
            .difficulty(job.cefrLevel())
            .build());
    }
}
