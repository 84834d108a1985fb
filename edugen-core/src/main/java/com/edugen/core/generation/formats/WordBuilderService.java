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
import com.edugen.core.generation.model.WordBuilderItem;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;

import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.Random;
import java.util.regex.Pattern;
import java.util.stream.Collectors;

/**
 * Listen and spell the word from scrambled letters.
 */
@Service
public class WordBuilderService extends AbstractGenerationService {
    
    // Single alphabetic word short enough to spell from scrambled tiles
    private static final Pattern SPELLABLE_WORD = Pattern.compile("[a-z]{4,12}");
    
    @Autowired
    public WordBuilderService(LlmManager llmManager, ContextResolver contextResolver,
                              GenerationProperties properties) {
        this(llmManager, contextResolver, properties, new Random());
    }
    
    WordBuilderService(LlmManager llmManager, ContextResolver contextResolver,
                       GenerationProperties properties, Random random) {
        super(llmManager, contextResolver, properties, random);
    }
    
    @Override
    public ActivityType getActivityType() {
        return ActivityType.LISTENING_WORD_BUILDER;
    }
    
    @Override
    protected JsonSchema itemSchema(GenerationRequest request) {
        return JsonSchema.object()
            .required("word", JsonSchema.string())
            .optional("definition", JsonSchema.string());
    }
    
    @Override
    protected String buildPrompt(GenerationJob job) {
        return ActivityPrompts.listeningWordBuilder(job.context(), job.count(), job.cefrLevel());
    }
    
    @Override
    protected Optional<WordBuilderItem> normalizeItem(ObjectValue candidate, GenerationJob job, int index) {
        String word = candidate.text("word");
        if (word == null) {
            return Optional.empty();
        }
        word = word.trim().toLowerCase(Locale.ROOT);
        if (!SPELLABLE_WORD.matcher(word).matches()) {
            return Optional.empty();
        }
        
        List<String> letters = word.chars()
            .mapToObj(c -> String.valueOf((char) c))
            .collect(Collectors.toList());
        
        return Optional.of(WordBuilderItem.builder()
            .correctWord(word)
            .letters(ItemShuffler.shuffleAwayFrom(letters, random))
            .letterCount(letters.size())
            .definition(candidate.text("definition"))
            .difficulty(job.cefrLevel())
            .build());
    }
}
