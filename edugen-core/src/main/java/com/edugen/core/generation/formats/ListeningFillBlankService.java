package com.edugen.core.generation.formats;

import com.edugen.ai.llm.LlmManager;
import com.edugen.ai.llm.structured.JsonSchema;
import com.edugen.ai.llm.structured.StructuredValue;
import com.edugen.ai.llm.structured.StructuredValue.ObjectValue;
import com.edugen.core.context.ContextResolver;
import com.edugen.core.generation.AbstractGenerationService;
import com.edugen.core.generation.ActivityPrompts;
import com.edugen.core.generation.GenerationJob;
import com.edugen.core.generation.GenerationProperties;
import com.edugen.core.generation.ItemShuffler;
import com.edugen.core.generation.model.ActivityType;
import com.edugen.core.generation.model.GenerationRequest;
import com.edugen.core.generation.model.ListeningGapItem;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.Random;

@Service
public class ListeningFillBlankService extends AbstractGenerationService {
    
    @Autowired
    public ListeningFillBlankService(LlmManager llmManager, ContextResolver contextResolver,
                                     GenerationProperties properties) {
        this(llmManager, contextResolver, properties, new Random());
    }
    
    ListeningFillBlankService(LlmManager llmManager, ContextResolver contextResolver,
                              GenerationProperties properties, Random random) {
        super(llmManager, contextResolver, properties, random);
    }
    
    @Override
    public ActivityType getActivityType() {
        return ActivityType.LISTENING_FILL_BLANK;
    }
    
    @Override
    protected JsonSchema itemSchema(GenerationRequest request) {
        return JsonSchema.object()
            .required("full_sentence", JsonSchema.string())
            .required("display_sentence", JsonSchema.string().describedAs("Sentence with " + BLANK + " per missing word"))
            .required("missing_words", JsonSchema.stringArray().minItems(1))
            .optional("acceptable_answers", JsonSchema.arrayOf(JsonSchema.stringArray()))
            .optional("distractors", JsonSchema.stringArray());
    }
    
    @Override
    protected String buildPrompt(GenerationJob job) {
        return ActivityPrompts.listeningFillBlank(job.context(), job.count(), job.cefrLevel());
    }
    
    @Override
    protected Optional<ListeningGapItem> normalizeItem(ObjectValue candidate, GenerationJob job, int index) {
        String fullSentence = candidate.text("full_sentence");
        String displaySentence = candidate.text("display_sentence");
        List<String> missingWords = candidate.texts("missing_words");
        if (fullSentence == null || displaySentence == null || missingWords.isEmpty()
                || countBlanks(displaySentence) != missingWords.size()) {
            return Optional.empty();
        }
        
        List<StructuredValue> rawAnswers = candidate.array("acceptable_answers").elements();
        List<List<String>> acceptable = new ArrayList<>();
        for (int i = 0; i < missingWords.size(); i++) {
            List<String> answers = new ArrayList<>();
            answers.add(missingWords.get(i));
            if (i < rawAnswers.size()) {
                answers.addAll(alternatives(rawAnswers.get(i)));
            }
            acceptable.add(distinctIgnoreCase(answers));
        }
        
        List<String> bank = new ArrayList<>(missingWords);
        bank.addAll(candidate.texts("distractors"));
        
        return Optional.of(ListeningGapItem.builder()
            .fullSentence(fullSentence)
            .displaySentence(displaySentence)
            .missingWords(missingWords)
            .acceptableAnswers(acceptable)
            .wordBank(ItemShuffler.shuffle(distinctIgnoreCase(bank), random))
            .difficulty(job.cefrLevel())
            .build());
    }
    
    private static List<String> alternatives(StructuredValue value) {
        if (value.kind() == StructuredValue.Kind.ARRAY) {
            return ((StructuredValue.ArrayValue) value).texts();
        }
        String text = value.asText();
        return text == null ? List.of() : List.of(text);
    }
}
