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
import com.edugen.core.generation.model.ListeningQuestion;
import org.springframework.stereotype.Service;

import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.Random;

@Service
public class ListeningQuizService extends AbstractGenerationService {
    
    static final List<String> SUB_SKILLS = List.of("gist", "detail", "discrimination");
    private static final String DEFAULT_SUB_SKILL = "detail";
    
    public ListeningQuizService(LlmManager llmManager, ContextResolver contextResolver, GenerationProperties properties) {
        super(llmManager, contextResolver, properties, new Random());
    }
    
    @Override
    public ActivityType getActivityType() {
        return ActivityType.LISTENING_QUIZ;
    }
    
    @Override
    protected JsonSchema itemSchema(GenerationRequest request) {
        JsonSchema item = JsonSchema.object()
            .required("audio_text", JsonSchema.string().describedAs("Text read aloud to the student"))
            .required("question", JsonSchema.string())
            .required("options", JsonSchema.stringArray().exactly(MCQ_OPTION_COUNT))
            .required("correct_index", JsonSchema.integer())
            .required("sub_skill", JsonSchema.string().oneOf(SUB_SKILLS.toArray(new String[0])));
        if (request.isIncludeExplanations()) {
            item.optional("explanation", JsonSchema.string());
        }
        return item;
    }
    
    @Override
    protected String buildPrompt(GenerationJob job) {
        return ActivityPrompts.listeningQuiz(job.context(), job.count(), job.cefrLevel(),
            job.request().isIncludeExplanations());
    }
    
    @Override
    protected Optional<ListeningQuestion> normalizeItem(ObjectValue candidate, GenerationJob job, int index) {
        String audioText = candidate.text("audio_text");
        String question = candidate.text("question");
        List<String> options = fourOptions(candidate);
        if (audioText == null || question == null || options == null) {
            return Optional.empty();
        }
        
        int correctIndex = clampIndex(candidate.integer("correct_index"), options.size());
        String subSkill = candidate.text("sub_skill", DEFAULT_SUB_SKILL).toLowerCase(Locale.ROOT);
        
        return Optional.of(ListeningQuestion.builder()
            .audioText(audioText)
            .question(question)
            .options(options)
            .correctIndex(correctIndex)
            .correctAnswer(options.get(correctIndex))
            .explanation(job.request().isIncludeExplanations() ? candidate.text("explanation") : null)
            .subSkill(SUB_SKILLS.contains(subSkill) ? subSkill : DEFAULT_SUB_SKILL)
            .difficulty(candidate.text("difficulty", job.cefrLevel()))
            .build());
    }
}
