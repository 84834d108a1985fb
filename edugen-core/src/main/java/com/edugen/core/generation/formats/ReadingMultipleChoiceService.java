package com.edugen.core.generation.formats;

import com.edugen.ai.llm.LlmManager;
import com.edugen.core.context.ContextResolver;
import com.edugen.core.generation.ActivityPrompts;
import com.edugen.core.generation.GenerationJob;
import com.edugen.core.generation.GenerationProperties;
import com.edugen.core.generation.model.ActivityType;
import org.springframework.stereotype.Service;

@Service
public class ReadingMultipleChoiceService extends AbstractMultipleChoiceService {
    
    public ReadingMultipleChoiceService(LlmManager llmManager, ContextResolver contextResolver,
                                        GenerationProperties properties) {
        super(llmManager, contextResolver, properties);
    }
    
    @Override
    public ActivityType getActivityType() {
        return ActivityType.READING_MULTIPLE_CHOICE;
    }
    
    @Override
    protected String buildPrompt(GenerationJob job) {
        return ActivityPrompts.readingMultipleChoice(job.context(), job.count(), job.cefrLevel(),
            job.request().isIncludeExplanations());
    }
}
