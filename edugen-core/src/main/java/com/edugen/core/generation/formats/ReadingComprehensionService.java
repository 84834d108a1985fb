package com.edugen.core.generation.formats;

import com.edugen.ai.llm.LlmManager;
import com.edugen.ai.llm.structured.JsonSchema;
import com.edugen.ai.llm.structured.StructuredValue.ObjectValue;
import com.edugen.core.context.ContextResolver;
import com.edugen.core.generation.AbstractGenerationService;
import com.edugen.core.generation.ActivityPrompts;
import com.edugen.core.generation.GenerationException;
import com.edugen.core.generation.GenerationJob;
import com.edugen.core.generation.GenerationProperties;
import com.edugen.core.generation.model.ActivityType;
import com.edugen.core.generation.model.ComprehensionQuestion;
import com.edugen.core.generation.model.GeneratedActivity;
import com.edugen.core.generation.model.GenerationRequest;
import org.springframework.stereotype.Service;

import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.Random;
import java.util.stream.Collectors;

/**
 * A generated passage followed by questions of mixed types.
 */
@Service
public class ReadingComprehensionService extends AbstractGenerationService {
    
    static final List<String> QUESTION_TYPES = List.of(
        ComprehensionQuestion.MCQ, ComprehensionQuestion.TRUE_FALSE, ComprehensionQuestion.SHORT_ANSWER);
    private static final List<String> TRUE_FALSE_OPTIONS = List.of("True", "False");
    
    public ReadingComprehensionService(LlmManager llmManager, ContextResolver contextResolver,
                                       GenerationProperties properties) {
        super(llmManager, contextResolver, properties, new Random());
    }
    
    @Override
    public ActivityType getActivityType() {
        return ActivityType.READING_COMPREHENSION;
    }
    
    @Override
    protected JsonSchema rootSchema(GenerationRequest request) {
        return super.rootSchema(request)
            .required("passage", JsonSchema.string())
            .optional("passage_title", JsonSchema.string());
    }
    
    @Override
    protected JsonSchema itemSchema(GenerationRequest request) {
        JsonSchema item = JsonSchema.object()
            .required("question_type", JsonSchema.string().oneOf(allowedTypes(request).toArray(new String[0])))
            .required("question", JsonSchema.string())
            .optional("options", JsonSchema.stringArray())
            .optional("correct_index", JsonSchema.integer())
            .required("correct_answer", JsonSchema.string())
            .optional("passage_reference", JsonSchema.string());
        if (request.isIncludeExplanations()) {
            item.optional("explanation", JsonSchema.string());
        }
        return item;
    }
    
    @Override
    protected String buildPrompt(GenerationJob job) {
        return ActivityPrompts.readingComprehension(job.context(), job.count(), job.cefrLevel(),
            allowedTypes(job.request()), job.request().isIncludeExplanations());
    }
    
    @Override
    protected void checkPayload(ObjectValue payload, GenerationJob job) {
        if (payload.text("passage") == null) {
            throw new GenerationException(getActivityType(), "Provider returned no reading passage", null);
        }
    }
    
    @Override
    protected void completeActivity(GeneratedActivity activity, ObjectValue payload, GenerationJob job) {
        activity.setPassage(payload.text("passage"));
        activity.setPassageTitle(payload.text("passage_title", job.context().getPrimaryModuleTitle()));
    }
    
    @Override
    protected Optional<ComprehensionQuestion> normalizeItem(ObjectValue candidate, GenerationJob job, int index) {
        String questionType = candidate.text("question_type", ComprehensionQuestion.MCQ).toLowerCase(Locale.ROOT);
        String question = candidate.text("question");
        if (question == null || !allowedTypes(job.request()).contains(questionType)) {
            return Optional.empty();
        }
        
        ComprehensionQuestion.ComprehensionQuestionBuilder<?, ?> builder = ComprehensionQuestion.builder()
            .questionType(questionType)
            .question(question)
            .explanation(job.request().isIncludeExplanations() ? candidate.text("explanation") : null)
            .passageReference(candidate.text("passage_reference"));
        
        String answer = candidate.text("correct_answer");
        switch (questionType) {
            case ComprehensionQuestion.MCQ: {
                List<String> options = fourOptions(candidate);
                if (options == null) {
                    return Optional.empty();
                }
                int correctIndex = resolveIndex(candidate.integer("correct_index"), answer, options);
                builder.options(options).correctIndex(correctIndex).correctAnswer(options.get(correctIndex));
                break;
            }
            case ComprehensionQuestion.TRUE_FALSE: {
                Integer correctIndex = candidate.integer("correct_index");
                if (correctIndex == null || correctIndex < 0 || correctIndex > 1) {
                    correctIndex = indexOfIgnoreCase(TRUE_FALSE_OPTIONS, answer);
                }
                if (correctIndex < 0) {
                    return Optional.empty();
                }
                builder.options(TRUE_FALSE_OPTIONS).correctIndex(correctIndex)
                    .correctAnswer(TRUE_FALSE_OPTIONS.get(correctIndex));
                break;
            }
            default:
                if (answer == null) {
                    return Optional.empty();
                }
                builder.correctAnswer(answer);
        }
        return Optional.of(builder.build());
    }
    
    static List<String> allowedTypes(GenerationRequest request) {
        List<String> requested = request.getQuestionTypes().stream()
            .map(type -> type.trim().toLowerCase(Locale.ROOT))
            .filter(QUESTION_TYPES::contains)
            .distinct()
            .collect(Collectors.toList());
        return requested.isEmpty() ? QUESTION_TYPES : requested;
    }
    
    private static int resolveIndex(Integer index, String answer, List<String> options) {
        if (index != null && index >= 0 && index < options.size()) {
            return index;
        }
        int inferred = indexOfIgnoreCase(options, answer);
        return inferred >= 0 ? inferred : 0;
    }
    
    private static int indexOfIgnoreCase(List<String> options, String value) {
        if (value == null) {
            return -1;
        }
        for (int i = 0; i < options.size(); i++) {
            if (options.get(i).equalsIgnoreCase(value.trim())) {
                return i;
            }
        }
        return -1;
    }
}
