package com.edugen.core.generation.formats;

import com.edugen.ai.llm.LlmManager;
import com.edugen.ai.llm.structured.JsonSchema;
import com.edugen.ai.usage.UsageContext;
import com.edugen.core.context.ContextResolver;
import com.edugen.core.generation.GenerationProperties;
import com.edugen.core.generation.model.ActivityFormat;
import com.edugen.core.generation.model.GeneratedActivity;
import com.edugen.core.generation.model.GenerationRequest;
import com.edugen.core.generation.model.MultipleChoiceQuestion;
import com.edugen.core.generation.model.Skill;
import com.edugen.core.support.TestPayloads;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyLong;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

class VocabularyMultipleChoiceServiceTest {
    
    private LlmManager llmManager;
    private VocabularyMultipleChoiceService service;
    
    @BeforeEach
    void setUp() {
        llmManager = mock(LlmManager.class);
        ContextResolver contextResolver = mock(ContextResolver.class);
        when(contextResolver.resolve(anyLong(), any(), any())).thenReturn(TestPayloads.bookContext("A1"));
        service = new VocabularyMultipleChoiceService(llmManager, contextResolver, new GenerationProperties());
    }
    
    @Test
    void should_AttributeQuestionsToModulesInTurn_When_SeveralModulesAreUsed() {
        when(llmManager.generateStructured(anyString(), any(JsonSchema.class), any(), any()))
            .thenReturn(TestPayloads.result("""
                {"questions":[
                  {"question":"What is breakfast?","options":["A meal","A drink","A game","A room"],"correct_index":0},
                  {"question":"Three options only","options":["a","b","c"],"correct_index":0},
                  {"question":"Usually means?","options":["never","often","always","sometimes"],"correct_index":1},
                  {"question":"Pick one","options":["w","x","y","z"],"correct_index":7}
                ]}
                """));
        GenerationRequest request = GenerationRequest.builder()
            .teacherId("teacher-1")
            .skill(Skill.VOCABULARY)
            .format(ActivityFormat.MULTIPLE_CHOICE)
            .bookId(42L)
            .moduleIds(List.of(1L, 2L))
            .count(4)
            .includeExplanations(false)
            .build();
        
        GeneratedActivity activity = service.generate(request, UsageContext.of("teacher-1", "vocabulary"));
        
        assertThat(activity.getDifficulty().slug()).isEqualTo("easy");
        assertThat(activity.getItems()).hasSize(3);
        assertThat(activity.getItems())
            .extracting(item -> ((MultipleChoiceQuestion) item).getSourceModuleId())
            .containsExactly(1L, 2L, 1L);
        MultipleChoiceQuestion last = (MultipleChoiceQuestion) activity.getItems().get(2);
        assertThat(last.getCorrectIndex()).isZero();
        assertThat(last.getCorrectAnswer()).isEqualTo("w");
        assertThat(last.getExplanation()).isNull();
    }
}
