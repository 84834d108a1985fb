package com.edugen.core.generation.formats;

import com.edugen.ai.llm.LlmManager;
import com.edugen.ai.llm.structured.JsonSchema;
import com.edugen.ai.usage.UsageContext;
import com.edugen.core.context.ContextResolver;
import com.edugen.core.generation.ActivityRedactor;
import com.edugen.core.generation.GenerationProperties;
import com.edugen.core.generation.model.ActivityFormat;
import com.edugen.core.generation.model.GeneratedActivity;
import com.edugen.core.generation.model.GenerationRequest;
import com.edugen.core.generation.model.ListeningGapItem;
import com.edugen.core.generation.model.SentenceBuilderItem;
import com.edugen.core.generation.model.Skill;
import com.edugen.core.generation.model.WordBuilderItem;
import com.edugen.core.support.TestPayloads;
import com.fasterxml.jackson.databind.JsonNode;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Random;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

class ListeningPuzzleServicesTest {
    
    private LlmManager llmManager;
    private ContextResolver contextResolver;
    private final GenerationProperties properties = new GenerationProperties();
    private final UsageContext usage = UsageContext.of("teacher-1", "listening");
    
    @BeforeEach
    void setUp() {
        llmManager = mock(LlmManager.class);
        contextResolver = mock(ContextResolver.class);
        when(contextResolver.fromText(anyString(), any())).thenReturn(TestPayloads.bookContext("A1"));
    }
    
    private void providerReturns(String json) {
        when(llmManager.generateStructured(anyString(), any(JsonSchema.class), any(), any()))
            .thenReturn(TestPayloads.result(json));
    }
    
    private static GenerationRequest request(ActivityFormat format, int count) {
        return GenerationRequest.builder()
            .teacherId("teacher-1")
            .skill(Skill.LISTENING)
            .format(format)
            .sourceText("I usually have breakfast at seven.")
            .count(count)
            .build();
    }
    
    @Test
    void should_ShuffleWordsAwayFromSentence_When_BuildingSentences() {
        providerReturns("""
            {"sentences":[{"sentence":"I usually have breakfast at seven"},{"sentence":"Hello"},{"sentence":"  "}]}
            """);
        SentenceBuilderService service = new SentenceBuilderService(llmManager, contextResolver, properties, new Random(7));
        
        GeneratedActivity activity = service.generate(request(ActivityFormat.SENTENCE_BUILDER, 3), usage);
        
        assertThat(activity.getItems()).hasSize(1);
        SentenceBuilderItem item = (SentenceBuilderItem) activity.getItems().get(0);
        assertThat(item.getWordCount()).isEqualTo(6);
        assertThat(item.getWords())
            .containsExactlyInAnyOrder("I", "usually", "have", "breakfast", "at", "seven")
            .isNotEqualTo(List.of("I", "usually", "have", "breakfast", "at", "seven"));
        
        JsonNode publicItem = new ActivityRedactor(TestPayloads.MAPPER).toPublicView(activity).get("sentences").get(0);
        assertThat(publicItem.has("correct_sentence")).isFalse();
        assertThat(publicItem.get("words")).hasSize(6);
    }
    
    @Test
    void should_ScrambleLowercasedLetters_When_BuildingWords() {
        providerReturns("""
            {"words":[{"word":"Breakfast","definition":"morning meal"},{"word":"a"}]}
            """);
        WordBuilderService service = new WordBuilderService(llmManager, contextResolver, properties, new Random(3));
        
        GeneratedActivity activity = service.generate(request(ActivityFormat.WORD_BUILDER, 2), usage);
        
        assertThat(activity.getItems()).hasSize(1);
        WordBuilderItem item = (WordBuilderItem) activity.getItems().get(0);
        assertThat(item.getCorrectWord()).isEqualTo("breakfast");
        assertThat(item.getLetterCount()).isEqualTo(9);
        assertThat(String.join("", item.getLetters())).isNotEqualTo("breakfast");
        assertThat(item.getLetters()).containsExactlyInAnyOrder("b", "r", "e", "a", "k", "f", "a", "s", "t");
        assertThat(item.getDefinition()).isEqualTo("morning meal");
    }
    
    @Test
    void should_DropUnspellableCandidates_When_BuildingWords() {
        providerReturns("""
            {"words":[{"word":"ice cream"},{"word":"go"},{"word":"it's"},{"word":"caf\u00e9"},
              {"word":"extraordinarily"},{"word":"apple"},{"word":" Kitchen "}]}
            """);
        WordBuilderService service = new WordBuilderService(llmManager, contextResolver, properties, new Random(3));
        
        GeneratedActivity activity = service.generate(request(ActivityFormat.WORD_BUILDER, 7), usage);
        
        assertThat(activity.getItems())
            .extracting(item -> ((WordBuilderItem) item).getCorrectWord())
            .containsExactly("apple", "kitchen");
    }
    
    @Test
    void should_RequireMatchingBlankCount_When_BuildingListeningGaps() {
        providerReturns("""
            {"items":[
              {"full_sentence":"She drinks hot tea every morning.","display_sentence":"She drinks _______ tea every _______.",
               "missing_words":["hot","morning"],"acceptable_answers":[["warm","Hot"]],"distractors":["cold","night"]},
              {"full_sentence":"We play football.","display_sentence":"We play _______.","missing_words":["football","play"]}
            ]}
            """);
        ListeningFillBlankService service = new ListeningFillBlankService(llmManager, contextResolver, properties, new Random(1));
        
        GeneratedActivity activity = service.generate(request(ActivityFormat.FILL_BLANK, 2), usage);
        
        assertThat(activity.getItems()).hasSize(1);
        ListeningGapItem item = (ListeningGapItem) activity.getItems().get(0);
        assertThat(item.getAcceptableAnswers()).containsExactly(List.of("hot", "warm"), List.of("morning"));
        assertThat(item.getWordBank()).containsExactlyInAnyOrder("hot", "morning", "cold", "night");
        
        JsonNode publicItem = new ActivityRedactor(TestPayloads.MAPPER).toPublicView(activity).get("items").get(0);
        assertThat(publicItem.has("full_sentence")).isFalse();
        assertThat(publicItem.has("missing_words")).isFalse();
        assertThat(publicItem.has("acceptable_answers")).isFalse();
        assertThat(publicItem.get("display_sentence").asText()).contains("_______");
        assertThat(publicItem.get("word_bank")).hasSize(4);
    }
}
