package com.edugen.core.generation;

import com.edugen.ai.config.RateLimitProperties;
import com.edugen.ai.ratelimit.GenerationRateLimiter;
import com.edugen.ai.ratelimit.RateLimitExceededException;
import com.edugen.ai.usage.UsageContext;
import com.edugen.core.activity.ActivityNotFoundException;
import com.edugen.core.activity.InMemoryActivityStore;
import com.edugen.core.context.SourceNotFoundException;
import com.edugen.core.generation.mix.MixModeService;
import com.edugen.core.generation.model.ActivityFormat;
import com.edugen.core.generation.model.ActivityItem;
import com.edugen.core.generation.model.ActivityType;
import com.edugen.core.generation.model.AudioStatus;
import com.edugen.core.generation.model.GeneratedActivity;
import com.edugen.core.generation.model.GenerationRequest;
import com.edugen.core.generation.model.ListeningQuestion;
import com.edugen.core.generation.model.Skill;
import com.edugen.core.support.TestPayloads;
import com.fasterxml.jackson.databind.JsonNode;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.UUID;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

class GenerationOrchestratorTest {
    
    private AbstractGenerationService listeningQuiz;
    private MixModeService mixModeService;
    private RateLimitProperties rateLimits;
    private GenerationRateLimiter rateLimiter;
    private GenerationOrchestrator orchestrator;
    
    @BeforeEach
    void setUp() {
        listeningQuiz = mock(AbstractGenerationService.class);
        when(listeningQuiz.getActivityType()).thenReturn(ActivityType.LISTENING_QUIZ);
        when(listeningQuiz.generate(any(GenerationRequest.class), any(UsageContext.class)))
            .thenAnswer(invocation -> listeningActivity(((GenerationRequest) invocation.getArgument(0)).getCount()));
        mixModeService = mock(MixModeService.class);
        
        rateLimits = new RateLimitProperties();
        rateLimits.setDailyLimitPerTeacher(10);
        rateLimits.setMaxItemsPerRequest(50);
        rateLimiter = new GenerationRateLimiter(rateLimits);
        
        orchestrator = new GenerationOrchestrator(new GenerationServiceRegistry(List.of(listeningQuiz)),
            mixModeService, rateLimiter, new InMemoryActivityStore(new GenerationProperties()),
            new ActivityRedactor(TestPayloads.MAPPER));
    }
    
    private static GeneratedActivity listeningActivity(int count) {
        List<ActivityItem> items = new ArrayList<>();
        for (int i = 0; i < count; i++) {
            ListeningQuestion question = ListeningQuestion.builder()
                .itemId(UUID.randomUUID().toString())
                .audioText("Tom gets up at " + (i + 6) + ".")
                .question("When does Tom get up?")
                .options(List.of("At 5", "At 6", "At 7", "At 8"))
                .correctIndex(1)
                .correctAnswer("At 6")
                .audioStatus(AudioStatus.PENDING)
                .build();
            question.setType(ActivityType.LISTENING_QUIZ);
            items.add(question);
        }
        return GeneratedActivity.builder()
            .activityId(UUID.randomUUID().toString())
            .type(ActivityType.LISTENING_QUIZ)
            .skill(Skill.LISTENING)
            .format(ActivityFormat.QUIZ)
            .requestedItems(count)
            .totalItems(count)
            .provider("DeepSeek")
            .items(items)
            .build();
    }
    
    private static GenerationRequest.GenerationRequestBuilder listening(int count) {
        return GenerationRequest.builder()
            .teacherId("teacher-1")
            .skill(Skill.LISTENING)
            .format(ActivityFormat.QUIZ)
            .bookId(42L)
            .moduleIds(List.of(1L, 2L))
            .count(count);
    }
    
    @Test
    void should_StoreActivityAndReturnPublicView_When_GenerationSucceeds() {
        GenerationOutcome outcome = orchestrator.generate(listening(3).build());
        
        assertThat(outcome.activity().getTotalItems()).isEqualTo(3);
        assertThat(outcome.quota().used()).isEqualTo(1);
        assertThat(outcome.quota().remaining()).isEqualTo(9);
        JsonNode question = outcome.publicView().get("questions").get(0);
        assertThat(question.has("audio_text")).isFalse();
        assertThat(question.has("correct_answer")).isFalse();
        assertThat(outcome.publicView().has("provider")).isFalse();
        
        JsonNode stored = orchestrator.authoringView(outcome.activityId());
        assertThat(stored.get("questions").get(0).get("correct_answer").asText()).isEqualTo("At 6");
        assertThat(orchestrator.publicView(outcome.activityId())).isEqualTo(outcome.publicView());
    }
    
    @Test
    @DisplayName("The eleventh request of the day is refused before any provider work")
    void should_RejectWithoutGenerating_When_DailyLimitIsReached() {
        for (int i = 0; i < 9; i++) {
            orchestrator.generate(listening(5).build());
        }
        assertThat(rateLimiter.getRemaining("teacher-1")).isEqualTo(1);
        
        GenerationOutcome tenth = orchestrator.generate(listening(5).build());
        assertThat(tenth.quota().remaining()).isZero();
        
        assertThatThrownBy(() -> orchestrator.generate(listening(5).build()))
            .isInstanceOf(RateLimitExceededException.class)
            .satisfies(e -> assertThat(((RateLimitExceededException) e).getLimitType())
                .isEqualTo(RateLimitExceededException.LimitType.DAILY));
        verify(listeningQuiz, times(10)).generate(any(GenerationRequest.class), any(UsageContext.class));
    }
    
    @Test
    void should_NotContactServices_When_RequestExceedsPerRequestLimit() {
        rateLimits.setMaxItemsPerRequest(5);
        
        assertThatThrownBy(() -> orchestrator.generate(listening(10).build()))
            .isInstanceOf(RateLimitExceededException.class);
        verify(listeningQuiz, times(0)).generate(any(GenerationRequest.class), any(UsageContext.class));
        verifyNoInteractions(mixModeService);
    }
    
    @Test
    void should_ReleaseQuota_When_GenerationFails() {
        doThrow(new GenerationException(ActivityType.LISTENING_QUIZ, "all providers failed", null))
            .when(listeningQuiz).generate(any(GenerationRequest.class), any(UsageContext.class));
        
        assertThatThrownBy(() -> orchestrator.generate(listening(5).build()))
            .isInstanceOf(GenerationException.class);
        assertThat(rateLimiter.getQuotaInfo("teacher-1").used()).isZero();
    }
    
    @Test
    @DisplayName("Three requests for a missing book leave the teacher's quota untouched")
    void should_ReleaseQuota_When_SourceIsNotFound() {
        doThrow(new SourceNotFoundException(42L, List.of(1L, 2L)))
            .when(listeningQuiz).generate(any(GenerationRequest.class), any(UsageContext.class));
        
        for (int i = 0; i < 3; i++) {
            assertThatThrownBy(() -> orchestrator.generate(listening(5).build()))
                .isInstanceOf(SourceNotFoundException.class);
        }
        
        assertThat(rateLimiter.getQuotaInfo("teacher-1").used()).isZero();
        assertThat(orchestrator.generate(listening(5).build()).quota().used()).isEqualTo(1);
    }
    
    @Test
    void should_ReleaseQuota_When_NoValidItemsSurvive() {
        doThrow(new NoValidItemsException(ActivityType.LISTENING_QUIZ, 4))
            .when(listeningQuiz).generate(any(GenerationRequest.class), any(UsageContext.class));
        
        assertThatThrownBy(() -> orchestrator.generate(listening(5).build()))
            .isInstanceOf(NoValidItemsException.class);
        assertThat(rateLimiter.getRemaining("teacher-1")).isEqualTo(10);
    }
    
    @Test
    void should_DelegateToMixMode_When_SkillIsMix() {
        GeneratedActivity mixed = listeningActivity(5);
        mixed.setType(ActivityType.MIX);
        when(mixModeService.generate(any(GenerationRequest.class), any(UsageContext.class))).thenReturn(mixed);
        
        GenerationOutcome outcome = orchestrator.generate(listening(5).skill(Skill.MIX).format(ActivityFormat.MIX).build());
        
        assertThat(outcome.publicView().get("items")).hasSize(5);
        verify(listeningQuiz, times(0)).generate(any(GenerationRequest.class), any(UsageContext.class));
    }
    
    @Test
    void should_RejectBothSources_When_BookAndTextAreGiven() {
        assertThatThrownBy(() -> orchestrator.generate(listening(5).sourceText("Some text").build()))
            .isInstanceOf(InvalidGenerationRequestException.class)
            .satisfies(e -> assertThat(((InvalidGenerationRequestException) e).getField()).isEqualTo("source"));
        assertThat(rateLimiter.getQuotaInfo("teacher-1").used()).isZero();
    }
    
    @Test
    void should_RejectMissingSource_When_NeitherBookNorTextIsGiven() {
        assertThatThrownBy(() -> orchestrator.generate(listening(5).bookId(null).moduleIds(List.of()).build()))
            .isInstanceOf(InvalidGenerationRequestException.class);
    }
    
    @Test
    void should_RejectModuleIds_When_NullOrNotPositive() {
        assertThatThrownBy(() -> orchestrator.generate(listening(5).moduleIds(Arrays.asList(1L, null)).build()))
            .isInstanceOf(InvalidGenerationRequestException.class)
            .satisfies(e -> assertThat(((InvalidGenerationRequestException) e).getField()).isEqualTo("module_ids"));
        assertThatThrownBy(() -> orchestrator.generate(listening(5).moduleIds(List.of(0L, 2L)).build()))
            .isInstanceOf(InvalidGenerationRequestException.class);
        
        verify(listeningQuiz, times(0)).generate(any(GenerationRequest.class), any(UsageContext.class));
        assertThat(rateLimiter.getQuotaInfo("teacher-1").used()).isZero();
    }
    
    @Test
    void should_RejectUnsupportedPair_When_FormatDoesNotBelongToSkill() {
        assertThatThrownBy(() -> orchestrator.generate(listening(5).skill(Skill.READING)
                .format(ActivityFormat.SENTENCE_BUILDER).build()))
            .isInstanceOf(InvalidGenerationRequestException.class)
            .hasMessageContaining("sentence_builder");
    }
    
    @Test
    void should_RejectCountOutsideTypeBounds_When_Validating() {
        assertThatThrownBy(() -> orchestrator.validate(listening(0).build()))
            .isInstanceOf(InvalidGenerationRequestException.class)
            .hasMessageContaining("between 1 and 50");
        assertThatThrownBy(() -> orchestrator.validate(listening(3).skill(Skill.MIX).format(ActivityFormat.MIX).build()))
            .hasMessageContaining("between 5 and 50");
    }
    
    @Test
    void should_RejectRequest_When_TeacherOrDifficultyIsMissing() {
        assertThatThrownBy(() -> orchestrator.validate(listening(5).teacherId(" ").build()))
            .satisfies(e -> assertThat(((InvalidGenerationRequestException) e).getField()).isEqualTo("teacher_id"));
        assertThatThrownBy(() -> orchestrator.validate(listening(5).difficulty(null).build()))
            .satisfies(e -> assertThat(((InvalidGenerationRequestException) e).getField()).isEqualTo("difficulty"));
    }
    
    @Test
    void should_Throw_When_ActivityIsUnknown() {
        assertThatThrownBy(() -> orchestrator.publicView("missing"))
            .isInstanceOf(ActivityNotFoundException.class);
    }
}
