package com.edugen.core.context;

import com.edugen.core.content.ContentStoreClient;
import com.edugen.core.content.ContentStoreException;
import com.edugen.core.content.ContentStoreProperties;
import com.edugen.core.content.model.BookProcessingMetadata;
import com.edugen.core.content.model.ModuleDetail;
import com.edugen.core.content.model.ModuleSummary;
import com.edugen.core.content.model.ModulesMetadata;
import com.edugen.core.content.model.VocabularyList;
import com.edugen.core.content.model.VocabularyWord;
import com.edugen.core.support.MutableClock;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.anyLong;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

class ContextResolverTest {
    
    private ContentStoreClient contentStore;
    private ExecutorService executor;
    private MutableClock clock;
    private ContextResolver resolver;
    
    @BeforeEach
    void setUp() {
        contentStore = mock(ContentStoreClient.class);
        executor = Executors.newFixedThreadPool(4);
        clock = new MutableClock(Instant.parse("2024-05-01T10:00:00Z"));
        ContentStoreProperties properties = new ContentStoreProperties();
        properties.setContextTtlSeconds(300);
        properties.setSubFetchTimeoutSeconds(2);
        resolver = new ContextResolver(contentStore, properties, executor, clock);
    }
    
    @AfterEach
    void tearDown() {
        executor.shutdownNow();
    }
    
    private static ModuleSummary module(long id, String title, String level, String... topics) {
        return ModuleSummary.builder().moduleId(id).title(title).difficultyLevel(level).topics(List.of(topics)).build();
    }
    
    private void givenBook(ModuleSummary... modules) {
        when(contentStore.getModulesMetadata(42)).thenReturn(Optional.of(ModulesMetadata.builder()
            .bookId(42L).primaryLanguage("tr").modules(List.of(modules)).build()));
        when(contentStore.getModuleDetail(eq(42L), anyLong())).thenReturn(Optional.empty());
        when(contentStore.getVocabulary(eq(42L), anyLong())).thenReturn(Optional.empty());
    }
    
    @Test
    @DisplayName("Two resolutions inside the TTL hit the content store once")
    void should_FetchOnce_When_ResolvedTwiceWithinTtl() {
        givenBook(module(1, "Unit 1", "A2", "Family"), module(2, "Unit 2", "B1", "Food"));
        
        MetadataContext first = resolver.resolve(42, List.of(2L, 1L), "en");
        MetadataContext second = resolver.resolve(42, List.of(1L, 2L), "en");
        
        assertThat(second).isSameAs(first);
        verify(contentStore, times(1)).getModulesMetadata(42);
        verify(contentStore, times(1)).getModuleDetail(42, 1);
    }
    
    @Test
    void should_RebuildContext_When_TtlExpired() {
        givenBook(module(1, "Unit 1", "A2"));
        
        resolver.resolve(42, List.of(1L), null);
        clock.advance(Duration.ofSeconds(301));
        resolver.resolve(42, List.of(1L), null);
        
        verify(contentStore, times(2)).getModulesMetadata(42);
    }
    
    @Test
    void should_MergeAndDeduplicate_When_ModulesOverlap() {
        givenBook(module(1, "Unit 1", "A2", "Family", "Home"), module(2, "Unit 2", "B1", "family", "Food"));
        when(contentStore.getModuleDetail(42, 1)).thenReturn(Optional.of(ModuleDetail.builder()
            .moduleId(1).text("My family lives in a small house.").grammarPoints(List.of("Present simple")).build()));
        when(contentStore.getModuleDetail(42, 2)).thenReturn(Optional.of(ModuleDetail.builder()
            .moduleId(2).text("We eat rice.").grammarPoints(List.of("present simple", "Countable nouns")).build()));
        when(contentStore.getVocabulary(42, 1L)).thenReturn(Optional.of(VocabularyList.builder()
            .words(List.of(VocabularyWord.builder().word("House").build())).build()));
        when(contentStore.getVocabulary(42, 2L)).thenReturn(Optional.of(VocabularyList.builder()
            .words(List.of(VocabularyWord.builder().word("house").build(), VocabularyWord.builder().word("rice").build()))
            .build()));
        
        MetadataContext context = resolver.resolve(42, List.of(1L, 2L), null);
        
        assertThat(context.getTopics()).containsExactly("Family", "Home", "Food");
        assertThat(context.getGrammarPoints()).containsExactly("Present simple", "Countable nouns");
        assertThat(context.vocabularyWords()).containsExactly("House", "rice");
        assertThat(context.getDifficultyLevel()).isEqualTo("A2");
        assertThat(context.getLanguage()).isEqualTo("tr");
        assertThat(context.getPrimaryModuleTitle()).isEqualTo("Unit 1 | Unit 2");
        assertThat(context.getTextSample()).startsWith("My family lives").contains("We eat rice.");
    }
    
    @Test
    void should_AbbreviateTitle_When_MoreThanThreeModules() {
        givenBook(module(1, "Unit 1", "A1"), module(2, "Unit 2", "A1"), module(3, "Unit 3", "A1"), module(4, "Unit 4", "A1"));
        
        MetadataContext context = resolver.resolve(42, List.of(), "en");
        
        assertThat(context.getModuleIds()).containsExactly(1L, 2L, 3L, 4L);
        assertThat(context.getPrimaryModuleTitle()).isEqualTo("Unit 1 and 3 more");
        assertThat(context.getLanguage()).isEqualTo("en");
    }
    
    @Test
    void should_ThrowSourceNotFound_When_NoRequestedModuleExists() {
        givenBook(module(1, "Unit 1", "A1"));
        
        assertThatThrownBy(() -> resolver.resolve(42, List.of(7L, 8L), null))
            .isInstanceOf(SourceNotFoundException.class)
            .hasMessageContaining("42");
    }
    
    @Test
    void should_ReportNotReady_When_BookStillProcessing() {
        when(contentStore.getModulesMetadata(42)).thenReturn(Optional.empty());
        when(contentStore.getProcessingMetadata(42)).thenReturn(Optional.of(
            BookProcessingMetadata.builder().bookId(42L).processingStatus("processing").build()));
        
        assertThatThrownBy(() -> resolver.resolve(42, List.of(1L), null))
            .isInstanceOf(ContextResolutionException.class)
            .isNotInstanceOf(SourceNotFoundException.class)
            .extracting(e -> ((ContextResolutionException) e).getReason())
            .isEqualTo(ContextResolutionException.Reason.NOT_READY);
    }
    
    @Test
    void should_WrapStoreFailure_When_CredentialsRejected() {
        when(contentStore.getModulesMetadata(42)).thenThrow(
            new ContentStoreException("rejected", ContentStoreException.Kind.AUTH, 42L, null));
        
        assertThatThrownBy(() -> resolver.resolve(42, List.of(1L), null))
            .isInstanceOf(ContextResolutionException.class)
            .extracting(e -> ((ContextResolutionException) e).getReason())
            .isEqualTo(ContextResolutionException.Reason.AUTH);
    }
    
    @Test
    void should_NotCacheFailure_When_StoreRecovers() {
        givenBook(module(1, "Unit 1", "A1"));
        when(contentStore.getModulesMetadata(42))
            .thenThrow(new ContentStoreException("down", ContentStoreException.Kind.CONNECTION, 42L, null))
            .thenReturn(Optional.of(ModulesMetadata.builder().bookId(42L).modules(List.of(module(1, "Unit 1", "A1"))).build()));
        
        assertThatThrownBy(() -> resolver.resolve(42, List.of(1L), null)).isInstanceOf(ContextResolutionException.class);
        
        assertThat(resolver.resolve(42, List.of(1L), null).getModuleTitles()).containsExactly("Unit 1");
    }
    
    @Test
    void should_SkipModuleDetail_When_SubFetchFails() {
        givenBook(module(1, "Unit 1", "A1", "Animals"));
        when(contentStore.getModuleDetail(42, 1)).thenThrow(
            new ContentStoreException("boom", ContentStoreException.Kind.CONNECTION, 42L, null));
        
        MetadataContext context = resolver.resolve(42, List.of(1L), null);
        
        assertThat(context.getTopics()).containsExactly("Animals");
        assertThat(context.getTextSample()).isEmpty();
    }
    
    @Test
    @DisplayName("A sub-fetch that outlives its timeout is dropped and its worker interrupted")
    void should_InterruptSubFetch_When_TimedOut() throws Exception {
        ContentStoreProperties properties = new ContentStoreProperties();
        properties.setContextTtlSeconds(300);
        properties.setSubFetchTimeoutSeconds(1);
        ContextResolver impatient = new ContextResolver(contentStore, properties, executor, clock);
        givenBook(module(1, "Unit 1", "A1", "Animals"));
        CountDownLatch interrupted = new CountDownLatch(1);
        when(contentStore.getModuleDetail(42, 1)).thenAnswer(invocation -> {
            try {
                new CountDownLatch(1).await(30, TimeUnit.SECONDS);
            } catch (InterruptedException e) {
                interrupted.countDown();
            }
            return Optional.empty();
        });
        
        MetadataContext context = impatient.resolve(42, List.of(1L), null);
        
        assertThat(context.getTopics()).containsExactly("Animals");
        assertThat(interrupted.await(5, TimeUnit.SECONDS)).isTrue();
    }
    
    @Test
    void should_RefetchBook_When_Invalidated() {
        givenBook(module(1, "Unit 1", "A1"));
        resolver.resolve(42, List.of(1L), null);
        
        assertThat(resolver.invalidateBook(42)).isEqualTo(1);
        resolver.resolve(42, List.of(1L), null);
        
        verify(contentStore, times(2)).getModulesMetadata(42);
    }
    
    @Test
    void should_BuildTextContext_When_SourceTextGiven() {
        MetadataContext context = resolver.fromText("  The cat sat on the mat.  ", null);
        
        assertThat(context.isFreeText()).isTrue();
        assertThat(context.getTextSample()).isEqualTo("The cat sat on the mat.");
        assertThat(context.getLanguage()).isEqualTo("en");
        assertThat(context.getDifficultyLevel()).isNull();
    }
}
