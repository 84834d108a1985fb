package com.edugen.core.context;

import com.edugen.common.cache.ResponseCache;
import com.edugen.core.content.ContentStoreClient;
import com.edugen.core.content.ContentStoreException;
import com.edugen.core.content.ContentStoreProperties;
import com.edugen.core.content.model.BookProcessingMetadata;
import com.edugen.core.content.model.ModuleDetail;
import com.edugen.core.content.model.ModuleSummary;
import com.edugen.core.content.model.ModulesMetadata;
import com.edugen.core.content.model.VocabularyList;
import com.edugen.core.content.model.VocabularyWord;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Duration;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.function.Supplier;
import java.util.stream.Collectors;

/**
 * Builds {@link MetadataContext}s from the content store and caches them per
 * (book, module set, language).
 */
@Service
@Slf4j
public class ContextResolver {

    static final int TEXT_SAMPLE_CHARS = 3000;
    private static final int MAX_TITLES_JOINED = 3;
    private static final String DEFAULT_LANGUAGE = "en";
    private static final String FREE_TEXT_TITLE = "Custom text";

    private final ContentStoreClient contentStore;
    private final ContentStoreProperties properties;
    private final ExecutorService executor;
    private final ResponseCache<MetadataContext> cache;

    @Autowired
    public ContextResolver(ContentStoreClient contentStore, ContentStoreProperties properties,
                           @Qualifier("providerExecutor") ExecutorService executor) {
        this(contentStore, properties, executor, Clock.systemUTC());
    }

    ContextResolver(ContentStoreClient contentStore, ContentStoreProperties properties,
                    ExecutorService executor, Clock clock) {
        this.contentStore = contentStore;
        this.properties = properties;
        this.executor = executor;
        this.cache = new ResponseCache<>("context", Duration.ofSeconds(properties.getContextTtlSeconds()), 1000, clock);
    }

    /**
     * Context for the given modules of a book. An empty module list selects every module.
     *
     * @throws SourceNotFoundException when the book or all requested modules are unknown
     * @throws ContextResolutionException when the content store cannot be read
     */
    public MetadataContext resolve(long bookId, List<Long> moduleIds, String language) {
        List<Long> requested = moduleIds == null ? List.of() : moduleIds;
        String key = cacheKey(bookId, requested, language);
        return cache.getOrFetch(key, () -> build(bookId, requested, language));
    }

    /**
     * Context built straight from pasted text. Not cached.
     */
    public MetadataContext fromText(String sourceText, String language) {
        String text = sourceText == null ? "" : sourceText.trim();
        return MetadataContext.builder()
            .primaryModuleTitle(FREE_TEXT_TITLE)
            .moduleTitles(List.of(FREE_TEXT_TITLE))
            .language(language != null && !language.isBlank() ? language : DEFAULT_LANGUAGE)
            .textSample(text.length() > TEXT_SAMPLE_CHARS ? text.substring(0, TEXT_SAMPLE_CHARS) : text)
            .build();
    }

    public int invalidateBook(long bookId) {
        int removed = cache.invalidatePrefix("ctx:" + bookId + ":");
        log.info("[CONTEXT] Book contexts invalidated | bookId={} | removed={}", bookId, removed);
        return removed;
    }

    public ResponseCache.Stats getCacheStats() {
        return cache.stats();
    }

    static String cacheKey(long bookId, List<Long> moduleIds, String language) {
        String modules = moduleIds.stream()
            .distinct()
            .sorted()
            .map(String::valueOf)
            .collect(Collectors.joining(","));
        String lang = language == null || language.isBlank() ? "default" : language.toLowerCase(Locale.ROOT);
        return "ctx:" + bookId + ":" + modules + ":" + lang;
    }

    private MetadataContext build(long bookId, List<Long> moduleIds, String language) {
        long startTime = System.currentTimeMillis();
        log.info("[CONTEXT] Building context | bookId={} | moduleIds={} | language={}", bookId, moduleIds, language);

        ModulesMetadata metadata = storeCall(bookId, () -> contentStore.getModulesMetadata(bookId))
            .orElseThrow(() -> missingBook(bookId, moduleIds));

        Set<Long> wanted = new HashSet<>(moduleIds);
        List<ModuleSummary> selected = metadata.getModules().stream()
            .filter(module -> wanted.isEmpty() || wanted.contains(module.getModuleId()))
            .collect(Collectors.toList());
        if (selected.isEmpty()) {
            log.warn("[CONTEXT] No matching modules | bookId={} | moduleIds={}", bookId, moduleIds);
            throw new SourceNotFoundException(bookId, moduleIds);
        }

        // Plain executor futures so that cancel(true) interrupts a stuck sub-fetch
        Map<Long, Future<Optional<ModuleDetail>>> details = new LinkedHashMap<>();
        Map<Long, Future<Optional<VocabularyList>>> vocabularies = new LinkedHashMap<>();
        for (ModuleSummary module : selected) {
            long moduleId = module.getModuleId();
            details.put(moduleId, executor.submit(() -> contentStore.getModuleDetail(bookId, moduleId)));
            vocabularies.put(moduleId, executor.submit(() -> contentStore.getVocabulary(bookId, moduleId)));
        }

        Set<String> topics = new DedupSet();
        Set<String> grammarPoints = new DedupSet();
        Map<String, VocabularyWord> words = new LinkedHashMap<>();
        List<String> titles = new ArrayList<>();
        List<String> summaries = new ArrayList<>();
        StringBuilder textSample = new StringBuilder();

        for (ModuleSummary module : selected) {
            titles.add(module.getTitle());
            if (module.getSummary() != null && !module.getSummary().isBlank()) {
                summaries.add(module.getSummary());
            }
            topics.addAll(module.getTopics());

            Optional<ModuleDetail> detail = await(details.get(module.getModuleId()), bookId, module.getModuleId(), "detail");
            detail.ifPresent(d -> {
                topics.addAll(d.getTopics());
                grammarPoints.addAll(d.getGrammarPoints());
                appendSample(textSample, d.getText());
            });

            await(vocabularies.get(module.getModuleId()), bookId, module.getModuleId(), "vocabulary")
                .ifPresent(list -> list.getWords().forEach(word -> {
                    if (word.getWord() != null && !word.getWord().isBlank()) {
                        words.putIfAbsent(word.getWord().trim().toLowerCase(Locale.ROOT), word);
                    }
                }));
        }

        MetadataContext context = MetadataContext.builder()
            .bookId(bookId)
            .moduleIds(selected.stream().map(ModuleSummary::getModuleId).collect(Collectors.toList()))
            .topics(List.copyOf(topics))
            .grammarPoints(List.copyOf(grammarPoints))
            .vocabulary(List.copyOf(words.values()))
            .moduleTitles(List.copyOf(titles))
            .summaries(List.copyOf(summaries))
            .difficultyLevel(selected.get(0).getDifficultyLevel())
            .language(pickLanguage(language, metadata.getPrimaryLanguage()))
            .primaryModuleTitle(displayTitle(titles))
            .textSample(textSample.toString())
            .build();

        log.info("[CONTEXT] Context built | bookId={} | modules={} | topics={} | vocabulary={} | grammarPoints={} | level={} | durationMs={}",
            bookId, selected.size(), context.getTopics().size(), context.getVocabulary().size(),
            context.getGrammarPoints().size(), context.getDifficultyLevel(), System.currentTimeMillis() - startTime);
        return context;
    }

    private RuntimeException missingBook(long bookId, List<Long> moduleIds) {
        Optional<BookProcessingMetadata> processing = storeCall(bookId, () -> contentStore.getProcessingMetadata(bookId));
        if (processing.isPresent() && !processing.get().isCompleted()) {
            log.warn("[CONTEXT] Book not processed yet | bookId={} | status={}",
                bookId, processing.get().getProcessingStatus());
            return new ContextResolutionException("Book " + bookId + " is still being processed (status: "
                + processing.get().getProcessingStatus() + ")", ContextResolutionException.Reason.NOT_READY, bookId);
        }
        return new SourceNotFoundException(bookId, moduleIds);
    }

    private <T> Optional<T> storeCall(long bookId, Supplier<Optional<T>> call) {
        try {
            return call.get();
        } catch (ContentStoreException e) {
            ContextResolutionException.Reason reason = e.getKind() == ContentStoreException.Kind.AUTH
                ? ContextResolutionException.Reason.AUTH
                : e.getKind() == ContentStoreException.Kind.NOT_READY
                    ? ContextResolutionException.Reason.NOT_READY
                    : ContextResolutionException.Reason.CONNECTION;
            throw new ContextResolutionException(e.getMessage(), reason, bookId, e);
        }
    }

    private <T> Optional<T> await(Future<Optional<T>> future, long bookId, long moduleId, String part) {
        try {
            Optional<T> value = future.get(properties.getSubFetchTimeoutSeconds(), TimeUnit.SECONDS);
            return value == null ? Optional.empty() : value;
        } catch (TimeoutException e) {
            future.cancel(true);
            log.warn("[CONTEXT] Sub-fetch timed out | bookId={} | moduleId={} | part={} | timeoutSeconds={}",
                bookId, moduleId, part, properties.getSubFetchTimeoutSeconds());
        } catch (ExecutionException e) {
            log.warn("[CONTEXT] Sub-fetch failed | bookId={} | moduleId={} | part={} | error={}",
                bookId, moduleId, part, e.getCause() != null ? e.getCause().getMessage() : e.getMessage());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            future.cancel(true);
            throw new ContextResolutionException("Interrupted while loading module " + moduleId,
                ContextResolutionException.Reason.CONNECTION, bookId, e);
        }
        return Optional.empty();
    }

    private static void appendSample(StringBuilder sample, String text) {
        if (text == null || text.isBlank() || sample.length() >= TEXT_SAMPLE_CHARS) {
            return;
        }
        if (sample.length() > 0) {
            sample.append("\n\n");
        }
        int room = TEXT_SAMPLE_CHARS - sample.length();
        String trimmed = text.trim();
        sample.append(trimmed.length() > room ? trimmed.substring(0, Math.max(0, room)) : trimmed);
    }

    static String displayTitle(List<String> titles) {
        if (titles.isEmpty()) {
            return "";
        }
        if (titles.size() <= MAX_TITLES_JOINED) {
            return String.join(" | ", titles);
        }
        return titles.get(0) + " and " + (titles.size() - 1) + " more";
    }

    private static String pickLanguage(String override, String bookLanguage) {
        if (override != null && !override.isBlank()) {
            return override;
        }
        if (bookLanguage != null && !bookLanguage.isBlank()) {
            return bookLanguage;
        }
        return DEFAULT_LANGUAGE;
    }

    /** Insertion-ordered set that ignores case and blanks; first spelling wins. */
    private static final class DedupSet extends LinkedHashSet<String> {
        private final Set<String> seen = new HashSet<>();

        @Override
        public boolean add(String value) {
            if (value == null || value.isBlank()) {
                return false;
            }
            String trimmed = value.trim();
            if (!seen.add(trimmed.toLowerCase(Locale.ROOT))) {
                return false;
            }
            return super.add(trimmed);
        }
    }
}
