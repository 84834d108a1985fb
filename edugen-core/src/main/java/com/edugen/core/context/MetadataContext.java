package com.edugen.core.context;

import com.edugen.core.content.model.VocabularyWord;
import lombok.Builder;
import lombok.Value;

import java.util.List;
import java.util.stream.Collectors;

/**
 * Everything a prompt needs to know about the selected book modules (or the
 * free text a teacher pasted in). Built whole and never updated afterwards.
 */
@Value
@Builder
public class MetadataContext {
    Long bookId;
    @Builder.Default
    List<Long> moduleIds = List.of();
    @Builder.Default
    List<String> topics = List.of();
    @Builder.Default
    List<VocabularyWord> vocabulary = List.of();
    @Builder.Default
    List<String> moduleTitles = List.of();
    @Builder.Default
    List<String> summaries = List.of();
    @Builder.Default
    List<String> grammarPoints = List.of();
    /** CEFR level of the first selected module, null when unknown. */
    String difficultyLevel;
    String language;
    String primaryModuleTitle;
    @Builder.Default
    String textSample = "";
    
    public boolean isFreeText() {
        return bookId == null;
    }
    
    public List<String> vocabularyWords() {
        return vocabulary.stream().map(VocabularyWord::getWord).collect(Collectors.toList());
    }
}
