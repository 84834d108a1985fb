package com.edugen.core.generation.model;

import java.util.Arrays;
import java.util.List;
import java.util.Optional;

/**
 * The supported skill and format pairs. Each pair fixes the key its items live
 * under, the item fields that reveal answers and the item count bounds.
 */
public enum ActivityType {
    
    LISTENING_QUIZ(Skill.LISTENING, ActivityFormat.QUIZ, "questions", true, 1, 50,
        "audio_text", "correct_index", "correct_answer", "explanation"),
    LISTENING_FILL_BLANK(Skill.LISTENING, ActivityFormat.FILL_BLANK, "items", true, 1, 50,
        "full_sentence", "missing_words", "acceptable_answers"),
    LISTENING_SENTENCE_BUILDER(Skill.LISTENING, ActivityFormat.SENTENCE_BUILDER, "sentences", true, 1, 50,
        "correct_sentence"),
    LISTENING_WORD_BUILDER(Skill.LISTENING, ActivityFormat.WORD_BUILDER, "words", true, 1, 50,
        "correct_word"),
    VOCABULARY_MULTIPLE_CHOICE(Skill.VOCABULARY, ActivityFormat.MULTIPLE_CHOICE, "questions", false, 1, 50,
        "correct_index", "correct_answer", "explanation"),
    READING_MULTIPLE_CHOICE(Skill.READING, ActivityFormat.MULTIPLE_CHOICE, "questions", false, 1, 50,
        "correct_index", "correct_answer", "explanation"),
    READING_COMPREHENSION(Skill.READING, ActivityFormat.COMPREHENSION, "questions", false, 1, 20,
        "correct_index", "correct_answer", "explanation", "passage_reference"),
    GRAMMAR_FILL_BLANK(Skill.GRAMMAR, ActivityFormat.FILL_BLANK, "items", false, 1, 50,
        "correct_answer", "explanation"),
    WRITING_FILL_BLANK(Skill.WRITING, ActivityFormat.FILL_BLANK, "items", false, 1, 50,
        "correct_answer", "acceptable_answers"),
    MIX(Skill.MIX, ActivityFormat.MIX, "items", false, 5, 50);
    
    private final Skill skill;
    private final ActivityFormat format;
    private final String rootKey;
    private final boolean audio;
    private final int minCount;
    private final int maxCount;
    private final List<String> answerBearingFields;
    
    ActivityType(Skill skill, ActivityFormat format, String rootKey, boolean audio,
                 int minCount, int maxCount, String... answerBearingFields) {
        this.skill = skill;
        this.format = format;
        this.rootKey = rootKey;
        this.audio = audio;
        this.minCount = minCount;
        this.maxCount = maxCount;
        this.answerBearingFields = List.of(answerBearingFields);
    }
    
    public static Optional<ActivityType> of(Skill skill, ActivityFormat format) {
        return Arrays.stream(values())
            .filter(type -> type.skill == skill && type.format == format)
            .findFirst();
    }
    
    /** e.g. {@code listening_quiz}; used as the activity type in usage records. */
    public String slug() {
        return skill == Skill.MIX ? "mix" : skill.slug() + "_" + format.slug();
    }
    
    public Skill getSkill() { return skill; }
    public ActivityFormat getFormat() { return format; }
    public String getRootKey() { return rootKey; }
    public boolean hasAudio() { return audio; }
    public int getMinCount() { return minCount; }
    public int getMaxCount() { return maxCount; }
    
    /** Item fields the public view must never carry, in snake_case. */
    public List<String> answerBearingFields() { return answerBearingFields; }
}
