package com.edugen.core.generation;

import com.edugen.core.context.MetadataContext;

import java.util.List;
import java.util.stream.Collectors;

/**
 * Prompt templates for every activity type. Pure string substitution.
 */
public final class ActivityPrompts {

    private static final int MAX_LISTED_WORDS = 40;
    private static final int MAX_LISTED_TOPICS = 15;

    public static final String SYSTEM_PROMPT = """
        You are an experienced ESL/EFL materials writer. You create classroom activities that are \
        accurate, age-appropriate and pitched exactly at the requested CEFR level. \
        You always answer with JSON only.""";

    private static final String CONTEXT_BLOCK = """
        Source: %s
        Topics: %s
        Key vocabulary: %s
        Grammar points: %s
        CEFR level: %s
        Language of instruction: %s
        """;

    private static final String LISTENING_QUIZ = """
        Create %d listening comprehension questions.

        %s
        Each question has:
        - "audio_text": 1-3 sentences a narrator will read aloud (never shown to the student)
        - "question": what the student answers after listening
        - "options": exactly 4 answer choices
        - "correct_index": index (0-3) of the correct option
        - "sub_skill": one of "gist", "detail", "discrimination"
        %s
        Mix sub-skills across the set. Keep audio texts natural and short enough to hold in memory.
        Return {"questions": [...]}.""";

    private static final String LISTENING_FILL_BLANK = """
        Create %d listen-and-fill-the-gap items.

        %s
        Each item has:
        - "full_sentence": the complete sentence the narrator reads
        - "display_sentence": the same sentence with each missing word replaced by _______
        - "missing_words": the removed words in order (1-2 per sentence)
        - "acceptable_answers": list of accepted spellings per missing word (optional)
        - "distractors": 2-3 plausible words that are not in the sentence

        Return {"items": [...]}.""";

    private static final String LISTENING_SENTENCE_BUILDER = """
        Create %d sentences for a listen-and-build-the-sentence activity.

        %s
        Each item has:
        - "sentence": a complete sentence of 4-12 words using the vocabulary above

        Sentences are spoken aloud, so avoid abbreviations, numbers written as digits and quotations.
        Return {"sentences": [...]}.""";

    private static final String LISTENING_WORD_BUILDER = """
        Create %d words for a listen-and-spell activity.

        %s
        Each item has:
        - "word": a single word of 4 to 12 letters (letters only, no spaces) taken from or related to the vocabulary above
        - "definition": a short learner-friendly definition

        Return {"words": [...]}.""";

    private static final String VOCABULARY_MCQ = """
        Create %d vocabulary multiple-choice questions.

        %s
        Each question has:
        - "question": asks for the meaning, use or form of one vocabulary word
        - "options": exactly 4 choices, one correct
        - "correct_index": index (0-3) of the correct option
        %s
        Prefer words from the key vocabulary list. Distractors must be plausible but clearly wrong.
        Return {"questions": [...]}.""";

    private static final String READING_MCQ = """
        Create %d reading multiple-choice questions about the text below.

        %s
        Text:
        \"\"\"
        %s
        \"\"\"

        Each question has:
        - "question"
        - "options": exactly 4 choices
        - "correct_index": index (0-3) of the correct option
        %s
        Return {"questions": [...]}.""";

    private static final String READING_COMPREHENSION = """
        Write one reading passage and %d comprehension questions about it.

        %s
        Base the passage on these notes:
        \"\"\"
        %s
        \"\"\"

        Return {"passage_title": "...", "passage": "...", "questions": [...]}.
        Each question has:
        - "question_type": one of %s
        - "question"
        - "options": exactly 4 choices for "mcq", omitted otherwise
        - "correct_index": index of the correct option for "mcq" and "true_false"
        - "correct_answer": the answer text ("True"/"False" for "true_false")
        - "passage_reference": the sentence of the passage that holds the answer
        %s""";

    private static final String GRAMMAR_FILL_BLANK = """
        Create %d grammar fill-in-the-blank items.

        %s
        Each item has:
        - "sentence": a sentence with exactly one blank written as _______
        - "correct_answer": the word or phrase that fills the blank
        - "distractors": 3 wrong forms of the same word or structure
        - "grammar_focus": the grammar point being practised
        %s
        Focus on the grammar points listed above.
        Return {"items": [...]}.""";

    private static final String WRITING_FILL_BLANK = """
        Create %d fill-in-the-blank items that test expressive word choice, not grammar forms.

        %s
        Each item has:
        - "sentence": a sentence with one blank written as _______
        - "correct_answer": the best word for the blank
        - "acceptable_answers": other words that also fit well
        - "hint": a short clue about the meaning needed
        - "context": one sentence of situation the blank sits in

        Return {"items": [...]}.""";

    private ActivityPrompts() {
    }

    public static String listeningQuiz(MetadataContext context, int count, String level, boolean explanations) {
        return LISTENING_QUIZ.formatted(count, contextBlock(context, level), explanationLine(explanations));
    }

    public static String listeningFillBlank(MetadataContext context, int count, String level) {
        return LISTENING_FILL_BLANK.formatted(count, contextBlock(context, level));
    }

    public static String listeningSentenceBuilder(MetadataContext context, int count, String level) {
        return LISTENING_SENTENCE_BUILDER.formatted(count, contextBlock(context, level));
    }

    public static String listeningWordBuilder(MetadataContext context, int count, String level) {
        return LISTENING_WORD_BUILDER.formatted(count, contextBlock(context, level));
    }

    public static String vocabularyMultipleChoice(MetadataContext context, int count, String level, boolean explanations) {
        return VOCABULARY_MCQ.formatted(count, contextBlock(context, level), explanationLine(explanations));
    }

    public static String readingMultipleChoice(MetadataContext context, int count, String level, boolean explanations) {
        return READING_MCQ.formatted(count, contextBlock(context, level), sourceText(context),
            explanationLine(explanations));
    }

    public static String readingComprehension(MetadataContext context, int count, String level,
                                              List<String> questionTypes, boolean explanations) {
        String types = questionTypes.stream().map(type -> "\"" + type + "\"").collect(Collectors.joining(", "));
        return READING_COMPREHENSION.formatted(count, contextBlock(context, level), sourceText(context), types,
            explanationLine(explanations));
    }

    public static String grammarFillBlank(MetadataContext context, int count, String level, boolean explanations) {
        return GRAMMAR_FILL_BLANK.formatted(count, contextBlock(context, level), explanationLine(explanations));
    }

    public static String writingFillBlank(MetadataContext context, int count, String level) {
        return WRITING_FILL_BLANK.formatted(count, contextBlock(context, level));
    }

    static String contextBlock(MetadataContext context, String level) {
        return CONTEXT_BLOCK.formatted(
            orNone(context.getPrimaryModuleTitle()),
            join(context.getTopics(), MAX_LISTED_TOPICS),
            join(context.vocabularyWords(), MAX_LISTED_WORDS),
            join(context.getGrammarPoints(), MAX_LISTED_TOPICS),
            level,
            context.getLanguage());
    }

    private static String sourceText(MetadataContext context) {
        if (!context.getTextSample().isBlank()) {
            return context.getTextSample();
        }
        return String.join("\n", context.getSummaries());
    }

    private static String explanationLine(boolean explanations) {
        return explanations ? "- \"explanation\": one sentence on why the answer is correct\n" : "";
    }

    private static String join(List<String> values, int limit) {
        if (values == null || values.isEmpty()) {
            return "(none)";
        }
        return values.stream().limit(limit).collect(Collectors.joining(", "));
    }

    private static String orNone(String value) {
        return value == null || value.isBlank() ? "(none)" : value;
    }
}
