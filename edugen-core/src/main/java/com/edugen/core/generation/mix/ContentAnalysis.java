package com.edugen.core.generation.mix;

import com.edugen.core.generation.model.Skill;

import java.util.EnumMap;
import java.util.HashSet;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Skill weights derived from the module text. Richer vocabulary, longer text,
 * dialogue and opinion language each pull more items towards their skill.
 */
public final class ContentAnalysis {
    
    private static final Pattern DIALOGUE = Pattern.compile(
        "[\"'](.*?)[\"']|said|asked|told|replied", Pattern.CASE_INSENSITIVE);
    private static final Pattern EXPRESSIVE = Pattern.compile(
        "\\b(opinion|describe|explain|imagine|think|feel|believe|prefer)\\b", Pattern.CASE_INSENSITIVE);
    
    private ContentAnalysis() {
    }
    
    /** Weights in allocation order: vocabulary, grammar, reading, listening, writing. */
    public static Map<Skill, Double> weigh(String text) {
        String body = text == null ? "" : text.trim();
        String[] words = body.isEmpty() ? new String[0] : body.split("\\s+");
        Set<String> unique = new HashSet<>();
        for (String word : words) {
            unique.add(word.toLowerCase(Locale.ROOT));
        }
        
        Map<Skill, Double> weights = new EnumMap<>(Skill.class);
        weights.put(Skill.VOCABULARY, 1.0);
        weights.put(Skill.GRAMMAR, 1.0);
        weights.put(Skill.READING, 1.0);
        weights.put(Skill.LISTENING, 1.0);
        weights.put(Skill.WRITING, 1.0);
        
        if (words.length > 0) {
            double density = (double) unique.size() / words.length;
            if (density > 0.6) {
                weights.put(Skill.VOCABULARY, 1.5);
            } else if (density < 0.3) {
                weights.put(Skill.VOCABULARY, 0.7);
            }
        }
        
        if (words.length > 200) {
            weights.put(Skill.READING, 1.5);
        } else if (words.length < 50) {
            weights.put(Skill.READING, 0.5);
        }
        
        if (count(DIALOGUE, body) > 3) {
            weights.put(Skill.LISTENING, 1.5);
        }
        if (count(EXPRESSIVE, body) > 2) {
            weights.put(Skill.WRITING, 1.3);
        }
        return weights;
    }
    
    private static int count(Pattern pattern, String text) {
        Matcher matcher = pattern.matcher(text);
        int count = 0;
        while (matcher.find()) {
            count++;
        }
        return count;
    }
}
