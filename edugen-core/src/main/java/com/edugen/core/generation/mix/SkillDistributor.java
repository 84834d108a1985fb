package com.edugen.core.generation.mix;

import com.edugen.core.generation.model.Skill;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Splits a total item count across skills in proportion to their weights.
 */
public final class SkillDistributor {
    
    private SkillDistributor() {
    }
    
    /**
     * Every skill gets at least one item and the counts add up to {@code total}
     * (as long as {@code total} is at least the number of skills).
     */
    public static Map<Skill, Integer> distribute(Map<Skill, Double> weights, int total) {
        double weightSum = weights.values().stream().mapToDouble(Double::doubleValue).sum();
        Map<Skill, Integer> counts = new LinkedHashMap<>();
        weights.forEach((skill, weight) ->
            counts.put(skill, (int) Math.max(1, Math.round(weight / weightSum * total))));
        
        int current = counts.values().stream().mapToInt(Integer::intValue).sum();
        while (current > total && current > counts.size()) {
            List<Skill> largestFirst = new ArrayList<>(counts.keySet());
            largestFirst.sort(Comparator.comparing((Skill skill) -> counts.get(skill)).reversed());
            for (Skill skill : largestFirst) {
                if (current <= total) {
                    break;
                }
                if (counts.get(skill) > 1) {
                    counts.put(skill, counts.get(skill) - 1);
                    current--;
                }
            }
        }
        List<Skill> heaviestFirst = new ArrayList<>(weights.keySet());
        heaviestFirst.sort(Comparator.comparing((Skill skill) -> weights.get(skill)).reversed());
        while (current < total && !heaviestFirst.isEmpty()) {
            for (Skill skill : heaviestFirst) {
                if (current >= total) {
                    break;
                }
                counts.put(skill, counts.get(skill) + 1);
                current++;
            }
        }
        return counts;
    }
}
