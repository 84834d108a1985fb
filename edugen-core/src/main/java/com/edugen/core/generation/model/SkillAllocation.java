package com.edugen.core.generation.model;

/**
 * How many mix items a skill contributed and in which format.
 */
public record SkillAllocation(int count, String format) {
}
