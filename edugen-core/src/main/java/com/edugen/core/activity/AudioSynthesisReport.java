package com.edugen.core.activity;

/**
 * Outcome of voicing the pending items of one activity.
 */
public record AudioSynthesisReport(String activityId, int pending, int ready, int failed, long durationMs) {
}
