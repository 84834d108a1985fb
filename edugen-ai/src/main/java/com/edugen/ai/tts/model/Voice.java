package com.edugen.ai.tts.model;

/**
 * A neural voice, e.g. {@code en-US-JennyNeural}.
 */
public record Voice(String id, String name, String locale, String gender) {
}
