package com.edugen.ai.tts;

import com.edugen.ai.provider.ProviderErrorKind;
import com.edugen.ai.provider.ProviderException;
import com.edugen.ai.tts.model.AudioOptions;
import com.edugen.ai.tts.model.Voice;

import java.util.List;
import java.util.Map;

/**
 * Neural voices shared by both speech vendors.
 */
public final class VoiceCatalog {
    
    private static final Map<String, String> LOCALES = Map.of(
        "en", "en-US",
        "tr", "tr-TR"
    );
    
    private static final Map<String, List<Voice>> VOICES = Map.of(
        "en-US", List.of(
            new Voice("en-US-JennyNeural", "Jenny", "en-US", "female"),
            new Voice("en-US-GuyNeural", "Guy", "en-US", "male"),
            new Voice("en-US-AriaNeural", "Aria", "en-US", "female")
        ),
        "tr-TR", List.of(
            new Voice("tr-TR-EmelNeural", "Emel", "tr-TR", "female"),
            new Voice("tr-TR-AhmetNeural", "Ahmet", "tr-TR", "male")
        )
    );
    
    private VoiceCatalog() {}
    
    public static boolean supports(String language) {
        return toLocale(language) != null;
    }
    
    public static List<Voice> voicesFor(String language) {
        String locale = toLocale(language);
        return locale != null ? VOICES.get(locale) : List.of();
    }
    
    /**
     * Picks the requested voice, or the first voice of the language.
     *
     * @throws ProviderException of kind RESPONSE for an unsupported language or unknown voice
     */
    public static Voice resolve(AudioOptions options) {
        String locale = toLocale(options.getLanguage());
        if (locale == null) {
            throw new ProviderException("Unsupported speech language: " + options.getLanguage(), 
                ProviderErrorKind.RESPONSE, "TTS");
        }
        List<Voice> voices = VOICES.get(locale);
        if (options.getVoice() == null || options.getVoice().isBlank()) {
            return voices.get(0);
        }
        for (Voice voice : voices) {
            if (voice.id().equalsIgnoreCase(options.getVoice()) || voice.name().equalsIgnoreCase(options.getVoice())) {
                return voice;
            }
        }
        throw new ProviderException("Voice " + options.getVoice() + " is not available for " + locale, 
            ProviderErrorKind.RESPONSE, "TTS");
    }
    
    static String toLocale(String language) {
        if (language == null || language.isBlank()) {
            return null;
        }
        String trimmed = language.trim();
        for (String locale : VOICES.keySet()) {
            if (locale.equalsIgnoreCase(trimmed)) {
                return locale;
            }
        }
        return LOCALES.get(trimmed.toLowerCase());
    }
}
