package com.edugen.ai.tts;

import com.edugen.ai.config.TtsProperties;
import com.edugen.ai.tts.model.AudioFormat;
import com.edugen.ai.tts.model.AudioResult;
import com.edugen.common.cache.ResponseCache;
import com.edugen.common.util.TextHashing;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Duration;
import java.util.Optional;

/**
 * Synthesized audio keyed by normalized text, language, voice and format.
 */
@Component
@Slf4j
public class AudioCache {
    
    private final ResponseCache<AudioResult> cache;
    
    @Autowired
    public AudioCache(TtsProperties properties) {
        this(properties, Clock.systemUTC());
    }
    
    public AudioCache(TtsProperties properties, Clock clock) {
        this.cache = new ResponseCache<>("audio", Duration.ofHours(properties.getCacheTtlHours()),
            properties.getCacheMaxEntries(), clock);
    }
    
    public static String key(String text, String language, String voice, AudioFormat format) {
        return TextHashing.sha256Hex(TextHashing.normalize(text)) + ":" + language + ":" + voice + ":" + format.getExtension();
    }
    
    public Optional<AudioResult> get(String key) {
        Optional<AudioResult> hit = cache.get(key);
        if (hit.isPresent()) {
            log.debug("[AUDIO_CACHE] Hit | key={}", abbreviate(key));
        }
        return hit.map(result -> result.withCached(true));
    }
    
    public void put(String key, AudioResult result) {
        cache.put(key, result.withCached(false));
        log.debug("[AUDIO_CACHE] Stored | key={} | bytes={}", abbreviate(key), result.getSizeBytes());
    }
    
    public ResponseCache.Stats stats() {
        return cache.stats();
    }
    
    private static String abbreviate(String key) {
        int separator = key.indexOf(':');
        return separator > 12 ? key.substring(0, 12) + "..." + key.substring(separator) : key;
    }
}
