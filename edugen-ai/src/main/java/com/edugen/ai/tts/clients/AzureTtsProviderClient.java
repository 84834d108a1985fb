package com.edugen.ai.tts.clients;

import com.edugen.ai.config.TtsProperties;
import com.edugen.ai.provider.ProviderErrorKind;
import com.edugen.ai.provider.ProviderException;
import com.edugen.ai.tts.Ssml;
import com.edugen.ai.tts.TtsProvider;
import com.edugen.ai.tts.TtsProviderClient;
import com.edugen.ai.tts.model.AudioOptions;
import com.edugen.ai.tts.model.AudioResult;
import com.edugen.ai.tts.model.Voice;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpHeaders;
import org.springframework.stereotype.Component;
import org.springframework.web.reactive.function.client.WebClient;
import org.springframework.web.reactive.function.client.WebClientRequestException;
import org.springframework.web.reactive.function.client.WebClientResponseException;
import reactor.core.Exceptions;

import java.time.Duration;
import java.util.concurrent.TimeoutException;

/**
 * Azure Cognitive Services speech over REST.
 */
@Component
@Slf4j
public class AzureTtsProviderClient implements TtsProviderClient {
    
    private static final String SSML_CONTENT_TYPE = "application/ssml+xml";
    
    private final WebClient webClient;
    private final TtsProperties properties;
    
    public AzureTtsProviderClient(WebClient.Builder webClientBuilder, TtsProperties properties) {
        this.properties = properties;
        this.webClient = webClientBuilder.clone()
            .baseUrl(properties.getAzure().resolveEndpoint())
            .build();
    }
    
    @Override
    public AudioResult synthesize(String text, Voice voice, AudioOptions options) {
        if (!isAvailable()) {
            throw new ProviderException("Azure subscription key is not configured", 
                ProviderErrorKind.AUTHENTICATION, getName());
        }
        
        long startTime = System.currentTimeMillis();
        log.info("[AZURE_TTS] Synthesizing | voice={} | textLength={}", voice.id(), text.length());
        
        byte[] audio;
        try {
            audio = webClient.post()
                .uri("/cognitiveservices/v1")
                .header("Ocp-Apim-Subscription-Key", properties.getAzure().getSubscriptionKey())
                .header(HttpHeaders.CONTENT_TYPE, SSML_CONTENT_TYPE)
                .header("X-Microsoft-OutputFormat", options.getFormat().getOutputFormat())
                .header(HttpHeaders.USER_AGENT, "edugen-tts")
                .bodyValue(Ssml.build(text, voice, options))
                .retrieve()
                .bodyToMono(byte[].class)
                .timeout(Duration.ofSeconds(properties.getTimeoutSeconds()))
                .block();
        } catch (Exception e) {
            ProviderException error = mapError(e);
            log.error("[AZURE_TTS] Synthesis failed | voice={} | kind={} | statusCode={} | durationMs={} | error={}", 
                voice.id(), error.getKind(), error.getStatusCode(), System.currentTimeMillis() - startTime, error.getMessage());
            throw error;
        }
        
        if (audio == null || audio.length == 0) {
            throw new ProviderException("Azure returned no audio", ProviderErrorKind.RESPONSE, getName());
        }
        
        long duration = System.currentTimeMillis() - startTime;
        log.info("[AZURE_TTS] Synthesis completed | voice={} | bytes={} | durationMs={}", voice.id(), audio.length, duration);
        
        return AudioResult.builder()
            .audio(audio)
            .format(options.getFormat())
            .provider(TtsProvider.AZURE)
            .voice(voice.id())
            .language(voice.locale())
            .characters(text.length())
            .latencyMs(duration)
            .build();
    }
    
    private ProviderException mapError(Throwable error) {
        Throwable e = Exceptions.unwrap(error);
        if (e instanceof WebClientResponseException) {
            WebClientResponseException http = (WebClientResponseException) e;
            int status = http.getStatusCode().value();
            Integer retryAfter = null;
            String header = http.getHeaders().getFirst("Retry-After");
            if (status == 429 && header != null && header.trim().matches("\\d+")) {
                retryAfter = Integer.parseInt(header.trim());
            }
            return new ProviderException("Azure TTS error: " + status + " " + http.getStatusText(), 
                ProviderErrorKind.fromHttpStatus(status), getName(), status, retryAfter, http);
        }
        if (e instanceof TimeoutException) {
            return new ProviderException("Azure TTS timed out", ProviderErrorKind.TIMEOUT, getName(), e);
        }
        if (e instanceof WebClientRequestException) {
            return new ProviderException("Azure TTS connection failed: " + e.getMessage(), 
                ProviderErrorKind.CONNECTION, getName(), e);
        }
        return new ProviderException("Azure TTS failed: " + e.getMessage(), ProviderErrorKind.RESPONSE, getName(), e);
    }
    
    @Override
    public boolean isAvailable() {
        String key = properties.getAzure().getSubscriptionKey();
        return key != null && !key.isBlank();
    }
    
    @Override
    public TtsProvider getProvider() {
        return TtsProvider.AZURE;
    }
}
