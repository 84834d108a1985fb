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
import com.edugen.common.util.TextHashing;
import lombok.extern.slf4j.Slf4j;
import org.springframework.core.io.buffer.DataBuffer;
import org.springframework.http.HttpHeaders;
import org.springframework.stereotype.Component;
import org.springframework.web.reactive.socket.WebSocketMessage;
import org.springframework.web.reactive.socket.client.WebSocketClient;
import reactor.core.Exceptions;
import reactor.core.publisher.Flux;

import java.io.ByteArrayOutputStream;
import java.net.URI;
import java.nio.charset.StandardCharsets;
import java.time.Clock;
import java.time.Duration;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;
import java.util.Locale;
import java.util.UUID;
import java.util.concurrent.TimeoutException;

/**
 * Free read-aloud speech service used by the Edge browser, spoken to over WebSocket.
 *
 * One connection per synthesis: a {@code speech.config} frame, then the SSML frame;
 * audio arrives as binary frames tagged {@code Path:audio} until {@code Path:turn.end}.
 */
@Component
@Slf4j
public class EdgeTtsProviderClient implements TtsProviderClient {
    
    private static final String GEC_VERSION = "1-130.0.2849.68";
    private static final String ORIGIN = "chrome-extension://jdiccldimpdaibmpdkjnbmckianbfold";
    private static final String USER_AGENT = "Mozilla/5.0 (Windows NT 10.0; Win64; x64) AppleWebKit/537.36 "
        + "(KHTML, like Gecko) Chrome/130.0.0.0 Safari/537.36 Edg/130.0.0.0";
    // Seconds between 1601-01-01 and the Unix epoch
    private static final long WINDOWS_EPOCH_OFFSET = 11_644_473_600L;
    private static final DateTimeFormatter TIMESTAMP = DateTimeFormatter
        .ofPattern("EEE MMM dd yyyy HH:mm:ss 'GMT+0000 (Coordinated Universal Time)'", Locale.US)
        .withZone(ZoneOffset.UTC);
    private static final String AUDIO_PATH = "Path:audio\r\n";
    
    private final WebSocketClient webSocketClient;
    private final TtsProperties properties;
    private final Clock clock;
    
    public EdgeTtsProviderClient(WebSocketClient webSocketClient, TtsProperties properties) {
        this(webSocketClient, properties, Clock.systemUTC());
    }
    
    EdgeTtsProviderClient(WebSocketClient webSocketClient, TtsProperties properties, Clock clock) {
        this.webSocketClient = webSocketClient;
        this.properties = properties;
        this.clock = clock;
    }
    
    @Override
    public AudioResult synthesize(String text, Voice voice, AudioOptions options) {
        long startTime = System.currentTimeMillis();
        String connectionId = UUID.randomUUID().toString().replace("-", "");
        log.info("[EDGE_TTS] Synthesizing | voice={} | textLength={} | connectionId={}", voice.id(), text.length(), connectionId);
        
        String timestamp = TIMESTAMP.format(clock.instant());
        String configMessage = "X-Timestamp:" + timestamp + "\r\n"
            + "Content-Type:application/json; charset=utf-8\r\n"
            + "Path:speech.config\r\n\r\n"
            + "{\"context\":{\"synthesis\":{\"audio\":{\"metadataoptions\":{"
            + "\"sentenceBoundaryEnabled\":\"false\",\"wordBoundaryEnabled\":\"false\"},"
            + "\"outputFormat\":\"" + options.getFormat().getOutputFormat() + "\"}}}}\r\n";
        String ssmlMessage = "X-RequestId:" + connectionId + "\r\n"
            + "Content-Type:application/ssml+xml\r\n"
            + "X-Timestamp:" + timestamp + "Z\r\n"
            + "Path:ssml\r\n\r\n"
            + Ssml.build(text, voice, options);
        
        HttpHeaders headers = new HttpHeaders();
        headers.set(HttpHeaders.ORIGIN, ORIGIN);
        headers.set(HttpHeaders.USER_AGENT, USER_AGENT);
        headers.set(HttpHeaders.PRAGMA, "no-cache");
        headers.set(HttpHeaders.CACHE_CONTROL, "no-cache");
        
        ByteArrayOutputStream audio = new ByteArrayOutputStream();
        try {
            webSocketClient.execute(endpoint(connectionId), headers, session ->
                    session.send(Flux.just(session.textMessage(configMessage), session.textMessage(ssmlMessage)))
                        .thenMany(session.receive()
                            .map(message -> {
                                if (message.getType() == WebSocketMessage.Type.BINARY) {
                                    appendAudio(message.getPayload(), audio);
                                    return "";
                                }
                                return message.getPayloadAsText();
                            })
                            .takeUntil(payload -> payload.contains("Path:turn.end")))
                        .then())
                .timeout(Duration.ofSeconds(properties.getTimeoutSeconds()))
                .block();
        } catch (Exception e) {
            ProviderException error = mapError(e);
            log.error("[EDGE_TTS] Synthesis failed | voice={} | kind={} | durationMs={} | error={}", 
                voice.id(), error.getKind(), System.currentTimeMillis() - startTime, error.getMessage());
            throw error;
        }
        
        if (audio.size() == 0) {
            throw new ProviderException("Edge TTS returned no audio", ProviderErrorKind.RESPONSE, getName());
        }
        
        long duration = System.currentTimeMillis() - startTime;
        log.info("[EDGE_TTS] Synthesis completed | voice={} | bytes={} | durationMs={}", voice.id(), audio.size(), duration);
        
        return AudioResult.builder()
            .audio(audio.toByteArray())
            .format(options.getFormat())
            .provider(TtsProvider.EDGE)
            .voice(voice.id())
            .language(voice.locale())
            .characters(text.length())
            .latencyMs(duration)
            .build();
    }
    
    URI endpoint(String connectionId) {
        TtsProperties.Edge edge = properties.getEdge();
        return URI.create(edge.getEndpoint()
            + "?TrustedClientToken=" + edge.getTrustedClientToken()
            + "&Sec-MS-GEC=" + secMsGec(edge.getTrustedClientToken())
            + "&Sec-MS-GEC-Version=" + GEC_VERSION
            + "&ConnectionId=" + connectionId);
    }
    
    /**
     * Rolling access token: SHA-256 of the Windows file-time tick count, rounded down to
     * five minutes, concatenated with the trusted client token.
     */
    String secMsGec(String trustedClientToken) {
        long seconds = clock.instant().getEpochSecond() + WINDOWS_EPOCH_OFFSET;
        seconds -= seconds % 300;
        long ticks = seconds * 10_000_000L;
        return TextHashing.sha256Hex(ticks + trustedClientToken).toUpperCase(Locale.ROOT);
    }
    
    /**
     * Binary frames start with a 2-byte big-endian header length, then the header text,
     * then the audio bytes.
     */
    static void appendAudio(DataBuffer payload, ByteArrayOutputStream audio) {
        byte[] frame = new byte[payload.readableByteCount()];
        payload.read(frame);
        if (frame.length < 2) {
            return;
        }
        int headerLength = ((frame[0] & 0xFF) << 8) | (frame[1] & 0xFF);
        int dataStart = 2 + headerLength;
        if (dataStart > frame.length) {
            return;
        }
        String header = new String(frame, 2, headerLength, StandardCharsets.UTF_8);
        if (header.contains(AUDIO_PATH) || header.endsWith("Path:audio")) {
            audio.write(frame, dataStart, frame.length - dataStart);
        }
    }
    
    private ProviderException mapError(Throwable error) {
        Throwable e = Exceptions.unwrap(error);
        if (e instanceof TimeoutException) {
            return new ProviderException("Edge TTS timed out", ProviderErrorKind.TIMEOUT, getName(), e);
        }
        String message = e.getMessage() != null ? e.getMessage() : e.getClass().getSimpleName();
        if (message.contains("403") || message.contains("401")) {
            return new ProviderException("Edge TTS rejected the connection: " + message, 
                ProviderErrorKind.AUTHENTICATION, getName(), e);
        }
        return new ProviderException("Edge TTS connection failed: " + message, ProviderErrorKind.CONNECTION, getName(), e);
    }
    
    @Override
    public boolean isAvailable() {
        return properties.getEdge().isEnabled();
    }
    
    @Override
    public TtsProvider getProvider() {
        return TtsProvider.EDGE;
    }
}
