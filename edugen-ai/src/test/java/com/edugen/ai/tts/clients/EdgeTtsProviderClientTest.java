package com.edugen.ai.tts.clients;

import com.edugen.ai.config.TtsProperties;
import com.edugen.ai.support.MutableClock;
import org.junit.jupiter.api.Test;
import org.springframework.core.io.buffer.DefaultDataBufferFactory;
import org.springframework.web.reactive.socket.client.ReactorNettyWebSocketClient;

import java.io.ByteArrayOutputStream;
import java.net.URI;
import java.nio.charset.StandardCharsets;
import java.time.Instant;

import static org.assertj.core.api.Assertions.assertThat;

class EdgeTtsProviderClientTest {
    
    private final MutableClock clock = new MutableClock(Instant.parse("2026-06-01T12:00:00Z"));
    private final EdgeTtsProviderClient client =
        new EdgeTtsProviderClient(new ReactorNettyWebSocketClient(), new TtsProperties(), clock);
    
    private static byte[] frame(String header, byte[] audio) {
        byte[] headerBytes = header.getBytes(StandardCharsets.UTF_8);
        byte[] frame = new byte[2 + headerBytes.length + audio.length];
        frame[0] = (byte) (headerBytes.length >> 8);
        frame[1] = (byte) headerBytes.length;
        System.arraycopy(headerBytes, 0, frame, 2, headerBytes.length);
        System.arraycopy(audio, 0, frame, 2 + headerBytes.length, audio.length);
        return frame;
    }
    
    @Test
    void should_KeepOnlyAudioFrameBodies() {
        ByteArrayOutputStream audio = new ByteArrayOutputStream();
        DefaultDataBufferFactory buffers = DefaultDataBufferFactory.sharedInstance;
        
        EdgeTtsProviderClient.appendAudio(buffers.wrap(frame("X-RequestId:1\r\nContent-Type:audio/mpeg\r\nPath:audio\r\n",
            new byte[] {1, 2, 3})), audio);
        EdgeTtsProviderClient.appendAudio(buffers.wrap(frame("X-RequestId:1\r\nPath:audio.metadata\r\n",
            new byte[] {9, 9})), audio);
        EdgeTtsProviderClient.appendAudio(buffers.wrap(frame("Path:audio\r\n", new byte[] {4})), audio);
        
        assertThat(audio.toByteArray()).containsExactly(1, 2, 3, 4);
    }
    
    @Test
    void should_RoundTokenToFiveMinuteWindows() {
        String first = client.secMsGec("token");
        clock.set(Instant.parse("2026-06-01T12:04:59Z"));
        String sameWindow = client.secMsGec("token");
        clock.set(Instant.parse("2026-06-01T12:05:00Z"));
        String nextWindow = client.secMsGec("token");
        
        assertThat(first).hasSize(64).isUpperCase().isEqualTo(sameWindow);
        assertThat(nextWindow).isNotEqualTo(first);
    }
    
    @Test
    void should_BuildEndpointWithTokens() {
        URI uri = client.endpoint("abc123");
        
        assertThat(uri.toString())
            .startsWith("wss://speech.platform.bing.com/consumer/speech/synthesize/readaloud/edge/v1?TrustedClientToken=")
            .contains("&Sec-MS-GEC=")
            .endsWith("&ConnectionId=abc123");
    }
}
