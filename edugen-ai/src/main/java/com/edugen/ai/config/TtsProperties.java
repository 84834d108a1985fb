package com.edugen.ai.config;

import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

@Configuration
@ConfigurationProperties(prefix = "tts")
@Getter
@Setter
public class TtsProperties {
    private boolean enabled = true;
    private String primaryProvider = "edge";
    private String fallbackProvider = "azure";
    private int maxRetries = 2;
    private long retryDelayMs = 500;
    private int timeoutSeconds = 30;
    private int cacheTtlHours = 24;
    private int cacheMaxEntries = 2000;
    private int batchConcurrency = 5;
    
    private Azure azure = new Azure();
    private Edge edge = new Edge();
    
    @Getter
    @Setter
    public static class Azure {
        private String subscriptionKey;
        private String region = "turkeycentral";
        // Overrides the region endpoint, e.g. for a private link
        private String endpoint;
        
        public String resolveEndpoint() {
            if (endpoint != null && !endpoint.isBlank()) {
                return endpoint;
            }
            return "https://" + region + ".tts.speech.microsoft.com";
        }
    }
    
    @Getter
    @Setter
    public static class Edge {
        private boolean enabled = true;
        private String endpoint = "wss://speech.platform.bing.com/consumer/speech/synthesize/readaloud/edge/v1";
        private String trustedClientToken = "6A5AA1D4EAFF4E9FB37E23D68491D6F4";
    }
}
