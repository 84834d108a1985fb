package com.edugen.ai.config;

import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

@Configuration
@ConfigurationProperties(prefix = "llm")
@Getter
@Setter
public class LlmProperties {
    private boolean enabled = true;
    private String primaryProvider = "deepseek";
    private String fallbackProvider = "gemini";
    private int maxRetries = 3;
    private long retryDelayMs = 1000;
    private long maxRetryAfterSeconds = 30;
    private int timeoutSeconds = 60;
    private double defaultTemperature = 0.7;
    private int defaultMaxTokens = 4096;
    
    private Vendor deepseek = new Vendor("https://api.deepseek.com/v1", "deepseek-chat");
    private Vendor gemini = new Vendor("https://generativelanguage.googleapis.com/v1beta/models", "gemini-2.5-flash");
    
    @Getter
    @Setter
    public static class Vendor {
        private String apiKey;
        private String baseUrl;
        private String model;
        
        public Vendor() {}
        
        public Vendor(String baseUrl, String model) {
            this.baseUrl = baseUrl;
            this.model = model;
        }
        
        public boolean hasApiKey() {
            return apiKey != null && !apiKey.isBlank();
        }
    }
}
