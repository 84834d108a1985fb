package com.edugen.core.content;

import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

@Configuration
@ConfigurationProperties(prefix = "content-store")
@Getter
@Setter
public class ContentStoreProperties {
    private String baseUrl = "http://localhost:8081/api/v1";
    private String apiToken;
    private int timeoutSeconds = 10;
    // Lifetime of an assembled book/module context
    private int contextTtlSeconds = 300;
    private int subFetchTimeoutSeconds = 10;
}
