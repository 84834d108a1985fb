package com.edugen.core.generation;

import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

@Configuration
@ConfigurationProperties(prefix = "ai.generation")
@Getter
@Setter
public class GenerationProperties {
    private double temperature = 0.7;
    private int maxTokens = 8192;
    // How long generated activities stay available for review and audio synthesis
    private int activityTtlHours = 24;
    private int mixTimeoutSeconds = 300;
}
