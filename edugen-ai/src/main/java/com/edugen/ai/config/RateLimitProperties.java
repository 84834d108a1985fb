package com.edugen.ai.config;

import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

@Configuration
@ConfigurationProperties(prefix = "ai.rate-limit")
@Getter
@Setter
public class RateLimitProperties {
    private int maxItemsPerRequest = 50;
    private int dailyLimitPerTeacher = 100;
}
