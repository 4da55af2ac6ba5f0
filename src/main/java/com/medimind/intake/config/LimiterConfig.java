package com.medimind.intake.config;

import com.medimind.intake.infra.InMemoryRpmRateLimiter;
import com.medimind.intake.infra.RateLimiter;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration
public class LimiterConfig {

    @Bean("completionLimiter")
    public RateLimiter completionLimiter(FallbackProperties fallbackProperties) {
        return new InMemoryRpmRateLimiter(fallbackProperties.requestsPerMinute());
    }
}
