package com.medimind.intake.config;

import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotNull;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

import java.time.Duration;

@Validated
@ConfigurationProperties(prefix = "app.fallback")
public record FallbackProperties(
    @NotNull Boolean enabled,
    @NotNull @Min(100) @Max(100_000) Integer headChars,
    @NotNull @Min(0) @Max(100_000) Integer tailChars,
    @NotNull Duration timeout,
    @NotNull @Min(1) @Max(1_000) Integer requestsPerMinute
) {

    public FallbackProperties {
        enabled = enabled != null ? enabled : Boolean.FALSE;
        headChars = headChars != null ? headChars : 3000;
        tailChars = tailChars != null ? tailChars : 1000;
        timeout = timeout != null ? timeout : Duration.ofSeconds(30);
        requestsPerMinute = requestsPerMinute != null ? requestsPerMinute : 12;
    }
}
