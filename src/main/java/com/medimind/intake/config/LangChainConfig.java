package com.medimind.intake.config;

import com.medimind.intake.infra.ChatModelCompletionClient;
import com.medimind.intake.infra.CompletionClient;
import com.medimind.intake.infra.RateLimiter;
import dev.langchain4j.model.chat.ChatModel;
import dev.langchain4j.model.googleai.GoogleAiGeminiChatModel;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Duration;
import java.util.concurrent.Executor;

/**
 * Language model used by the demographics fallback. Nothing here is created unless
 * {@code app.fallback.enabled} is true.
 */
@Configuration
@ConditionalOnProperty(prefix = "app.fallback", name = "enabled", havingValue = "true")
public class LangChainConfig {

    @Value("${app.gemini.api-key:}")
    private String apiKey;

    @Value("${app.gemini.model-name:gemini-2.0-flash}")
    private String modelName;

    @Bean
    public ChatModel chatLanguageModel(FallbackProperties fallbackProperties) {
        return GoogleAiGeminiChatModel.builder()
            .apiKey(apiKey)
            .modelName(modelName)
            .temperature(0.0)
            .timeout(fallbackProperties.timeout())
            .maxRetries(2)
            .build();
    }

    @Bean
    public CompletionClient completionClient(
        ChatModel chatModel,
        @Qualifier("completionLimiter") RateLimiter completionLimiter,
        @Qualifier("completionTaskExecutor") Executor completionTaskExecutor,
        FallbackProperties fallbackProperties
    ) {
        Duration timeout = fallbackProperties.timeout();
        return new ChatModelCompletionClient(chatModel, completionLimiter, completionTaskExecutor, timeout);
    }
}
