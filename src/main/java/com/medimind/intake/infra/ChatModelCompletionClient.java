package com.medimind.intake.infra;

import com.medimind.intake.exception.FallbackServiceException;
import dev.langchain4j.model.chat.ChatModel;
import lombok.extern.slf4j.Slf4j;

import java.time.Duration;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Executor;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * {@link CompletionClient} over a langchain4j {@link ChatModel}. Calls are throttled by the
 * limiter and abandoned once the timeout expires.
 */
@Slf4j
public class ChatModelCompletionClient implements CompletionClient {

    public static final String COMPLETION_LIMIT = "completion";

    private final ChatModel chatModel;
    private final RateLimiter limiter;
    private final Executor executor;
    private final Duration timeout;

    public ChatModelCompletionClient(ChatModel chatModel, RateLimiter limiter, Executor executor, Duration timeout) {
        this.chatModel = chatModel;
        this.limiter = limiter;
        this.executor = executor;
        this.timeout = timeout;
    }

    @Override
    public String complete(String prompt) {
        CompletableFuture<String> call;
        try {
            call = CompletableFuture.supplyAsync(
                () -> limiter.execute(COMPLETION_LIMIT, 1, () -> chatModel.chat(prompt)),
                executor
            );
        } catch (RejectedExecutionException e) {
            throw new FallbackServiceException("Completion rejected: executor is saturated", e);
        }
        try {
            String answer = call.get(timeout.toMillis(), TimeUnit.MILLISECONDS);
            log.debug("Completion returned {} chars", answer == null ? 0 : answer.length());
            return answer;
        } catch (TimeoutException e) {
            call.cancel(true);
            throw new FallbackServiceException("Completion timed out after " + timeout, e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new FallbackServiceException("Completion interrupted", e);
        } catch (ExecutionException e) {
            Throwable cause = e.getCause() != null ? e.getCause() : e;
            throw new FallbackServiceException("Completion failed: " + cause.getMessage(), cause);
        }
    }
}
