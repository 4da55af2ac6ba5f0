package com.medimind.intake.infra;

/**
 * Narrow text-completion capability of a hosted language model.
 */
public interface CompletionClient {

    /**
     * @throws com.medimind.intake.exception.FallbackServiceException when the model fails or does not answer in time
     */
    String complete(String prompt);
}
