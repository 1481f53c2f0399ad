package com.example.triage.llm;

/**
 * One completed model call. {@code fallback} is set when the primary route gave up and the
 * answer came from the fallback provider; {@code attempts} counts calls on the answering route.
 */
public record LlmResponse(
    String content,
    ModelTier tier,
    String provider,
    String model,
    int inputTokens,
    int outputTokens,
    double costUsd,
    String finishReason,
    boolean fallback,
    int attempts
) {

    public int totalTokens() {
        return inputTokens + outputTokens;
    }
}
