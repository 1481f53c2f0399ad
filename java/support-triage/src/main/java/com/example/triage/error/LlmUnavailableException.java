package com.example.triage.error;

/** Every configured language-model provider failed after retries. */
public class LlmUnavailableException extends TriageException {

    public LlmUnavailableException(String stage, Throwable cause) {
        super("All LLM providers failed after retries (stage=" + stage + ")", cause);
    }
}
