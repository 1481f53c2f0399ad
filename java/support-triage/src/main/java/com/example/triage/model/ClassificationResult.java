package com.example.triage.model;

import java.util.List;
import java.util.Map;

import com.fasterxml.jackson.annotation.JsonIgnore;

/** One classifier verdict. {@code sentiment} is positive, neutral, negative or frustrated. */
public record ClassificationResult(
    Category category,
    double confidence,
    String urgency,
    String sentiment,
    boolean humanRequested,
    String action,
    Map<String, String> parameters,
    List<String> entities,
    int inputTokens,
    int outputTokens,
    double costUsd
) {

    public ClassificationResult {
        parameters = parameters != null ? Map.copyOf(parameters) : Map.of();
        entities = entities != null ? List.copyOf(entities) : List.of();
        urgency = urgency != null ? urgency : "medium";
        sentiment = sentiment != null ? sentiment : "neutral";
    }

    public static ClassificationResult uncategorized(double confidence, int inputTokens, int outputTokens, double costUsd) {
        return new ClassificationResult(Category.UNCATEGORIZED, confidence, "medium", "neutral", false, null,
            Map.of(), List.of(), inputTokens, outputTokens, costUsd);
    }

    @JsonIgnore
    public boolean isUncategorized() {
        return category == Category.UNCATEGORIZED;
    }

    /** Low-confidence results collapse to the sentinel; the raw confidence is kept for the trace. */
    public ClassificationResult withThreshold(double threshold) {
        if (isUncategorized() || confidence >= threshold) {
            return this;
        }
        return new ClassificationResult(Category.UNCATEGORIZED, confidence, urgency, sentiment, humanRequested, null,
            parameters, entities, inputTokens, outputTokens, costUsd);
    }
}
