package com.example.triage.config;

import java.time.Duration;

import org.springframework.boot.context.properties.ConfigurationProperties;

import com.example.triage.llm.ModelTier;

/**
 * Language-model routing. Every call goes to {@code primary} first and to {@code fallback}
 * once the primary has used up {@code maxAttempts}; each route names its own model per tier.
 */
@ConfigurationProperties(prefix = "app.llm")
public record LlmProperties(
    Route primary,
    Route fallback,
    int maxTokens,
    double temperature,
    int maxAttempts,
    Duration minBackoff,
    Duration maxBackoff,
    String pricingFile
) {

    public LlmProperties {
        if (primary == null) primary = new Route("openai", "gpt-4o", "gpt-4o-mini");
        if (fallback == null) fallback = new Route("anthropic", "claude-sonnet-4-20250514", "claude-3-5-haiku-latest");
        if (maxTokens <= 0) maxTokens = 1024;
        if (maxAttempts <= 0) maxAttempts = 3;
        if (minBackoff == null) minBackoff = Duration.ofSeconds(1);
        if (maxBackoff == null) maxBackoff = Duration.ofSeconds(10);
        if (pricingFile == null || pricingFile.isBlank()) pricingFile = "classpath:pricing.json";
    }

    public record Route(String provider, String capableModel, String fastModel) {

        public String model(ModelTier tier) {
            return tier == ModelTier.CAPABLE ? capableModel : fastModel;
        }
    }
}
