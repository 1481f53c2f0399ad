package com.example.triage.llm;

import java.util.Map;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.ai.chat.model.ChatModel;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.core.io.ResourceLoader;

import com.example.triage.config.LlmProperties;

@Configuration
public class LlmConfig {

    private static final Logger log = LoggerFactory.getLogger(LlmConfig.class);

    public static final Map<String, String> PROVIDER_SERVERS = Map.of(
        "openai", "api.openai.com",
        "anthropic", "api.anthropic.com",
        "ollama", "localhost"
    );

    public static final Map<String, Integer> PROVIDER_PORTS = Map.of(
        "openai", 443,
        "anthropic", 443,
        "ollama", 11434
    );

    /** The chat models the service alternates between; not a ChatModel itself so the model map stays acyclic. */
    public record ModelProviders(ChatModel primary, ChatModel fallback) {}

    @Bean
    ModelProviders modelProviders(LlmProperties properties, Map<String, ChatModel> chatModels) {
        var primary = properties.primary();
        var fallback = properties.fallback();
        log.info("LLM routes: primary={} (capable={}, fast={}), fallback={} (capable={}, fast={})",
            primary.provider(), primary.capableModel(), primary.fastModel(),
            fallback.provider(), fallback.capableModel(), fallback.fastModel());
        return new ModelProviders(resolveChatModel(primary.provider(), chatModels),
            resolveChatModel(fallback.provider(), chatModels));
    }

    @Bean
    Pricing pricing(LlmProperties properties, ResourceLoader resourceLoader) {
        return new Pricing(resourceLoader.getResource(properties.pricingFile()));
    }

    static ChatModel resolveChatModel(String provider, Map<String, ChatModel> chatModels) {
        // Spring AI registers its models as "openAiChatModel", "anthropicChatModel", ...
        return switch (provider) {
            case "openai" -> findBean(chatModels, "openAiChatModel");
            case "anthropic" -> findBean(chatModels, "anthropicChatModel");
            case "ollama" -> findBean(chatModels, "ollamaChatModel");
            default -> throw new IllegalArgumentException("Unknown LLM provider: " + provider);
        };
    }

    private static ChatModel findBean(Map<String, ChatModel> chatModels, String name) {
        var model = chatModels.get(name);
        if (model == null) {
            throw new IllegalStateException(
                "ChatModel bean '" + name + "' not found. Available: " + chatModels.keySet());
        }
        return model;
    }
}
