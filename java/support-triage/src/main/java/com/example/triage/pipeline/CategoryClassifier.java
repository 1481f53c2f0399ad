package com.example.triage.pipeline;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.stream.Collectors;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import com.example.triage.config.TriageProperties;
import com.example.triage.llm.LlmResponse;
import com.example.triage.llm.LlmService;
import com.example.triage.llm.ModelTier;
import com.example.triage.model.Category;
import com.example.triage.model.ClassificationResult;
import com.example.triage.model.Message;
import com.example.triage.model.MessageRole;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;

import io.opentelemetry.api.GlobalOpenTelemetry;
import io.opentelemetry.api.trace.Span;
import io.opentelemetry.api.trace.StatusCode;
import io.opentelemetry.api.trace.Tracer;
import io.opentelemetry.context.Scope;

/**
 * Assigns one category of the closed taxonomy to a session's message history. Reads nothing
 * but its input; low confidence and unreadable replies come back as UNCATEGORIZED.
 */
@Component
public class CategoryClassifier {

    private static final Logger log = LoggerFactory.getLogger(CategoryClassifier.class);
    private static final ObjectMapper mapper = new ObjectMapper();

    private static final String SYSTEM_PROMPT = """
        You are the message classifier of a subscription-box customer support team.
        Classify the conversation into exactly one primary category, judging mostly by the latest customer messages.

        Respond ONLY with a JSON object (no markdown, no explanation):
        {
          "category": "%s",
          "confidence": 0.0-1.0,
          "urgency": "low|medium|high|critical",
          "sentiment": "positive|neutral|negative|frustrated",
          "human_requested": true|false,
          "action": "tool name or null",
          "parameters": {"name": "value"},
          "entities": ["secondary intent or extracted entity"]
        }

        Category definitions:
        - tracking: where is my package, delivery delays, lost shipments
        - billing: charges, payments, receipts, refunds questions
        - retention: the customer wants to cancel, including repeated cancellation requests
        - damage_claim: an item arrived damaged, broken or leaking
        - subscription_change: pause, skip a month, change frequency, change recipient or address
        - gratitude: thanks and compliments, nothing to resolve
        - general: box customization and anything else

        Set action only for subscription_change (pause_subscription, skip_month, change_frequency, change_address),
        retention (cancel_subscription) and damage_claim (create_damage_claim). Put its arguments in parameters,
        e.g. duration_months, new_frequency, new_address, item_description, damage_type.
        Set human_requested=true when the customer asks for a manager, supervisor, live person or human agent.
        Sentiment is frustrated for anger, repeated unresolved issues, shouting or strings of exclamation marks.
        Set urgency critical for threats, bank disputes and legal threats; high for damaged items and repeated cancellations.
        """.formatted(Category.assignable().stream().map(Category::label).collect(Collectors.joining("|")));

    private static final Set<String> SENTIMENTS = Set.of("positive", "neutral", "negative", "frustrated");

    private final LlmService llmService;
    private final double threshold;
    private final Tracer tracer;

    public CategoryClassifier(LlmService llmService, TriageProperties properties) {
        this.llmService = llmService;
        this.threshold = properties.classifierConfidenceThreshold();
        this.tracer = GlobalOpenTelemetry.getTracer("support-triage");
    }

    /** Throws when the model cannot be reached; the caller turns that into a draft. */
    public ClassificationResult classify(List<Message> history) {
        Span span = tracer.spanBuilder("classify_category")
            .setAttribute("triage.stage", "classify")
            .setAttribute("triage.history_size", (long) history.size())
            .startSpan();

        try (Scope ignored = span.makeCurrent()) {
            LlmResponse response = llmService.complete(ModelTier.FAST, SYSTEM_PROMPT, transcript(history), "classify");
            ClassificationResult result = parseResponse(response).withThreshold(threshold);

            span.setAttribute("triage.category", result.category().label());
            span.setAttribute("triage.confidence", result.confidence());
            span.setAttribute("triage.human_requested", result.humanRequested());
            if (result.action() != null) {
                span.setAttribute("triage.action", result.action());
            }

            log.debug("Classified: category={} confidence={} action={}",
                result.category(), result.confidence(), result.action());
            return result;

        } catch (RuntimeException e) {
            span.setStatus(StatusCode.ERROR, e.getMessage());
            log.warn("Classification failed: {}", e.getMessage());
            throw e;

        } finally {
            span.end();
        }
    }

    static String transcript(List<Message> history) {
        var sb = new StringBuilder();
        for (Message message : history) {
            if (message.role() == MessageRole.SYSTEM) {
                continue;
            }
            sb.append(message.role() == MessageRole.CUSTOMER ? "customer" : "support")
                .append(": ").append(message.content()).append('\n');
        }
        return sb.toString();
    }

    ClassificationResult parseResponse(LlmResponse response) {
        try {
            String content = response.content().strip();
            if (content.startsWith("```")) {
                content = content.replaceAll("```(?:json)?\\s*", "").replaceAll("```\\s*$", "").strip();
            }

            JsonNode root = mapper.readTree(content);
            Category category = Category.fromLabel(root.path("category").asText(null));
            double confidence = Math.max(0.0, Math.min(1.0, root.path("confidence").asDouble(0.0)));
            if (category == Category.UNCATEGORIZED) {
                log.warn("Classifier named an unknown category: {}", root.path("category").asText());
                return ClassificationResult.uncategorized(confidence,
                    response.inputTokens(), response.outputTokens(), response.costUsd());
            }

            String action = root.hasNonNull("action") ? root.get("action").asText() : null;
            if (action != null && (action.isBlank() || "null".equalsIgnoreCase(action))) {
                action = null;
            }

            Map<String, String> parameters = new LinkedHashMap<>();
            if (root.path("parameters").isObject()) {
                root.get("parameters").fields().forEachRemaining(field -> {
                    if (!field.getValue().isNull()) {
                        parameters.put(field.getKey(), field.getValue().asText());
                    }
                });
            }

            List<String> entities = new ArrayList<>();
            if (root.path("entities").isArray()) {
                for (JsonNode e : root.get("entities")) {
                    entities.add(e.asText());
                }
            }

            return new ClassificationResult(category, confidence,
                root.path("urgency").asText("medium"),
                sentiment(root.path("sentiment").asText(null)),
                root.path("human_requested").asBoolean(false),
                action, parameters, entities,
                response.inputTokens(), response.outputTokens(), response.costUsd());

        } catch (Exception e) {
            log.warn("Failed to parse classifier response: {}", e.getMessage());
            return ClassificationResult.uncategorized(0.0,
                response.inputTokens(), response.outputTokens(), response.costUsd());
        }
    }

    private static String sentiment(String value) {
        if (value == null) {
            return "neutral";
        }
        String normalized = value.trim().toLowerCase(Locale.ROOT);
        return SENTIMENTS.contains(normalized) ? normalized : "neutral";
    }
}
