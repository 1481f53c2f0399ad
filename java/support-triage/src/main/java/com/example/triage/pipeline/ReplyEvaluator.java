package com.example.triage.pipeline;

import java.util.List;
import java.util.Locale;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import com.example.triage.llm.LlmResponse;
import com.example.triage.llm.LlmService;
import com.example.triage.llm.ModelTier;
import com.example.triage.model.Category;
import com.example.triage.model.ClassificationResult;
import com.example.triage.model.Decision;
import com.example.triage.model.EscalationPriority;
import com.example.triage.model.RoutingDecision;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;

import io.opentelemetry.api.GlobalOpenTelemetry;
import io.opentelemetry.api.trace.Span;
import io.opentelemetry.api.trace.Tracer;
import io.opentelemetry.context.Scope;

/**
 * Second check on a reply the policy wants to send, after {@link ResponseGuard}: a fast-tier
 * model grades safety, tone, accuracy and completeness. The verdict can only hold or lower
 * the decision. An unreachable or unreadable evaluator lowers a send to a draft.
 */
@Component
public class ReplyEvaluator {

    private static final Logger log = LoggerFactory.getLogger(ReplyEvaluator.class);
    private static final ObjectMapper mapper = new ObjectMapper();
    private static final int MAX_LABEL = 255;

    private static final String SYSTEM_PROMPT = """
        You are the last quality check before an automated reply reaches a customer of a subscription box service.

        Grade the reply on:
        1. safety: never confirms a cancellation, pause or refund; exposes no personal data
        2. tone: warm and professional, not robotic or dismissive
        3. accuracy: facts come from the lookup results; nothing is invented
        4. completeness: answers the customer's actual question with a next step

        Respond ONLY with a JSON object (no markdown, no explanation):
        {"decision": "send|draft|escalate", "confidence": "high|medium|low", "reason": "short reason"}

        send: every check passes. draft: any check is doubtful. escalate: a safety violation,
        or the customer needs a person.
        """;

    /** What the evaluator concluded; {@code label()} is what the trace keeps. */
    public record Verdict(Decision decision, String confidence, String reason, double costUsd) {

        static Verdict unavailable(String reason) {
            return new Verdict(Decision.DRAFT, "low", reason, 0.0);
        }

        public String label() {
            String label = decision.label() + ":" + confidence;
            if (reason != null && !reason.isBlank()) {
                label += ":" + reason;
            }
            return label.length() > MAX_LABEL ? label.substring(0, MAX_LABEL) : label;
        }

        /** Applies this verdict to the policy's routing, never raising it. */
        public RoutingDecision applyTo(RoutingDecision routing) {
            return switch (decision) {
                case SEND -> routing;
                case DRAFT -> routing.downgradeToDraft("evaluator_draft");
                case ESCALATE -> routing.decision() == Decision.ESCALATE
                    ? routing : RoutingDecision.escalate("evaluator_escalation", EscalationPriority.MEDIUM);
            };
        }
    }

    private final LlmService llmService;
    private final Tracer tracer;

    public ReplyEvaluator(LlmService llmService) {
        this.llmService = llmService;
        this.tracer = GlobalOpenTelemetry.getTracer("support-triage");
    }

    public Verdict evaluate(String customerMessage, String reply, ClassificationResult classification,
                            List<String> tools) {
        Category category = classification != null ? classification.category() : null;
        String sentiment = classification != null ? classification.sentiment() : "neutral";
        Span span = tracer.spanBuilder("evaluate_reply")
            .setAttribute("triage.stage", "evaluate")
            .setAttribute("triage.sentiment", sentiment)
            .startSpan();

        try (Scope ignored = span.makeCurrent()) {
            LlmResponse response;
            try {
                response = llmService.complete(ModelTier.FAST, SYSTEM_PROMPT,
                    prompt(customerMessage, reply, category, sentiment, tools), "evaluate");
            } catch (RuntimeException e) {
                log.warn("Reply evaluator unavailable, holding reply for review: {}", e.getMessage());
                return Verdict.unavailable("evaluator_unavailable");
            }
            Verdict verdict = strictForFrustrated(parse(response), sentiment);
            span.setAttribute("triage.eval_decision", verdict.decision().label());
            span.setAttribute("triage.eval_confidence", verdict.confidence());
            log.debug("Reply evaluated: decision={} confidence={} reason={}",
                verdict.decision(), verdict.confidence(), verdict.reason());
            return verdict;

        } finally {
            span.end();
        }
    }

    static String prompt(String customerMessage, String reply, Category category, String sentiment,
                         List<String> tools) {
        return "CATEGORY: " + (category != null ? category.label() : "unknown") + "\n"
            + "CUSTOMER SENTIMENT: " + sentiment + "\n"
            + "LOOKUPS USED: " + (tools.isEmpty() ? "none" : String.join(", ", tools)) + "\n\n"
            + "CUSTOMER MESSAGE:\n" + customerMessage + "\n\n"
            + "REPLY TO EVALUATE:\n" + reply;
    }

    Verdict parse(LlmResponse response) {
        try {
            String content = response.content().strip();
            if (content.startsWith("```")) {
                content = content.replaceAll("```(?:json)?\\s*", "").replaceAll("```\\s*$", "").strip();
            }
            JsonNode root = mapper.readTree(content);
            Decision decision = Decision.valueOf(root.path("decision").asText("").trim().toUpperCase(Locale.ROOT));
            String confidence = root.path("confidence").asText("low").toLowerCase(Locale.ROOT);
            return new Verdict(decision, confidence, root.path("reason").asText(""), response.costUsd());
        } catch (Exception e) {
            log.warn("Unreadable evaluator verdict, holding reply for review: {}", e.getMessage());
            return new Verdict(Decision.DRAFT, "low", "evaluator_unreadable", response.costUsd());
        }
    }

    /** A frustrated customer gets an automatic reply only on a high-confidence pass. */
    private static Verdict strictForFrustrated(Verdict verdict, String sentiment) {
        if ("frustrated".equals(sentiment) && verdict.decision() == Decision.SEND
            && !"high".equals(verdict.confidence())) {
            return new Verdict(Decision.DRAFT, verdict.confidence(), "frustrated_customer", verdict.costUsd());
        }
        return verdict;
    }
}
