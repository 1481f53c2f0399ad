package com.example.triage.pipeline;

import java.util.List;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import com.example.triage.llm.LlmResponse;
import com.example.triage.llm.LlmService;
import com.example.triage.llm.ModelTier;
import com.example.triage.model.Category;
import com.example.triage.model.Decision;
import com.example.triage.model.Message;
import com.example.triage.model.RoutingDecision;
import com.example.triage.model.ToolExecution;
import com.example.triage.model.ToolStatus;

import io.opentelemetry.api.GlobalOpenTelemetry;
import io.opentelemetry.api.trace.Span;
import io.opentelemetry.api.trace.StatusCode;
import io.opentelemetry.api.trace.Tracer;
import io.opentelemetry.context.Scope;

/**
 * Writes the customer reply (send) or the reviewer's draft body (draft). Escalations use a
 * fixed holding text and never reach the model.
 */
@Component
public class ReplyGenerator {

    private static final Logger log = LoggerFactory.getLogger(ReplyGenerator.class);

    static final String HOLDING_REPLY =
        "Thank you for reaching out. A member of our support team is reviewing your message personally "
            + "and will get back to you shortly.";

    static final String FALLBACK_DRAFT =
        "No automated draft could be written for this conversation. Please reply manually.";

    private static final String SYSTEM_PROMPT_TEMPLATE = """
        You are a warm, concise customer support agent for a monthly subscription box service.

        Guidelines:
        - Be concise and helpful (under 150 words), plain text
        - Acknowledge problems with empathy
        - Use only the facts in the lookup results below; never invent tracking numbers, dates or amounts
        - Never state that a subscription was cancelled, paused or refunded; say the request is being handled
        - If you don't know something, say so honestly

        Conversation category: %s
        %s
        Lookup results:
        %s
        """;

    private final LlmService llmService;
    private final Tracer tracer;

    public ReplyGenerator(LlmService llmService) {
        this.llmService = llmService;
        this.tracer = GlobalOpenTelemetry.getTracer("support-triage");
    }

    public LlmResponse generate(Category category, RoutingDecision routing,
                                List<ToolExecution> executions, List<Message> history) {
        Span span = tracer.spanBuilder("generate_reply")
            .setAttribute("triage.stage", "generate")
            .setAttribute("triage.category", category != null ? category.label() : "none")
            .startSpan();

        try (Scope ignored = span.makeCurrent()) {
            String audience = routing.decision() == Decision.SEND
                ? "This reply goes to the customer directly."
                : "A human reviewer will check and edit this reply before it is sent (" + routing.reason() + ").";
            String systemPrompt = SYSTEM_PROMPT_TEMPLATE.formatted(
                category != null ? category.label() : "unknown", audience, formatLookups(executions));

            LlmResponse response = llmService.complete(ModelTier.CAPABLE, systemPrompt,
                CategoryClassifier.transcript(history), "generate");

            span.setAttribute("gen_ai.usage.input_tokens", (long) response.inputTokens());
            span.setAttribute("gen_ai.usage.output_tokens", (long) response.outputTokens());
            span.setAttribute("gen_ai.usage.cost_usd", response.costUsd());

            span.setAttribute("triage.llm_fallback", response.fallback());
            if (response.fallback()) {
                log.info("Reply written by fallback provider {} ({})", response.provider(), response.model());
            }
            log.debug("Generated reply: {} tokens (in={}, out={}) after {} attempt(s)",
                response.totalTokens(), response.inputTokens(), response.outputTokens(), response.attempts());
            return response;

        } catch (RuntimeException e) {
            span.setStatus(StatusCode.ERROR, e.getMessage());
            log.warn("Reply generation failed: {}", e.getMessage());
            throw e;

        } finally {
            span.end();
        }
    }

    static String formatLookups(List<ToolExecution> executions) {
        var sb = new StringBuilder();
        for (ToolExecution exec : executions) {
            if (exec.status() == ToolStatus.SUCCESS) {
                sb.append("- ").append(exec.toolName()).append(": ").append(exec.resultPayload()).append('\n');
            } else if (exec.status() == ToolStatus.FAILED) {
                sb.append("- ").append(exec.toolName()).append(": unavailable\n");
            } else {
                sb.append("- ").append(exec.toolName()).append(": ").append(exec.status().name().toLowerCase())
                    .append(", not yet carried out\n");
            }
        }
        return sb.isEmpty() ? "(none)\n" : sb.toString();
    }
}
