package com.example.triage.tools;

import java.time.Duration;
import java.time.Instant;
import java.util.Map;
import java.util.UUID;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.ai.tool.execution.ToolExecutionException;
import org.springframework.stereotype.Component;

import com.example.triage.error.ToolExecutionFailedException;
import com.example.triage.model.ApprovalOutcome;
import com.example.triage.model.ApprovalResolution;
import com.example.triage.model.Session;
import com.example.triage.model.ToolExecution;
import com.example.triage.store.SessionStore;
import com.example.triage.telemetry.TriageMetrics;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;

import io.opentelemetry.api.GlobalOpenTelemetry;
import io.opentelemetry.api.trace.Span;
import io.opentelemetry.api.trace.StatusCode;
import io.opentelemetry.api.trace.Tracer;
import io.opentelemetry.context.Scope;

import reactor.core.publisher.Mono;
import reactor.core.scheduler.Schedulers;

/**
 * Runs registered tools for a session cycle and enforces the approval gate. Approval-gated
 * tools are only recorded as PENDING here; their handler runs after a reviewer approves.
 */
@Component
public class ToolExecutor {

    private static final Logger log = LoggerFactory.getLogger(ToolExecutor.class);

    public static final String ENGINE_ACTOR = "engine";
    public static final String SYSTEM_ACTOR = "system";

    private final ToolRegistry registry;
    private final SessionStore store;
    private final ObjectMapper mapper;
    private final TriageMetrics metrics;
    private final Tracer tracer;

    public ToolExecutor(ToolRegistry registry, SessionStore store, ObjectMapper mapper, TriageMetrics metrics) {
        this.registry = registry;
        this.store = store;
        this.mapper = mapper;
        this.metrics = metrics;
        this.tracer = GlobalOpenTelemetry.getTracer("support-triage");
    }

    record Payload(String customerId, Map<String, String> arguments) {}

    private record HandlerResult(boolean succeeded, String result, String failureReason, long durationMs) {}

    /**
     * Records one call of {@code toolName} in the session's current cycle. Idempotent per
     * (session, cycle, tool): a repeated call returns the execution already recorded.
     */
    public Mono<ToolExecution> invoke(Session session, String toolName, Map<String, String> arguments) {
        return Mono.fromCallable(() -> registry.require(toolName))
            .flatMap(tool -> {
                String payload = writePayload(new Payload(session.customerId(), arguments));
                if (tool.requiresApproval()) {
                    return store.createExecution(
                            ToolExecution.pending(session.id(), session.cycle(), tool.name(), payload), ENGINE_ACTOR)
                        .doOnNext(exec -> log.info("Tool awaiting approval: session={} cycle={} tool={} execution={}",
                            session.id(), session.cycle(), tool.name(), exec.id()));
                }
                return store.executions(session.id(), session.cycle())
                    .filter(exec -> exec.toolName().equals(tool.name()))
                    .next()
                    .switchIfEmpty(Mono.defer(() -> run(tool, toRequest(session.id(), payload))
                        .map(result -> ToolExecution.completed(session.id(), session.cycle(), tool.name(), payload,
                            result.succeeded(), result.result(), result.failureReason(), result.durationMs(), null))
                        .flatMap(exec -> store.createExecution(exec, ENGINE_ACTOR))));
            });
    }

    /**
     * Applies a reviewer outcome to a PENDING execution. The store decides under the session lock
     * whether the session has moved on; only an approval that was not superseded runs the handler.
     */
    public Mono<ApprovalResolution> resolveApproval(UUID executionId, ApprovalOutcome outcome,
                                                    String reviewer, String note) {
        return store.resolveApproval(executionId, outcome, reviewer, note)
            .doOnNext(resolution -> {
                ToolExecution resolved = resolution.execution();
                log.info("Approval resolved: execution={} tool={} outcome={} reviewer={} superseded={}",
                    executionId, resolved.toolName(), outcome, reviewer, resolution.superseded());
                metrics.recordApprovalWait(
                    Duration.between(resolved.createdAt(), Instant.now()).toMillis() / 1000.0,
                    outcome.name().toLowerCase());
            })
            .flatMap(resolution -> outcome == ApprovalOutcome.APPROVED && !resolution.superseded()
                ? executeApproved(resolution.execution()).map(done -> new ApprovalResolution(done, false))
                : Mono.just(resolution));
    }

    private Mono<ToolExecution> executeApproved(ToolExecution approved) {
        return Mono.fromCallable(() -> registry.require(approved.toolName()))
            .flatMap(tool -> run(tool, toRequest(approved.sessionId(), approved.inputPayload())))
            .flatMap(result -> store.updateExecution(approved.id(),
                exec -> result.succeeded()
                    ? exec.succeeded(result.result(), result.durationMs())
                    : exec.failed(result.failureReason(), result.durationMs()),
                SYSTEM_ACTOR, null));
    }

    private Mono<HandlerResult> run(RegisteredTool tool, ToolRequest request) {
        return Mono.fromCallable(() -> runBlocking(tool, request))
            .subscribeOn(Schedulers.boundedElastic());
    }

    private HandlerResult runBlocking(RegisteredTool tool, ToolRequest request) {
        Span span = tracer.spanBuilder("tool_execution")
            .setAttribute("triage.stage", "tool")
            .setAttribute("triage.session_id", request.sessionId())
            .setAttribute("triage.tool_name", tool.name())
            .setAttribute("triage.tool_requires_approval", tool.requiresApproval())
            .startSpan();
        long start = System.nanoTime();

        try (Scope ignored = span.makeCurrent()) {
            String result = tool.callback().call(request.input(mapper), request.context());
            long elapsed = (System.nanoTime() - start) / 1_000_000;
            span.setAttribute("triage.tool_duration_ms", elapsed);
            metrics.recordToolCall(tool.name(), "success");
            return new HandlerResult(true, result, null, elapsed);

        } catch (RuntimeException e) {
            long elapsed = (System.nanoTime() - start) / 1_000_000;
            String reason = failureReason(e);
            span.setStatus(StatusCode.ERROR, reason);
            metrics.recordToolCall(tool.name(), "failed");
            log.warn("Tool failed: session={} tool={} reason={}", request.sessionId(), tool.name(), reason);
            return new HandlerResult(false, null, reason, elapsed);

        } finally {
            span.end();
        }
    }

    /** Callbacks wrap method exceptions in {@link ToolExecutionException}; the domain failure is the cause. */
    static String failureReason(RuntimeException e) {
        for (Throwable cause = e; cause != null; cause = cause.getCause()) {
            if (cause instanceof ToolExecutionFailedException) {
                return cause.getMessage();
            }
        }
        Throwable root = e instanceof ToolExecutionException && e.getCause() != null ? e.getCause() : e;
        return root.getClass().getSimpleName() + ": " + root.getMessage();
    }

    private ToolRequest toRequest(String sessionId, String payload) {
        try {
            var parsed = mapper.readValue(payload, Payload.class);
            return new ToolRequest(sessionId, parsed.customerId(), parsed.arguments());
        } catch (JsonProcessingException e) {
            throw new ToolExecutionFailedException("payload", "Unreadable tool payload", e);
        }
    }

    private String writePayload(Payload payload) {
        try {
            return mapper.writeValueAsString(payload);
        } catch (JsonProcessingException e) {
            throw new ToolExecutionFailedException("payload", "Unwritable tool payload", e);
        }
    }
}
