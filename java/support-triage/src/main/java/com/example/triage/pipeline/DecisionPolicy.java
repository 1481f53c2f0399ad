package com.example.triage.pipeline;

import java.util.Optional;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import com.example.triage.config.TriageProperties;
import com.example.triage.model.EscalationPriority;
import com.example.triage.model.RoutingDecision;
import com.example.triage.model.ToolExecution;
import com.example.triage.model.ToolStatus;

import io.opentelemetry.api.GlobalOpenTelemetry;
import io.opentelemetry.api.trace.Span;
import io.opentelemetry.api.trace.Tracer;
import io.opentelemetry.context.Scope;

/**
 * Routing rules, evaluated top-down; the first match wins. Safety always comes first and
 * nothing short of every lookup succeeding on an auto-send category yields SEND.
 */
@Component
public class DecisionPolicy {

    private static final Logger log = LoggerFactory.getLogger(DecisionPolicy.class);

    private final double autoSendConfidence;
    private final Tracer tracer;

    public DecisionPolicy(TriageProperties properties) {
        this.autoSendConfidence = properties.autoSendConfidence();
        this.tracer = GlobalOpenTelemetry.getTracer("support-triage");
    }

    public RoutingDecision evaluate(CycleFacts facts) {
        Span span = tracer.spanBuilder("decision_policy")
            .setAttribute("triage.stage", "route")
            .setAttribute("triage.tool_executions", (long) facts.executions().size())
            .startSpan();

        try (Scope ignored = span.makeCurrent()) {
            RoutingDecision routing = checkRules(facts);

            span.setAttribute("triage.parked", routing.parked());
            span.setAttribute("triage.reason", routing.reason());
            if (!routing.parked()) {
                span.setAttribute("triage.decision", routing.decision().label());
                log.debug("Routing: decision={} reason={} priority={}",
                    routing.decision(), routing.reason(), routing.priority());
            }
            return routing;

        } finally {
            span.end();
        }
    }

    RoutingDecision checkRules(CycleFacts facts) {
        if (facts.safety().flagged()) {
            return RoutingDecision.escalate("safety:" + facts.safety().trigger(), EscalationPriority.URGENT);
        }

        boolean humanRequested = facts.humanRequested()
            || (facts.classification() != null && facts.classification().humanRequested());
        if (humanRequested) {
            return RoutingDecision.escalate("human_requested", EscalationPriority.HIGH);
        }

        if (find(facts, ToolStatus.REJECTED).isPresent()) {
            return RoutingDecision.escalate("approval_rejected", EscalationPriority.HIGH);
        }

        if (find(facts, ToolStatus.PENDING).isPresent()) {
            return RoutingDecision.stayParked();
        }

        if (facts.classification() != null && facts.classification().isUncategorized()) {
            return facts.priorCycle()
                ? RoutingDecision.escalate("repeated_uncategorized", EscalationPriority.MEDIUM)
                : RoutingDecision.draft("uncategorized");
        }

        if (facts.classifierFailed() || facts.classification() == null) {
            return RoutingDecision.draft("classifier_error");
        }

        Optional<ToolExecution> failed = find(facts, ToolStatus.FAILED);
        if (failed.isPresent()) {
            return RoutingDecision.draft("tool_failed:" + failed.get().toolName());
        }

        boolean writeAction = facts.executions().stream().anyMatch(ToolExecution::requiresApproval);
        if (writeAction) {
            return RoutingDecision.draft("write_action_requires_review");
        }

        boolean confident = facts.classification().confidence() >= autoSendConfidence;
        if (facts.plan() != null && facts.plan().autoSend() && confident && lookupsSucceeded(facts)) {
            return RoutingDecision.send("auto_send");
        }

        return RoutingDecision.draft(confident ? "not_auto_send" : "low_confidence");
    }

    private static boolean lookupsSucceeded(CycleFacts facts) {
        return facts.plan().lookups().stream().allMatch(name -> facts.executions().stream()
            .anyMatch(exec -> exec.toolName().equals(name) && exec.status() == ToolStatus.SUCCESS));
    }

    private static Optional<ToolExecution> find(CycleFacts facts, ToolStatus status) {
        return facts.executions().stream().filter(exec -> exec.status() == status).findFirst();
    }
}
