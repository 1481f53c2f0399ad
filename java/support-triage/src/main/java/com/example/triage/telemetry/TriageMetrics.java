package com.example.triage.telemetry;

import org.springframework.stereotype.Component;

import io.opentelemetry.api.GlobalOpenTelemetry;
import io.opentelemetry.api.common.AttributeKey;
import io.opentelemetry.api.common.Attributes;
import io.opentelemetry.api.metrics.DoubleHistogram;
import io.opentelemetry.api.metrics.LongCounter;
import io.opentelemetry.api.metrics.Meter;

@Component
public class TriageMetrics {

    private final LongCounter decisionCount;
    private final LongCounter escalationCount;
    private final LongCounter toolCallCount;
    private final LongCounter dispatchAttempts;
    private final LongCounter dispatchFailures;
    private final DoubleHistogram cycleDuration;
    private final DoubleHistogram approvalWait;

    public TriageMetrics() {
        Meter meter = GlobalOpenTelemetry.getMeter("support-triage");

        this.decisionCount = meter.counterBuilder("triage.decision.count")
            .setDescription("Decisions recorded, by decision and category")
            .build();

        this.escalationCount = meter.counterBuilder("triage.escalation.count")
            .setDescription("Escalated cycles, by reason")
            .build();

        this.toolCallCount = meter.counterBuilder("triage.tool_calls")
            .setDescription("Tool executions by tool and resulting status")
            .build();

        this.dispatchAttempts = meter.counterBuilder("triage.dispatch.attempts")
            .setDescription("Channel write attempts")
            .build();

        this.dispatchFailures = meter.counterBuilder("triage.dispatch.failures")
            .setDescription("Dispatches that exhausted their retries")
            .build();

        this.cycleDuration = meter.histogramBuilder("triage.cycle.duration")
            .setUnit("s")
            .setDescription("Time from the first message of a cycle to its dispatch")
            .build();

        this.approvalWait = meter.histogramBuilder("triage.approval.wait")
            .setUnit("s")
            .setDescription("Time a tool execution waited for a reviewer")
            .build();
    }

    public void recordDecision(String decision, String category) {
        decisionCount.add(1, Attributes.of(
            AttributeKey.stringKey("triage.decision"), decision,
            AttributeKey.stringKey("triage.category"), category
        ));
    }

    public void recordEscalation(String reason, String priority) {
        escalationCount.add(1, Attributes.of(
            AttributeKey.stringKey("triage.escalation_reason"), reason,
            AttributeKey.stringKey("triage.escalation_priority"), priority
        ));
    }

    public void recordToolCall(String toolName, String status) {
        toolCallCount.add(1, Attributes.of(
            AttributeKey.stringKey("triage.tool_name"), toolName,
            AttributeKey.stringKey("triage.tool_status"), status
        ));
    }

    public void recordDispatchAttempt(String operation, boolean success) {
        dispatchAttempts.add(1, Attributes.of(
            AttributeKey.stringKey("triage.dispatch_operation"), operation,
            AttributeKey.booleanKey("triage.dispatch_success"), success
        ));
    }

    public void recordDispatchFailure(String decision) {
        dispatchFailures.add(1, Attributes.of(AttributeKey.stringKey("triage.decision"), decision));
    }

    public void recordCycleDuration(double seconds, String decision) {
        cycleDuration.record(seconds, Attributes.of(AttributeKey.stringKey("triage.decision"), decision));
    }

    public void recordApprovalWait(double seconds, String outcome) {
        approvalWait.record(seconds, Attributes.of(AttributeKey.stringKey("triage.approval_outcome"), outcome));
    }
}
