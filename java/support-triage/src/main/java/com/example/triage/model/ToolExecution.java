package com.example.triage.model;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.UUID;

import org.springframework.data.annotation.Id;
import org.springframework.data.annotation.Version;
import org.springframework.data.relational.core.mapping.Table;

import com.example.triage.error.IllegalTransitionException;

/**
 * One call of a registered tool within a session cycle. {@code requiresApproval} is copied
 * from the tool definition when the execution is created and never changes afterwards.
 */
@Table("tool_executions")
public record ToolExecution(
    @Id UUID id,
    String sessionId,
    int cycle,
    String toolName,
    String inputPayload,
    boolean requiresApproval,
    ToolStatus status,
    String resultPayload,
    String failureReason,
    String reviewer,
    Long durationMs,
    BigDecimal costUsd,
    Instant createdAt,
    Instant updatedAt,
    @Version Long version
) {

    public static ToolExecution pending(String sessionId, int cycle, String toolName, String inputPayload) {
        Instant now = Instant.now();
        return new ToolExecution(null, sessionId, cycle, toolName, inputPayload, true,
            ToolStatus.PENDING, null, null, null, null, null, now, now, null);
    }

    /** A call that needed no approval and ran immediately. */
    public static ToolExecution completed(String sessionId, int cycle, String toolName, String inputPayload,
                                          boolean succeeded, String resultPayload, String failureReason,
                                          long durationMs, Double costUsd) {
        Instant now = Instant.now();
        return new ToolExecution(null, sessionId, cycle, toolName, inputPayload, false,
            succeeded ? ToolStatus.SUCCESS : ToolStatus.FAILED,
            resultPayload, failureReason, null, durationMs,
            costUsd != null ? BigDecimal.valueOf(costUsd) : null, now, now, null);
    }

    public ToolExecution approved(String by) {
        return transition(ToolStatus.APPROVED, resultPayload, failureReason, by, durationMs);
    }

    public ToolExecution rejected(String by, String reason) {
        return transition(ToolStatus.REJECTED, resultPayload, reason, by, durationMs);
    }

    /** Applies a reviewer outcome; a rejection without a note is recorded as "rejected". */
    public ToolExecution resolved(ApprovalOutcome outcome, String by, String note) {
        return outcome == ApprovalOutcome.APPROVED
            ? approved(by)
            : rejected(by, note != null && !note.isBlank() ? note : "rejected");
    }

    public ToolExecution succeeded(String result, long elapsedMs) {
        return transition(ToolStatus.SUCCESS, result, null, reviewer, elapsedMs);
    }

    public ToolExecution failed(String reason, long elapsedMs) {
        return transition(ToolStatus.FAILED, resultPayload, reason, reviewer, elapsedMs);
    }

    public boolean isPending() {
        return status == ToolStatus.PENDING;
    }

    private ToolExecution transition(ToolStatus next, String result, String reason, String by, Long elapsed) {
        if (!status.canTransitionTo(next)) {
            throw new IllegalTransitionException("Tool execution " + id, status, next);
        }
        if (next == ToolStatus.SUCCESS && requiresApproval && status != ToolStatus.APPROVED) {
            throw new IllegalTransitionException("Tool execution " + id + " needs approval before success");
        }
        return new ToolExecution(id, sessionId, cycle, toolName, inputPayload, requiresApproval,
            next, result, reason, by, elapsed, costUsd, createdAt, Instant.now(), version);
    }
}
