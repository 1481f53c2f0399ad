package com.example.triage.model;

import java.util.UUID;

public record TriageOutcome(
    Status status,
    String sessionId,
    int cycle,
    Decision decision,
    String reason,
    UUID pendingExecutionId
) {

    public enum Status { DISPATCHED, DISPATCH_FAILED, PARKED, DUPLICATE, SUPERSEDED }

    public static TriageOutcome duplicate(String sessionId, int cycle) {
        return new TriageOutcome(Status.DUPLICATE, sessionId, cycle, null, "duplicate_event", null);
    }

    public static TriageOutcome superseded(String sessionId, int cycle) {
        return new TriageOutcome(Status.SUPERSEDED, sessionId, cycle, null, "superseded", null);
    }

    public static TriageOutcome parked(String sessionId, int cycle, UUID executionId) {
        return new TriageOutcome(Status.PARKED, sessionId, cycle, null, "approval_pending", executionId);
    }
}
