package com.example.triage.model;

/**
 * Output of the decision policy. A null {@code decision} means the cycle stays parked
 * on a pending approval.
 */
public record RoutingDecision(
    Decision decision,
    String reason,
    EscalationPriority priority
) {

    public static RoutingDecision send(String reason) {
        return new RoutingDecision(Decision.SEND, reason, EscalationPriority.LOW);
    }

    public static RoutingDecision draft(String reason) {
        return new RoutingDecision(Decision.DRAFT, reason, EscalationPriority.LOW);
    }

    public static RoutingDecision escalate(String reason, EscalationPriority priority) {
        return new RoutingDecision(Decision.ESCALATE, reason, priority);
    }

    public static RoutingDecision stayParked() {
        return new RoutingDecision(null, "approval_pending", EscalationPriority.LOW);
    }

    public boolean parked() {
        return decision == null;
    }

    public RoutingDecision downgradeToDraft(String why) {
        return decision == Decision.SEND ? draft(why) : this;
    }
}
