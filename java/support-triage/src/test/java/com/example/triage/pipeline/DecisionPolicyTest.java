package com.example.triage.pipeline;

import java.util.List;
import java.util.Map;

import org.junit.jupiter.api.Test;

import com.example.triage.config.TriageProperties;
import com.example.triage.model.Category;
import com.example.triage.model.ClassificationResult;
import com.example.triage.model.Decision;
import com.example.triage.model.EscalationPriority;
import com.example.triage.model.RoutingDecision;
import com.example.triage.model.SafetySignal;
import com.example.triage.model.ToolExecution;
import com.example.triage.tools.CategoryPlan;

import static org.junit.jupiter.api.Assertions.*;

class DecisionPolicyTest {

    private final DecisionPolicy policy = new DecisionPolicy(TriageProperties.defaults());

    private static final CategoryPlan TRACKING_PLAN =
        CategoryPlan.of(Category.TRACKING, List.of("get_subscription", "track_package"), true);
    private static final CategoryPlan RETENTION_PLAN = new CategoryPlan(Category.RETENTION,
        List.of("get_subscription"), List.of("cancel_subscription"), "cancel_subscription", false);

    private static ClassificationResult classified(Category category, double confidence) {
        return new ClassificationResult(category, confidence, "low", "neutral", false, null, Map.of(), List.of(), 10, 10, 0.0);
    }

    private static ToolExecution lookup(String tool, boolean succeeded) {
        return ToolExecution.completed("s-1", 1, tool, "{}", succeeded, "{}", succeeded ? null : "timeout", 5, null);
    }

    private static CycleFacts facts(ClassificationResult classification, CategoryPlan plan, ToolExecution... executions) {
        return new CycleFacts(SafetySignal.none(), false, classification, false, false, plan, List.of(executions));
    }

    @Test
    void confidentTrackingWithSuccessfulLookupsIsSent() {
        RoutingDecision routing = policy.checkRules(facts(classified(Category.TRACKING, 0.95), TRACKING_PLAN,
            lookup("get_subscription", true), lookup("track_package", true)));
        assertEquals(Decision.SEND, routing.decision());
        assertEquals("auto_send", routing.reason());
    }

    @Test
    void failedLookupDowngradesToDraft() {
        RoutingDecision routing = policy.checkRules(facts(classified(Category.TRACKING, 0.95), TRACKING_PLAN,
            lookup("get_subscription", true), lookup("track_package", false)));
        assertEquals(Decision.DRAFT, routing.decision());
        assertEquals("tool_failed:track_package", routing.reason());
    }

    @Test
    void missingLookupIsNeverSent() {
        RoutingDecision routing = policy.checkRules(facts(classified(Category.TRACKING, 0.95), TRACKING_PLAN,
            lookup("get_subscription", true)));
        assertEquals(Decision.DRAFT, routing.decision());
    }

    @Test
    void lowConfidenceIsDrafted() {
        RoutingDecision routing = policy.checkRules(facts(classified(Category.TRACKING, 0.7), TRACKING_PLAN,
            lookup("get_subscription", true), lookup("track_package", true)));
        assertEquals(RoutingDecision.draft("low_confidence"), routing);
    }

    @Test
    void safetyOverridesEverything() {
        var facts = new CycleFacts(SafetySignal.of("legal_threat"), true,
            classified(Category.TRACKING, 0.99), false, false, TRACKING_PLAN, List.of());
        RoutingDecision routing = policy.checkRules(facts);
        assertEquals(Decision.ESCALATE, routing.decision());
        assertEquals("safety:legal_threat", routing.reason());
        assertEquals(EscalationPriority.URGENT, routing.priority());
    }

    @Test
    void humanRequestEscalates() {
        var facts = new CycleFacts(SafetySignal.none(), true,
            classified(Category.GENERAL, 0.9), false, false, null, List.of());
        assertEquals(RoutingDecision.escalate("human_requested", EscalationPriority.HIGH), policy.checkRules(facts));
    }

    @Test
    void pendingApprovalKeepsCycleParked() {
        RoutingDecision routing = policy.checkRules(facts(classified(Category.RETENTION, 0.9), RETENTION_PLAN,
            lookup("get_subscription", true), ToolExecution.pending("s-1", 1, "cancel_subscription", "{}")));
        assertTrue(routing.parked());
    }

    @Test
    void rejectedApprovalEscalates() {
        ToolExecution rejected = ToolExecution.pending("s-1", 1, "cancel_subscription", "{}")
            .rejected("alice", "no");
        RoutingDecision routing = policy.checkRules(facts(classified(Category.RETENTION, 0.9), RETENTION_PLAN,
            lookup("get_subscription", true), rejected));
        assertEquals(RoutingDecision.escalate("approval_rejected", EscalationPriority.HIGH), routing);
    }

    @Test
    void approvedWriteActionIsDraftedForReview() {
        ToolExecution done = ToolExecution.pending("s-1", 1, "cancel_subscription", "{}")
            .approved("alice").succeeded("{}", 3);
        RoutingDecision routing = policy.checkRules(facts(classified(Category.RETENTION, 0.9), RETENTION_PLAN,
            lookup("get_subscription", true), done));
        assertEquals(RoutingDecision.draft("write_action_requires_review"), routing);
    }

    @Test
    void uncategorizedIsDraftedThenEscalatedOnRepeat() {
        var first = new CycleFacts(SafetySignal.none(), false,
            ClassificationResult.uncategorized(0.3, 0, 0, 0.0), false, false, null, List.of());
        var repeat = new CycleFacts(SafetySignal.none(), false,
            ClassificationResult.uncategorized(0.3, 0, 0, 0.0), false, true, null, List.of());
        assertEquals(RoutingDecision.draft("uncategorized"), policy.checkRules(first));
        assertEquals(RoutingDecision.escalate("repeated_uncategorized", EscalationPriority.MEDIUM),
            policy.checkRules(repeat));
    }

    @Test
    void classifierFailureIsDrafted() {
        var facts = new CycleFacts(SafetySignal.none(), false, null, true, false, null, List.of());
        assertEquals(RoutingDecision.draft("classifier_error"), policy.evaluate(facts));
    }

    @Test
    void downgradeOnlyAffectsSend() {
        assertEquals(RoutingDecision.draft("unsafe_reply:confirmed_refund"),
            RoutingDecision.send("auto_send").downgradeToDraft("unsafe_reply:confirmed_refund"));
        RoutingDecision escalation = RoutingDecision.escalate("human_requested", EscalationPriority.HIGH);
        assertSame(escalation, escalation.downgradeToDraft("reply_generation_failed"));
    }
}
