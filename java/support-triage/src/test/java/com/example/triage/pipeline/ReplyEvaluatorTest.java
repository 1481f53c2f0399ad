package com.example.triage.pipeline;

import java.util.List;
import java.util.Map;

import org.junit.jupiter.api.Test;

import com.example.triage.error.LlmUnavailableException;
import com.example.triage.llm.LlmResponse;
import com.example.triage.llm.LlmService;
import com.example.triage.llm.ModelTier;
import com.example.triage.model.Category;
import com.example.triage.model.ClassificationResult;
import com.example.triage.model.Decision;
import com.example.triage.model.EscalationPriority;
import com.example.triage.model.RoutingDecision;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.contains;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

class ReplyEvaluatorTest {

    private final LlmService llm = mock(LlmService.class);
    private final ReplyEvaluator evaluator = new ReplyEvaluator(llm);

    private static ClassificationResult tracking(String sentiment) {
        return new ClassificationResult(Category.TRACKING, 0.93, "low", sentiment, false, null, Map.of(),
            List.of(), 40, 10, 0.0001);
    }

    private void modelAnswers(String content) {
        when(llm.complete(eq(ModelTier.FAST), anyString(), anyString(), eq("evaluate")))
            .thenReturn(new LlmResponse(content, ModelTier.FAST, "openai", "gpt-4o-mini", 400, 30, 0.00008,
                "stop", false, 1));
    }

    private ReplyEvaluator.Verdict evaluate(String sentiment) {
        return evaluator.evaluate("Where is my box?", "Your box ships Monday.", tracking(sentiment),
            List.of("get_subscription", "track_package"));
    }

    @Test
    void passingReplyKeepsSend() {
        modelAnswers("{\"decision\": \"send\", \"confidence\": \"high\", \"reason\": \"answers the question\"}");

        ReplyEvaluator.Verdict verdict = evaluate("neutral");

        assertEquals(Decision.SEND, verdict.decision());
        assertEquals("send:high:answers the question", verdict.label());
        assertEquals(0.00008, verdict.costUsd(), 1e-12);
        RoutingDecision send = RoutingDecision.send("auto_send");
        assertSame(send, verdict.applyTo(send));
        verify(llm).complete(eq(ModelTier.FAST), anyString(), contains("LOOKUPS USED: get_subscription, track_package"),
            eq("evaluate"));
    }

    @Test
    void doubtfulReplyBecomesDraft() {
        modelAnswers("```json\n{\"decision\": \"draft\", \"confidence\": \"medium\", \"reason\": \"tone\"}\n```");

        RoutingDecision routing = evaluate("neutral").applyTo(RoutingDecision.send("auto_send"));

        assertEquals(Decision.DRAFT, routing.decision());
        assertEquals("evaluator_draft", routing.reason());
    }

    @Test
    void escalationVerdictEscalates() {
        modelAnswers("{\"decision\": \"escalate\", \"confidence\": \"high\", \"reason\": \"needs a person\"}");

        RoutingDecision routing = evaluate("negative").applyTo(RoutingDecision.send("auto_send"));

        assertEquals(Decision.ESCALATE, routing.decision());
        assertEquals("evaluator_escalation", routing.reason());
        assertEquals(EscalationPriority.MEDIUM, routing.priority());
    }

    @Test
    void verdictNeverRaisesADraft() {
        modelAnswers("{\"decision\": \"send\", \"confidence\": \"high\"}");

        RoutingDecision draft = RoutingDecision.draft("low_confidence");

        assertSame(draft, evaluate("neutral").applyTo(draft));
    }

    @Test
    void frustratedCustomerNeedsHighConfidencePass() {
        modelAnswers("{\"decision\": \"send\", \"confidence\": \"medium\", \"reason\": \"fine\"}");

        ReplyEvaluator.Verdict verdict = evaluate("frustrated");

        assertEquals(Decision.DRAFT, verdict.decision());
        assertEquals("frustrated_customer", verdict.reason());
        verify(llm).complete(eq(ModelTier.FAST), anyString(), contains("CUSTOMER SENTIMENT: frustrated"),
            eq("evaluate"));
    }

    @Test
    void unreachableEvaluatorHoldsReplyForReview() {
        when(llm.complete(eq(ModelTier.FAST), anyString(), anyString(), eq("evaluate")))
            .thenThrow(new LlmUnavailableException("evaluate", new IllegalStateException("503")));

        ReplyEvaluator.Verdict verdict = evaluate("neutral");

        assertEquals(Decision.DRAFT, verdict.decision());
        assertEquals("draft:low:evaluator_unavailable", verdict.label());
    }

    @Test
    void unreadableVerdictHoldsReplyForReview() {
        modelAnswers("Looks good to me!");

        ReplyEvaluator.Verdict verdict = evaluate("neutral");

        assertEquals(Decision.DRAFT, verdict.decision());
        assertEquals("evaluator_unreadable", verdict.reason());
        assertEquals(0.00008, verdict.costUsd(), 1e-12);
    }

    @Test
    void longReasonIsCutToColumnWidth() {
        var verdict = new ReplyEvaluator.Verdict(Decision.DRAFT, "low", "x".repeat(400), 0.0);

        assertEquals(255, verdict.label().length());
    }
}
