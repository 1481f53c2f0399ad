package com.example.triage.model;

import java.time.Instant;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.EnumSource;

import com.example.triage.error.IllegalTransitionException;
import com.example.triage.error.StaleSnapshotException;

import static org.junit.jupiter.api.Assertions.*;

class SessionTest {

    private static final Instant NOW = Instant.parse("2026-01-01T00:00:00Z");

    private static Session received() {
        return Session.open("s-1", "chatwoot", "jane@example.com", "42", NOW)
            .withInbound(MessageRole.CUSTOMER, null, NOW);
    }

    private static Session dispatched() {
        return received()
            .decided(Decision.SEND, 1, 1, NOW)
            .claimDispatch("s-1:1:send", NOW)
            .dispatched(NOW.plusSeconds(5));
    }

    @Test
    void inboundAssignsMonotonicSequences() {
        Session session = received().withInbound(MessageRole.CUSTOMER, null, NOW);
        assertEquals(2, session.lastSequence());
        assertEquals(2, session.lastCustomerSequence());
        assertEquals(1, session.cycle());
        assertEquals(SessionState.RECEIVED, session.state());
    }

    @Test
    void assistantMessageDoesNotMoveCustomerWatermark() {
        Session session = received().withInbound(MessageRole.ASSISTANT, null, NOW);
        assertEquals(2, session.lastSequence());
        assertEquals(1, session.lastCustomerSequence());
    }

    @Test
    void customerMessageAfterDispatchOpensNextCycle() {
        Session next = dispatched().withInbound(MessageRole.CUSTOMER, null, NOW);
        assertEquals(2, next.cycle());
        assertEquals(SessionState.RECEIVED, next.state());
        assertNull(next.decision());
        assertNull(next.dispatchToken());
        assertNull(next.category());
    }

    @Test
    void decisionOnStaleSnapshotIsRejected() {
        Session session = received().withInbound(MessageRole.CUSTOMER, null, NOW);
        assertThrows(StaleSnapshotException.class, () -> session.decided(Decision.SEND, 1, 1, NOW));
    }

    @Test
    void secondDecisionForSameCycleIsRejected() {
        Session decided = received().decided(Decision.DRAFT, 1, 1, NOW);
        assertThrows(StaleSnapshotException.class, () -> decided.decided(Decision.SEND, 1, 1, NOW));
    }

    @Test
    void decisionForOtherCycleIsRejected() {
        assertThrows(StaleSnapshotException.class, () -> received().decided(Decision.SEND, 2, 1, NOW));
    }

    @Test
    void safetyEscalationGoesStraightFromReceivedToDecided() {
        Session decided = received().decided(Decision.ESCALATE, 1, 1, NOW);
        assertEquals(SessionState.DECIDED, decided.state());
        assertEquals(Decision.ESCALATE, decided.decision());
    }

    @Test
    void parkingRequiresClassification() {
        assertThrows(IllegalTransitionException.class, () -> received().parked(NOW));
        Session parked = received().classified(Category.RETENTION, 0.9, "{}", 1, NOW).parked(NOW);
        assertEquals(SessionState.TOOL_PENDING, parked.state());
    }

    @Test
    void classificationOnParkedSessionStaysParked() {
        Session parked = received().classified(Category.RETENTION, 0.9, "{}", 1, NOW).parked(NOW)
            .withInbound(MessageRole.CUSTOMER, null, NOW);
        Session reclassified = parked.classified(Category.BILLING, 0.8, "{}", 2, NOW);
        assertEquals(SessionState.TOOL_PENDING, reclassified.state());
        assertEquals(Category.BILLING, reclassified.category());
        assertEquals(2, reclassified.classifiedThrough());
    }

    @Test
    void dispatchClaimIsHeldOnce() {
        Session claimed = received().decided(Decision.SEND, 1, 1, NOW).claimDispatch("s-1:1:send", NOW);
        assertEquals(SessionState.DISPATCHING, claimed.state());
        assertTrue(claimed.holdsDispatch("s-1:1:send"));
        assertThrows(IllegalTransitionException.class, () -> claimed.claimDispatch("s-1:1:send", NOW));
    }

    @Test
    void dispatchRecordsFirstResponseOnlyOnce() {
        Session first = dispatched();
        assertEquals(5000L, first.firstResponseMs());

        Session second = first.withInbound(MessageRole.CUSTOMER, null, NOW.plusSeconds(60))
            .decided(Decision.SEND, 2, 2, NOW.plusSeconds(60))
            .claimDispatch("s-1:2:send", NOW.plusSeconds(60))
            .dispatched(NOW.plusSeconds(90));
        assertEquals(5000L, second.firstResponseMs());
        assertEquals(90_000L, second.resolutionMs());
    }

    @Test
    void draftOrEscalationIsNotAResponse() {
        Session drafted = received().decided(Decision.DRAFT, 1, 1, NOW)
            .claimDispatch("s-1:1:draft", NOW)
            .dispatched(NOW.plusSeconds(5));
        assertNull(drafted.firstResponseMs());
        assertNull(drafted.resolutionMs());

        Session answered = drafted.withInbound(MessageRole.CUSTOMER, null, NOW.plusSeconds(30))
            .decided(Decision.SEND, 2, 2, NOW.plusSeconds(30))
            .claimDispatch("s-1:2:send", NOW.plusSeconds(30))
            .dispatched(NOW.plusSeconds(40));
        assertEquals(40_000L, answered.firstResponseMs());

        Session escalated = answered.withInbound(MessageRole.CUSTOMER, null, NOW.plusSeconds(60))
            .decided(Decision.ESCALATE, 3, 3, NOW.plusSeconds(60))
            .claimDispatch("s-1:3:escalate", NOW.plusSeconds(60))
            .dispatched(NOW.plusSeconds(70));
        assertEquals(40_000L, escalated.firstResponseMs());
        assertEquals(40_000L, escalated.resolutionMs());
    }

    @Test
    void onlyAStalledDispatchCanBeAbandoned() {
        Session claimed = received().decided(Decision.SEND, 1, 1, NOW).claimDispatch("s-1:1:send", NOW);
        assertThrows(IllegalTransitionException.class,
            () -> claimed.abandonDispatch(NOW.minusSeconds(1), NOW.plusSeconds(600)));

        Session abandoned = claimed.abandonDispatch(NOW, NOW.plusSeconds(600));
        assertEquals(SessionState.DISPATCH_FAILED, abandoned.state());
        assertEquals("s-1:1:send", abandoned.dispatchToken());
        assertThrows(IllegalTransitionException.class, () -> dispatched().abandonDispatch(NOW.plusSeconds(600), NOW));
    }

    @Test
    void failedDispatchCanBeReopened() {
        Session failed = received().decided(Decision.DRAFT, 1, 1, NOW)
            .claimDispatch("s-1:1:draft", NOW)
            .dispatchStepCompleted(1, NOW)
            .dispatchFailed(NOW);
        Session reopened = failed.reopenDispatch(NOW);
        assertEquals(SessionState.DISPATCHING, reopened.state());
        assertEquals(1, reopened.dispatchStep());
    }

    @ParameterizedTest
    @EnumSource(value = SessionState.class, names = {"DECIDED", "DISPATCHING", "DISPATCHED", "DISPATCH_FAILED"})
    void decidedStatesAreClosed(SessionState state) {
        assertTrue(state.isDecided());
    }
}
