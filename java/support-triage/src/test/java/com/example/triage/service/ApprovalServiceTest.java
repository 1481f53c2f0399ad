package com.example.triage.service;

import java.time.Duration;
import java.time.Instant;
import java.util.Map;
import java.util.UUID;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import com.example.triage.error.ApprovalNotPendingException;
import com.example.triage.error.ExecutionNotFoundException;
import com.example.triage.model.ApprovalOutcome;
import com.example.triage.model.ApprovalResolution;
import com.example.triage.model.Category;
import com.example.triage.model.Decision;
import com.example.triage.model.SessionState;
import com.example.triage.model.ToolStatus;
import com.example.triage.model.TraceKind;
import com.example.triage.model.TraceRecord;
import com.example.triage.model.TriageOutcome;
import com.example.triage.pipeline.EngineFixture;
import com.example.triage.store.InMemorySessionStore;
import com.example.triage.tools.ToolExecutor;

import reactor.core.publisher.Mono;
import reactor.test.StepVerifier;

import static com.example.triage.pipeline.EngineFixture.classification;
import static com.example.triage.pipeline.EngineFixture.message;
import static com.example.triage.pipeline.EngineFixture.reply;
import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyList;
import static org.mockito.Mockito.when;

class ApprovalServiceTest {

    private EngineFixture fx;
    private ApprovalService approvals;
    private UUID pending;

    @BeforeEach
    void setUp() {
        fx = new EngineFixture();
        approvals = new ApprovalService(fx.store, fx.executor, fx.engine, fx.traces);
        when(fx.replies.generate(any(), any(), anyList(), anyList())).thenReturn(reply("We paused your box."));
        when(fx.classifier.classify(anyList()))
            .thenReturn(classification(Category.RETENTION, 0.9, "cancel_subscription", Map.of("reason", "moving")));
        pending = fx.engine.process(message("m-1", "Please cancel, I'm moving abroad")).block().pendingExecutionId();
    }

    @Test
    void listsPendingApprovals() {
        StepVerifier.create(approvals.listPending())
            .assertNext(exec -> {
                assertEquals(pending, exec.id());
                assertEquals("cancel_subscription", exec.toolName());
            })
            .verifyComplete();
    }

    @Test
    void approvalRunsActionAndResumesSession() {
        StepVerifier.create(approvals.resolve(pending, ApprovalOutcome.APPROVED, "alice", null))
            .assertNext(result -> {
                assertFalse(result.superseded());
                assertEquals(ToolStatus.SUCCESS, result.execution().status());
                assertEquals(TriageOutcome.Status.DISPATCHED, result.outcome().status());
                assertEquals(Decision.DRAFT, result.outcome().decision());
            })
            .verifyComplete();

        assertEquals(1, fx.tools.calls("cancel_subscription"));
    }

    @Test
    void secondResolutionIsRejected() {
        approvals.resolve(pending, ApprovalOutcome.REJECTED, "alice", "keep them").block();

        StepVerifier.create(approvals.resolve(pending, ApprovalOutcome.APPROVED, "bob", null))
            .expectError(ApprovalNotPendingException.class)
            .verify();
        assertEquals(0, fx.tools.calls("cancel_subscription"));
    }

    @Test
    void unknownExecutionIsNotFound() {
        StepVerifier.create(approvals.resolve(UUID.randomUUID(), ApprovalOutcome.APPROVED, "alice", null))
            .expectError(ExecutionNotFoundException.class)
            .verify();
    }

    @Test
    void approvalAfterSessionMovedOnIsOnlyRecorded() {
        TriageOutcome escalated = fx.engine.process(message("m-2", "Forget it, I'm calling my lawyer")).block();
        assertEquals(Decision.ESCALATE, escalated.decision());
        int writesBefore = fx.channel.writes().size();

        StepVerifier.create(approvals.resolve(pending, ApprovalOutcome.APPROVED, "alice", null))
            .assertNext(result -> {
                assertTrue(result.superseded());
                assertNull(result.outcome());
                assertEquals(ToolStatus.APPROVED, result.execution().status());
            })
            .verifyComplete();

        assertEquals(0, fx.tools.calls("cancel_subscription"));
        assertEquals(writesBefore, fx.channel.writes().size());
        TraceRecord last = fx.store.traces().get(fx.store.traces().size() - 1);
        assertEquals(TraceKind.APPROVAL_RESOLVED, last.kind());
    }

    /** Runs {@code beforeResolution} right before the store records a reviewer outcome. */
    static class InterleavingStore extends InMemorySessionStore {

        Runnable beforeResolution = () -> { };

        @Override
        public Mono<ApprovalResolution> resolveApproval(UUID executionId, ApprovalOutcome outcome,
                                                        String reviewer, String note) {
            return Mono.fromRunnable(beforeResolution)
                .then(super.resolveApproval(executionId, outcome, reviewer, note));
        }
    }

    @Test
    void approvalRacingSafetyEscalationIsNotExecuted() {
        var store = new InterleavingStore();
        var racing = new EngineFixture(store);
        when(racing.replies.generate(any(), any(), anyList(), anyList())).thenReturn(reply("ok"));
        when(racing.classifier.classify(anyList()))
            .thenReturn(classification(Category.RETENTION, 0.9, "cancel_subscription", Map.of()));
        var service = new ApprovalService(racing.store, racing.executor, racing.engine, racing.traces);
        UUID execution = racing.engine.process(message("m-1", "Cancel my plan")).block().pendingExecutionId();
        store.beforeResolution = () -> racing.engine.process(message("m-2", "Do it now or I will sue you")).block();

        StepVerifier.create(service.resolve(execution, ApprovalOutcome.APPROVED, "alice", null))
            .assertNext(result -> {
                assertTrue(result.superseded());
                assertEquals(ToolStatus.APPROVED, result.execution().status());
            })
            .verifyComplete();

        assertEquals(0, racing.tools.calls("cancel_subscription"));
        assertEquals(Decision.ESCALATE, racing.store.decision("cw_42", 1).block().decision());
        assertEquals(SessionState.DISPATCHED, racing.store.find("cw_42").block().state());
    }

    @Test
    void sweeperRejectsExpiredApprovalsAndEscalates() {
        var sweeper = new ApprovalTimeoutSweeper(fx.store, approvals, fx.properties);

        StepVerifier.create(sweeper.sweepOnce(Instant.now()))
            .expectNext(0L)
            .verifyComplete();

        StepVerifier.create(sweeper.sweepOnce(Instant.now().plus(Duration.ofHours(25))))
            .expectNext(1L)
            .verifyComplete();

        var rejected = fx.store.findExecution(pending).block();
        assertEquals(ToolStatus.REJECTED, rejected.status());
        assertEquals(ToolExecutor.SYSTEM_ACTOR, rejected.reviewer());
        assertEquals(ApprovalTimeoutSweeper.TIMEOUT_NOTE, rejected.failureReason());
        assertEquals("approval_rejected", fx.store.decision("cw_42", 1).block().reason());
    }
}
