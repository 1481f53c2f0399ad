package com.example.triage.store;

import java.time.Instant;
import java.util.UUID;
import java.util.function.UnaryOperator;

import com.example.triage.model.ApprovalOutcome;
import com.example.triage.model.ApprovalResolution;
import com.example.triage.model.DecisionRecord;
import com.example.triage.model.DispatchClaim;
import com.example.triage.model.InboundAppend;
import com.example.triage.model.InboundEvent;
import com.example.triage.model.Message;
import com.example.triage.model.Session;
import com.example.triage.model.SessionState;
import com.example.triage.model.ToolExecution;
import com.example.triage.model.ToolExecutionEvent;
import com.example.triage.model.ToolStatus;
import com.example.triage.model.TraceRecord;

import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

/**
 * Transactional interface over sessions, messages, tool executions, decisions and traces.
 * Every mutation of a session or its executions runs while holding that session's
 * exclusive lock, so writers of one session are serialized and writers of different
 * sessions never contend. Mutation functions run inside the lock and must not block.
 */
public interface SessionStore {

    /**
     * Creates the session on first contact and appends the customer message with the next
     * sequence number. A redelivered event id yields {@code duplicate=true} and the original message.
     */
    Mono<InboundAppend> appendInbound(InboundEvent event);

    /** Emits {@link com.example.triage.error.SessionNotFoundException} when absent. */
    Mono<Session> find(String sessionId);

    Flux<Session> findByState(SessionState state);

    Flux<Message> history(String sessionId);

    Mono<Session> update(String sessionId, UnaryOperator<Session> mutation);

    /** Appends an assistant or system message; customer messages go through {@link #appendInbound}. */
    Mono<Message> appendMessage(Message message);

    /**
     * Moves the session to DECIDED and records the decision for its cycle in one transaction.
     * Fails with {@link com.example.triage.error.StaleSnapshotException} when the session has
     * newer customer messages or the cycle is already decided.
     */
    Mono<DecisionRecord> decide(String sessionId, DecisionRecord record);

    Mono<DecisionRecord> decision(String sessionId, int cycle);

    Flux<DecisionRecord> decisions(String sessionId);

    /** DECIDED → DISPATCHING with the token, or {@code claimed=false} if the token is already held. */
    Mono<DispatchClaim> claimDispatch(String sessionId, String token);

    /** Idempotent per (session, cycle, tool): returns the existing execution if one was recorded. */
    Mono<ToolExecution> createExecution(ToolExecution execution, String actor);

    Mono<ToolExecution> updateExecution(UUID executionId, UnaryOperator<ToolExecution> mutation,
                                        String actor, String note);

    /**
     * Applies a reviewer outcome to a PENDING execution while holding its session's lock. The
     * outcome is superseded when, under that lock, the session has decided or moved to a later
     * cycle; the event then carries {@link ApprovalResolution#SUPERSEDED_NOTE}. Fails with
     * {@link com.example.triage.error.ApprovalNotPendingException} when already resolved.
     */
    Mono<ApprovalResolution> resolveApproval(UUID executionId, ApprovalOutcome outcome, String reviewer, String note);

    Mono<ToolExecution> findExecution(UUID executionId);

    Flux<ToolExecution> executions(String sessionId, int cycle);

    Flux<ToolExecution> executions(String sessionId);

    Flux<ToolExecution> executionsByStatus(ToolStatus status);

    Flux<ToolExecution> pendingOlderThan(Instant cutoff);

    Flux<ToolExecutionEvent> executionHistory(UUID executionId);

    Mono<TraceRecord> appendTrace(TraceRecord record);

    Flux<TraceRecord> tracesAfter(long afterId, int limit);
}
