package com.example.triage.service;

import java.util.UUID;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import com.example.triage.model.ApprovalOutcome;
import com.example.triage.model.ToolExecution;
import com.example.triage.model.ToolStatus;
import com.example.triage.model.TriageOutcome;
import com.example.triage.pipeline.DecisionEngine;
import com.example.triage.store.SessionStore;
import com.example.triage.tools.ToolExecutor;
import com.example.triage.trace.TraceRecorder;

import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

/**
 * Human approval gate for write actions. Resolving an approval resumes the parked session;
 * an approval that arrives after the session moved on is kept for audit and traced on its own.
 */
@Service
public class ApprovalService {

    private static final Logger log = LoggerFactory.getLogger(ApprovalService.class);

    private final SessionStore store;
    private final ToolExecutor executor;
    private final DecisionEngine engine;
    private final TraceRecorder traceRecorder;

    public ApprovalService(SessionStore store, ToolExecutor executor, DecisionEngine engine,
                           TraceRecorder traceRecorder) {
        this.store = store;
        this.executor = executor;
        this.engine = engine;
        this.traceRecorder = traceRecorder;
    }

    public record ApprovalResult(ToolExecution execution, boolean superseded, TriageOutcome outcome) {}

    public Flux<ToolExecution> listPending() {
        return store.executionsByStatus(ToolStatus.PENDING);
    }

    public Mono<ApprovalResult> resolve(UUID executionId, ApprovalOutcome outcome, String reviewer, String note) {
        return executor.resolveApproval(executionId, outcome, reviewer, note)
            .flatMap(resolution -> {
                ToolExecution execution = resolution.execution();
                if (resolution.superseded()) {
                    return store.find(execution.sessionId())
                        .flatMap(session -> traceRecorder.recordApprovalResolved(session, execution))
                        .thenReturn(new ApprovalResult(execution, true, null));
                }
                return engine.resume(execution.sessionId())
                    .doOnNext(result -> log.info("Session resumed after approval: session={} outcome={}",
                        execution.sessionId(), result.status()))
                    .map(result -> new ApprovalResult(execution, false, result));
            });
    }
}
