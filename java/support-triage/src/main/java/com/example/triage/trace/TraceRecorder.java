package com.example.triage.trace;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import com.example.triage.error.TriageException;
import com.example.triage.model.DecisionRecord;
import com.example.triage.model.Session;
import com.example.triage.model.ToolExecution;
import com.example.triage.model.TraceKind;
import com.example.triage.model.TraceRecord;
import com.example.triage.store.SessionStore;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;

import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

/**
 * Appends the audit trail analytics reads: one CYCLE record per dispatch attempt and one
 * APPROVAL_RESOLVED record per approval that arrived after its cycle was decided.
 * Records are never updated.
 */
@Component
public class TraceRecorder {

    private static final Logger log = LoggerFactory.getLogger(TraceRecorder.class);
    static final int MAX_PAGE = 500;

    private final SessionStore store;
    private final ObjectMapper mapper;

    public TraceRecorder(SessionStore store, ObjectMapper mapper) {
        this.store = store;
        this.mapper = mapper;
    }

    public Mono<TraceRecord> recordCycle(Session session, DecisionRecord decision,
                                         List<ToolExecution> executions, String dispatchStatus) {
        BigDecimal cost = executions.stream()
            .map(ToolExecution::costUsd)
            .filter(Objects::nonNull)
            .reduce(decision.costUsd() != null ? decision.costUsd() : BigDecimal.ZERO, BigDecimal::add);
        long durationMs = Math.max(0, Instant.now().toEpochMilli() - session.cycleStartedAt().toEpochMilli());

        var record = new TraceRecord(null, session.id(), decision.cycle(), TraceKind.CYCLE,
            decision.decision(), decision.category(), decision.confidence(),
            executionsJson(executions), cost, durationMs, dispatchStatus, decision.evaluation(), Instant.now());
        return store.appendTrace(record)
            .doOnNext(saved -> log.info("Trace recorded: id={} session={} cycle={} decision={} dispatch={}",
                saved.id(), saved.sessionId(), saved.cycle(), saved.decision(), dispatchStatus));
    }

    public Mono<TraceRecord> recordApprovalResolved(Session session, ToolExecution execution) {
        var record = new TraceRecord(null, session.id(), execution.cycle(), TraceKind.APPROVAL_RESOLVED,
            null, session.category(), null, executionsJson(List.of(execution)),
            execution.costUsd() != null ? execution.costUsd() : BigDecimal.ZERO,
            execution.durationMs(), null, null, Instant.now());
        return store.appendTrace(record)
            .doOnNext(saved -> log.info("Trailing approval recorded: session={} execution={} status={}",
                session.id(), execution.id(), execution.status()));
    }

    /** Feed for the analytics collaborator, ordered by id; {@code limit} is capped. */
    public Flux<TraceRecord> feed(long afterId, int limit) {
        return store.tracesAfter(Math.max(0, afterId), Math.max(1, Math.min(limit, MAX_PAGE)));
    }

    String executionsJson(List<ToolExecution> executions) {
        List<Map<String, Object>> rows = new ArrayList<>();
        for (ToolExecution exec : executions) {
            var row = new LinkedHashMap<String, Object>();
            row.put("execution_id", exec.id() != null ? exec.id().toString() : null);
            row.put("tool", exec.toolName());
            row.put("status", exec.status().name().toLowerCase());
            row.put("requires_approval", exec.requiresApproval());
            row.put("duration_ms", exec.durationMs());
            row.put("reviewer", exec.reviewer());
            row.put("failure_reason", exec.failureReason());
            rows.add(row);
        }
        try {
            return mapper.writeValueAsString(rows);
        } catch (JsonProcessingException e) {
            throw new TriageException("Unable to serialize tool executions for trace", e);
        }
    }
}
