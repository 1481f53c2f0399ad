package com.example.triage.service;

import java.time.Instant;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import com.example.triage.config.TriageProperties;
import com.example.triage.dispatch.DispatchAdapter;
import com.example.triage.dispatch.DispatchResult;
import com.example.triage.error.IllegalTransitionException;
import com.example.triage.model.Session;
import com.example.triage.model.SessionState;
import com.example.triage.store.SessionStore;
import com.example.triage.trace.TraceRecorder;

import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

/**
 * Operator queue for sessions whose dispatch exhausted its retries or stalled, for example
 * when the process died between the dispatch claim and the last channel write.
 */
@Service
public class OperatorService {

    private static final Logger log = LoggerFactory.getLogger(OperatorService.class);

    private final SessionStore store;
    private final DispatchAdapter dispatcher;
    private final TraceRecorder traceRecorder;
    private final TriageProperties properties;

    public OperatorService(SessionStore store, DispatchAdapter dispatcher, TraceRecorder traceRecorder,
                           TriageProperties properties) {
        this.store = store;
        this.dispatcher = dispatcher;
        this.traceRecorder = traceRecorder;
        this.properties = properties;
    }

    public Flux<Session> dispatchFailures() {
        return store.findByState(SessionState.DISPATCH_FAILED);
    }

    /** Retries a failed dispatch from its first unconfirmed write and traces the result. */
    public Mono<DispatchResult> redispatch(String sessionId) {
        log.info("Operator redispatch requested: session={}", sessionId);
        return dispatcher.redispatch(sessionId)
            .flatMap(result -> store.decision(sessionId, result.session().cycle())
                .flatMap(record -> store.executions(sessionId, record.cycle()).collectList()
                    .flatMap(executions -> traceRecorder.recordCycle(
                        result.session(), record, executions, result.status().name())))
                .thenReturn(result));
    }

    /**
     * Marks every session DISPATCHING without progress since {@code now - staleAfter} as
     * DISPATCH_FAILED, which puts it in the redispatch queue. Returns how many were marked.
     */
    public Mono<Long> failStaleDispatches(Instant now) {
        Instant cutoff = now.minus(properties.dispatch().staleAfter());
        return store.findByState(SessionState.DISPATCHING)
            .filter(session -> !session.updatedAt().isAfter(cutoff))
            .concatMap(session -> store.update(session.id(), s -> s.abandonDispatch(cutoff, now))
                .doOnNext(failed -> log.warn("Stale dispatch marked failed: session={} cycle={} step={} since={}",
                    failed.id(), failed.cycle(), failed.dispatchStep(), session.updatedAt()))
                .onErrorResume(IllegalTransitionException.class, e -> {
                    log.info("Dispatch moved on before it was marked stale: session={}", session.id());
                    return Mono.empty();
                }))
            .count();
    }
}
