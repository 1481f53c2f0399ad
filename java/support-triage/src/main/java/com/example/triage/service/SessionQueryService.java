package com.example.triage.service;

import java.util.List;
import java.util.UUID;

import org.springframework.stereotype.Service;

import com.example.triage.model.DecisionRecord;
import com.example.triage.model.Message;
import com.example.triage.model.Session;
import com.example.triage.model.SessionState;
import com.example.triage.model.ToolExecution;
import com.example.triage.model.ToolExecutionEvent;
import com.example.triage.store.SessionStore;

import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;


@Service
public class SessionQueryService {

    private final SessionStore store;

    public SessionQueryService(SessionStore store) {
        this.store = store;
    }

    public record SessionView(
        Session session,
        List<Message> messages,
        List<ToolExecution> executions,
        List<DecisionRecord> decisions
    ) {}

    public Mono<SessionView> view(String sessionId) {
        return store.find(sessionId)
            .flatMap(session -> Mono.zip(
                    store.history(sessionId).collectList(),
                    store.executions(sessionId).collectList(),
                    store.decisions(sessionId).collectList())
                .map(t -> new SessionView(session, t.getT1(), t.getT2(), t.getT3())));
    }

    public Flux<Session> byState(SessionState state) {
        return store.findByState(state);
    }

    public Flux<ToolExecutionEvent> executionHistory(UUID executionId) {
        return store.findExecution(executionId)
            .flatMapMany(exec -> store.executionHistory(executionId));
    }
}
