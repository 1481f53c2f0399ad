package com.example.triage.store;

import java.time.Instant;
import java.util.UUID;
import java.util.function.UnaryOperator;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;
import org.springframework.transaction.reactive.TransactionalOperator;

import com.example.triage.error.ApprovalNotPendingException;
import com.example.triage.error.ExecutionNotFoundException;
import com.example.triage.error.IllegalTransitionException;
import com.example.triage.error.SessionNotFoundException;
import com.example.triage.model.ApprovalOutcome;
import com.example.triage.model.ApprovalResolution;
import com.example.triage.model.DecisionRecord;
import com.example.triage.model.DispatchClaim;
import com.example.triage.model.InboundAppend;
import com.example.triage.model.InboundEvent;
import com.example.triage.model.Message;
import com.example.triage.model.MessageRole;
import com.example.triage.model.Session;
import com.example.triage.model.SessionState;
import com.example.triage.model.ToolExecution;
import com.example.triage.model.ToolExecutionEvent;
import com.example.triage.model.ToolStatus;
import com.example.triage.model.TraceRecord;
import com.example.triage.repository.DecisionRepository;
import com.example.triage.repository.MessageRepository;
import com.example.triage.repository.SessionRepository;
import com.example.triage.repository.ToolExecutionEventRepository;
import com.example.triage.repository.ToolExecutionRepository;
import com.example.triage.repository.TraceRecordRepository;

import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

/**
 * PostgreSQL-backed store. Each mutation opens a transaction whose first statement is
 * {@code SELECT ... FOR UPDATE} on the session row; optimistic versions on sessions and
 * executions catch anything that slips past the row lock.
 */
@Component
public class R2dbcSessionStore implements SessionStore {

    private static final Logger log = LoggerFactory.getLogger(R2dbcSessionStore.class);

    private final SessionRepository sessionRepo;
    private final MessageRepository messageRepo;
    private final ToolExecutionRepository executionRepo;
    private final ToolExecutionEventRepository eventRepo;
    private final DecisionRepository decisionRepo;
    private final TraceRecordRepository traceRepo;
    private final TransactionalOperator tx;

    public R2dbcSessionStore(
        SessionRepository sessionRepo,
        MessageRepository messageRepo,
        ToolExecutionRepository executionRepo,
        ToolExecutionEventRepository eventRepo,
        DecisionRepository decisionRepo,
        TraceRecordRepository traceRepo,
        TransactionalOperator tx
    ) {
        this.sessionRepo = sessionRepo;
        this.messageRepo = messageRepo;
        this.executionRepo = executionRepo;
        this.eventRepo = eventRepo;
        this.decisionRepo = decisionRepo;
        this.traceRepo = traceRepo;
        this.tx = tx;
    }

    @Override
    public Mono<InboundAppend> appendInbound(InboundEvent event) {
        return sessionRepo.insertIfAbsent(event.sessionId(), event.channel(), event.customerId(), event.conversationRef())
            .then(locked(event.sessionId()))
            .flatMap(session -> findDuplicate(session, event)
                .switchIfEmpty(Mono.defer(() -> {
                    Session next = session.withInbound(MessageRole.CUSTOMER, event.customerId(), Instant.now());
                    Message message = Message.customer(session.id(), event.text(), event.eventId())
                        .sequenced(next.cycle(), next.lastSequence());
                    return sessionRepo.save(next)
                        .flatMap(saved -> messageRepo.save(message)
                            .map(stored -> new InboundAppend(saved, stored, false)));
                })))
            .as(tx::transactional)
            .doOnNext(result -> {
                if (result.duplicate()) {
                    log.info("Duplicate event ignored: session={} event={}", event.sessionId(), event.eventId());
                }
            });
    }

    private Mono<InboundAppend> findDuplicate(Session session, InboundEvent event) {
        if (event.eventId() == null || event.eventId().isBlank()) {
            return Mono.empty();
        }
        return messageRepo.findBySessionIdAndEventId(session.id(), event.eventId())
            .map(existing -> new InboundAppend(session, existing, true));
    }

    @Override
    public Mono<Session> find(String sessionId) {
        return sessionRepo.findById(sessionId)
            .switchIfEmpty(Mono.error(() -> new SessionNotFoundException(sessionId)));
    }

    @Override
    public Flux<Session> findByState(SessionState state) {
        return sessionRepo.findByStateOrderByUpdatedAtAsc(state);
    }

    @Override
    public Flux<Message> history(String sessionId) {
        return messageRepo.findBySessionIdOrderBySequenceAsc(sessionId);
    }

    @Override
    public Mono<Session> update(String sessionId, UnaryOperator<Session> mutation) {
        return locked(sessionId)
            .map(mutation)
            .flatMap(sessionRepo::save)
            .as(tx::transactional);
    }

    @Override
    public Mono<Message> appendMessage(Message message) {
        if (message.role() == MessageRole.CUSTOMER) {
            return Mono.error(new IllegalArgumentException("Customer messages must arrive as inbound events"));
        }
        return locked(message.sessionId())
            .flatMap(session -> {
                Session next = session.withInbound(message.role(), null, Instant.now());
                return sessionRepo.save(next)
                    .then(messageRepo.save(message.sequenced(next.cycle(), next.lastSequence())));
            })
            .as(tx::transactional);
    }

    @Override
    public Mono<DecisionRecord> decide(String sessionId, DecisionRecord record) {
        return locked(sessionId)
            .map(session -> session.decided(record.decision(), record.cycle(), record.basedOnSequence(), Instant.now()))
            .flatMap(sessionRepo::save)
            .then(decisionRepo.save(record))
            .as(tx::transactional);
    }

    @Override
    public Mono<DecisionRecord> decision(String sessionId, int cycle) {
        return decisionRepo.findBySessionIdAndCycle(sessionId, cycle);
    }

    @Override
    public Flux<DecisionRecord> decisions(String sessionId) {
        return decisionRepo.findBySessionIdOrderByCycleAsc(sessionId);
    }

    @Override
    public Mono<DispatchClaim> claimDispatch(String sessionId, String token) {
        return locked(sessionId)
            .flatMap(session -> {
                if (session.holdsDispatch(token)) {
                    return Mono.just(new DispatchClaim(session, false));
                }
                if (session.state() != SessionState.DECIDED) {
                    return Mono.error(new IllegalTransitionException(
                        "Session " + sessionId + " is " + session.state() + " and does not hold " + token));
                }
                return sessionRepo.save(session.claimDispatch(token, Instant.now()))
                    .map(saved -> new DispatchClaim(saved, true));
            })
            .as(tx::transactional);
    }

    @Override
    public Mono<ToolExecution> createExecution(ToolExecution execution, String actor) {
        return locked(execution.sessionId())
            .then(executionRepo.findBySessionIdAndCycleAndToolName(
                execution.sessionId(), execution.cycle(), execution.toolName()))
            .switchIfEmpty(Mono.defer(() -> executionRepo.save(execution)
                .flatMap(saved -> eventRepo.save(ToolExecutionEvent.of(saved.id(), saved.status(), actor, null))
                    .thenReturn(saved))))
            .as(tx::transactional);
    }

    @Override
    public Mono<ToolExecution> updateExecution(UUID executionId, UnaryOperator<ToolExecution> mutation,
                                               String actor, String note) {
        return findExecution(executionId)
            .flatMap(current -> locked(current.sessionId()))
            .then(Mono.defer(() -> findExecution(executionId)))
            .map(mutation)
            .flatMap(executionRepo::save)
            .flatMap(saved -> eventRepo.save(ToolExecutionEvent.of(saved.id(), saved.status(), actor, note))
                .thenReturn(saved))
            .as(tx::transactional);
    }

    @Override
    public Mono<ApprovalResolution> resolveApproval(UUID executionId, ApprovalOutcome outcome,
                                                    String reviewer, String note) {
        return findExecution(executionId)
            .flatMap(current -> locked(current.sessionId()))
            .flatMap(session -> findExecution(executionId)
                .flatMap(exec -> {
                    if (!exec.isPending()) {
                        return Mono.error(new ApprovalNotPendingException(executionId, exec.status()));
                    }
                    boolean superseded = session.supersedes(exec);
                    String eventNote = superseded ? ApprovalResolution.SUPERSEDED_NOTE : note;
                    return executionRepo.save(exec.resolved(outcome, reviewer, note))
                        .flatMap(saved -> eventRepo.save(ToolExecutionEvent.of(saved.id(), saved.status(), reviewer, eventNote))
                            .thenReturn(new ApprovalResolution(saved, superseded)));
                }))
            .as(tx::transactional);
    }

    @Override
    public Mono<ToolExecution> findExecution(UUID executionId) {
        return executionRepo.findById(executionId)
            .switchIfEmpty(Mono.error(() -> new ExecutionNotFoundException(executionId)));
    }

    @Override
    public Flux<ToolExecution> executions(String sessionId, int cycle) {
        return executionRepo.findBySessionIdAndCycleOrderByCreatedAtAsc(sessionId, cycle);
    }

    @Override
    public Flux<ToolExecution> executions(String sessionId) {
        return executionRepo.findBySessionIdOrderByCreatedAtAsc(sessionId);
    }

    @Override
    public Flux<ToolExecution> executionsByStatus(ToolStatus status) {
        return executionRepo.findByStatusOrderByCreatedAtAsc(status);
    }

    @Override
    public Flux<ToolExecution> pendingOlderThan(Instant cutoff) {
        return executionRepo.findByStatusAndCreatedAtBefore(ToolStatus.PENDING, cutoff);
    }

    @Override
    public Flux<ToolExecutionEvent> executionHistory(UUID executionId) {
        return eventRepo.findByExecutionIdOrderByIdAsc(executionId);
    }

    @Override
    public Mono<TraceRecord> appendTrace(TraceRecord record) {
        if (record.id() != null) {
            return Mono.error(new IllegalArgumentException("Trace records are append-only"));
        }
        return traceRepo.save(record);
    }

    @Override
    public Flux<TraceRecord> tracesAfter(long afterId, int limit) {
        return traceRepo.findAfter(afterId, limit);
    }

    private Mono<Session> locked(String sessionId) {
        return sessionRepo.lockById(sessionId)
            .switchIfEmpty(Mono.error(() -> new SessionNotFoundException(sessionId)));
    }
}
