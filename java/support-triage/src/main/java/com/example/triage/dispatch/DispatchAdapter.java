package com.example.triage.dispatch;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import com.example.triage.config.ChannelProperties;
import com.example.triage.config.TriageProperties;
import com.example.triage.error.DispatchChannelUnavailableException;
import com.example.triage.error.DispatchRejectedException;
import com.example.triage.error.IllegalTransitionException;
import com.example.triage.filter.OutboundTextSanitizer;
import com.example.triage.model.Decision;
import com.example.triage.model.DecisionRecord;
import com.example.triage.model.Message;
import com.example.triage.model.Session;
import com.example.triage.store.SessionStore;
import com.example.triage.telemetry.TriageMetrics;

import reactor.core.Exceptions;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;
import reactor.util.retry.Retry;

/**
 * Makes a recorded decision visible on the channel. The session is claimed with a dispatch
 * token before the first write, and each confirmed write advances {@code dispatchStep}, so
 * neither a repeated call nor a redispatch repeats a channel write.
 */
@Component
public class DispatchAdapter {

    private static final Logger log = LoggerFactory.getLogger(DispatchAdapter.class);

    static final String DRAFT_LABEL = "ai_draft";
    static final String ESCALATION_LABEL = "ai_escalation";
    static final String HIGH_PRIORITY_LABEL = "high_priority";

    private final SessionStore store;
    private final ChannelClient channel;
    private final OutboundTextSanitizer sanitizer;
    private final TriageMetrics metrics;
    private final TriageProperties.Dispatch retryPolicy;
    private final Long escalationAssigneeId;

    public DispatchAdapter(SessionStore store, ChannelClient channel, OutboundTextSanitizer sanitizer,
                           TriageMetrics metrics, TriageProperties properties, ChannelProperties channelProperties) {
        this.store = store;
        this.channel = channel;
        this.sanitizer = sanitizer;
        this.metrics = metrics;
        this.retryPolicy = properties.dispatch();
        this.escalationAssigneeId = channelProperties.escalationAssigneeId();
    }

    public static String token(DecisionRecord record) {
        return record.sessionId() + ":" + record.cycle() + ":" + record.decision().label();
    }

    /**
     * Dispatches the decision recorded for the session's current cycle. Calling this again for
     * the same session and decision returns ALREADY_DISPATCHED without writing.
     */
    public Mono<DispatchResult> dispatch(String sessionId, Decision decision) {
        return store.find(sessionId)
            .flatMap(session -> store.decision(sessionId, session.cycle())
                .switchIfEmpty(Mono.error(() -> new IllegalTransitionException(
                    "Session " + sessionId + " cycle " + session.cycle() + " has no recorded decision")))
                .flatMap(record -> {
                    if (record.decision() != decision) {
                        return Mono.error(new IllegalTransitionException("Session " + sessionId + " cycle "
                            + record.cycle() + " was decided " + record.decision() + ", not " + decision));
                    }
                    return store.claimDispatch(sessionId, token(record))
                        .flatMap(claim -> claim.claimed()
                            ? deliver(claim.session(), record)
                            : Mono.just(DispatchResult.alreadyDispatched(claim.session())));
                }))
            .doOnNext(result -> {
                if (!result.performed()) {
                    log.info("Dispatch already claimed: session={} decision={}", sessionId, decision);
                }
            });
    }

    /** Resumes a DISPATCH_FAILED session from its first unconfirmed write. */
    public Mono<DispatchResult> redispatch(String sessionId) {
        return store.update(sessionId, session -> session.reopenDispatch(Instant.now()))
            .flatMap(session -> store.decision(sessionId, session.cycle())
                .switchIfEmpty(Mono.error(() -> new IllegalTransitionException(
                    "Session " + sessionId + " has no decision to redispatch")))
                .doOnNext(record -> log.info("Redispatching: session={} cycle={} fromStep={}",
                    sessionId, session.cycle(), session.dispatchStep()))
                .flatMap(record -> deliver(session, record)));
    }

    private Mono<DispatchResult> deliver(Session session, DecisionRecord record) {
        List<ChannelOperation> operations = operationsFor(session, record);
        String ref = session.conversationRef() != null ? session.conversationRef() : session.id();
        int from = Math.min(session.dispatchStep(), operations.size());

        return Flux.range(from, operations.size() - from)
            .concatMap(step -> attempt(operations.get(step), ref, session.id())
                .then(Mono.defer(() -> confirmStep(session, record, step, operations.get(step)))))
            .then(Mono.defer(() -> store.update(session.id(), s -> s.dispatched(Instant.now()))))
            .map(dispatched -> {
                log.info("Dispatched: session={} cycle={} decision={} steps={}",
                    session.id(), record.cycle(), record.decision(), operations.size());
                return DispatchResult.dispatched(dispatched);
            })
            .onErrorResume(DispatchAdapter::isChannelFailure, e -> {
                log.error("Dispatch exhausted: session={} cycle={} decision={} error={}",
                    session.id(), record.cycle(), record.decision(), e.getMessage());
                metrics.recordDispatchFailure(record.decision().label());
                return store.update(session.id(), s -> s.dispatchFailed(Instant.now()))
                    .map(failed -> DispatchResult.failed(failed, rootMessage(e)));
            });
    }

    private Mono<Void> attempt(ChannelOperation operation, String ref, String sessionId) {
        return Mono.defer(() -> operation.apply(channel, ref))
            .doOnSuccess(ignored -> metrics.recordDispatchAttempt(operation.name(), true))
            .doOnError(e -> metrics.recordDispatchAttempt(operation.name(), false))
            .retryWhen(Retry.backoff(retryPolicy.maxAttempts() - 1L, retryPolicy.minBackoff())
                .maxBackoff(retryPolicy.maxBackoff())
                .jitter(0.5)
                .filter(e -> !(e instanceof DispatchRejectedException))
                .doBeforeRetry(signal -> log.warn("Retrying {}: session={} attempt={} error={}",
                    operation.name(), sessionId, signal.totalRetries() + 2, signal.failure().getMessage())));
    }

    private Mono<Session> confirmStep(Session session, DecisionRecord record, int step, ChannelOperation operation) {
        Mono<Session> advanced = store.update(session.id(), s -> s.dispatchStepCompleted(step + 1, Instant.now()));
        if (step != 0) {
            return advanced;
        }
        // The first write carries the reply itself; record it as the assistant message.
        boolean customerVisible = operation instanceof ChannelOperation.PublicReply;
        long latencyMs = Duration.between(session.cycleStartedAt(), Instant.now()).toMillis();
        Message reply = Message.assistant(session.id(), messageText(operation), customerVisible,
            record.costUsd() != null ? record.costUsd().doubleValue() : 0.0, latencyMs);
        return advanced.flatMap(s -> store.appendMessage(reply).thenReturn(s));
    }

    List<ChannelOperation> operationsFor(Session session, DecisionRecord record) {
        String category = record.category() != null ? record.category().label() : "uncategorized";
        String reply = record.replyText() != null ? sanitizer.sanitize(record.replyText(), session.channel()) : "";
        var operations = new ArrayList<ChannelOperation>();

        switch (record.decision()) {
            case SEND -> operations.add(new ChannelOperation.PublicReply(reply));
            case DRAFT -> {
                operations.add(new ChannelOperation.PrivateNote(draftNote(record, category, reply)));
                operations.add(new ChannelOperation.SetStatus("open"));
                operations.add(new ChannelOperation.AddLabels(List.of(DRAFT_LABEL, category)));
            }
            case ESCALATE -> {
                operations.add(new ChannelOperation.PrivateNote(escalationNote(record, category, reply)));
                operations.add(new ChannelOperation.SetStatus("open"));
                operations.add(new ChannelOperation.AddLabels(List.of(ESCALATION_LABEL, category, HIGH_PRIORITY_LABEL)));
                if (escalationAssigneeId != null) {
                    operations.add(new ChannelOperation.Assign(escalationAssigneeId));
                }
            }
        }
        return List.copyOf(operations);
    }

    private static String draftNote(DecisionRecord record, String category, String reply) {
        return "**AI Draft (needs review)**\n\n"
            + "Category: " + category + "\n"
            + "Confidence: " + formatConfidence(record.confidence()) + "\n"
            + "Reason: " + record.reason() + "\n\n"
            + "---\n\n" + reply;
    }

    private static String escalationNote(DecisionRecord record, String category, String reply) {
        return "**AI Escalation**\n\n"
            + "Category: " + category + "\n"
            + "Reason: " + record.reason() + "\n"
            + "Priority: " + record.priority() + "\n\n"
            + "---\n\nAI draft:\n" + reply;
    }

    private static String formatConfidence(Double confidence) {
        return confidence != null ? String.format(Locale.ROOT, "%.2f", confidence) : "n/a";
    }

    private static String messageText(ChannelOperation operation) {
        if (operation instanceof ChannelOperation.PublicReply publicReply) {
            return publicReply.text();
        }
        if (operation instanceof ChannelOperation.PrivateNote note) {
            return note.text();
        }
        return operation.name();
    }

    private static boolean isChannelFailure(Throwable e) {
        return Exceptions.isRetryExhausted(e) || e instanceof DispatchChannelUnavailableException
            || e instanceof DispatchRejectedException;
    }

    private static String rootMessage(Throwable e) {
        Throwable cause = Exceptions.isRetryExhausted(e) && e.getCause() != null ? e.getCause() : e;
        return cause.getMessage();
    }
}
