package com.example.triage.pipeline;

import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Optional;
import java.util.stream.Collectors;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import com.example.triage.config.TriageProperties;
import com.example.triage.dispatch.DispatchAdapter;
import com.example.triage.dispatch.DispatchResult;
import com.example.triage.error.StaleSnapshotException;
import com.example.triage.error.TriageException;
import com.example.triage.model.ClassificationResult;
import com.example.triage.model.Decision;
import com.example.triage.model.DecisionRecord;
import com.example.triage.model.InboundEvent;
import com.example.triage.model.Message;
import com.example.triage.model.MessageRole;
import com.example.triage.model.RoutingDecision;
import com.example.triage.model.SafetySignal;
import com.example.triage.model.Session;
import com.example.triage.model.SessionState;
import com.example.triage.model.ToolExecution;
import com.example.triage.model.ToolStatus;
import com.example.triage.model.TriageOutcome;
import com.example.triage.store.SessionStore;
import com.example.triage.telemetry.TriageMetrics;
import com.example.triage.tools.CategoryPlan;
import com.example.triage.tools.ToolExecutor;
import com.example.triage.tools.ToolRegistry;
import com.example.triage.trace.TraceRecorder;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;

import io.opentelemetry.api.GlobalOpenTelemetry;
import io.opentelemetry.api.trace.Span;
import io.opentelemetry.api.trace.StatusCode;
import io.opentelemetry.api.trace.Tracer;

import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Schedulers;

/**
 * Runs one decision cycle per call: safety screen, classification, tools, routing, commit and
 * dispatch. The cycle holds no lock while it waits on the model or a tool; every commit is
 * checked by the store against the latest customer message, and a stale commit makes the
 * engine recompute from the new history.
 */
@Component
public class DecisionEngine {

    private static final Logger log = LoggerFactory.getLogger(DecisionEngine.class);

    private final SessionStore store;
    private final SafetyScreen safetyScreen;
    private final CategoryClassifier classifier;
    private final ToolRegistry registry;
    private final ToolExecutor executor;
    private final DecisionPolicy policy;
    private final ReplyGenerator replyGenerator;
    private final ResponseGuard responseGuard;
    private final ReplyEvaluator replyEvaluator;
    private final DispatchAdapter dispatcher;
    private final TraceRecorder traceRecorder;
    private final TriageMetrics metrics;
    private final ObjectMapper mapper;
    private final int maxStaleRestarts;
    private final Tracer tracer;

    public DecisionEngine(
        SessionStore store,
        SafetyScreen safetyScreen,
        CategoryClassifier classifier,
        ToolRegistry registry,
        ToolExecutor executor,
        DecisionPolicy policy,
        ReplyGenerator replyGenerator,
        ResponseGuard responseGuard,
        ReplyEvaluator replyEvaluator,
        DispatchAdapter dispatcher,
        TraceRecorder traceRecorder,
        TriageMetrics metrics,
        ObjectMapper mapper,
        TriageProperties properties
    ) {
        this.store = store;
        this.safetyScreen = safetyScreen;
        this.classifier = classifier;
        this.registry = registry;
        this.executor = executor;
        this.policy = policy;
        this.replyGenerator = replyGenerator;
        this.responseGuard = responseGuard;
        this.replyEvaluator = replyEvaluator;
        this.dispatcher = dispatcher;
        this.traceRecorder = traceRecorder;
        this.metrics = metrics;
        this.mapper = mapper;
        this.maxStaleRestarts = properties.maxStaleRestarts();
        this.tracer = GlobalOpenTelemetry.getTracer("support-triage");
    }

    private record Classified(Session session, ClassificationResult result, boolean failed) {}

    private record Reply(String text, double costUsd, boolean failed) {}

    /** Appends the inbound message and runs the session's cycle. Redelivered events short-circuit. */
    public Mono<TriageOutcome> process(InboundEvent event) {
        return store.appendInbound(event)
            .flatMap(append -> {
                if (append.duplicate()) {
                    return Mono.just(TriageOutcome.duplicate(event.sessionId(), append.session().cycle()));
                }
                log.info("Inbound message: session={} cycle={} sequence={}",
                    event.sessionId(), append.session().cycle(), append.message().sequence());
                return runCycle(event.sessionId(), 0, false);
            });
    }

    /**
     * Re-enters the session's cycle after an approval was resolved. A cycle left DECIDED by an
     * interrupted worker is dispatched from here.
     */
    public Mono<TriageOutcome> resume(String sessionId) {
        return runCycle(sessionId, 0, true);
    }

    private Mono<TriageOutcome> runCycle(String sessionId, int restarts, boolean dispatchIfDecided) {
        Span span = tracer.spanBuilder("triage_cycle")
            .setAttribute("triage.session_id", sessionId)
            .setAttribute("triage.restarts", (long) restarts)
            .startSpan();

        return store.find(sessionId)
            .flatMap(session -> {
                span.setAttribute("triage.cycle", (long) session.cycle());
                if (session.state().isDecided()) {
                    if (dispatchIfDecided && session.state() == SessionState.DECIDED) {
                        return store.decision(sessionId, session.cycle())
                            .flatMap(record -> store.executions(sessionId, session.cycle()).collectList()
                                .flatMap(executions -> dispatchAndTrace(record, executions)))
                            .defaultIfEmpty(TriageOutcome.superseded(sessionId, session.cycle()));
                    }
                    return Mono.just(TriageOutcome.superseded(sessionId, session.cycle()));
                }
                return Mono.zip(store.history(sessionId).collectList(), previousWatermark(session))
                    .flatMap(snapshot -> decideCycle(session, snapshot.getT1(), snapshot.getT2()));
            })
            .onErrorResume(StaleSnapshotException.class, e -> restart(sessionId, restarts, e))
            .doOnNext(outcome -> {
                span.setAttribute("triage.outcome", outcome.status().name());
                if (outcome.decision() != null) {
                    span.setAttribute("triage.decision", outcome.decision().label());
                }
            })
            .doOnError(e -> span.setStatus(StatusCode.ERROR, e.getMessage()))
            .doFinally(signal -> span.end());
    }

    private Mono<TriageOutcome> restart(String sessionId, int restarts, StaleSnapshotException e) {
        if (restarts < maxStaleRestarts) {
            log.info("Stale snapshot, recomputing: session={} restart={} reason={}", sessionId, restarts + 1, e.getMessage());
            return runCycle(sessionId, restarts + 1, false);
        }
        log.warn("Yielding after {} stale restarts: session={}", restarts, sessionId);
        return store.find(sessionId).map(session -> TriageOutcome.superseded(sessionId, session.cycle()));
    }

    /** Sequence the previous cycle was decided on; customer messages after it belong to this cycle. */
    private Mono<Long> previousWatermark(Session session) {
        if (!session.hasPriorCycle()) {
            return Mono.just(0L);
        }
        return store.decision(session.id(), session.cycle() - 1)
            .map(DecisionRecord::basedOnSequence)
            .defaultIfEmpty(0L);
    }

    private Mono<TriageOutcome> decideCycle(Session session, List<Message> history, long watermark) {
        long basedOn = session.lastCustomerSequence();
        List<String> allCustomer = customerTexts(history, 0);
        List<String> current = customerTexts(history, watermark);

        SafetySignal signal = safetyScreen.screen(current, allCustomer);
        if (signal.flagged()) {
            var facts = CycleFacts.flagged(signal, session.hasPriorCycle());
            return commit(session, facts, policy.evaluate(facts), history, basedOn);
        }
        boolean humanAsked = safetyScreen.humanRequested(current);

        return classify(session, history, basedOn)
            .flatMap(classified -> runTools(classified, humanAsked)
                .map(executions -> new CycleFacts(SafetySignal.none(), humanAsked, classified.result(),
                    classified.failed(), session.hasPriorCycle(),
                    classified.result() != null ? registry.plan(classified.result().category()) : null,
                    executions))
                .flatMap(facts -> {
                    RoutingDecision routing = policy.evaluate(facts);
                    if (routing.parked()) {
                        return park(classified.session(), facts);
                    }
                    return commit(classified.session(), facts, routing, history, basedOn);
                }));
    }

    private Mono<Classified> classify(Session session, List<Message> history, long basedOn) {
        if (session.classification() != null && session.classifiedThrough() >= basedOn) {
            return Mono.fromCallable(() -> new Classified(session,
                mapper.readValue(session.classification(), ClassificationResult.class), false));
        }
        return Mono.fromCallable(() -> classifier.classify(history))
            .subscribeOn(Schedulers.boundedElastic())
            .map(Optional::of)
            .onErrorResume(e -> {
                log.warn("Classifier error, cycle will be drafted: session={} error={}", session.id(), e.getMessage());
                return Mono.just(Optional.empty());
            })
            .flatMap(result -> {
                if (result.isEmpty()) {
                    return Mono.just(new Classified(session, null, true));
                }
                ClassificationResult classification = result.get();
                String json = toJson(classification);
                return store.update(session.id(), s -> s.classified(classification.category(),
                        classification.confidence(), json, basedOn, Instant.now()))
                    .doOnNext(s -> log.info("Classified: session={} cycle={} category={} confidence={}",
                        s.id(), s.cycle(), classification.category(), classification.confidence()))
                    .map(s -> new Classified(s, classification, false));
            });
    }

    private Mono<List<ToolExecution>> runTools(Classified classified, boolean humanAsked) {
        if (classified.result() == null) {
            return store.executions(classified.session().id(), classified.session().cycle()).collectList();
        }
        Session session = classified.session();
        ClassificationResult result = classified.result();
        CategoryPlan plan = registry.plan(result.category());
        String action = humanAsked || result.humanRequested() ? null : plan.actionFor(result.action());

        return Flux.fromIterable(plan.lookups())
            .concatMap(tool -> executor.invoke(session, tool, result.parameters()))
            .then(action != null
                ? Mono.defer(() -> executor.invoke(session, action, result.parameters())).then()
                : Mono.empty())
            .then(Mono.defer(() -> store.executions(session.id(), session.cycle()).collectList()));
    }

    private Mono<TriageOutcome> park(Session session, CycleFacts facts) {
        ToolExecution pending = facts.executions().stream()
            .filter(exec -> exec.status() == ToolStatus.PENDING)
            .findFirst()
            .orElseThrow(() -> new TriageException("Parked without a pending execution"));

        Mono<Session> parked = session.state() == SessionState.CLASSIFIED
            ? store.update(session.id(), s -> s.state() == SessionState.CLASSIFIED ? s.parked(Instant.now()) : s)
            : Mono.just(session);
        return parked.map(s -> {
            log.info("Parked: session={} cycle={} tool={} execution={}",
                s.id(), s.cycle(), pending.toolName(), pending.id());
            return TriageOutcome.parked(s.id(), s.cycle(), pending.id());
        });
    }

    private Mono<TriageOutcome> commit(Session session, CycleFacts facts, RoutingDecision routing,
                                       List<Message> history, long basedOn) {
        Mono<Reply> reply = routing.decision() == Decision.ESCALATE
            ? Mono.just(new Reply(ReplyGenerator.HOLDING_REPLY, 0.0, false))
            : Mono.fromCallable(() -> replyGenerator.generate(session.category(), routing, facts.executions(), history))
                .subscribeOn(Schedulers.boundedElastic())
                .map(response -> new Reply(response.content(), response.costUsd(), false))
                .onErrorResume(e -> {
                    log.warn("Reply generation failed: session={} error={}", session.id(), e.getMessage());
                    return Mono.just(new Reply(ReplyGenerator.FALLBACK_DRAFT, 0.0, true));
                });

        return reply.flatMap(generated -> {
            RoutingDecision guarded = guard(session, routing, generated);
            return evaluate(session, facts, guarded, generated.text(), history).flatMap(verdict -> {
                RoutingDecision finalRouting = verdict.map(v -> v.applyTo(guarded)).orElse(guarded);
                if (finalRouting != guarded) {
                    log.warn("Reply evaluator lowered decision: session={} decision={} verdict={}",
                        session.id(), finalRouting.decision().label(), verdict.get().label());
                }
                double cost = generated.costUsd()
                    + (facts.classification() != null ? facts.classification().costUsd() : 0.0)
                    + verdict.map(ReplyEvaluator.Verdict::costUsd).orElse(0.0);
                DecisionRecord record = DecisionRecord.of(session, finalRouting, generated.text(),
                    verdict.map(ReplyEvaluator.Verdict::label).orElse(null), basedOn, cost);
                return store.decide(session.id(), record)
                    .doOnNext(this::recordDecided)
                    .flatMap(saved -> dispatchAndTrace(saved, facts.executions()));
            });
        });
    }

    private RoutingDecision guard(Session session, RoutingDecision routing, Reply generated) {
        RoutingDecision guarded = generated.failed() ? routing.downgradeToDraft("reply_generation_failed") : routing;
        if (guarded.decision() == Decision.SEND) {
            Optional<String> violation = responseGuard.check(generated.text());
            if (violation.isPresent()) {
                log.warn("Unsafe reply withheld: session={} violation={}", session.id(), violation.get());
                return guarded.downgradeToDraft("unsafe_reply:" + violation.get());
            }
        }
        return guarded;
    }

    /** Only replies still headed straight to the customer are evaluated. */
    private Mono<Optional<ReplyEvaluator.Verdict>> evaluate(Session session, CycleFacts facts,
                                                            RoutingDecision guarded, String reply,
                                                            List<Message> history) {
        if (guarded.decision() != Decision.SEND) {
            return Mono.just(Optional.empty());
        }
        String customerMessage = history.stream()
            .filter(m -> m.role() == MessageRole.CUSTOMER && m.cycle() == session.cycle())
            .map(Message::content)
            .collect(Collectors.joining("\n"));
        List<String> lookups = facts.executions().stream()
            .filter(exec -> exec.status() == ToolStatus.SUCCESS)
            .map(ToolExecution::toolName)
            .toList();
        return Mono.fromCallable(() -> Optional.of(
                replyEvaluator.evaluate(customerMessage, reply, facts.classification(), lookups)))
            .subscribeOn(Schedulers.boundedElastic());
    }

    private void recordDecided(DecisionRecord record) {
        String category = record.category() != null ? record.category().label() : "none";
        log.info("Decided: session={} cycle={} decision={} reason={} category={}",
            record.sessionId(), record.cycle(), record.decision().label(), record.reason(), category);
        metrics.recordDecision(record.decision().label(), category);
        if (record.decision() == Decision.ESCALATE) {
            metrics.recordEscalation(record.reason(), record.priority().name());
        }
    }

    private Mono<TriageOutcome> dispatchAndTrace(DecisionRecord record, List<ToolExecution> executions) {
        return dispatcher.dispatch(record.sessionId(), record.decision())
            .flatMap(result -> {
                if (!result.performed()) {
                    return Mono.just(TriageOutcome.superseded(record.sessionId(), record.cycle()));
                }
                Session dispatched = result.session();
                metrics.recordCycleDuration(
                    Duration.between(dispatched.cycleStartedAt(), Instant.now()).toMillis() / 1000.0,
                    record.decision().label());
                var outcome = new TriageOutcome(
                    result.status() == DispatchResult.Status.DISPATCHED
                        ? TriageOutcome.Status.DISPATCHED : TriageOutcome.Status.DISPATCH_FAILED,
                    record.sessionId(), record.cycle(), record.decision(), record.reason(), null);
                return traceRecorder.recordCycle(dispatched, record, executions, result.status().name())
                    .then(followUp(dispatched, record, outcome));
            });
    }

    /** Customer messages that arrived while the cycle was being dispatched open the next cycle. */
    private Mono<TriageOutcome> followUp(Session dispatched, DecisionRecord record, TriageOutcome outcome) {
        if (dispatched.lastCustomerSequence() <= record.basedOnSequence()) {
            return Mono.just(outcome);
        }
        return store.update(dispatched.id(), s -> s.cycle() == record.cycle()
                && (s.state() == SessionState.DISPATCHED || s.state() == SessionState.DISPATCH_FAILED)
                && s.lastCustomerSequence() > record.basedOnSequence()
                ? s.nextCycle(Instant.now()) : s)
            .flatMap(s -> {
                if (s.cycle() == record.cycle()) {
                    return Mono.just(outcome);
                }
                log.info("Late customer messages, opening cycle {}: session={}", s.cycle(), s.id());
                return runCycle(s.id(), 0, false);
            });
    }

    private static List<String> customerTexts(List<Message> history, long afterSequence) {
        return history.stream()
            .filter(m -> m.role() == MessageRole.CUSTOMER && m.sequence() > afterSequence)
            .map(Message::content)
            .toList();
    }

    private String toJson(ClassificationResult result) {
        try {
            return mapper.writeValueAsString(result);
        } catch (JsonProcessingException e) {
            throw new TriageException("Unable to serialize classification", e);
        }
    }
}
