package com.example.triage.store;

import java.time.Instant;
import java.util.List;
import java.util.UUID;

import io.r2dbc.spi.ConnectionFactory;

import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.data.r2dbc.DataR2dbcTest;
import org.springframework.boot.test.context.TestConfiguration;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Import;
import org.springframework.r2dbc.connection.R2dbcTransactionManager;
import org.springframework.test.context.DynamicPropertyRegistry;
import org.springframework.test.context.DynamicPropertySource;
import org.springframework.transaction.ReactiveTransactionManager;
import org.springframework.transaction.reactive.TransactionalOperator;
import org.testcontainers.containers.PostgreSQLContainer;
import org.testcontainers.junit.jupiter.Container;
import org.testcontainers.junit.jupiter.Testcontainers;

import com.example.triage.error.StaleSnapshotException;
import com.example.triage.model.ApprovalOutcome;
import com.example.triage.model.ApprovalResolution;
import com.example.triage.model.Category;
import com.example.triage.model.DecisionRecord;
import com.example.triage.model.InboundAppend;
import com.example.triage.model.InboundEvent;
import com.example.triage.model.Message;
import com.example.triage.model.RoutingDecision;
import com.example.triage.model.Session;
import com.example.triage.model.SessionState;
import com.example.triage.model.ToolExecution;
import com.example.triage.model.ToolExecutionEvent;
import com.example.triage.model.ToolStatus;

import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Schedulers;
import reactor.test.StepVerifier;

import static org.junit.jupiter.api.Assertions.*;

/** Runs the store against PostgreSQL so row locks, versions and unique keys are the real ones. */
@DataR2dbcTest
@Testcontainers(disabledWithoutDocker = true)
@Import({R2dbcSessionStore.class, R2dbcSessionStoreTest.StoreConfig.class})
class R2dbcSessionStoreTest {

    @Container
    static PostgreSQLContainer<?> postgres = new PostgreSQLContainer<>("postgres:15-alpine")
        .withDatabaseName("triage_test")
        .withUsername("test")
        .withPassword("test");

    @DynamicPropertySource
    static void r2dbc(DynamicPropertyRegistry registry) {
        registry.add("spring.r2dbc.url", () -> "r2dbc:postgresql://" + postgres.getHost() + ":"
            + postgres.getFirstMappedPort() + "/" + postgres.getDatabaseName());
        registry.add("spring.r2dbc.username", postgres::getUsername);
        registry.add("spring.r2dbc.password", postgres::getPassword);
        registry.add("spring.sql.init.mode", () -> "always");
    }

    @TestConfiguration
    static class StoreConfig {

        @Bean
        ReactiveTransactionManager transactionManager(ConnectionFactory connectionFactory) {
            return new R2dbcTransactionManager(connectionFactory);
        }

        @Bean
        TransactionalOperator transactionalOperator(ReactiveTransactionManager transactionManager) {
            return TransactionalOperator.create(transactionManager);
        }
    }

    @Autowired
    private R2dbcSessionStore store;

    private static String newSession() {
        return "cw_" + UUID.randomUUID();
    }

    private static InboundEvent event(String sessionId, String eventId, String text) {
        return new InboundEvent(eventId, sessionId, "chatwoot", text, "jane@example.com", "42");
    }

    private Session classified(String sessionId) {
        store.appendInbound(event(sessionId, "e-1", "Where is my box?")).block();
        return store.update(sessionId, s -> s.classified(Category.TRACKING, 0.9, "{}", s.lastCustomerSequence(),
            Instant.now())).block();
    }

    @Test
    void redeliveredEventIsStoredOnce() {
        String id = newSession();
        store.appendInbound(event(id, "e-1", "Where is my box?")).block();
        store.appendInbound(event(id, "e-2", "It was due Monday")).block();

        StepVerifier.create(store.appendInbound(event(id, "e-1", "Where is my box?")))
            .assertNext(append -> {
                assertTrue(append.duplicate());
                assertEquals(1, append.message().sequence());
            })
            .verifyComplete();

        List<Long> sequences = store.history(id).map(Message::sequence).collectList().block();
        assertEquals(List.of(1L, 2L), sequences);
        assertEquals(2, store.find(id).block().lastCustomerSequence());
    }

    @Test
    void concurrentAppendsGetDistinctSequences() {
        String id = newSession();
        List<InboundAppend> appends = Flux.range(1, 8)
            .flatMap(n -> store.appendInbound(event(id, "e-" + n, "message " + n)).subscribeOn(Schedulers.parallel()))
            .collectList()
            .block();

        assertEquals(8, appends.size());
        assertTrue(appends.stream().noneMatch(InboundAppend::duplicate));
        List<Long> sequences = store.history(id).map(Message::sequence).collectList().block();
        assertEquals(List.of(1L, 2L, 3L, 4L, 5L, 6L, 7L, 8L), sequences);
        assertEquals(8, store.find(id).block().lastSequence());
    }

    @Test
    void concurrentDecisionsForOneCycleCommitOnce() {
        String id = newSession();
        Session session = classified(id);
        DecisionRecord record = DecisionRecord.of(session, RoutingDecision.send("auto_send"), "Ships Monday.",
            "send:high", session.lastCustomerSequence(), 0.001);

        List<Boolean> outcomes = Flux.range(1, 2)
            .flatMap(n -> store.decide(id, record)
                .map(saved -> true)
                .onErrorResume(StaleSnapshotException.class, e -> Mono.just(false))
                .subscribeOn(Schedulers.parallel()))
            .collectList()
            .block();

        assertEquals(1, outcomes.stream().filter(Boolean::booleanValue).count());
        assertEquals(SessionState.DECIDED, store.find(id).block().state());
        assertEquals(1L, store.decisions(id).count().block());
        assertEquals("send:high", store.decision(id, session.cycle()).block().evaluation());
    }

    @Test
    void dispatchClaimIsHeldByOneToken() {
        String id = newSession();
        Session session = classified(id);
        DecisionRecord record = DecisionRecord.of(session, RoutingDecision.send("auto_send"), "Ships Monday.",
            null, session.lastCustomerSequence(), 0.001);
        store.decide(id, record).block();

        assertTrue(store.claimDispatch(id, "token-1").block().claimed());
        assertFalse(store.claimDispatch(id, "token-1").block().claimed());
        assertEquals(SessionState.DISPATCHING, store.find(id).block().state());
    }

    @Test
    void approvalAfterDecisionIsRecordedAsSuperseded() {
        String id = newSession();
        Session session = classified(id);
        ToolExecution pending = store.createExecution(
            ToolExecution.pending(id, session.cycle(), "cancel_subscription", "{}"), "engine").block();
        store.decide(id, DecisionRecord.of(session, RoutingDecision.draft("not_auto_send"), "Draft",
            null, session.lastCustomerSequence(), 0.0)).block();

        StepVerifier.create(store.resolveApproval(pending.id(), ApprovalOutcome.APPROVED, "alice", null))
            .assertNext(resolution -> {
                assertTrue(resolution.superseded());
                assertEquals(ToolStatus.APPROVED, resolution.execution().status());
            })
            .verifyComplete();

        List<ToolExecutionEvent> history = store.executionHistory(pending.id()).collectList().block();
        assertEquals(List.of(ToolStatus.PENDING, ToolStatus.APPROVED),
            history.stream().map(ToolExecutionEvent::status).toList());
        assertEquals(ApprovalResolution.SUPERSEDED_NOTE, history.get(1).note());
    }
}
