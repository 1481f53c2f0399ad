package com.example.triage.repository;

import org.springframework.data.r2dbc.repository.Modifying;
import org.springframework.data.r2dbc.repository.Query;
import org.springframework.data.repository.reactive.ReactiveCrudRepository;

import com.example.triage.model.Session;
import com.example.triage.model.SessionState;

import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

public interface SessionRepository extends ReactiveCrudRepository<Session, String> {

    Flux<Session> findByStateOrderByUpdatedAtAsc(SessionState state);

    @Modifying
    @Query("INSERT INTO sessions (id, channel, customer_id, conversation_ref, state, cycle, " +
           "last_sequence, last_customer_sequence, classified_through, dispatch_step, " +
           "cycle_started_at, created_at, updated_at, version) " +
           "VALUES (:id, :channel, :customerId, :conversationRef, 'RECEIVED', 1, 0, 0, 0, 0, " +
           "NOW(), NOW(), NOW(), 0) ON CONFLICT (id) DO NOTHING")
    Mono<Integer> insertIfAbsent(String id, String channel, String customerId, String conversationRef);

    @Query("SELECT * FROM sessions WHERE id = :id FOR UPDATE")
    Mono<Session> lockById(String id);
}
