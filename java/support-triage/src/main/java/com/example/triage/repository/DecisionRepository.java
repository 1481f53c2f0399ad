package com.example.triage.repository;

import java.util.UUID;

import org.springframework.data.repository.reactive.ReactiveCrudRepository;

import com.example.triage.model.DecisionRecord;

import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

public interface DecisionRepository extends ReactiveCrudRepository<DecisionRecord, UUID> {

    Mono<DecisionRecord> findBySessionIdAndCycle(String sessionId, int cycle);

    Flux<DecisionRecord> findBySessionIdOrderByCycleAsc(String sessionId);
}
