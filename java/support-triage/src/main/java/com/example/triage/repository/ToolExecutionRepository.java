package com.example.triage.repository;

import java.time.Instant;
import java.util.UUID;

import org.springframework.data.repository.reactive.ReactiveCrudRepository;

import com.example.triage.model.ToolExecution;
import com.example.triage.model.ToolStatus;

import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

public interface ToolExecutionRepository extends ReactiveCrudRepository<ToolExecution, UUID> {

    Flux<ToolExecution> findBySessionIdAndCycleOrderByCreatedAtAsc(String sessionId, int cycle);

    Flux<ToolExecution> findBySessionIdOrderByCreatedAtAsc(String sessionId);

    Mono<ToolExecution> findBySessionIdAndCycleAndToolName(String sessionId, int cycle, String toolName);

    Flux<ToolExecution> findByStatusOrderByCreatedAtAsc(ToolStatus status);

    Flux<ToolExecution> findByStatusAndCreatedAtBefore(ToolStatus status, Instant cutoff);
}
