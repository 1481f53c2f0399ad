package com.example.triage.repository;

import java.util.UUID;

import org.springframework.data.repository.reactive.ReactiveCrudRepository;

import com.example.triage.model.ToolExecutionEvent;

import reactor.core.publisher.Flux;

public interface ToolExecutionEventRepository extends ReactiveCrudRepository<ToolExecutionEvent, Long> {

    Flux<ToolExecutionEvent> findByExecutionIdOrderByIdAsc(UUID executionId);
}
