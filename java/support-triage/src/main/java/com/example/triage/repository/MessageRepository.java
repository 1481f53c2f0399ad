package com.example.triage.repository;

import java.util.UUID;

import org.springframework.data.repository.reactive.ReactiveCrudRepository;

import com.example.triage.model.Message;

import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

public interface MessageRepository extends ReactiveCrudRepository<Message, UUID> {

    Flux<Message> findBySessionIdOrderBySequenceAsc(String sessionId);

    Mono<Message> findBySessionIdAndEventId(String sessionId, String eventId);
}
