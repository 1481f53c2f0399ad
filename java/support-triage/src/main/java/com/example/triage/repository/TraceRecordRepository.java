package com.example.triage.repository;

import org.springframework.data.r2dbc.repository.Query;
import org.springframework.data.repository.reactive.ReactiveCrudRepository;

import com.example.triage.model.TraceRecord;

import reactor.core.publisher.Flux;

public interface TraceRecordRepository extends ReactiveCrudRepository<TraceRecord, Long> {

    @Query("SELECT * FROM trace_records WHERE id > :after ORDER BY id ASC LIMIT :limit")
    Flux<TraceRecord> findAfter(long after, int limit);

    Flux<TraceRecord> findBySessionIdOrderByIdAsc(String sessionId);
}
