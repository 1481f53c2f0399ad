package com.example.triage.model;

import java.math.BigDecimal;
import java.time.Instant;

import org.springframework.data.annotation.Id;
import org.springframework.data.relational.core.mapping.Table;

@Table("trace_records")
public record TraceRecord(
    @Id Long id,
    String sessionId,
    int cycle,
    TraceKind kind,
    Decision decision,
    Category category,
    Double confidence,
    String toolExecutions,
    BigDecimal costUsd,
    Long durationMs,
    String dispatchStatus,
    String evaluation,
    Instant recordedAt
) {}
