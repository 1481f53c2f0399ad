package com.example.triage.model;

import java.time.Instant;
import java.util.UUID;

import org.springframework.data.annotation.Id;
import org.springframework.data.relational.core.mapping.Table;

/** Append-only status history of a tool execution. */
@Table("tool_execution_events")
public record ToolExecutionEvent(
    @Id Long id,
    UUID executionId,
    ToolStatus status,
    String actor,
    String note,
    Instant occurredAt
) {
    public static ToolExecutionEvent of(UUID executionId, ToolStatus status, String actor, String note) {
        return new ToolExecutionEvent(null, executionId, status, actor, note, Instant.now());
    }
}
