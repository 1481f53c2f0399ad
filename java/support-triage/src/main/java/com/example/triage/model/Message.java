package com.example.triage.model;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.UUID;

import org.springframework.data.annotation.Id;
import org.springframework.data.relational.core.mapping.Table;

/**
 * One message in a session. {@code sequence} is assigned by the store and is the only
 * ordering that counts; {@code eventId} deduplicates inbound redeliveries.
 */
@Table("messages")
public record Message(
    @Id UUID id,
    String sessionId,
    int cycle,
    long sequence,
    MessageRole role,
    String content,
    String eventId,
    boolean customerVisible,
    BigDecimal costUsd,
    Long latencyMs,
    Instant createdAt
) {
    public static Message customer(String sessionId, String content, String eventId) {
        return new Message(null, sessionId, 0, 0, MessageRole.CUSTOMER, content, eventId,
            true, null, null, Instant.now());
    }

    public static Message assistant(String sessionId, String content, boolean customerVisible,
                                    double costUsd, long latencyMs) {
        return new Message(null, sessionId, 0, 0, MessageRole.ASSISTANT, content, null,
            customerVisible, BigDecimal.valueOf(costUsd), latencyMs, Instant.now());
    }

    public static Message system(String sessionId, String content) {
        return new Message(null, sessionId, 0, 0, MessageRole.SYSTEM, content, null,
            false, null, null, Instant.now());
    }

    public Message sequenced(int assignedCycle, long assignedSequence) {
        return new Message(id, sessionId, assignedCycle, assignedSequence, role, content, eventId,
            customerVisible, costUsd, latencyMs, createdAt);
    }
}
