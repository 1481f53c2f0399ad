package com.example.triage.model;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.UUID;

import org.springframework.data.annotation.Id;
import org.springframework.data.relational.core.mapping.Table;

/** The terminal decision of one session cycle. Unique per (session, cycle); never updated. */
@Table("decisions")
public record DecisionRecord(
    @Id UUID id,
    String sessionId,
    int cycle,
    Decision decision,
    String reason,
    EscalationPriority priority,
    Category category,
    Double confidence,
    String replyText,
    String evaluation,
    long basedOnSequence,
    BigDecimal costUsd,
    Instant decidedAt
) {
    /** {@code evaluation} is the reply evaluator's verdict label, null when the reply was not evaluated. */
    public static DecisionRecord of(Session session, RoutingDecision routing, String replyText, String evaluation,
                                    long basedOnSequence, double costUsd) {
        return new DecisionRecord(null, session.id(), session.cycle(), routing.decision(), routing.reason(),
            routing.priority(), session.category(), session.confidence(), replyText, evaluation, basedOnSequence,
            BigDecimal.valueOf(costUsd), Instant.now());
    }
}
