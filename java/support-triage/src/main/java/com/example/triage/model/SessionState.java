package com.example.triage.model;

import java.util.EnumSet;
import java.util.Set;

/**
 * Lifecycle of one decision cycle. DISPATCHING is held between the dispatch claim
 * and the last confirmed channel write.
 */
public enum SessionState {
    RECEIVED,
    CLASSIFIED,
    TOOL_PENDING,
    DECIDED,
    DISPATCHING,
    DISPATCHED,
    DISPATCH_FAILED;

    public Set<SessionState> successors() {
        return switch (this) {
            case RECEIVED -> EnumSet.of(CLASSIFIED, DECIDED);
            case CLASSIFIED -> EnumSet.of(CLASSIFIED, TOOL_PENDING, DECIDED);
            case TOOL_PENDING -> EnumSet.of(TOOL_PENDING, DECIDED);
            case DECIDED -> EnumSet.of(DISPATCHING);
            case DISPATCHING -> EnumSet.of(DISPATCHED, DISPATCH_FAILED);
            case DISPATCHED -> EnumSet.of(RECEIVED);
            case DISPATCH_FAILED -> EnumSet.of(DISPATCHING, RECEIVED);
        };
    }

    public boolean canTransitionTo(SessionState next) {
        return successors().contains(next);
    }

    /** True once the cycle's decision is fixed; no further decision-state transitions apply. */
    public boolean isDecided() {
        return this == DECIDED || this == DISPATCHING || this == DISPATCHED || this == DISPATCH_FAILED;
    }
}
