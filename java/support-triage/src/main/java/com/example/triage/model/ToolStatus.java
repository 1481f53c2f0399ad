package com.example.triage.model;

import java.util.EnumSet;
import java.util.Set;

public enum ToolStatus {
    PENDING,
    APPROVED,
    REJECTED,
    SUCCESS,
    FAILED;

    public Set<ToolStatus> successors() {
        return switch (this) {
            case PENDING -> EnumSet.of(APPROVED, REJECTED);
            case APPROVED -> EnumSet.of(SUCCESS, FAILED);
            case REJECTED, SUCCESS, FAILED -> EnumSet.noneOf(ToolStatus.class);
        };
    }

    public boolean canTransitionTo(ToolStatus next) {
        return successors().contains(next);
    }

    public boolean isTerminal() {
        return successors().isEmpty();
    }
}
