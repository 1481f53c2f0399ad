package com.example.triage.model;

import java.util.Locale;

public enum ApprovalOutcome {
    APPROVED,
    REJECTED;

    public static ApprovalOutcome parse(String value) {
        if (value == null) {
            throw new IllegalArgumentException("Approval outcome is required");
        }
        return switch (value.strip().toLowerCase(Locale.ROOT)) {
            case "approved", "approve" -> APPROVED;
            case "rejected", "reject" -> REJECTED;
            default -> throw new IllegalArgumentException("Unknown approval outcome: " + value);
        };
    }

    public ToolStatus status() {
        return this == APPROVED ? ToolStatus.APPROVED : ToolStatus.REJECTED;
    }
}
