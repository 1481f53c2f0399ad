package com.example.triage.model;

/**
 * Result of a reviewer decision. {@code superseded} means the session had already moved on,
 * so the outcome was recorded for audit only and nothing was executed.
 */
public record ApprovalResolution(ToolExecution execution, boolean superseded) {

    public static final String SUPERSEDED_NOTE = "superseded";
}
