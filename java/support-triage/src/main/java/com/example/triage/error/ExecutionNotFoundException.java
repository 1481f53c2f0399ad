package com.example.triage.error;

import java.util.UUID;

public class ExecutionNotFoundException extends TriageException {

    public ExecutionNotFoundException(UUID executionId) {
        super("Tool execution not found: " + executionId);
    }
}
