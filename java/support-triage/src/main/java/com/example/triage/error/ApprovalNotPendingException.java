package com.example.triage.error;

import java.util.UUID;

import com.example.triage.model.ToolStatus;

public class ApprovalNotPendingException extends TriageException {

    public ApprovalNotPendingException(UUID executionId, ToolStatus current) {
        super("Tool execution " + executionId + " is " + current + ", not PENDING");
    }
}
