package com.example.triage.error;

public class UnknownToolException extends TriageException {

    public UnknownToolException(String toolName) {
        super("Unknown tool: " + toolName);
    }
}
