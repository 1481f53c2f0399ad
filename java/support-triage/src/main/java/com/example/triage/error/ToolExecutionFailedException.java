package com.example.triage.error;

public class ToolExecutionFailedException extends TriageException {

    private final String toolName;

    public ToolExecutionFailedException(String toolName, String reason) {
        super("Tool " + toolName + " failed: " + reason);
        this.toolName = toolName;
    }

    public ToolExecutionFailedException(String toolName, String reason, Throwable cause) {
        super("Tool " + toolName + " failed: " + reason, cause);
        this.toolName = toolName;
    }

    public String toolName() {
        return toolName;
    }
}
