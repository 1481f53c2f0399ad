package com.example.triage.error;

/** The channel refused a write outright; repeating the same request cannot succeed. */
public class DispatchRejectedException extends TriageException {

    private final int status;

    public DispatchRejectedException(String operation, int status, Throwable cause) {
        super("Channel rejected " + operation + " with status " + status, cause);
        this.status = status;
    }

    public int status() {
        return status;
    }
}
