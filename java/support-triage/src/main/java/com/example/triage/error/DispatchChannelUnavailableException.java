package com.example.triage.error;

public class DispatchChannelUnavailableException extends TriageException {

    public DispatchChannelUnavailableException(String operation, Throwable cause) {
        super("Channel unavailable during " + operation + ": "
            + (cause != null ? cause.getMessage() : "unknown"), cause);
    }
}
