package com.example.triage.error;

public class SessionNotFoundException extends TriageException {

    public SessionNotFoundException(String sessionId) {
        super("Session not found: " + sessionId);
    }
}
