package com.example.triage.error;

public class IllegalTransitionException extends TriageException {

    public IllegalTransitionException(String entity, Object from, Object to) {
        super(entity + " cannot move from " + from + " to " + to);
    }

    public IllegalTransitionException(String message) {
        super(message);
    }
}
