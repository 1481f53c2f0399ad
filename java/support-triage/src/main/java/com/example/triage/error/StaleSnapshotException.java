package com.example.triage.error;

/**
 * A commit was computed from a message set that is no longer the latest for its session.
 * The engine recomputes instead of surfacing this.
 */
public class StaleSnapshotException extends TriageException {

    public StaleSnapshotException(String sessionId, long basedOn, long latest) {
        super("Session " + sessionId + " moved past sequence " + basedOn + " (latest " + latest + ")");
    }

    public StaleSnapshotException(String message) {
        super(message);
    }
}
