package com.example.triage.dispatch;

import com.example.triage.model.Session;

public record DispatchResult(Status status, Session session, String failureReason) {

    public enum Status { DISPATCHED, ALREADY_DISPATCHED, FAILED }

    public static DispatchResult dispatched(Session session) {
        return new DispatchResult(Status.DISPATCHED, session, null);
    }

    public static DispatchResult alreadyDispatched(Session session) {
        return new DispatchResult(Status.ALREADY_DISPATCHED, session, null);
    }

    public static DispatchResult failed(Session session, String reason) {
        return new DispatchResult(Status.FAILED, session, reason);
    }

    /** True when this call performed the channel writes (or tried to), not a repeated call. */
    public boolean performed() {
        return status != Status.ALREADY_DISPATCHED;
    }
}
