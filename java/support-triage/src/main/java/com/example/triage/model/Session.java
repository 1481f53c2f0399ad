package com.example.triage.model;

import java.time.Duration;
import java.time.Instant;

import org.springframework.data.annotation.Id;
import org.springframework.data.annotation.Version;
import org.springframework.data.relational.core.mapping.Table;

import com.example.triage.error.IllegalTransitionException;
import com.example.triage.error.StaleSnapshotException;

/**
 * One support conversation thread. Immutable; every lifecycle step returns a new
 * instance and validates the transition against {@link SessionState}.
 * Sequence numbers are authoritative for ordering; {@code lastCustomerSequence}
 * is the watermark decision commits are checked against.
 */
@Table("sessions")
public record Session(
    @Id String id,
    String channel,
    String customerId,
    String conversationRef,
    Category category,
    Double confidence,
    String classification,
    SessionState state,
    Decision decision,
    int cycle,
    long lastSequence,
    long lastCustomerSequence,
    long classifiedThrough,
    String dispatchToken,
    int dispatchStep,
    Long firstResponseMs,
    Long resolutionMs,
    Instant cycleStartedAt,
    Instant createdAt,
    Instant updatedAt,
    @Version Long version
) {

    public static Session open(String id, String channel, String customerId, String conversationRef, Instant now) {
        return new Session(id, channel, customerId, conversationRef, null, null, null,
            SessionState.RECEIVED, null, 1, 0, 0, 0, null, 0, null, null, now, now, now, null);
    }

    /**
     * Assigns the next sequence number to an arriving message. A customer message on a
     * session whose cycle is already dispatched opens the next cycle.
     */
    public Session withInbound(MessageRole role, String knownCustomerId, Instant now) {
        long seq = lastSequence + 1;
        String customer = customerId != null ? customerId : knownCustomerId;
        if (role != MessageRole.CUSTOMER) {
            return new Session(id, channel, customer, conversationRef, category, confidence, classification,
                state, decision, cycle, seq, lastCustomerSequence, classifiedThrough, dispatchToken,
                dispatchStep, firstResponseMs, resolutionMs, cycleStartedAt, createdAt, now, version);
        }
        if (state == SessionState.DISPATCHED || state == SessionState.DISPATCH_FAILED) {
            return new Session(id, channel, customer, conversationRef, null, null, null,
                SessionState.RECEIVED, null, cycle + 1, seq, seq, classifiedThrough, null,
                0, firstResponseMs, resolutionMs, now, createdAt, now, version);
        }
        return new Session(id, channel, customer, conversationRef, category, confidence, classification,
            state, decision, cycle, seq, seq, classifiedThrough, dispatchToken,
            dispatchStep, firstResponseMs, resolutionMs, cycleStartedAt, createdAt, now, version);
    }

    /** Opens a new cycle for customer messages that arrived while the previous one was being decided. */
    public Session nextCycle(Instant now) {
        require(SessionState.RECEIVED);
        return new Session(id, channel, customerId, conversationRef, null, null, null,
            SessionState.RECEIVED, null, cycle + 1, lastSequence, lastCustomerSequence, classifiedThrough, null,
            0, firstResponseMs, resolutionMs, now, createdAt, now, version);
    }

    public Session classified(Category newCategory, double newConfidence, String classificationJson,
                              long basedOnSequence, Instant now) {
        if (state.isDecided()) {
            throw new StaleSnapshotException("Session " + id + " cycle " + cycle + " is already " + state);
        }
        if (basedOnSequence < lastCustomerSequence) {
            throw new StaleSnapshotException(id, basedOnSequence, lastCustomerSequence);
        }
        if (classifiedThrough >= basedOnSequence && classification != null) {
            return this;
        }
        SessionState next = state == SessionState.TOOL_PENDING ? SessionState.TOOL_PENDING : SessionState.CLASSIFIED;
        require(next);
        return new Session(id, channel, customerId, conversationRef, newCategory, newConfidence, classificationJson,
            next, decision, cycle, lastSequence, lastCustomerSequence, basedOnSequence, dispatchToken,
            dispatchStep, firstResponseMs, resolutionMs, cycleStartedAt, createdAt, now, version);
    }

    public Session parked(Instant now) {
        require(SessionState.TOOL_PENDING);
        return withState(SessionState.TOOL_PENDING, now);
    }

    public Session decided(Decision value, int forCycle, long basedOnSequence, Instant now) {
        if (state.isDecided() || forCycle != cycle) {
            throw new StaleSnapshotException("Session " + id + " cycle " + forCycle + " already decided or superseded");
        }
        if (basedOnSequence < lastCustomerSequence) {
            throw new StaleSnapshotException(id, basedOnSequence, lastCustomerSequence);
        }
        require(SessionState.DECIDED);
        return new Session(id, channel, customerId, conversationRef, category, confidence, classification,
            SessionState.DECIDED, value, cycle, lastSequence, lastCustomerSequence, classifiedThrough, null,
            0, firstResponseMs, resolutionMs, cycleStartedAt, createdAt, now, version);
    }

    /** True when this session already carries the given dispatch token. */
    public boolean holdsDispatch(String token) {
        return token != null && token.equals(dispatchToken);
    }

    public Session claimDispatch(String token, Instant now) {
        if (state != SessionState.DECIDED) {
            throw new IllegalTransitionException("Session " + id + " is " + state + ", cannot claim dispatch " + token);
        }
        return new Session(id, channel, customerId, conversationRef, category, confidence, classification,
            SessionState.DISPATCHING, decision, cycle, lastSequence, lastCustomerSequence, classifiedThrough, token,
            0, firstResponseMs, resolutionMs, cycleStartedAt, createdAt, now, version);
    }

    public Session reopenDispatch(Instant now) {
        require(SessionState.DISPATCHING);
        return withState(SessionState.DISPATCHING, now);
    }

    public Session dispatchStepCompleted(int completedSteps, Instant now) {
        if (state != SessionState.DISPATCHING) {
            throw new IllegalTransitionException("Session " + id + " is " + state + ", not dispatching");
        }
        int steps = Math.max(dispatchStep, completedSteps);
        return new Session(id, channel, customerId, conversationRef, category, confidence, classification,
            state, decision, cycle, lastSequence, lastCustomerSequence, classifiedThrough, dispatchToken,
            steps, firstResponseMs, resolutionMs, cycleStartedAt, createdAt, now, version);
    }

    /**
     * Marks the cycle dispatched. Only a reply the customer sees counts as a response: drafts
     * and escalations leave first-response and resolution times untouched.
     */
    public Session dispatched(Instant now) {
        require(SessionState.DISPATCHED);
        Long firstResponse = firstResponseMs;
        Long resolution = resolutionMs;
        if (decision == Decision.SEND) {
            long elapsed = Duration.between(createdAt, now).toMillis();
            firstResponse = firstResponseMs != null ? firstResponseMs : elapsed;
            resolution = elapsed;
        }
        return new Session(id, channel, customerId, conversationRef, category, confidence, classification,
            SessionState.DISPATCHED, decision, cycle, lastSequence, lastCustomerSequence, classifiedThrough,
            dispatchToken, dispatchStep, firstResponse, resolution, cycleStartedAt, createdAt, now, version);
    }

    public Session dispatchFailed(Instant now) {
        require(SessionState.DISPATCH_FAILED);
        return withState(SessionState.DISPATCH_FAILED, now);
    }

    /**
     * Gives up a dispatch that confirmed no write since {@code cutoff}. A live dispatch moves
     * {@code updatedAt} with every confirmed step.
     */
    public Session abandonDispatch(Instant cutoff, Instant now) {
        if (state != SessionState.DISPATCHING || updatedAt.isAfter(cutoff)) {
            throw new IllegalTransitionException("Session " + id + " is " + state + " since " + updatedAt
                + ", not a stale dispatch");
        }
        return dispatchFailed(now);
    }

    /** True once the session decided or moved past the cycle that requested {@code execution}. */
    public boolean supersedes(ToolExecution execution) {
        return cycle != execution.cycle() || state.isDecided();
    }

    public boolean hasPriorCycle() {
        return cycle > 1;
    }

    private Session withState(SessionState next, Instant now) {
        return new Session(id, channel, customerId, conversationRef, category, confidence, classification,
            next, decision, cycle, lastSequence, lastCustomerSequence, classifiedThrough, dispatchToken,
            dispatchStep, firstResponseMs, resolutionMs, cycleStartedAt, createdAt, now, version);
    }

    private void require(SessionState next) {
        if (!state.canTransitionTo(next)) {
            throw new IllegalTransitionException("Session " + id, state, next);
        }
    }
}
