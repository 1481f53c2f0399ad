package com.example.triage.config;

import java.time.Duration;

import org.springframework.boot.context.properties.ConfigurationProperties;

@ConfigurationProperties(prefix = "app.triage")
public record TriageProperties(
    double classifierConfidenceThreshold,
    double autoSendConfidence,
    Duration approvalTimeout,
    Duration approvalSweepInterval,
    int maxStaleRestarts,
    Dispatch dispatch
) {

    public TriageProperties {
        if (classifierConfidenceThreshold <= 0) classifierConfidenceThreshold = 0.6;
        if (autoSendConfidence <= 0) autoSendConfidence = 0.8;
        if (approvalTimeout == null) approvalTimeout = Duration.ofHours(24);
        if (approvalSweepInterval == null) approvalSweepInterval = Duration.ofMinutes(5);
        if (maxStaleRestarts <= 0) maxStaleRestarts = 3;
        if (dispatch == null) dispatch = new Dispatch(0, null, null, null);
    }

    /**
     * Channel-write retry policy; a write is attempted at most {@code maxAttempts} times. A session
     * left DISPATCHING without progress for {@code staleAfter} is marked DISPATCH_FAILED.
     */
    public record Dispatch(int maxAttempts, Duration minBackoff, Duration maxBackoff, Duration staleAfter) {

        public Dispatch {
            if (maxAttempts <= 0) maxAttempts = 4;
            if (minBackoff == null) minBackoff = Duration.ofMillis(500);
            if (maxBackoff == null) maxBackoff = Duration.ofSeconds(8);
            if (staleAfter == null) staleAfter = Duration.ofMinutes(10);
        }
    }

    public static TriageProperties defaults() {
        return new TriageProperties(0, 0, null, null, 0, null);
    }
}
