package com.example.triage.service;

import java.time.Instant;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

import com.example.triage.config.TriageProperties;
import com.example.triage.error.ApprovalNotPendingException;
import com.example.triage.model.ApprovalOutcome;
import com.example.triage.store.SessionStore;
import com.example.triage.tools.ToolExecutor;

import reactor.core.publisher.Mono;

/** Rejects approvals nobody acted on within the configured timeout, so parked sessions escalate. */
@Component
public class ApprovalTimeoutSweeper {

    private static final Logger log = LoggerFactory.getLogger(ApprovalTimeoutSweeper.class);

    static final String TIMEOUT_NOTE = "approval_timeout";

    private final SessionStore store;
    private final ApprovalService approvals;
    private final TriageProperties properties;

    public ApprovalTimeoutSweeper(SessionStore store, ApprovalService approvals, TriageProperties properties) {
        this.store = store;
        this.approvals = approvals;
        this.properties = properties;
    }

    @Scheduled(fixedDelayString = "${app.triage.approval-sweep-interval:PT5M}",
               initialDelayString = "${app.triage.approval-sweep-interval:PT5M}")
    public void sweep() {
        Long expired = sweepOnce(Instant.now()).block();
        if (expired != null && expired > 0) {
            log.info("Approval sweep rejected {} expired executions", expired);
        }
    }

    /** Rejects every execution still pending since before {@code now - approvalTimeout}. */
    public Mono<Long> sweepOnce(Instant now) {
        Instant cutoff = now.minus(properties.approvalTimeout());
        return store.pendingOlderThan(cutoff)
            .concatMap(exec -> approvals.resolve(exec.id(), ApprovalOutcome.REJECTED, ToolExecutor.SYSTEM_ACTOR, TIMEOUT_NOTE)
                .doOnNext(result -> log.warn("Approval timed out: execution={} session={} tool={}",
                    exec.id(), exec.sessionId(), exec.toolName()))
                .onErrorResume(ApprovalNotPendingException.class, e -> {
                    log.info("Approval resolved before timeout: execution={}", exec.id());
                    return Mono.empty();
                }))
            .count();
    }
}
