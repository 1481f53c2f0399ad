package com.example.triage.service;

import java.time.Instant;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

/** Periodically hands stalled dispatches to the operator queue. */
@Component
public class StaleDispatchSweeper {

    private static final Logger log = LoggerFactory.getLogger(StaleDispatchSweeper.class);

    private final OperatorService operator;

    public StaleDispatchSweeper(OperatorService operator) {
        this.operator = operator;
    }

    @Scheduled(fixedDelayString = "${app.triage.dispatch-sweep-interval:PT1M}",
               initialDelayString = "${app.triage.dispatch-sweep-interval:PT1M}")
    public void sweep() {
        Long stale = operator.failStaleDispatches(Instant.now()).block();
        if (stale != null && stale > 0) {
            log.info("Dispatch sweep marked {} stale sessions failed", stale);
        }
    }
}
