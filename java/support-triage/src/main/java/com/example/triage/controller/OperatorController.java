package com.example.triage.controller;

import java.time.Instant;
import java.util.Map;

import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import com.example.triage.dispatch.DispatchResult;
import com.example.triage.model.Session;
import com.example.triage.service.OperatorService;

import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

@RestController
@RequestMapping("/api/operator")
public class OperatorController {

    private final OperatorService operator;

    public OperatorController(OperatorService operator) {
        this.operator = operator;
    }

    public record RedispatchResponse(String sessionId, String status, String failureReason) {}

    @GetMapping("/dispatch-failures")
    public Flux<Session> failures() {
        return operator.dispatchFailures();
    }

    /** Marks stalled dispatches failed now instead of waiting for the sweep. */
    @PostMapping("/stale-dispatches/fail")
    public Mono<Map<String, Long>> failStale() {
        return operator.failStaleDispatches(Instant.now()).map(count -> Map.of("failed", count));
    }

    @PostMapping("/sessions/{id}/redispatch")
    public Mono<RedispatchResponse> redispatch(@PathVariable String id) {
        return operator.redispatch(id)
            .map(result -> new RedispatchResponse(id, result.status().name(), result.failureReason()));
    }
}
