package com.example.triage.controller;

import java.util.UUID;

import org.springframework.http.HttpStatus;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;
import org.springframework.web.server.ResponseStatusException;

import com.example.triage.model.ApprovalOutcome;
import com.example.triage.model.ToolExecution;
import com.example.triage.model.ToolExecutionEvent;
import com.example.triage.service.ApprovalService;
import com.example.triage.service.SessionQueryService;

import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

@RestController
@RequestMapping("/api/approvals")
public class ApprovalController {

    private final ApprovalService approvals;
    private final SessionQueryService queries;

    public ApprovalController(ApprovalService approvals, SessionQueryService queries) {
        this.approvals = approvals;
        this.queries = queries;
    }

    public record ResolveRequest(String outcome, String reviewer, String note) {}

    @GetMapping
    public Flux<ToolExecution> pending() {
        return approvals.listPending();
    }

    @GetMapping("/{id}/history")
    public Flux<ToolExecutionEvent> history(@PathVariable UUID id) {
        return queries.executionHistory(id);
    }

    @PostMapping("/{id}")
    public Mono<ApprovalService.ApprovalResult> resolve(@PathVariable UUID id, @RequestBody ResolveRequest request) {
        if (request.reviewer() == null || request.reviewer().isBlank()) {
            return Mono.error(new ResponseStatusException(HttpStatus.BAD_REQUEST, "reviewer is required"));
        }
        return Mono.fromCallable(() -> ApprovalOutcome.parse(request.outcome()))
            .flatMap(outcome -> approvals.resolve(id, outcome, request.reviewer(), request.note()));
    }
}
