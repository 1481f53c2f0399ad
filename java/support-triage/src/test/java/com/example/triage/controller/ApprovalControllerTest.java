package com.example.triage.controller;

import java.util.Map;
import java.util.UUID;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.http.MediaType;
import org.springframework.test.web.reactive.server.WebTestClient;

import com.example.triage.error.ApprovalNotPendingException;
import com.example.triage.error.ExecutionNotFoundException;
import com.example.triage.error.UnknownToolException;
import com.example.triage.model.ApprovalOutcome;
import com.example.triage.model.ToolExecution;
import com.example.triage.model.ToolStatus;
import com.example.triage.service.ApprovalService;
import com.example.triage.service.SessionQueryService;

import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.ArgumentMatchers.isNull;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

class ApprovalControllerTest {

    private final UUID id = UUID.randomUUID();
    private ApprovalService approvals;
    private SessionQueryService queries;
    private WebTestClient client;

    @BeforeEach
    void setUp() {
        approvals = mock(ApprovalService.class);
        queries = mock(SessionQueryService.class);
        client = WebTestClient.bindToController(new ApprovalController(approvals, queries))
            .controllerAdvice(new ApiExceptionHandler())
            .build();
    }

    @Test
    void listsPending() {
        when(approvals.listPending()).thenReturn(Flux.just(
            ToolExecution.pending("cw_42", 1, "cancel_subscription", "{\"reason\":\"price\"}")));

        client.get().uri("/api/approvals")
            .exchange()
            .expectStatus().isOk()
            .expectBody()
            .jsonPath("$[0].toolName").isEqualTo("cancel_subscription")
            .jsonPath("$[0].status").isEqualTo("PENDING");
    }

    @Test
    void resolvesWithParsedOutcome() {
        var execution = ToolExecution.pending("cw_42", 1, "cancel_subscription", "{}").rejected("alice", "no");
        when(approvals.resolve(eq(id), eq(ApprovalOutcome.REJECTED), eq("alice"), isNull()))
            .thenReturn(Mono.just(new ApprovalService.ApprovalResult(execution, true, null)));

        client.post().uri("/api/approvals/{id}", id)
            .contentType(MediaType.APPLICATION_JSON)
            .bodyValue(Map.of("outcome", "reject", "reviewer", "alice"))
            .exchange()
            .expectStatus().isOk()
            .expectBody()
            .jsonPath("$.superseded").isEqualTo(true)
            .jsonPath("$.execution.status").isEqualTo("REJECTED");
    }

    @Test
    void approvingAnUnregisteredToolIsBadRequest() {
        when(approvals.resolve(eq(id), eq(ApprovalOutcome.APPROVED), eq("alice"), isNull()))
            .thenReturn(Mono.error(new UnknownToolException("refund_order")));

        client.post().uri("/api/approvals/{id}", id)
            .contentType(MediaType.APPLICATION_JSON)
            .bodyValue(Map.of("outcome", "approve", "reviewer", "alice"))
            .exchange()
            .expectStatus().isBadRequest()
            .expectBody()
            .jsonPath("$.error").isEqualTo("unknown_tool")
            .jsonPath("$.message").isEqualTo("Unknown tool: refund_order");
    }

    @Test
    void reviewerIsRequired() {
        client.post().uri("/api/approvals/{id}", id)
            .contentType(MediaType.APPLICATION_JSON)
            .bodyValue(Map.of("outcome", "approved"))
            .exchange()
            .expectStatus().isBadRequest();

        verify(approvals, never()).resolve(any(), any(), anyString(), any());
    }

    @Test
    void unknownOutcomeIsBadRequest() {
        client.post().uri("/api/approvals/{id}", id)
            .contentType(MediaType.APPLICATION_JSON)
            .bodyValue(Map.of("outcome", "maybe", "reviewer", "alice"))
            .exchange()
            .expectStatus().isBadRequest()
            .expectBody().jsonPath("$.error").isEqualTo("bad_request");
    }

    @Test
    void alreadyResolvedIsConflict() {
        when(approvals.resolve(eq(id), any(), anyString(), any()))
            .thenReturn(Mono.error(new ApprovalNotPendingException(id, ToolStatus.APPROVED)));

        client.post().uri("/api/approvals/{id}", id)
            .contentType(MediaType.APPLICATION_JSON)
            .bodyValue(Map.of("outcome", "approved", "reviewer", "bob"))
            .exchange()
            .expectStatus().isEqualTo(409)
            .expectBody().jsonPath("$.error").isEqualTo("conflict");
    }

    @Test
    void historyOfUnknownExecutionIsNotFound() {
        when(queries.executionHistory(id)).thenReturn(Flux.error(new ExecutionNotFoundException(id)));

        client.get().uri("/api/approvals/{id}/history", id)
            .exchange()
            .expectStatus().isNotFound();
    }
}
