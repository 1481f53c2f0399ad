package com.example.triage.controller;

import java.util.Map;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RestController;
import org.springframework.web.server.ResponseStatusException;

import com.example.triage.model.InboundEvent;
import com.example.triage.model.TriageOutcome;
import com.example.triage.pipeline.DecisionEngine;

import reactor.core.publisher.Mono;

@RestController
public class InboundController {

    private static final Logger log = LoggerFactory.getLogger(InboundController.class);

    static final String CHATWOOT_CHANNEL = "chatwoot";

    private final DecisionEngine engine;

    public InboundController(DecisionEngine engine) {
        this.engine = engine;
    }

    public record InboundRequest(
        String eventId,
        String sessionId,
        String channel,
        String text,
        String customerId,
        String conversationRef
    ) {}

    @PostMapping("/api/events")
    public Mono<TriageOutcome> receive(@RequestBody InboundRequest request) {
        if (isBlank(request.eventId()) || isBlank(request.sessionId())) {
            return Mono.error(new ResponseStatusException(HttpStatus.BAD_REQUEST, "eventId and sessionId are required"));
        }
        if (isBlank(request.text())) {
            return Mono.error(new ResponseStatusException(HttpStatus.BAD_REQUEST, "Message cannot be empty"));
        }
        return engine.process(new InboundEvent(request.eventId(), request.sessionId(),
            isBlank(request.channel()) ? "api" : request.channel(),
            request.text(), request.customerId(), request.conversationRef()));
    }

    /**
     * Chatwoot webhook. Only public incoming {@code message_created} events with text start a
     * cycle; everything else, including our own outgoing messages, is acknowledged and ignored.
     */
    @PostMapping("/api/webhooks/chatwoot")
    public Mono<Map<String, Object>> chatwoot(@RequestBody Map<String, Object> payload) {
        InboundEvent event = fromChatwoot(payload);
        if (event == null) {
            return Mono.just(Map.of("status", "ignored"));
        }
        return engine.process(event)
            .map(outcome -> Map.<String, Object>of(
                "status", outcome.status().name().toLowerCase(),
                "session_id", outcome.sessionId(),
                "cycle", outcome.cycle()));
    }

    static InboundEvent fromChatwoot(Map<String, Object> payload) {
        if (!"message_created".equals(payload.get("event"))
            || !"incoming".equals(String.valueOf(payload.get("message_type")))
            || Boolean.TRUE.equals(payload.get("private"))) {
            return null;
        }
        Object content = payload.get("content");
        Object messageId = payload.get("id");
        if (!(payload.get("conversation") instanceof Map<?, ?> conversation)
            || content == null || String.valueOf(content).isBlank() || messageId == null) {
            return null;
        }
        Object conversationId = conversation.get("id");
        if (conversationId == null) {
            return null;
        }
        String customerId = null;
        if (payload.get("sender") instanceof Map<?, ?> sender) {
            Object email = sender.get("email");
            customerId = email != null ? String.valueOf(email) : null;
        }
        log.debug("Chatwoot message: conversation={} message={}", conversationId, messageId);
        return new InboundEvent(String.valueOf(messageId), "cw_" + conversationId, CHATWOOT_CHANNEL,
            String.valueOf(content), customerId, String.valueOf(conversationId));
    }

    private static boolean isBlank(String value) {
        return value == null || value.isBlank();
    }
}
