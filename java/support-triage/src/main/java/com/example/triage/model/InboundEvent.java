package com.example.triage.model;

public record InboundEvent(
    String eventId,
    String sessionId,
    String channel,
    String text,
    String customerId,
    String conversationRef
) {}
